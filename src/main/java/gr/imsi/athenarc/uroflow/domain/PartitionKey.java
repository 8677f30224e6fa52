package gr.imsi.athenarc.uroflow.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * Identifies the day partition of a patient's sample history.
 */
public class PartitionKey implements Comparable<PartitionKey> {

    private static final Comparator<PartitionKey> ORDER = Comparator
            .comparingInt(PartitionKey::getYear)
            .thenComparingInt(PartitionKey::getMonth)
            .thenComparingInt(PartitionKey::getDay);

    private final int year;
    private final int month;
    private final int day;

    public PartitionKey(int year, int month, int day) {
        Preconditions.checkArgument(month >= 1 && month <= 12, "month out of range: %s", month);
        Preconditions.checkArgument(day >= 1 && day <= 31, "day out of range: %s", day);
        this.year = year;
        this.month = month;
        this.day = day;
    }

    public static PartitionKey of(LocalDate date) {
        return new PartitionKey(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    /**
     * Maps an epoch-millisecond timestamp to the partition of its local calendar date.
     */
    public static PartitionKey fromTimestamp(long timestamp, ZoneId zoneId) {
        return of(Instant.ofEpochMilli(timestamp).atZone(zoneId).toLocalDate());
    }

    public int getYear() {
        return year;
    }

    public int getMonth() {
        return month;
    }

    public int getDay() {
        return day;
    }

    public LocalDate toLocalDate() {
        return LocalDate.of(year, month, day);
    }

    /**
     * Path of the partition's node below a patient's history node, e.g. {@code 2024/03/07}.
     */
    public String toPath() {
        return String.format("%04d/%02d/%02d", year, month, day);
    }

    @Override
    public int compareTo(PartitionKey o) {
        return ORDER.compare(this, o);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PartitionKey)) return false;
        PartitionKey that = (PartitionKey) o;
        return year == that.year && month == that.month && day == that.day;
    }

    @Override
    public int hashCode() {
        return Objects.hash(year, month, day);
    }

    @Override
    public String toString() {
        return toPath();
    }
}
