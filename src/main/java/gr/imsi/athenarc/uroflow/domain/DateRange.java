package gr.imsi.athenarc.uroflow.domain;

import java.time.LocalDate;
import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * An inclusive range of calendar dates. A range whose start is after its end is
 * accepted and considered empty.
 */
public class DateRange {

    private final LocalDate start;
    private final LocalDate end;

    private DateRange(LocalDate start, LocalDate end) {
        this.start = Preconditions.checkNotNull(start, "start");
        this.end = Preconditions.checkNotNull(end, "end");
    }

    public static DateRange of(LocalDate start, LocalDate end) {
        return new DateRange(start, end);
    }

    public static DateRange ofDay(LocalDate day) {
        return new DateRange(day, day);
    }

    public LocalDate getStart() {
        return start;
    }

    public LocalDate getEnd() {
        return end;
    }

    public boolean isEmpty() {
        return start.isAfter(end);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DateRange)) return false;
        DateRange that = (DateRange) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "DateRange{" + start + " - " + end + '}';
    }
}
