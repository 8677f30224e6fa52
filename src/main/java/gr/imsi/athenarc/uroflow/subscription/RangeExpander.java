package gr.imsi.athenarc.uroflow.subscription;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.uroflow.domain.DateRange;
import gr.imsi.athenarc.uroflow.domain.PartitionKey;

import java.time.LocalDate;

/**
 * Turns a date range into the partitions that have to be watched for it.
 */
public class RangeExpander {

    private static final Logger LOG = LoggerFactory.getLogger(RangeExpander.class);

    private RangeExpander() {}

    /**
     * Lists the day partitions from the range start to its end, both inclusive, in
     * ascending order. A range whose start is after its end yields no partitions.
     *
     * @param range the date range
     * @return the ordered partition keys
     */
    public static ImmutableList<PartitionKey> expand(DateRange range) {
        if (range.isEmpty()) {
            LOG.warn("Range start {} is after its end {}, no partitions selected", range.getStart(), range.getEnd());
            return ImmutableList.of();
        }
        ImmutableList.Builder<PartitionKey> keys = ImmutableList.builder();
        for (LocalDate day = range.getStart(); !day.isAfter(range.getEnd()); day = day.plusDays(1)) {
            keys.add(PartitionKey.of(day));
        }
        return keys.build();
    }
}
