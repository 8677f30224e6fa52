package gr.imsi.athenarc.uroflow.domain;

import static org.junit.Assert.*;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

import org.junit.Test;

public class DateTimeUtilTest {

    private static final ZoneId ATHENS = ZoneId.of("Europe/Athens");

    @Test
    public void testFormatIsoKeepsMilliseconds() {
        assertEquals("2024-01-01T09:00:00.000Z", DateTimeUtil.formatIso(Instant.parse("2024-01-01T09:00:00Z").toEpochMilli()));
        assertEquals("2024-01-01T09:00:00.123Z", DateTimeUtil.formatIso(Instant.parse("2024-01-01T09:00:00.123Z").toEpochMilli()));
    }

    @Test
    public void testFloorToIntervalRoundsDown() {
        assertEquals(3_600_000L, DateTimeUtil.floorToInterval(3_600_000L + 59_999L, 60_000L * 60));
        assertEquals(-60_000L, DateTimeUtil.floorToInterval(-1L, 60_000L));
        assertEquals(0L, DateTimeUtil.floorToInterval(0L, 60_000L));
    }

    @Test
    public void testParseTimestampFormats() {
        long instant = Instant.parse("2024-01-01T09:00:00Z").toEpochMilli();
        assertEquals(instant, DateTimeUtil.parseTimestamp("2024-01-01T09:00:00Z", ATHENS));
        assertEquals(instant, DateTimeUtil.parseTimestamp("2024-01-01T09:00:00.000Z", ATHENS));
        assertEquals(instant, DateTimeUtil.parseTimestamp("2024-01-01T11:00:00+02:00", ATHENS));
        assertEquals(instant, DateTimeUtil.parseTimestamp("2024-01-01T11:00:00", ATHENS));
        assertEquals(Instant.parse("2023-12-31T22:00:00Z").toEpochMilli(), DateTimeUtil.parseTimestamp("2024-01-01", ATHENS));
    }

    @Test(expected = DateTimeParseException.class)
    public void testParseTimestampRejectsGarbage() {
        DateTimeUtil.parseTimestamp("yesterday-ish", ATHENS);
    }
}
