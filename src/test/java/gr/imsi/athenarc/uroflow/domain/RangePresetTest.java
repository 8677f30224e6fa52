package gr.imsi.athenarc.uroflow.domain;

import static org.junit.Assert.*;

import java.time.LocalDate;

import org.junit.Test;

public class RangePresetTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 7);
    private static final DateRange CURRENT = DateRange.of(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 3));

    @Test
    public void testPresetsResolveRelativeToToday() {
        assertEquals(DateRange.ofDay(TODAY), RangePreset.TODAY.resolve(TODAY, CURRENT));
        assertEquals(DateRange.ofDay(LocalDate.of(2024, 3, 6)), RangePreset.YESTERDAY.resolve(TODAY, CURRENT));
        assertEquals(DateRange.of(LocalDate.of(2024, 3, 1), TODAY), RangePreset.LAST7.resolve(TODAY, CURRENT));
    }

    @Test
    public void testCustomKeepsCurrentRange() {
        assertSame(CURRENT, RangePreset.CUSTOM.resolve(TODAY, CURRENT));
    }

    @Test
    public void testFromName() {
        assertEquals(RangePreset.LAST7, RangePreset.fromName("last7"));
        assertEquals(RangePreset.TODAY, RangePreset.fromName(" Today "));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFromNameRejectsUnknown() {
        RangePreset.fromName("lastMonth");
    }

    @Test
    public void testInvertedRangeIsEmpty() {
        assertTrue(DateRange.of(TODAY, TODAY.minusDays(1)).isEmpty());
        assertFalse(DateRange.ofDay(TODAY).isEmpty());
    }
}
