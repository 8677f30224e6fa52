package gr.imsi.athenarc.uroflow.datasource.json;

import static org.junit.Assert.*;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import gr.imsi.athenarc.uroflow.domain.ImmutableSample;
import gr.imsi.athenarc.uroflow.domain.Sample;

public class SampleNodeParserTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final SampleNodeParser parser = new SampleNodeParser(ZoneId.of("UTC"));

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text.replace('\'', '"'));
    }

    private static long t(String iso) {
        return Instant.parse(iso).toEpochMilli();
    }

    @Test
    public void testFindsSamplesAtAnyDepthInDocumentOrder() throws Exception {
        JsonNode day = json("{'-Nabc': {'ts': '2024-03-07T09:00:00Z', 'flowRate': 12.5},"
                + " '09': {'-Nxyz': {'ts': '2024-03-07T09:30:00Z', 'volume_ml': 20}},"
                + " 'list': [{'ts': 1709805600000, 'flowRate': '7.5'}]}");

        List<Sample> samples = parser.parse(day);

        assertEquals(3, samples.size());
        assertEquals(new ImmutableSample(t("2024-03-07T09:00:00Z"), 12.5), samples.get(0));
        assertEquals(new ImmutableSample(t("2024-03-07T09:30:00Z"), 20), samples.get(1));
        assertEquals(new ImmutableSample(1709805600000L, 7.5), samples.get(2));
    }

    @Test
    public void testVolumeWinsOverFlowRate() throws Exception {
        List<Sample> samples = parser.parse(json("{'a': {'ts': '2024-03-07T09:00:00Z', 'flowRate': 1, 'volume_ml': 2}}"));

        assertEquals(1, samples.size());
        assertEquals(2, samples.get(0).getValue(), 0);
    }

    @Test
    public void testUnreadableValuesBecomeZero() throws Exception {
        List<Sample> samples = parser.parse(json("{'a': {'ts': '2024-03-07T09:00:00Z', 'flowRate': 'n/a'},"
                + " 'b': {'ts': '2024-03-07T09:01:00Z', 'flowRate': null}}"));

        assertEquals(2, samples.size());
        assertEquals(0, samples.get(0).getValue(), 0);
        assertEquals(0, samples.get(1).getValue(), 0);
    }

    @Test
    public void testSkipsEntriesWithoutUsableTimestamp() throws Exception {
        List<Sample> samples = parser.parse(json("{'a': {'ts': 'soon', 'flowRate': 3},"
                + " 'b': {'flowRate': 4}, 'c': {'ts': '2024-03-07T09:00:00Z', 'other': 1}}"));

        assertTrue(samples.isEmpty());
    }

    @Test
    public void testZeroOrEmptyTimestampDoesNotMarkASample() throws Exception {
        List<Sample> samples = parser.parse(json("{'a': {'ts': 0, 'flowRate': 3,"
                + " 'inner': {'ts': '2024-03-07T09:00:00Z', 'flowRate': 4}},"
                + " 'b': {'ts': '', 'volume_ml': 5}}"));

        assertEquals(1, samples.size());
        assertEquals(new ImmutableSample(t("2024-03-07T09:00:00Z"), 4), samples.get(0));
    }

    @Test
    public void testMissingNodeIsEmpty() {
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parse(mapper.nullNode()).isEmpty());
    }
}
