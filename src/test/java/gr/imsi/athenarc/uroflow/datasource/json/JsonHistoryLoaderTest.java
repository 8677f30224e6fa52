package gr.imsi.athenarc.uroflow.datasource.json;

import static org.junit.Assert.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.fasterxml.jackson.databind.ObjectMapper;

import gr.imsi.athenarc.uroflow.datasource.InMemoryPartitionDataSource;
import gr.imsi.athenarc.uroflow.domain.PartitionKey;
import gr.imsi.athenarc.uroflow.domain.Sample;

public class JsonHistoryLoaderTest {

    private static final String EXPORT = ("{'patients': {'p1': {'name': 'A'}},"
            + " 'history': {"
            + "  'p1': {'2024': {'03': {"
            + "     '06': {'-a': {'ts': '2024-03-06T10:00:00Z', 'flowRate': 5}},"
            + "     '07': {'-b': {'ts': '2024-03-07T09:00:00Z', 'volume_ml': 10}, '-c': {'ts': '2024-03-07T09:30:00Z', 'volume_ml': 30}},"
            + "     '08': {'note': 'nothing here'},"
            + "     '31x': {}}}},"
            + "  'p2': {'2024': {'03': {'07': {'-d': {'ts': '2024-03-07T11:00:00Z', 'flowRate': 99}}}}}}}").replace('\'', '"');

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final JsonHistoryLoader loader = new JsonHistoryLoader(ZoneId.of("UTC"));

    @Test
    public void testReadsOnePartitionPerNonEmptyDay() throws Exception {
        Map<PartitionKey, List<Sample>> partitions = loader.readPartitions(new ObjectMapper().readTree(EXPORT), "p1");

        assertEquals(2, partitions.size());
        assertEquals(1, partitions.get(new PartitionKey(2024, 3, 6)).size());
        assertEquals(2, partitions.get(new PartitionKey(2024, 3, 7)).size());
        assertFalse(partitions.containsKey(new PartitionKey(2024, 3, 8)));
    }

    @Test
    public void testAcceptsPatientSubtreeAsRoot() throws Exception {
        String subtree = "{\"2024\": {\"02\": {\"29\": {\"x\": {\"ts\": \"2024-02-29T10:00:00Z\", \"flowRate\": 1}}}}}";

        Map<PartitionKey, List<Sample>> partitions = loader.readPartitions(new ObjectMapper().readTree(subtree), "p1");

        assertEquals(1, partitions.size());
        assertTrue(partitions.containsKey(new PartitionKey(2024, 2, 29)));
    }

    @Test
    public void testIgnoresImpossibleDates() throws Exception {
        String subtree = "{\"2023\": {\"02\": {\"30\": {\"x\": {\"ts\": \"2023-03-02T10:00:00Z\", \"flowRate\": 1}}}}}";

        assertTrue(loader.readPartitions(new ObjectMapper().readTree(subtree), "p1").isEmpty());
    }

    @Test
    public void testLoadFillsDataSource() throws Exception {
        Path file = folder.newFile("export.json").toPath();
        Files.write(file, EXPORT.getBytes(StandardCharsets.UTF_8));
        InMemoryPartitionDataSource dataSource = new InMemoryPartitionDataSource("test");

        int loaded = loader.load(file, "p2", dataSource);

        assertEquals(1, loaded);
        assertEquals(99, dataSource.getSamples(new PartitionKey(2024, 3, 7)).get(0).getValue(), 0);
    }
}
