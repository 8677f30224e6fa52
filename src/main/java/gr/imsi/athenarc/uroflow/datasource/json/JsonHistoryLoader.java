package gr.imsi.athenarc.uroflow.datasource.json;

import java.io.IOException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import gr.imsi.athenarc.uroflow.datasource.InMemoryPartitionDataSource;
import gr.imsi.athenarc.uroflow.domain.PartitionKey;
import gr.imsi.athenarc.uroflow.domain.Sample;

/**
 * Reads a JSON export of the sample store, laid out as
 * {@code history/{patientId}/{yyyy}/{MM}/{dd}}, into day partitions.
 */
public class JsonHistoryLoader {

    private static final Logger LOG = LoggerFactory.getLogger(JsonHistoryLoader.class);
    private static final String HISTORY_NODE = "history";

    private final ObjectMapper mapper;
    private final SampleNodeParser parser;

    public JsonHistoryLoader(ZoneId zoneId) {
        this(new ObjectMapper(), new SampleNodeParser(zoneId));
    }

    public JsonHistoryLoader(ObjectMapper mapper, SampleNodeParser parser) {
        this.mapper = mapper;
        this.parser = parser;
    }

    /**
     * Loads one patient's history into the given data source.
     *
     * @param file the export file
     * @param patientId the patient whose history is loaded
     * @param target the data source receiving one node per day
     * @return the number of day partitions loaded
     * @throws IOException if the file cannot be read or is not JSON
     */
    public int load(Path file, String patientId, InMemoryPartitionDataSource target) throws IOException {
        JsonNode root = mapper.readTree(file.toFile());
        Map<PartitionKey, List<Sample>> partitions = readPartitions(root, patientId);
        partitions.forEach(target::replace);
        LOG.info("Loaded {} day partitions for patient {} from {}", partitions.size(), patientId, file);
        return partitions.size();
    }

    /**
     * Resolves the patient's subtree and reads every day node below it. The root may be the
     * whole export, its {@code history} node, or the patient's own subtree.
     */
    public Map<PartitionKey, List<Sample>> readPartitions(JsonNode root, String patientId) {
        JsonNode patientNode = root;
        if (patientNode.has(HISTORY_NODE)) {
            patientNode = patientNode.get(HISTORY_NODE);
        }
        if (patientNode.has(patientId)) {
            patientNode = patientNode.get(patientId);
        }
        Map<PartitionKey, List<Sample>> partitions = new TreeMap<>();
        forEachNumericChild(patientNode, (year, yearNode) ->
            forEachNumericChild(yearNode, (month, monthNode) ->
                forEachNumericChild(monthNode, (day, dayNode) -> {
                    PartitionKey key;
                    try {
                        key = PartitionKey.of(LocalDate.of(year, month, day));
                    } catch (DateTimeException e) {
                        LOG.warn("Ignoring invalid day node {}/{}/{}", year, month, day);
                        return;
                    }
                    List<Sample> samples = parser.parse(dayNode);
                    if (!samples.isEmpty()) {
                        partitions.put(key, samples);
                    }
                })));
        return partitions;
    }

    private interface NumericChildConsumer {
        void accept(int number, JsonNode child);
    }

    private void forEachNumericChild(JsonNode node, NumericChildConsumer consumer) {
        if (node == null || !node.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            int number;
            try {
                number = Integer.parseInt(field.getKey());
            } catch (NumberFormatException e) {
                LOG.debug("Skipping non-date node {}", field.getKey());
                continue;
            }
            consumer.accept(number, field.getValue());
        }
    }
}
