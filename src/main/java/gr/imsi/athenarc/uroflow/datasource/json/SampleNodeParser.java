package gr.imsi.athenarc.uroflow.datasource.json;

import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import gr.imsi.athenarc.uroflow.domain.DateTimeUtil;
import gr.imsi.athenarc.uroflow.domain.ImmutableSample;
import gr.imsi.athenarc.uroflow.domain.Sample;

/**
 * Extracts the samples stored below a day node. Devices write samples at arbitrary depth,
 * so the node is walked depth-first in document order and every object carrying a
 * {@code ts} field together with {@code volume_ml} or {@code flowRate} is taken as one
 * sample.
 */
public class SampleNodeParser {

    private static final Logger LOG = LoggerFactory.getLogger(SampleNodeParser.class);

    public static final String TIMESTAMP_FIELD = "ts";
    public static final String VOLUME_FIELD = "volume_ml";
    public static final String FLOW_RATE_FIELD = "flowRate";

    private final ZoneId zoneId;

    /**
     * @param zoneId zone used for timestamps written without an offset
     */
    public SampleNodeParser(ZoneId zoneId) {
        this.zoneId = zoneId;
    }

    public List<Sample> parse(JsonNode node) {
        List<Sample> collected = new ArrayList<>();
        if (node != null) {
            gather(node, collected);
        }
        return collected;
    }

    private void gather(JsonNode node, List<Sample> collected) {
        if (!node.isContainerNode()) {
            return;
        }
        if (isSample(node)) {
            JsonNode valueNode = node.has(VOLUME_FIELD) ? node.get(VOLUME_FIELD) : node.get(FLOW_RATE_FIELD);
            JsonNode tsNode = node.get(TIMESTAMP_FIELD);
            try {
                collected.add(new ImmutableSample(parseTimestamp(tsNode), parseValue(valueNode)));
            } catch (DateTimeParseException | IllegalArgumentException e) {
                LOG.debug("Skipping sample with unreadable timestamp {}", tsNode);
            }
            return;
        }
        for (JsonNode child : node) {
            gather(child, collected);
        }
    }

    private boolean isSample(JsonNode node) {
        if (!node.isObject()) {
            return false;
        }
        return hasTimestamp(node.get(TIMESTAMP_FIELD)) && (node.has(VOLUME_FIELD) || node.has(FLOW_RATE_FIELD));
    }

    // 0, false and the empty string do not count as a timestamp
    private static boolean hasTimestamp(JsonNode ts) {
        if (ts == null || ts.isNull()) {
            return false;
        }
        if (ts.isNumber()) {
            return ts.asDouble() != 0;
        }
        if (ts.isTextual()) {
            return !ts.asText().isEmpty();
        }
        if (ts.isBoolean()) {
            return ts.booleanValue();
        }
        return true;
    }

    private long parseTimestamp(JsonNode tsNode) {
        if (tsNode.isNumber()) {
            return tsNode.asLong();
        }
        if (tsNode.isTextual()) {
            return DateTimeUtil.parseTimestamp(tsNode.asText(), zoneId);
        }
        throw new IllegalArgumentException("Unsupported timestamp node: " + tsNode);
    }

    private double parseValue(JsonNode valueNode) {
        if (valueNode == null || valueNode.isNull()) {
            return 0;
        }
        if (valueNode.isNumber()) {
            return valueNode.asDouble();
        }
        if (valueNode.isTextual()) {
            try {
                double parsed = Double.parseDouble(valueNode.asText().trim());
                return Double.isNaN(parsed) ? 0 : parsed;
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }
}
