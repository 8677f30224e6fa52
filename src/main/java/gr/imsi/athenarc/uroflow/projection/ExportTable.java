package gr.imsi.athenarc.uroflow.projection;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Tabular form of the chart series, ready to be written as delimited text. The first
 * record is the header; values keep full floating-point precision.
 */
public class ExportTable {

    public static final ImmutableList<String> HEADER = ImmutableList.of("timestamp", "value");

    private final ImmutableList<Row> rows;

    public ExportTable(List<Row> rows) {
        this.rows = ImmutableList.copyOf(rows);
    }

    public ImmutableList<Row> getRows() {
        return rows;
    }

    /**
     * @return the header followed by one record per row
     */
    public ImmutableList<ImmutableList<String>> toRecords() {
        ImmutableList.Builder<ImmutableList<String>> records = ImmutableList.builderWithExpectedSize(rows.size() + 1);
        records.add(HEADER);
        for (Row row : rows) {
            records.add(ImmutableList.of(row.getTimestamp(), Double.toString(row.getValue())));
        }
        return records.build();
    }

    public static class Row {
        private final String timestamp;
        private final double value;

        public Row(String timestamp, double value) {
            this.timestamp = timestamp;
            this.value = value;
        }

        public String getTimestamp() {
            return timestamp;
        }

        public double getValue() {
            return value;
        }

        @Override
        public String toString() {
            return timestamp + "," + value;
        }
    }
}
