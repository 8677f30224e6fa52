package gr.imsi.athenarc.uroflow.projection;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Chart-ready series: parallel lists of display labels and values.
 */
public class ChartData {

    public static final ChartData EMPTY = new ChartData(ImmutableList.of(), ImmutableList.of());

    private final ImmutableList<String> labels;
    private final ImmutableList<Double> values;

    public ChartData(List<String> labels, List<Double> values) {
        Preconditions.checkArgument(labels.size() == values.size(),
                "labels (%s) and values (%s) differ in length", labels.size(), values.size());
        this.labels = ImmutableList.copyOf(labels);
        this.values = ImmutableList.copyOf(values);
    }

    public ImmutableList<String> getLabels() {
        return labels;
    }

    public ImmutableList<Double> getValues() {
        return values;
    }

    public int size() {
        return labels.size();
    }

    public boolean isEmpty() {
        return labels.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChartData)) return false;
        ChartData that = (ChartData) o;
        return labels.equals(that.labels) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return 31 * labels.hashCode() + values.hashCode();
    }

    @Override
    public String toString() {
        return "ChartData{" + size() + " points}";
    }
}
