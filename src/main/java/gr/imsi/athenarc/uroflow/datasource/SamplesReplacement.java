package gr.imsi.athenarc.uroflow.datasource;

import java.util.List;

import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.uroflow.domain.Sample;

/**
 * The full content of one partition as reported by a {@link PartitionDataSource}.
 * A replacement is never a delta: it supersedes everything previously reported for the
 * partition. An empty replacement means the partition was cleared or never had data.
 */
public class SamplesReplacement {

    private static final SamplesReplacement EMPTY = new SamplesReplacement(ImmutableList.of());

    private final ImmutableList<Sample> samples;

    private SamplesReplacement(ImmutableList<Sample> samples) {
        this.samples = samples;
    }

    public static SamplesReplacement of(List<? extends Sample> samples) {
        return samples.isEmpty() ? EMPTY : new SamplesReplacement(ImmutableList.copyOf(samples));
    }

    public static SamplesReplacement empty() {
        return EMPTY;
    }

    public ImmutableList<Sample> getSamples() {
        return samples;
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    @Override
    public String toString() {
        return "SamplesReplacement{" + samples.size() + " samples}";
    }
}
