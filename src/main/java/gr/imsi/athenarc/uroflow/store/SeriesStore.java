package gr.imsi.athenarc.uroflow.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import gr.imsi.athenarc.uroflow.domain.PartitionKey;
import gr.imsi.athenarc.uroflow.domain.Sample;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Holds the latest snapshot of every active day partition together with the flattened,
 * time-ordered union of all of them.
 *
 * <p>Every mutation replaces the whole content of one partition. The flattened series is
 * rebuilt after each mutation: partitions are concatenated in the order their current
 * snapshots arrived and then stably sorted by timestamp, so equal timestamps keep arrival
 * order. Readers get an immutable copy and never see the live map.
 */
public class SeriesStore {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesStore.class);

    private static final Comparator<Sample> BY_TIMESTAMP = Comparator.comparingLong(Sample::getTimestamp);

    private final Map<PartitionKey, PartitionSnapshot> snapshots;
    private final ReadWriteLock storeLock;
    private ImmutableList<Sample> flattened;
    private long version;
    private long arrivals;

    public SeriesStore() {
        this.snapshots = new HashMap<>();
        this.storeLock = new ReentrantReadWriteLock();
        this.flattened = ImmutableList.of();
    }

    /**
     * Replaces the snapshot of a partition. An empty list removes the partition's
     * contribution. Replacing a snapshot with identical content changes nothing.
     *
     * @param key the partition being replaced
     * @param samples the complete new content of the partition
     * @return true if the flattened series changed
     */
    public boolean applyPartition(PartitionKey key, List<? extends Sample> samples) {
        Preconditions.checkNotNull(key, "key");
        Preconditions.checkNotNull(samples, "samples");
        ImmutableList<Sample> content = ImmutableList.copyOf(samples);
        try {
            storeLock.writeLock().lock();
            PartitionSnapshot current = snapshots.get(key);
            if (current == null ? content.isEmpty() : current.samples.equals(content)) {
                LOG.debug("Partition {} unchanged ({} samples)", key, content.size());
                return false;
            }
            if (content.isEmpty()) {
                snapshots.remove(key);
            } else {
                snapshots.put(key, new PartitionSnapshot(content, arrivals++));
            }
            rebuild();
            LOG.debug("Applied {} samples to partition {}, series now holds {} samples",
                    content.size(), key, flattened.size());
            return true;
        } finally {
            storeLock.writeLock().unlock();
        }
    }

    /**
     * Removes the contribution of a partition.
     *
     * @return true if the flattened series changed
     */
    public boolean clearPartition(PartitionKey key) {
        return applyPartition(key, ImmutableList.of());
    }

    /**
     * Drops every partition.
     */
    public void clear() {
        try {
            storeLock.writeLock().lock();
            if (!snapshots.isEmpty()) {
                snapshots.clear();
                rebuild();
            }
        } finally {
            storeLock.writeLock().unlock();
        }
    }

    /**
     * @return the flattened series, sorted ascending by timestamp
     */
    public ImmutableList<Sample> snapshotSeries() {
        try {
            storeLock.readLock().lock();
            return flattened;
        } finally {
            storeLock.readLock().unlock();
        }
    }

    /**
     * Returns a counter incremented on every change of the flattened series.
     */
    public long getVersion() {
        try {
            storeLock.readLock().lock();
            return version;
        } finally {
            storeLock.readLock().unlock();
        }
    }

    public ImmutableList<Sample> getPartition(PartitionKey key) {
        try {
            storeLock.readLock().lock();
            PartitionSnapshot snapshot = snapshots.get(key);
            return snapshot == null ? ImmutableList.of() : snapshot.samples;
        } finally {
            storeLock.readLock().unlock();
        }
    }

    /**
     * @return the partitions currently contributing samples
     */
    public ImmutableSet<PartitionKey> getPartitions() {
        try {
            storeLock.readLock().lock();
            return ImmutableSet.copyOf(snapshots.keySet());
        } finally {
            storeLock.readLock().unlock();
        }
    }

    public int size() {
        return snapshotSeries().size();
    }

    private void rebuild() {
        List<PartitionSnapshot> ordered = new ArrayList<>(snapshots.values());
        ordered.sort(Comparator.comparingLong(snapshot -> snapshot.arrival));
        List<Sample> merged = new ArrayList<>();
        for (PartitionSnapshot snapshot : ordered) {
            merged.addAll(snapshot.samples);
        }
        merged.sort(BY_TIMESTAMP);
        flattened = ImmutableList.copyOf(merged);
        version++;
    }

    private static class PartitionSnapshot {
        private final ImmutableList<Sample> samples;
        private final long arrival;

        private PartitionSnapshot(ImmutableList<Sample> samples, long arrival) {
            this.samples = samples;
            this.arrival = arrival;
        }
    }
}
