package gr.imsi.athenarc.uroflow.datasource;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.MoreExecutors;

import gr.imsi.athenarc.uroflow.domain.PartitionKey;
import gr.imsi.athenarc.uroflow.domain.Sample;

/**
 * A {@link PartitionDataSource} holding its day nodes in memory. Writers replace or clear
 * whole nodes; every write is pushed to the node's subscribers through the configured
 * {@link Executor}. Use a sequential executor to keep per-key delivery order.
 */
public class InMemoryPartitionDataSource implements PartitionDataSource {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryPartitionDataSource.class);

    private final Map<PartitionKey, ImmutableList<Sample>> nodes = new ConcurrentHashMap<>();
    private final Map<PartitionKey, Set<InMemorySubscription>> subscribers = new ConcurrentHashMap<>();
    private final Executor executor;
    private final String name;

    public InMemoryPartitionDataSource(String name) {
        this(name, MoreExecutors.directExecutor());
    }

    public InMemoryPartitionDataSource(String name, Executor executor) {
        this.name = name;
        this.executor = executor;
    }

    @Override
    public Subscription subscribe(PartitionKey key, PartitionListener listener) {
        Preconditions.checkNotNull(key, "key");
        Preconditions.checkNotNull(listener, "listener");
        InMemorySubscription subscription = new InMemorySubscription(key, listener);
        subscribers.computeIfAbsent(key, k -> new CopyOnWriteArraySet<>()).add(subscription);
        LOG.debug("Subscribed to partition {} of {}", key, name);
        deliver(subscription, snapshotOf(key));
        return subscription;
    }

    /**
     * Replaces the content of a day node and notifies its subscribers.
     */
    public void replace(PartitionKey key, List<? extends Sample> samples) {
        Preconditions.checkNotNull(key, "key");
        if (samples.isEmpty()) {
            nodes.remove(key);
        } else {
            nodes.put(key, ImmutableList.copyOf(samples));
        }
        notifySubscribers(key);
    }

    /**
     * Removes a day node; subscribers receive an empty replacement.
     */
    public void clear(PartitionKey key) {
        replace(key, ImmutableList.of());
    }

    /**
     * Reports a failure to every subscriber of {@code key}. The node content is kept.
     */
    public void fail(PartitionKey key, Throwable error) {
        for (InMemorySubscription subscription : subscribersOf(key)) {
            executor.execute(() -> {
                if (!subscription.isCancelled()) {
                    subscription.listener.onError(error);
                }
            });
        }
    }

    public ImmutableList<Sample> getSamples(PartitionKey key) {
        return nodes.getOrDefault(key, ImmutableList.of());
    }

    public ImmutableSet<PartitionKey> getPartitions() {
        return ImmutableSet.copyOf(nodes.keySet());
    }

    public int getSubscriberCount(PartitionKey key) {
        return subscribersOf(key).size();
    }

    @Override
    public String getDescription() {
        return "in-memory:" + name;
    }

    private SamplesReplacement snapshotOf(PartitionKey key) {
        return SamplesReplacement.of(getSamples(key));
    }

    private void notifySubscribers(PartitionKey key) {
        SamplesReplacement replacement = snapshotOf(key);
        for (InMemorySubscription subscription : subscribersOf(key)) {
            deliver(subscription, replacement);
        }
    }

    private void deliver(InMemorySubscription subscription, SamplesReplacement replacement) {
        executor.execute(() -> {
            if (!subscription.isCancelled()) {
                subscription.listener.onReplacement(replacement);
            }
        });
    }

    private Set<InMemorySubscription> subscribersOf(PartitionKey key) {
        return subscribers.getOrDefault(key, ImmutableSet.of());
    }

    private class InMemorySubscription implements Subscription {
        private final PartitionKey key;
        private final PartitionListener listener;
        private final AtomicBoolean cancelled = new AtomicBoolean();

        private InMemorySubscription(PartitionKey key, PartitionListener listener) {
            this.key = key;
            this.listener = listener;
        }

        @Override
        public PartitionKey getKey() {
            return key;
        }

        @Override
        public void cancel() {
            if (cancelled.compareAndSet(false, true)) {
                Set<InMemorySubscription> current = subscribers.get(key);
                if (current != null) {
                    current.remove(this);
                }
                LOG.debug("Cancelled subscription to partition {} of {}", key, name);
            }
        }

        @Override
        public boolean isCancelled() {
            return cancelled.get();
        }
    }
}
