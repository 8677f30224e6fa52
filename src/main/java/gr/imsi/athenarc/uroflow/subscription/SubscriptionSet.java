package gr.imsi.athenarc.uroflow.subscription;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import gr.imsi.athenarc.uroflow.datasource.PartitionDataSource;
import gr.imsi.athenarc.uroflow.datasource.PartitionListener;
import gr.imsi.athenarc.uroflow.datasource.SamplesReplacement;
import gr.imsi.athenarc.uroflow.datasource.Subscription;
import gr.imsi.athenarc.uroflow.domain.DateRange;
import gr.imsi.athenarc.uroflow.domain.PartitionKey;
import gr.imsi.athenarc.uroflow.store.SeriesChangeListener;
import gr.imsi.athenarc.uroflow.store.SeriesStore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of live partition subscriptions, keyed by {@link PartitionKey}.
 *
 * <p>On every range change the registry is reconciled against the desired keys: keys
 * that dropped out are cancelled and their data is removed from the {@link SeriesStore},
 * new keys are subscribed, and keys present in both are left untouched.
 *
 * <p>Each subscription is tagged with a generation number. A batch is applied only if the
 * registry still holds the same generation for its key when the batch is accepted, so a
 * batch racing a cancellation is dropped. Acceptance and cancellation both happen under
 * one lock; once a key is removed no further mutation of the store comes from its channel.
 */
public class SubscriptionSet implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SubscriptionSet.class);

    private final PartitionDataSource dataSource;
    private final SeriesStore store;
    private final Object registryLock = new Object();
    private final Map<PartitionKey, Handle> handles = new LinkedHashMap<>();
    // removed from the registry, cancellation not finished yet
    private final Map<PartitionKey, Handle> closing = new HashMap<>();
    private final List<SeriesChangeListener> changeListeners = new CopyOnWriteArrayList<>();
    private final List<SubscriptionWarningListener> warningListeners = new CopyOnWriteArrayList<>();
    private long generations;
    private boolean closed;

    public SubscriptionSet(PartitionDataSource dataSource, SeriesStore store) {
        this.dataSource = Preconditions.checkNotNull(dataSource, "dataSource");
        this.store = Preconditions.checkNotNull(store, "store");
    }

    public void addChangeListener(SeriesChangeListener listener) {
        changeListeners.add(listener);
    }

    public void addWarningListener(SubscriptionWarningListener listener) {
        warningListeners.add(listener);
    }

    /**
     * Reconciles the subscriptions with the partitions of {@code range}.
     *
     * @param range the newly selected range
     */
    public void update(DateRange range) {
        reconcile(RangeExpander.expand(range));
    }

    /**
     * Makes the registry hold exactly one subscription per desired key. Subscriptions
     * whose last attempt to open failed are retried.
     *
     * @param desired the partitions that should be watched
     */
    public void reconcile(List<PartitionKey> desired) {
        List<Handle> toOpen = new ArrayList<>();
        List<Handle> toCancel = new ArrayList<>();
        boolean changed = false;
        synchronized (registryLock) {
            if (closed) {
                LOG.warn("Ignoring reconciliation of a closed subscription set");
                return;
            }
            Set<PartitionKey> desiredKeys = new LinkedHashSet<>(desired);
            Iterator<Map.Entry<PartitionKey, Handle>> entries = handles.entrySet().iterator();
            while (entries.hasNext()) {
                Handle handle = entries.next().getValue();
                if (!desiredKeys.contains(handle.key)) {
                    entries.remove();
                    handle.state = SubscriptionState.CLOSING;
                    closing.put(handle.key, handle);
                    toCancel.add(handle);
                    changed |= store.clearPartition(handle.key);
                }
            }
            for (PartitionKey key : desiredKeys) {
                Handle existing = handles.get(key);
                if (existing == null || existing.state == SubscriptionState.CLOSED) {
                    Handle handle = new Handle(key, ++generations);
                    handles.put(key, handle);
                    toOpen.add(handle);
                }
            }
        }
        LOG.info("Reconciled subscriptions: {} opening, {} closing, {} desired",
                toOpen.size(), toCancel.size(), desired.size());

        for (Handle handle : toCancel) {
            cancel(handle);
        }
        for (Handle handle : toOpen) {
            open(handle);
        }
        if (changed) {
            notifyChanged();
        }
    }

    /**
     * Cancels every subscription and drops all partition data. Further reconciliations
     * are ignored. Calling it more than once has no further effect.
     */
    @Override
    public void close() {
        List<Handle> toCancel;
        synchronized (registryLock) {
            if (closed) {
                return;
            }
            closed = true;
            toCancel = new ArrayList<>(handles.values());
            for (Handle handle : toCancel) {
                handle.state = SubscriptionState.CLOSING;
                closing.put(handle.key, handle);
            }
            handles.clear();
            store.clear();
        }
        for (Handle handle : toCancel) {
            cancel(handle);
        }
        LOG.info("Closed subscription set, {} subscriptions cancelled", toCancel.size());
    }

    public boolean isClosed() {
        synchronized (registryLock) {
            return closed;
        }
    }

    /**
     * @return the state of the subscription for {@code key}, {@link SubscriptionState#CLOSED} if there is none
     */
    public SubscriptionState getState(PartitionKey key) {
        synchronized (registryLock) {
            Handle handle = handles.get(key);
            if (handle == null) {
                handle = closing.get(key);
            }
            return handle == null ? SubscriptionState.CLOSED : handle.state;
        }
    }

    /**
     * @return the keys currently held in the registry, in the order they were added
     */
    public ImmutableList<PartitionKey> getKeys() {
        synchronized (registryLock) {
            return ImmutableList.copyOf(handles.keySet());
        }
    }

    /**
     * @return true while some subscription has not reported anything yet
     */
    public boolean isLoading() {
        synchronized (registryLock) {
            for (Handle handle : handles.values()) {
                if (!handle.reported && handle.state != SubscriptionState.CLOSED) {
                    return true;
                }
            }
            return false;
        }
    }

    /**
     * @return the last error of every partition whose subscription has failed
     */
    public ImmutableMap<PartitionKey, SubscriptionException> getErrors() {
        synchronized (registryLock) {
            ImmutableMap.Builder<PartitionKey, SubscriptionException> errors = ImmutableMap.builder();
            for (Handle handle : handles.values()) {
                if (handle.lastError != null) {
                    errors.put(handle.key, handle.lastError);
                }
            }
            return errors.build();
        }
    }

    private void open(Handle handle) {
        Subscription subscription;
        try {
            subscription = dataSource.subscribe(handle.key, new HandleListener(handle.key, handle.generation));
        } catch (RuntimeException e) {
            synchronized (registryLock) {
                handle.state = SubscriptionState.CLOSED;
            }
            reportError(handle.key, handle.generation, e);
            return;
        }
        boolean superseded;
        synchronized (registryLock) {
            superseded = !isCurrent(handle.key, handle.generation);
            if (!superseded) {
                handle.subscription = subscription;
                handle.state = SubscriptionState.OPEN;
            }
        }
        if (superseded) {
            LOG.debug("Subscription to {} (generation {}) was dropped while opening", handle.key, handle.generation);
            subscription.cancel();
        } else {
            LOG.debug("Opened subscription to {} (generation {})", handle.key, handle.generation);
        }
    }

    private void cancel(Handle handle) {
        Subscription subscription;
        synchronized (registryLock) {
            subscription = handle.subscription;
            handle.subscription = null;
        }
        if (subscription != null) {
            subscription.cancel();
        }
        synchronized (registryLock) {
            handle.state = SubscriptionState.CLOSED;
            closing.remove(handle.key, handle);
        }
        LOG.debug("Cancelled subscription to {} (generation {})", handle.key, handle.generation);
    }

    private boolean isCurrent(PartitionKey key, long generation) {
        Handle handle = handles.get(key);
        return !closed && handle != null && handle.generation == generation;
    }

    private void accept(PartitionKey key, long generation, SamplesReplacement replacement) {
        boolean changed;
        synchronized (registryLock) {
            if (!isCurrent(key, generation)) {
                LOG.debug("Dropping stale batch of {} samples for {} (generation {})",
                        replacement.getSamples().size(), key, generation);
                return;
            }
            Handle handle = handles.get(key);
            handle.reported = true;
            handle.lastError = null;
            changed = store.applyPartition(key, replacement.getSamples());
        }
        if (changed) {
            notifyChanged();
        }
    }

    private void reportError(PartitionKey key, long generation, Throwable cause) {
        SubscriptionException error = new SubscriptionException(key, cause);
        synchronized (registryLock) {
            if (!isCurrent(key, generation)) {
                LOG.debug("Dropping error of stale subscription to {} (generation {})", key, generation);
                return;
            }
            Handle handle = handles.get(key);
            handle.reported = true;
            handle.lastError = error;
        }
        LOG.warn("Partition {} failed, keeping its last snapshot", key, cause);
        for (SubscriptionWarningListener listener : warningListeners) {
            listener.onSubscriptionError(error);
        }
    }

    private void notifyChanged() {
        for (SeriesChangeListener listener : changeListeners) {
            try {
                listener.onSeriesChanged();
            } catch (RuntimeException e) {
                LOG.error("Series change listener failed", e);
            }
        }
    }

    private static class Handle {
        private final PartitionKey key;
        private final long generation;
        private SubscriptionState state = SubscriptionState.OPENING;
        private Subscription subscription;
        private boolean reported;
        private SubscriptionException lastError;

        private Handle(PartitionKey key, long generation) {
            this.key = key;
            this.generation = generation;
        }
    }

    private class HandleListener implements PartitionListener {
        private final PartitionKey key;
        private final long generation;

        private HandleListener(PartitionKey key, long generation) {
            this.key = key;
            this.generation = generation;
        }

        @Override
        public void onReplacement(SamplesReplacement replacement) {
            accept(key, generation, replacement);
        }

        @Override
        public void onError(Throwable error) {
            reportError(key, generation, error);
        }
    }
}
