package gr.imsi.athenarc.uroflow.subscription;

import static org.junit.Assert.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableSet;

import gr.imsi.athenarc.uroflow.datasource.InMemoryPartitionDataSource;
import gr.imsi.athenarc.uroflow.domain.DateRange;
import gr.imsi.athenarc.uroflow.domain.ImmutableSample;
import gr.imsi.athenarc.uroflow.domain.PartitionKey;
import gr.imsi.athenarc.uroflow.domain.Sample;
import gr.imsi.athenarc.uroflow.store.SeriesStore;

public class SubscriptionSetConcurrencyTest {

    private static final int DAYS = 7;
    private static final int WRITERS = 3;

    private ExecutorService deliveryPool;
    private ExecutorService writerPool;
    private InMemoryPartitionDataSource dataSource;
    private SeriesStore store;
    private SubscriptionSet subscriptions;

    @Before
    public void setUp() {
        deliveryPool = Executors.newFixedThreadPool(4);
        writerPool = Executors.newFixedThreadPool(WRITERS);
        dataSource = new InMemoryPartitionDataSource("concurrent", deliveryPool);
        for (int day = 1; day <= DAYS; day++) {
            dataSource.replace(key(day), samplesOf(day, 1, new Random(day)));
        }
        store = new SeriesStore();
        subscriptions = new SubscriptionSet(dataSource, store);
    }

    @After
    public void tearDown() {
        writerPool.shutdownNow();
        deliveryPool.shutdownNow();
    }

    private static PartitionKey key(int day) {
        return new PartitionKey(2024, 3, day);
    }

    private static DateRange range(int startDay, int endDay) {
        return DateRange.of(LocalDate.of(2024, 3, startDay), LocalDate.of(2024, 3, endDay));
    }

    private static List<Sample> samplesOf(int day, int count, Random random) {
        long dayStart = LocalDate.of(2024, 3, day).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        List<Sample> samples = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            samples.add(new ImmutableSample(dayStart + random.nextInt(86_400_000), random.nextInt(40)));
        }
        return samples;
    }

    private List<Future<?>> startWriters(AtomicBoolean running, CountDownLatch started) {
        List<Future<?>> writers = new ArrayList<>();
        for (int w = 0; w < WRITERS; w++) {
            Random random = new Random(100 + w);
            writers.add(writerPool.submit(() -> {
                started.countDown();
                while (running.get()) {
                    int day = 1 + random.nextInt(DAYS);
                    dataSource.replace(key(day), samplesOf(day, 1 + random.nextInt(5), random));
                }
            }));
        }
        return writers;
    }

    private void stopWriters(AtomicBoolean running, List<Future<?>> writers) throws Exception {
        running.set(false);
        for (Future<?> writer : writers) {
            writer.get(10, TimeUnit.SECONDS);
        }
    }

    private void drainDeliveries() throws InterruptedException {
        deliveryPool.shutdown();
        assertTrue(deliveryPool.awaitTermination(10, TimeUnit.SECONDS));
    }

    @Test
    public void testOnlyFinalRangeRemainsAfterConcurrentUpdates() throws Exception {
        AtomicBoolean running = new AtomicBoolean(true);
        CountDownLatch started = new CountDownLatch(WRITERS);
        List<Future<?>> writers = startWriters(running, started);
        started.await(10, TimeUnit.SECONDS);

        Random random = new Random(7);
        for (int i = 0; i < 200; i++) {
            int start = 1 + random.nextInt(DAYS);
            int end = start + random.nextInt(DAYS - start + 1);
            subscriptions.update(range(start, end));
        }
        subscriptions.update(range(3, 4));

        stopWriters(running, writers);
        drainDeliveries();

        assertEquals(ImmutableSet.of(key(3), key(4)), store.getPartitions());
        assertEquals(ImmutableSet.of(key(3), key(4)), ImmutableSet.copyOf(subscriptions.getKeys()));
        long from = Instant.parse("2024-03-03T00:00:00Z").toEpochMilli();
        long to = Instant.parse("2024-03-05T00:00:00Z").toEpochMilli();
        List<Sample> series = store.snapshotSeries();
        for (int i = 0; i < series.size(); i++) {
            long timestamp = series.get(i).getTimestamp();
            assertTrue(timestamp >= from && timestamp < to);
            if (i > 0) {
                assertTrue(series.get(i - 1).getTimestamp() <= timestamp);
            }
        }
        for (int day = 1; day <= DAYS; day++) {
            if (day != 3 && day != 4) {
                assertEquals(0, dataSource.getSubscriberCount(key(day)));
            }
        }
    }

    @Test
    public void testCloseDuringConcurrentDeliveryLeavesNothingBehind() throws Exception {
        subscriptions.update(range(1, DAYS));
        AtomicBoolean running = new AtomicBoolean(true);
        CountDownLatch started = new CountDownLatch(WRITERS);
        List<Future<?>> writers = startWriters(running, started);
        started.await(10, TimeUnit.SECONDS);

        subscriptions.close();

        stopWriters(running, writers);
        drainDeliveries();

        assertTrue(store.getPartitions().isEmpty());
        assertTrue(store.snapshotSeries().isEmpty());
        for (int day = 1; day <= DAYS; day++) {
            assertEquals(0, dataSource.getSubscriberCount(key(day)));
        }
    }
}
