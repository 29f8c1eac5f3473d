package com.flowmetrics.service.core.buffer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flowmetrics.model.AgentMetric;
import com.flowmetrics.model.MetricRecord;
import com.flowmetrics.service.core.config.MetricsProperties;
import com.flowmetrics.service.core.error.ErrorKind;
import com.flowmetrics.service.core.error.MetricsStoreException;
import com.flowmetrics.service.core.support.InMemoryMetricsStore;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class MetricsFlushServiceTest {

    private final MetricsProperties properties = new MetricsProperties();
    private final InMemoryMetricsStore store = new InMemoryMetricsStore();
    private final List<MetricRecord> reportedDrops = new CopyOnWriteArrayList<>();
    private MetricsWriteBuffer buffer;
    private MetricsFlushService flushService;

    private void start(int maxSize, int maxPending, Duration interval) {
        properties.getBuffer().setMaxSize(maxSize);
        properties.getBuffer().setMaxPending(maxPending);
        properties.getBuffer().setFlushInterval(interval);
        buffer = new MetricsWriteBuffer(properties);
        flushService = new MetricsFlushService(
                buffer, store, properties, (dropped, cause) -> reportedDrops.addAll(dropped));
        flushService.init(interval);
    }

    @AfterEach
    void tearDown() {
        if (flushService != null) {
            flushService.haltWorker();
        }
    }

    @Test
    void reachingMaxSizeTriggersAsynchronousFlush() throws Exception {
        start(10, 1000, Duration.ofMinutes(10));

        for (int i = 0; i < 10; i++) {
            assertThat(flushService.enqueue(metric(i))).isTrue();
        }

        waitUntil(() -> store.size() == 10);
        assertThat(flushService.pendingCount()).isZero();
        assertThat(flushService.flushedCount()).isEqualTo(10);
        assertThat(store.batches()).isEqualTo(1);
    }

    @Test
    void explicitFlushPersistsEverythingBuffered() {
        start(100, 1000, Duration.ofMinutes(10));
        for (int i = 0; i < 7; i++) {
            flushService.enqueue(metric(i));
        }

        assertThat(flushService.flush()).isEqualTo(7);
        assertThat(flushService.flush()).isZero();
        assertThat(store.all()).hasSize(7);
    }

    @Test
    void enqueueIsRejectedAtMaxPending() {
        start(100, 3, Duration.ofMinutes(10));

        assertThat(flushService.enqueue(metric(1))).isTrue();
        assertThat(flushService.enqueue(metric(2))).isTrue();
        assertThat(flushService.enqueue(metric(3))).isTrue();
        assertThat(flushService.enqueue(metric(4))).isFalse();
        assertThat(flushService.pendingCount()).isEqualTo(3);
    }

    @Test
    void failedFlushReportsDroppedRecordsWithoutRequeueing() {
        start(100, 1000, Duration.ofMinutes(10));
        flushService.enqueue(metric(1));
        flushService.enqueue(metric(2));
        store.failWith(InMemoryMetricsStore.unavailable());

        assertThatThrownBy(() -> flushService.flush())
                .isInstanceOf(MetricsStoreException.class)
                .satisfies(ex -> assertThat(((MetricsStoreException) ex).getKind())
                        .isEqualTo(ErrorKind.STORAGE_UNAVAILABLE));

        assertThat(reportedDrops).hasSize(2);
        assertThat(flushService.droppedCount()).isEqualTo(2);
        assertThat(flushService.pendingCount()).isZero();
    }

    @Test
    void shutdownFlushesRemainingRecords() {
        start(100, 1000, Duration.ofMinutes(10));
        flushService.enqueue(metric(1));
        flushService.enqueue(metric(2));

        flushService.stop();

        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    void abruptStopLosesAtMostTheLastFlushInterval() throws Exception {
        Duration interval = Duration.ofMillis(100);
        start(100_000, 100_000, interval);
        long deadline = System.currentTimeMillis() + 600;
        int total = 0;
        while (System.currentTimeMillis() < deadline) {
            Instant now = Instant.now();
            flushService.enqueue(new AgentMetric("agent-1", now, "throughput", total, null));
            total++;
            Thread.sleep(2);
        }

        Instant killedAt = Instant.now();
        flushService.haltWorker();

        List<MetricRecord> lost = buffer.drain();
        assertThat(store.size() + lost.size()).isEqualTo(total);
        assertThat(store.size()).isPositive();
        Instant oldestAllowed = killedAt.minus(interval).minusMillis(250);
        assertThat(lost).allSatisfy(record -> assertThat(record.timestamp()).isAfter(oldestAllowed));
    }

    @Test
    void concurrentWritersLoseAndDuplicateNothing() throws Exception {
        int writers = 8;
        int perWriter = 5_000;
        start(50, writers * perWriter, Duration.ofMillis(20));
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Integer>> accepted = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                String agent = "agent-" + w;
                accepted.add(pool.submit(() -> {
                    go.await();
                    int ok = 0;
                    for (int i = 0; i < perWriter; i++) {
                        ok += flushService.enqueue(new AgentMetric(agent, Instant.now(), "throughput", i, null)) ? 1 : 0;
                    }
                    return ok;
                }));
            }
            go.countDown();
            for (Future<Integer> f : accepted) {
                assertThat(f.get()).isEqualTo(perWriter);
            }
        } finally {
            pool.shutdownNow();
        }

        flushService.flush();

        List<MetricRecord> persisted = store.all();
        assertThat(persisted).hasSize(writers * perWriter);
        Set<String> distinct = new HashSet<>();
        persisted.forEach(r -> distinct.add(r.scopeId() + "#" + (long) ((AgentMetric) r).value()));
        assertThat(distinct).hasSize(writers * perWriter);
        assertThat(flushService.droppedCount()).isZero();
    }

    @Test
    void nonPositiveFlushIntervalIsReportedAtStartup() {
        properties.getBuffer().setFlushInterval(Duration.ZERO);
        MetricsFlushService service = new MetricsFlushService(
                new MetricsWriteBuffer(properties), store, properties, (dropped, cause) -> {});

        assertThatThrownBy(() -> service.init(Duration.ZERO))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("flowmetrics.buffer.flush-interval");
    }

    private static AgentMetric metric(int i) {
        return new AgentMetric("agent-" + (i % 3), Instant.now(), "throughput", i, null);
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(condition.getAsBoolean()).isTrue();
    }
}
