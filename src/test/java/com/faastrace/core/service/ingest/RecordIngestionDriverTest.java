package com.faastrace.core.service.ingest;

import com.faastrace.core.service.config.FaasTraceConfig;
import com.faastrace.core.service.config.IngestionConfig;
import com.faastrace.core.service.config.MetricsConfig;
import com.faastrace.core.service.model.TestRecords;
import com.faastrace.core.service.store.InMemoryRecordStore;
import com.faastrace.core.service.store.RecordStore;
import com.faastrace.core.service.store.RecordStoreException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static com.faastrace.core.service.model.TestRecords.record;
import static com.faastrace.core.service.model.TestRecords.recordIds;
import static com.faastrace.core.service.model.TestRecords.withInbound;
import static com.faastrace.core.service.model.TestRecords.withOutbound;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

class RecordIngestionDriverTest {

    private static final Map<String, Object> QUEUE_MESSAGE = Map.of("queue", "orders", "message_id", "m-1");

    private InMemoryRecordStore store;
    private IngestionConfig ingestionConfig;
    private FaasTraceConfig faasTraceConfig;
    private MetricsConfig metricsConfig;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore(TestRecords.objectMapper());
        ingestionConfig = new IngestionConfig();
        ingestionConfig.getPrefetch().setWindowSize(3);
        faasTraceConfig = new FaasTraceConfig();
        metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private RecordIngestionDriver driver(RecordStore recordStore) {
        return new RecordIngestionDriver(recordStore, ingestionConfig, faasTraceConfig, metricsConfig, executor);
    }

    // ==================== Full Runs ====================

    @Test
    @DisplayName("Linked records become one persisted trace and leave the backlog")
    void processesLinkedRecords() {
        store.putUnprocessed(withInbound(record("r2", "t2", "consumer", 100), QUEUE_MESSAGE));
        store.putUnprocessed(withOutbound(record("r1", "t1", "producer", 0), QUEUE_MESSAGE));

        var result = driver(store).run();

        assertThat(result.recordsListed()).isEqualTo(2);
        assertThat(result.recordsProcessed()).isEqualTo(2);
        assertThat(result.merges()).isEqualTo(1);
        assertThat(result.tracesPersisted()).isEqualTo(1);
        assertThat(result.profilesWritten()).isEqualTo(1);
        assertThat(store.listUnprocessed()).isEmpty();

        var trace = store.getTrace("t1").orElseThrow();
        assertThat(trace.rootRecordId()).isEqualTo("r1");
        assertThat(trace.findRecord("r2").orElseThrow().getParentId()).isEqualTo("r1");
        assertThat(store.findProfileByFunction("aws::producer::handler.main")).isPresent();
        assertThat(metricsConfig.getRecordsProcessed().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Records without trace id are quarantined, unreadable records stay in the backlog")
    void handlesBadRecords() {
        store.putUnprocessed(record("r1", "t1", "producer", 0));
        store.putUnprocessedRaw("no-trace-id", "{\"recordId\":\"r9\"}");
        store.putUnprocessedRaw("garbage", "{not json");

        var result = driver(store).run();

        assertThat(result.recordsSkipped()).isEqualTo(2);
        assertThat(result.recordsQuarantined()).isEqualTo(1);
        assertThat(result.recordsProcessed()).isEqualTo(1);
        assertThat(store.isFailed("no-trace-id")).isTrue();
        assertThat(store.listUnprocessed()).containsExactly("garbage");
        assertThat(metricsConfig.getRecordsSkipped().count()).isEqualTo(2.0);
        assertThat(metricsConfig.getRecordsQuarantined().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Bad records at the head of the backlog do not block later records")
    void badRecordsDoNotStarveBacklog() {
        ingestionConfig.getBatch().setMaxRecords(2);
        store.putUnprocessedRaw("bad-1", "{\"recordId\":\"bad-1\"}");
        store.putUnprocessedRaw("bad-2", "{not json");
        store.putUnprocessedRaw("bad-3", "{not json");
        store.putUnprocessed(record("good", "t1", "producer", 0));
        var driver = driver(store);

        var first = driver.run();
        var second = driver.run();

        assertThat(first.recordsListed()).isEqualTo(2);
        assertThat(first.recordsQuarantined()).isEqualTo(1);
        assertThat(store.isFailed("bad-1")).isTrue();
        assertThat(second.recordsListed()).isEqualTo(2);
        assertThat(second.recordsProcessed()).isEqualTo(1);
        assertThat(store.isProcessed("good")).isTrue();
        assertThat(store.listUnprocessed()).containsExactly("bad-2", "bad-3");
    }

    @Test
    @DisplayName("Records that never find a root are quarantined after the deferral limit")
    void rootlessRecordsAreQuarantinedAfterLimit() {
        ingestionConfig.getBatch().setMaxRecords(2);
        ingestionConfig.getBatch().setMaxDeferrals(2);
        var first = record("r1", "t1", "worker", 0);
        first.setParentId("r2");
        var second = record("r2", "t1", "worker", 10);
        second.setParentId("r1");
        store.putUnprocessed(first);
        store.putUnprocessed(second);
        store.putUnprocessed(record("r3", "t3", "producer", 0));
        var driver = driver(store);

        var firstRun = driver.run();
        var secondRun = driver.run();
        var thirdRun = driver.run();

        assertThat(firstRun.tracesDeferred()).isEqualTo(1);
        assertThat(firstRun.recordsQuarantined()).isZero();
        assertThat(secondRun.recordsProcessed()).isEqualTo(1);
        assertThat(store.isProcessed("r3")).isTrue();
        assertThat(secondRun.recordsQuarantined()).isEqualTo(1);
        assertThat(store.isFailed("r1")).isTrue();
        assertThat(thirdRun.recordsQuarantined()).isEqualTo(1);
        assertThat(store.isFailed("r2")).isTrue();
        assertThat(store.listUnprocessed()).isEmpty();
    }

    @Test
    void fetchFailureLeavesRecordUnprocessed() {
        var flaky = spy(store);
        flaky.putUnprocessed(record("r1", "t1", "producer", 0));
        flaky.putUnprocessed(record("r2", "t2", "producer", 0));
        doThrow(new RecordStoreException("timeout", "r2", RecordStoreException.Reason.UNAVAILABLE))
                .when(flaky).fetch("r2");

        var result = driver(flaky).run();

        assertThat(result.recordsFetched()).isEqualTo(1);
        assertThat(result.recordsSkipped()).isEqualTo(1);
        assertThat(flaky.listUnprocessed()).containsExactly("r2");
    }

    @Test
    @DisplayName("Rootless traces are deferred and their records re-listed next run")
    void defersRootlessTraces() {
        var first = record("r1", "t1", "worker", 0);
        first.setParentId("r2");
        var second = record("r2", "t1", "worker", 10);
        second.setParentId("r1");
        store.putUnprocessed(first);
        store.putUnprocessed(second);
        store.putUnprocessed(record("r3", "t3", "producer", 0));

        var result = driver(store).run();

        assertThat(result.tracesDeferred()).isEqualTo(1);
        assertThat(result.tracesPersisted()).isEqualTo(1);
        assertThat(store.listUnprocessed()).containsExactly("r1", "r2");
        assertThat(store.getTrace("t1")).isEmpty();
    }

    @Test
    @DisplayName("Prefetched records are merged in listing order")
    void prefetchKeepsListingOrder() {
        var expected = IntStream.range(0, 10).mapToObj(i -> "r" + i).toList();
        expected.forEach(id -> store.putUnprocessed(record(id, "shared", "worker", expected.indexOf(id))));

        driver(store).run();

        assertThat(recordIds(store.getTrace("shared").orElseThrow())).containsExactlyElementsOf(expected);
    }

    @Test
    void batchLimitKeepsOldestRecords() {
        ingestionConfig.getBatch().setMaxRecords(2);
        List.of("r1", "r2", "r3").forEach(id -> store.putUnprocessed(record(id, "t-" + id, "f", 0)));

        var result = driver(store).run();

        assertThat(result.recordsListed()).isEqualTo(2);
        assertThat(store.listUnprocessed()).containsExactly("r3");
    }

    @Test
    void sequentialFetchWhenPrefetchDisabled() {
        ingestionConfig.getPrefetch().setEnabled(false);
        store.putUnprocessed(record("r1", "t1", "f", 0));

        assertThat(driver(store).run().recordsProcessed()).isEqualTo(1);
    }

    // ==================== Failures ====================

    @Test
    void unavailableStoreAbortsRun() {
        var broken = mock(RecordStore.class);
        when(broken.listUnprocessed())
                .thenThrow(new RecordStoreException("offline", "x", RecordStoreException.Reason.UNAVAILABLE));

        var driver = driver(broken);

        assertThatThrownBy(driver::run)
                .isInstanceOf(IngestionException.class)
                .extracting(e -> ((IngestionException) e).getErrorCode())
                .isEqualTo(IngestionException.STORE_UNAVAILABLE);
        assertThat(driver.isRunning()).isFalse();
    }

    @Test
    void secondConcurrentRunIsRefused() throws Exception {
        var release = new CountDownLatch(1);
        var blocking = mock(RecordStore.class);
        when(blocking.listUnprocessed()).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return List.of();
        });
        var driver = driver(blocking);

        var firstRun = CompletableFuture.supplyAsync(driver::run);
        await().atMost(5, TimeUnit.SECONDS).until(driver::isRunning);

        assertThatThrownBy(driver::run)
                .isInstanceOf(IngestionException.class)
                .extracting(e -> ((IngestionException) e).getErrorCode())
                .isEqualTo(IngestionException.RUN_IN_PROGRESS);

        release.countDown();
        assertThat(firstRun.get(5, TimeUnit.SECONDS).recordsListed()).isZero();
        assertThat(driver.isRunning()).isFalse();
    }

    @Test
    void disabledIngestionIsRefused() {
        faasTraceConfig.setEnabled(false);

        assertThatThrownBy(() -> driver(store).run())
                .isInstanceOf(IngestionException.class)
                .extracting(e -> ((IngestionException) e).getErrorCode())
                .isEqualTo(IngestionException.INGESTION_DISABLED);
    }

    @Test
    void submitRejectsIdsThatAreNotPlainNames() {
        assertThatThrownBy(() -> driver(store).submit(record("../../escaped", "t1", "f", 0)))
                .isInstanceOf(IngestionException.class)
                .extracting(e -> ((IngestionException) e).getErrorCode())
                .isEqualTo(IngestionException.INVALID_RECORD_ID);
        assertThatThrownBy(() -> driver(store).submit(record("r1", "traces/t1", "f", 0)))
                .isInstanceOf(IngestionException.class);
        assertThat(store.listUnprocessed()).isEmpty();
    }

    @Test
    void submitRejectsRecordWithoutTraceId() {
        assertThatThrownBy(() -> driver(store).submit(record("r1", " ", "f", 0)))
                .isInstanceOf(IngestionException.class);
        assertThat(store.listUnprocessed()).isEmpty();
    }
}
