package com.faastrace.core.service.engine;

import com.faastrace.core.service.correlation.InMemoryRequestCorrelationCache;
import com.faastrace.core.service.correlation.PendingRequest;
import com.faastrace.core.service.ingest.IngestionException;
import com.faastrace.core.service.model.Trace;
import com.faastrace.core.service.model.TraceRecord;
import com.faastrace.core.service.trace.InMemoryTraceCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.faastrace.core.service.model.TestRecords.record;
import static com.faastrace.core.service.model.TestRecords.recordIds;
import static com.faastrace.core.service.model.TestRecords.withInbound;
import static com.faastrace.core.service.model.TestRecords.withOutbound;
import static com.faastrace.core.service.model.TestRecords.withUnresolvableInbound;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TraceMergerTest {

    private static final Map<String, Object> QUEUE_MESSAGE = Map.of("queue", "orders", "message_id", "m-1");
    private static final Map<String, Object> BUCKET_OBJECT = Map.of("bucket", "images", "key", "cat.png");

    private InMemoryTraceCache traceCache;
    private InMemoryRequestCorrelationCache correlationCache;
    private TraceMerger merger;

    private TraceRecord producer;
    private TraceRecord resizer;
    private TraceRecord thumbnailer;

    @BeforeEach
    void setUp() {
        traceCache = new InMemoryTraceCache();
        correlationCache = new InMemoryRequestCorrelationCache();
        merger = new TraceMerger(traceCache, correlationCache);

        producer = withOutbound(record("r1", "t1", "producer", 0), QUEUE_MESSAGE);
        resizer = withOutbound(withInbound(record("r2", "t2", "resizer", 100), QUEUE_MESSAGE), BUCKET_OBJECT);
        thumbnailer = withInbound(record("r3", "t3", "thumbnailer", 200), BUCKET_OBJECT);
    }

    // ==================== End-to-end Scenarios ====================

    @Nested
    @DisplayName("Chain producer -> resizer -> thumbnailer")
    class Chain {

        @Test
        @DisplayName("Records in call order collapse into the producer's trace")
        void forwardArrival() {
            merger.process(producer);
            merger.process(resizer);
            merger.process(thumbnailer);

            assertSingleChainTrace();
            assertThat(correlationCache.pendingInboundCount()).isZero();
            assertThat(correlationCache.pendingOutboundCount()).isZero();
        }

        @Test
        @DisplayName("Records in reverse order give the same trace")
        void reverseArrival() {
            merger.process(thumbnailer);
            merger.process(resizer);
            merger.process(producer);

            assertSingleChainTrace();
            assertThat(traceCache.get("t3")).map(Trace::getTraceId).contains("t1");
        }

        @Test
        @DisplayName("Middle record last still links both ends")
        void middleLast() {
            merger.process(producer);
            merger.process(thumbnailer);
            var outcome = merger.process(resizer);

            assertThat(outcome.inboundResolved()).isTrue();
            assertThat(outcome.outboundResolved()).isEqualTo(1);
            assertThat(outcome.merges()).isEqualTo(2);
            assertSingleChainTrace();
        }

        private void assertSingleChainTrace() {
            assertThat(traceCache.allLiveTraces()).hasSize(1);
            var trace = traceCache.allLiveTraces().iterator().next();

            assertThat(trace.getTraceId()).isEqualTo("t1");
            assertThat(recordIds(trace)).containsExactlyInAnyOrder("r1", "r2", "r3");
            assertThat(trace.getRecords()).allMatch(record -> record.getTraceId().equals("t1"));
            assertThat(trace.rootRecordId()).isEqualTo("r1");
            assertThat(resizer.getParentId()).isEqualTo("r1");
            assertThat(thumbnailer.getParentId()).isEqualTo("r2");
            assertThat(producer.getParentId()).isNull();

            assertThat(resizer.getInboundContext().getTriggerFinishedAt())
                    .isEqualTo(producer.getOutboundContexts().get(0).getFinishedAt());
            assertThat(thumbnailer.getInboundContext().getTriggerFinishedAt())
                    .isEqualTo(resizer.getOutboundContexts().get(0).getFinishedAt());
        }
    }

    @Test
    @DisplayName("Unresolvable inbound trigger is never correlated")
    void unresolvableInbound() {
        var consumer = withUnresolvableInbound(record("r2", "t2", "consumer", 100), QUEUE_MESSAGE);

        merger.process(producer);
        var outcome = merger.process(consumer);

        assertThat(outcome.inboundResolved()).isFalse();
        assertThat(outcome.deferred()).isZero();
        assertThat(traceCache.allLiveTraces()).hasSize(2);
        assertThat(consumer.getParentId()).isNull();
        assertThat(consumer.getTraceId()).isEqualTo("t2");
        assertThat(correlationCache.pendingOutboundCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Inbound resolution is skipped for records that already have a parent")
    void recordWithParentSkipsInboundResolution() {
        resizer.setParentId("external");

        merger.process(producer);
        var outcome = merger.process(resizer);

        assertThat(outcome.inboundResolved()).isFalse();
        assertThat(resizer.getParentId()).isEqualTo("external");
        assertThat(traceCache.allLiveTraces()).hasSize(2);
    }

    @Test
    @DisplayName("Triggers without identifier attributes still correlate on the empty identifier")
    void emptyIdentifierCorrelates() {
        var sender = withOutbound(record("r1", "t1", "sender", 0), Map.of());
        var receiver = withInbound(record("r2", "t2", "receiver", 100), Map.of());

        merger.process(sender);
        var outcome = merger.process(receiver);

        assertThat(outcome.inboundResolved()).isTrue();
        assertThat(receiver.getParentId()).isEqualTo("r1");
        assertThat(receiver.getTraceId()).isEqualTo("t1");
        assertThat(traceCache.get("t2")).map(Trace::getTraceId).contains("t1");
        assertThat(correlationCache.pendingOutboundCount()).isZero();
    }

    // ==================== Correlation Conflicts ====================

    @Test
    void secondEmptyIdentifierOnSameSideIsCountedNotThrown() {
        var firstSender = withOutbound(record("r1", "t1", "sender", 0), Map.of());
        var secondSender = withOutbound(record("r5", "t5", "sender", 50), Map.of());

        merger.process(firstSender);
        var outcome = merger.process(secondSender);

        assertThat(outcome.correlationErrors()).isEqualTo(1);
        assertThat(outcome.deferred()).isZero();
        assertThat(correlationCache.findOutboundForInbound(""))
                .map(PendingRequest::recordId)
                .contains("r1");
        assertThat(traceCache.allLiveTraces()).hasSize(2);
    }

    @Test
    void duplicateOutboundIdentifierIsCountedAndProcessingContinues() {
        var secondProducer = withOutbound(withOutbound(record("r9", "t9", "producer", 5), QUEUE_MESSAGE),
                BUCKET_OBJECT);

        merger.process(producer);
        var outcome = merger.process(secondProducer);

        assertThat(outcome.correlationErrors()).isEqualTo(1);
        assertThat(outcome.deferred()).isEqualTo(1);
        assertThat(correlationCache.findInboundForOutbound("bucket#images##key#cat.png")).isEmpty();
        assertThat(correlationCache.findOutboundForInbound("bucket#images##key#cat.png")).isPresent();
    }

    @Test
    void recordWithoutTracingContextIsRejected() {
        var orphan = record("r1", null, "producer", 0);

        assertThatThrownBy(() -> merger.process(orphan))
                .isInstanceOf(IngestionException.class)
                .extracting(e -> ((IngestionException) e).getErrorCode())
                .isEqualTo(IngestionException.MISSING_TRACING_CONTEXT);
        assertThat(traceCache.liveTraceCount()).isZero();
    }

    @Test
    void duplicateRecordIdIsIgnored() {
        merger.process(producer);
        var outcome = merger.process(withOutbound(record("r1", "t1", "producer", 0), QUEUE_MESSAGE));

        assertThat(outcome.duplicate()).isTrue();
        assertThat(outcome.correlationErrors()).isZero();
        assertThat(traceCache.get("t1").orElseThrow().size()).isEqualTo(1);
    }

    // ==================== Merge ====================

    @Test
    @DisplayName("Merge is size-additive and empties the child")
    void mergeMovesAllRecords() {
        var parent = traceCache.createOrGet("p");
        parent.addRecord(record("a", "p", "f", 0));
        var child = traceCache.createOrGet("c");
        child.addRecord(record("b", "c", "g", 10));
        child.addRecord(record("c1", "c", "g", 20));

        merger.merge(parent, child, "a", "b");

        assertThat(parent.size()).isEqualTo(3);
        assertThat(child.isEmpty()).isTrue();
        assertThat(parent.findRecord("b")).map(TraceRecord::getParentId).contains("a");
        assertThat(parent.findRecord("c1")).map(TraceRecord::getParentId).isEmpty();
        assertThat(parent.findRecord("c1")).map(TraceRecord::getTraceId).contains("p");
        assertThat(traceCache.get("c")).containsSame(parent);
        assertThat(traceCache.isLive("c")).isFalse();
    }

    @Test
    void mergingEmptyTraceChangesNothing() {
        var parent = traceCache.createOrGet("p");
        parent.addRecord(record("a", "p", "f", 0));
        var empty = new Trace("e");

        merger.merge(parent, empty, "a", "x");

        assertThat(recordIds(parent)).containsExactly("a");
        assertThat(traceCache.get("e")).isEmpty();
    }

    @Test
    @DisplayName("Correlation inside one trace only links parent and child")
    void selfMergeSetsParentOnly() {
        var first = withOutbound(record("r1", "shared", "producer", 0), QUEUE_MESSAGE);
        var second = withInbound(record("r2", "shared", "consumer", 50), QUEUE_MESSAGE);

        merger.process(first);
        var outcome = merger.process(second);

        assertThat(outcome.inboundResolved()).isTrue();
        var trace = traceCache.get("shared").orElseThrow();
        assertThat(recordIds(trace)).containsExactly("r1", "r2");
        assertThat(second.getParentId()).isEqualTo("r1");
        assertThat(traceCache.isLive("shared")).isTrue();
    }
}
