package com.faastrace.core.service.persistence;

import com.faastrace.core.service.engine.TraceGraphBuilder;
import com.faastrace.core.service.model.TestRecords;
import com.faastrace.core.service.model.Trace;
import com.faastrace.core.service.store.InMemoryRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.faastrace.core.service.model.TestRecords.record;
import static com.faastrace.core.service.model.TestRecords.withInbound;
import static com.faastrace.core.service.model.TestRecords.withOutbound;
import static org.assertj.core.api.Assertions.assertThat;

class CypherBuilderTest {

    private InMemoryRecordStore store;
    private CypherBuilder cypherBuilder;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore(TestRecords.objectMapper());
        cypherBuilder = new CypherBuilder(store, new TraceGraphBuilder());
    }

    @Test
    void buildsMetadataNodesThenEdges() {
        var parent = withOutbound(record("r1", "t1", "producer", 0), Map.of("queue", "orders"));
        var child = withInbound(record("r2", "t1", "consumer", 100), Map.of("queue", "orders"));
        child.setParentId("r1");
        var trace = new Trace("t1");
        trace.addRecord(parent);
        trace.addRecord(child);
        store.putTrace(trace);

        var statements = cypherBuilder.buildCypher("t1");

        assertThat(statements).hasSize(4);
        assertThat(statements.get(0)).startsWith("MERGE (t:FaasTrace {traceId: 't1'})")
                .contains("t.recordCount = 2", "t.rootRecordId = 'r1'");
        assertThat(statements.get(1)).startsWith("MERGE (n:FunctionNode {recordId: 'r1'})")
                .contains("n.functionName = 'producer'", "n.executionTimeMs = 100",
                        "n.invokedAt = datetime('2024-05-01T10:00:00Z')");
        assertThat(statements.get(3)).contains("MERGE (p)-[e:TRIGGERED]->(c)", "e.triggerType = 'queue'",
                "e.synchronicity = 'async'");
    }

    @Test
    void escapesQuotes() {
        var trace = new Trace("t'1");
        trace.addRecord(record("r'1", "t'1", "it's", 0));

        var statements = cypherBuilder.buildStatementsForTrace(trace);

        assertThat(statements.get(1)).contains("recordId: 'r\\'1'", "n.functionName = 'it\\'s'");
    }

    @Test
    void countsNodesAndEdges() {
        var trace = new Trace("t1");
        trace.addRecord(record("r1", "t1", "producer", 0));
        var child = record("r2", "t1", "consumer", 100);
        child.setParentId("r1");
        trace.addRecord(child);
        trace.addRecord(record("r3", "t1", "orphan", 200));

        var graph = cypherBuilder.buildGraph(trace);

        assertThat(graph.nodeCount()).isEqualTo(3);
        assertThat(graph.edgeCount()).isEqualTo(1);
        assertThat(graph.statements()).hasSize(5);
    }

    @Test
    void missingTraceGivesNoStatements() {
        assertThat(cypherBuilder.buildCypher("missing")).isEmpty();
    }
}
