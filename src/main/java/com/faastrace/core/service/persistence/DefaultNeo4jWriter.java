package com.faastrace.core.service.persistence;

import com.faastrace.core.service.config.FaasTraceConfig;
import com.faastrace.core.service.config.MetricsConfig;
import com.faastrace.core.service.model.Trace;
import com.faastrace.core.service.store.RecordStore;
import com.faastrace.core.service.store.RecordStoreException;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.exceptions.Neo4jException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Pushes stored traces into Neo4j.
 *
 * The driver is only opened when the export feature is enabled. A trace is written
 * in a single transaction, so a failed push leaves no partial graph behind.
 */
@Slf4j
@Component
public class DefaultNeo4jWriter implements Neo4jWriter {

    private static final String RECORD_ID_CONSTRAINT = """
            CREATE CONSTRAINT function_node_record_id IF NOT EXISTS \
            FOR (n:%s) REQUIRE n.recordId IS UNIQUE""".formatted(CypherBuilder.NODE_LABEL);

    private final RecordStore recordStore;
    private final CypherBuilder cypherBuilder;
    private final FaasTraceConfig faasTraceConfig;
    private final MetricsConfig metricsConfig;

    @Value("${faas.neo4j.uri:bolt://localhost:7687}")
    private String uri;

    @Value("${faas.neo4j.username:neo4j}")
    private String username;

    @Value("${faas.neo4j.password:password}")
    private String password;

    @Value("${faas.neo4j.database:neo4j}")
    private String database;

    private Driver driver;
    private volatile boolean connected;

    public DefaultNeo4jWriter(RecordStore recordStore,
                              CypherBuilder cypherBuilder,
                              FaasTraceConfig faasTraceConfig,
                              MetricsConfig metricsConfig) {
        this.recordStore = recordStore;
        this.cypherBuilder = cypherBuilder;
        this.faasTraceConfig = faasTraceConfig;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    void connect() {
        if (!faasTraceConfig.getFeatures().isNeo4jExportEnabled()) {
            log.info("Neo4j export is disabled");
            return;
        }
        try {
            driver = GraphDatabase.driver(uri, AuthTokens.basic(username, password));
            driver.verifyConnectivity();
            ensureConstraints();
            connected = true;
            log.info("Connected to Neo4j at {} (database {})", uri, database);
        } catch (Neo4jException e) {
            log.warn("Neo4j at {} is not reachable, trace push disabled: {}", uri, e.getMessage());
            connected = false;
        }
    }

    @PreDestroy
    void disconnect() {
        connected = false;
        if (driver != null) {
            driver.close();
            log.info("Neo4j driver closed");
        }
    }

    @Override
    public List<String> generateCypher(String traceId) {
        return cypherBuilder.buildCypher(traceId);
    }

    @Override
    @Async("exportExecutor")
    public CompletableFuture<ExportResult> pushToNeo4j(String traceId) {
        var sample = Timer.start(metricsConfig.getRegistry());
        try {
            return CompletableFuture.completedFuture(push(traceId));
        } finally {
            sample.stop(metricsConfig.getExportTimer());
        }
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    // ==================== Push ====================

    private ExportResult push(String traceId) {
        if (!connected) {
            return ExportResult.failure(traceId, "Neo4j not connected");
        }

        Trace trace;
        try {
            trace = recordStore.getTrace(traceId).orElse(null);
        } catch (RecordStoreException e) {
            log.error("Cannot load trace {} for export: {}", traceId, e.getMessage());
            return ExportResult.failure(traceId, e.getMessage());
        }
        if (trace == null || trace.isEmpty()) {
            return ExportResult.failure(traceId, "Trace not found or empty");
        }

        long startTime = System.currentTimeMillis();
        var graph = cypherBuilder.buildGraph(trace);
        try (var session = driver.session(sessionConfig())) {
            session.executeWriteWithoutResult(tx -> graph.statements().forEach(tx::run));
        } catch (Neo4jException e) {
            log.error("Failed to export trace {} to Neo4j", traceId, e);
            return ExportResult.failure(traceId, e.getMessage());
        }

        long duration = System.currentTimeMillis() - startTime;
        metricsConfig.getExportsCompleted().increment();
        log.info("Exported trace {} to Neo4j: {} function nodes, {} edges in {}ms",
                traceId, graph.nodeCount(), graph.edgeCount(), duration);
        return ExportResult.success(traceId, graph.nodeCount(), graph.edgeCount(), duration);
    }

    private void ensureConstraints() {
        try (var session = driver.session(sessionConfig())) {
            session.executeWriteWithoutResult(tx -> tx.run(RECORD_ID_CONSTRAINT));
        }
    }

    private SessionConfig sessionConfig() {
        return SessionConfig.forDatabase(database);
    }
}
