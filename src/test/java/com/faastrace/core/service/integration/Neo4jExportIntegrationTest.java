package com.faastrace.core.service.integration;

import com.faastrace.core.service.model.Trace;
import com.faastrace.core.service.persistence.Neo4jWriter;
import com.faastrace.core.service.store.InMemoryRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.GraphDatabase;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.Neo4jContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import static com.faastrace.core.service.model.TestRecords.record;
import static com.faastrace.core.service.model.TestRecords.withInbound;
import static com.faastrace.core.service.model.TestRecords.withOutbound;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Pushes reconstructed traces into a Neo4j container.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class Neo4jExportIntegrationTest {

    @Container
    static Neo4jContainer<?> neo4jContainer = new Neo4jContainer<>("neo4j:5.15.0")
            .withoutAuthentication();

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private InMemoryRecordStore recordStore;

    @Autowired
    private Neo4jWriter neo4jWriter;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("faas.neo4j.uri", neo4jContainer::getBoltUrl);
        registry.add("faas.neo4j.username", () -> "neo4j");
        registry.add("faas.neo4j.password", () -> "neo4j");
        registry.add("faas.features.neo4j-export-enabled", () -> "true");
    }

    @BeforeEach
    void setUp() {
        recordStore.clear();
        var parent = withOutbound(record("r1", "t1", "producer", 0), Map.of("queue", "orders"));
        var child = withInbound(record("r2", "t1", "consumer", 100), Map.of("queue", "orders"));
        child.setParentId("r1");
        var trace = new Trace("t1");
        trace.addRecord(parent);
        trace.addRecord(child);
        recordStore.putTrace(trace);
    }

    @Test
    @DisplayName("Should push a trace with its nodes and edges")
    void pushesTrace() throws Exception {
        assertThat(neo4jWriter.isConnected()).isTrue();

        var result = neo4jWriter.pushToNeo4j("t1").get(30, TimeUnit.SECONDS);

        assertThat(result.success()).isTrue();
        assertThat(result.nodesExported()).isEqualTo(2);
        assertThat(result.edgesExported()).isEqualTo(1);
        assertThat(countEdges()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Should push a trace through the export endpoint")
    void pushesTraceThroughApi() throws Exception {
        mockMvc.perform(get("/export/neo4j/t1").param("mode", "push"))
                .andExpect(status().isAccepted());

        await().atMost(30, TimeUnit.SECONDS)
                .until(() -> countEdges() == 1L);
    }

    private long countEdges() {
        try (var driver = GraphDatabase.driver(neo4jContainer.getBoltUrl(), AuthTokens.none());
             var session = driver.session()) {
            return session.run("MATCH (:FunctionNode)-[e:TRIGGERED]->(:FunctionNode) RETURN count(e) AS c")
                    .single().get("c").asLong();
        }
    }
}
