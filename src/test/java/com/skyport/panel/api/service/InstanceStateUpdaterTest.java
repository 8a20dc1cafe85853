package com.skyport.panel.api.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.skyport.panel.api.TestFixtures;
import com.skyport.panel.api.model.InstanceRecord;
import com.skyport.panel.api.model.NodeRedeployResponse;
import com.skyport.panel.api.repository.InMemoryKeyValueStore;
import com.skyport.panel.api.repository.InstanceRepository;
import com.skyport.panel.api.repository.KeyLockRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class InstanceStateUpdaterTest {

    private ExecutorService readExecutor;

    @BeforeEach
    void setUp() {
        readExecutor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        readExecutor.shutdownNow();
    }

    private InstanceStateUpdater updater(InMemoryKeyValueStore store) {
        return new InstanceStateUpdater(
                new InstanceRepository(store, TestFixtures.objectMapper()),
                new KeyLockRegistry(),
                readExecutor
        );
    }

    private InstanceRecord apply(InstanceStateUpdater updater, String newContainerId) {
        InstanceRecord previous = TestFixtures.instance(TestFixtures.INSTANCE_ID, "c-old");
        return updater.applyRedeploy(
                TestFixtures.request("80:8080,443:8443"),
                TestFixtures.IMAGE,
                TestFixtures.node(),
                new NodeRedeployResponse(newContainerId, "v1"),
                previous.env(),
                previous.imageData()
        );
    }

    @Test
    void replacesEntryInAllThreeViews() {
        InMemoryKeyValueStore store = TestFixtures.storeWithCatalog();
        InstanceRecord old = TestFixtures.instance(TestFixtures.INSTANCE_ID, "c-old");
        InstanceRecord other = TestFixtures.instance("inst-2", "c-other");
        TestFixtures.write(store, "user-1_instances", List.of(old, other));
        TestFixtures.write(store, "instances", List.of(other, old));
        TestFixtures.write(store, "inst-1_instance", old);

        InstanceRecord updated = apply(updater(store), "c2");

        InstanceRepository repository = new InstanceRepository(store, TestFixtures.objectMapper());
        ArrayNode userInstances = repository.findUserInstances(TestFixtures.USER_ID);
        ArrayNode globalInstances = repository.findAllInstances();
        assertEquals(List.of("inst-2", "inst-1"), ids(userInstances));
        assertEquals(List.of("inst-2", "inst-1"), ids(globalInstances));
        assertEquals("c2", userInstances.get(1).path("ContainerId").asText());
        assertEquals("c2", globalInstances.get(1).path("ContainerId").asText());
        assertEquals("c2", repository.findInstance(TestFixtures.INSTANCE_ID).orElseThrow().containerId());

        assertEquals(TestFixtures.INSTANCE_ID, updated.volumeId());
        assertEquals(1024, updated.memory());
        assertEquals(2, updated.cpu());
        assertEquals("80:8080,443:8443", updated.ports());
        assertEquals("web-v2", updated.name());
        assertEquals("true", updated.primary());
        assertEquals(List.of("ghcr.io/skyport/node:18"), updated.altImages());
        assertEquals("Node 20", updated.imageData().get("Name").asText());
        assertNotNull(updated.lastUpdated());
    }

    @Test
    void createsListsWhenAbsent() {
        InMemoryKeyValueStore store = TestFixtures.storeWithCatalog();

        apply(updater(store), "c2");

        assertTrue(store.contains("user-1_instances"));
        assertTrue(store.contains("instances"));
        assertTrue(store.contains("inst-1_instance"));
    }

    @Test
    void missingImageLeavesAltImagesEmpty() {
        InstanceRecord updated = apply(updater(new InMemoryKeyValueStore()), "c2");

        assertEquals(List.of(), updated.altImages());
    }

    @Test
    void repeatedUpdatesKeepOneEntryPerInstance() {
        InMemoryKeyValueStore store = TestFixtures.storeWithCatalog();
        InstanceStateUpdater updater = updater(store);

        apply(updater, "c2");
        apply(updater, "c3");

        InstanceRepository repository = new InstanceRepository(store, TestFixtures.objectMapper());
        assertEquals(1, repository.findUserInstances(TestFixtures.USER_ID).size());
        assertEquals(1, repository.findAllInstances().size());
        assertEquals("c3", repository.findAllInstances().get(0).path("ContainerId").asText());
    }

    @Test
    void otherInstancesAreWrittenBackUnchanged() {
        InMemoryKeyValueStore store = TestFixtures.storeWithCatalog();
        String sibling = """
                {"Id":"inst-2","Name":"db","User":"user-1","State":"running","Suspended":false,
                 "Node":{"id":"node-1","apiKey":"k","location":"eu"}}""";
        store.set("instances", "[" + sibling + "]");
        store.set("user-1_instances", "[" + sibling + "]");

        apply(updater(store), "c2");

        JsonNode expected = readTree(sibling);
        InstanceRepository repository = new InstanceRepository(store, TestFixtures.objectMapper());
        assertEquals(expected, repository.findAllInstances().get(0));
        assertEquals(expected, repository.findUserInstances(TestFixtures.USER_ID).get(0));
        assertFalse(repository.findAllInstances().get(0).has("Memory"));
    }

    @Test
    void storedNodeKeepsAttributesBeyondConnectionFields() {
        InMemoryKeyValueStore store = TestFixtures.storeWithCatalog();
        store.set("node-1_node", """
                {"id":"node-1","name":"eu-1","address":"10.0.0.5","port":3002,"apiKey":"node-secret",
                 "location":"eu-west","tags":["ssd"]}""");
        InstanceRepository repository = new InstanceRepository(store, TestFixtures.objectMapper());
        InstanceRecord previous = TestFixtures.instance(TestFixtures.INSTANCE_ID, "c-old");

        updater(store).applyRedeploy(
                TestFixtures.request("80:8080"),
                TestFixtures.IMAGE,
                repository.findNode(TestFixtures.NODE_ID).orElseThrow(),
                new NodeRedeployResponse("c2", "v1"),
                previous.env(),
                previous.imageData()
        );

        JsonNode storedNode = readTree(store.get("inst-1_instance").orElseThrow()).path("Node");
        assertEquals("eu-west", storedNode.path("location").asText());
        assertEquals("ssd", storedNode.path("tags").get(0).asText());
        assertEquals("eu-west", repository.findAllInstances().get(0).path("Node").path("location").asText());
    }

    @Test
    void lastUpdatedIsStoredAsIsoTimestamp() {
        InMemoryKeyValueStore store = TestFixtures.storeWithCatalog();

        apply(updater(store), "c2");

        JsonNode stored = readTree(store.get("inst-1_instance").orElseThrow());
        assertTrue(stored.path("LastUpdated").isTextual());
        assertNotNull(Instant.parse(stored.path("LastUpdated").asText()));
    }

    private static JsonNode readTree(String json) {
        try {
            return TestFixtures.objectMapper().readTree(json);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException(ex);
        }
    }

    private static List<String> ids(ArrayNode instances) {
        List<String> ids = new ArrayList<>();
        instances.forEach(entry -> ids.add(entry.path("Id").asText()));
        return ids;
    }

    @Test
    void droppedGlobalWriteFailsVerification() {
        InMemoryKeyValueStore store = new DroppingStore("instances");
        TestFixtures.write(store, "images", List.of(TestFixtures.image()));

        RedeploymentException ex = assertThrows(RedeploymentException.class, () -> apply(updater(store), "c2"));

        assertEquals(RedeployFailureKind.VERIFICATION_FAILED, ex.getKind());
        assertEquals("Database verification failed after update", ex.getReason());
    }

    @Test
    void droppedRecordWriteFailsVerification() {
        InMemoryKeyValueStore store = new DroppingStore("inst-1_instance");

        assertThrows(RedeploymentException.class, () -> apply(updater(store), "c2"));
    }

    static final class DroppingStore extends InMemoryKeyValueStore {

        private final String droppedKey;

        DroppingStore(String droppedKey) {
            this.droppedKey = droppedKey;
        }

        @Override
        public void set(String key, String json) {
            if (!droppedKey.equals(key)) {
                super.set(key, json);
            }
        }
    }
}
