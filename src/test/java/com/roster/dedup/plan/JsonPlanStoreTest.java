package com.roster.dedup.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roster.dedup.core.model.PersonRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JsonPlanStore")
class JsonPlanStoreTest {

    @TempDir
    Path dir;

    private static DeduplicationPlan plan() {
        return DeduplicationPlan.create(42, List.of(
                DeduplicationAction.delete(1, 0, "junk name", List.of(new PersonRef(7, "Unknown"))),
                DeduplicationAction.merge(2, 2, "single-word evidence", new PersonRef(3, "Glenn Dubin"),
                        List.of(new PersonRef(9, "Dubin")), "score 10 (5 shared docs, 0 shared conns)")));
    }

    @Test
    @DisplayName("Saved plan should use lower-case enums and omit absent fields")
    void wireFormat() throws Exception {
        Path file = dir.resolve("plan.json");
        new JsonPlanStore(file).save(plan());

        JsonNode root = new ObjectMapper().readTree(Files.readString(file));

        assertEquals(42, root.get("personCountBefore").asLong());
        assertEquals(2, root.get("summary").get("totalActions").asInt());
        assertEquals("delete", root.get("summary").get("byPass").get("0").get("type").asText());
        assertEquals("single-word evidence", root.get("summary").get("byPass").get("2").get("label").asText());

        JsonNode delete = root.get("actions").get(0);
        assertEquals("delete", delete.get("type").asText());
        assertEquals("pending", delete.get("status").asText());
        assertEquals("Unknown", delete.get("targets").get(0).get("name").asText());
        assertFalse(delete.has("canonical"));
        assertFalse(delete.has("evidence"));

        JsonNode merge = root.get("actions").get(1);
        assertEquals("merge", merge.get("type").asText());
        assertEquals(3, merge.get("canonical").get("id").asLong());
        assertFalse(merge.has("targets"));
    }

    @Test
    @DisplayName("Statuses should survive a save and reload")
    void statusesPersist() {
        JsonPlanStore store = new JsonPlanStore(dir.resolve("nested").resolve("plan.json"));
        DeduplicationPlan plan = plan();
        plan.getActions().get(0).markExecuted();
        store.save(plan);

        DeduplicationPlan loaded = store.load();

        assertEquals(ActionStatus.EXECUTED, loaded.getActions().get(0).getStatus());
        assertEquals(ActionStatus.PENDING, loaded.getActions().get(1).getStatus());
        assertEquals(plan.getCreatedAt(), loaded.getCreatedAt());
        assertEquals(1, loaded.getPendingActions().size());
        assertFalse(Files.exists(dir.resolve("nested").resolve("plan.json.tmp")));
    }

    @Test
    @DisplayName("A reviewer's rejected status and unknown fields should be accepted")
    void handEditedPlan() throws Exception {
        Path file = dir.resolve("plan.json");
        Files.writeString(file, """
                {
                  "createdAt": "2024-01-01T00:00:00Z",
                  "personCountBefore": 3,
                  "reviewer": "ops",
                  "actions": [
                    {"id": 1, "pass": 3, "type": "delete", "reason": "single-word name",
                     "targets": [{"id": 5, "name": "Kellen"}], "status": "Rejected"}
                  ]
                }
                """);

        DeduplicationPlan loaded = new JsonPlanStore(file).load();

        assertEquals(ActionStatus.REJECTED, loaded.getActions().get(0).getStatus());
        assertEquals(1, loaded.getSummary().totalActions());
        assertTrue(loaded.getPendingActions().isEmpty());
    }

    @Test
    @DisplayName("A missing plan file should raise PlanStoreException")
    void missingFile() {
        JsonPlanStore store = new JsonPlanStore(dir.resolve("absent.json"));

        assertFalse(store.exists());
        PlanStoreException e = assertThrows(PlanStoreException.class, store::load);
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    @DisplayName("A malformed plan file should raise PlanStoreException")
    void malformedFile() throws Exception {
        Path file = dir.resolve("plan.json");
        Files.writeString(file, "{\"createdAt\": \"2024\", \"actions\": [");

        assertThrows(PlanStoreException.class, () -> new JsonPlanStore(file).load());
    }

    @Test
    @DisplayName("An unknown action type should raise PlanStoreException")
    void unknownType() throws Exception {
        Path file = dir.resolve("plan.json");
        Files.writeString(file, """
                {"createdAt": "2024", "personCountBefore": 1,
                 "actions": [{"id": 1, "pass": 0, "type": "rename", "status": "pending"}]}
                """);

        assertThrows(PlanStoreException.class, () -> new JsonPlanStore(file).load());
    }
}
