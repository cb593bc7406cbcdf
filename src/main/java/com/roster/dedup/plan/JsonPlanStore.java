package com.roster.dedup.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Stores a plan as pretty-printed JSON in a single file.
 * Writes go to a sibling temporary file first and are moved into place, so a crash while
 * saving leaves the previous checkpoint intact.
 */
public class JsonPlanStore implements PlanStore {
    private static final Logger log = LoggerFactory.getLogger(JsonPlanStore.class);

    public static final Path DEFAULT_PATH = Path.of("data", "dedup-plan.json");

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonPlanStore(Path path) {
        this(path, defaultObjectMapper());
    }

    public JsonPlanStore(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public void save(DeduplicationPlan plan) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            Files.writeString(tmp, objectMapper.writeValueAsString(plan), StandardCharsets.UTF_8);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            log.debug("plan.saved path={} actions={}", path, plan.getActions().size());
        } catch (IOException e) {
            throw new PlanStoreException("Failed to write plan to " + path, e);
        }
    }

    @Override
    public DeduplicationPlan load() {
        if (!Files.exists(path)) {
            throw new PlanStoreException("Plan file not found: " + path + " (run a dry-run first)");
        }
        try {
            DeduplicationPlan plan = objectMapper.readValue(
                    Files.readString(path, StandardCharsets.UTF_8), DeduplicationPlan.class);
            log.info("plan.loaded path={} actions={} pending={}",
                    path, plan.getActions().size(), plan.countByStatus(ActionStatus.PENDING));
            return plan;
        } catch (JsonProcessingException e) {
            throw new PlanStoreException("Malformed plan file " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new PlanStoreException("Failed to read plan from " + path, e);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new PlanStoreException("Invalid plan file " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean exists() {
        return Files.exists(path);
    }

    @Override
    public String location() {
        return path.toString();
    }

    public Path getPath() {
        return path;
    }
}
