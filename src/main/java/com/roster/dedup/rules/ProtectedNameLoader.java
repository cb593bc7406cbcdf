package com.roster.dedup.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the protected-name roster from a JSON file.
 *
 * <p>Expected format is an array whose elements are either objects with a {@code name}
 * field or plain strings:</p>
 * <pre>
 * [
 *   {"name": "Ghislaine Maxwell", "category": "key figure"},
 *   "Jeffrey Epstein"
 * ]
 * </pre>
 *
 * <p>A missing file is not an error: the run proceeds with an empty roster and a warning.</p>
 */
public class ProtectedNameLoader {
    private static final Logger log = LoggerFactory.getLogger(ProtectedNameLoader.class);

    private final ObjectMapper objectMapper;

    public ProtectedNameLoader() {
        this(new ObjectMapper());
    }

    public ProtectedNameLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads the roster from {@code path}, or returns an empty roster if the path is null or absent.
     *
     * @throws RuleLoadException if the file exists but is not a JSON array
     */
    public ProtectedNames load(Path path) {
        if (path == null || !Files.exists(path)) {
            log.warn("protected.names.missing path={} - no protected names loaded", path);
            return ProtectedNames.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new RuleLoadException("Unreadable protected-name file: " + path, e);
        }
        if (root == null || !root.isArray()) {
            throw new RuleLoadException("Protected-name file must contain a JSON array: " + path);
        }

        List<String> names = new ArrayList<>();
        for (JsonNode element : root) {
            if (element.isTextual()) {
                names.add(element.asText());
            } else if (element.hasNonNull("name")) {
                names.add(element.get("name").asText());
            }
        }

        ProtectedNames roster = ProtectedNames.of(names);
        log.info("protected.names.loaded path={} count={}", path, roster.size());
        return roster;
    }
}
