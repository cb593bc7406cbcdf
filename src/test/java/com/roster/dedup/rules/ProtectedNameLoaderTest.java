package com.roster.dedup.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProtectedNameLoader Tests")
class ProtectedNameLoaderTest {

    private final ProtectedNameLoader loader = new ProtectedNameLoader();

    @Test
    @DisplayName("Should load objects with a name field and plain strings")
    void loadsRoster() throws URISyntaxException {
        Path path = Path.of(getClass().getClassLoader().getResource("fixtures/protected-names.json").toURI());

        ProtectedNames names = loader.load(path);

        assertEquals(4, names.size());
        assertTrue(names.isProtected("Ghislaine Maxwell"));
        assertTrue(names.isProtected("Sarah Kellen"));
        assertTrue(names.isProtected("Jane Roe"));
    }

    @Test
    @DisplayName("Membership should be tested on the normalized form")
    void matchesNormalizedVariants() {
        ProtectedNames names = ProtectedNames.of(List.of("Ghislaine Maxwell"));

        assertTrue(names.isProtected("MAXWELL, GHISLAINE"));
        assertTrue(names.isProtected("ghislaine maxwell"));
        assertFalse(names.isProtected("G. Maxwell"));
        assertFalse(names.isProtected(null));
    }

    @Test
    @DisplayName("Missing file should yield an empty roster")
    void missingFileYieldsEmpty(@TempDir Path dir) {
        ProtectedNames names = loader.load(dir.resolve("absent.json"));

        assertEquals(0, names.size());
        assertFalse(names.isProtected("Ghislaine Maxwell"));
        assertEquals(0, loader.load(null).size());
    }

    @Test
    @DisplayName("A JSON object instead of an array should be rejected")
    void rejectsNonArray(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("roster.json");
        Files.writeString(file, "{\"name\": \"Ghislaine Maxwell\"}");

        assertThrows(RuleLoadException.class, () -> loader.load(file));
    }

    @Test
    @DisplayName("Unparseable JSON should be rejected")
    void rejectsMalformedJson(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("roster.json");
        Files.writeString(file, "[{\"name\": ");

        assertThrows(RuleLoadException.class, () -> loader.load(file));
    }

    @Test
    @DisplayName("Blank names should be ignored")
    void ignoresBlankNames() {
        ProtectedNames names = ProtectedNames.of(List.of("", "  ", "Dr.", "Sarah Kellen"));

        assertEquals(1, names.size());
    }
}
