package com.metallisense.common.grade;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metallisense.common.model.Element;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GradeSpecStoreTest {

    private final GradeSpecStore store = new GradeSpecStore(new ObjectMapper());

    private static ByteArrayInputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("saved registry loads back as an equivalent new instance")
    void saveAndLoad(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("grades.json");
        GradeRegistry original = GradeRegistry.defaults();

        store.save(original, file);
        String written = Files.readString(file);
        assertTrue(written.contains("\"composition_ranges\""));

        GradeRegistry loaded = store.load(file);
        assertNotSame(original, loaded);
        assertEquals(original.availableGrades(), loaded.availableGrades());
        assertEquals(original.getSpec("HIGH-CARBON-STEEL"), loaded.getSpec("HIGH-CARBON-STEEL"));
    }

    @Test
    @DisplayName("document with a partial element table loads only those ranges")
    void partialRanges() {
        GradeRegistry registry = store.load(json("""
            {"TEST": {"grade": "TEST", "description": "test grade",
                      "composition_ranges": {"Fe": [80.0, 90.0], "C": [1.0, 2.0]}}}
            """));
        assertEquals(2, registry.getSpec("TEST").ranges().size());
        assertNull(registry.getSpec("TEST").rangeOf(Element.SI));
    }

    @Test
    @DisplayName("key that disagrees with the grade field → rejected")
    void mismatchedKey() {
        assertThrows(IllegalArgumentException.class, () -> store.load(json("""
            {"A": {"grade": "B", "description": "", "composition_ranges": {"Fe": [80.0, 90.0]}}}
            """)));
    }

    @Test
    @DisplayName("unknown element, short or null bounds → rejected")
    void malformedRanges() {
        assertThrows(IllegalArgumentException.class, () -> store.load(json("""
            {"A": {"grade": "A", "description": "", "composition_ranges": {"Xx": [1.0, 2.0]}}}
            """)));
        assertThrows(IllegalArgumentException.class, () -> store.load(json("""
            {"A": {"grade": "A", "description": "", "composition_ranges": {"Fe": [1.0]}}}
            """)));
        assertThrows(IllegalArgumentException.class, () -> store.load(json("""
            {"A": {"grade": "A", "description": "", "composition_ranges": {"Fe": [null, 2.0]}}}
            """)));
    }

    @Test
    @DisplayName("missing file → UncheckedIOException")
    void missingFile(@TempDir Path dir) {
        assertThrows(UncheckedIOException.class, () -> store.load(dir.resolve("absent.json")));
    }
}
