package com.metallisense.common.grade;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.metallisense.common.model.Element;
import com.metallisense.common.model.ElementRange;
import com.metallisense.common.model.GradeSpec;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON persistence for the grade table.
 *
 * <p>Document shape:
 * <pre>
 * {
 *   "SG-IRON": {
 *     "grade": "SG-IRON",
 *     "description": "...",
 *     "composition_ranges": { "Fe": [82.0, 90.0], "C": [3.0, 4.0], ... }
 *   }
 * }
 * </pre>
 */
public final class GradeSpecStore {

    private static final TypeReference<LinkedHashMap<String, GradeDocument>> DOCUMENT_TYPE =
        new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public GradeSpecStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public GradeRegistry load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read grade specifications from " + path, e);
        }
    }

    public GradeRegistry load(InputStream in) {
        Map<String, GradeDocument> document;
        try {
            document = objectMapper.readValue(in, DOCUMENT_TYPE);
        } catch (IOException e) {
            throw new UncheckedIOException("Malformed grade specification document", e);
        }
        List<GradeSpec> specs = new ArrayList<>();
        document.forEach((key, doc) -> specs.add(toSpec(key, doc)));
        return new GradeRegistry(specs);
    }

    public void save(GradeRegistry registry, Path path) {
        Map<String, GradeDocument> document = new LinkedHashMap<>();
        for (GradeSpec spec : registry.allSpecs()) {
            document.put(spec.grade(), GradeDocument.from(spec));
        }
        try {
            objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(path.toFile(), document);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write grade specifications to " + path, e);
        }
    }

    private static GradeSpec toSpec(String key, GradeDocument doc) {
        String grade = doc.grade() != null ? doc.grade() : key;
        if (!grade.equals(key)) {
            throw new IllegalArgumentException("Grade key " + key + " does not match grade field " + grade);
        }
        Map<Element, ElementRange> ranges = new EnumMap<>(Element.class);
        if (doc.compositionRanges() != null) {
            doc.compositionRanges().forEach((symbol, bounds) -> {
                Element element = Element.fromSymbol(symbol);
                if (element == null) {
                    throw new IllegalArgumentException("Grade " + grade + " references unknown element " + symbol);
                }
                if (bounds == null || bounds.size() != 2 || bounds.contains(null)) {
                    throw new IllegalArgumentException(
                        "Grade " + grade + " range for " + symbol + " must be [min, max]");
                }
                ranges.put(element, new ElementRange(bounds.get(0), bounds.get(1)));
            });
        }
        return new GradeSpec(grade, doc.description(), ranges);
    }
}
