package com.metallisense.common.grade;

import com.metallisense.common.exception.UnknownGradeException;
import com.metallisense.common.model.Composition;
import com.metallisense.common.model.Element;
import com.metallisense.common.model.ElementRange;
import com.metallisense.common.model.GradeSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GradeRegistryTest {

    private final GradeRegistry registry = GradeRegistry.defaults();

    static Composition sgIronMidpoint() {
        return Composition.of(Map.of("Fe", 86.0, "C", 3.5, "Si", 2.3, "Mn", 0.65, "P", 0.045, "S", 0.02));
    }

    @Nested
    @DisplayName("lookup")
    class Lookup {

        @Test
        @DisplayName("defaults list the five foundry grades in registration order")
        void availableGrades() {
            assertEquals(List.of("SG-IRON", "GREY-IRON", "LOW-CARBON-STEEL",
                    "MEDIUM-CARBON-STEEL", "HIGH-CARBON-STEEL"),
                registry.availableGrades());
        }

        @Test
        @DisplayName("getSpec returns the grade's ranges")
        void getSpec() {
            GradeSpec spec = registry.getSpec("GREY-IRON");
            assertEquals(new ElementRange(85.0, 92.0), spec.rangeOf(Element.FE));
            assertEquals(new ElementRange(0.02, 0.12), spec.rangeOf(Element.S));
        }

        @Test
        @DisplayName("unknown grade → UnknownGradeException listing available grades")
        void unknownGrade() {
            UnknownGradeException e =
                assertThrows(UnknownGradeException.class, () -> registry.getSpec("UNOBTAINIUM"));
            assertEquals("UNOBTAINIUM", e.getGrade());
            assertTrue(e.getMessage().contains("Unknown grade: UNOBTAINIUM"));
            assertTrue(e.getMessage().contains("SG-IRON"));
        }

        @Test
        @DisplayName("null grade → UnknownGradeException, contains() is false")
        void nullGrade() {
            assertThrows(UnknownGradeException.class, () -> registry.getSpec(null));
            assertFalse(registry.contains(null));
        }

        @Test
        @DisplayName("duplicate grade identifiers are rejected")
        void duplicates() {
            GradeSpec spec = registry.getSpec("SG-IRON");
            assertThrows(IllegalArgumentException.class, () -> new GradeRegistry(List.of(spec, spec)));
        }
    }

    @Nested
    @DisplayName("derived queries")
    class Derived {

        @Test
        @DisplayName("midpoint is (min + max) / 2 per element")
        void midpoint() {
            Map<Element, Double> midpoint = registry.getMidpoint("SG-IRON");
            assertEquals(86.0, midpoint.get(Element.FE), 1e-9);
            assertEquals(3.5, midpoint.get(Element.C), 1e-9);
            assertEquals(0.045, midpoint.get(Element.P), 1e-9);
        }

        @Test
        @DisplayName("composition at the midpoint is in spec for every element")
        void midpointInSpec() {
            Map<Element, Boolean> inSpec = registry.isInSpec("SG-IRON", sgIronMidpoint());
            assertEquals(6, inSpec.size());
            assertTrue(inSpec.values().stream().allMatch(Boolean::booleanValue));
        }

        @Test
        @DisplayName("range bounds are inclusive")
        void inclusiveBounds() {
            Composition atBounds = Composition.of(
                Map.of("Fe", 85.0, "C", 3.8, "Si", 1.0, "Mn", 1.2, "P", 0.02, "S", 0.12));
            assertTrue(registry.isInSpec("GREY-IRON", atBounds).values().stream().allMatch(Boolean::booleanValue));
        }

        @Test
        @DisplayName("Fe above range is flagged alone")
        void feAboveRange() {
            Composition composition = Composition.of(
                Map.of("Fe", 93.5, "C", 3.2, "Si", 2.1, "Mn", 0.65, "P", 0.08, "S", 0.12));
            Map<Element, Boolean> inSpec = registry.isInSpec("GREY-IRON", composition);
            assertFalse(inSpec.get(Element.FE));
            assertTrue(inSpec.get(Element.C));
            assertTrue(inSpec.get(Element.S));
        }

        @Test
        @DisplayName("elements a grade does not constrain are skipped")
        void unconstrainedElementsSkipped() {
            Map<Element, ElementRange> ranges = new EnumMap<>(Element.class);
            ranges.put(Element.FE, new ElementRange(80.0, 90.0));
            GradeRegistry partial = new GradeRegistry(List.of(new GradeSpec("FE-ONLY", "Iron only", ranges)));
            Map<Element, Boolean> inSpec = partial.isInSpec("FE-ONLY", sgIronMidpoint());
            assertEquals(Map.of(Element.FE, true), inSpec);
        }

        @Test
        @DisplayName("deviation is composition minus midpoint, signed")
        void deviation() {
            Composition composition = Composition.of(
                Map.of("Fe", 81.2, "C", 4.4, "Si", 3.1, "Mn", 0.4, "P", 0.04, "S", 0.02));
            Map<Element, Double> deviation = registry.getDeviation("SG-IRON", composition);
            assertEquals(-4.8, deviation.get(Element.FE), 1e-9);
            assertEquals(0.9, deviation.get(Element.C), 1e-9);
            assertEquals(0.0, deviation.get(Element.S), 1e-9);
        }
    }
}
