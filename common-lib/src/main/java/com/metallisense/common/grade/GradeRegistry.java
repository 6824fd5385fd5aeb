package com.metallisense.common.grade;

import com.metallisense.common.exception.UnknownGradeException;
import com.metallisense.common.model.Composition;
import com.metallisense.common.model.Element;
import com.metallisense.common.model.ElementRange;
import com.metallisense.common.model.GradeSpec;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only table of metal grades and their per-element ranges.
 *
 * <p>Built once and shared by all requests; reloading means constructing a new
 * registry. Every query is a pure function of the table.
 */
public final class GradeRegistry {

    private final Map<String, GradeSpec> specs;

    public GradeRegistry(Collection<GradeSpec> specs) {
        Map<String, GradeSpec> byGrade = new LinkedHashMap<>();
        for (GradeSpec spec : specs) {
            if (byGrade.putIfAbsent(spec.grade(), spec) != null) {
                throw new IllegalArgumentException("Duplicate grade: " + spec.grade());
            }
        }
        this.specs = Collections.unmodifiableMap(byGrade);
    }

    /** Built-in foundry grades. */
    public static GradeRegistry defaults() {
        return new GradeRegistry(List.of(
            spec("SG-IRON", "Spheroidal Graphite Cast Iron (Ductile Iron)",
                82.0, 90.0, 3.0, 4.0, 1.8, 2.8, 0.3, 1.0, 0.01, 0.08, 0.01, 0.03),
            spec("GREY-IRON", "Grey Cast Iron (General Purpose)",
                85.0, 92.0, 2.5, 3.8, 1.0, 2.5, 0.4, 1.2, 0.02, 0.15, 0.02, 0.12),
            spec("LOW-CARBON-STEEL", "Mild Steel (Carbon < 0.3%)",
                98.0, 99.5, 0.05, 0.25, 0.1, 0.5, 0.3, 0.9, 0.01, 0.04, 0.01, 0.05),
            spec("MEDIUM-CARBON-STEEL", "Medium Carbon Steel (0.3-0.6% C)",
                97.5, 99.0, 0.3, 0.6, 0.15, 0.6, 0.5, 1.5, 0.01, 0.04, 0.01, 0.05),
            spec("HIGH-CARBON-STEEL", "High Carbon Steel (0.6-1.4% C)",
                97.0, 98.5, 0.6, 1.4, 0.2, 0.8, 0.6, 1.8, 0.01, 0.04, 0.01, 0.05)
        ));
    }

    // Bounds are given as min/max pairs in Element order: Fe, C, Si, Mn, P, S.
    private static GradeSpec spec(String grade, String description, double... bounds) {
        Map<Element, ElementRange> ranges = new EnumMap<>(Element.class);
        Element[] elements = Element.values();
        for (int i = 0; i < elements.length; i++) {
            ranges.put(elements[i], new ElementRange(bounds[2 * i], bounds[2 * i + 1]));
        }
        return new GradeSpec(grade, description, ranges);
    }

    /**
     * @throws UnknownGradeException if the grade is not registered
     */
    public GradeSpec getSpec(String grade) {
        GradeSpec spec = grade == null ? null : specs.get(grade);
        if (spec == null) {
            throw new UnknownGradeException(grade, availableGrades());
        }
        return spec;
    }

    public boolean contains(String grade) {
        return grade != null && specs.containsKey(grade);
    }

    /** Grade identifiers in registration order. */
    public List<String> availableGrades() {
        return new ArrayList<>(specs.keySet());
    }

    public Collection<GradeSpec> allSpecs() {
        return specs.values();
    }

    public Map<Element, Double> getMidpoint(String grade) {
        return getSpec(grade).midpoints();
    }

    /**
     * Per-element inclusive range membership. Elements the grade does not
     * constrain are left out of the result.
     */
    public Map<Element, Boolean> isInSpec(String grade, Composition composition) {
        GradeSpec spec = getSpec(grade);
        Map<Element, Boolean> inSpec = new EnumMap<>(Element.class);
        for (Element element : Element.values()) {
            ElementRange range = spec.rangeOf(element);
            if (range == null) continue;
            inSpec.put(element, range.contains(composition.get(element)));
        }
        return inSpec;
    }

    /** Signed {@code composition - midpoint} for every element the grade constrains. */
    public Map<Element, Double> getDeviation(String grade, Composition composition) {
        Map<Element, Double> deviations = new EnumMap<>(Element.class);
        getMidpoint(grade).forEach((element, midpoint) ->
            deviations.put(element, composition.get(element) - midpoint));
        return deviations;
    }
}
