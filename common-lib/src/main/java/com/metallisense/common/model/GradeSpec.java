package com.metallisense.common.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Named target specification for a metal grade: an inclusive range per element.
 * Elements without a range are not constrained by the grade.
 */
public record GradeSpec(String grade, String description, Map<Element, ElementRange> ranges) {

    public GradeSpec {
        if (grade == null || grade.isBlank()) {
            throw new IllegalArgumentException("Grade identifier is required");
        }
        ranges = Collections.unmodifiableMap(ranges.isEmpty()
            ? new EnumMap<>(Element.class)
            : new EnumMap<>(ranges));
    }

    public ElementRange rangeOf(Element element) {
        return ranges.get(element);
    }

    public Map<Element, Double> midpoints() {
        Map<Element, Double> out = new EnumMap<>(Element.class);
        ranges.forEach((element, range) -> out.put(element, range.midpoint()));
        return Collections.unmodifiableMap(out);
    }
}
