package com.metallisense.common.grade;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.metallisense.common.model.GradeSpec;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serialized form of a {@link GradeSpec}: ranges keyed by element symbol as {@code [min, max]}.
 */
public record GradeDocument(
    @JsonProperty("grade") String grade,
    @JsonProperty("description") String description,
    @JsonProperty("composition_ranges") Map<String, List<Double>> compositionRanges
) {
    public static GradeDocument from(GradeSpec spec) {
        Map<String, List<Double>> ranges = new LinkedHashMap<>();
        spec.ranges().forEach((element, range) ->
            ranges.put(element.symbol(), List.of(range.min(), range.max())));
        return new GradeDocument(spec.grade(), spec.description(), ranges);
    }
}
