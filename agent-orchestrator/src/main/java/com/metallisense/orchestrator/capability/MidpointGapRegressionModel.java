package com.metallisense.orchestrator.capability;

import com.metallisense.common.correction.RegressionModel;
import com.metallisense.common.model.Composition;
import com.metallisense.common.model.Element;
import com.metallisense.common.model.ElementRange;
import com.metallisense.common.model.GradeSpec;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Predicts, per element, the gap between the grade midpoint and the reading.
 * Elements above midpoint produce negative values; the recommender floors them.
 */
public class MidpointGapRegressionModel implements RegressionModel {

    public static final String MODEL_TYPE = "midpoint-gap";

    private final Map<String, Integer> gradeIds;
    private final Map<Integer, GradeSpec> specsById;
    private final Map<String, Object> metadata;

    /**
     * @param gradeIds encoding learned at training time
     * @param specs    grade specification for every encoded grade, keyed by grade name
     */
    public MidpointGapRegressionModel(Map<String, Integer> gradeIds, Map<String, GradeSpec> specs,
                                      String version, String source) {
        Map<Integer, GradeSpec> byId = new HashMap<>();
        gradeIds.forEach((grade, id) -> {
            GradeSpec spec = specs.get(grade);
            if (spec == null) {
                throw new IllegalArgumentException("No grade specification for encoded grade " + grade);
            }
            if (byId.put(id, spec) != null) {
                throw new IllegalArgumentException("Grade id " + id + " is assigned more than once");
            }
        });
        this.gradeIds  = Map.copyOf(gradeIds);
        this.specsById = Map.copyOf(byId);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("model_type", MODEL_TYPE);
        meta.put("version", version);
        meta.put("source", source);
        meta.put("available_grades", gradeIds.keySet().stream().sorted().toList());
        this.metadata = Map.copyOf(meta);
    }

    @Override
    public double[] predict(int gradeId, Composition composition) {
        GradeSpec spec = specsById.get(gradeId);
        if (spec == null) {
            throw new IllegalArgumentException("Unknown grade id " + gradeId);
        }
        double[] gaps = new double[Element.values().length];
        for (Element element : Element.values()) {
            ElementRange range = spec.rangeOf(element);
            gaps[element.ordinal()] = range == null ? 0.0 : range.midpoint() - composition.get(element);
        }
        return gaps;
    }

    @Override
    public Map<String, Integer> gradeIds() {
        return gradeIds;
    }

    @Override
    public boolean isReady() {
        return true;
    }

    @Override
    public Map<String, Object> metadata() {
        return metadata;
    }
}
