package com.metallisense.orchestrator.capability;

import com.metallisense.common.anomaly.ScoreCalibration;
import com.metallisense.common.anomaly.ScoringModel;
import com.metallisense.common.model.Composition;
import com.metallisense.common.model.Element;
import com.metallisense.common.model.ElementRange;
import com.metallisense.common.model.GradeSpec;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Scores a reading by its distance to a reference grade.
 *
 * <p>For a reference grade the per-element deviation from the range midpoint is
 * scaled by the range half-width; the grade distance is the RMS of those scaled
 * deviations. When the reading names its target grade the raw score is the negated
 * distance to that grade, so moving any element away from the target midpoint never
 * raises the score. Without a target, or for a grade outside the references, the
 * nearest reference grade is used.
 *
 * <p>Immutable after construction; safe for concurrent use.
 */
public class GradeCentroidScoringModel implements ScoringModel {

    public static final String MODEL_TYPE = "grade-centroid";

    // Guards zero-width ranges.
    private static final double MIN_SCALE = 1e-6;

    private final List<GradeSpec> references;
    private final Map<String, GradeSpec> referencesByGrade;
    private final ScoreCalibration calibration;
    private final Map<String, Object> metadata;

    public GradeCentroidScoringModel(List<GradeSpec> references, ScoreCalibration calibration,
                                     String version, String source) {
        if (references.isEmpty()) {
            throw new IllegalArgumentException("At least one reference grade is required");
        }
        this.references        = List.copyOf(references);
        this.referencesByGrade = this.references.stream()
            .collect(Collectors.toUnmodifiableMap(GradeSpec::grade, spec -> spec, (first, second) -> first));
        this.calibration       = calibration;

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("model_type", MODEL_TYPE);
        meta.put("version", version);
        meta.put("source", source);
        meta.put("reference_grades", this.references.stream().map(GradeSpec::grade).toList());
        meta.put("score_min", calibration.scoreMin());
        meta.put("score_max", calibration.scoreMax());
        this.metadata = Map.copyOf(meta);
    }

    @Override
    public double score(Composition composition, String grade) {
        GradeSpec target = grade == null ? null : referencesByGrade.get(grade);
        return target == null ? score(composition) : -distance(target, composition);
    }

    @Override
    public double score(Composition composition) {
        double nearest = Double.POSITIVE_INFINITY;
        for (GradeSpec reference : references) {
            nearest = Math.min(nearest, distance(reference, composition));
        }
        return -nearest;
    }

    /** RMS of midpoint deviations scaled by half-width over the grade's ranged elements. */
    static double distance(GradeSpec reference, Composition composition) {
        double sumSquares = 0.0;
        int count = 0;
        for (Element element : Element.values()) {
            ElementRange range = reference.rangeOf(element);
            if (range == null) continue;
            double scale = Math.max(range.halfWidth(), MIN_SCALE);
            double z = (composition.get(element) - range.midpoint()) / scale;
            sumSquares += z * z;
            count++;
        }
        return count == 0 ? 0.0 : Math.sqrt(sumSquares / count);
    }

    @Override
    public ScoreCalibration calibration() {
        return calibration;
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
