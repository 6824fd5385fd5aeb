package com.metallisense.orchestrator.capability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metallisense.common.anomaly.ScoringModel;
import com.metallisense.common.correction.RegressionModel;
import com.metallisense.common.grade.GradeRegistry;
import com.metallisense.common.model.Element;
import com.metallisense.common.model.GradeSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads trained capabilities from their JSON artifacts once at startup.
 *
 * <p>A missing or malformed artifact does not stop the service: the loader logs the
 * problem and returns an unloaded capability that reports not-ready, so the affected
 * stage degrades to an ERROR result instead of failing every request.
 */
@Component
public class ModelArtifactLoader {

    private static final Logger log = LoggerFactory.getLogger(ModelArtifactLoader.class);

    private static final List<String> ELEMENT_ORDER =
        Arrays.stream(Element.values()).map(Element::symbol).toList();

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public ModelArtifactLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.resourceLoader = resourceLoader;
        this.objectMapper   = objectMapper;
    }

    public ScoringModel loadScoringModel(String location, GradeRegistry gradeRegistry) {
        try {
            ScoringModelArtifact artifact = read(location, ScoringModelArtifact.class);
            if (!GradeCentroidScoringModel.MODEL_TYPE.equals(artifact.modelType())) {
                throw new IllegalArgumentException("Unsupported scoring model type " + artifact.modelType());
            }
            if (artifact.calibration() == null) {
                throw new IllegalArgumentException("Scoring artifact has no calibration");
            }
            List<GradeSpec> references = new ArrayList<>();
            for (String grade : Objects.requireNonNullElse(artifact.referenceGrades(), List.<String>of())) {
                references.add(gradeRegistry.getSpec(grade));
            }
            ScoringModel model = new GradeCentroidScoringModel(references, artifact.calibration(),
                Objects.requireNonNullElse(artifact.version(), "unknown"), location);
            log.info("[ModelArtifactLoader] Scoring model loaded. location={} referenceGrades={} calibration={}",
                location, references.size(), artifact.calibration());
            return model;
        } catch (IOException | RuntimeException e) {
            log.error("[ModelArtifactLoader] Scoring model unavailable. location={}", location, e);
            return new UnloadedScoringModel("Scoring model not loaded from " + location + ": " + e.getMessage());
        }
    }

    public RegressionModel loadRegressionModel(String location, GradeRegistry gradeRegistry) {
        try {
            RegressionModelArtifact artifact = read(location, RegressionModelArtifact.class);
            if (!MidpointGapRegressionModel.MODEL_TYPE.equals(artifact.modelType())) {
                throw new IllegalArgumentException("Unsupported regression model type " + artifact.modelType());
            }
            if (artifact.elements() != null && !ELEMENT_ORDER.equals(artifact.elements())) {
                throw new IllegalArgumentException("Regression output order " + artifact.elements()
                    + " does not match " + ELEMENT_ORDER);
            }
            Map<String, Integer> gradeIds = Objects.requireNonNullElse(artifact.gradeIds(), Map.of());
            Map<String, GradeSpec> specs = new LinkedHashMap<>();
            for (String grade : gradeIds.keySet()) {
                specs.put(grade, gradeRegistry.getSpec(grade));
            }
            RegressionModel model = new MidpointGapRegressionModel(gradeIds, specs,
                Objects.requireNonNullElse(artifact.version(), "unknown"), location);
            log.info("[ModelArtifactLoader] Regression model loaded. location={} grades={}",
                location, gradeIds.keySet());
            return model;
        } catch (IOException | RuntimeException e) {
            log.error("[ModelArtifactLoader] Regression model unavailable. location={}", location, e);
            return new UnloadedRegressionModel("Regression model not loaded from " + location + ": " + e.getMessage());
        }
    }

    private <T> T read(String location, Class<T> type) throws IOException {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IOException("Model artifact not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, type);
        }
    }
}
