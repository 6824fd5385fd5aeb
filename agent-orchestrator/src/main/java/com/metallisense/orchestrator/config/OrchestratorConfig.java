package com.metallisense.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.metallisense.common.anomaly.AnomalyEvaluator;
import com.metallisense.common.anomaly.ScoringModel;
import com.metallisense.common.correction.CorrectionRecommender;
import com.metallisense.common.correction.RegressionModel;
import com.metallisense.common.grade.GradeRegistry;
import com.metallisense.common.grade.GradeSpecStore;
import com.metallisense.common.model.PipelineSettings;
import com.metallisense.orchestrator.capability.ModelArtifactLoader;
import com.metallisense.orchestrator.pipeline.PipelineContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

@Configuration
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Value("${metallisense.grades.location:classpath:grades/grade-specs.json}")
    private String gradesLocation;

    @Value("${metallisense.models.scoring-artifact:classpath:models/scoring-model.json}")
    private String scoringArtifact;

    @Value("${metallisense.models.regression-artifact:classpath:models/regression-model.json}")
    private String regressionArtifact;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public PipelineSettings pipelineSettings(
            @Value("${metallisense.anomaly.medium-threshold:0.33}") double mediumThreshold,
            @Value("${metallisense.anomaly.high-threshold:0.66}") double highThreshold,
            @Value("${metallisense.correction.max-addition-percentage:5.0}") double maxAdditionPercentage,
            @Value("${metallisense.correction.significance-floor:0.01}") double significanceFloor,
            @Value("${metallisense.correction.min-confidence-threshold:0.5}") double minConfidenceThreshold,
            @Value("${metallisense.correction.large-addition-threshold:3.0}") double largeAdditionThreshold) {
        PipelineSettings settings = new PipelineSettings(mediumThreshold, highThreshold, maxAdditionPercentage,
            significanceFloor, minConfidenceThreshold, largeAdditionThreshold);
        log.info("[Config] Pipeline settings loaded. {}", settings);
        return settings;
    }

    /**
     * Grade table from {@code metallisense.grades.location}. The built-in table is used
     * when nothing exists there; a document that exists but is malformed stops startup.
     */
    @Bean
    public GradeRegistry gradeRegistry(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        Resource resource = resourceLoader.getResource(gradesLocation);
        if (!resource.exists()) {
            log.warn("[Config] No grade document at {}. Using built-in grades.", gradesLocation);
            return GradeRegistry.defaults();
        }
        try (InputStream in = resource.getInputStream()) {
            GradeRegistry registry = new GradeSpecStore(objectMapper).load(in);
            log.info("[Config] Grades loaded. location={} grades={}", gradesLocation, registry.availableGrades());
            return registry;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read grade document " + gradesLocation, e);
        }
    }

    @Bean
    public ScoringModel scoringModel(ModelArtifactLoader loader, GradeRegistry gradeRegistry) {
        return loader.loadScoringModel(scoringArtifact, gradeRegistry);
    }

    @Bean
    public RegressionModel regressionModel(ModelArtifactLoader loader, GradeRegistry gradeRegistry) {
        return loader.loadRegressionModel(regressionArtifact, gradeRegistry);
    }

    @Bean
    public AnomalyEvaluator anomalyEvaluator(ScoringModel scoringModel, PipelineSettings settings) {
        return new AnomalyEvaluator(scoringModel, settings);
    }

    @Bean
    public CorrectionRecommender correctionRecommender(RegressionModel regressionModel,
                                                       GradeRegistry gradeRegistry, PipelineSettings settings) {
        return new CorrectionRecommender(regressionModel, gradeRegistry, settings);
    }

    @Bean
    public PipelineContext pipelineContext(GradeRegistry gradeRegistry, ScoringModel scoringModel,
                                           RegressionModel regressionModel, PipelineSettings settings) {
        return new PipelineContext(gradeRegistry, scoringModel, regressionModel, settings);
    }
}
