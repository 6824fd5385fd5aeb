package com.metallisense.orchestrator.capability;

import com.metallisense.common.grade.GradeRegistry;
import com.metallisense.common.model.Composition;
import com.metallisense.orchestrator.PipelineFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GradeCentroidScoringModelTest {

    private final GradeCentroidScoringModel model = PipelineFixtures.scoringModel(GradeRegistry.defaults());

    private static Composition greyMidpoint() {
        return Composition.of(PipelineFixtures.melt(88.5, 3.15, 1.75, 0.8, 0.085, 0.07));
    }

    @Test
    @DisplayName("midpoint of the target grade → score 0")
    void targetMidpoint() {
        assertEquals(0.0, model.score(greyMidpoint(), "GREY-IRON"), 1e-9);
    }

    @Test
    @DisplayName("reading near another grade → scored against the target, not the nearest")
    void targetOverridesNearest() {
        assertEquals(0.0, model.score(greyMidpoint()), 1e-9);
        assertTrue(model.score(greyMidpoint(), "SG-IRON") < -2.0);
    }

    @Test
    @DisplayName("no target or unknown target → nearest reference grade")
    void fallbackToNearest() {
        Composition melt = Composition.of(PipelineFixtures.sgIronMelt());
        assertEquals(model.score(melt), model.score(melt, null));
        assertEquals(model.score(melt), model.score(melt, "UNKNOWN-GRADE"));
    }

    @Test
    @DisplayName("element moved away from the target midpoint → score strictly decreases")
    void monotonicInDeviation() {
        double previous = 0.0;
        for (int step = 1; step <= 5; step++) {
            Composition melt = Composition.of(PipelineFixtures.melt(86.0, 3.5, 2.3, 0.65, 0.045, 0.02 + step * 0.01));
            double current = model.score(melt, "SG-IRON");
            assertTrue(current < previous, "step " + step);
            previous = current;
        }
    }
}
