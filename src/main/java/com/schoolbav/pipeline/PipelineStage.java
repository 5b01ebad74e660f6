package com.schoolbav.pipeline;

import java.util.List;

public interface PipelineStage {
    Stage stage();

    /**
     * Recomputes this stage's outputs for the given academic years, replacing any previous values.
     * Safe to call again after a failure.
     *
     * @throws StageOrderingException when an upstream stage has not populated a requested year
     */
    PipelineModels.StageResult run(List<String> academicYears);
}
