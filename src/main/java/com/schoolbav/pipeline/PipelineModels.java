package com.schoolbav.pipeline;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public class PipelineModels {
    public record StageResult(Stage stage, List<String> academicYears, int rowsWritten, Map<String, Object> summary) {}

    public record PipelineRunReport(String runId,
                                    Instant startedAt,
                                    Instant completedAt,
                                    List<String> academicYears,
                                    List<StageResult> stages) {}
}
