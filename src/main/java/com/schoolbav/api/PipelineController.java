package com.schoolbav.api;

import com.schoolbav.pipeline.PipelineModels;
import com.schoolbav.pipeline.PipelineService;
import com.schoolbav.pipeline.Stage;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/pipeline")
public class PipelineController {
    private final PipelineService pipelineService;

    public PipelineController(PipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @PostMapping("/run")
    public ResponseEntity<PipelineModels.PipelineRunReport> runAll() {
        return ResponseEntity.ok(pipelineService.runAll());
    }

    /** {@code stage} is a stage name such as {@code risk-score}; {@code years} defaults to all years. */
    @PostMapping("/stages/{stage}")
    public ResponseEntity<PipelineModels.StageResult> runStage(@PathVariable String stage,
                                                               @RequestParam(required = false) List<String> years) {
        Stage target = Stage.valueOf(stage.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        return ResponseEntity.ok(pipelineService.runStage(target, years));
    }
}
