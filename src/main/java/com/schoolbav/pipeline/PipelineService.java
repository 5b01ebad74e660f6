package com.schoolbav.pipeline;

import com.schoolbav.repository.FactJdbcRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;

/**
 * Runs the stages in dependency order. Runs are serialised: the pipeline is a single writer.
 */
@Service
@Slf4j
public class PipelineService {
    private final Map<Stage, PipelineStage> stages = new EnumMap<>(Stage.class);
    private final FactJdbcRepository facts;

    public PipelineService(List<PipelineStage> stages, FactJdbcRepository facts) {
        for (PipelineStage stage : stages) {
            PipelineStage previous = this.stages.put(stage.stage(), stage);
            if (previous != null) {
                throw new IllegalStateException("Two implementations registered for stage " + stage.stage());
            }
        }
        EnumSet<Stage> missing = EnumSet.allOf(Stage.class);
        missing.removeAll(this.stages.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No implementation registered for stages " + missing);
        }
        this.facts = facts;
    }

    /** Every stage, in order, over every academic year present in the enrolment facts. */
    public synchronized PipelineModels.PipelineRunReport runAll() {
        List<String> years = facts.distinctYears();
        String runId = UUID.randomUUID().toString();
        Instant startedAt = Instant.now();
        if (years.isEmpty()) {
            log.warn("Pipeline run {}: no academic years in yearly_metrics, nothing to compute", runId);
            return new PipelineModels.PipelineRunReport(runId, startedAt, Instant.now(), years, List.of());
        }

        log.info("Pipeline run {} started for years {}", runId, years);
        List<PipelineModels.StageResult> results = new ArrayList<>();
        for (Stage stage : Stage.values()) {
            results.add(execute(stage, years));
        }
        Instant completedAt = Instant.now();
        log.info("Pipeline run {} completed in {} ms", runId, completedAt.toEpochMilli() - startedAt.toEpochMilli());
        return new PipelineModels.PipelineRunReport(runId, startedAt, completedAt, years, results);
    }

    /** One stage over {@code academicYears}, or over every known year when none are given. */
    public synchronized PipelineModels.StageResult runStage(Stage stage, List<String> academicYears) {
        List<String> years = academicYears == null || academicYears.isEmpty()
                ? facts.distinctYears()
                : academicYears.stream().distinct().sorted().toList();
        return execute(stage, years);
    }

    private PipelineModels.StageResult execute(Stage stage, List<String> years) {
        long started = System.currentTimeMillis();
        log.info("Stage {} started for {} year(s)", stage, years.size());
        try {
            PipelineModels.StageResult result = stages.get(stage).run(years);
            log.info("Stage {} finished in {} ms: {}", stage, System.currentTimeMillis() - started, result.summary());
            return result;
        } catch (StageOrderingException e) {
            log.error("Stage {} stopped: {}", stage, e.getMessage());
            throw e;
        }
    }
}
