package com.schoolbav.trend;

import com.schoolbav.domain.DomainModels.TrendDirection;
import com.schoolbav.pipeline.PipelineModels;
import com.schoolbav.pipeline.PipelineStage;
import com.schoolbav.pipeline.Stage;
import com.schoolbav.pipeline.StagePreconditions;
import com.schoolbav.repository.InfrastructureJdbcRepository;
import com.schoolbav.repository.TrendJdbcRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
@Slf4j
public class TrendService implements PipelineStage {
    private final InfrastructureJdbcRepository infrastructure;
    private final TrendJdbcRepository repository;
    private final StagePreconditions preconditions;

    public TrendService(InfrastructureJdbcRepository infrastructure,
                        TrendJdbcRepository repository,
                        StagePreconditions preconditions) {
        this.infrastructure = infrastructure;
        this.repository = repository;
        this.preconditions = preconditions;
    }

    @Override
    public Stage stage() {
        return Stage.RISK_TREND;
    }

    @Override
    public PipelineModels.StageResult run(List<String> academicYears) {
        academicYears.forEach(year -> preconditions.requireRiskScores(stage(), year));

        Set<String> targets = new HashSet<>(academicYears);
        List<TrendModels.TrendEntry> entries = TrendTracker.track(infrastructure.loadHistory()).stream()
                .filter(e -> targets.contains(e.academicYear()))
                .toList();
        int written = repository.replaceYears(targets, entries);

        Map<TrendDirection, Long> directions = new EnumMap<>(TrendDirection.class);
        entries.forEach(e -> directions.merge(e.direction(), 1L, Long::sum));
        long chronic = entries.stream().filter(TrendModels.TrendEntry::chronic).count();
        long volatileCount = entries.stream().filter(TrendModels.TrendEntry::volatileRisk).count();
        log.info("Risk trend complete: {} records, directions {}, chronic {}, volatile {}",
                written, directions, chronic, volatileCount);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("records", written);
        directions.forEach((d, count) -> summary.put(d.name(), count));
        summary.put("chronic", chronic);
        summary.put("volatile", volatileCount);
        return new PipelineModels.StageResult(stage(), academicYears, written, summary);
    }
}
