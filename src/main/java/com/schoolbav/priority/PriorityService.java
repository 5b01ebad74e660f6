package com.schoolbav.priority;

import com.schoolbav.domain.DomainModels.InfrastructureRow;
import com.schoolbav.domain.DomainModels.PriorityBucket;
import com.schoolbav.pipeline.PipelineModels;
import com.schoolbav.pipeline.PipelineStage;
import com.schoolbav.pipeline.Stage;
import com.schoolbav.pipeline.StagePreconditions;
import com.schoolbav.repository.InfrastructureJdbcRepository;
import com.schoolbav.repository.PriorityJdbcRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class PriorityService implements PipelineStage {
    private final InfrastructureJdbcRepository infrastructure;
    private final PriorityJdbcRepository repository;
    private final StagePreconditions preconditions;

    public PriorityService(InfrastructureJdbcRepository infrastructure,
                           PriorityJdbcRepository repository,
                           StagePreconditions preconditions) {
        this.infrastructure = infrastructure;
        this.repository = repository;
        this.preconditions = preconditions;
    }

    @Override
    public Stage stage() {
        return Stage.PRIORITISATION;
    }

    @Override
    public PipelineModels.StageResult run(List<String> academicYears) {
        academicYears.forEach(year -> preconditions.requireRiskScores(stage(), year));

        List<InfrastructureRow> history = infrastructure.loadHistory();
        Map<PriorityBucket, Long> buckets = new EnumMap<>(PriorityBucket.class);
        int written = 0;
        long persistent = 0;
        for (String year : academicYears) {
            List<InfrastructureRow> yearRows = history.stream()
                    .filter(r -> year.equals(r.academicYear()))
                    .toList();
            List<PriorityModels.PriorityEntry> entries = PriorityRanker.rank(yearRows, history);
            written += repository.replaceYear(year, entries);

            long yearPersistent = entries.stream().filter(PriorityModels.PriorityEntry::persistentHighRisk).count();
            persistent += yearPersistent;
            entries.forEach(e -> buckets.merge(e.bucket(), 1L, Long::sum));
            log.info("Prioritisation {}: {} ranked, {} persistent high-risk", year, entries.size(), yearPersistent);
        }

        log.info("Prioritisation complete: {} records, buckets {}, persistent {}", written, buckets, persistent);
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("records", written);
        buckets.forEach((bucket, count) -> summary.put(bucket.name(), count));
        summary.put("persistentHighRisk", persistent);
        return new PipelineModels.StageResult(stage(), academicYears, written, summary);
    }
}
