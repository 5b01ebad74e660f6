package com.schoolbav.risk;

import com.schoolbav.domain.DomainModels.InfrastructureRow;
import com.schoolbav.domain.DomainModels.RiskLevel;
import com.schoolbav.domain.DomainModels.SchoolYear;
import com.schoolbav.domain.DomainModels.TeacherRow;
import com.schoolbav.pipeline.PipelineModels;
import com.schoolbav.pipeline.PipelineStage;
import com.schoolbav.pipeline.Stage;
import com.schoolbav.pipeline.StagePreconditions;
import com.schoolbav.repository.FactJdbcRepository;
import com.schoolbav.repository.InfrastructureJdbcRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Slf4j
public class RiskService implements PipelineStage {
    private final FactJdbcRepository facts;
    private final InfrastructureJdbcRepository infrastructure;
    private final StagePreconditions preconditions;

    public RiskService(FactJdbcRepository facts, InfrastructureJdbcRepository infrastructure,
                       StagePreconditions preconditions) {
        this.facts = facts;
        this.infrastructure = infrastructure;
        this.preconditions = preconditions;
    }

    @Override
    public Stage stage() {
        return Stage.RISK_SCORE;
    }

    @Override
    public PipelineModels.StageResult run(List<String> academicYears) {
        academicYears.forEach(year -> preconditions.requireRequirements(stage(), year));

        Map<SchoolYear, Double> growth = RiskScorer.growthRates(facts.loadYearlyMetrics());
        int written = 0;
        Map<RiskLevel, Long> levels = new EnumMap<>(RiskLevel.class);
        double scoreTotal = 0.0;

        for (String year : academicYears) {
            Map<String, TeacherRow> teachers = infrastructure.loadTeacherRows(year).stream()
                    .collect(Collectors.toMap(TeacherRow::schoolId, Function.identity()));
            List<InfrastructureRow> rows = infrastructure.loadRows(year);

            List<RiskModels.RiskInput> inputs = rows.stream()
                    .map(r -> {
                        TeacherRow t = teachers.get(r.schoolId());
                        return new RiskModels.RiskInput(r.schoolId(), year,
                                r.classroomGap(), r.requiredClassRooms(),
                                t == null ? null : t.teacherGap(), t == null ? null : t.requiredTeachers(),
                                growth.getOrDefault(new SchoolYear(r.schoolId(), year), 0.0));
                    })
                    .toList();

            List<RiskModels.RiskAssessment> assessments = RiskScorer.assess(inputs);
            written += infrastructure.replaceRiskScores(assessments);
            for (RiskModels.RiskAssessment a : assessments) {
                levels.merge(a.riskLevel(), 1L, Long::sum);
                scoreTotal += a.riskScore();
            }
            log.info("Risk score {}: {} school-years scored", year, assessments.size());
        }

        double avgRisk = written == 0 ? 0.0 : scoreTotal / written;
        log.info("Risk scoring complete: {} records, average risk {}, levels {}", written,
                String.format("%.4f", avgRisk), levels);
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("records", written);
        summary.put("avgRisk", avgRisk);
        levels.forEach((level, count) -> summary.put(level.name(), count));
        return new PipelineModels.StageResult(stage(), academicYears, written, summary);
    }
}
