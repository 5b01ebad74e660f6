package com.schoolbav.district;

import com.schoolbav.domain.DomainModels.ComplianceGrade;
import com.schoolbav.domain.DomainModels.InfrastructureRow;
import com.schoolbav.domain.DomainModels.TeacherRow;
import com.schoolbav.domain.DomainModels.YearlyMetric;
import com.schoolbav.pipeline.PipelineModels;
import com.schoolbav.pipeline.PipelineStage;
import com.schoolbav.pipeline.Stage;
import com.schoolbav.pipeline.StagePreconditions;
import com.schoolbav.repository.DistrictJdbcRepository;
import com.schoolbav.repository.FactJdbcRepository;
import com.schoolbav.repository.InfrastructureJdbcRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Slf4j
public class DistrictService implements PipelineStage {
    private final FactJdbcRepository facts;
    private final InfrastructureJdbcRepository infrastructure;
    private final DistrictJdbcRepository repository;
    private final StagePreconditions preconditions;

    public DistrictService(FactJdbcRepository facts,
                           InfrastructureJdbcRepository infrastructure,
                           DistrictJdbcRepository repository,
                           StagePreconditions preconditions) {
        this.facts = facts;
        this.infrastructure = infrastructure;
        this.repository = repository;
        this.preconditions = preconditions;
    }

    @Override
    public Stage stage() {
        return Stage.DISTRICT_COMPLIANCE;
    }

    @Override
    public PipelineModels.StageResult run(List<String> academicYears) {
        List<DistrictModels.DistrictInput> inputs = new ArrayList<>();
        for (String year : academicYears) {
            preconditions.requireRiskScores(stage(), year);
            inputs.addAll(inputs(year));
        }

        List<DistrictModels.DistrictScore> scores = DistrictAggregator.aggregate(inputs);
        int written = repository.replaceYears(academicYears, scores, DistrictAggregator::compare);

        Map<ComplianceGrade, Long> grades = new EnumMap<>(ComplianceGrade.class);
        scores.forEach(s -> grades.merge(s.grade(), 1L, Long::sum));
        log.info("District compliance complete: {} district-years, grades {}", written, grades);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("records", written);
        summary.put("districts", scores.stream().map(DistrictModels.DistrictScore::district).distinct().count());
        grades.forEach((g, count) -> summary.put("grade" + g.name(), count));
        return new PipelineModels.StageResult(stage(), academicYears, written, summary);
    }

    private List<DistrictModels.DistrictInput> inputs(String year) {
        Map<String, TeacherRow> teachers = infrastructure.loadTeacherRows(year).stream()
                .collect(Collectors.toMap(TeacherRow::schoolId, Function.identity()));
        Map<String, Integer> enrolment = new HashMap<>();
        for (YearlyMetric m : facts.loadYearlyMetrics(year)) {
            enrolment.put(m.schoolId(), m.totalEnrolment());
        }

        List<DistrictModels.DistrictInput> out = new ArrayList<>();
        int withoutDistrict = 0;
        for (InfrastructureRow row : infrastructure.loadRows(year)) {
            if (row.district() == null) {
                withoutDistrict++;
                continue;
            }
            TeacherRow teacher = teachers.get(row.schoolId());
            out.add(new DistrictModels.DistrictInput(row.schoolId(), year, row.district(), row.riskScore(), row.riskLevel(),
                    row.classroomGap(), teacher == null ? null : teacher.teacherGap(),
                    enrolment.get(row.schoolId()), row.classroomConditionScore()));
        }
        if (withoutDistrict > 0) {
            log.warn("{}: {} scored school-years have no school record with a district and are left out", year, withoutDistrict);
        }
        return out;
    }
}
