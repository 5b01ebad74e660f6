package com.schoolbav.gap;

import com.schoolbav.domain.DomainModels.School;
import com.schoolbav.domain.DomainModels.TeacherFact;
import com.schoolbav.domain.DomainModels.YearlyMetric;
import com.schoolbav.pipeline.PipelineModels;
import com.schoolbav.pipeline.PipelineStage;
import com.schoolbav.pipeline.Stage;
import com.schoolbav.repository.FactJdbcRepository;
import com.schoolbav.repository.InfrastructureJdbcRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Slf4j
public class TeacherAdequacyService implements PipelineStage {
    private final FactJdbcRepository facts;
    private final InfrastructureJdbcRepository infrastructure;

    public TeacherAdequacyService(FactJdbcRepository facts, InfrastructureJdbcRepository infrastructure) {
        this.facts = facts;
        this.infrastructure = infrastructure;
    }

    @Override
    public Stage stage() {
        return Stage.TEACHER_ADEQUACY;
    }

    @Override
    public PipelineModels.StageResult run(List<String> academicYears) {
        Map<String, School> schools = facts.loadSchools();
        int written = 0;
        int deficits = 0;
        long gapTotal = 0;
        for (String year : academicYears) {
            Map<String, YearlyMetric> enrolment = facts.loadYearlyMetrics(year).stream()
                    .collect(Collectors.toMap(YearlyMetric::schoolId, Function.identity()));
            Map<String, TeacherFact> staff = facts.loadTeacherFacts(year).stream()
                    .collect(Collectors.toMap(TeacherFact::schoolId, Function.identity()));
            Set<String> keys = new TreeSet<>(enrolment.keySet());
            keys.addAll(staff.keySet());
            facts.loadInfrastructureFacts(year).forEach(f -> keys.add(f.schoolId()));

            int missingStaff = 0;
            List<GapModels.CapacityInput> inputs = new ArrayList<>();
            for (String schoolId : keys) {
                YearlyMetric metric = enrolment.get(schoolId);
                TeacherFact fact = staff.get(schoolId);
                School school = schools.get(schoolId);
                if (fact == null || fact.totalTeachers() == null) missingStaff++;
                inputs.add(new GapModels.CapacityInput(schoolId, year,
                        metric == null ? null : metric.totalEnrolment(),
                        fact == null ? null : fact.totalTeachers(),
                        school == null ? null : school.category()));
            }
            if (missingStaff > 0) {
                log.warn("{}: {} school-years have no teacher count; treated as 0", year, missingStaff);
            }

            List<GapModels.Requirement> requirements = GapResolver.teachers(inputs);
            written += infrastructure.replaceTeacherRequirements(requirements);
            long yearDeficits = requirements.stream().filter(r -> r.gap() > 0).count();
            deficits += (int) yearDeficits;
            gapTotal += requirements.stream().mapToLong(GapModels.Requirement::gap).sum();
            log.info("Teacher adequacy {}: {} school-years, {} with deficit", year, requirements.size(), yearDeficits);
        }
        double avgGap = deficits == 0 ? 0.0 : (double) gapTotal / deficits;
        log.info("Teacher adequacy complete: {} records, {} with deficit, average gap {}", written, deficits,
                String.format("%.2f", avgGap));
        return new PipelineModels.StageResult(stage(), academicYears, written,
                Map.of("records", written, "deficitCount", deficits, "avgGap", avgGap));
    }
}
