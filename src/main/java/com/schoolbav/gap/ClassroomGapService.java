package com.schoolbav.gap;

import com.schoolbav.domain.DomainModels.InfrastructureFact;
import com.schoolbav.domain.DomainModels.School;
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
public class ClassroomGapService implements PipelineStage {
    private final FactJdbcRepository facts;
    private final InfrastructureJdbcRepository infrastructure;

    public ClassroomGapService(FactJdbcRepository facts, InfrastructureJdbcRepository infrastructure) {
        this.facts = facts;
        this.infrastructure = infrastructure;
    }

    @Override
    public Stage stage() {
        return Stage.CLASSROOM_GAP;
    }

    @Override
    public PipelineModels.StageResult run(List<String> academicYears) {
        Map<String, School> schools = facts.loadSchools();
        int written = 0;
        int deficits = 0;
        long gapTotal = 0;
        for (String year : academicYears) {
            List<GapModels.CapacityInput> inputs = inputs(year, schools);
            List<GapModels.Requirement> requirements = GapResolver.classrooms(inputs);
            written += infrastructure.replaceClassroomRequirements(requirements);

            long yearDeficits = requirements.stream().filter(r -> r.gap() > 0).count();
            deficits += (int) yearDeficits;
            gapTotal += requirements.stream().mapToLong(GapModels.Requirement::gap).sum();
            log.info("Classroom gap {}: {} school-years, {} with deficit", year, requirements.size(), yearDeficits);
        }
        double avgGap = deficits == 0 ? 0.0 : (double) gapTotal / deficits;
        log.info("Classroom gap complete: {} records, {} with deficit, average gap {}", written, deficits,
                String.format("%.2f", avgGap));
        return new PipelineModels.StageResult(stage(), academicYears, written,
                Map.of("records", written, "deficitCount", deficits, "avgGap", avgGap));
    }

    private List<GapModels.CapacityInput> inputs(String year, Map<String, School> schools) {
        Map<String, YearlyMetric> enrolment = facts.loadYearlyMetrics(year).stream()
                .collect(Collectors.toMap(YearlyMetric::schoolId, Function.identity()));
        Map<String, InfrastructureFact> rooms = facts.loadInfrastructureFacts(year).stream()
                .collect(Collectors.toMap(InfrastructureFact::schoolId, Function.identity()));

        Set<String> keys = new TreeSet<>(enrolment.keySet());
        keys.addAll(rooms.keySet());

        List<GapModels.CapacityInput> inputs = new ArrayList<>();
        int missingEnrolment = 0;
        int missingRooms = 0;
        int unmapped = 0;
        for (String schoolId : keys) {
            YearlyMetric metric = enrolment.get(schoolId);
            InfrastructureFact fact = rooms.get(schoolId);
            School school = schools.get(schoolId);
            Integer category = school == null ? null : school.category();
            if (metric == null || metric.totalEnrolment() == null) missingEnrolment++;
            if (fact == null || fact.usableClassRooms() == null) missingRooms++;
            if (!CapacityNorms.isMapped(category)) unmapped++;
            inputs.add(new GapModels.CapacityInput(schoolId, year,
                    metric == null ? null : metric.totalEnrolment(),
                    fact == null ? null : fact.usableClassRooms(),
                    category));
        }
        if (missingEnrolment > 0) {
            log.warn("{}: {} school-years have no enrolment; treated as 0", year, missingEnrolment);
        }
        if (missingRooms > 0) {
            log.warn("{}: {} school-years have no usable classroom count; treated as 0", year, missingRooms);
        }
        if (unmapped > 0) {
            log.warn("{}: {} schools have an unmapped category; using norm {}", year, unmapped, CapacityNorms.CONSERVATIVE_NORM);
        }
        return inputs;
    }
}
