package com.schoolbav.forecast;

import com.schoolbav.domain.DomainModels.InfrastructureFact;
import com.schoolbav.domain.DomainModels.School;
import com.schoolbav.domain.DomainModels.TeacherFact;
import com.schoolbav.domain.DomainModels.YearlyMetric;
import com.schoolbav.pipeline.PipelineModels;
import com.schoolbav.pipeline.PipelineStage;
import com.schoolbav.pipeline.Stage;
import com.schoolbav.repository.FactJdbcRepository;
import com.schoolbav.repository.ForecastJdbcRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

@Service
@Slf4j
public class ForecastService implements PipelineStage {
    private final FactJdbcRepository facts;
    private final ForecastJdbcRepository repository;

    public ForecastService(FactJdbcRepository facts, ForecastJdbcRepository repository) {
        this.facts = facts;
        this.repository = repository;
    }

    @Override
    public Stage stage() {
        return Stage.FORECAST;
    }

    /** Forecasts every school whose latest enrolment year is among {@code academicYears}. */
    @Override
    public PipelineModels.StageResult run(List<String> academicYears) {
        Set<String> targets = new TreeSet<>(academicYears);
        Map<String, School> schools = facts.loadSchools();
        Map<String, List<YearlyMetric>> histories = facts.loadYearlyMetrics().stream()
                .collect(Collectors.groupingBy(YearlyMetric::schoolId, TreeMap::new, Collectors.toList()));

        Map<String, Map<String, InfrastructureFact>> rooms = new HashMap<>();
        Map<String, Map<String, TeacherFact>> teachers = new HashMap<>();
        List<ForecastModels.ForecastInput> inputs = new ArrayList<>();
        int noEnrolment = 0;
        for (Map.Entry<String, List<YearlyMetric>> e : histories.entrySet()) {
            Optional<String> baseYear = Forecaster.baseYear(e.getValue());
            if (baseYear.isEmpty()) {
                noEnrolment++;
                continue;
            }
            if (!targets.contains(baseYear.get())) continue;

            InfrastructureFact room = rooms.computeIfAbsent(baseYear.get(), this::roomsOf).get(e.getKey());
            TeacherFact teacher = teachers.computeIfAbsent(baseYear.get(), this::teachersOf).get(e.getKey());
            School school = schools.get(e.getKey());
            inputs.add(new ForecastModels.ForecastInput(e.getKey(), school == null ? null : school.category(), e.getValue(),
                    room == null || room.usableClassRooms() == null ? 0 : room.usableClassRooms(),
                    teacher == null || teacher.totalTeachers() == null ? 0 : teacher.totalTeachers()));
        }
        if (noEnrolment > 0) {
            log.warn("{} schools have no recorded enrolment in any year and are not forecast", noEnrolment);
        }

        List<ForecastModels.Forecast> forecasts = Forecaster.forecast(inputs);
        int written = repository.replaceBaseYears(targets, forecasts);

        long withDeficit = forecasts.stream()
                .filter(f -> f.yearsAhead() == Forecaster.HORIZON && f.projectedClassroomGap() > 0)
                .count();
        long projectedTotal = forecasts.stream()
                .filter(f -> f.yearsAhead() == Forecaster.HORIZON)
                .mapToLong(ForecastModels.Forecast::projectedEnrolment)
                .sum();
        log.info("Forecast complete: {} rows for {} schools, {} with a classroom deficit at T+{}",
                written, inputs.size(), withDeficit, Forecaster.HORIZON);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("records", written);
        summary.put("schools", inputs.size());
        summary.put("classroomDeficitAtHorizon", withDeficit);
        summary.put("projectedEnrolmentAtHorizon", projectedTotal);
        return new PipelineModels.StageResult(stage(), academicYears, written, summary);
    }

    private Map<String, InfrastructureFact> roomsOf(String year) {
        return facts.loadInfrastructureFacts(year).stream()
                .collect(Collectors.toMap(InfrastructureFact::schoolId, f -> f));
    }

    private Map<String, TeacherFact> teachersOf(String year) {
        return facts.loadTeacherFacts(year).stream()
                .collect(Collectors.toMap(TeacherFact::schoolId, f -> f));
    }
}
