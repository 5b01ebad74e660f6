package com.schoolbav.budget;

import com.schoolbav.domain.DomainModels.InfrastructureRow;
import com.schoolbav.domain.DomainModels.TeacherRow;
import com.schoolbav.pipeline.PipelineModels;
import com.schoolbav.pipeline.PipelineStage;
import com.schoolbav.pipeline.SchoolBavProperties;
import com.schoolbav.pipeline.Stage;
import com.schoolbav.pipeline.StagePreconditions;
import com.schoolbav.repository.BudgetJdbcRepository;
import com.schoolbav.repository.InfrastructureJdbcRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Committed allocation run against the configured budget, plus the non-persisting dry run used by
 * the read API.
 */
@Service
@Slf4j
public class BudgetService implements PipelineStage {
    private final InfrastructureJdbcRepository infrastructure;
    private final BudgetJdbcRepository repository;
    private final StagePreconditions preconditions;
    private final SchoolBavProperties properties;

    public BudgetService(InfrastructureJdbcRepository infrastructure,
                         BudgetJdbcRepository repository,
                         StagePreconditions preconditions,
                         SchoolBavProperties properties) {
        this.infrastructure = infrastructure;
        this.repository = repository;
        this.preconditions = preconditions;
        this.properties = properties;
    }

    @Override
    public Stage stage() {
        return Stage.BUDGET_ALLOCATION;
    }

    @Override
    public PipelineModels.StageResult run(List<String> academicYears) {
        BudgetModels.BudgetConfig config = configured();
        log.info("Budget allocation: cap {} classrooms, {} teacher posts per year",
                config.classroomCap(), config.teacherPosts());

        int written = 0;
        int classrooms = 0;
        int teachers = 0;
        for (String year : academicYears) {
            preconditions.requireRiskScores(stage(), year);
            List<BudgetModels.Allocation> allocations = BudgetAllocator.allocate(demands(year), config);
            written += repository.replaceYear(year, allocations);

            BudgetModels.SimulationSummary summary = BudgetAllocator.summarise(year, config, allocations);
            classrooms += summary.classroomsAllocated();
            teachers += summary.teachersAllocated();
            log.info("{}: {} rows, {} classrooms and {} teachers allocated, {} funded, {} partial, {} unfunded",
                    year, allocations.size(), summary.classroomsAllocated(), summary.teachersAllocated(),
                    summary.funded(), summary.partiallyFunded(), summary.unfunded());
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("records", written);
        summary.put("classroomCap", config.classroomCap());
        summary.put("teacherCap", config.teacherPosts());
        summary.put("classroomsAllocated", classrooms);
        summary.put("teachersAllocated", teachers);
        return new PipelineModels.StageResult(stage(), academicYears, written, summary);
    }

    /** Same allocation as the committed run, against arbitrary parameters; nothing is written. */
    public BudgetModels.SimulationSummary simulate(String academicYear, BudgetModels.BudgetConfig config) {
        preconditions.requireRiskScores(stage(), academicYear);
        List<BudgetModels.Allocation> allocations = BudgetAllocator.allocate(demands(academicYear), config);
        log.debug("Dry run for {}: cap {} classrooms, {} teachers over {} schools",
                academicYear, config.classroomCap(), config.teacherPosts(), allocations.size());
        return BudgetAllocator.summarise(academicYear, config, allocations);
    }

    public BudgetModels.BudgetConfig configured() {
        SchoolBavProperties.Budget budget = properties.getBudget();
        return new BudgetModels.BudgetConfig(budget.getTotalBudget(), budget.getCostPerClassroom(), budget.getTeacherPosts());
    }

    private List<BudgetModels.BudgetDemand> demands(String year) {
        Map<String, TeacherRow> teachers = infrastructure.loadTeacherRows(year).stream()
                .collect(Collectors.toMap(TeacherRow::schoolId, Function.identity()));
        List<BudgetModels.BudgetDemand> demands = new ArrayList<>();
        for (InfrastructureRow row : infrastructure.loadRows(year)) {
            TeacherRow teacher = teachers.get(row.schoolId());
            demands.add(new BudgetModels.BudgetDemand(row.schoolId(), year, row.district(), row.riskLevel(),
                    row.riskScore(), orZero(row.classroomGap()), teacher == null ? 0 : orZero(teacher.teacherGap())));
        }
        return demands;
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }
}
