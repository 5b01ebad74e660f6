package com.schoolbav.budget;

import com.schoolbav.SchoolBavTestData;
import com.schoolbav.pipeline.PipelineService;
import com.schoolbav.pipeline.StageOrderingException;
import com.schoolbav.repository.FactJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class BudgetServiceTest {
    @Autowired
    private BudgetService budgetService;
    @Autowired
    private PipelineService pipelineService;
    @Autowired
    private FactJdbcRepository facts;
    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void runPipeline() {
        SchoolBavTestData.reset(jdbcTemplate);
        SchoolBavTestData.load(facts);
        pipelineService.runAll();
    }

    @Test
    void dryRunLeavesStoredAllocationUntouched() {
        List<Map<String, Object>> before = jdbcTemplate.queryForList("SELECT * FROM budget_simulation ORDER BY school_id, academic_year");

        BudgetModels.SimulationSummary summary = budgetService.simulate("2023-24",
                new BudgetModels.BudgetConfig(1_000_000_000L, 500_000L, 100_000));

        assertEquals(before, jdbcTemplate.queryForList("SELECT * FROM budget_simulation ORDER BY school_id, academic_year"));
        assertEquals(5, summary.totalSchools());
        assertEquals(4, summary.funded());
        assertEquals(1, summary.noDemand());
        assertEquals(0, summary.unfunded());
        assertEquals(30, summary.classroomsAllocated());
        assertEquals(35, summary.teachersAllocated());
        assertEquals(0, summary.remainingClassroomDeficit());
        assertEquals(15_000_000L, summary.totalCost());
    }

    @Test
    void configuredCapsGoToTheHighestTierFirst() {
        BudgetModels.SimulationSummary summary = budgetService.simulate("2023-24", budgetService.configured());

        assertEquals(10, summary.classroomCap());
        assertEquals(10, summary.classroomsAllocated());
        assertEquals(12, summary.teachersAllocated());
        assertEquals(100.0, summary.budgetUtilisationPct());
        assertEquals(20, summary.remainingClassroomDeficit());
    }

    @Test
    void emptyBudgetFundsNobody() {
        BudgetModels.SimulationSummary summary = budgetService.simulate("2023-24",
                new BudgetModels.BudgetConfig(0, 500_000L, 0));

        assertEquals(0, summary.classroomsAllocated());
        assertEquals(4, summary.unfunded());
        assertEquals(0.0, summary.budgetUtilisationPct());
    }

    @Test
    void unscoredYearCannotBeSimulated() {
        assertThrows(StageOrderingException.class,
                () -> budgetService.simulate("2030-31", budgetService.configured()));
    }
}
