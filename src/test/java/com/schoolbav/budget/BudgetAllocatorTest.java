package com.schoolbav.budget;

import com.schoolbav.domain.DomainModels.RiskLevel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class BudgetAllocatorTest {

    private static BudgetModels.BudgetDemand demand(String id, String district, RiskLevel level, double score,
                                                   int classroomGap, int teacherGap) {
        return new BudgetModels.BudgetDemand(id, "2023-24", district, level, score, classroomGap, teacherGap);
    }

    @Test
    void ordersByTierThenScore() {
        List<BudgetModels.Allocation> allocations = BudgetAllocator.allocate(List.of(
                demand("low", "N", RiskLevel.LOW, 0.1, 2, 0),
                demand("crit-b", "N", RiskLevel.CRITICAL, 0.8, 3, 0),
                demand("high", "S", RiskLevel.HIGH, 0.6, 5, 0),
                demand("crit-a", "S", RiskLevel.CRITICAL, 0.9, 4, 0)),
                new BudgetModels.BudgetConfig(3_000_000, 500_000, 0));

        assertEquals(List.of("crit-a", "crit-b", "high", "low"),
                allocations.stream().map(a -> a.demand().schoolId()).toList());
        assertEquals(List.of(1, 2, 3, 4), allocations.stream().map(BudgetModels.Allocation::priority).toList());
        assertEquals(List.of(4, 2, 0, 0), allocations.stream().map(BudgetModels.Allocation::classroomsAllocated).toList());
        assertTrue(allocations.get(0).classroomResolved());
        assertFalse(allocations.get(1).classroomResolved());
    }

    @Test
    void resourcesAreAllocatedIndependently() {
        List<BudgetModels.Allocation> allocations = BudgetAllocator.allocate(List.of(
                demand("a", "N", RiskLevel.CRITICAL, 0.9, 10, 1),
                demand("b", "N", RiskLevel.HIGH, 0.6, 1, 10)),
                new BudgetModels.BudgetConfig(5_000_000, 500_000, 5));

        assertEquals(10, allocations.get(0).classroomsAllocated());
        assertEquals(1, allocations.get(0).teachersAllocated());
        assertEquals(0, allocations.get(1).classroomsAllocated());
        assertEquals(4, allocations.get(1).teachersAllocated());
        assertTrue(allocations.get(0).classroomResolved());
        assertFalse(allocations.get(1).teacherResolved());
    }

    @Test
    void allocationNeverExceedsCapOrGap() {
        Random random = new Random(42);
        for (int run = 0; run < 50; run++) {
            int[] gaps = new int[random.nextInt(30) + 1];
            for (int i = 0; i < gaps.length; i++) gaps[i] = random.nextInt(8);
            int cap = random.nextInt(60);

            int[] allocated = BudgetAllocator.allocate(gaps, cap);
            int total = 0;
            int straddle = -1;
            for (int i = 0; i < gaps.length; i++) {
                assertTrue(allocated[i] >= 0 && allocated[i] <= gaps[i]);
                total += allocated[i];
                if (straddle < 0 && allocated[i] < gaps[i]) straddle = i;
            }
            assertTrue(total <= cap);
            if (straddle >= 0) {
                for (int i = straddle + 1; i < gaps.length; i++) {
                    assertEquals(0, allocated[i], "row after the straddling row got an allocation");
                }
            }
        }
    }

    @Test
    void exactFitLeavesNothingForLaterRows() {
        assertArrayEquals(new int[]{3, 2, 0, 0}, BudgetAllocator.allocate(new int[]{3, 2, 1, 0}, 5));
    }

    @Test
    void classroomCapIsWholeClassrooms() {
        assertEquals(10, new BudgetModels.BudgetConfig(5_400_000, 500_000, 0).classroomCap());
        assertThrows(IllegalArgumentException.class, () -> new BudgetModels.BudgetConfig(1, 0, 0));
    }

    @Test
    void budgetParametersOutsideTheirRangesAreRefused() {
        assertThrows(IllegalArgumentException.class, () -> new BudgetModels.BudgetConfig(5_000_000_001L, 500_000, 100));
        assertThrows(IllegalArgumentException.class, () -> new BudgetModels.BudgetConfig(-1, 500_000, 100));
        assertThrows(IllegalArgumentException.class, () -> new BudgetModels.BudgetConfig(10_000_000, 99_999, 100));
        assertThrows(IllegalArgumentException.class, () -> new BudgetModels.BudgetConfig(10_000_000, 5_000_001, 100));
        assertThrows(IllegalArgumentException.class, () -> new BudgetModels.BudgetConfig(10_000_000, 500_000, 100_001));

        BudgetModels.BudgetConfig widest = new BudgetModels.BudgetConfig(
                BudgetModels.BudgetConfig.MAX_TOTAL_BUDGET, BudgetModels.BudgetConfig.MIN_COST_PER_CLASSROOM,
                BudgetModels.BudgetConfig.MAX_TEACHER_POSTS);
        assertEquals(50_000, widest.classroomCap());
    }

    @Test
    void summarisesFundingOutcomes() {
        BudgetModels.BudgetConfig config = new BudgetModels.BudgetConfig(2_500_000, 500_000, 3);
        List<BudgetModels.Allocation> allocations = BudgetAllocator.allocate(List.of(
                demand("a", "North", RiskLevel.CRITICAL, 0.9, 2, 1),
                demand("b", "South", RiskLevel.HIGH, 0.7, 4, 0),
                demand("c", "South", RiskLevel.MODERATE, 0.3, 3, 5),
                demand("d", "North", RiskLevel.LOW, 0.1, 0, 0)), config);

        BudgetModels.SimulationSummary summary = BudgetAllocator.summarise("2023-24", config, allocations);

        assertEquals(5, summary.classroomCap());
        assertEquals(1, summary.funded());
        assertEquals(2, summary.partiallyFunded());
        assertEquals(0, summary.unfunded());
        assertEquals(1, summary.noDemand());
        assertEquals(5, summary.classroomsAllocated());
        assertEquals(3, summary.teachersAllocated());
        assertEquals(2_500_000L, summary.totalCost());
        assertEquals(100.0, summary.budgetUtilisationPct());
        assertEquals(4, summary.remainingClassroomDeficit());
        assertEquals(3, summary.remainingTeacherDeficit());
        assertEquals("South", summary.byDistrict().get(0).district());
        assertEquals(3, summary.byDistrict().get(0).classrooms());
    }

    @Test
    void districtBreakdownIsLimited() {
        List<BudgetModels.BudgetDemand> demands = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            demands.add(demand("s" + i, "D" + i, RiskLevel.HIGH, 0.6, 1, 0));
        }
        BudgetModels.BudgetConfig config = new BudgetModels.BudgetConfig(100_000_000, 500_000, 0);
        var summary = BudgetAllocator.summarise("2023-24", config, BudgetAllocator.allocate(demands, config));
        assertEquals(BudgetAllocator.DISTRICT_BREAKDOWN_LIMIT, summary.byDistrict().size());
        assertEquals(20, summary.funded());
    }
}
