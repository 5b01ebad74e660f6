package com.schoolbav.budget;

import com.schoolbav.domain.DomainModels.RiskLevel;
import com.schoolbav.domain.Rounding;

import java.util.*;

/**
 * Greedy allocation of classroom and teacher-post caps along a fixed priority order.
 */
public final class BudgetAllocator {
    public static final int DISTRICT_BREAKDOWN_LIMIT = 15;

    /** CRITICAL first, then by score, then by school id so equal scores stay in a stable order. */
    public static final Comparator<BudgetModels.BudgetDemand> PRIORITY_ORDER =
            Comparator.comparingInt((BudgetModels.BudgetDemand d) -> tier(d.riskLevel()))
                    .thenComparing(Comparator.comparingDouble(BudgetModels.BudgetDemand::riskScore).reversed())
                    .thenComparing(BudgetModels.BudgetDemand::schoolId);

    private BudgetAllocator() {
    }

    public static List<BudgetModels.Allocation> allocate(List<BudgetModels.BudgetDemand> demands,
                                                         BudgetModels.BudgetConfig config) {
        List<BudgetModels.BudgetDemand> ordered = demands.stream().sorted(PRIORITY_ORDER).toList();
        int[] classrooms = allocate(ordered.stream().mapToInt(BudgetModels.BudgetDemand::classroomGap).toArray(), config.classroomCap());
        int[] teachers = allocate(ordered.stream().mapToInt(BudgetModels.BudgetDemand::teacherGap).toArray(), config.teacherPosts());

        List<BudgetModels.Allocation> out = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            out.add(new BudgetModels.Allocation(ordered.get(i), i + 1, classrooms[i], teachers[i]));
        }
        return out;
    }

    /**
     * Prefix-sum scan over requested gaps in priority order. A row gets its full gap while the running
     * request total stays within {@code cap}, the straddling row gets the remaining headroom, and every
     * later row gets nothing.
     */
    static int[] allocate(int[] gaps, int cap) {
        int[] allocated = new int[gaps.length];
        long runningTotal = 0;
        for (int i = 0; i < gaps.length; i++) {
            long before = runningTotal;
            runningTotal += gaps[i];
            if (runningTotal <= cap) {
                allocated[i] = gaps[i];
            } else if (before < cap) {
                allocated[i] = (int) (cap - before);
            }
        }
        return allocated;
    }

    public static BudgetModels.SimulationSummary summarise(String academicYear,
                                                           BudgetModels.BudgetConfig config,
                                                           List<BudgetModels.Allocation> allocations) {
        int funded = 0;
        int partial = 0;
        int unfunded = 0;
        int noDemand = 0;
        int classrooms = 0;
        int teachers = 0;
        int remainingClassrooms = 0;
        int remainingTeachers = 0;
        Map<String, int[]> byDistrict = new LinkedHashMap<>();

        for (BudgetModels.Allocation a : allocations) {
            if (!a.hasDemand()) {
                noDemand++;
            } else if (!a.served()) {
                unfunded++;
            } else if (a.classroomResolved() && a.teacherResolved()) {
                funded++;
            } else {
                partial++;
            }
            classrooms += a.classroomsAllocated();
            teachers += a.teachersAllocated();
            remainingClassrooms += a.demand().classroomGap() - a.classroomsAllocated();
            remainingTeachers += a.demand().teacherGap() - a.teachersAllocated();

            int[] district = byDistrict.computeIfAbsent(Objects.toString(a.demand().district(), "UNKNOWN"), k -> new int[3]);
            district[0] += a.classroomsAllocated();
            district[1] += a.teachersAllocated();
            if (a.served()) district[2]++;
        }

        List<BudgetModels.DistrictAllocation> districts = byDistrict.entrySet().stream()
                .map(e -> new BudgetModels.DistrictAllocation(e.getKey(), e.getValue()[0], e.getValue()[1],
                        (long) e.getValue()[0] * config.costPerClassroom(), e.getValue()[2]))
                .sorted(Comparator.comparingInt(BudgetModels.DistrictAllocation::classrooms).reversed()
                        .thenComparing(BudgetModels.DistrictAllocation::district))
                .limit(DISTRICT_BREAKDOWN_LIMIT)
                .toList();

        long cost = (long) classrooms * config.costPerClassroom();
        double utilisation = config.totalBudget() == 0 ? 0.0 : Rounding.round(cost * 100.0 / config.totalBudget(), 1);
        return new BudgetModels.SimulationSummary(academicYear, config, config.classroomCap(), allocations.size(),
                funded, partial, unfunded, noDemand, classrooms, teachers, cost, utilisation,
                remainingClassrooms, remainingTeachers, districts);
    }

    static int tier(RiskLevel level) {
        if (level == null) return 5;
        return switch (level) {
            case CRITICAL -> 1;
            case HIGH -> 2;
            case MODERATE -> 3;
            case LOW -> 4;
        };
    }
}
