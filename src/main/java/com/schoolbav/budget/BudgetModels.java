package com.schoolbav.budget;

import com.schoolbav.domain.DomainModels.RiskLevel;

import java.util.List;

public class BudgetModels {
    public record BudgetConfig(long totalBudget, long costPerClassroom, int teacherPosts) {
        /** 500 crore. */
        public static final long MAX_TOTAL_BUDGET = 5_000_000_000L;
        /** 1 to 50 lakh. */
        public static final long MIN_COST_PER_CLASSROOM = 100_000L;
        public static final long MAX_COST_PER_CLASSROOM = 5_000_000L;
        public static final int MAX_TEACHER_POSTS = 100_000;

        public BudgetConfig {
            if (totalBudget < 0 || totalBudget > MAX_TOTAL_BUDGET) {
                throw new IllegalArgumentException("totalBudget must be between 0 and " + MAX_TOTAL_BUDGET);
            }
            if (costPerClassroom < MIN_COST_PER_CLASSROOM || costPerClassroom > MAX_COST_PER_CLASSROOM) {
                throw new IllegalArgumentException("costPerClassroom must be between " + MIN_COST_PER_CLASSROOM
                        + " and " + MAX_COST_PER_CLASSROOM);
            }
            if (teacherPosts < 0 || teacherPosts > MAX_TEACHER_POSTS) {
                throw new IllegalArgumentException("teacherPosts must be between 0 and " + MAX_TEACHER_POSTS);
            }
        }

        /** Whole classrooms the budget can pay for. */
        public int classroomCap() {
            return (int) Math.min(Integer.MAX_VALUE, totalBudget / costPerClassroom);
        }
    }

    /** Shortfall of one scored school-year; missing gaps are already zero. */
    public record BudgetDemand(String schoolId,
                               String academicYear,
                               String district,
                               RiskLevel riskLevel,
                               double riskScore,
                               int classroomGap,
                               int teacherGap) {}

    public record Allocation(BudgetDemand demand,
                             int priority,
                             int classroomsAllocated,
                             int teachersAllocated) {
        public boolean classroomResolved() {
            return classroomsAllocated >= demand.classroomGap();
        }

        public boolean teacherResolved() {
            return teachersAllocated >= demand.teacherGap();
        }

        public boolean served() {
            return classroomsAllocated > 0 || teachersAllocated > 0;
        }

        public boolean hasDemand() {
            return demand.classroomGap() > 0 || demand.teacherGap() > 0;
        }
    }

    public record DistrictAllocation(String district, int classrooms, int teachers, long cost, int schoolsServed) {}

    public record SimulationSummary(String academicYear,
                                    BudgetConfig config,
                                    int classroomCap,
                                    int totalSchools,
                                    int funded,
                                    int partiallyFunded,
                                    int unfunded,
                                    int noDemand,
                                    int classroomsAllocated,
                                    int teachersAllocated,
                                    long totalCost,
                                    double budgetUtilisationPct,
                                    int remainingClassroomDeficit,
                                    int remainingTeacherDeficit,
                                    List<DistrictAllocation> byDistrict) {}
}
