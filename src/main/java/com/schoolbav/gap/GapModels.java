package com.schoolbav.gap;

public class GapModels {
    /** One school-year as seen by the resolvers: enrolment, current capacity, category. */
    public record CapacityInput(String schoolId, String academicYear, Integer enrolment,
                                Integer currentCapacity, Integer category) {}

    public record Requirement(String schoolId, String academicYear, int required, int gap) {}
}
