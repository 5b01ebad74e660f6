package com.schoolbav.domain;

public class DomainModels {
    public record School(String schoolId, String schoolName, String district, String block,
                         String managementType, Integer category) {}

    public record YearlyMetric(String schoolId, String academicYear, Integer totalEnrolment) {}

    public record InfrastructureFact(String schoolId, String academicYear,
                                     Integer totalClassRooms, Integer usableClassRooms,
                                     Integer classroomConditionScore) {}

    /** Amenity checklist reported alongside the classroom counts; unreported items stay null. */
    public record FacilityFact(String schoolId, String academicYear,
                               Boolean drinkingWater, Boolean electricity, Boolean internet,
                               Boolean girlsToilet, Boolean ramp, Boolean cwsnToilet, Boolean resourceRoom,
                               String buildingCondition) {}

    public record TeacherFact(String schoolId, String academicYear, Integer totalTeachers) {}

    /** School-year key; ordering of academic years is lexicographic. */
    public record SchoolYear(String schoolId, String academicYear) {}

    /**
     * Infrastructure row with the columns the downstream stages read back.
     * Any computed column may be null until its stage has run.
     */
    public record InfrastructureRow(String schoolId, String academicYear, String district,
                                    Integer usableClassRooms, Integer classroomConditionScore,
                                    Integer requiredClassRooms, Integer classroomGap,
                                    Double riskScore, RiskLevel riskLevel) {}

    public record TeacherRow(String schoolId, String academicYear, Integer totalTeachers,
                             Integer requiredTeachers, Integer teacherGap) {}

    public enum RiskLevel {
        LOW, MODERATE, HIGH, CRITICAL;

        public boolean isHighOrCritical() {
            return this == HIGH || this == CRITICAL;
        }

        public static RiskLevel parse(String value) {
            return value == null || value.isBlank() ? null : RiskLevel.valueOf(value);
        }
    }

    public enum TrendDirection { BASELINE, IMPROVING, STABLE, DETERIORATING }

    public enum PriorityBucket { TOP_5, TOP_10, TOP_20, STANDARD }

    public enum ComplianceGrade { A, B, C, D, F }

    public enum DecisionStatus { ACCEPTED, FLAGGED, REJECTED }

    public enum ReasonCode {
        NO_DEFICIT,
        CLASSROOM_OVER_REQUEST,
        TEACHER_OVER_REQUEST,
        CLASSROOM_MODERATE_OVER,
        TEACHER_MODERATE_OVER,
        CLASSROOM_UNDER_REQUEST,
        TEACHER_UNDER_REQUEST,
        NO_REQUEST,
        WITHIN_TOLERANCE,
        SCHOOL_NOT_FOUND
    }
}
