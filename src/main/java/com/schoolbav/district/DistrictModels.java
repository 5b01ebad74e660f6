package com.schoolbav.district;

import com.schoolbav.domain.DomainModels.ComplianceGrade;
import com.schoolbav.domain.DomainModels.RiskLevel;

public class DistrictModels {
    /** One scored school-year with its counterpart facts; absent counterparts are null. */
    public record DistrictInput(String schoolId,
                                String academicYear,
                                String district,
                                double riskScore,
                                RiskLevel riskLevel,
                                Integer classroomGap,
                                Integer teacherGap,
                                Integer enrolment,
                                Integer classroomConditionScore) {}

    public record DistrictScore(String district,
                                String academicYear,
                                int totalSchools,
                                double avgRiskScore,
                                double pctHighCritical,
                                int totalClassroomDeficit,
                                int totalTeacherDeficit,
                                long totalEnrolment,
                                Double avgClassroomCondition,
                                Double yoyRiskImprovement,
                                int districtRank,
                                ComplianceGrade grade) {

        DistrictScore withComparisons(Double yoy, int rank) {
            return new DistrictScore(district, academicYear, totalSchools, avgRiskScore, pctHighCritical,
                    totalClassroomDeficit, totalTeacherDeficit, totalEnrolment, avgClassroomCondition, yoy, rank, grade);
        }
    }
}
