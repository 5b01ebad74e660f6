package com.schoolbav.risk;

import com.schoolbav.domain.DomainModels.RiskLevel;

public class RiskModels {
    public record RiskInput(String schoolId,
                            String academicYear,
                            Integer classroomGap,
                            Integer requiredClassRooms,
                            Integer teacherGap,
                            Integer requiredTeachers,
                            double enrolmentGrowthRate) {}

    public record RiskAssessment(String schoolId,
                                 String academicYear,
                                 double classroomDeficitRatio,
                                 double teacherDeficitRatio,
                                 double enrolmentGrowthRate,
                                 double riskScore,
                                 RiskLevel riskLevel) {}
}
