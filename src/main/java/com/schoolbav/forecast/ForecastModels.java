package com.schoolbav.forecast;

import com.schoolbav.domain.DomainModels.YearlyMetric;

import java.util.List;

public class ForecastModels {
    /**
     * A school's enrolment series and the capacity it has in the base (latest) year. Capacities
     * missing from the base year are zero.
     */
    public record ForecastInput(String schoolId,
                                Integer category,
                                List<YearlyMetric> enrolmentHistory,
                                int currentClassrooms,
                                int currentTeachers) {}

    public record Forecast(String schoolId,
                           String baseYear,
                           String forecastYear,
                           int yearsAhead,
                           int baseEnrolment,
                           double growthRate,
                           int projectedEnrolment,
                           int projectedClassroomsReq,
                           int projectedTeachersReq,
                           int currentClassrooms,
                           int currentTeachers,
                           int projectedClassroomGap,
                           int projectedTeacherGap,
                           Integer category) {}
}
