package com.schoolbav.repository;

import com.schoolbav.forecast.ForecastModels;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

@Repository
public class ForecastJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public ForecastJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public int replaceBaseYears(Collection<String> baseYears, List<ForecastModels.Forecast> forecasts) {
        baseYears.forEach(year -> jdbcTemplate.update("DELETE FROM enrolment_forecast WHERE base_year = ?", year));
        jdbcTemplate.batchUpdate(
                "INSERT INTO enrolment_forecast(school_id, base_year, forecast_year, years_ahead, base_enrolment, avg_growth_rate, projected_enrolment, projected_classrooms_req, projected_teachers_req, current_classrooms, current_teachers, projected_classroom_gap, projected_teacher_gap, school_category) VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
                forecasts.stream().map(f -> new Object[]{f.schoolId(), f.baseYear(), f.forecastYear(), f.yearsAhead(),
                        f.baseEnrolment(), f.growthRate(), f.projectedEnrolment(), f.projectedClassroomsReq(),
                        f.projectedTeachersReq(), f.currentClassrooms(), f.currentTeachers(), f.projectedClassroomGap(),
                        f.projectedTeacherGap(), f.category()}).toList());
        return forecasts.size();
    }
}
