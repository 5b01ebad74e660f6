package com.schoolbav;

import com.schoolbav.domain.DomainModels.FacilityFact;
import com.schoolbav.domain.DomainModels.InfrastructureFact;
import com.schoolbav.domain.DomainModels.School;
import com.schoolbav.domain.DomainModels.TeacherFact;
import com.schoolbav.domain.DomainModels.YearlyMetric;
import com.schoolbav.repository.FactJdbcRepository;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Small three-year dataset:
 * X  category 1, North, 900 pupils, 25 rooms, 20 teachers every year (the worked example)
 * H  category 1, North, 600 pupils, 5 rooms, 5 teachers every year (HIGH three years running)
 * S  category 4, South, growing 700/800/1000 with ample rooms and teachers
 * N  unmapped category 9, South, 2023-24 only, no infrastructure fact
 * E  category 2, East, 2023-24 only, no teacher fact
 */
public final class SchoolBavTestData {
    public static final List<String> YEARS = List.of("2021-22", "2022-23", "2023-24");
    public static final String LATEST = "2023-24";

    private static final List<String> TABLES = List.of(
            "school_proposals", "proposal_validations", "school_demand_proposals", "enrolment_forecast",
            "budget_simulation", "district_compliance_index", "risk_trend", "school_priority_index",
            "teacher_metrics", "infrastructure_details", "yearly_metrics", "schools");

    private SchoolBavTestData() {
    }

    public static void reset(JdbcTemplate jdbcTemplate) {
        TABLES.forEach(table -> jdbcTemplate.update("DELETE FROM " + table));
    }

    public static void load(FactJdbcRepository facts) {
        facts.saveSchools(List.of(
                new School("X", "Example Primary", "North", "Block A", "Government", 1),
                new School("H", "Hill Primary", "North", "Block A", "Government", 1),
                new School("S", "South Secondary", "South", "Block B", "Aided", 4),
                new School("N", "New Campus", "South", "Block B", "Private", 9),
                new School("E", "East Primary", "East", "Block C", "Government", 2)));

        List<YearlyMetric> metrics = new ArrayList<>();
        List<InfrastructureFact> rooms = new ArrayList<>();
        List<TeacherFact> teachers = new ArrayList<>();
        int[] southEnrolment = {700, 800, 1000};
        for (int i = 0; i < YEARS.size(); i++) {
            String year = YEARS.get(i);
            metrics.add(new YearlyMetric("X", year, 900));
            metrics.add(new YearlyMetric("H", year, 600));
            metrics.add(new YearlyMetric("S", year, southEnrolment[i]));
            rooms.add(new InfrastructureFact("X", year, 27, 25, 3));
            rooms.add(new InfrastructureFact("H", year, 6, 5, 2));
            rooms.add(new InfrastructureFact("S", year, 30, 30, 4));
            teachers.add(new TeacherFact("X", year, 20));
            teachers.add(new TeacherFact("H", year, 5));
            teachers.add(new TeacherFact("S", year, 30));
        }
        metrics.add(new YearlyMetric("N", LATEST, 300));
        teachers.add(new TeacherFact("N", LATEST, 4));
        metrics.add(new YearlyMetric("E", LATEST, 120));
        rooms.add(new InfrastructureFact("E", LATEST, 4, 4, 5));

        facts.saveYearlyMetrics(metrics);
        facts.saveInfrastructureFacts(rooms);
        facts.saveTeacherFacts(teachers);
        facts.saveFacilityFacts(List.of(
                new FacilityFact("X", LATEST, true, true, false, true, null, false, null, "Good")));
    }
}
