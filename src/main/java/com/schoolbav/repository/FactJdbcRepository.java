package com.schoolbav.repository;

import com.schoolbav.domain.DomainModels.FacilityFact;
import com.schoolbav.domain.DomainModels.InfrastructureFact;
import com.schoolbav.domain.DomainModels.School;
import com.schoolbav.domain.DomainModels.TeacherFact;
import com.schoolbav.domain.DomainModels.YearlyMetric;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Committed facts written by ingestion. The pipeline only reads them; the save methods are the
 * landing point for the upstream loader.
 */
@Repository
public class FactJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public FactJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public void saveSchools(List<School> schools) {
        jdbcTemplate.batchUpdate(
                "MERGE INTO schools(school_id, school_name, district, block, management_type, school_category) KEY(school_id) VALUES (?,?,?,?,?,?)",
                schools.stream().map(s -> new Object[]{s.schoolId(), s.schoolName(), s.district(), s.block(),
                        s.managementType(), s.category()}).toList());
    }

    @Transactional
    public void saveYearlyMetrics(List<YearlyMetric> metrics) {
        jdbcTemplate.batchUpdate(
                "MERGE INTO yearly_metrics(school_id, academic_year, total_enrolment) KEY(school_id, academic_year) VALUES (?,?,?)",
                metrics.stream().map(m -> new Object[]{m.schoolId(), m.academicYear(), m.totalEnrolment()}).toList());
    }

    @Transactional
    public void saveInfrastructureFacts(List<InfrastructureFact> facts) {
        jdbcTemplate.batchUpdate(
                "MERGE INTO infrastructure_details(school_id, academic_year, total_class_rooms, usable_class_rooms, classroom_condition_score) KEY(school_id, academic_year) VALUES (?,?,?,?,?)",
                facts.stream().map(f -> new Object[]{f.schoolId(), f.academicYear(), f.totalClassRooms(),
                        f.usableClassRooms(), f.classroomConditionScore()}).toList());
    }

    @Transactional
    public void saveFacilityFacts(List<FacilityFact> facts) {
        jdbcTemplate.batchUpdate("""
                        MERGE INTO infrastructure_details(school_id, academic_year, drinking_water_available, electricity_available,
                            internet_available, separate_girls_toilet, ramp_available, cwsn_toilet_available,
                            resource_room_available, building_condition)
                        KEY(school_id, academic_year) VALUES (?,?,?,?,?,?,?,?,?,?)
                        """,
                facts.stream().map(f -> new Object[]{f.schoolId(), f.academicYear(), f.drinkingWater(), f.electricity(),
                        f.internet(), f.girlsToilet(), f.ramp(), f.cwsnToilet(), f.resourceRoom(),
                        f.buildingCondition()}).toList());
    }

    @Transactional
    public void saveTeacherFacts(List<TeacherFact> facts) {
        jdbcTemplate.batchUpdate(
                "MERGE INTO teacher_metrics(school_id, academic_year, total_teachers) KEY(school_id, academic_year) VALUES (?,?,?)",
                facts.stream().map(f -> new Object[]{f.schoolId(), f.academicYear(), f.totalTeachers()}).toList());
    }

    public Map<String, School> loadSchools() {
        return jdbcTemplate.query(
                        "SELECT school_id, school_name, district, block, management_type, school_category FROM schools",
                        (rs, n) -> new School(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
                                rs.getString(5), (Integer) rs.getObject(6)))
                .stream()
                .collect(Collectors.toMap(School::schoolId, Function.identity()));
    }

    public List<YearlyMetric> loadYearlyMetrics() {
        return jdbcTemplate.query(
                "SELECT school_id, academic_year, total_enrolment FROM yearly_metrics ORDER BY school_id, academic_year",
                (rs, n) -> new YearlyMetric(rs.getString(1), rs.getString(2), (Integer) rs.getObject(3)));
    }

    public List<YearlyMetric> loadYearlyMetrics(String academicYear) {
        return jdbcTemplate.query(
                "SELECT school_id, academic_year, total_enrolment FROM yearly_metrics WHERE academic_year = ?",
                (rs, n) -> new YearlyMetric(rs.getString(1), rs.getString(2), (Integer) rs.getObject(3)),
                academicYear);
    }

    public List<InfrastructureFact> loadInfrastructureFacts(String academicYear) {
        return jdbcTemplate.query(
                "SELECT school_id, academic_year, total_class_rooms, usable_class_rooms, classroom_condition_score FROM infrastructure_details WHERE academic_year = ?",
                (rs, n) -> new InfrastructureFact(rs.getString(1), rs.getString(2), (Integer) rs.getObject(3),
                        (Integer) rs.getObject(4), (Integer) rs.getObject(5)),
                academicYear);
    }

    public List<TeacherFact> loadTeacherFacts(String academicYear) {
        return jdbcTemplate.query(
                "SELECT school_id, academic_year, total_teachers FROM teacher_metrics WHERE academic_year = ?",
                (rs, n) -> new TeacherFact(rs.getString(1), rs.getString(2), (Integer) rs.getObject(3)),
                academicYear);
    }

    public List<String> distinctYears() {
        return jdbcTemplate.queryForList(
                "SELECT DISTINCT academic_year FROM yearly_metrics ORDER BY academic_year", String.class);
    }
}
