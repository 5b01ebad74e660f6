package com.schoolbav.repository;

import com.schoolbav.domain.DomainModels.InfrastructureRow;
import com.schoolbav.domain.DomainModels.RiskLevel;
import com.schoolbav.domain.DomainModels.TeacherRow;
import com.schoolbav.gap.GapModels;
import com.schoolbav.risk.RiskModels;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Computed columns of infrastructure_details and teacher_metrics.
 */
@Repository
public class InfrastructureJdbcRepository {
    private static final String INFRA_SELECT =
            "SELECT i.school_id, i.academic_year, s.district, i.usable_class_rooms, i.classroom_condition_score, " +
                    "i.required_class_rooms, i.classroom_gap, i.risk_score, i.risk_level " +
                    "FROM infrastructure_details i LEFT JOIN schools s ON s.school_id = i.school_id ";

    private static final RowMapper<InfrastructureRow> INFRA_MAPPER = (rs, n) -> new InfrastructureRow(
            rs.getString(1), rs.getString(2), rs.getString(3),
            (Integer) rs.getObject(4), (Integer) rs.getObject(5),
            (Integer) rs.getObject(6), (Integer) rs.getObject(7),
            (Double) rs.getObject(8), RiskLevel.parse(rs.getString(9)));

    private final JdbcTemplate jdbcTemplate;

    public InfrastructureJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /** Overwrites required/gap for the listed school-years, creating the row when ingestion supplied none. */
    @Transactional
    public int replaceClassroomRequirements(List<GapModels.Requirement> requirements) {
        int[] counts = jdbcTemplate.batchUpdate(
                "MERGE INTO infrastructure_details(school_id, academic_year, required_class_rooms, classroom_gap) KEY(school_id, academic_year) VALUES (?,?,?,?)",
                requirements.stream().map(r -> new Object[]{r.schoolId(), r.academicYear(), r.required(), r.gap()}).toList());
        return counts.length;
    }

    @Transactional
    public int replaceTeacherRequirements(List<GapModels.Requirement> requirements) {
        int[] counts = jdbcTemplate.batchUpdate(
                "MERGE INTO teacher_metrics(school_id, academic_year, required_teachers, teacher_gap) KEY(school_id, academic_year) VALUES (?,?,?,?)",
                requirements.stream().map(r -> new Object[]{r.schoolId(), r.academicYear(), r.required(), r.gap()}).toList());
        return counts.length;
    }

    @Transactional
    public int replaceRiskScores(List<RiskModels.RiskAssessment> assessments) {
        int[] counts = jdbcTemplate.batchUpdate(
                "UPDATE infrastructure_details SET classroom_deficit_ratio = ?, teacher_deficit_ratio = ?, enrolment_growth_rate = ?, risk_score = ?, risk_level = ? " +
                        "WHERE school_id = ? AND academic_year = ?",
                assessments.stream().map(a -> new Object[]{a.classroomDeficitRatio(), a.teacherDeficitRatio(),
                        a.enrolmentGrowthRate(), a.riskScore(), a.riskLevel().name(), a.schoolId(), a.academicYear()}).toList());
        return counts.length;
    }

    public List<InfrastructureRow> loadRows(String academicYear) {
        return jdbcTemplate.query(INFRA_SELECT + "WHERE i.academic_year = ?", INFRA_MAPPER, academicYear);
    }

    /** Every school-year row, scored or not, ordered chronologically within each school. */
    public List<InfrastructureRow> loadHistory() {
        return jdbcTemplate.query(INFRA_SELECT + "ORDER BY i.school_id, i.academic_year", INFRA_MAPPER);
    }

    public List<TeacherRow> loadTeacherRows(String academicYear) {
        return jdbcTemplate.query(
                "SELECT school_id, academic_year, total_teachers, required_teachers, teacher_gap FROM teacher_metrics WHERE academic_year = ?",
                (rs, n) -> new TeacherRow(rs.getString(1), rs.getString(2), (Integer) rs.getObject(3),
                        (Integer) rs.getObject(4), (Integer) rs.getObject(5)),
                academicYear);
    }

    public long countRows(String academicYear) {
        return count("SELECT COUNT(*) FROM infrastructure_details WHERE academic_year = ?", academicYear);
    }

    public long countMissingClassroomRequirement(String academicYear) {
        return count("SELECT COUNT(*) FROM infrastructure_details WHERE academic_year = ? AND required_class_rooms IS NULL", academicYear);
    }

    public long countMissingTeacherRequirement(String academicYear) {
        return count("SELECT COUNT(*) FROM teacher_metrics WHERE academic_year = ? AND required_teachers IS NULL", academicYear);
    }

    /** School-years with an infrastructure row but no teacher row carrying a requirement. */
    public long countMissingTeacherCounterpart(String academicYear) {
        return count("""
                SELECT COUNT(*) FROM infrastructure_details i
                LEFT JOIN teacher_metrics t ON t.school_id = i.school_id AND t.academic_year = i.academic_year
                WHERE i.academic_year = ? AND t.required_teachers IS NULL
                """, academicYear);
    }

    public long countMissingRiskScore(String academicYear) {
        return count("SELECT COUNT(*) FROM infrastructure_details WHERE academic_year = ? AND risk_score IS NULL", academicYear);
    }

    private long count(String sql, Object... args) {
        Long value = jdbcTemplate.queryForObject(sql, Long.class, args);
        return value == null ? 0 : value;
    }
}
