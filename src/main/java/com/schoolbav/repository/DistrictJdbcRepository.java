package com.schoolbav.repository;

import com.schoolbav.district.DistrictModels;
import com.schoolbav.domain.DomainModels.ComplianceGrade;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.function.UnaryOperator;

@Repository
public class DistrictJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public DistrictJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Replaces the scorecards of {@code academicYears}, then re-derives the comparison columns of the
     * whole table with {@code secondPass}. Both steps commit together.
     */
    @Transactional
    public int replaceYears(Collection<String> academicYears,
                            List<DistrictModels.DistrictScore> scores,
                            UnaryOperator<List<DistrictModels.DistrictScore>> secondPass) {
        academicYears.forEach(year -> jdbcTemplate.update("DELETE FROM district_compliance_index WHERE academic_year = ?", year));
        jdbcTemplate.batchUpdate(
                "INSERT INTO district_compliance_index(district, academic_year, total_schools, avg_risk_score, pct_high_critical, total_classroom_deficit, total_teacher_deficit, total_enrolment, avg_classroom_condition, compliance_grade) VALUES (?,?,?,?,?,?,?,?,?,?)",
                scores.stream().map(s -> new Object[]{s.district(), s.academicYear(), s.totalSchools(), s.avgRiskScore(),
                        s.pctHighCritical(), s.totalClassroomDeficit(), s.totalTeacherDeficit(), s.totalEnrolment(),
                        s.avgClassroomCondition(), s.grade().name()}).toList());

        List<DistrictModels.DistrictScore> compared = secondPass.apply(loadAll());
        jdbcTemplate.batchUpdate(
                "UPDATE district_compliance_index SET yoy_risk_improvement = ?, district_rank = ? WHERE district = ? AND academic_year = ?",
                compared.stream().map(s -> new Object[]{s.yoyRiskImprovement(), s.districtRank(), s.district(), s.academicYear()}).toList());
        return scores.size();
    }

    public List<DistrictModels.DistrictScore> loadAll() {
        return jdbcTemplate.query(
                "SELECT district, academic_year, total_schools, avg_risk_score, pct_high_critical, total_classroom_deficit, total_teacher_deficit, total_enrolment, avg_classroom_condition, yoy_risk_improvement, district_rank, compliance_grade " +
                        "FROM district_compliance_index ORDER BY academic_year, district",
                (rs, n) -> new DistrictModels.DistrictScore(
                        rs.getString(1), rs.getString(2), rs.getInt(3), rs.getDouble(4), rs.getDouble(5),
                        rs.getInt(6), rs.getInt(7), rs.getLong(8), (Double) rs.getObject(9), (Double) rs.getObject(10),
                        rs.getInt(11), ComplianceGrade.valueOf(rs.getString(12))));
    }
}
