package com.schoolbav.repository;

import com.schoolbav.priority.PriorityModels;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public class PriorityJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public PriorityJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public int replaceYear(String academicYear, List<PriorityModels.PriorityEntry> entries) {
        jdbcTemplate.update("DELETE FROM school_priority_index WHERE academic_year = ?", academicYear);
        jdbcTemplate.batchUpdate(
                "INSERT INTO school_priority_index(school_id, academic_year, risk_score, state_rank, district_rank, priority_bucket, persistent_high_risk_flag) VALUES (?,?,?,?,?,?,?)",
                entries.stream().map(e -> new Object[]{e.schoolId(), e.academicYear(), e.riskScore(), e.stateRank(),
                        e.districtRank(), e.bucket().name(), e.persistentHighRisk()}).toList());
        return entries.size();
    }
}
