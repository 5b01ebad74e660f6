package com.schoolbav.repository;

import com.schoolbav.trend.TrendModels;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

@Repository
public class TrendJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public TrendJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public int replaceYears(Collection<String> academicYears, List<TrendModels.TrendEntry> entries) {
        academicYears.forEach(year -> jdbcTemplate.update("DELETE FROM risk_trend WHERE academic_year = ?", year));
        jdbcTemplate.batchUpdate(
                "INSERT INTO risk_trend(school_id, academic_year, risk_score, prev_risk_score, risk_delta, trend_direction, year_over_year_count, cumulative_avg_risk, chronic_risk_flag, volatile_flag) VALUES (?,?,?,?,?,?,?,?,?,?)",
                entries.stream().map(e -> new Object[]{e.schoolId(), e.academicYear(), e.riskScore(), e.previousRiskScore(),
                        e.riskDelta(), e.direction().name(), e.sequence(), e.cumulativeAvgRisk(), e.chronic(), e.volatileRisk()}).toList());
        return entries.size();
    }
}
