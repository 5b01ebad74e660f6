package com.schoolbav.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only views over the derived tables for the REST layer. Column names come back in
 * lower snake case.
 */
@Repository
public class QueryJdbcRepository {
    public static final int SEARCH_LIMIT = 20;
    public static final int PRIORITY_LIMIT = 50;
    public static final int BLOCK_SCHOOLS_LIMIT = 100;
    public static final int WATCHLIST_LIMIT = 30;
    public static final int DISTRICT_LEADERBOARD_LIMIT = 10;

    private static final List<String> RISK_LEVELS = List.of("CRITICAL", "HIGH", "MODERATE", "LOW");

    private final JdbcTemplate jdbcTemplate;

    public QueryJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<String> scoredYears() {
        return jdbcTemplate.queryForList(
                "SELECT DISTINCT academic_year FROM infrastructure_details WHERE risk_score IS NOT NULL ORDER BY academic_year",
                String.class);
    }

    public Optional<String> latestScoredYear() {
        List<String> years = scoredYears();
        return years.isEmpty() ? Optional.empty() : Optional.of(years.get(years.size() - 1));
    }

    /** {@code year} when given, else the latest scored year. */
    public String yearOrLatest(String year) {
        if (year != null && !year.isBlank()) return year;
        return latestScoredYear().orElseThrow(() -> new IllegalArgumentException("no scored academic years yet"));
    }

    // state

    public List<Map<String, Object>> riskLevelCounts(String year) {
        return jdbcTemplate.queryForList(
                "SELECT risk_level, COUNT(*) AS schools FROM infrastructure_details WHERE academic_year = ? AND risk_level IS NOT NULL GROUP BY risk_level ORDER BY risk_level",
                year);
    }

    public Map<String, Object> stateTotals(String year) {
        return jdbcTemplate.queryForMap("""
                SELECT COUNT(*) AS total_schools,
                       ROUND(AVG(i.risk_score), 4) AS avg_risk_score,
                       COALESCE(SUM(y.total_enrolment), 0) AS total_enrolment,
                       COALESCE(SUM(i.classroom_gap), 0) AS total_classroom_gap,
                       COALESCE(SUM(t.teacher_gap), 0) AS total_teacher_gap
                FROM infrastructure_details i
                LEFT JOIN yearly_metrics y ON y.school_id = i.school_id AND y.academic_year = i.academic_year
                LEFT JOIN teacher_metrics t ON t.school_id = i.school_id AND t.academic_year = i.academic_year
                WHERE i.academic_year = ?
                """, year);
    }

    public Map<String, Object> allocationTotals(String year) {
        return jdbcTemplate.queryForMap("""
                SELECT COUNT(*) AS school_years,
                       COALESCE(SUM(classrooms_allocated), 0) AS classrooms_allocated,
                       COALESCE(SUM(teachers_allocated), 0) AS teachers_allocated,
                       COALESCE(SUM(CASE WHEN classroom_resolved THEN 1 ELSE 0 END), 0) AS classroom_resolved,
                       COALESCE(SUM(CASE WHEN teacher_resolved THEN 1 ELSE 0 END), 0) AS teacher_resolved
                FROM budget_simulation WHERE academic_year = ?
                """, year);
    }

    public List<Map<String, Object>> districtScorecards(String year) {
        return jdbcTemplate.queryForList(
                "SELECT * FROM district_compliance_index WHERE academic_year = ? ORDER BY district_rank, district",
                year);
    }

    public List<Map<String, Object>> stateTrends() {
        return jdbcTemplate.queryForList("""
                SELECT i.academic_year,
                       COUNT(*) AS total_schools,
                       ROUND(AVG(i.risk_score), 4) AS avg_risk_score,
                       COALESCE(SUM(y.total_enrolment), 0) AS total_enrolment
                FROM infrastructure_details i
                LEFT JOIN yearly_metrics y ON y.school_id = i.school_id AND y.academic_year = i.academic_year
                WHERE i.risk_score IS NOT NULL
                GROUP BY i.academic_year
                ORDER BY i.academic_year
                """);
    }

    /** Committed allocation by funding outcome, and the districts left with the largest unfunded classroom gap. */
    public Map<String, Object> budgetOutcomes(String year) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("by_status", jdbcTemplate.queryForList("""
                SELECT allocation_status, COUNT(*) AS schools,
                       SUM(classrooms_allocated) AS classrooms, SUM(teachers_allocated) AS teachers
                FROM (SELECT CASE
                                 WHEN classroom_gap = 0 AND teacher_gap = 0 THEN 'NO_DEMAND'
                                 WHEN classroom_resolved AND teacher_resolved THEN 'FUNDED'
                                 WHEN classroom_resolved OR teacher_resolved THEN 'PARTIALLY_FUNDED'
                                 ELSE 'UNFUNDED'
                             END AS allocation_status,
                             classrooms_allocated, teachers_allocated
                      FROM budget_simulation WHERE academic_year = ?) b
                GROUP BY allocation_status
                ORDER BY allocation_status
                """, year));
        body.put("top_unfunded_districts", jdbcTemplate.queryForList("""
                SELECT s.district,
                       SUM(b.classroom_gap - b.classrooms_allocated) AS unfunded_classroom_gap,
                       SUM(b.teacher_gap - b.teachers_allocated) AS unfunded_teacher_gap,
                       COUNT(*) AS schools
                FROM budget_simulation b
                JOIN schools s ON s.school_id = b.school_id
                WHERE b.academic_year = ? AND NOT b.classroom_resolved AND NOT b.teacher_resolved
                GROUP BY s.district
                ORDER BY unfunded_classroom_gap DESC, s.district
                LIMIT ?
                """, year, DISTRICT_LEADERBOARD_LIMIT));
        return body;
    }

    /** Projected gaps per horizon, and the districts with the largest classroom gap three years out. */
    public Map<String, Object> forecastOutlook() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("by_horizon", jdbcTemplate.queryForList("""
                SELECT years_ahead, forecast_year,
                       SUM(projected_classroom_gap) AS classroom_gap,
                       SUM(projected_teacher_gap) AS teacher_gap,
                       ROUND(AVG(avg_growth_rate), 4) AS mean_growth,
                       SUM(projected_enrolment) AS total_enrolment
                FROM enrolment_forecast
                GROUP BY years_ahead, forecast_year
                ORDER BY years_ahead, forecast_year
                """));
        body.put("top_districts", jdbcTemplate.queryForList("""
                SELECT s.district,
                       SUM(f.projected_classroom_gap) AS classroom_gap,
                       SUM(f.projected_teacher_gap) AS teacher_gap,
                       SUM(f.projected_enrolment) AS enrolment,
                       ROUND(AVG(f.avg_growth_rate), 4) AS growth
                FROM enrolment_forecast f
                JOIN schools s ON s.school_id = f.school_id
                WHERE f.years_ahead = 3
                GROUP BY s.district
                ORDER BY classroom_gap DESC, s.district
                LIMIT ?
                """, DISTRICT_LEADERBOARD_LIMIT));
        return body;
    }

    // districts

    public List<String> districts() {
        return jdbcTemplate.queryForList(
                "SELECT DISTINCT district FROM schools WHERE district IS NOT NULL ORDER BY district", String.class);
    }

    public List<Map<String, Object>> districtCompliance(String district) {
        return jdbcTemplate.queryForList(
                "SELECT * FROM district_compliance_index WHERE district = ? ORDER BY academic_year", district);
    }

    public List<Map<String, Object>> districtPriority(String district, String year) {
        return jdbcTemplate.queryForList("""
                SELECT p.school_id, s.school_name, s.block, p.risk_score, p.state_rank, p.district_rank,
                       p.priority_bucket, p.persistent_high_risk_flag
                FROM school_priority_index p
                JOIN schools s ON s.school_id = p.school_id
                WHERE s.district = ? AND p.academic_year = ?
                ORDER BY p.district_rank, p.school_id
                LIMIT ?
                """, district, year, PRIORITY_LIMIT);
    }

    /** Risk level counts per block, one row per block with a column per level. */
    public List<Map<String, Object>> districtBlocks(String district, String year) {
        Map<String, Map<String, Object>> blocks = new LinkedHashMap<>();
        jdbcTemplate.query("""
                SELECT COALESCE(s.block, 'UNKNOWN') AS block, i.risk_level, COUNT(*) AS schools
                FROM infrastructure_details i
                JOIN schools s ON s.school_id = i.school_id
                WHERE s.district = ? AND i.academic_year = ? AND i.risk_level IS NOT NULL
                GROUP BY COALESCE(s.block, 'UNKNOWN'), i.risk_level
                ORDER BY block
                """, rs -> {
            Map<String, Object> block = blocks.computeIfAbsent(rs.getString("block"), name -> {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("block", name);
                RISK_LEVELS.forEach(level -> row.put(level, 0L));
                row.put("total", 0L);
                return row;
            });
            long count = rs.getLong("schools");
            block.put(rs.getString("risk_level"), count);
            block.merge("total", count, (a, b) -> (Long) a + (Long) b);
        }, district, year);
        return new ArrayList<>(blocks.values());
    }

    public Map<String, Object> districtProposals(String district, String year) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("summary", jdbcTemplate.queryForList("""
                SELECT v.decision_status, COUNT(*) AS schools
                FROM proposal_validations v
                JOIN schools s ON s.school_id = v.school_id
                WHERE s.district = ? AND v.academic_year = ?
                GROUP BY v.decision_status
                ORDER BY v.decision_status
                """, district, year));
        body.put("flagged", jdbcTemplate.queryForList("""
                SELECT v.school_id, s.school_name, s.block, v.decision_status, v.reason_code,
                       v.confidence_score, v.classroom_ratio, v.teacher_ratio
                FROM proposal_validations v
                JOIN schools s ON s.school_id = v.school_id
                WHERE s.district = ? AND v.academic_year = ? AND v.decision_status = 'FLAGGED'
                ORDER BY v.confidence_score, v.school_id
                LIMIT ?
                """, district, year, WATCHLIST_LIMIT));
        return body;
    }

    public List<Map<String, Object>> districtTrend(String district) {
        return jdbcTemplate.queryForList("""
                SELECT academic_year, avg_risk_score, compliance_grade, district_rank,
                       yoy_risk_improvement, total_schools, pct_high_critical
                FROM district_compliance_index
                WHERE district = ?
                ORDER BY academic_year
                """, district);
    }

    // blocks

    public Map<String, Object> blockSummary(String district, String block, String year) {
        Map<String, Object> kpis = jdbcTemplate.queryForMap("""
                SELECT COUNT(*) AS total_schools,
                       COALESCE(SUM(CASE WHEN i.risk_level = 'CRITICAL' THEN 1 ELSE 0 END), 0) AS critical,
                       COALESCE(SUM(CASE WHEN i.risk_level = 'HIGH' THEN 1 ELSE 0 END), 0) AS high,
                       COALESCE(SUM(CASE WHEN i.risk_level = 'MODERATE' THEN 1 ELSE 0 END), 0) AS moderate,
                       COALESCE(SUM(CASE WHEN i.risk_level = 'LOW' THEN 1 ELSE 0 END), 0) AS low,
                       ROUND(AVG(i.risk_score), 4) AS avg_risk_score,
                       COALESCE(SUM(i.classroom_gap), 0) AS total_classroom_gap,
                       COALESCE(SUM(t.teacher_gap), 0) AS total_teacher_gap
                FROM infrastructure_details i
                JOIN schools s ON s.school_id = i.school_id
                LEFT JOIN teacher_metrics t ON t.school_id = i.school_id AND t.academic_year = i.academic_year
                WHERE s.district = ? AND COALESCE(s.block, 'UNKNOWN') = ? AND i.academic_year = ?
                """, district, block, year);
        Long funded = jdbcTemplate.queryForObject("""
                SELECT COUNT(*)
                FROM budget_simulation b
                JOIN schools s ON s.school_id = b.school_id
                WHERE s.district = ? AND COALESCE(s.block, 'UNKNOWN') = ? AND b.academic_year = ?
                  AND (b.classroom_gap > 0 OR b.teacher_gap > 0) AND b.classroom_resolved AND b.teacher_resolved
                """, Long.class, district, block, year);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("kpis", kpis);
        body.put("funded_count", funded == null ? 0L : funded);
        return body;
    }

    public List<Map<String, Object>> blockSchools(String district, String block, String year) {
        return jdbcTemplate.queryForList("""
                SELECT i.school_id, s.school_name, s.school_category, i.risk_score, i.risk_level, i.classroom_gap,
                       COALESCE(t.teacher_gap, 0) AS teacher_gap,
                       COALESCE(r.trend_direction, 'N/A') AS trend_direction,
                       COALESCE(r.chronic_risk_flag, FALSE) AS is_chronic,
                       COALESCE(r.volatile_flag, FALSE) AS is_volatile,
                       CASE
                           WHEN b.school_id IS NULL THEN 'NOT_ALLOCATED'
                           WHEN b.classroom_gap = 0 AND b.teacher_gap = 0 THEN 'NO_DEMAND'
                           WHEN b.classroom_resolved AND b.teacher_resolved THEN 'FUNDED'
                           WHEN b.classroom_resolved OR b.teacher_resolved THEN 'PARTIAL'
                           ELSE 'UNFUNDED'
                       END AS budget_status,
                       y.total_enrolment
                FROM infrastructure_details i
                JOIN schools s ON s.school_id = i.school_id
                LEFT JOIN yearly_metrics y ON y.school_id = i.school_id AND y.academic_year = i.academic_year
                LEFT JOIN teacher_metrics t ON t.school_id = i.school_id AND t.academic_year = i.academic_year
                LEFT JOIN risk_trend r ON r.school_id = i.school_id AND r.academic_year = i.academic_year
                LEFT JOIN budget_simulation b ON b.school_id = i.school_id AND b.academic_year = i.academic_year
                WHERE s.district = ? AND COALESCE(s.block, 'UNKNOWN') = ? AND i.academic_year = ?
                ORDER BY i.risk_score DESC NULLS LAST, i.school_id
                LIMIT ?
                """, district, block, year, BLOCK_SCHOOLS_LIMIT);
    }

    /** Chronic schools of the block, and the volatile ones ordered by the size of their swing. */
    public Map<String, Object> blockWatchlist(String district, String block, String year) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chronic", jdbcTemplate.queryForList("""
                SELECT r.school_id, s.school_name, r.risk_score, r.trend_direction, r.volatile_flag AS is_volatile,
                       i.classroom_gap, COALESCE(t.teacher_gap, 0) AS teacher_gap
                FROM risk_trend r
                JOIN schools s ON s.school_id = r.school_id
                JOIN infrastructure_details i ON i.school_id = r.school_id AND i.academic_year = r.academic_year
                LEFT JOIN teacher_metrics t ON t.school_id = r.school_id AND t.academic_year = r.academic_year
                WHERE s.district = ? AND COALESCE(s.block, 'UNKNOWN') = ? AND r.academic_year = ? AND r.chronic_risk_flag
                ORDER BY r.risk_score DESC, r.school_id
                """, district, block, year));
        body.put("volatile", jdbcTemplate.queryForList("""
                SELECT r.school_id, s.school_name, r.risk_score, r.risk_delta, r.trend_direction
                FROM risk_trend r
                JOIN schools s ON s.school_id = r.school_id
                WHERE s.district = ? AND COALESCE(s.block, 'UNKNOWN') = ? AND r.academic_year = ? AND r.volatile_flag
                ORDER BY ABS(r.risk_delta) DESC, r.school_id
                LIMIT ?
                """, district, block, year, WATCHLIST_LIMIT));
        return body;
    }

    // schools

    public List<Map<String, Object>> searchSchools(String q) {
        String pattern = "%" + q.toLowerCase() + "%";
        return jdbcTemplate.queryForList("""
                SELECT school_id, school_name, district, block, school_category
                FROM schools
                WHERE LOWER(school_id) LIKE ? OR LOWER(school_name) LIKE ?
                ORDER BY school_name, school_id
                LIMIT ?
                """, pattern, pattern, SEARCH_LIMIT);
    }

    public Optional<Map<String, Object>> school(String schoolId) {
        return jdbcTemplate.queryForList("SELECT * FROM schools WHERE school_id = ?", schoolId).stream().findFirst();
    }

    public Optional<Map<String, Object>> latestSnapshot(String schoolId) {
        return jdbcTemplate.queryForList("""
                SELECT i.academic_year, y.total_enrolment, i.usable_class_rooms, i.required_class_rooms, i.classroom_gap,
                       t.total_teachers, t.required_teachers, t.teacher_gap, i.risk_score, i.risk_level,
                       p.state_rank, p.district_rank, p.priority_bucket, p.persistent_high_risk_flag,
                       r.trend_direction, r.chronic_risk_flag, r.volatile_flag
                FROM infrastructure_details i
                LEFT JOIN yearly_metrics y ON y.school_id = i.school_id AND y.academic_year = i.academic_year
                LEFT JOIN teacher_metrics t ON t.school_id = i.school_id AND t.academic_year = i.academic_year
                LEFT JOIN school_priority_index p ON p.school_id = i.school_id AND p.academic_year = i.academic_year
                LEFT JOIN risk_trend r ON r.school_id = i.school_id AND r.academic_year = i.academic_year
                WHERE i.school_id = ?
                ORDER BY i.academic_year DESC
                LIMIT 1
                """, schoolId).stream().findFirst();
    }

    /** Amenity checklist and building condition from the school's most recent infrastructure row. */
    public Optional<Map<String, Object>> schoolFacilities(String schoolId) {
        return jdbcTemplate.queryForList("""
                SELECT academic_year, drinking_water_available AS drinking_water, electricity_available AS electricity,
                       internet_available AS internet, separate_girls_toilet AS girls_toilet, ramp_available AS ramp,
                       cwsn_toilet_available AS cwsn_toilet, resource_room_available AS resource_room,
                       building_condition, classroom_condition_score, total_class_rooms, usable_class_rooms
                FROM infrastructure_details
                WHERE school_id = ?
                ORDER BY academic_year DESC
                LIMIT 1
                """, schoolId).stream().findFirst();
    }

    public List<Map<String, Object>> schoolHistory(String schoolId) {
        return jdbcTemplate.queryForList("""
                SELECT i.academic_year, y.total_enrolment, i.total_class_rooms, i.usable_class_rooms,
                       i.required_class_rooms, i.classroom_gap, t.total_teachers, t.required_teachers, t.teacher_gap,
                       i.classroom_deficit_ratio, i.teacher_deficit_ratio, i.enrolment_growth_rate,
                       i.risk_score, i.risk_level
                FROM infrastructure_details i
                LEFT JOIN yearly_metrics y ON y.school_id = i.school_id AND y.academic_year = i.academic_year
                LEFT JOIN teacher_metrics t ON t.school_id = i.school_id AND t.academic_year = i.academic_year
                WHERE i.school_id = ?
                ORDER BY i.academic_year
                """, schoolId);
    }

    /** Forecast rows of the school's most recent base year. */
    public List<Map<String, Object>> schoolForecast(String schoolId) {
        return jdbcTemplate.queryForList("""
                SELECT * FROM enrolment_forecast
                WHERE school_id = ?
                  AND base_year = (SELECT MAX(base_year) FROM enrolment_forecast WHERE school_id = ?)
                ORDER BY years_ahead
                """, schoolId, schoolId);
    }

    public List<Map<String, Object>> schoolTrend(String schoolId) {
        return jdbcTemplate.queryForList(
                "SELECT * FROM risk_trend WHERE school_id = ? ORDER BY academic_year", schoolId);
    }

    public List<Map<String, Object>> proposalsForSchool(String schoolId) {
        return jdbcTemplate.queryForList("""
                SELECT id, school_id, academic_year, classrooms_requested, teachers_requested, actual_classroom_gap,
                       actual_teacher_gap, justification, submitted_by, submitted_at, decision_status, reason_code,
                       confidence_score, classroom_ratio, teacher_ratio
                FROM school_proposals
                WHERE school_id = ?
                ORDER BY id DESC
                """, schoolId);
    }
}
