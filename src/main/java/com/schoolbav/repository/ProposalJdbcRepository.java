package com.schoolbav.repository;

import com.schoolbav.domain.Rounding;
import com.schoolbav.proposal.ProposalModels;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Seeded demand, its validations, and submitted proposals.
 */
@Repository
public class ProposalJdbcRepository {
    private static final String GAP_SELECT =
            "SELECT i.school_id, i.academic_year, GREATEST(COALESCE(i.classroom_gap, 0), 0), GREATEST(COALESCE(t.teacher_gap, 0), 0) " +
                    "FROM infrastructure_details i LEFT JOIN teacher_metrics t " +
                    "ON t.school_id = i.school_id AND t.academic_year = i.academic_year ";

    private static final RowMapper<ProposalModels.ActualGap> GAP_MAPPER = (rs, n) ->
            new ProposalModels.ActualGap(rs.getString(1), rs.getString(2), rs.getInt(3), rs.getInt(4));

    private final JdbcTemplate jdbcTemplate;

    public ProposalJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<ProposalModels.ActualGap> loadGaps(String academicYear) {
        return jdbcTemplate.query(GAP_SELECT + "WHERE i.academic_year = ? ORDER BY i.school_id", GAP_MAPPER, academicYear);
    }

    public Optional<ProposalModels.ActualGap> findGap(String schoolId, String academicYear) {
        return jdbcTemplate.query(GAP_SELECT + "WHERE i.school_id = ? AND i.academic_year = ?", GAP_MAPPER, schoolId, academicYear)
                .stream()
                .findFirst();
    }

    public List<ProposalModels.DemandProposal> loadDemand(String academicYear) {
        return jdbcTemplate.query(
                "SELECT school_id, academic_year, requested_classrooms, requested_teachers, proposal_source FROM school_demand_proposals WHERE academic_year = ? ORDER BY school_id",
                (rs, n) -> new ProposalModels.DemandProposal(rs.getString(1), rs.getString(2), rs.getInt(3), rs.getInt(4), rs.getString(5)),
                academicYear);
    }

    /** Replaces the seeded demand and its validations for one year. */
    @Transactional
    public int replaceYear(String academicYear,
                           List<ProposalModels.DemandProposal> demand,
                           List<ProposalModels.Validation> validations) {
        jdbcTemplate.update("DELETE FROM school_demand_proposals WHERE academic_year = ?", academicYear);
        jdbcTemplate.batchUpdate(
                "INSERT INTO school_demand_proposals(school_id, academic_year, requested_classrooms, requested_teachers, proposal_source) VALUES (?,?,?,?,?)",
                demand.stream().map(p -> new Object[]{p.schoolId(), p.academicYear(), p.requestedClassrooms(),
                        p.requestedTeachers(), p.source()}).toList());
        return replaceValidations(academicYear, validations);
    }

    @Transactional
    public int replaceValidations(String academicYear, List<ProposalModels.Validation> validations) {
        jdbcTemplate.update("DELETE FROM proposal_validations WHERE academic_year = ?", academicYear);
        jdbcTemplate.batchUpdate(
                "INSERT INTO proposal_validations(school_id, academic_year, requested_classrooms, requested_teachers, actual_classroom_gap, actual_teacher_gap, classroom_ratio, teacher_ratio, decision_status, reason_code, confidence_score) VALUES (?,?,?,?,?,?,?,?,?,?,?)",
                validations.stream().map(v -> new Object[]{v.proposal().schoolId(), v.proposal().academicYear(),
                        v.proposal().requestedClassrooms(), v.proposal().requestedTeachers(),
                        v.actual() == null ? null : v.actual().classroomGap(),
                        v.actual() == null ? null : v.actual().teacherGap(),
                        storable(v.decision().classroomRatio()), storable(v.decision().teacherRatio()),
                        v.decision().status().name(), v.decision().reason().name(), v.decision().confidence()}).toList());
        return validations.size();
    }

    public void saveSubmission(ProposalModels.Submission submission,
                               ProposalModels.ActualGap actual,
                               ProposalModels.Decision decision,
                               Instant submittedAt) {
        jdbcTemplate.update(
                "INSERT INTO school_proposals(school_id, academic_year, classrooms_requested, teachers_requested, actual_classroom_gap, actual_teacher_gap, justification, submitted_by, submitted_at, decision_status, reason_code, classroom_ratio, teacher_ratio, confidence_score) VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
                submission.schoolId(), submission.academicYear(), submission.classroomsRequested(), submission.teachersRequested(),
                actual == null ? null : actual.classroomGap(), actual == null ? null : actual.teacherGap(),
                submission.justification(), submission.submittedBy(), submittedAt.toString(),
                decision.status().name(), decision.reason().name(),
                storable(decision.classroomRatio()), storable(decision.teacherRatio()), decision.confidence());
    }

    /** SQL has no infinity; an unbounded ratio is stored as NULL. */
    private static Double storable(Double ratio) {
        if (ratio == null || ratio.isInfinite() || ratio.isNaN()) return null;
        return Rounding.round(ratio, 4);
    }
}
