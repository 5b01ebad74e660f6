package com.schoolbav.proposal;

import com.schoolbav.domain.DomainModels.DecisionStatus;
import com.schoolbav.domain.DomainModels.ReasonCode;
import com.schoolbav.domain.Rounding;

import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Decision tree comparing requested resources with computed gaps. Rules are evaluated in order and
 * the first match wins, so the worse of the two resource outcomes governs.
 */
public final class ProposalValidator {
    public static final double OVER_REQUEST_ABOVE = 1.5;
    public static final double MODERATE_FROM = 1.2;
    public static final double UNDER_REQUEST_BELOW = 0.5;

    static final double NO_DEFICIT_CONFIDENCE = 0.1;
    static final double OVER_REQUEST_CONFIDENCE = 0.2;
    static final double MODERATE_CONFIDENCE = 0.5;
    static final double UNDER_REQUEST_CONFIDENCE = 0.6;
    static final double NO_REQUEST_CONFIDENCE = 1.0;

    private ProposalValidator() {
    }

    public static ProposalModels.Decision validate(int requestedClassrooms, int requestedTeachers,
                                                   int classroomGap, int teacherGap) {
        double cr = ratio(requestedClassrooms, classroomGap);
        double tr = ratio(requestedTeachers, teacherGap);

        if (classroomGap == 0 && teacherGap == 0 && (requestedClassrooms > 0 || requestedTeachers > 0)) {
            return decision(DecisionStatus.REJECTED, ReasonCode.NO_DEFICIT, cr, tr, NO_DEFICIT_CONFIDENCE);
        }
        if (cr > OVER_REQUEST_ABOVE) {
            return decision(DecisionStatus.REJECTED, ReasonCode.CLASSROOM_OVER_REQUEST, cr, tr, OVER_REQUEST_CONFIDENCE);
        }
        if (tr > OVER_REQUEST_ABOVE) {
            return decision(DecisionStatus.REJECTED, ReasonCode.TEACHER_OVER_REQUEST, cr, tr, OVER_REQUEST_CONFIDENCE);
        }
        if (cr >= MODERATE_FROM) {
            return decision(DecisionStatus.FLAGGED, ReasonCode.CLASSROOM_MODERATE_OVER, cr, tr, MODERATE_CONFIDENCE);
        }
        if (tr >= MODERATE_FROM) {
            return decision(DecisionStatus.FLAGGED, ReasonCode.TEACHER_MODERATE_OVER, cr, tr, MODERATE_CONFIDENCE);
        }
        if (cr < UNDER_REQUEST_BELOW && classroomGap > 0) {
            return decision(DecisionStatus.FLAGGED, ReasonCode.CLASSROOM_UNDER_REQUEST, cr, tr, UNDER_REQUEST_CONFIDENCE);
        }
        if (tr < UNDER_REQUEST_BELOW && teacherGap > 0) {
            return decision(DecisionStatus.FLAGGED, ReasonCode.TEACHER_UNDER_REQUEST, cr, tr, UNDER_REQUEST_CONFIDENCE);
        }
        if (requestedClassrooms == 0 && requestedTeachers == 0 && classroomGap == 0 && teacherGap == 0) {
            return decision(DecisionStatus.ACCEPTED, ReasonCode.NO_REQUEST, 0.0, 0.0, NO_REQUEST_CONFIDENCE);
        }
        double confidence = Math.max(0.0, 1.0 - 0.5 * Math.abs(cr - 1.0) - 0.5 * Math.abs(tr - 1.0));
        return decision(DecisionStatus.ACCEPTED, ReasonCode.WITHIN_TOLERANCE, cr, tr, Rounding.round(confidence, 3));
    }

    public static ProposalModels.Decision schoolNotFound() {
        return new ProposalModels.Decision(DecisionStatus.REJECTED, ReasonCode.SCHOOL_NOT_FOUND, null, null, 0.0);
    }

    /** requested / gap; against a zero gap any request is infinitely over. */
    public static double ratio(int requested, int gap) {
        if (gap > 0) return (double) requested / Math.max(gap, 1);
        return requested > 0 ? Double.POSITIVE_INFINITY : 0.0;
    }

    /**
     * Deterministic stand-in demand: the gap scaled by a factor in [0.70, 1.49] derived from
     * CRC32 of school id, year and resource suffix, rounded half up.
     */
    public static int syntheticRequest(int gap, String schoolId, String academicYear, String resource) {
        if (gap <= 0) return 0;
        CRC32 crc = new CRC32();
        crc.update((schoolId + academicYear + resource).getBytes(StandardCharsets.UTF_8));
        long factorPercent = 70 + crc.getValue() % 80;
        return (int) ((gap * factorPercent + 50) / 100);
    }

    public static String message(ProposalModels.Decision decision) {
        String reason = decision.reason().name().replace('_', ' ').toLowerCase();
        return switch (decision.status()) {
            case ACCEPTED -> "Proposal accepted, within tolerance of actual gaps.";
            case FLAGGED -> "Proposal flagged for manual review: " + reason + ".";
            case REJECTED -> "Proposal rejected: " + reason + ".";
        };
    }

    private static ProposalModels.Decision decision(DecisionStatus status, ReasonCode reason,
                                                    double cr, double tr, double confidence) {
        return new ProposalModels.Decision(status, reason, cr, tr, confidence);
    }
}
