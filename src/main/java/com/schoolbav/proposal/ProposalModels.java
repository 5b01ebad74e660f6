package com.schoolbav.proposal;

import com.schoolbav.domain.DomainModels.DecisionStatus;
import com.schoolbav.domain.DomainModels.ReasonCode;

import java.util.Map;

public class ProposalModels {
    public record DemandProposal(String schoolId,
                                 String academicYear,
                                 int requestedClassrooms,
                                 int requestedTeachers,
                                 String source) {}

    /** Positive part of the computed gaps of one school-year. */
    public record ActualGap(String schoolId, String academicYear, int classroomGap, int teacherGap) {}

    /** Ratios are {@code Infinity} when something is requested against a zero gap. */
    public record Decision(DecisionStatus status,
                           ReasonCode reason,
                           Double classroomRatio,
                           Double teacherRatio,
                           double confidence) {}

    public record Validation(DemandProposal proposal, ActualGap actual, Decision decision) {}

    public record Submission(String schoolId,
                             String academicYear,
                             int classroomsRequested,
                             int teachersRequested,
                             String justification,
                             String submittedBy) {}

    public record SubmissionResult(DecisionStatus decisionStatus,
                                   ReasonCode reasonCode,
                                   double confidenceScore,
                                   Double classroomRatio,
                                   Double teacherRatio,
                                   Map<String, Object> actualGaps,
                                   String message) {}
}
