package com.schoolbav.proposal;

import com.schoolbav.domain.DomainModels.DecisionStatus;
import com.schoolbav.domain.DomainModels.ReasonCode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProposalValidatorTest {

    @Test
    void ratioOfExactlyOnePointTwoIsFlagged() {
        var decision = ProposalValidator.validate(6, 0, 5, 0);
        assertEquals(DecisionStatus.FLAGGED, decision.status());
        assertEquals(ReasonCode.CLASSROOM_MODERATE_OVER, decision.reason());
        assertEquals(1.2, decision.classroomRatio());
        assertEquals(0.5, decision.confidence());
    }

    @Test
    void ratioOfExactlyOnePointFiveIsStillModerate() {
        assertEquals(ReasonCode.TEACHER_MODERATE_OVER, ProposalValidator.validate(10, 15, 10, 10).reason());
        assertEquals(ReasonCode.CLASSROOM_OVER_REQUEST, ProposalValidator.validate(8, 0, 5, 0).reason());
    }

    @Test
    void requestWithoutAnyDeficitIsRejected() {
        var decision = ProposalValidator.validate(2, 0, 0, 0);
        assertEquals(DecisionStatus.REJECTED, decision.status());
        assertEquals(ReasonCode.NO_DEFICIT, decision.reason());
        assertEquals(0.1, decision.confidence());
    }

    @Test
    void requestAgainstOneZeroGapIsInfinitelyOver() {
        var decision = ProposalValidator.validate(5, 2, 5, 0);
        assertEquals(DecisionStatus.REJECTED, decision.status());
        assertEquals(ReasonCode.TEACHER_OVER_REQUEST, decision.reason());
        assertTrue(decision.teacherRatio().isInfinite());
        assertEquals(0.2, decision.confidence());
    }

    @Test
    void worseOutcomeGoverns() {
        // classroom within tolerance, teacher badly over
        assertEquals(DecisionStatus.REJECTED, ProposalValidator.validate(5, 20, 5, 10).status());
        // classroom under, teacher moderate: moderate is checked first
        assertEquals(ReasonCode.TEACHER_MODERATE_OVER, ProposalValidator.validate(1, 13, 5, 10).reason());
    }

    @Test
    void underRequestIsFlagged() {
        var decision = ProposalValidator.validate(2, 10, 5, 10);
        assertEquals(DecisionStatus.FLAGGED, decision.status());
        assertEquals(ReasonCode.CLASSROOM_UNDER_REQUEST, decision.reason());
        assertEquals(0.6, decision.confidence());
        assertEquals(ReasonCode.TEACHER_UNDER_REQUEST, ProposalValidator.validate(5, 0, 5, 10).reason());
    }

    @Test
    void nothingRequestedAndNothingNeeded() {
        var decision = ProposalValidator.validate(0, 0, 0, 0);
        assertEquals(DecisionStatus.ACCEPTED, decision.status());
        assertEquals(ReasonCode.NO_REQUEST, decision.reason());
        assertEquals(1.0, decision.confidence());
    }

    @Test
    void withinToleranceConfidenceFallsWithDeviation() {
        var exact = ProposalValidator.validate(5, 10, 5, 10);
        assertEquals(ReasonCode.WITHIN_TOLERANCE, exact.reason());
        assertEquals(1.0, exact.confidence());

        assertEquals(0.95, ProposalValidator.validate(5, 11, 5, 10).confidence());
        assertEquals(0.8, ProposalValidator.validate(4, 8, 5, 10).confidence());
    }

    @Test
    void unknownSchoolYearIsRejected() {
        var decision = ProposalValidator.schoolNotFound();
        assertEquals(DecisionStatus.REJECTED, decision.status());
        assertEquals(ReasonCode.SCHOOL_NOT_FOUND, decision.reason());
        assertEquals(0.0, decision.confidence());
        assertNull(decision.classroomRatio());
    }

    @Test
    void syntheticDemandIsDeterministicAndBounded() {
        assertEquals(0, ProposalValidator.syntheticRequest(0, "s1", "2023-24", "cr"));
        for (String id : List.of("s1", "s2", "s3", "s4", "s5")) {
            int first = ProposalValidator.syntheticRequest(20, id, "2023-24", "cr");
            assertEquals(first, ProposalValidator.syntheticRequest(20, id, "2023-24", "cr"));
            assertTrue(first >= 14 && first <= 30, id + " -> " + first);
        }
    }

    @Test
    void messagesNameTheReason() {
        assertEquals("Proposal rejected: no deficit.", ProposalValidator.message(ProposalValidator.validate(1, 0, 0, 0)));
    }
}
