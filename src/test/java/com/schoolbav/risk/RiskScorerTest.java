package com.schoolbav.risk;

import com.schoolbav.domain.DomainModels.RiskLevel;
import com.schoolbav.domain.DomainModels.SchoolYear;
import com.schoolbav.domain.DomainModels.YearlyMetric;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RiskScorerTest {

    @Test
    void scoresTheWorkedExample() {
        var assessment = RiskScorer.assess(new RiskModels.RiskInput("X", "2023-24", 5, 30, 10, 30, 0.0));

        assertEquals(0.1667, assessment.classroomDeficitRatio(), 1e-4);
        assertEquals(0.3333, assessment.teacherDeficitRatio(), 1e-4);
        assertEquals(0.2083, assessment.riskScore());
        assertEquals(RiskLevel.MODERATE, assessment.riskLevel());
    }

    @Test
    void thresholdsAreExclusiveOnTheLowerSide() {
        assertEquals(RiskLevel.HIGH, RiskScorer.classify(0.75));
        assertEquals(RiskLevel.CRITICAL, RiskScorer.classify(0.7501));
        assertEquals(RiskLevel.MODERATE, RiskScorer.classify(0.50));
        assertEquals(RiskLevel.HIGH, RiskScorer.classify(0.5001));
        assertEquals(RiskLevel.LOW, RiskScorer.classify(0.20));
        assertEquals(RiskLevel.MODERATE, RiskScorer.classify(0.2001));
    }

    @Test
    void deficitRatioIsGuardedAndCapped() {
        assertEquals(0.0, RiskScorer.deficitRatio(5, 0));
        assertEquals(0.0, RiskScorer.deficitRatio(5, null));
        assertEquals(0.0, RiskScorer.deficitRatio(null, 10));
        assertEquals(1.0, RiskScorer.deficitRatio(50, 10));
    }

    @Test
    void growthContributesByMagnitudeUpToTheCap() {
        assertEquals(0.1, RiskScorer.score(0, 0, 0.9));
        assertEquals(0.06, RiskScorer.score(0, 0, -0.3));
        assertEquals(0.9, RiskScorer.score(1, 1, 2.0));
    }

    @Test
    void growthRatesComeFromEachSchoolsPredecessor() {
        var rates = RiskScorer.growthRates(List.of(
                new YearlyMetric("A", "2022-23", 120),
                new YearlyMetric("A", "2021-22", 100),
                new YearlyMetric("B", "2021-22", 0),
                new YearlyMetric("B", "2022-23", 50)));

        assertEquals(0.0, rates.get(new SchoolYear("A", "2021-22")));
        assertEquals(0.2, rates.get(new SchoolYear("A", "2022-23")), 1e-9);
        assertEquals(0.0, rates.get(new SchoolYear("B", "2022-23")));
    }

    @Test
    void sustainedHighRiskNeedsThreeConsecutiveObservedYears() {
        var twoYears = List.of(RiskLevel.HIGH, RiskLevel.CRITICAL);
        assertFalse(RiskScorer.isSustainedHighRisk(twoYears, 0));
        assertFalse(RiskScorer.isSustainedHighRisk(twoYears, 1));

        var threeYears = List.of(RiskLevel.HIGH, RiskLevel.CRITICAL, RiskLevel.HIGH);
        assertTrue(RiskScorer.isSustainedHighRisk(threeYears, 2));

        var broken = Arrays.asList(RiskLevel.HIGH, null, RiskLevel.HIGH, RiskLevel.HIGH);
        assertFalse(RiskScorer.isSustainedHighRisk(broken, 3));
        assertFalse(RiskScorer.isSustainedHighRisk(List.of(RiskLevel.HIGH, RiskLevel.MODERATE, RiskLevel.HIGH), 2));
    }
}
