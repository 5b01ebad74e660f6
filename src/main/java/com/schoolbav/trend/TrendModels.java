package com.schoolbav.trend;

import com.schoolbav.domain.DomainModels.TrendDirection;

public class TrendModels {
    public record TrendEntry(String schoolId,
                             String academicYear,
                             double riskScore,
                             Double previousRiskScore,
                             Double riskDelta,
                             TrendDirection direction,
                             int sequence,
                             double cumulativeAvgRisk,
                             boolean chronic,
                             boolean volatileRisk) {}
}
