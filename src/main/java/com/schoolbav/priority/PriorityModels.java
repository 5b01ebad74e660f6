package com.schoolbav.priority;

import com.schoolbav.domain.DomainModels.PriorityBucket;

public class PriorityModels {
    public record PriorityEntry(String schoolId,
                                String academicYear,
                                String district,
                                double riskScore,
                                int stateRank,
                                int districtRank,
                                double percentRank,
                                PriorityBucket bucket,
                                boolean persistentHighRisk) {}
}
