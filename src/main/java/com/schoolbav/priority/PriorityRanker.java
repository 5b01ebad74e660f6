package com.schoolbav.priority;

import com.schoolbav.domain.DomainModels.InfrastructureRow;
import com.schoolbav.domain.DomainModels.PriorityBucket;
import com.schoolbav.domain.DomainModels.RiskLevel;
import com.schoolbav.risk.RiskScorer;

import java.util.*;
import java.util.stream.Collectors;

/**
 * State and district ranking of one year's risk scores, percentile buckets and the persistent
 * high-risk flag.
 */
public final class PriorityRanker {
    private PriorityRanker() {
    }

    /**
     * @param yearRows scored rows of a single academic year
     * @param history  every infrastructure row, used for the persistent flag
     */
    public static List<PriorityModels.PriorityEntry> rank(List<InfrastructureRow> yearRows, List<InfrastructureRow> history) {
        List<InfrastructureRow> scored = yearRows.stream()
                .filter(r -> r.riskScore() != null)
                .sorted(Comparator.comparing(InfrastructureRow::riskScore).reversed()
                        .thenComparing(InfrastructureRow::schoolId))
                .toList();

        Map<String, Integer> stateRanks = ranks(scored);
        Map<String, Integer> districtRanks = new HashMap<>();
        scored.stream()
                .collect(Collectors.groupingBy(r -> Objects.toString(r.district(), ""), LinkedHashMap::new, Collectors.toList()))
                .values()
                .forEach(group -> districtRanks.putAll(ranks(group)));

        Map<String, List<InfrastructureRow>> bySchool = history.stream()
                .collect(Collectors.groupingBy(InfrastructureRow::schoolId));

        int n = scored.size();
        return scored.stream()
                .map(r -> {
                    int stateRank = stateRanks.get(r.schoolId());
                    double percentRank = n <= 1 ? 0.0 : (double) (stateRank - 1) / (n - 1);
                    return new PriorityModels.PriorityEntry(r.schoolId(), r.academicYear(), r.district(), r.riskScore(),
                            stateRank, districtRanks.get(r.schoolId()), percentRank, bucket(percentRank),
                            persistent(r, bySchool.getOrDefault(r.schoolId(), List.of())));
                })
                .toList();
    }

    /** First match wins, inclusive upper bounds. */
    public static PriorityBucket bucket(double percentRank) {
        if (percentRank <= 0.05) return PriorityBucket.TOP_5;
        if (percentRank <= 0.10) return PriorityBucket.TOP_10;
        if (percentRank <= 0.20) return PriorityBucket.TOP_20;
        return PriorityBucket.STANDARD;
    }

    /** RANK() semantics over rows already sorted by score descending: ties share a rank, the next rank skips. */
    static Map<String, Integer> ranks(List<InfrastructureRow> sortedDesc) {
        Map<String, Integer> ranks = new HashMap<>();
        Double previous = null;
        int rank = 0;
        for (int i = 0; i < sortedDesc.size(); i++) {
            InfrastructureRow row = sortedDesc.get(i);
            if (previous == null || Double.compare(row.riskScore(), previous) != 0) {
                rank = i + 1;
                previous = row.riskScore();
            }
            ranks.put(row.schoolId(), rank);
        }
        return ranks;
    }

    private static boolean persistent(InfrastructureRow row, List<InfrastructureRow> schoolHistory) {
        List<InfrastructureRow> ordered = schoolHistory.stream()
                .sorted(Comparator.comparing(InfrastructureRow::academicYear))
                .toList();
        List<RiskLevel> levels = ordered.stream().map(InfrastructureRow::riskLevel).toList();
        for (int i = 0; i < ordered.size(); i++) {
            if (ordered.get(i).academicYear().equals(row.academicYear())) {
                return RiskScorer.isSustainedHighRisk(levels, i);
            }
        }
        return false;
    }
}
