package com.schoolbav.trend;

import com.schoolbav.domain.DomainModels.InfrastructureRow;
import com.schoolbav.domain.DomainModels.RiskLevel;
import com.schoolbav.domain.DomainModels.TrendDirection;
import com.schoolbav.domain.Rounding;
import com.schoolbav.risk.RiskScorer;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Longitudinal view of each school's risk score: deltas, direction, running mean, chronic and
 * volatile flags.
 */
public final class TrendTracker {
    public static final double TREND_THRESHOLD = 0.10;
    public static final double VOLATILITY_THRESHOLD = 0.25;

    private TrendTracker() {
    }

    /**
     * Computes trend rows for every scored school-year in {@code history}. Deltas and running means
     * are derived for the whole history first; the flags are derived from those afterwards.
     */
    public static List<TrendModels.TrendEntry> track(List<InfrastructureRow> history) {
        Map<String, List<InfrastructureRow>> bySchool = history.stream()
                .collect(Collectors.groupingBy(InfrastructureRow::schoolId, TreeMap::new, Collectors.toList()));

        List<TrendModels.TrendEntry> out = new ArrayList<>();
        bySchool.values().forEach(rows -> out.addAll(trackSchool(rows)));
        return out;
    }

    static List<TrendModels.TrendEntry> trackSchool(List<InfrastructureRow> schoolRows) {
        List<InfrastructureRow> observed = schoolRows.stream()
                .sorted(Comparator.comparing(InfrastructureRow::academicYear))
                .toList();
        List<InfrastructureRow> scored = observed.stream().filter(r -> r.riskScore() != null).toList();

        List<Double> deltas = new ArrayList<>();
        List<TrendModels.TrendEntry> base = new ArrayList<>();
        double runningTotal = 0.0;
        for (int i = 0; i < scored.size(); i++) {
            InfrastructureRow row = scored.get(i);
            Double previous = i == 0 ? null : scored.get(i - 1).riskScore();
            Double delta = previous == null ? null : Rounding.round(row.riskScore() - previous, 4);
            runningTotal += row.riskScore();
            deltas.add(delta);
            base.add(new TrendModels.TrendEntry(row.schoolId(), row.academicYear(), row.riskScore(), previous, delta,
                    direction(delta), i + 1, Rounding.round(runningTotal / (i + 1), 4), false, false));
        }

        List<RiskLevel> levels = observed.stream().map(InfrastructureRow::riskLevel).toList();
        List<String> observedYears = observed.stream().map(InfrastructureRow::academicYear).toList();

        List<TrendModels.TrendEntry> out = new ArrayList<>(base.size());
        for (int i = 0; i < base.size(); i++) {
            TrendModels.TrendEntry e = base.get(i);
            boolean chronic = RiskScorer.isSustainedHighRisk(levels, observedYears.indexOf(e.academicYear()));
            boolean volatileRisk = exceedsVolatility(deltas.get(i)) || (i > 0 && exceedsVolatility(deltas.get(i - 1)));
            out.add(new TrendModels.TrendEntry(e.schoolId(), e.academicYear(), e.riskScore(), e.previousRiskScore(),
                    e.riskDelta(), e.direction(), e.sequence(), e.cumulativeAvgRisk(), chronic, volatileRisk));
        }
        return out;
    }

    public static TrendDirection direction(Double delta) {
        if (delta == null) return TrendDirection.BASELINE;
        if (delta < -TREND_THRESHOLD) return TrendDirection.IMPROVING;
        if (delta > TREND_THRESHOLD) return TrendDirection.DETERIORATING;
        return TrendDirection.STABLE;
    }

    private static boolean exceedsVolatility(Double delta) {
        return delta != null && Math.abs(delta) > VOLATILITY_THRESHOLD;
    }
}
