package com.schoolbav.forecast;

import com.schoolbav.domain.AcademicYears;
import com.schoolbav.domain.DomainModels.YearlyMetric;
import com.schoolbav.domain.Rounding;
import com.schoolbav.gap.CapacityNorms;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Enrolment projection from a recency-weighted growth estimate, compounded over the horizon.
 */
public final class Forecaster {
    public static final int HORIZON = 3;
    public static final double GROWTH_CLIP = 0.30;
    /** Most recent transition first. */
    static final double[] TRANSITION_WEIGHTS = {3.0, 2.0, 1.0};

    private Forecaster() {
    }

    public static List<ForecastModels.Forecast> forecast(List<ForecastModels.ForecastInput> inputs) {
        List<ForecastModels.Forecast> out = new ArrayList<>();
        inputs.forEach(in -> out.addAll(forecast(in)));
        return out;
    }

    /** Empty when the school has no year with a recorded enrolment. */
    public static List<ForecastModels.Forecast> forecast(ForecastModels.ForecastInput in) {
        List<YearlyMetric> observed = observed(in.enrolmentHistory());
        if (observed.isEmpty()) {
            return List.of();
        }
        YearlyMetric base = observed.get(observed.size() - 1);
        double growth = growthEstimate(observed);
        int classroomNorm = CapacityNorms.classroomNorm(in.category());
        int teacherNorm = CapacityNorms.teacherNorm(in.category());

        List<ForecastModels.Forecast> out = new ArrayList<>(HORIZON);
        for (int k = 1; k <= HORIZON; k++) {
            int projected = project(base.totalEnrolment(), growth, k);
            int classrooms = CapacityNorms.required(projected, classroomNorm);
            int teachers = CapacityNorms.required(projected, teacherNorm);
            out.add(new ForecastModels.Forecast(in.schoolId(), base.academicYear(), AcademicYears.plus(base.academicYear(), k), k,
                    base.totalEnrolment(), Rounding.round(growth, 4), projected, classrooms, teachers,
                    in.currentClassrooms(), in.currentTeachers(),
                    CapacityNorms.gap(classrooms, in.currentClassrooms()),
                    CapacityNorms.gap(teachers, in.currentTeachers()),
                    in.category()));
        }
        return out;
    }

    /**
     * Weighted mean of the last three year-over-year growth rates, each normalised by the enrolment at
     * the start of its transition. Transitions that are missing or start from zero are left out of
     * both sums. Clipped to +/-{@value #GROWTH_CLIP}.
     */
    public static double growthEstimate(List<YearlyMetric> history) {
        List<YearlyMetric> observed = observed(history);
        double numerator = 0.0;
        double denominator = 0.0;
        for (int j = 0; j < TRANSITION_WEIGHTS.length; j++) {
            int end = observed.size() - 1 - j;
            int start = end - 1;
            if (start < 0) break;
            int from = observed.get(start).totalEnrolment();
            int to = observed.get(end).totalEnrolment();
            if (from <= 0) continue;
            numerator += TRANSITION_WEIGHTS[j] * (to - from) / (double) from;
            denominator += TRANSITION_WEIGHTS[j];
        }
        double growth = denominator == 0.0 ? 0.0 : numerator / denominator;
        return Math.max(-GROWTH_CLIP, Math.min(GROWTH_CLIP, growth));
    }

    public static int project(int baseEnrolment, double growth, int yearsAhead) {
        return (int) Math.max(0, Math.round(baseEnrolment * Math.pow(1 + growth, yearsAhead)));
    }

    public static Optional<String> baseYear(List<YearlyMetric> history) {
        List<YearlyMetric> observed = observed(history);
        return observed.isEmpty() ? Optional.empty() : Optional.of(observed.get(observed.size() - 1).academicYear());
    }

    private static List<YearlyMetric> observed(List<YearlyMetric> history) {
        return history.stream()
                .filter(m -> m.totalEnrolment() != null)
                .sorted(Comparator.comparing(YearlyMetric::academicYear))
                .toList();
    }
}
