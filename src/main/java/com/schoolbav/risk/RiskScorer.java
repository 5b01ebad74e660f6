package com.schoolbav.risk;

import com.schoolbav.domain.DomainModels.RiskLevel;
import com.schoolbav.domain.DomainModels.SchoolYear;
import com.schoolbav.domain.DomainModels.YearlyMetric;
import com.schoolbav.domain.Rounding;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Weighted composite risk: 0.45 teacher deficit, 0.35 classroom deficit, 0.20 enrolment growth magnitude.
 */
public final class RiskScorer {
    public static final double TEACHER_WEIGHT = 0.45;
    public static final double CLASSROOM_WEIGHT = 0.35;
    public static final double GROWTH_WEIGHT = 0.20;
    public static final double GROWTH_CAP = 0.50;

    public static final double CRITICAL_ABOVE = 0.75;
    public static final double HIGH_ABOVE = 0.50;
    public static final double MODERATE_ABOVE = 0.20;

    private RiskScorer() {
    }

    public static List<RiskModels.RiskAssessment> assess(List<RiskModels.RiskInput> inputs) {
        return inputs.stream().map(RiskScorer::assess).toList();
    }

    public static RiskModels.RiskAssessment assess(RiskModels.RiskInput in) {
        double teacherRatio = deficitRatio(in.teacherGap(), in.requiredTeachers());
        double classroomRatio = deficitRatio(in.classroomGap(), in.requiredClassRooms());
        double score = score(teacherRatio, classroomRatio, in.enrolmentGrowthRate());
        return new RiskModels.RiskAssessment(in.schoolId(), in.academicYear(), classroomRatio, teacherRatio,
                in.enrolmentGrowthRate(), score, classify(score));
    }

    /** min(gap / required, 1); zero when the requirement is zero or unknown. */
    public static double deficitRatio(Integer gap, Integer required) {
        if (required == null || required <= 0) return 0.0;
        int g = gap == null ? 0 : Math.max(gap, 0);
        return Math.min((double) g / required, 1.0);
    }

    public static double score(double teacherRatio, double classroomRatio, double growthRate) {
        double growthScaled = Math.min(Math.abs(growthRate), GROWTH_CAP);
        double raw = TEACHER_WEIGHT * teacherRatio + CLASSROOM_WEIGHT * classroomRatio + GROWTH_WEIGHT * growthScaled;
        return Math.min(1.0, Math.max(0.0, Rounding.round(raw, 4)));
    }

    /** Lower bounds are exclusive: exactly 0.75 is HIGH. */
    public static RiskLevel classify(double score) {
        if (score > CRITICAL_ABOVE) return RiskLevel.CRITICAL;
        if (score > HIGH_ABOVE) return RiskLevel.HIGH;
        if (score > MODERATE_ABOVE) return RiskLevel.MODERATE;
        return RiskLevel.LOW;
    }

    /**
     * Sustained high risk: the row at {@code index} and the two rows before it in a school's own
     * chronological history are all HIGH or CRITICAL. Fewer than three observed rows never qualify.
     */
    public static boolean isSustainedHighRisk(List<RiskLevel> orderedLevels, int index) {
        if (index < 2 || index >= orderedLevels.size()) return false;
        for (int i = index - 2; i <= index; i++) {
            RiskLevel level = orderedLevels.get(i);
            if (level == null || !level.isHighOrCritical()) return false;
        }
        return true;
    }

    /**
     * Growth of each school-year against the school's chronological predecessor in the enrolment
     * history. First observed year, or a predecessor with zero (or missing) enrolment, gives 0.
     */
    public static Map<SchoolYear, Double> growthRates(List<YearlyMetric> history) {
        Map<SchoolYear, Double> rates = new HashMap<>();
        Map<String, List<YearlyMetric>> bySchool = history.stream()
                .collect(Collectors.groupingBy(YearlyMetric::schoolId));
        bySchool.values().forEach(rows -> {
            List<YearlyMetric> ordered = rows.stream()
                    .sorted(Comparator.comparing(YearlyMetric::academicYear))
                    .toList();
            for (int i = 0; i < ordered.size(); i++) {
                YearlyMetric current = ordered.get(i);
                Integer previous = i == 0 ? null : ordered.get(i - 1).totalEnrolment();
                double rate = 0.0;
                if (previous != null && previous != 0 && current.totalEnrolment() != null) {
                    rate = (double) (current.totalEnrolment() - previous) / previous;
                }
                rates.put(new SchoolYear(current.schoolId(), current.academicYear()), rate);
            }
        });
        return rates;
    }
}
