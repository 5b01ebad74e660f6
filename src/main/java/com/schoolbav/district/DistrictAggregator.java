package com.schoolbav.district;

import com.schoolbav.domain.DomainModels.ComplianceGrade;
import com.schoolbav.domain.Rounding;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Rolls scored school-years up to district-year scorecards.
 *
 * <p>{@link #aggregate} is the per-district grouping; {@link #compare} is the second pass that needs
 * the complete aggregate table (prior years and peer districts) to fill year-over-year change and rank.
 */
public final class DistrictAggregator {
    private DistrictAggregator() {
    }

    public static List<DistrictModels.DistrictScore> aggregate(List<DistrictModels.DistrictInput> rows) {
        Map<List<String>, List<DistrictModels.DistrictInput>> groups = rows.stream()
                .collect(Collectors.groupingBy(r -> List.of(r.district(), r.academicYear()), LinkedHashMap::new, Collectors.toList()));

        List<DistrictModels.DistrictScore> out = new ArrayList<>();
        groups.forEach((key, group) -> out.add(score(key.get(0), key.get(1), group)));
        out.sort(Comparator.comparing(DistrictModels.DistrictScore::academicYear)
                .thenComparing(DistrictModels.DistrictScore::district));
        return out;
    }

    static DistrictModels.DistrictScore score(String district, String academicYear, List<DistrictModels.DistrictInput> group) {
        int count = group.size();
        int schools = (int) group.stream().map(DistrictModels.DistrictInput::schoolId).distinct().count();
        double avgRisk = Rounding.round(group.stream().mapToDouble(DistrictModels.DistrictInput::riskScore).average().orElse(0.0), 4);
        long highOrCritical = group.stream()
                .filter(r -> r.riskLevel() != null && r.riskLevel().isHighOrCritical())
                .count();
        double pctHighCritical = count == 0 ? 0.0 : Rounding.round(highOrCritical * 100.0 / count, 2);
        int classroomDeficit = group.stream().mapToInt(r -> positive(r.classroomGap())).sum();
        int teacherDeficit = group.stream().mapToInt(r -> positive(r.teacherGap())).sum();
        long enrolment = group.stream().filter(r -> r.enrolment() != null).mapToLong(DistrictModels.DistrictInput::enrolment).sum();
        OptionalDouble condition = group.stream()
                .filter(r -> r.classroomConditionScore() != null)
                .mapToInt(DistrictModels.DistrictInput::classroomConditionScore)
                .average();
        Double avgCondition = condition.isPresent() ? Rounding.round(condition.getAsDouble(), 4) : null;

        return new DistrictModels.DistrictScore(district, academicYear, schools, avgRisk, pctHighCritical,
                classroomDeficit, teacherDeficit, enrolment, avgCondition, null, 0, grade(avgRisk));
    }

    /**
     * Fills year-over-year change (against the district's own previous aggregated year) and the
     * per-year rank by average risk, highest risk first.
     */
    public static List<DistrictModels.DistrictScore> compare(List<DistrictModels.DistrictScore> all) {
        Map<String, Double> yoy = new HashMap<>();
        all.stream()
                .collect(Collectors.groupingBy(DistrictModels.DistrictScore::district))
                .forEach((district, series) -> {
                    List<DistrictModels.DistrictScore> ordered = series.stream()
                            .sorted(Comparator.comparing(DistrictModels.DistrictScore::academicYear))
                            .toList();
                    for (int i = 1; i < ordered.size(); i++) {
                        double delta = ordered.get(i).avgRiskScore() - ordered.get(i - 1).avgRiskScore();
                        yoy.put(key(ordered.get(i)), Rounding.round(delta, 4));
                    }
                });

        Map<String, Integer> ranks = new HashMap<>();
        all.stream()
                .collect(Collectors.groupingBy(DistrictModels.DistrictScore::academicYear))
                .values()
                .forEach(peers -> {
                    List<DistrictModels.DistrictScore> ordered = peers.stream()
                            .sorted(Comparator.comparingDouble(DistrictModels.DistrictScore::avgRiskScore).reversed()
                                    .thenComparing(DistrictModels.DistrictScore::district))
                            .toList();
                    int rank = 0;
                    Double previous = null;
                    for (int i = 0; i < ordered.size(); i++) {
                        double avg = ordered.get(i).avgRiskScore();
                        if (previous == null || Double.compare(avg, previous) != 0) {
                            rank = i + 1;
                            previous = avg;
                        }
                        ranks.put(key(ordered.get(i)), rank);
                    }
                });

        return all.stream()
                .map(s -> s.withComparisons(yoy.get(key(s)), ranks.get(key(s))))
                .sorted(Comparator.comparing(DistrictModels.DistrictScore::academicYear)
                        .thenComparing(DistrictModels.DistrictScore::districtRank)
                        .thenComparing(DistrictModels.DistrictScore::district))
                .toList();
    }

    public static ComplianceGrade grade(double avgRisk) {
        if (avgRisk <= 0.15) return ComplianceGrade.A;
        if (avgRisk <= 0.30) return ComplianceGrade.B;
        if (avgRisk <= 0.50) return ComplianceGrade.C;
        if (avgRisk <= 0.75) return ComplianceGrade.D;
        return ComplianceGrade.F;
    }

    private static int positive(Integer gap) {
        return gap == null || gap < 0 ? 0 : gap;
    }

    private static String key(DistrictModels.DistrictScore s) {
        return s.district() + "|" + s.academicYear();
    }
}
