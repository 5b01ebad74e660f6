package com.schoolbav.district;

import com.schoolbav.domain.DomainModels.ComplianceGrade;
import com.schoolbav.risk.RiskScorer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DistrictAggregatorTest {

    private static DistrictModels.DistrictInput input(String schoolId, String year, String district, double risk,
                                                      Integer classroomGap, Integer teacherGap,
                                                      Integer enrolment, Integer condition) {
        return new DistrictModels.DistrictInput(schoolId, year, district, risk, RiskScorer.classify(risk),
                classroomGap, teacherGap, enrolment, condition);
    }

    @Test
    void aggregatesOneDistrictYear() {
        List<DistrictModels.DistrictScore> scores = DistrictAggregator.aggregate(List.of(
                input("a", "2023-24", "North", 0.2, 3, 2, 100, 3),
                input("b", "2023-24", "North", 0.8, null, 4, null, null)));

        assertEquals(1, scores.size());
        DistrictModels.DistrictScore north = scores.get(0);
        assertEquals(2, north.totalSchools());
        assertEquals(0.5, north.avgRiskScore());
        assertEquals(50.0, north.pctHighCritical());
        assertEquals(3, north.totalClassroomDeficit());
        assertEquals(6, north.totalTeacherDeficit());
        assertEquals(100L, north.totalEnrolment());
        assertEquals(3.0, north.avgClassroomCondition());
        assertEquals(ComplianceGrade.C, north.grade());
        assertNull(north.yoyRiskImprovement());
    }

    @Test
    void conditionAverageIsNullWithoutAnyScore() {
        var score = DistrictAggregator.aggregate(List.of(input("a", "2023-24", "East", 0.1, 0, 0, 50, null))).get(0);
        assertNull(score.avgClassroomCondition());
        assertEquals(ComplianceGrade.A, score.grade());
    }

    @Test
    void gradeBoundariesAreInclusive() {
        assertEquals(ComplianceGrade.A, DistrictAggregator.grade(0.15));
        assertEquals(ComplianceGrade.B, DistrictAggregator.grade(0.1501));
        assertEquals(ComplianceGrade.B, DistrictAggregator.grade(0.30));
        assertEquals(ComplianceGrade.C, DistrictAggregator.grade(0.50));
        assertEquals(ComplianceGrade.D, DistrictAggregator.grade(0.75));
        assertEquals(ComplianceGrade.F, DistrictAggregator.grade(0.7501));
    }

    @Test
    void secondPassAddsYearOverYearChangeAndRank() {
        List<DistrictModels.DistrictScore> first = DistrictAggregator.aggregate(List.of(
                input("n1", "2022-23", "North", 0.4, 0, 0, 10, 3),
                input("s1", "2022-23", "South", 0.6, 0, 0, 10, 3),
                input("w1", "2022-23", "West", 0.1, 0, 0, 10, 3),
                input("n1", "2023-24", "North", 0.5, 0, 0, 10, 3),
                input("s1", "2023-24", "South", 0.5, 0, 0, 10, 3),
                input("w1", "2023-24", "West", 0.3, 0, 0, 10, 3)));

        Map<String, DistrictModels.DistrictScore> compared = DistrictAggregator.compare(first).stream()
                .collect(Collectors.toMap(s -> s.district() + " " + s.academicYear(), Function.identity()));

        assertNull(compared.get("North 2022-23").yoyRiskImprovement());
        assertEquals(0.1, compared.get("North 2023-24").yoyRiskImprovement());
        assertEquals(-0.1, compared.get("South 2023-24").yoyRiskImprovement());

        assertEquals(1, compared.get("South 2022-23").districtRank());
        assertEquals(2, compared.get("North 2022-23").districtRank());
        assertEquals(3, compared.get("West 2022-23").districtRank());
        assertEquals(1, compared.get("North 2023-24").districtRank());
        assertEquals(1, compared.get("South 2023-24").districtRank());
        assertEquals(3, compared.get("West 2023-24").districtRank());
    }
}
