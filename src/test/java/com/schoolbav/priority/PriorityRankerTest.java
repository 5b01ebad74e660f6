package com.schoolbav.priority;

import com.schoolbav.domain.DomainModels.InfrastructureRow;
import com.schoolbav.domain.DomainModels.PriorityBucket;
import com.schoolbav.risk.RiskScorer;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PriorityRankerTest {

    private static InfrastructureRow row(String schoolId, String year, String district, double score) {
        return new InfrastructureRow(schoolId, year, district, 10, 3, 10, 0, score, RiskScorer.classify(score));
    }

    @Test
    void tiedScoresShareRankAndTheNextRankSkips() {
        List<InfrastructureRow> rows = List.of(
                row("a", "2023-24", "North", 0.9),
                row("b", "2023-24", "South", 0.7),
                row("c", "2023-24", "North", 0.7),
                row("d", "2023-24", "North", 0.2));

        Map<String, PriorityModels.PriorityEntry> bySchool = PriorityRanker.rank(rows, rows).stream()
                .collect(Collectors.toMap(PriorityModels.PriorityEntry::schoolId, Function.identity()));

        assertEquals(1, bySchool.get("a").stateRank());
        assertEquals(2, bySchool.get("b").stateRank());
        assertEquals(2, bySchool.get("c").stateRank());
        assertEquals(4, bySchool.get("d").stateRank());

        assertEquals(1, bySchool.get("a").districtRank());
        assertEquals(2, bySchool.get("c").districtRank());
        assertEquals(3, bySchool.get("d").districtRank());
        assertEquals(1, bySchool.get("b").districtRank());
    }

    @Test
    void bucketsPartitionTheRankedYear() {
        List<InfrastructureRow> rows = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            rows.add(row(String.format("s%02d", i), "2023-24", "North", 0.95 - i * 0.04));
        }

        List<PriorityModels.PriorityEntry> ranked = PriorityRanker.rank(rows, rows);
        Map<PriorityBucket, Long> counts = ranked.stream()
                .collect(Collectors.groupingBy(PriorityModels.PriorityEntry::bucket, Collectors.counting()));

        assertEquals(20, ranked.size());
        assertEquals(1L, counts.get(PriorityBucket.TOP_5));
        assertEquals(1L, counts.get(PriorityBucket.TOP_10));
        assertEquals(2L, counts.get(PriorityBucket.TOP_20));
        assertEquals(16L, counts.get(PriorityBucket.STANDARD));
    }

    @Test
    void bucketBoundariesAreInclusive() {
        assertEquals(PriorityBucket.TOP_5, PriorityRanker.bucket(0.05));
        assertEquals(PriorityBucket.TOP_10, PriorityRanker.bucket(0.0501));
        assertEquals(PriorityBucket.TOP_10, PriorityRanker.bucket(0.10));
        assertEquals(PriorityBucket.TOP_20, PriorityRanker.bucket(0.20));
        assertEquals(PriorityBucket.STANDARD, PriorityRanker.bucket(0.2001));
    }

    @Test
    void singleSchoolIsInTheTopBucket() {
        List<InfrastructureRow> rows = List.of(row("only", "2023-24", "North", 0.1));
        var entry = PriorityRanker.rank(rows, rows).get(0);
        assertEquals(0.0, entry.percentRank());
        assertEquals(PriorityBucket.TOP_5, entry.bucket());
    }

    @Test
    void unscoredRowsAreNotRanked() {
        List<InfrastructureRow> rows = List.of(
                row("a", "2023-24", "North", 0.4),
                new InfrastructureRow("b", "2023-24", "North", 10, 3, 10, 0, null, null));
        assertEquals(1, PriorityRanker.rank(rows, rows).size());
    }

    @Test
    void persistentFlagNeedsThreeConsecutiveHighYears() {
        List<InfrastructureRow> history = List.of(
                row("p", "2021-22", "North", 0.6),
                row("p", "2022-23", "North", 0.8),
                row("p", "2023-24", "North", 0.7),
                row("q", "2022-23", "North", 0.6),
                row("q", "2023-24", "North", 0.8));
        List<InfrastructureRow> year = history.stream().filter(r -> r.academicYear().equals("2023-24")).toList();

        Map<String, Boolean> flags = PriorityRanker.rank(year, history).stream()
                .collect(Collectors.toMap(PriorityModels.PriorityEntry::schoolId, PriorityModels.PriorityEntry::persistentHighRisk));
        assertTrue(flags.get("p"));
        assertFalse(flags.get("q"));
    }
}
