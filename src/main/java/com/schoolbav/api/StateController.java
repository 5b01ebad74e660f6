package com.schoolbav.api;

import com.schoolbav.repository.QueryJdbcRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/state")
public class StateController {
    private final QueryJdbcRepository queries;

    public StateController(QueryJdbcRepository queries) {
        this.queries = queries;
    }

    @GetMapping("/years")
    public ResponseEntity<List<String>> years() {
        return ResponseEntity.ok(queries.scoredYears());
    }

    /** Defaults to the latest scored year. */
    @GetMapping("/overview")
    public ResponseEntity<Map<String, Object>> overview(@RequestParam(required = false) String year) {
        String target = queries.yearOrLatest(year);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("academicYear", target);
        body.put("totals", queries.stateTotals(target));
        body.put("riskLevels", queries.riskLevelCounts(target));
        body.put("allocation", queries.allocationTotals(target));
        body.put("districts", queries.districtScorecards(target));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/trends")
    public ResponseEntity<List<Map<String, Object>>> trends() {
        return ResponseEntity.ok(queries.stateTrends());
    }

    @GetMapping("/budget")
    public ResponseEntity<Map<String, Object>> budget(@RequestParam(required = false) String year) {
        String target = queries.yearOrLatest(year);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("academicYear", target);
        body.putAll(queries.budgetOutcomes(target));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/forecast")
    public ResponseEntity<Map<String, Object>> forecast() {
        return ResponseEntity.ok(queries.forecastOutlook());
    }
}
