package com.schoolbav.api;

import com.schoolbav.repository.QueryJdbcRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/schools")
public class SchoolController {
    private final QueryJdbcRepository queries;

    public SchoolController(QueryJdbcRepository queries) {
        this.queries = queries;
    }

    @GetMapping("/search")
    public ResponseEntity<List<Map<String, Object>>> search(@RequestParam String q) {
        if (q.trim().length() < 2) {
            throw new IllegalArgumentException("q must have at least 2 characters");
        }
        return ResponseEntity.ok(queries.searchSchools(q.trim()));
    }

    @GetMapping("/{schoolId}/overview")
    public ResponseEntity<Map<String, Object>> overview(@PathVariable String schoolId) {
        return queries.school(schoolId)
                .map(school -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("school", school);
                    body.put("latest", queries.latestSnapshot(schoolId).orElse(Map.of()));
                    return ResponseEntity.ok(body);
                })
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{schoolId}/facilities")
    public ResponseEntity<Map<String, Object>> facilities(@PathVariable String schoolId) {
        return queries.schoolFacilities(schoolId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{schoolId}/history")
    public ResponseEntity<List<Map<String, Object>>> history(@PathVariable String schoolId) {
        return ResponseEntity.ok(queries.schoolHistory(schoolId));
    }

    @GetMapping("/{schoolId}/forecast")
    public ResponseEntity<List<Map<String, Object>>> forecast(@PathVariable String schoolId) {
        return ResponseEntity.ok(queries.schoolForecast(schoolId));
    }

    @GetMapping("/{schoolId}/trend")
    public ResponseEntity<List<Map<String, Object>>> trend(@PathVariable String schoolId) {
        return ResponseEntity.ok(queries.schoolTrend(schoolId));
    }
}
