package com.schoolbav.api;

import com.schoolbav.repository.QueryJdbcRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/districts")
public class DistrictController {
    private final QueryJdbcRepository queries;

    public DistrictController(QueryJdbcRepository queries) {
        this.queries = queries;
    }

    @GetMapping
    public ResponseEntity<List<String>> districts() {
        return ResponseEntity.ok(queries.districts());
    }

    @GetMapping("/{district}/compliance")
    public ResponseEntity<List<Map<String, Object>>> compliance(@PathVariable String district) {
        return ResponseEntity.ok(queries.districtCompliance(district));
    }

    @GetMapping("/{district}/priority")
    public ResponseEntity<List<Map<String, Object>>> priority(@PathVariable String district,
                                                              @RequestParam(required = false) String year) {
        String target = queries.yearOrLatest(year);
        return ResponseEntity.ok(queries.districtPriority(district, target));
    }

    @GetMapping("/{district}/trend")
    public ResponseEntity<List<Map<String, Object>>> trend(@PathVariable String district) {
        return ResponseEntity.ok(queries.districtTrend(district));
    }

    /** Risk level mix per block. */
    @GetMapping("/{district}/blocks")
    public ResponseEntity<Map<String, Object>> blocks(@PathVariable String district,
                                                      @RequestParam(required = false) String year) {
        String target = queries.yearOrLatest(year);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("academicYear", target);
        body.put("blocks", queries.districtBlocks(district, target));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{district}/proposals")
    public ResponseEntity<Map<String, Object>> proposals(@PathVariable String district,
                                                         @RequestParam(required = false) String year) {
        String target = queries.yearOrLatest(year);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("academicYear", target);
        body.putAll(queries.districtProposals(district, target));
        return ResponseEntity.ok(body);
    }
}
