package com.schoolbav.api;

import com.schoolbav.repository.QueryJdbcRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Block views inside a district. Schools without a block are grouped under {@code UNKNOWN}.
 */
@RestController
@RequestMapping("/api/blocks/{district}/{block}")
public class BlockController {
    private final QueryJdbcRepository queries;

    public BlockController(QueryJdbcRepository queries) {
        this.queries = queries;
    }

    @GetMapping("/summary")
    public ResponseEntity<Map<String, Object>> summary(@PathVariable String district,
                                                       @PathVariable String block,
                                                       @RequestParam(required = false) String year) {
        String target = queries.yearOrLatest(year);
        Map<String, Object> body = header(district, block, target);
        body.putAll(queries.blockSummary(district, block, target));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/schools")
    public ResponseEntity<Map<String, Object>> schools(@PathVariable String district,
                                                       @PathVariable String block,
                                                       @RequestParam(required = false) String year) {
        String target = queries.yearOrLatest(year);
        Map<String, Object> body = header(district, block, target);
        body.put("schools", queries.blockSchools(district, block, target));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/chronic")
    public ResponseEntity<Map<String, Object>> chronic(@PathVariable String district,
                                                       @PathVariable String block,
                                                       @RequestParam(required = false) String year) {
        String target = queries.yearOrLatest(year);
        Map<String, Object> body = header(district, block, target);
        body.putAll(queries.blockWatchlist(district, block, target));
        return ResponseEntity.ok(body);
    }

    private static Map<String, Object> header(String district, String block, String year) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("academicYear", year);
        body.put("district", district);
        body.put("block", block);
        return body;
    }
}
