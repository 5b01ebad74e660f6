package com.schoolbav.api;

import com.schoolbav.budget.BudgetModels;
import com.schoolbav.budget.BudgetService;
import com.schoolbav.proposal.ProposalModels;
import com.schoolbav.proposal.ProposalService;
import com.schoolbav.repository.QueryJdbcRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/proposals")
public class ProposalController {
    private final ProposalService proposalService;
    private final BudgetService budgetService;
    private final QueryJdbcRepository queries;

    public ProposalController(ProposalService proposalService, BudgetService budgetService, QueryJdbcRepository queries) {
        this.proposalService = proposalService;
        this.budgetService = budgetService;
        this.queries = queries;
    }

    @PostMapping("/submit")
    public ResponseEntity<ProposalModels.SubmissionResult> submit(@RequestBody SubmitRequest request) {
        return ResponseEntity.ok(proposalService.submit(new ProposalModels.Submission(
                request.schoolId(), request.academicYear(),
                request.classroomsRequested() == null ? 0 : request.classroomsRequested(),
                request.teachersRequested() == null ? 0 : request.teachersRequested(),
                request.justification() == null ? "" : request.justification(),
                request.submittedBy() == null ? "School Admin" : request.submittedBy())));
    }

    @GetMapping("/school/{schoolId}")
    public ResponseEntity<List<Map<String, Object>>> forSchool(@PathVariable String schoolId) {
        return ResponseEntity.ok(queries.proposalsForSchool(schoolId));
    }

    /** Dry run of the allocation; unset parameters fall back to the configured budget. */
    @PostMapping("/budget/simulate")
    public ResponseEntity<BudgetModels.SimulationSummary> simulate(@RequestBody SimulateRequest request) {
        BudgetModels.BudgetConfig configured = budgetService.configured();
        String year = queries.yearOrLatest(request.year());
        BudgetModels.BudgetConfig config = new BudgetModels.BudgetConfig(
                request.totalBudget() == null ? configured.totalBudget() : request.totalBudget(),
                request.costPerClassroom() == null ? configured.costPerClassroom() : request.costPerClassroom(),
                request.teacherPosts() == null ? configured.teacherPosts() : request.teacherPosts());
        return ResponseEntity.ok(budgetService.simulate(year, config));
    }

    public record SubmitRequest(String schoolId,
                                String academicYear,
                                Integer classroomsRequested,
                                Integer teachersRequested,
                                String justification,
                                String submittedBy) {}

    public record SimulateRequest(String year, Long totalBudget, Long costPerClassroom, Integer teacherPosts) {}
}
