package com.schoolbav.proposal;

import com.schoolbav.domain.DomainModels.DecisionStatus;
import com.schoolbav.pipeline.PipelineModels;
import com.schoolbav.pipeline.PipelineStage;
import com.schoolbav.pipeline.SchoolBavProperties;
import com.schoolbav.pipeline.Stage;
import com.schoolbav.pipeline.StagePreconditions;
import com.schoolbav.repository.ProposalJdbcRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Slf4j
public class ProposalService implements PipelineStage {
    public static final int MAX_REQUEST = 100;
    static final String SIMULATION_SOURCE = "SIMULATION";

    private final ProposalJdbcRepository repository;
    private final StagePreconditions preconditions;
    private final SchoolBavProperties properties;

    public ProposalService(ProposalJdbcRepository repository,
                           StagePreconditions preconditions,
                           SchoolBavProperties properties) {
        this.repository = repository;
        this.preconditions = preconditions;
        this.properties = properties;
    }

    @Override
    public Stage stage() {
        return Stage.PROPOSAL_VALIDATION;
    }

    /**
     * Validates each year's demand proposals. With demand simulation on, the year's proposals are
     * first re-seeded from the computed gaps; otherwise the stored proposals are validated as they are.
     */
    @Override
    public PipelineModels.StageResult run(List<String> academicYears) {
        boolean simulate = properties.getProposals().isSimulateDemand();
        int written = 0;
        Map<DecisionStatus, Long> decisions = new EnumMap<>(DecisionStatus.class);
        for (String year : academicYears) {
            preconditions.requireRequirements(stage(), year);
            List<ProposalModels.ActualGap> gaps = repository.loadGaps(year);
            List<ProposalModels.DemandProposal> demand = simulate ? seed(gaps) : repository.loadDemand(year);
            List<ProposalModels.Validation> validations = validateAll(demand, gaps);

            written += simulate
                    ? repository.replaceYear(year, demand, validations)
                    : repository.replaceValidations(year, validations);
            validations.forEach(v -> decisions.merge(v.decision().status(), 1L, Long::sum));
            log.debug("{}: {} proposals validated", year, validations.size());
        }
        log.info("Proposal validation complete: {} validations ({}), decisions {}",
                written, simulate ? "simulated demand" : "stored demand", decisions);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("records", written);
        summary.put("simulatedDemand", simulate);
        decisions.forEach((status, count) -> summary.put(status.name(), count));
        return new PipelineModels.StageResult(stage(), academicYears, written, summary);
    }

    /** Validates a submission against the current gaps once, and stores it with its decision. */
    public ProposalModels.SubmissionResult submit(ProposalModels.Submission submission) {
        if (submission.schoolId() == null || submission.schoolId().isBlank()) {
            throw new IllegalArgumentException("schoolId is required");
        }
        if (submission.academicYear() == null || submission.academicYear().isBlank()) {
            throw new IllegalArgumentException("academicYear is required");
        }
        requireRequestRange("classroomsRequested", submission.classroomsRequested());
        requireRequestRange("teachersRequested", submission.teachersRequested());

        Optional<ProposalModels.ActualGap> actual = repository.findGap(submission.schoolId(), submission.academicYear());
        ProposalModels.Decision decision = actual
                .map(g -> ProposalValidator.validate(submission.classroomsRequested(), submission.teachersRequested(),
                        g.classroomGap(), g.teacherGap()))
                .orElseGet(ProposalValidator::schoolNotFound);
        repository.saveSubmission(submission, actual.orElse(null), decision, Instant.now());
        log.info("Proposal for {} {} by {}: {} / {}", submission.schoolId(), submission.academicYear(),
                submission.submittedBy(), decision.status(), decision.reason());

        Map<String, Object> gaps = new LinkedHashMap<>();
        actual.ifPresent(g -> {
            gaps.put("classroomGap", g.classroomGap());
            gaps.put("teacherGap", g.teacherGap());
        });
        return new ProposalModels.SubmissionResult(decision.status(), decision.reason(), decision.confidence(),
                decision.classroomRatio(), decision.teacherRatio(), gaps, ProposalValidator.message(decision));
    }

    static List<ProposalModels.DemandProposal> seed(List<ProposalModels.ActualGap> gaps) {
        return gaps.stream()
                .map(g -> new ProposalModels.DemandProposal(g.schoolId(), g.academicYear(),
                        ProposalValidator.syntheticRequest(g.classroomGap(), g.schoolId(), g.academicYear(), "cr"),
                        ProposalValidator.syntheticRequest(g.teacherGap(), g.schoolId(), g.academicYear(), "tr"),
                        SIMULATION_SOURCE))
                .toList();
    }

    static List<ProposalModels.Validation> validateAll(List<ProposalModels.DemandProposal> demand,
                                                       List<ProposalModels.ActualGap> gaps) {
        Map<String, ProposalModels.ActualGap> bySchool = gaps.stream()
                .collect(Collectors.toMap(ProposalModels.ActualGap::schoolId, Function.identity()));
        return demand.stream()
                .map(p -> {
                    ProposalModels.ActualGap actual = bySchool.get(p.schoolId());
                    ProposalModels.Decision decision = actual == null
                            ? ProposalValidator.schoolNotFound()
                            : ProposalValidator.validate(p.requestedClassrooms(), p.requestedTeachers(),
                            actual.classroomGap(), actual.teacherGap());
                    return new ProposalModels.Validation(p, actual, decision);
                })
                .toList();
    }

    private static void requireRequestRange(String field, int value) {
        if (value < 0 || value > MAX_REQUEST) {
            throw new IllegalArgumentException(field + " must be between 0 and " + MAX_REQUEST);
        }
    }
}
