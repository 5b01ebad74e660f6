package com.schoolbav.pipeline;

import com.schoolbav.repository.InfrastructureJdbcRepository;
import org.springframework.stereotype.Component;

/**
 * Fail-fast checks that a stage's upstream columns are populated for a year.
 */
@Component
public class StagePreconditions {
    private final InfrastructureJdbcRepository infrastructure;

    public StagePreconditions(InfrastructureJdbcRepository infrastructure) {
        this.infrastructure = infrastructure;
    }

    public void requireRequirements(Stage stage, String year) {
        if (infrastructure.countRows(year) == 0) {
            throw new StageOrderingException(stage, year, "no classroom requirements computed");
        }
        if (infrastructure.countMissingClassroomRequirement(year) > 0) {
            throw new StageOrderingException(stage, year, "required_class_rooms is not populated");
        }
        if (infrastructure.countMissingTeacherRequirement(year) > 0) {
            throw new StageOrderingException(stage, year, "required_teachers is not populated");
        }
        long unmatched = infrastructure.countMissingTeacherCounterpart(year);
        if (unmatched > 0) {
            throw new StageOrderingException(stage, year, unmatched + " school-years have no teacher requirement");
        }
    }

    public void requireRiskScores(Stage stage, String year) {
        if (infrastructure.countRows(year) == 0) {
            throw new StageOrderingException(stage, year, "no school-years present");
        }
        long unscored = infrastructure.countMissingRiskScore(year);
        if (unscored > 0) {
            throw new StageOrderingException(stage, year, unscored + " school-years have no risk_score");
        }
    }
}
