package com.schoolbav.pipeline;

/** Pipeline stages in dependency order; each reads columns written by the ones before it. */
public enum Stage {
    CLASSROOM_GAP,
    TEACHER_ADEQUACY,
    RISK_SCORE,
    PRIORITISATION,
    RISK_TREND,
    DISTRICT_COMPLIANCE,
    BUDGET_ALLOCATION,
    FORECAST,
    PROPOSAL_VALIDATION
}
