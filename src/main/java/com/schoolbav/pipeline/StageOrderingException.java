package com.schoolbav.pipeline;

/**
 * A stage was invoked before the stage it depends on populated the columns it reads.
 */
public class StageOrderingException extends IllegalStateException {
    private final Stage stage;
    private final String academicYear;

    public StageOrderingException(Stage stage, String academicYear, String message) {
        super(stage + " cannot run for " + academicYear + ": " + message);
        this.stage = stage;
        this.academicYear = academicYear;
    }

    public Stage getStage() {
        return stage;
    }

    public String getAcademicYear() {
        return academicYear;
    }
}
