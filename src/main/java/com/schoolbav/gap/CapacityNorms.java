package com.schoolbav.gap;

import java.util.Map;

/**
 * Category-based capacity norms. Category encodes the grade span of a school (1-11).
 * <p>
 * The classroom and pupil-teacher tables differ for categories 5 and 7: classroom sizing follows the
 * upper-primary room norm there, while the PTR falls back to the blended 30:1 standard.
 */
public final class CapacityNorms {
    /** Smallest norm in both tables; applied to unmapped categories. */
    public static final int CONSERVATIVE_NORM = 30;

    private static final Map<Integer, Integer> STUDENTS_PER_CLASSROOM = Map.of(
            1, 30, 2, 30, 3, 30, 6, 30,
            4, 35, 5, 35, 7, 35,
            8, 40, 10, 40, 11, 40);

    private static final Map<Integer, Integer> PUPILS_PER_TEACHER = Map.of(
            1, 30, 2, 30, 3, 30, 5, 30, 6, 30, 7, 30, 8, 30, 10, 30, 11, 30,
            4, 35);

    private CapacityNorms() {
    }

    public static int classroomNorm(Integer category) {
        return category == null ? CONSERVATIVE_NORM : STUDENTS_PER_CLASSROOM.getOrDefault(category, CONSERVATIVE_NORM);
    }

    public static int teacherNorm(Integer category) {
        return category == null ? CONSERVATIVE_NORM : PUPILS_PER_TEACHER.getOrDefault(category, CONSERVATIVE_NORM);
    }

    public static boolean isMapped(Integer category) {
        return category != null && STUDENTS_PER_CLASSROOM.containsKey(category);
    }

    /** ceil(enrolment / norm); negative or missing enrolment counts as zero. */
    public static int required(Integer enrolment, int norm) {
        int students = enrolment == null ? 0 : Math.max(enrolment, 0);
        return (students + norm - 1) / norm;
    }

    public static int gap(int required, Integer current) {
        return Math.max(required - (current == null ? 0 : current), 0);
    }
}
