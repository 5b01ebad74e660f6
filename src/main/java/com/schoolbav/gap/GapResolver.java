package com.schoolbav.gap;

import java.util.List;
import java.util.function.Function;

/**
 * Norm-based requirement and shortfall for classrooms and teachers.
 */
public final class GapResolver {
    private GapResolver() {
    }

    public static List<GapModels.Requirement> classrooms(List<GapModels.CapacityInput> inputs) {
        return resolve(inputs, CapacityNorms::classroomNorm);
    }

    public static List<GapModels.Requirement> teachers(List<GapModels.CapacityInput> inputs) {
        return resolve(inputs, CapacityNorms::teacherNorm);
    }

    private static List<GapModels.Requirement> resolve(List<GapModels.CapacityInput> inputs,
                                                       Function<Integer, Integer> norm) {
        return inputs.stream()
                .map(in -> {
                    int required = CapacityNorms.required(in.enrolment(), norm.apply(in.category()));
                    return new GapModels.Requirement(in.schoolId(), in.academicYear(), required,
                            CapacityNorms.gap(required, in.currentCapacity()));
                })
                .toList();
    }
}
