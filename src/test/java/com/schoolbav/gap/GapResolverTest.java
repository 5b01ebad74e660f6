package com.schoolbav.gap;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GapResolverTest {

    @Test
    void primarySchoolOf900NeedsThirtyRoomsAndThirtyTeachers() {
        var rooms = GapResolver.classrooms(List.of(new GapModels.CapacityInput("X", "2023-24", 900, 25, 1)));
        var teachers = GapResolver.teachers(List.of(new GapModels.CapacityInput("X", "2023-24", 900, 20, 1)));

        assertEquals(30, rooms.get(0).required());
        assertEquals(5, rooms.get(0).gap());
        assertEquals(30, teachers.get(0).required());
        assertEquals(10, teachers.get(0).gap());
    }

    @Test
    void classroomAndTeacherNormsDifferForCategoriesFiveAndSeven() {
        assertEquals(35, CapacityNorms.classroomNorm(4));
        assertEquals(35, CapacityNorms.teacherNorm(4));
        assertEquals(35, CapacityNorms.classroomNorm(5));
        assertEquals(30, CapacityNorms.teacherNorm(5));
        assertEquals(35, CapacityNorms.classroomNorm(7));
        assertEquals(30, CapacityNorms.teacherNorm(7));
        assertEquals(40, CapacityNorms.classroomNorm(11));
        assertEquals(30, CapacityNorms.teacherNorm(11));
    }

    @Test
    void unmappedCategoryUsesConservativeNorm() {
        assertFalse(CapacityNorms.isMapped(9));
        assertFalse(CapacityNorms.isMapped(null));
        assertEquals(CapacityNorms.CONSERVATIVE_NORM, CapacityNorms.classroomNorm(9));
        assertEquals(CapacityNorms.CONSERVATIVE_NORM, CapacityNorms.teacherNorm(null));

        var rooms = GapResolver.classrooms(List.of(new GapModels.CapacityInput("Y", "2023-24", 400, 10, 9)));
        assertEquals(14, rooms.get(0).required());
        assertEquals(4, rooms.get(0).gap());
    }

    @Test
    void missingCounterpartsCountAsZero() {
        var result = GapResolver.classrooms(List.of(
                new GapModels.CapacityInput("no-enrolment", "2023-24", null, 12, 1),
                new GapModels.CapacityInput("no-rooms", "2023-24", 61, null, 1)));

        assertEquals(0, result.get(0).required());
        assertEquals(0, result.get(0).gap());
        assertEquals(3, result.get(1).required());
        assertEquals(3, result.get(1).gap());
    }

    @Test
    void surplusCapacityNeverGivesNegativeGap() {
        var result = GapResolver.teachers(List.of(new GapModels.CapacityInput("Z", "2023-24", 100, 40, 2)));
        assertEquals(4, result.get(0).required());
        assertEquals(0, result.get(0).gap());
    }
}
