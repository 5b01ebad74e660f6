package com.schoolbav.repository;

import com.schoolbav.budget.BudgetModels;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public class BudgetJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public BudgetJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public int replaceYear(String academicYear, List<BudgetModels.Allocation> allocations) {
        jdbcTemplate.update("DELETE FROM budget_simulation WHERE academic_year = ?", academicYear);
        jdbcTemplate.batchUpdate(
                "INSERT INTO budget_simulation(school_id, academic_year, risk_level, risk_score, classroom_gap, teacher_gap, classrooms_allocated, teachers_allocated, classroom_resolved, teacher_resolved, allocation_priority) VALUES (?,?,?,?,?,?,?,?,?,?,?)",
                allocations.stream().map(a -> new Object[]{a.demand().schoolId(), a.demand().academicYear(),
                        a.demand().riskLevel() == null ? null : a.demand().riskLevel().name(), a.demand().riskScore(),
                        a.demand().classroomGap(), a.demand().teacherGap(), a.classroomsAllocated(), a.teachersAllocated(),
                        a.classroomResolved(), a.teacherResolved(), a.priority()}).toList());
        return allocations.size();
    }
}
