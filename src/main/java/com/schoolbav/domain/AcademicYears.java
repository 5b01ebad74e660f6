package com.schoolbav.domain;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class AcademicYears {
    private static final Pattern LABEL = Pattern.compile("(\\d{4})-(\\d{2})");

    private AcademicYears() {
    }

    /**
     * Advances a "YYYY-YY" label by the given number of years, e.g. "2023-24" + 2 = "2025-26".
     */
    public static String plus(String academicYear, int years) {
        Matcher m = academicYear == null ? null : LABEL.matcher(academicYear.trim());
        if (m == null || !m.matches()) {
            throw new IllegalArgumentException("Academic year must be YYYY-YY: " + academicYear);
        }
        int start = Integer.parseInt(m.group(1)) + years;
        int end = (Integer.parseInt(m.group(2)) + years) % 100;
        return start + "-" + String.format("%02d", end);
    }
}
