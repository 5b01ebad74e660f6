package com.schoolbav.forecast;

import com.schoolbav.domain.AcademicYears;
import com.schoolbav.domain.DomainModels.YearlyMetric;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ForecasterTest {

    private static List<YearlyMetric> series(Integer... enrolment) {
        List<YearlyMetric> out = new ArrayList<>();
        for (int i = 0; i < enrolment.length; i++) {
            out.add(new YearlyMetric("s", AcademicYears.plus("2019-20", i), enrolment[i]));
        }
        return out;
    }

    @Test
    void flatEnrolmentProjectsTheBaseUnchanged() {
        var forecasts = Forecaster.forecast(new ForecastModels.ForecastInput("s", 1, series(500, 500, 500), 10, 10));

        assertEquals(3, forecasts.size());
        forecasts.forEach(f -> {
            assertEquals(0.0, f.growthRate());
            assertEquals(500, f.projectedEnrolment());
        });
        assertEquals(List.of("2022-23", "2023-24", "2024-25"), forecasts.stream().map(ForecastModels.Forecast::forecastYear).toList());
        assertEquals("2021-22", forecasts.get(0).baseYear());
    }

    @Test
    void weightsMostRecentTransitionsHeaviest() {
        assertEquals(1.0 / 6.0, Forecaster.growthEstimate(series(100, 200, 200, 200)), 1e-9);
        assertEquals(0.05, Forecaster.growthEstimate(series(100, 100, 100, 110)), 1e-9);
    }

    @Test
    void onlyTheLastThreeTransitionsCount() {
        assertEquals(0.0, Forecaster.growthEstimate(series(10, 100, 100, 100, 100)), 1e-9);
    }

    @Test
    void missingOrZeroStartTransitionsAreLeftOut() {
        assertEquals(0.1, Forecaster.growthEstimate(series(100, 110)), 1e-9);
        assertEquals(0.2, Forecaster.growthEstimate(series(0, 50, 60)), 1e-9);
        assertEquals(0.0, Forecaster.growthEstimate(series(700)), 1e-9);
        assertEquals(0.1, Forecaster.growthEstimate(Arrays.asList(
                new YearlyMetric("s", "2020-21", 100),
                new YearlyMetric("s", "2021-22", null),
                new YearlyMetric("s", "2022-23", 110))), 1e-9);
    }

    @Test
    void growthIsClipped() {
        assertEquals(Forecaster.GROWTH_CLIP, Forecaster.growthEstimate(series(100, 200)));
        assertEquals(-Forecaster.GROWTH_CLIP, Forecaster.growthEstimate(series(100, 10)));
    }

    @Test
    void compoundsOneGrowthRateAgainstCurrentCapacity() {
        var forecasts = Forecaster.forecast(new ForecastModels.ForecastInput("s", 1, series(1000, 1100), 30, 40));

        assertEquals(List.of(1210, 1331, 1464), forecasts.stream().map(ForecastModels.Forecast::projectedEnrolment).toList());
        ForecastModels.Forecast first = forecasts.get(0);
        assertEquals(1100, first.baseEnrolment());
        assertEquals(41, first.projectedClassroomsReq());
        assertEquals(11, first.projectedClassroomGap());
        assertEquals(41, first.projectedTeachersReq());
        assertEquals(1, first.projectedTeacherGap());
        assertEquals(30, first.currentClassrooms());
    }

    @Test
    void schoolWithoutEnrolmentIsNotForecast() {
        assertTrue(Forecaster.forecast(new ForecastModels.ForecastInput("s", 1, series((Integer) null), 0, 0)).isEmpty());
        assertTrue(Forecaster.baseYear(series((Integer) null)).isEmpty());
    }

    @Test
    void yearLabelsWrapTheCentury() {
        assertEquals("2100-01", AcademicYears.plus("2098-99", 2));
        assertThrows(IllegalArgumentException.class, () -> AcademicYears.plus("2023", 1));
    }
}
