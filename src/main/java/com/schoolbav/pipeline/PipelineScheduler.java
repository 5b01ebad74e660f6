package com.schoolbav.pipeline;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Optional full recompute on startup and on a cron schedule. The schedule is disabled ("-") by
 * default; set school-bav.pipeline.cron to enable it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PipelineScheduler {

    private final PipelineService pipelineService;
    private final SchoolBavProperties properties;

    @PostConstruct
    public void onStartup() {
        if (properties.getPipeline().isRunOnStartup()) {
            log.info("run-on-startup enabled, running full pipeline");
            runAll("Startup");
        } else {
            log.info("Pipeline ready. Schedule: {}", properties.getPipeline().getCron());
        }
    }

    @Scheduled(cron = "${school-bav.pipeline.cron:-}")
    public void scheduledRun() {
        log.info("Scheduled pipeline run triggered");
        runAll("Scheduled");
    }

    private void runAll(String trigger) {
        try {
            PipelineModels.PipelineRunReport report = pipelineService.runAll();
            log.info("{} pipeline run {} wrote {} stage results", trigger, report.runId(), report.stages().size());
        } catch (StageOrderingException | DataAccessException e) {
            log.error("{} pipeline run failed: {}", trigger, e.getMessage(), e);
        }
    }
}
