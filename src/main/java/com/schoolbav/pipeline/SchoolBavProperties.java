package com.schoolbav.pipeline;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "school-bav")
@Data
public class SchoolBavProperties {

    private Pipeline pipeline = new Pipeline();
    private Budget budget = new Budget();
    private Proposals proposals = new Proposals();

    @Data
    public static class Pipeline {
        private String cron = "-";
        private boolean runOnStartup = false;
    }

    @Data
    public static class Budget {
        private long totalBudget = 500_000_000L;
        private long costPerClassroom = 500_000L;
        private int teacherPosts = 10_000;
    }

    @Data
    public static class Proposals {
        private boolean simulateDemand = true;
    }
}
