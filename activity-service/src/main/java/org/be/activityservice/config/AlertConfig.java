package org.be.activityservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "alert")
public class AlertConfig {

    private Topics topics = new Topics();
    private boolean publishEnabled = false;
    private Scan scan = new Scan();

    @Data
    public static class Topics {
        private String activityAlerts = "activity-state-alerts";
    }

    @Data
    public static class Scan {
        private boolean enabled = false;
        private String cron = "0 30 0 * * *";
        private String timescale = "1D";
        private List<String> countries = new ArrayList<>();
    }
}
