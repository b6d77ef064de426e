package org.be.activityservice.service.alert;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.be.activityservice.config.AlertConfig;
import org.be.activityservice.enums.Timescale;
import org.be.activityservice.model.ActivityTimeline;
import org.be.activityservice.service.activity.ActivityStateService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class ActivityAlertScheduler {

    private final AlertConfig alertConfig;
    private final ActivityStateService activityStateService;
    private final ActivityAlertPublisher activityAlertPublisher;

    /**
     * 감시 국가 목록을 주기적으로 평가해 최신 알림 발행
     */
    @Scheduled(cron = "${alert.scan.cron:0 30 0 * * *}")
    public void scanWatchedCountries() {
        AlertConfig.Scan scan = alertConfig.getScan();
        if (!scan.isEnabled() || scan.getCountries().isEmpty()) {
            log.trace("감시 국가 스캔 비활성화");
            return;
        }

        try {
            Map<String, ActivityTimeline> timelines = activityStateService.evaluateCountries(
                    scan.getCountries(), Timescale.fromCode(scan.getTimescale()));

            int published = 0;
            for (ActivityTimeline timeline : timelines.values()) {
                published += activityAlertPublisher.publishLatest(timeline);
            }
            log.info("감시 국가 스캔 완료: 국가 {}개, 알림 {}개", timelines.size(), published);
        } catch (Exception e) {
            log.warn("감시 국가 스캔 실패", e);
        }
    }
}
