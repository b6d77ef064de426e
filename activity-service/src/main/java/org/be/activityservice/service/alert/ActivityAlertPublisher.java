package org.be.activityservice.service.alert;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.be.activityservice.config.AlertConfig;
import org.be.activityservice.dto.AlertEvent;
import org.be.activityservice.model.ActivityTimeline;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 최신 버킷에서 발생한 알림을 Kafka 토픽으로 발행한다. 발행 실패는 평가 결과에 영향을 주지 않는다.
 * 반환값은 발행을 시도한 알림 수.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ActivityAlertPublisher {

    private final AlertConfig alertConfig;
    private final AlertAnalyzer alertAnalyzer;
    private final KafkaTemplate<String, AlertEvent> kafkaTemplate;

    public int publishLatest(ActivityTimeline timeline) {
        if (!alertConfig.isPublishEnabled()) {
            log.debug("알림 발행 비활성화 상태: entity={}", timeline.getEntity());
            return 0;
        }

        List<AlertEvent> alerts = alertAnalyzer.createLatestAlerts(timeline);
        String topic = alertConfig.getTopics().getActivityAlerts();
        for (AlertEvent alert : alerts) {
            try {
                kafkaTemplate.send(topic, alert.getEntity(), alert)
                        .whenComplete((result, e) -> {
                            if (e != null) {
                                log.error("알림 발행 실패: entity={}, window={}", alert.getEntity(), alert.getWindowLabel(), e);
                            } else {
                                log.info("알림 발행 완료: {} ({})", alert.getTitle(), topic);
                            }
                        });
            } catch (KafkaException | org.apache.kafka.common.KafkaException e) {
                // send 호출 자체의 실패 (메타데이터 대기 초과, 직렬화 오류)
                log.error("알림 전송 요청 실패: entity={}, window={}", alert.getEntity(), alert.getWindowLabel(), e);
            }
        }
        return alerts.size();
    }
}
