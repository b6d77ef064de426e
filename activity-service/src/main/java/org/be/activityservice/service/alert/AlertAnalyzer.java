package org.be.activityservice.service.alert;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.be.activityservice.config.ActivityProperties;
import org.be.activityservice.dto.AlertEvent;
import org.be.activityservice.model.ActivityState;
import org.be.activityservice.model.ActivityTimeline;
import org.be.activityservice.model.StateRow;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.*;

@Slf4j
@Service
@RequiredArgsConstructor
public class AlertAnalyzer {

    private final ActivityProperties activityProperties;

    /**
     * 마지막 버킷에서 발생한 상태 변화 알림 목록
     */
    public List<AlertEvent> createLatestAlerts(ActivityTimeline timeline) {
        List<AlertEvent> alerts = new ArrayList<>();
        for (Map.Entry<String, List<StateRow>> entry : timeline.getRowsByWindow().entrySet()) {
            List<StateRow> rows = entry.getValue();
            if (rows.isEmpty() || !rows.get(rows.size() - 1).isAlert()) {
                continue;
            }
            StateRow current = rows.get(rows.size() - 1);
            StateRow previous = rows.size() > 1 ? rows.get(rows.size() - 2) : null;
            alerts.add(createStateChangeAlert(timeline.getEntity(), timeline.getSeries().isUsingMentions(),
                    current, previous));
        }
        return alerts;
    }

    public AlertEvent createStateChangeAlert(String entity, boolean usingMentions,
                                             StateRow current, StateRow previous) {
        ActivityState state = current.getState()
                .orElseThrow(() -> new IllegalArgumentException("Alert row must have a state"));
        Integer previousIndex = previous == null
                ? null
                : previous.getState().map(ActivityState::getIndex).orElse(null);

        AlertEvent alert = new AlertEvent();
        alert.setId(UUID.randomUUID().toString());
        alert.setType("state_change");
        alert.setEntity(entity);
        alert.setWindowLabel(current.getWindowLabel());
        alert.setStateName(state.getName());
        alert.setStateIndex(state.getIndex());
        alert.setPreviousStateIndex(previousIndex);
        alert.setBucket(current.getTimestamp());
        alert.setValue(current.getValue());
        alert.setTimestamp(LocalDateTime.now());
        alert.setSeverity(severityOf(state));
        alert.setTitle(String.format("%s %s 상태 진입: %s", entity, current.getWindowLabel(), state.getName()));
        alert.setContent(String.format("%s %s 값 %.0f, 상태 %d → %d",
                entity, usingMentions ? "멘션" : "이벤트", current.getValue(),
                previousIndex, state.getIndex()));

        // 메타데이터
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("metric_type", usingMentions ? "Mentions" : "Events");
        metadata.put("window_label", current.getWindowLabel());
        metadata.put("state_index", state.getIndex());
        alert.setMetadata(metadata);

        return alert;
    }

    double severityOf(ActivityState state) {
        int top = activityProperties.getStateNames().size() - 1;
        return top <= 0 ? 1.0 : (double) state.getIndex() / top;
    }
}
