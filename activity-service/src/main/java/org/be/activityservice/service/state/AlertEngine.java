package org.be.activityservice.service.state;

import org.be.activityservice.model.StateRow;

import java.util.ArrayList;
import java.util.List;

/**
 * 상승 엣지 알림. 이전 상태가 있고, 현재 상태가 기준 이상이며, 이전보다 높아졌을 때만 true.
 * 같은 상태에 머무르는 동안은 다시 울리지 않는다.
 */
public class AlertEngine {

    private final int minStateIndex;

    public AlertEngine(int minStateIndex) {
        this.minStateIndex = minStateIndex;
    }

    public List<StateRow> detect(List<StateRow> rows) {
        List<StateRow> result = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            boolean alert = i > 0 && isRisingEdge(rows.get(i - 1), rows.get(i));
            result.add(rows.get(i).withAlert(alert));
        }
        return result;
    }

    boolean isRisingEdge(StateRow previous, StateRow current) {
        if (!previous.isSet() || !current.isSet()) {
            return false;
        }
        int now = current.getState().get().getIndex();
        int before = previous.getState().get().getIndex();
        return now >= minStateIndex && now > before;
    }
}
