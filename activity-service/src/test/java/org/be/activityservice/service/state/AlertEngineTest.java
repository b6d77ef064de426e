package org.be.activityservice.service.state;

import org.be.activityservice.model.ActivityState;
import org.be.activityservice.model.StateRow;
import org.be.activityservice.support.SeriesFixtures;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class AlertEngineTest {

    private final AlertEngine engine = new AlertEngine(3);

    private static List<StateRow> rows(Integer... indices) {
        List<StateRow> rows = new ArrayList<>();
        for (int i = 0; i < indices.length; i++) {
            rows.add(indices[i] == null
                    ? StateRow.unset(SeriesFixtures.ORIGIN.plusDays(i), 0, "7 day")
                    : StateRow.of(SeriesFixtures.ORIGIN.plusDays(i), 0, "7 day", new ActivityState("s" + indices[i], indices[i])));
        }
        return rows;
    }

    private static List<Integer> alertPositions(List<StateRow> rows) {
        return IntStream.range(0, rows.size())
                .filter(i -> rows.get(i).isAlert())
                .boxed()
                .collect(Collectors.toList());
    }

    @Test
    void detect_firesOnRisingEdgeAtOrAboveHigh() {
        List<StateRow> result = engine.detect(rows(1, 1, 2, 3, 4, 3, 4));

        assertEquals(List.of(3, 4, 6), alertPositions(result));
    }

    @Test
    void detect_doesNotRepeatWhileStateHolds() {
        List<StateRow> result = engine.detect(rows(0, 5, 5, 5, 4, 5));

        assertEquals(List.of(1, 5), alertPositions(result));
    }

    @Test
    void detect_unsetNeighbourNeverAlerts() {
        List<StateRow> result = engine.detect(rows(null, 5, null, 4, 5));

        assertEquals(List.of(4), alertPositions(result));
    }

    @Test
    void detect_firstRowNeverAlerts() {
        assertFalse(engine.detect(rows(5)).get(0).isAlert());
    }

    @Test
    void detect_keepsInputUntouched() {
        List<StateRow> input = rows(0, 4);

        engine.detect(input);

        assertFalse(input.get(1).isAlert());
    }
}
