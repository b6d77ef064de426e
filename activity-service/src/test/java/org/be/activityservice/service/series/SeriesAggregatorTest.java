package org.be.activityservice.service.series;

import org.be.activityservice.enums.MetricType;
import org.be.activityservice.enums.Timescale;
import org.be.activityservice.exception.InvalidSchemaException;
import org.be.activityservice.model.RawEventRecord;
import org.be.activityservice.model.ValueSeries;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SeriesAggregatorTest {

    private final SeriesAggregator aggregator = new SeriesAggregator();

    private static Map<String, Object> row(String timestamp, Object mentions) {
        Map<String, Object> row = new HashMap<>();
        row.put("datetime_of_article", timestamp);
        if (mentions != null) {
            row.put("nummentions", mentions);
        }
        return row;
    }

    @Test
    void aggregate_sumsWeightsPerBucketAndFillsGaps() {
        List<RawEventRecord> records = List.of(
                new RawEventRecord("2024-01-01 03:00:00", 2.0),
                new RawEventRecord("2024-01-01 22:15:00", 3.0),
                new RawEventRecord("2024-01-04 09:00:00", 7.0));

        ValueSeries series = aggregator.aggregate(records, Timescale.DAILY, true).getSeries();

        assertEquals(4, series.size());
        assertArrayEquals(new double[]{5, 0, 0, 7}, series.values(0, 4));
        assertEquals(LocalDateTime.of(2024, 1, 2, 0, 0), series.timestampAt(1));
        assertEquals(MetricType.MENTIONS, series.getMetricType());
    }

    @Test
    void aggregate_countsRecordsWithoutWeights() {
        List<RawEventRecord> records = List.of(
                RawEventRecord.event("2024-01-01T01:00:00"),
                RawEventRecord.event("2024-01-01T02:00:00"),
                RawEventRecord.event("2024-01-02T02:00:00"));

        ValueSeries series = aggregator.aggregate(records, Timescale.DAILY, false).getSeries();

        assertArrayEquals(new double[]{2, 1}, series.values(0, 2));
        assertEquals(MetricType.EVENTS, series.getMetricType());
    }

    @Test
    void aggregate_dropsUnparseableTimestamps() {
        List<RawEventRecord> records = List.of(
                new RawEventRecord("2024-01-01 03:00:00", 1.0),
                new RawEventRecord("not a date", 100.0),
                new RawEventRecord("2024-01-02 03:00:00", 1.0));

        SeriesAggregator.Aggregation aggregation = aggregator.aggregate(records, Timescale.DAILY, true);

        assertEquals(1, aggregation.getInvalidTimestamps());
        assertArrayEquals(new double[]{1, 1}, aggregation.getSeries().values(0, 2));
    }

    @Test
    void aggregate_acceptsTypedTimestamps() {
        List<RawEventRecord> records = List.of(
                new RawEventRecord(LocalDateTime.of(2024, 1, 1, 6, 0), 3.0),
                new RawEventRecord(LocalDateTime.of(2024, 1, 1, 8, 0), 4.0),
                new RawEventRecord(LocalDateTime.of(2024, 1, 2, 0, 0), 1.0));

        SeriesAggregator.Aggregation aggregation = aggregator.aggregate(records, Timescale.DAILY, true);

        assertEquals(0, aggregation.getInvalidTimestamps());
        assertArrayEquals(new double[]{7, 1}, aggregation.getSeries().values(0, 2));
    }

    @Test
    void aggregateRows_passesTimestampValueThroughUnchanged() {
        Map<String, Object> first = new HashMap<>();
        first.put("datetime_of_article", LocalDateTime.of(2024, 1, 1, 23, 59, 59, 999_000_000));
        Map<String, Object> second = new HashMap<>();
        second.put("datetime_of_article", LocalDateTime.of(2024, 1, 2, 0, 0));

        SeriesAggregator.Aggregation aggregation = aggregator.aggregateRows(
                List.of(first, second), "datetime_of_article", "nummentions", Timescale.DAILY);

        assertEquals(LocalDateTime.of(2024, 1, 1, 0, 0), aggregation.getSeries().timestampAt(0));
        assertArrayEquals(new double[]{1, 1}, aggregation.getSeries().values(0, 2));
    }

    @Test
    void aggregate_weeklyBucketsEndOnSunday() {
        List<RawEventRecord> records = List.of(
                RawEventRecord.event("2024-01-03"),
                RawEventRecord.event("2024-01-07 23:00:00"),
                RawEventRecord.event("2024-01-08"));

        ValueSeries series = aggregator.aggregate(records, Timescale.WEEKLY, false).getSeries();

        assertEquals(LocalDateTime.of(2024, 1, 7, 0, 0), series.timestampAt(0));
        assertEquals(LocalDateTime.of(2024, 1, 14, 0, 0), series.timestampAt(1));
        assertArrayEquals(new double[]{2, 1}, series.values(0, 2));
    }

    @Test
    void aggregate_noRecordsGivesEmptySeries() {
        assertTrue(aggregator.aggregate(List.of(), Timescale.DAILY, true).getSeries().isEmpty());
    }

    @Test
    void aggregateRows_missingTimestampFieldFailsBeforeAggregation() {
        List<Map<String, Object>> rows = List.of(
                row("2024-01-01 00:00:00", 1),
                Map.<String, Object>of("nummentions", 3));

        assertThrows(InvalidSchemaException.class, () ->
                aggregator.aggregateRows(rows, "datetime_of_article", "nummentions", Timescale.DAILY));
    }

    @Test
    void aggregateRows_weightFieldSelectsMentions() {
        List<Map<String, Object>> rows = List.of(
                row("2024-01-01 00:00:00", 4),
                row("2024-01-01 12:00:00", "6"),
                row("2024-01-02 00:00:00", null));

        SeriesAggregator.Aggregation aggregation =
                aggregator.aggregateRows(rows, "datetime_of_article", "nummentions", Timescale.DAILY);

        assertTrue(aggregation.getSeries().isUsingMentions());
        assertArrayEquals(new double[]{10, 0}, aggregation.getSeries().values(0, 2));
    }

    @Test
    void aggregateRows_withoutWeightFieldCountsEvents() {
        List<Map<String, Object>> rows = List.of(
                row("2024-01-01 00:00:00", null),
                row("2024-01-01 12:00:00", null));

        SeriesAggregator.Aggregation aggregation =
                aggregator.aggregateRows(rows, "datetime_of_article", "nummentions", Timescale.DAILY);

        assertEquals(MetricType.EVENTS, aggregation.getSeries().getMetricType());
        assertArrayEquals(new double[]{2}, aggregation.getSeries().values(0, 1));
    }

    @Test
    void aggregateRows_nonNumericWeightIsDropped() {
        List<Map<String, Object>> rows = List.of(
                row("2024-01-01 00:00:00", 4),
                row("2024-01-01 12:00:00", "many"));

        SeriesAggregator.Aggregation aggregation =
                aggregator.aggregateRows(rows, "datetime_of_article", "nummentions", Timescale.DAILY);

        assertEquals(1, aggregation.getInvalidWeights());
        assertEquals(1, aggregation.getDroppedRecords());
        assertArrayEquals(new double[]{4}, aggregation.getSeries().values(0, 1));
    }
}
