package org.be.activityservice.service.series;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.be.activityservice.enums.Timescale;
import org.be.activityservice.exception.InvalidSchemaException;
import org.be.activityservice.exception.InvalidTimestampException;
import org.be.activityservice.model.RawEventRecord;
import org.be.activityservice.model.SeriesPoint;
import org.be.activityservice.model.ValueSeries;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 원시 레코드를 고정 간격 시계열로 집계한다.
 * 가중치(멘션 수)를 쓰면 버킷별로 합산하고, 아니면 레코드 수를 센다.
 * 첫 버킷부터 마지막 버킷까지 빈 구간은 0으로 채운다.
 */
@Slf4j
public class SeriesAggregator {

    public Aggregation aggregate(List<RawEventRecord> records, Timescale timescale, boolean usingMentions) {
        TreeMap<LocalDateTime, Double> buckets = new TreeMap<>();
        int invalidTimestamps = 0;

        for (RawEventRecord record : records) {
            LocalDateTime timestamp;
            try {
                timestamp = TimestampParser.parse(record.getTimestamp());
            } catch (InvalidTimestampException e) {
                invalidTimestamps++;
                log.warn("타임스탬프 파싱 실패, 레코드 제외: {}", e.getRawValue());
                continue;
            }
            double weight = usingMentions ? (record.getWeight() == null ? 0.0 : record.getWeight()) : 1.0;
            buckets.merge(timescale.bucketOf(timestamp), weight, Double::sum);
        }

        return new Aggregation(toSeries(buckets, timescale, usingMentions), invalidTimestamps, 0);
    }

    /**
     * 맵 형태의 레코드를 집계한다. 가중치 필드가 한 레코드라도 있으면 멘션 기반으로 집계한다.
     *
     * @throws InvalidSchemaException 타임스탬프 필드가 없는 레코드가 있을 때 (집계 전에 실패)
     */
    public Aggregation aggregateRows(List<Map<String, Object>> rows, String timestampField, String weightField,
                                     Timescale timescale) {
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = rows.get(i);
            if (row == null || !row.containsKey(timestampField)) {
                throw new InvalidSchemaException(
                        String.format("Record %d is missing required field '%s'", i, timestampField));
            }
        }
        boolean usingMentions = weightField != null
                && rows.stream().anyMatch(row -> row.containsKey(weightField));

        List<RawEventRecord> records = new ArrayList<>(rows.size());
        int invalidWeights = 0;
        for (Map<String, Object> row : rows) {
            Object timestamp = row.get(timestampField);
            if (!usingMentions) {
                records.add(RawEventRecord.event(timestamp));
                continue;
            }
            try {
                records.add(new RawEventRecord(timestamp, toWeight(row.get(weightField))));
            } catch (NumberFormatException e) {
                invalidWeights++;
                log.warn("가중치 값이 숫자가 아님, 레코드 제외: {}={}", weightField, row.get(weightField));
            }
        }

        Aggregation aggregation = aggregate(records, timescale, usingMentions);
        return new Aggregation(aggregation.getSeries(), aggregation.getInvalidTimestamps(), invalidWeights);
    }

    private static Double toWeight(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue();
        }
        String text = raw.toString().trim();
        return text.isEmpty() ? null : Double.valueOf(text);
    }

    private static ValueSeries toSeries(TreeMap<LocalDateTime, Double> buckets, Timescale timescale,
                                        boolean usingMentions) {
        if (buckets.isEmpty()) {
            return ValueSeries.empty(timescale, usingMentions);
        }
        List<SeriesPoint> points = new ArrayList<>();
        LocalDateTime last = buckets.lastKey();
        for (LocalDateTime bucket = buckets.firstKey(); !bucket.isAfter(last); bucket = timescale.next(bucket)) {
            points.add(new SeriesPoint(bucket, buckets.getOrDefault(bucket, 0.0)));
        }
        return new ValueSeries(points, timescale, usingMentions);
    }

    @Value
    public static class Aggregation {
        ValueSeries series;
        int invalidTimestamps;
        int invalidWeights;

        public int getDroppedRecords() {
            return invalidTimestamps + invalidWeights;
        }
    }
}
