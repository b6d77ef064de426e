package org.be.activityservice.service.series;

import org.be.activityservice.exception.InvalidTimestampException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;

/**
 * 레코드 타임스탬프 파서. 오프셋이 있으면 UTC 로 변환한다.
 */
public final class TimestampParser {

    private static final DateTimeFormatter SPACE_SEPARATED = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .toFormatter();

    private static final DateTimeFormatter SPACE_SEPARATED_OFFSET = new DateTimeFormatterBuilder()
            .append(SPACE_SEPARATED)
            .appendPattern("[XXX][XX][X]")
            .toFormatter();

    private static final DateTimeFormatter COMPACT_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private static final List<DateTimeFormatter> LOCAL_DATE_TIMES = List.of(
            SPACE_SEPARATED,
            DateTimeFormatter.ISO_LOCAL_DATE_TIME);

    private static final List<DateTimeFormatter> OFFSET_DATE_TIMES = List.of(
            SPACE_SEPARATED_OFFSET,
            DateTimeFormatter.ISO_OFFSET_DATE_TIME);

    private static final List<DateTimeFormatter> DATES = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            COMPACT_DATE);

    private TimestampParser() {
    }

    public static LocalDateTime parse(Object raw) {
        if (raw instanceof LocalDateTime) {
            return (LocalDateTime) raw;
        }
        if (raw == null) {
            throw new InvalidTimestampException("null", null);
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            throw new InvalidTimestampException(text, null);
        }

        DateTimeParseException lastError = null;
        for (DateTimeFormatter formatter : LOCAL_DATE_TIMES) {
            try {
                return LocalDateTime.parse(text, formatter);
            } catch (DateTimeParseException e) {
                lastError = e;
            }
        }
        for (DateTimeFormatter formatter : OFFSET_DATE_TIMES) {
            try {
                return OffsetDateTime.parse(text, formatter)
                        .withOffsetSameInstant(ZoneOffset.UTC)
                        .toLocalDateTime();
            } catch (DateTimeParseException e) {
                lastError = e;
            }
        }
        for (DateTimeFormatter formatter : DATES) {
            try {
                return LocalDate.parse(text, formatter).atStartOfDay();
            } catch (DateTimeParseException e) {
                lastError = e;
            }
        }
        throw new InvalidTimestampException(text, lastError);
    }
}
