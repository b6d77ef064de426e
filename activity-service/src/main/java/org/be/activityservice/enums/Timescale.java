package org.be.activityservice.enums;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Arrays;

/**
 * 집계 간격. 버킷 라벨은 캘린더 리샘플링 규칙을 따른다.
 * <ul>
 *     <li>시간 단위: 자정 기준 N시간 배수로 내림</li>
 *     <li>1D: 자정으로 내림</li>
 *     <li>1W: 월~일 한 주를 마지막 일요일 날짜로 라벨링</li>
 *     <li>1M: 월의 마지막 날짜로 라벨링</li>
 * </ul>
 */
public enum Timescale {
    HOURLY("1H", "Hourly"),
    SIX_HOURS("6H", "6-Hour"),
    TWELVE_HOURS("12H", "12-Hour"),
    DAILY("1D", "Daily"),
    WEEKLY("1W", "Weekly"),
    MONTHLY("1M", "Monthly");

    private final String code;
    private final String label;

    Timescale(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public static Timescale fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Timescale code is required");
        }
        return Arrays.stream(values())
                .filter(t -> t.code.equalsIgnoreCase(code.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported timescale: " + code));
    }

    /**
     * 타임스탬프가 속한 버킷 라벨
     */
    public LocalDateTime bucketOf(LocalDateTime timestamp) {
        switch (this) {
            case HOURLY:
            case SIX_HOURS:
            case TWELVE_HOURS:
                int hours = hoursPerBucket();
                LocalDateTime hour = timestamp.truncatedTo(ChronoUnit.HOURS);
                return hour.withHour(hour.getHour() - hour.getHour() % hours);
            case DAILY:
                return timestamp.truncatedTo(ChronoUnit.DAYS);
            case WEEKLY:
                return timestamp.toLocalDate()
                        .with(TemporalAdjusters.nextOrSame(DayOfWeek.SUNDAY))
                        .atTime(LocalTime.MIDNIGHT);
            case MONTHLY:
                return timestamp.toLocalDate()
                        .with(TemporalAdjusters.lastDayOfMonth())
                        .atTime(LocalTime.MIDNIGHT);
            default:
                throw new IllegalStateException("Unknown timescale: " + this);
        }
    }

    /**
     * 다음 버킷 라벨 (bucket 은 bucketOf 결과여야 한다)
     */
    public LocalDateTime next(LocalDateTime bucket) {
        switch (this) {
            case HOURLY:
            case SIX_HOURS:
            case TWELVE_HOURS:
                return bucket.plusHours(hoursPerBucket());
            case DAILY:
                return bucket.plusDays(1);
            case WEEKLY:
                return bucket.plusWeeks(1);
            case MONTHLY:
                return bucket.toLocalDate()
                        .plusMonths(1)
                        .with(TemporalAdjusters.lastDayOfMonth())
                        .atTime(LocalTime.MIDNIGHT);
            default:
                throw new IllegalStateException("Unknown timescale: " + this);
        }
    }

    private int hoursPerBucket() {
        switch (this) {
            case SIX_HOURS:
                return 6;
            case TWELVE_HOURS:
                return 12;
            default:
                return 1;
        }
    }
}
