package org.be.activityservice.service.activity;

import org.be.activityservice.dto.request.EvaluateRequestDto;
import org.be.activityservice.dto.response.ActivityRowDto;
import org.be.activityservice.dto.response.ActivityTimelineDto;
import org.be.activityservice.enums.Timescale;
import org.be.activityservice.model.ActivityTimeline;
import org.be.activityservice.model.ValueSeries;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public interface ActivityStateService {

    /**
     * 집계된 시계열 평가 (임계값 적합 → 상태 판정 → 알림)
     */
    ActivityTimeline evaluate(String entity, ValueSeries series);

    /**
     * 국가별 이벤트를 읽어 집계 후 평가
     */
    ActivityTimeline evaluateCountry(String countryCode, Timescale timescale,
                                     LocalDate from, LocalDate to, boolean useMentions);

    /**
     * 여러 국가 병렬 평가 (실패한 국가는 결과에서 제외)
     */
    Map<String, ActivityTimeline> evaluateCountries(List<String> countryCodes, Timescale timescale);

    /**
     * 이벤트가 있는 국가 코드 목록
     */
    List<String> getCountries();

    /**
     * 요청 본문의 원시 레코드 평가
     */
    ActivityTimelineDto evaluateRecords(EvaluateRequestDto request);

    /**
     * 국가별 타임라인 조회
     */
    ActivityTimelineDto getCountryTimeline(String countryCode, String timescale,
                                           LocalDate from, LocalDate to, boolean useMentions);

    /**
     * 국가별 알림 행만 조회
     */
    List<ActivityRowDto> getCountryAlerts(String countryCode, String timescale,
                                          LocalDate from, LocalDate to, boolean useMentions);
}
