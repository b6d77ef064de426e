package org.be.activityservice.service.activity;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.be.activityservice.config.ActivityProperties;
import org.be.activityservice.dto.request.EvaluateRequestDto;
import org.be.activityservice.dto.response.ActivityRowDto;
import org.be.activityservice.dto.response.ActivityTimelineDto;
import org.be.activityservice.dto.response.AlertPointDto;
import org.be.activityservice.dto.response.StateSegmentDto;
import org.be.activityservice.enums.FitMethod;
import org.be.activityservice.enums.Timescale;
import org.be.activityservice.exception.CountryNotFoundException;
import org.be.activityservice.metrics.ActivityMetrics;
import org.be.activityservice.model.ActivityTimeline;
import org.be.activityservice.model.RawEventRecord;
import org.be.activityservice.model.StateRow;
import org.be.activityservice.model.StateWindow;
import org.be.activityservice.model.ValueSeries;
import org.be.activityservice.repository.EventRecordView;
import org.be.activityservice.repository.GdeltEventRepository;
import org.be.activityservice.service.fitting.ThresholdFitter;
import org.be.activityservice.service.schedule.ThresholdTimeline;
import org.be.activityservice.service.schedule.WindowScheduler;
import org.be.activityservice.service.series.SeriesAggregator;
import org.be.activityservice.service.state.ActivityStateClassifier;
import org.be.activityservice.service.state.AlertEngine;
import org.be.activityservice.service.state.StateSegmentExtractor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ActivityStateServiceImpl implements ActivityStateService {

    private final ActivityProperties activityProperties;
    private final ThresholdFitter thresholdFitter;
    private final ActivityStateClassifier activityStateClassifier;
    private final AlertEngine alertEngine;
    private final SeriesAggregator seriesAggregator;
    private final StateSegmentExtractor stateSegmentExtractor;
    private final GdeltEventRepository gdeltEventRepository;
    private final ActivityMetrics activityMetrics;
    private final ThreadPoolTaskExecutor activityEvaluationExecutor;

    @Override
    public ActivityTimeline evaluate(String entity, ValueSeries series) {
        return evaluate(entity, series, 0);
    }

    private ActivityTimeline evaluate(String entity, ValueSeries series, int droppedRecords) {
        long startTime = System.currentTimeMillis();
        int startIdx = activityProperties.getStartIdx();

        // 임계값은 한 번만 적합해서 모든 윈도우가 공유
        WindowScheduler scheduler = new WindowScheduler(series, activityProperties.toWindowSpec(),
                thresholdFitter, activityProperties.quantileLevelArray());
        ThresholdTimeline thresholds = ThresholdTimeline.materialize(scheduler);

        Map<String, List<StateRow>> rowsByWindow = new LinkedHashMap<>();
        for (StateWindow window : activityProperties.getWindows()) {
            List<StateRow> states = activityStateClassifier.classifySeries(series, thresholds, window, startIdx);
            List<StateRow> rows = alertEngine.detect(states);
            rowsByWindow.put(window.getLabel(), rows);

            long alerts = rows.stream().filter(StateRow::isAlert).count();
            activityMetrics.incrementAlerts(window.getLabel(), alerts);
        }

        Map<FitMethod, Integer> fitCounts = thresholds.fitCounts();
        activityMetrics.recordFits(fitCounts);

        long elapsed = System.currentTimeMillis() - startTime;
        activityMetrics.recordEvaluationTime(elapsed);
        log.info("활동 상태 평가 완료: entity={}, length={}, fits={}, {}ms",
                entity, series.size(), fitCounts, elapsed);

        return ActivityTimeline.builder()
                .entity(entity)
                .series(series)
                .thresholds(thresholds)
                .rowsByWindow(rowsByWindow)
                .droppedRecords(droppedRecords)
                .build();
    }

    @Override
    public ActivityTimeline evaluateCountry(String countryCode, Timescale timescale,
                                            LocalDate from, LocalDate to, boolean useMentions) {
        log.debug("Evaluating country: {}, timescale={}, from={}, to={}", countryCode, timescale, from, to);

        List<EventRecordView> events = findEvents(countryCode, from, to);
        if (events.isEmpty()) {
            throw new CountryNotFoundException(countryCode);
        }

        List<RawEventRecord> records = events.stream()
                .map(event -> new RawEventRecord(
                        event.getDatetimeOfArticle(),
                        event.getNumMentions() == null ? null : event.getNumMentions().doubleValue()))
                .toList();

        SeriesAggregator.Aggregation aggregation = seriesAggregator.aggregate(records, timescale, useMentions);
        recordDropped(aggregation);
        return evaluate(countryCode, aggregation.getSeries(), aggregation.getDroppedRecords());
    }

    @Override
    public Map<String, ActivityTimeline> evaluateCountries(List<String> countryCodes, Timescale timescale) {
        log.info("국가 일괄 평가 시작: {}개 국가", countryCodes.size());

        Map<String, CompletableFuture<ActivityTimeline>> futures = new LinkedHashMap<>();
        for (String code : countryCodes) {
            futures.put(code, CompletableFuture.supplyAsync(
                    () -> evaluateCountry(code, timescale, null, null, true), activityEvaluationExecutor));
        }

        Map<String, ActivityTimeline> results = new LinkedHashMap<>();
        futures.forEach((code, future) -> {
            try {
                results.put(code, future.join());
            } catch (Exception e) {
                log.error("국가 {} 평가 중 에러 발생", code, e);
            }
        });

        log.info("국가 일괄 평가 완료: 성공 {}개 / 요청 {}개", results.size(), countryCodes.size());
        return results;
    }

    @Override
    public List<String> getCountries() {
        return gdeltEventRepository.findDistinctCountryCodes();
    }

    @Override
    public ActivityTimelineDto evaluateRecords(EvaluateRequestDto request) {
        Timescale timescale = resolveTimescale(request.getTimescale());
        log.debug("Evaluating {} raw records, timescale={}", request.getRecords().size(), timescale);

        SeriesAggregator.Aggregation aggregation = seriesAggregator.aggregateRows(
                request.getRecords(),
                activityProperties.getRecords().getTimestampField(),
                activityProperties.getRecords().getWeightField(),
                timescale);
        recordDropped(aggregation);

        String entity = StringUtils.hasText(request.getEntity()) ? request.getEntity() : "custom";
        return convertToDto(evaluate(entity, aggregation.getSeries(), aggregation.getDroppedRecords()));
    }

    @Override
    public ActivityTimelineDto getCountryTimeline(String countryCode, String timescale,
                                                  LocalDate from, LocalDate to, boolean useMentions) {
        return convertToDto(evaluateCountry(countryCode, resolveTimescale(timescale), from, to, useMentions));
    }

    @Override
    public List<ActivityRowDto> getCountryAlerts(String countryCode, String timescale,
                                                 LocalDate from, LocalDate to, boolean useMentions) {
        ActivityTimeline timeline = evaluateCountry(countryCode, resolveTimescale(timescale), from, to, useMentions);
        return timeline.getRowsByWindow().values().stream()
                .flatMap(List::stream)
                .filter(StateRow::isAlert)
                .map(ActivityRowDto::from)
                .toList();
    }

    // === Private Helper Methods ===

    private List<EventRecordView> findEvents(String countryCode, LocalDate from, LocalDate to) {
        if (from == null && to == null) {
            return gdeltEventRepository.findEventRecords(countryCode);
        }
        LocalDateTime start = from != null ? from.atStartOfDay() : LocalDateTime.of(1900, 1, 1, 0, 0);
        // to 는 해당 날짜 포함
        LocalDateTime end = to != null ? to.plusDays(1).atStartOfDay() : LocalDateTime.of(9999, 12, 31, 0, 0);
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("'from' must not be after 'to'");
        }
        return gdeltEventRepository.findEventRecordsBetween(countryCode, start, end);
    }

    private Timescale resolveTimescale(String code) {
        return Timescale.fromCode(StringUtils.hasText(code) ? code : activityProperties.getDefaultTimescale());
    }

    private void recordDropped(SeriesAggregator.Aggregation aggregation) {
        activityMetrics.recordDroppedRecords("invalid_timestamp", aggregation.getInvalidTimestamps());
        activityMetrics.recordDroppedRecords("invalid_weight", aggregation.getInvalidWeights());
    }

    private ActivityTimelineDto convertToDto(ActivityTimeline timeline) {
        ValueSeries series = timeline.getSeries();
        Map<FitMethod, Integer> fitCounts = timeline.getThresholds().fitCounts();

        List<ActivityRowDto> rows = new ArrayList<>();
        Map<String, List<StateSegmentDto>> segments = new LinkedHashMap<>();
        Map<String, List<AlertPointDto>> alertPoints = new LinkedHashMap<>();
        timeline.getRowsByWindow().forEach((label, windowRows) -> {
            windowRows.stream().map(ActivityRowDto::from).forEach(rows::add);
            segments.put(label, stateSegmentExtractor.extract(windowRows));
            alertPoints.put(label, stateSegmentExtractor.extractAlertPoints(windowRows));
        });

        return ActivityTimelineDto.builder()
                .entity(timeline.getEntity())
                .timescale(series.getTimescale().getCode())
                .timescaleLabel(series.getTimescale().getLabel())
                .metricType(series.getMetricType().getDescription())
                .windowLabels(timeline.getRowsByWindow().keySet().stream().collect(Collectors.toList()))
                .rows(rows)
                .segments(segments)
                .alertPoints(alertPoints)
                .fitSummary(ActivityTimelineDto.FitSummary.builder()
                        .seriesLength(series.size())
                        .extremeValueFits(fitCounts.getOrDefault(FitMethod.EXTREME_VALUE, 0))
                        .quantileFits(fitCounts.getOrDefault(FitMethod.QUANTILE, 0))
                        .droppedRecords(timeline.getDroppedRecords())
                        .build())
                .build();
    }
}
