package org.be.activityservice.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.be.activityservice.dto.request.EvaluateRequestDto;
import org.be.activityservice.dto.response.ActivityRowDto;
import org.be.activityservice.dto.response.ActivityTimelineDto;
import org.be.activityservice.service.activity.ActivityStateService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/v1/activity")
@RequiredArgsConstructor
public class ActivityController {

    private final ActivityStateService activityStateService;

    /**
     * 원시 레코드로 상태/알림 계산
     * POST /api/v1/activity/evaluate
     */
    @PostMapping("/evaluate")
    public ResponseEntity<ActivityTimelineDto> evaluate(@Valid @RequestBody EvaluateRequestDto request) {
        ActivityTimelineDto timeline = activityStateService.evaluateRecords(request);
        return ResponseEntity.ok(timeline);
    }

    /**
     * 이벤트가 있는 국가 코드 목록
     * GET /api/v1/activity/countries
     */
    @GetMapping("/countries")
    public ResponseEntity<List<String>> getCountries() {
        return ResponseEntity.ok(activityStateService.getCountries());
    }

    /**
     * 국가별 상태 타임라인
     * GET /api/v1/activity/countries/{code}?timescale=1D
     */
    @GetMapping("/countries/{code}")
    public ResponseEntity<ActivityTimelineDto> getCountryTimeline(
            @PathVariable String code,
            @RequestParam(required = false) String timescale,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(defaultValue = "true") boolean mentions) {

        ActivityTimelineDto timeline = activityStateService.getCountryTimeline(code, timescale, from, to, mentions);
        return ResponseEntity.ok(timeline);
    }

    /**
     * 국가별 상태 변화 알림
     * GET /api/v1/activity/countries/{code}/alerts
     */
    @GetMapping("/countries/{code}/alerts")
    public ResponseEntity<List<ActivityRowDto>> getCountryAlerts(
            @PathVariable String code,
            @RequestParam(required = false) String timescale,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(defaultValue = "true") boolean mentions) {

        List<ActivityRowDto> alerts = activityStateService.getCountryAlerts(code, timescale, from, to, mentions);
        return ResponseEntity.ok(alerts);
    }
}
