package org.be.activityservice.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluateRequestDto {

    /**
     * 결과에 붙일 대상 이름
     */
    @Builder.Default
    private String entity = "custom";

    /**
     * 집계 간격 코드 (비어 있으면 기본값)
     */
    private String timescale;

    /**
     * 원시 레코드 (타임스탬프 필드 필수, 가중치 필드 선택)
     */
    @NotNull
    private List<Map<String, Object>> records;
}
