package org.be.activityservice.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

/**
 * gdelt_events 테이블의 읽기 전용 매핑 (상태 계산에 필요한 컬럼만)
 */
@Entity
@Immutable
@Table(name = "gdelt_events")
@Getter
@NoArgsConstructor
public class GdeltEvent {

    @Id
    private Long id;

    @Column(name = "globaleventid")
    private Long globalEventId;

    @Column(name = "sqldate")
    private Integer sqlDate;

    @Column(name = "actiongeocountrycode")
    private String actionGeoCountryCode;

    @Column(name = "datetime_of_article")
    private LocalDateTime datetimeOfArticle;

    @Column(name = "nummentions")
    private Integer numMentions;
}
