package org.be.activityservice.repository;

import org.be.activityservice.entity.GdeltEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface GdeltEventRepository extends JpaRepository<GdeltEvent, Long> {

    /**
     * 이벤트가 있는 국가 코드 목록
     */
    @Query("""
        SELECT DISTINCT e.actionGeoCountryCode
        FROM GdeltEvent e
        WHERE e.actionGeoCountryCode IS NOT NULL
        ORDER BY e.actionGeoCountryCode
        """)
    List<String> findDistinctCountryCodes();

    /**
     * 국가별 이벤트 레코드 (기사 시각, 멘션 수)
     */
    @Query("""
        SELECT e.datetimeOfArticle AS datetimeOfArticle,
               e.numMentions AS numMentions
        FROM GdeltEvent e
        WHERE e.actionGeoCountryCode = :country
          AND e.datetimeOfArticle IS NOT NULL
        """)
    List<EventRecordView> findEventRecords(@Param("country") String country);

    /**
     * 기간 내 국가별 이벤트 레코드
     */
    @Query("""
        SELECT e.datetimeOfArticle AS datetimeOfArticle,
               e.numMentions AS numMentions
        FROM GdeltEvent e
        WHERE e.actionGeoCountryCode = :country
          AND e.datetimeOfArticle >= :startDate
          AND e.datetimeOfArticle < :endDate
        """)
    List<EventRecordView> findEventRecordsBetween(
            @Param("country") String country,
            @Param("startDate") LocalDateTime startDate,
            @Param("endDate") LocalDateTime endDate);
}
