package org.be.activityservice.repository;

import java.time.LocalDateTime;

public interface EventRecordView {

    LocalDateTime getDatetimeOfArticle();

    Integer getNumMentions();
}
