// DatabaseConfig.java - 이벤트 테이블 읽기 전용 JPA 설정
package org.be.activityservice.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@Configuration
@EnableJpaRepositories(basePackages = "org.be.activityservice.repository")
public class DatabaseConfig {
    // 스키마는 외부에서 관리 (ddl-auto: none)
}
