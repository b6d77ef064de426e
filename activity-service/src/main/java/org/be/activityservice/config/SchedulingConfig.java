package org.be.activityservice.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Slf4j
@Configuration
@EnableScheduling
@RequiredArgsConstructor
public class SchedulingConfig {

    private final ActivityProperties activityProperties;

    /**
     * 국가별 병렬 평가용 실행기
     */
    @Bean
    public ThreadPoolTaskExecutor activityEvaluationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(activityProperties.getExecutor().getPoolSize());
        executor.setMaxPoolSize(activityProperties.getExecutor().getPoolSize());
        executor.setThreadNamePrefix(activityProperties.getExecutor().getThreadNamePrefix());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        log.info("평가 실행기 생성: poolSize={}", activityProperties.getExecutor().getPoolSize());
        return executor;
    }
}
