package org.csits.reportd.server.config;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.extern.slf4j.Slf4j;
import org.csits.reportd.dao.serializer.ReportJson;
import org.csits.reportd.server.service.Sleeper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * 引擎的基础 Bean：时钟、HTTP 客户端、执行线程。
 */
@Slf4j
@Configuration
public class ServerBeansConfig {

    @Bean
    public Clock reportdClock(@Value("${reportd.scheduler.time-zone:}") String timeZone) {
        Clock clock = Clock.system(ReportJson.zoneOf(timeZone));
        log.info("调度时区: {}", clock.getZone());
        return clock;
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public RestTemplate reportdRestTemplate(
        @Value("${reportd.http.connect-timeout-seconds:30}") long connectTimeoutSeconds,
        @Value("${reportd.http.read-timeout-seconds:120}") long readTimeoutSeconds) {
        return new RestTemplateBuilder()
            .setConnectTimeout(Duration.ofSeconds(connectTimeoutSeconds))
            .setReadTimeout(Duration.ofSeconds(readTimeoutSeconds))
            .build();
    }

    /**
     * 单线程执行器：并发的执行请求排队，不会交错。
     */
    @Bean(name = "sweepExecutor", destroyMethod = "shutdown")
    public ExecutorService sweepExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "reportd-sweep");
            t.setDaemon(true);
            return t;
        });
    }
}
