package com.waterwatch.engine.config;

import com.waterwatch.engine.historian.HistorianClient;
import com.waterwatch.engine.historian.JdbcHistorianClient;
import com.waterwatch.engine.historian.TagMapping;
import com.waterwatch.engine.notification.LoggingSmsTransport;
import com.waterwatch.engine.notification.SmsTransport;
import com.waterwatch.engine.notification.TwilioSmsTransport;
import com.waterwatch.engine.shift.ShiftCalculator;
import com.waterwatch.engine.shift.ShiftDefinition;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wiring for the engine's collaborators.
 *
 * This configuration provides:
 * - the clock, shift calculator and configuration snapshot
 * - the historian client with its own connection pool
 * - the SMS transport and the WebClient it uses
 * - the rule evaluation and SMS dispatch pools
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Configuration
@Slf4j
public class EngineBeans {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ShiftCalculator shiftCalculator(FacilityConfig facilityConfig) {
        List<ShiftDefinition> shifts = facilityConfig.getShifts().stream()
                .map(shift -> new ShiftDefinition(shift.getName(), LocalTime.parse(shift.getStart())))
                .toList();
        ShiftCalculator calculator = new ShiftCalculator(ZoneId.of(facilityConfig.getTimezone()), shifts,
                LocalTime.parse(facilityConfig.getDayStart()));
        log.info("Shift calculator initialized for {} with shifts {} and day start {}",
                calculator.getZone(), calculator.getShifts(), facilityConfig.getDayStart());
        return calculator;
    }

    @Bean
    public SnapshotHolder snapshotHolder(SnapshotFactory snapshotFactory, FacilityConfig facilityConfig, Clock clock) {
        return new SnapshotHolder(snapshotFactory.build(facilityConfig, 1, clock.instant()), clock);
    }

    /**
     * Logical tag id to historian tag name, fixed for the life of the process
     */
    @Bean
    public TagMapping tagMapping(FacilityConfig facilityConfig) {
        Map<String, String> historianTags = new HashMap<>();
        for (FacilityConfig.TagConfig tag : facilityConfig.getTags()) {
            if (tag.getHistorianTag() != null && !tag.getHistorianTag().isBlank()) {
                historianTags.put(tag.getId(), tag.getHistorianTag().trim());
            }
        }
        return new TagMapping(facilityConfig.getTagMappingVersion(), historianTags);
    }

    /**
     * Historian client with a dedicated pool. The pool is not exposed as a
     * DataSource bean so it never replaces the record store's DataSource.
     */
    @Bean
    @ConditionalOnMissingBean(HistorianClient.class)
    public JdbcHistorianClient historianClient(HistorianConfig historianConfig, TagMapping tagMapping,
                                               ShiftCalculator shiftCalculator) {
        DataSourceBuilder<?> builder = DataSourceBuilder.create()
                .url(historianConfig.getUrl())
                .username(historianConfig.getUsername())
                .password(historianConfig.getPassword());
        if (historianConfig.getDriverClassName() != null && !historianConfig.getDriverClassName().isBlank()) {
            builder.driverClassName(historianConfig.getDriverClassName());
        }
        DataSource dataSource = builder.build();
        return new JdbcHistorianClient(dataSource, historianConfig, tagMapping, shiftCalculator.getZone());
    }

    /**
     * Create a WebClient configured for calling the SMS provider
     */
    @Bean
    public WebClient webClient(SmsConfig smsConfig) {
        log.info("Configuring WebClient with timeouts: connect={}s, response={}s",
                smsConfig.getConnectTimeoutSeconds(), smsConfig.getTimeoutSeconds());

        ConnectionProvider connectionProvider = ConnectionProvider.builder("waterwatch-sms")
                .maxConnections(10)
                .maxIdleTime(Duration.ofSeconds(30))
                .pendingAcquireTimeout(Duration.ofSeconds(30))
                .build();

        HttpClient httpClient = HttpClient.create(connectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, smsConfig.getConnectTimeoutSeconds() * 1000)
                .responseTimeout(Duration.ofSeconds(smsConfig.getTimeoutSeconds()));

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Bean
    @ConditionalOnMissingBean(SmsTransport.class)
    public SmsTransport smsTransport(WebClient webClient, SmsConfig smsConfig) {
        if (!smsConfig.hasCredentials()) {
            log.warn("SMS provider credentials not configured; messages will only be logged");
            return new LoggingSmsTransport();
        }
        return new TwilioSmsTransport(webClient, smsConfig);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService evaluationExecutor(EngineConfig engineConfig) {
        return Executors.newFixedThreadPool(engineConfig.getWorkerThreads(), namedThreads("waterwatch-eval-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService dispatchExecutor(EngineConfig engineConfig) {
        return Executors.newFixedThreadPool(engineConfig.getDispatchThreads(), namedThreads("waterwatch-sms-"));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
