package com.waterwatch.engine.historian;

import com.waterwatch.engine.config.HistorianConfig;
import com.waterwatch.engine.model.TagSample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import javax.sql.DataSource;
import java.io.Closeable;
import java.io.IOException;
import java.sql.SQLTransientException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

/**
 * Historian client that reads samples over JDBC.
 *
 * The historian stores local facility time, so instants are converted to and
 * from the facility zone. Every statement runs with a query timeout and
 * connectivity failures are retried with backoff before being reported as
 * {@link HistorianUnavailableException}.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Slf4j
public class JdbcHistorianClient implements HistorianClient, Closeable {

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final HistorianConfig historianConfig;
    private final TagMapping tagMapping;
    private final ZoneId zone;

    public JdbcHistorianClient(DataSource dataSource, HistorianConfig historianConfig, TagMapping tagMapping,
                               ZoneId zone) {
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.jdbcTemplate.setQueryTimeout(historianConfig.getQueryTimeoutSeconds());
        this.historianConfig = historianConfig;
        this.tagMapping = tagMapping;
        this.zone = zone;

        log.info("Initialized historian client for {} (tag mapping version {}, {} mapped tags)",
                historianConfig.getUrl(), tagMapping.getVersion(), tagMapping.size());
    }

    @Override
    public List<TagSample> fetchSamples(String tagId, Instant start, Instant end) {
        String historianTag = tagMapping.resolve(tagId);
        log.debug("Fetching samples for {} (historian tag {}) from {} to {}", tagId, historianTag, start, end);

        try {
            List<TagSample> samples = Mono.fromCallable(() -> query(tagId, historianTag, start, end))
                    .retryWhen(Retry.backoff(historianConfig.getMaxRetries(),
                                    Duration.ofMillis(historianConfig.getRetryBackoffMillis()))
                            .filter(this::isRetryableError)
                            .doBeforeRetry(signal -> log.warn("Retrying historian read for {}, attempt {}: {}",
                                    tagId, signal.totalRetries() + 1, signal.failure().getMessage()))
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .block();
            return samples != null ? samples : List.of();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            log.error("Historian read failed for {} (historian tag {}): {}", tagId, historianTag, cause.getMessage());
            throw new HistorianUnavailableException("Historian read failed for " + tagId, cause);
        }
    }

    private List<TagSample> query(String tagId, String historianTag, Instant start, Instant end) {
        return jdbcTemplate.query(historianConfig.getSampleQuery(),
                (rs, rowNum) -> {
                    Timestamp time = rs.getTimestamp(1);
                    double value = rs.getDouble(2);
                    return TagSample.of(tagId, time.toLocalDateTime().atZone(zone).toInstant(),
                            rs.wasNull() ? Double.NaN : value);
                },
                historianTag, toLocal(start), toLocal(end));
    }

    private Timestamp toLocal(Instant instant) {
        return Timestamp.valueOf(LocalDateTime.ofInstant(instant, zone));
    }

    /**
     * Connection and timeout problems may clear up; a broken query will not
     */
    private boolean isRetryableError(Throwable throwable) {
        return throwable instanceof TransientDataAccessException
                || throwable instanceof RecoverableDataAccessException
                || throwable instanceof DataAccessResourceFailureException
                || (throwable instanceof DataAccessException && throwable.getCause() instanceof SQLTransientException);
    }

    @Override
    public void close() throws IOException {
        if (dataSource instanceof Closeable closeable) {
            closeable.close();
        }
    }
}
