package com.waterwatch.engine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * Configuration properties for the read-only historian connection.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Configuration
@ConfigurationProperties(prefix = "waterwatch.historian")
@Data
@Validated
public class HistorianConfig {

    /**
     * Default sample query for a Wonderware-style History view.
     * Parameters: tag name, start (inclusive), end (exclusive).
     */
    public static final String DEFAULT_SAMPLE_QUERY =
            "SELECT DateTime, Value FROM History"
            + " WHERE TagName = ? AND DateTime >= ? AND DateTime < ?"
            + " AND wwRetrievalMode = 'Delta' AND Value IS NOT NULL"
            + " ORDER BY DateTime";

    @NotEmpty
    private String url = "jdbc:sqlserver://localhost:1433;databaseName=Runtime;encrypt=false";

    private String username;

    private String password;

    /**
     * JDBC driver class; derived from the URL when empty
     */
    private String driverClassName;

    /**
     * Statement timeout applied to every historian query
     */
    @Min(1)
    private int queryTimeoutSeconds = 15;

    /**
     * Retries of a read after a transient connectivity failure
     */
    @Min(0)
    private int maxRetries = 2;

    @Min(1)
    private long retryBackoffMillis = 500;

    @NotEmpty
    private String sampleQuery = DEFAULT_SAMPLE_QUERY;
}
