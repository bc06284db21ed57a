package com.waterwatch.engine.historian;

import com.waterwatch.engine.model.TagSample;

import java.time.Instant;
import java.util.List;

/**
 * Read-only access to the historian's raw counter samples.
 *
 * Reads are idempotent and may be retried.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
public interface HistorianClient {

    /**
     * Fetch the samples of a tag in [start, end), ordered by timestamp
     *
     * @param tagId logical tag id
     * @return the samples; empty when the tag is unknown or has no samples in the range
     * @throws HistorianUnavailableException if the historian cannot be reached or the query fails
     */
    List<TagSample> fetchSamples(String tagId, Instant start, Instant end);
}
