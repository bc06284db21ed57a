package com.waterwatch.engine.historian;

import java.util.Map;

/**
 * Immutable mapping from logical tag ids to the tag names stored in the historian.
 *
 * Built once at startup. A tag without an entry is looked up under its own id.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
public final class TagMapping {

    private final String version;
    private final Map<String, String> historianTags;

    public TagMapping(String version, Map<String, String> historianTags) {
        this.version = version;
        this.historianTags = Map.copyOf(historianTags);
    }

    public static TagMapping identity(String version) {
        return new TagMapping(version, Map.of());
    }

    /**
     * @return historian tag name for a logical tag id
     */
    public String resolve(String tagId) {
        return historianTags.getOrDefault(tagId, tagId);
    }

    public String getVersion() {
        return version;
    }

    public Map<String, String> getHistorianTags() {
        return historianTags;
    }

    public int size() {
        return historianTags.size();
    }
}
