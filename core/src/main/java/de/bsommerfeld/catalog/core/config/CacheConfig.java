package de.bsommerfeld.catalog.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code [cache]} section of {@code config.toml}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CacheConfig {

    /**
     * Category ids whose descendant lists are computed at startup. Usually the
     * store roots, since those are the most expensive prefix scans.
     */
    @JsonProperty("warmup-category-ids")
    private List<Integer> warmupCategoryIds = new ArrayList<>();

    public List<Integer> getWarmupCategoryIds() {
        return warmupCategoryIds;
    }

    public void setWarmupCategoryIds(List<Integer> warmupCategoryIds) {
        this.warmupCategoryIds = warmupCategoryIds == null ? new ArrayList<>() : warmupCategoryIds;
    }
}
