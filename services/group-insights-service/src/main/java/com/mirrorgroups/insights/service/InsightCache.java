package com.mirrorgroups.insights.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mirrorgroups.insights.config.GroupInsightsProperties;
import com.mirrorgroups.insights.model.insight.GroupAnalysisResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Redis cache of complete analysis results, one JSON entry per group.
 *
 * <p>The cache is an optimization only. Redis or serialization errors are logged and
 * reported as a miss; they never fail an analysis.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InsightCache {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final GroupInsightsProperties properties;
    private final Clock clock;

    /**
     * @return the cached result if one exists and is younger than the configured TTL
     */
    public Optional<GroupAnalysisResult> get(String groupId) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(key(groupId));
        } catch (RuntimeException e) {
            log.warn("Cache read failed for group {}: {}", groupId, e.getMessage());
            return Optional.empty();
        }
        if (json == null) {
            return Optional.empty();
        }

        try {
            GroupAnalysisResult result = objectMapper.readValue(json, GroupAnalysisResult.class);
            if (isExpired(result)) {
                log.debug("Cached analysis for group {} is stale", groupId);
                return Optional.empty();
            }
            return Optional.of(result);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry for group {}: {}", groupId, e.getOriginalMessage());
            evict(groupId);
            return Optional.empty();
        }
    }

    public void put(GroupAnalysisResult result) {
        try {
            String json = objectMapper.writeValueAsString(result);
            redisTemplate.opsForValue().set(key(result.getGroupId()), json, ttl());
            log.debug("Cached analysis {} for group {}", result.getAnalysisId(), result.getGroupId());
        } catch (JsonProcessingException e) {
            log.error("Could not serialize analysis for group {}", result.getGroupId(), e);
        } catch (RuntimeException e) {
            log.warn("Cache write failed for group {}: {}", result.getGroupId(), e.getMessage());
        }
    }

    public void evict(String groupId) {
        try {
            redisTemplate.delete(key(groupId));
        } catch (RuntimeException e) {
            log.warn("Cache eviction failed for group {}: {}", groupId, e.getMessage());
        }
    }

    /**
     * Deletes every entry whose key matches the glob pattern, relative to the cache prefix.
     *
     * @return number of keys removed
     */
    public long evictByPattern(String pattern) {
        try {
            Set<String> keys = redisTemplate.keys(properties.getAnalysis().getCacheKeyPrefix() + pattern);
            if (keys == null || keys.isEmpty()) {
                return 0;
            }
            Long deleted = redisTemplate.delete(keys);
            log.info("Evicted {} cached analyses matching {}", deleted, pattern);
            return deleted == null ? 0 : deleted;
        } catch (RuntimeException e) {
            log.warn("Cache eviction failed for pattern {}: {}", pattern, e.getMessage());
            return 0;
        }
    }

    String key(String groupId) {
        return properties.getAnalysis().getCacheKeyPrefix() + groupId;
    }

    private Duration ttl() {
        return properties.getAnalysis().getCacheTtl();
    }

    private boolean isExpired(GroupAnalysisResult result) {
        if (result.getTimestamp() == null) {
            return true;
        }
        Instant cutoff = Instant.now(clock).minus(ttl());
        return !result.getTimestamp().isAfter(cutoff);
    }
}
