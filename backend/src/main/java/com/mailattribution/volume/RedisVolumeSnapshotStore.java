package com.mailattribution.volume;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailattribution.cache.DateRange;
import com.mailattribution.config.AppProperties;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/** Stores volume snapshots as JSON strings under {@code <prefix><from>|<to>}. */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisVolumeSnapshotStore implements VolumeSnapshotStore {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;

    @Override
    public void save(DateRange range, VolumeResult result) {
        String key = keyFor(range);
        try {
            String json = objectMapper.writeValueAsString(result);
            // Kept twice the exact TTL; freshness is checked on load
            redisTemplate
                    .opsForValue()
                    .set(key, json, appProperties.getVolume().getExactTtl().multipliedBy(2));
            log.info("Saved volume snapshot {} ({} data sets)", key, result.size());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize volume snapshot {}: {}", key, e.getMessage());
        } catch (DataAccessException e) {
            log.warn("Failed to save volume snapshot {}: {}", key, e.getMessage());
        }
    }

    @Override
    public Optional<VolumeResult> load(DateRange range) {
        String key = keyFor(range);
        try {
            String json = redisTemplate.opsForValue().get(key);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, VolumeResult.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable volume snapshot {}: {}", key, e.getMessage());
            return Optional.empty();
        } catch (DataAccessException e) {
            log.warn("Failed to load volume snapshot {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    String keyFor(DateRange range) {
        return appProperties.getVolume().getSnapshotKeyPrefix() + range.key();
    }
}
