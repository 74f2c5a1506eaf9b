package com.mailattribution.volume;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailattribution.TestFixtures;
import com.mailattribution.cache.DateRange;
import com.mailattribution.config.AppProperties;
import com.mailattribution.config.JacksonConfig;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
class RedisVolumeSnapshotStoreTest {

    private static final DateRange RANGE =
            DateRange.of(LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 31));
    private static final String KEY = "attribution:volume:" + RANGE.key();

    @Mock private StringRedisTemplate redisTemplate;
    @Mock private ValueOperations<String, String> valueOperations;

    private RedisVolumeSnapshotStore store;

    @BeforeEach
    void setUp() {
        AppProperties appProperties = TestFixtures.appProperties();
        ObjectMapper objectMapper = JacksonConfig.configure(new ObjectMapper());
        store = new RedisVolumeSnapshotStore(redisTemplate, objectMapper, appProperties);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    @Test
    @DisplayName("A saved snapshot loads back with its sends, source and resolution time")
    void saveThenLoad_KeepsSnapshot() {
        // Arrange
        VolumeResult snapshot =
                VolumeResult.builder()
                        .sendsByDataSet(Map.of("M77_WIT", 600L, "GLB_HOME", 300L, "SCO_X", 100L))
                        .source(VolumeSource.CONTACT_EXPORT)
                        .exact(true)
                        .resolvedAt(Instant.parse("2026-02-01T12:00:00Z"))
                        .build();
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);

        // Act
        store.save(RANGE, snapshot);
        verify(valueOperations).set(eq(KEY), json.capture(), eq(Duration.ofHours(48)));
        when(valueOperations.get(KEY)).thenReturn(json.getValue());
        Optional<VolumeResult> loaded = store.load(RANGE);

        // Assert
        assertTrue(loaded.isPresent());
        assertEquals(snapshot, loaded.get());
        assertTrue(loaded.get().isExact());
        assertEquals(1000, loaded.get().total());
    }

    @Test
    @DisplayName("Missing or unreadable snapshots load as empty")
    void load_MissingOrUnreadable() {
        when(valueOperations.get(KEY)).thenReturn(null, "{not json");

        assertTrue(store.load(RANGE).isEmpty());
        assertTrue(store.load(RANGE).isEmpty());
    }

    @Test
    @DisplayName("Redis failures are logged, not thrown")
    void saveAndLoad_RedisDown() {
        doThrow(new QueryTimeoutException("timeout"))
                .when(valueOperations)
                .set(anyString(), anyString(), any(Duration.class));
        when(valueOperations.get(KEY)).thenThrow(new QueryTimeoutException("timeout"));

        assertDoesNotThrow(() -> store.save(RANGE, VolumeResult.empty()));
        assertTrue(store.load(RANGE).isEmpty());
    }
}
