package me.golemcore.scout.adapter.outbound.store;

import me.golemcore.scout.domain.exception.BackendUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisCounterStoreTest {

    private static final String KEY = "rate:concurrent:acme";

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOps;
    private RedisCounterStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        store = new RedisCounterStore(redisTemplate);
    }

    @Test
    void shouldIncrementAtomically() {
        when(valueOps.increment(KEY)).thenReturn(3L);

        assertEquals(3, store.increment(KEY));
    }

    @Test
    void shouldDeleteKeyWhenDecrementReachesZero() {
        when(valueOps.decrement(KEY)).thenReturn(0L);

        assertEquals(0, store.decrement(KEY));
        verify(redisTemplate).delete(KEY);
    }

    @Test
    void shouldKeepKeyWhenDecrementStaysPositive() {
        when(valueOps.decrement(KEY)).thenReturn(2L);

        assertEquals(2, store.decrement(KEY));
        verify(redisTemplate, never()).delete(KEY);
    }

    @Test
    void shouldReturnEmptyForMissingKey() {
        when(valueOps.get(KEY)).thenReturn(null);

        assertFalse(store.get(KEY).isPresent());
    }

    @Test
    void shouldParseStoredValue() {
        when(valueOps.get(KEY)).thenReturn("7");

        assertEquals(7, store.get(KEY).getAsLong());
    }

    @Test
    void shouldSetExpiry() {
        store.expire(KEY, Duration.ofHours(1));

        verify(redisTemplate).expire(KEY, Duration.ofHours(1));
    }

    @Test
    void shouldFailDistinctlyWhenRedisIsDown() {
        when(valueOps.increment(KEY)).thenThrow(new RedisConnectionFailureException("refused"));

        assertThrows(BackendUnavailableException.class, () -> store.increment(KEY));
    }

    @Test
    void shouldFailWhenIncrementReturnsNothing() {
        when(valueOps.increment(KEY)).thenReturn(null);

        assertThrows(BackendUnavailableException.class, () -> store.increment(KEY));
    }

    @Test
    void shouldFailOnNonNumericValue() {
        when(valueOps.get(KEY)).thenReturn("oops");

        assertThrows(BackendUnavailableException.class, () -> store.get(KEY));
    }
}
