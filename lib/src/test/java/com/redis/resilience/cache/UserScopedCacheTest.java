package com.redis.resilience.cache;

import com.redis.resilience.operations.RedisOperations;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests for UserScopedCache key namespacing.
 */
@ExtendWith(MockitoExtension.class)
class UserScopedCacheTest {

    @Mock
    private RedisOperations operations;

    private UserScopedCache userCache;

    @BeforeEach
    void setUp() {
        userCache = new UserScopedCache(operations);
    }

    @Test
    void testSetUsesUserNamespace() {
        when(operations.set("user:u1:profile", "v1", Duration.ofMinutes(5))).thenReturn(true);

        assertTrue(userCache.setUserCache("u1", "profile", "v1", Duration.ofMinutes(5)));
    }

    @Test
    void testSetWithoutTtl() {
        when(operations.set("user:u1:k", "v", null)).thenReturn(true);

        assertTrue(userCache.setUserCache("u1", "k", "v", null));
    }

    @Test
    void testGetAndClear() {
        when(operations.get("user:u2:k")).thenReturn(Optional.of("v2"));
        when(operations.delete("user:u2:k")).thenReturn(1L);

        assertEquals(Optional.of("v2"), userCache.getUserCache("u2", "k"));
        assertTrue(userCache.clearUserCache("u2", "k"));
    }

    @Test
    void testClearMissingKey() {
        when(operations.delete("user:u1:missing")).thenReturn(0L);

        assertFalse(userCache.clearUserCache("u1", "missing"));
    }

    @Test
    void testGetUserKeysStripsNamespace() {
        when(operations.keys("user:u1:*")).thenReturn(List.of("user:u1:b", "user:u1:a"));

        assertEquals(List.of("a", "b"), userCache.getUserKeys("u1"));
    }

    @Test
    void testGetUserKeysEscapesPatternCharacters() {
        when(operations.keys("user:team\\*:*")).thenReturn(List.of());

        assertTrue(userCache.getUserKeys("team*").isEmpty());
        verify(operations).keys("user:team\\*:*");
    }

    @Test
    void testBlankIdentifiersAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> userCache.setUserCache("", "k", "v", null));
        assertThrows(IllegalArgumentException.class, () -> userCache.getUserCache("u1", " "));
        assertThrows(IllegalArgumentException.class, () -> userCache.clearUserCache(null, "k"));
        assertThrows(IllegalArgumentException.class, () -> userCache.getUserKeys(""));
        verify(operations, never()).set(anyString(), anyString(), any());
    }
}
