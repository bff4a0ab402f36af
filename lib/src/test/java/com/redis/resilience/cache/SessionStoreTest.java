package com.redis.resilience.cache;

import com.redis.resilience.operations.RedisOperations;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Tests for SessionStore JSON handling.
 */
@ExtendWith(MockitoExtension.class)
class SessionStoreTest {

    @Mock
    private RedisOperations operations;

    private SessionStore sessionStore;

    @BeforeEach
    void setUp() {
        sessionStore = new SessionStore(operations);
    }

    @Test
    void testStoreWritesJsonWithTtl() {
        when(operations.set(eq("session:s1"), anyString(), eq(Duration.ofSeconds(60)))).thenReturn(true);

        assertTrue(sessionStore.storeSession("s1", Map.of("user_id", 42), 60));

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(operations).set(eq("session:s1"), payload.capture(), eq(Duration.ofSeconds(60)));
        assertEquals("{\"user_id\":42}", payload.getValue());
    }

    @Test
    void testStoreWithoutTtl() {
        when(operations.set(eq("session:s1"), anyString(), isNull())).thenReturn(true);

        assertTrue(sessionStore.storeSession("s1", Map.of("user_id", 42), 0));
    }

    @Test
    void testGetReadsJsonObject() {
        when(operations.get("session:s1"))
            .thenReturn(Optional.of("{\"user_id\":42,\"roles\":[\"admin\"],\"active\":true}"));

        Map<String, Object> session = sessionStore.getSession("s1").orElseThrow();

        assertEquals(42, session.get("user_id"));
        assertEquals(List.of("admin"), session.get("roles"));
        assertEquals(true, session.get("active"));
    }

    @Test
    void testGetMissingSession() {
        when(operations.get("session:missing")).thenReturn(Optional.empty());

        assertTrue(sessionStore.getSession("missing").isEmpty());
    }

    @Test
    void testGetRejectsNonObjectPayload() {
        when(operations.get("session:s1")).thenReturn(Optional.of("[1,2,3]"));
        assertThrows(SessionSerializationException.class, () -> sessionStore.getSession("s1"));

        when(operations.get("session:s2")).thenReturn(Optional.of("not json"));
        assertThrows(SessionSerializationException.class, () -> sessionStore.getSession("s2"));

        when(operations.get("session:s3")).thenReturn(Optional.of("null"));
        assertThrows(SessionSerializationException.class, () -> sessionStore.getSession("s3"));
    }

    @Test
    void testStoreRejectsUnserializablePayload() {
        Map<String, Object> data = Map.of("stream", new Object());

        assertThrows(SessionSerializationException.class, () -> sessionStore.storeSession("s1", data, 60));
        verifyNoInteractions(operations);
    }

    @Test
    void testDelete() {
        when(operations.delete("session:s1")).thenReturn(1L);
        when(operations.delete("session:s2")).thenReturn(0L);

        assertTrue(sessionStore.deleteSession("s1"));
        assertFalse(sessionStore.deleteSession("s2"));
    }

    @Test
    void testBlankSessionIdIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> sessionStore.getSession(" "));
        assertThrows(IllegalArgumentException.class, () -> sessionStore.deleteSession(null));
    }
}
