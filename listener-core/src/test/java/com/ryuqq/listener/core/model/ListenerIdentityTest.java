package com.ryuqq.listener.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ListenerIdentity 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ListenerIdentityTest {

    @Test
    void generate_CreatesSixHexCharacterId() {
        // When
        ListenerIdentity identity = ListenerIdentity.generate("orders-group", "orders");

        // Then
        assertTrue(identity.listenerId().matches("^[0-9a-f]{6}$"), identity.listenerId());
        assertEquals("orders-group", identity.groupId());
        assertEquals("orders", identity.topic());
    }

    @Test
    void generate_ProducesDistinctIds() {
        // Given
        Set<String> ids = new HashSet<>();

        // When
        for (int i = 0; i < 50; i++) {
            ids.add(ListenerIdentity.generate("g", "t").listenerId());
        }

        // Then: 3바이트 랜덤이므로 50개 중 충돌은 사실상 없음
        assertTrue(ids.size() > 45);
    }

    @Test
    void asMetadata_ContainsCorrelationFieldsInOrder() {
        // Given
        ListenerIdentity identity = new ListenerIdentity("abc123", "group", "topic");

        // When
        Map<String, Object> metadata = identity.asMetadata();

        // Then
        assertEquals(List.of("listener_id", "group_id", "topic"), List.copyOf(metadata.keySet()));
        assertEquals("abc123", metadata.get("listener_id"));
        assertEquals("group", metadata.get("group_id"));
        assertEquals("topic", metadata.get("topic"));
    }

    @Test
    void asMetadata_ReturnsFreshMutableMap() {
        // Given
        ListenerIdentity identity = new ListenerIdentity("abc123", "group", "topic");

        // When
        identity.asMetadata().put("extra", 1);

        // Then
        assertFalse(identity.asMetadata().containsKey("extra"));
    }

    @Test
    void constructor_BlankGroupId_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new ListenerIdentity("abc123", " ", "topic")
        );
        assertTrue(exception.getMessage().contains("groupId cannot be null or blank"));
    }

    @Test
    void generate_NullTopic_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ListenerIdentity.generate("group", null)
        );
        assertTrue(exception.getMessage().contains("topic cannot be null or blank"));
    }
}
