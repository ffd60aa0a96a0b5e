package com.ryuqq.composer.core.state;

import com.ryuqq.composer.core.model.StateKey;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SharedStateStore 테스트.
 *
 * @author Composer Team
 * @since 1.0.0
 */
class SharedStateStoreTest {

    private final SharedStateStore store = new SharedStateStore();

    @Test
    void set_ThenGet_ReturnsValue() {
        // When
        store.set(StateKey.of("context.domain"), "onderwijs");

        // Then
        assertEquals("onderwijs", store.get(StateKey.of("context.domain")).orElseThrow());
        assertTrue(store.contains(StateKey.of("context.domain")));
        assertEquals(1, store.size());
    }

    @Test
    void get_MissingKey_ReturnsEmpty() {
        assertTrue(store.get(StateKey.of("absent")).isEmpty());
    }

    @Test
    void get_WithType_FiltersMismatchedType() {
        store.set(StateKey.of("count"), 3);

        assertEquals(3, store.get(StateKey.of("count"), Integer.class).orElseThrow());
        assertTrue(store.get(StateKey.of("count"), String.class).isEmpty());
    }

    @Test
    void set_NullValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> store.set(StateKey.of("k"), null));
    }

    @Test
    void snapshot_PreservesInsertionOrderAndIsDetached() {
        // Given
        store.set(StateKey.of("b"), 2);
        store.set(StateKey.of("a"), 1);

        // When
        Map<StateKey, Object> snapshot = store.snapshot();
        store.set(StateKey.of("c"), 3);

        // Then
        assertEquals(List.of(StateKey.of("b"), StateKey.of("a")), List.copyOf(snapshot.keySet()));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put(StateKey.of("x"), 0));
    }
}
