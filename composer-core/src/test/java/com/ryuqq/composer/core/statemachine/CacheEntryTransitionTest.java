package com.ryuqq.composer.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.composer.core.statemachine.CacheEntryState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * CacheEntryTransition 테스트.
 *
 * <ul>
 *   <li>ABSENT → PENDING → READY → ABSENT 정상 흐름</li>
 *   <li>계산 실패 시 PENDING → ABSENT</li>
 *   <li>그 외 전이는 IllegalStateException</li>
 * </ul>
 *
 * @author Composer Team
 * @since 1.0.0
 */
class CacheEntryTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void transition_FullLifecycle_Succeeds() {
        // Given
        CacheEntryState state = ABSENT;

        // When
        state = CacheEntryTransition.transition(state, PENDING);
        state = CacheEntryTransition.transition(state, READY);
        state = CacheEntryTransition.transition(state, ABSENT);

        // Then
        assertEquals(ABSENT, state);
    }

    @Test
    void validate_PendingToAbsent_Succeeds() {
        assertDoesNotThrow(() -> CacheEntryTransition.validate(PENDING, ABSENT));
    }

    // ========== 잘못된 전이 테스트 ==========

    @Test
    void validate_AbsentToReady_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> CacheEntryTransition.validate(ABSENT, READY)
        );
        assertTrue(exception.getMessage().contains("ABSENT"));
        assertTrue(exception.getMessage().contains("READY"));
    }

    @Test
    void validate_ReadyToPending_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> CacheEntryTransition.validate(READY, PENDING));
    }

    @Test
    void validate_SameState_ThrowsException() {
        for (CacheEntryState state : CacheEntryState.values()) {
            assertThrows(IllegalStateException.class, () -> CacheEntryTransition.validate(state, state));
        }
    }

    @Test
    void validate_NullState_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> CacheEntryTransition.validate(null, PENDING));
        assertThrows(IllegalArgumentException.class, () -> CacheEntryTransition.validate(PENDING, null));
    }
}
