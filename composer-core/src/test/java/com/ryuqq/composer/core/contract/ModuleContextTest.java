package com.ryuqq.composer.core.contract;

import com.ryuqq.composer.core.exception.UndeclaredKeyAccessException;
import com.ryuqq.composer.core.model.ModuleDescriptor;
import com.ryuqq.composer.core.model.ModuleId;
import com.ryuqq.composer.core.model.StateKey;
import com.ryuqq.composer.core.state.SharedStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ModuleContext 테스트.
 *
 * @author Composer Team
 * @since 1.0.0
 */
class ModuleContextTest {

    private SharedStateStore sharedState;
    private ModuleContext context;

    @BeforeEach
    void setUp() {
        sharedState = new SharedStateStore();
        sharedState.set(StateKey.of("context.domain"), "zorg");
        sharedState.set(StateKey.of("essence"), "kern");
        ModuleDescriptor descriptor = ModuleDescriptor.of("structure").consumes("context.domain");
        context = new ModuleContext("run-1", descriptor, sharedState, Map.of("term", "verzekerde"));
    }

    @Test
    void get_DeclaredKey_ReturnsValue() {
        assertEquals("zorg", context.get("context.domain", String.class).orElseThrow());
    }

    @Test
    void get_WriteAfterConstruction_NotVisible() {
        // Given
        ModuleDescriptor descriptor = ModuleDescriptor.of("reader").consumes("category", "context.domain");
        ModuleContext early = new ModuleContext("run-1", descriptor, sharedState, Map.of());

        // When
        sharedState.set(StateKey.of("category"), "proces");
        sharedState.set(StateKey.of("context.domain"), "pensioen");

        // Then
        assertTrue(early.get("category").isEmpty());
        assertEquals("zorg", early.get("context.domain", String.class).orElseThrow());
    }

    @Test
    void constructor_StateSnapshot_ReadsFromGivenMap() {
        // Given
        Map<StateKey, Object> state = Map.of(StateKey.of("context.domain"), "wonen");

        // When
        ModuleContext fromSnapshot = new ModuleContext(
            "run-2", ModuleDescriptor.of("structure").consumes("context.domain"), state, Map.of());

        // Then
        assertEquals("wonen", fromSnapshot.get("context.domain", String.class).orElseThrow());
    }

    @Test
    void get_UndeclaredKey_ThrowsException() {
        // When
        UndeclaredKeyAccessException exception = assertThrows(
            UndeclaredKeyAccessException.class,
            () -> context.get("essence")
        );

        // Then
        assertEquals(StateKey.of("essence"), exception.key());
    }

    @Test
    void input_ReturnsInitialContextValue() {
        assertEquals("verzekerde", context.input("term", String.class).orElseThrow());
        assertTrue(context.input("missing").isEmpty());
        assertTrue(context.input("term", Integer.class).isEmpty());
    }

    @Test
    void accessors_ExposeRunAndModule() {
        assertEquals("run-1", context.runId());
        assertEquals(ModuleId.of("structure"), context.moduleId());
    }

    @Test
    void constructor_BlankRunId_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new ModuleContext(" ", ModuleDescriptor.of("m"), sharedState, Map.of()));
    }
}
