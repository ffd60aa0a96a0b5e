package com.ryuqq.composer.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ModuleDescriptor 테스트.
 *
 * @author Composer Team
 * @since 1.0.0
 */
class ModuleDescriptorTest {

    @Test
    void of_AppliesDefaults() {
        // When
        ModuleDescriptor descriptor = ModuleDescriptor.of("context");

        // Then
        assertEquals(ModuleId.of("context"), descriptor.id());
        assertEquals(ModuleDescriptor.DEFAULT_PRIORITY, descriptor.priority());
        assertTrue(descriptor.dependencies().isEmpty());
        assertTrue(descriptor.producedKeys().isEmpty());
        assertTrue(descriptor.consumedKeys().isEmpty());
        assertFalse(descriptor.required());
        assertEquals(0, descriptor.timeoutMs());
    }

    @Test
    void builderMethods_ReturnUpdatedCopies() {
        // Given
        ModuleDescriptor base = ModuleDescriptor.of("essentie");

        // When
        ModuleDescriptor updated = base.withPriority(90)
            .dependsOn("context", "base")
            .produces("essence")
            .consumes("context.domain")
            .withRequired(true)
            .withTimeoutMs(250);

        // Then
        assertEquals(ModuleDescriptor.DEFAULT_PRIORITY, base.priority());
        assertTrue(base.dependencies().isEmpty());
        assertEquals(90, updated.priority());
        assertEquals(List.of(ModuleId.of("base"), ModuleId.of("context")), List.copyOf(updated.dependencies()));
        assertTrue(updated.producesKey(StateKey.of("essence")));
        assertTrue(updated.consumesKey(StateKey.of("context.domain")));
        assertFalse(updated.consumesKey(StateKey.of("essence")));
        assertTrue(updated.required());
        assertEquals(250, updated.timeoutMs());
    }

    @Test
    void sets_AreImmutable() {
        ModuleDescriptor descriptor = ModuleDescriptor.of("context").produces("context.domain");

        assertThrows(UnsupportedOperationException.class,
            () -> descriptor.producedKeys().add(StateKey.of("other")));
    }

    @Test
    void constructor_NullId_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new ModuleDescriptor(null, 50, Set.of(), Set.of(), Set.of(), false, 0));
    }

    @Test
    void constructor_NegativeTimeout_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> ModuleDescriptor.of("context").withTimeoutMs(-1));
    }

    @Test
    void equals_SameDeclarationsInDifferentOrder_AreEqual() {
        ModuleDescriptor first = ModuleDescriptor.of("m").dependsOn("a", "b");
        ModuleDescriptor second = ModuleDescriptor.of("m").dependsOn("b", "a");

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void restrictTo_DropsDependenciesOutsideSelection() {
        // Given
        ModuleDescriptor descriptor = ModuleDescriptor.of("structure").dependsOn("context", "essentie");

        // When
        ModuleDescriptor restricted = descriptor.restrictTo(Set.of(ModuleId.of("structure"), ModuleId.of("context")));

        // Then
        assertEquals(Set.of(ModuleId.of("context")), restricted.dependencies());
    }

    @Test
    void restrictTo_AllDependenciesSelected_ReturnsSameInstance() {
        ModuleDescriptor descriptor = ModuleDescriptor.of("structure").dependsOn("context");

        assertSame(descriptor, descriptor.restrictTo(Set.of(ModuleId.of("context"), ModuleId.of("structure"))));
    }
}
