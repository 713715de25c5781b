package me.golemcore.memory.domain.service;

import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MemoryEngineRegistryTest {

    private OwnerContextFactory factory;
    private MemoryEngineRegistry registry;

    @BeforeEach
    void setUp() {
        factory = mock(OwnerContextFactory.class);
        registry = new MemoryEngineRegistry(factory, new MemoryProperties());
    }

    @Test
    void shouldRejectBlankOwnerId() {
        assertThrows(IllegalArgumentException.class, () -> registry.get(null));
        assertThrows(IllegalArgumentException.class, () -> registry.get("  "));
    }

    @Test
    void shouldCreateContextOncePerOwner() {
        OwnerMemoryContext alice = mock(OwnerMemoryContext.class);
        when(factory.create("alice")).thenReturn(alice);

        assertFalse(registry.isOpen("alice"));
        assertSame(alice, registry.get("alice"));
        assertSame(alice, registry.get("alice"));

        verify(factory, times(1)).create("alice");
        assertTrue(registry.isOpen("alice"));
        assertEquals(List.of("alice"), registry.ownerIds());
    }

    @Test
    void shouldKeepFlushingOtherOwnersWhenOneFails() {
        OwnerMemoryContext alice = mock(OwnerMemoryContext.class);
        OwnerMemoryContext bob = mock(OwnerMemoryContext.class);
        when(factory.create("alice")).thenReturn(alice);
        when(factory.create("bob")).thenReturn(bob);
        doThrow(new IllegalStateException("disk full")).when(alice).flushDue();
        doThrow(new IllegalStateException("disk full")).when(bob).flushDue();
        registry.get("alice");
        registry.get("bob");

        registry.flushDue();

        verify(alice).flushDue();
        verify(bob).flushDue();
    }

    @Test
    void shouldFlushEverythingOnShutdown() {
        OwnerMemoryContext alice = mock(OwnerMemoryContext.class);
        when(factory.create("alice")).thenReturn(alice);
        registry.init();
        registry.get("alice");

        registry.shutdown();

        verify(alice).flushAll();
    }
}
