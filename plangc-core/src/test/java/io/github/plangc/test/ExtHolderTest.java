package io.github.plangc.test;

import io.github.plangc.core.ext.Ext;
import io.github.plangc.core.ext.ExtHolder;
import io.github.plangc.core.passes.InPlaceIRPass;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class ExtHolderTest {
    static final Ext<String> NAME = Ext.create(String.class, "NAME");
    static final Ext<Integer> COUNT = Ext.create(Integer.class, "COUNT");

    @Test
    void testAttachAndRemove() {
        ExtHolder holder = new ExtHolder();
        assertNull(holder.getNullable(NAME));
        assertFalse(holder.hasExt(NAME));
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> holder.getExtOrThrow(NAME));
        assertTrue(e.getMessage().contains("NAME"));
        assertEquals(7, (int) holder.getExtOr(COUNT, 7));

        holder.attachExt(NAME, "x");
        holder.attachExt(COUNT, 1);
        assertEquals("x", holder.getExtOrThrow(NAME));
        assertTrue(holder.hasExt(COUNT));

        holder.removeExt(NAME);
        assertNull(holder.getNullable(NAME));
        assertEquals(1, (int) holder.getExtOrThrow(COUNT));
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    void testAttachChecksValues() {
        ExtHolder holder = new ExtHolder();
        assertThrows(IllegalArgumentException.class, () -> holder.attachExt(NAME, null));

        Ext raw = Ext.<List, List<String>>create(List.class, "NAMES");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> holder.attachExt(raw, "not a list"));
        assertTrue(e.getMessage().contains("NAMES"));
        assertFalse(holder.hasExt(raw));
    }

    @Test
    void testGetOrRun() {
        ExtHolder holder = new ExtHolder();
        AtomicInteger runs = new AtomicInteger();
        InPlaceIRPass<ExtHolder> compute = h -> {
            runs.incrementAndGet();
            h.attachExt(NAME, "computed");
        };
        assertEquals("computed", holder.getExtOrRun(NAME, holder, compute));
        assertEquals("computed", holder.getExtOrRun(NAME, holder, compute));
        assertEquals(1, runs.get());
    }
}
