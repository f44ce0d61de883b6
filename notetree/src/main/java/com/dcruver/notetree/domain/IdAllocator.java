package com.dcruver.notetree.domain;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-kind monotonically increasing id counters.
 * Counters only move forward: an id is never handed out twice,
 * even after the entity holding it has been purged.
 */
public class IdAllocator {

    private final Map<EntityKind, Long> nextIds = new EnumMap<>(EntityKind.class);

    public IdAllocator() {
        for (EntityKind kind : EntityKind.values()) {
            nextIds.put(kind, 1L);
        }
    }

    /**
     * Allocate the next id for the given kind
     */
    public long nextId(EntityKind kind) {
        long id = nextIds.get(kind);
        nextIds.put(kind, id + 1);
        return id;
    }

    /**
     * Record an id that was assigned elsewhere (e.g. read back from disk)
     * so the counter never hands it out again.
     */
    public void observe(EntityKind kind, long id) {
        if (id >= nextIds.get(kind)) {
            nextIds.put(kind, id + 1);
        }
    }

    public long peek(EntityKind kind) {
        return nextIds.get(kind);
    }

    /**
     * Copy of the next id per kind, for saving
     */
    public Map<EntityKind, Long> snapshot() {
        return new EnumMap<>(nextIds);
    }

    /**
     * Move counters forward to previously saved values. Never moves a counter back.
     */
    public void restore(Map<EntityKind, Long> saved) {
        saved.forEach((kind, next) -> {
            if (kind != null && next != null && next > 1) {
                observe(kind, next - 1);
            }
        });
    }
}
