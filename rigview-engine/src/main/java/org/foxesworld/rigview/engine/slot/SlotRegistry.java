package org.foxesworld.rigview.engine.slot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * The 25 grid slot records plus the single-view slot. No I/O; updates are atomic swaps of
 * immutable {@link SlotState} records.
 */
public final class SlotRegistry {

    private final ConcurrentHashMap<SlotId, SlotState> slots = new ConcurrentHashMap<>();
    private final List<SlotId> gridOrder;

    public SlotRegistry() {
        List<SlotId> order = new ArrayList<>(SlotId.ROWS * SlotId.COLS);
        for (int i = 0; i < SlotId.ROWS * SlotId.COLS; i++) {
            SlotId id = SlotId.ofIndex(i);
            order.add(id);
            slots.put(id, SlotState.empty(id));
        }
        slots.put(SlotId.SINGLE, SlotState.empty(SlotId.SINGLE));
        this.gridOrder = Collections.unmodifiableList(order);
    }

    public SlotState get(SlotId id) {
        SlotState s = slots.get(Objects.requireNonNull(id, "id"));
        if (s == null) throw new IllegalArgumentException("unknown slot: " + id);
        return s;
    }

    public SlotState single() {
        return get(SlotId.SINGLE);
    }

    public void set(SlotState state) {
        Objects.requireNonNull(state, "state");
        if (!slots.containsKey(state.id())) throw new IllegalArgumentException("unknown slot: " + state.id());
        slots.put(state.id(), state);
    }

    /** Atomic read-modify-write; returns the stored record. */
    public SlotState update(SlotId id, UnaryOperator<SlotState> fn) {
        Objects.requireNonNull(fn, "fn");
        SlotState out = slots.computeIfPresent(Objects.requireNonNull(id, "id"), (k, prev) -> {
            SlotState next = fn.apply(prev);
            if (next == null || !next.id().equals(k)) {
                throw new IllegalStateException("slot update must keep identity: " + k);
            }
            return next;
        });
        if (out == null) throw new IllegalArgumentException("unknown slot: " + id);
        return out;
    }

    /** Moves the slot to LOADING with the next generation and returns that generation. */
    public long beginLoad(SlotId id) {
        return update(id, s -> s.loading(s.generation() + 1)).generation();
    }

    /** Bumps the generation without touching the phase; pending completions go stale. */
    public long nextGeneration(SlotId id) {
        return update(id, s -> s.withGeneration(s.generation() + 1)).generation();
    }

    public boolean isCurrent(SlotId id, long generation) {
        return get(id).generation() == generation;
    }

    public SlotState reset(SlotId id) {
        return update(id, SlotState::cleared);
    }

    /** Grid slots in row-major order, then the single slot. */
    public List<SlotState> all() {
        List<SlotState> out = new ArrayList<>(gridOrder.size() + 1);
        for (SlotId id : gridOrder) out.add(slots.get(id));
        out.add(slots.get(SlotId.SINGLE));
        return out;
    }

    /** Grid slots in row-major order. */
    public List<SlotState> grid() {
        return gridWhere(s -> true);
    }

    public List<SlotId> gridIds() {
        return gridOrder;
    }

    /** Grid slots currently holding a rig. */
    public List<SlotState> bound() {
        return gridWhere(SlotState::hasRig);
    }

    /** Grid slots with nothing bound and nothing in flight (EMPTY or FAILED). */
    public List<SlotState> empty() {
        return gridWhere(s -> !s.hasRig() && !s.isLoading());
    }

    private List<SlotState> gridWhere(Predicate<SlotState> filter) {
        List<SlotState> out = new ArrayList<>();
        for (SlotId id : gridOrder) {
            SlotState s = slots.get(id);
            if (filter.test(s)) out.add(s);
        }
        return out;
    }
}
