package org.foxesworld.rigview.engine.slot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Slot identity: a grid cell {@code (row, col)} or the single-view slot.
 */
public record SlotId(int row, int col) {

    public static final int ROWS = 5;
    public static final int COLS = 5;

    public static final SlotId SINGLE = new SlotId(-1, -1);

    private static final List<SlotId> GRID_IDS;

    static {
        List<SlotId> ids = new ArrayList<>(ROWS * COLS);
        for (int i = 0; i < ROWS * COLS; i++) ids.add(new SlotId(i / COLS, i % COLS));
        GRID_IDS = Collections.unmodifiableList(ids);
    }

    public SlotId {
        boolean single = row == -1 && col == -1;
        if (!single && (row < 0 || row >= ROWS || col < 0 || col >= COLS)) {
            throw new IllegalArgumentException("slot out of range: row=" + row + " col=" + col);
        }
    }

    public static SlotId grid(int row, int col) {
        return new SlotId(row, col);
    }

    /** Row-major index in {@code [0, 25)}. */
    public static SlotId ofIndex(int index) {
        if (index < 0 || index >= ROWS * COLS) throw new IllegalArgumentException("slot index out of range: " + index);
        return new SlotId(index / COLS, index % COLS);
    }

    /** All grid slots in row-major order. */
    public static List<SlotId> gridIds() {
        return GRID_IDS;
    }

    /** Parses {@link #key()} output. */
    public static SlotId parse(String key) {
        if (key == null) throw new IllegalArgumentException("slot key is null");
        String k = key.trim();
        if ("single".equals(k)) return SINGLE;
        if (!k.startsWith("slot-")) throw new IllegalArgumentException("bad slot key: " + key);
        String[] parts = k.substring(5).split("-");
        if (parts.length != 2) throw new IllegalArgumentException("bad slot key: " + key);
        try {
            return new SlotId(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bad slot key: " + key, e);
        }
    }

    public boolean isSingle() {
        return row == -1;
    }

    public int index() {
        if (isSingle()) throw new IllegalStateException("single slot has no grid index");
        return row * COLS + col;
    }

    /** Stable key, also used as the binder correlation prefix. */
    public String key() {
        return isSingle() ? "single" : "slot-" + row + "-" + col;
    }

    /** {@code R1C1}-style label. */
    public String label() {
        return isSingle() ? "Single" : "R" + (row + 1) + "C" + (col + 1);
    }

    @Override
    public String toString() {
        return key();
    }
}
