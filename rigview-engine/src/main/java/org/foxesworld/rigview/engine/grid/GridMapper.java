package org.foxesworld.rigview.engine.grid;

import com.jme3.math.Vector2f;
import org.foxesworld.rigview.engine.slot.SlotId;
import org.foxesworld.rigview.engine.util.Bounds2f;

import java.util.Optional;

/**
 * Pointer → cell and cell → rectangle for the fixed grid.
 *
 * <p>Cells are half-open {@code [left, left+size)}; {@link #hitTest} is corrected against
 * {@link #cellRect} so both agree exactly on every boundary.</p>
 */
public final class GridMapper {

    private GridMapper() {}

    public static GridMetrics metrics(float viewportWidth, float viewportHeight, float cellSize) {
        return GridMetrics.of(viewportWidth, viewportHeight, cellSize, SlotId.ROWS, SlotId.COLS);
    }

    public static Optional<SlotId> hitTest(GridMetrics m, float x, float y) {
        if (m.cellSize() <= 0f || !Float.isFinite(x) || !Float.isFinite(y)) return Optional.empty();
        int col = index(x, m.left(), m.cellSize());
        int row = index(y, m.top(), m.cellSize());
        if (col < 0 || col >= m.cols() || row < 0 || row >= m.rows()) return Optional.empty();
        return Optional.of(SlotId.grid(row, col));
    }

    public static Bounds2f cellRect(GridMetrics m, SlotId slot) {
        requireGrid(slot);
        return new Bounds2f(cellEdge(m.left(), slot.col(), m.cellSize()), cellEdge(m.top(), slot.row(), m.cellSize()),
                m.cellSize(), m.cellSize());
    }

    public static Vector2f cellCenter(GridMetrics m, SlotId slot) {
        return new Vector2f(centerX(m, slot), centerY(m, slot));
    }

    public static float centerX(GridMetrics m, SlotId slot) {
        requireGrid(slot);
        return m.left() + slot.col() * m.cellSize() + m.cellSize() / 2f;
    }

    public static float centerY(GridMetrics m, SlotId slot) {
        requireGrid(slot);
        return m.top() + slot.row() * m.cellSize() + m.cellSize() / 2f;
    }

    /** Visible cell: {@code max(cell - gap, 0)} wide, centered inside the cell. */
    public static Bounds2f drawRect(GridMetrics m, SlotId slot, float gap) {
        Bounds2f cell = cellRect(m, slot);
        float size = Math.max(m.cellSize() - Math.max(gap, 0f), 0f);
        float offset = (m.cellSize() - size) / 2f;
        return new Bounds2f(cell.x() + offset, cell.y() + offset, size, size);
    }

    public static Bounds2f gridRect(GridMetrics m) {
        return new Bounds2f(m.left(), m.top(), m.gridWidth(), m.gridHeight());
    }

    private static float cellEdge(float origin, int i, float cell) {
        return origin + i * cell;
    }

    private static int index(float p, float origin, float cell) {
        if (p < origin) return -1;
        int i = (int) Math.floor((p - origin) / cell);
        // floor() of the quotient can land one off the edge the rect function computes
        if (cellEdge(origin, i, cell) > p) i--;
        else if (cellEdge(origin, i + 1, cell) <= p) i++;
        return i;
    }

    private static void requireGrid(SlotId slot) {
        if (slot == null || slot.isSingle()) throw new IllegalArgumentException("grid slot required: " + slot);
    }
}
