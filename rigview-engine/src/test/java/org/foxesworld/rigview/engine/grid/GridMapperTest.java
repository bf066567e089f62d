package org.foxesworld.rigview.engine.grid;

import org.foxesworld.rigview.engine.slot.SlotId;
import org.foxesworld.rigview.engine.util.Bounds2f;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GridMapperTest {

    private final GridMetrics m = GridMapper.metrics(1000f, 800f, 100f);

    @Test
    void gridIsCenteredInTheViewport() {
        assertEquals(250f, m.left());
        assertEquals(150f, m.top());
        assertEquals(500f, m.gridWidth());
        assertEquals(750f, m.right());
        assertEquals(650f, m.bottom());
    }

    @Test
    void topLeftCornerHitsFirstCell() {
        assertEquals(Optional.of(SlotId.grid(0, 0)), GridMapper.hitTest(m, 250f, 150f));
    }

    @Test
    void cellsAreHalfOpen() {
        assertEquals(Optional.of(SlotId.grid(0, 0)), GridMapper.hitTest(m, 349.99f, 150f));
        assertEquals(Optional.of(SlotId.grid(0, 1)), GridMapper.hitTest(m, 350f, 150f));
        assertEquals(Optional.of(SlotId.grid(4, 4)), GridMapper.hitTest(m, 749.9f, 649.9f));
        assertEquals(Optional.empty(), GridMapper.hitTest(m, 750f, 300f));
        assertEquals(Optional.empty(), GridMapper.hitTest(m, 300f, 650f));
    }

    @Test
    void nonFinitePointsMissAll() {
        assertEquals(Optional.empty(), GridMapper.hitTest(m, Float.NaN, Float.NaN));
        assertEquals(Optional.empty(), GridMapper.hitTest(m, Float.NaN, 200f));
        assertEquals(Optional.empty(), GridMapper.hitTest(m, 300f, Float.POSITIVE_INFINITY));
        assertEquals(Optional.empty(), GridMapper.hitTest(m, Float.NEGATIVE_INFINITY, 200f));
    }

    @Test
    void pointsOutsideTheGridMissAll() {
        assertEquals(Optional.empty(), GridMapper.hitTest(m, 249.9f, 200f));
        assertEquals(Optional.empty(), GridMapper.hitTest(m, 300f, 149.9f));
        assertEquals(Optional.empty(), GridMapper.hitTest(m, -10f, -10f));
    }

    @Test
    void centersSitInTheMiddleOfTheCell() {
        SlotId id = SlotId.grid(2, 3);

        assertEquals(600f, GridMapper.centerX(m, id));
        assertEquals(400f, GridMapper.centerY(m, id));
        assertEquals(Optional.of(id), GridMapper.hitTest(m, GridMapper.centerX(m, id), GridMapper.centerY(m, id)));
    }

    @Test
    void drawRectShrinksByTheGap() {
        Bounds2f r = GridMapper.drawRect(m, SlotId.grid(0, 0), 3f);

        assertEquals(new Bounds2f(251.5f, 151.5f, 97f, 97f), r);
        assertEquals(0f, GridMapper.drawRect(m, SlotId.grid(0, 0), 500f).width());
    }

    @Test
    void hitTestAgreesWithCellRectOnAwkwardSizes() {
        float[] sizes = {37.3f, 40f, 59.99f, 120f, 133.7f, 400f};
        for (float size : sizes) {
            GridMetrics metrics = GridMapper.metrics(997f, 613f, size);
            for (SlotId id : SlotId.gridIds()) {
                Bounds2f cell = GridMapper.cellRect(metrics, id);
                assertEquals(Optional.of(id), GridMapper.hitTest(metrics, cell.x(), cell.y()),
                        "top-left corner of " + id + " at cell size " + size);
                if (id.col() > 0) {
                    Optional<SlotId> left = GridMapper.hitTest(metrics, Math.nextDown(cell.x()), cell.y());
                    assertEquals(Optional.of(SlotId.grid(id.row(), id.col() - 1)), left,
                            "just left of " + id + " at cell size " + size);
                }
            }
        }
    }

    @Test
    void singleSlotHasNoCell() {
        assertThrows(IllegalArgumentException.class, () -> GridMapper.cellRect(m, SlotId.SINGLE));
    }
}
