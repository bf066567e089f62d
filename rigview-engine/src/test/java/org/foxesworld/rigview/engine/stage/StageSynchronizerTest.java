package org.foxesworld.rigview.engine.stage;

import com.jme3.math.Vector3f;
import org.foxesworld.rigview.engine.asset.BlobUrlRegistry;
import org.foxesworld.rigview.engine.asset.RigBinder;
import org.foxesworld.rigview.engine.grid.GridMapper;
import org.foxesworld.rigview.engine.lifecycle.RigArena;
import org.foxesworld.rigview.engine.lifecycle.RigLifecycleCoordinator;
import org.foxesworld.rigview.engine.rig.RigInstance;
import org.foxesworld.rigview.engine.slot.SlotId;
import org.foxesworld.rigview.engine.slot.SlotRegistry;
import org.foxesworld.rigview.engine.testsupport.FakeRigRuntime;
import org.foxesworld.rigview.engine.testsupport.InMemoryAssetManager;
import org.foxesworld.rigview.engine.testsupport.RecordingOverlayFactory;
import org.foxesworld.rigview.engine.testsupport.RecordingOverlayFactory.FakeOverlay;
import org.foxesworld.rigview.engine.testsupport.RigFixtures;
import org.foxesworld.rigview.engine.testsupport.TestStage;
import org.foxesworld.rigview.engine.util.Bounds2f;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StageSynchronizerTest {

    private TestStage stage;
    private RecordingOverlayFactory overlays;
    private RigArena arena;
    private StageSynchronizer synchronizer;
    private RigLifecycleCoordinator coordinator;

    @BeforeEach
    void setUp() {
        stage = new TestStage(1000f, 800f);
        overlays = new RecordingOverlayFactory();
        arena = new RigArena();
        synchronizer = new StageSynchronizer(stage, overlays, arena, 100f, 3f, 8f, true);
        RigBinder binder = new RigBinder(new InMemoryAssetManager(), new BlobUrlRegistry(), new FakeRigRuntime(),
                Runnable::run);
        coordinator = new RigLifecycleCoordinator(new SlotRegistry(), arena, binder, stage, overlays,
                synchronizer, Runnable::run);
    }

    private RigInstance load(SlotId id) {
        coordinator.load(id, RigFixtures.descriptor("page1.png")).join();
        return arena.instance(id);
    }

    private FakeOverlay overlay(String name) {
        return overlays.named(name).get(0);
    }

    @Test
    void singleModeCentersTheRigAndDrawsItsOutline() {
        RigInstance rig = load(SlotId.SINGLE);

        Vector3f pos = rig.node().getLocalTranslation();
        assertEquals(new Vector3f(500f, 400f, OverlayFactory.LAYER_RIG), pos);
        assertEquals(new Bounds2f(450f, 350f, 100f, 100f), rig.screenBounds());

        FakeOverlay outline = overlay("outline:single");
        assertTrue(stage.isAttached(outline.node()));
        assertEquals(OverlayFactory.LAYER_OUTLINE, outline.node().getLocalTranslation().z);
        assertEquals(1, outline.shapeCount());
        assertEquals(rig.screenBounds(), outline.shapes().get(0).rect());
        assertEquals(2, stage.children().size());
    }

    @Test
    void gridModeDrawsTheGuideAndPlacesRigsAtCellCenters() {
        synchronizer.setMode(PresentationMode.GRID);
        RigInstance rig = load(SlotId.grid(2, 3));

        assertEquals(600f, rig.node().getLocalTranslation().x);
        assertEquals(400f, rig.node().getLocalTranslation().y);

        FakeOverlay guide = overlay("grid:guide");
        assertEquals(25 * 2 + 1, guide.shapeCount(), "shadow and fill per cell plus the frame");
        assertEquals(StageSynchronizer.GRID_FRAME, guide.shapes().get(50).style());
        assertTrue(stage.isAttached(guide.node()));
        assertTrue(stage.isAttached(overlay("grid:hover").node()));
        assertTrue(stage.isAttached(rig.node()));
        assertTrue(stage.isAttached(overlay("outline:slot-2-3").node()));
    }

    @Test
    void singleRigIsHiddenInGridModeAndBack() {
        RigInstance single = load(SlotId.SINGLE);

        synchronizer.setMode(PresentationMode.GRID);
        assertFalse(stage.isAttached(single.node()));

        synchronizer.setMode(PresentationMode.SINGLE);
        assertTrue(stage.isAttached(single.node()));
        assertFalse(stage.isAttached(overlay("grid:guide").node()));
    }

    @Test
    void pointerDownSelectsTheCellAndHidesOutlinesOnce() {
        synchronizer.setMode(PresentationMode.GRID);
        load(SlotId.grid(0, 0));
        synchronizer.tick(0.016f);
        FakeOverlay outline = overlay("outline:slot-0-0");
        assertEquals(1, outline.shapeCount());

        Optional<SlotId> hit = synchronizer.pointerDown(260f, 160f);

        assertEquals(Optional.of(SlotId.grid(0, 0)), hit);
        assertFalse(synchronizer.outlinesVisible());
        assertEquals(0, outline.shapeCount());
        synchronizer.tick(0.016f);
        assertEquals(0, outline.shapeCount(), "hidden outlines are not redrawn");
        assertNotNull(arena.outline(SlotId.grid(0, 0)), "outline object is kept");
    }

    @Test
    void pointerDownOutsideTheGridStillHidesOutlines() {
        synchronizer.setMode(PresentationMode.GRID);

        assertEquals(Optional.empty(), synchronizer.pointerDown(10f, 10f));
        assertFalse(synchronizer.outlinesVisible());
    }

    @Test
    void pointerDownInSingleModeDoesNothing() {
        assertEquals(Optional.empty(), synchronizer.pointerDown(500f, 400f));
        assertTrue(synchronizer.outlinesVisible());
    }

    @Test
    void outlinesToggledOffAndOnAreRecreated() {
        synchronizer.setMode(PresentationMode.GRID);
        load(SlotId.grid(0, 0));
        FakeOverlay first = overlay("outline:slot-0-0");

        coordinator.setOutlinesVisible(false);
        assertFalse(stage.isAttached(first.node()));
        RigInstance later = load(SlotId.grid(1, 1));
        assertNotNull(later);
        assertNull(arena.outline(SlotId.grid(1, 1)));

        coordinator.setOutlinesVisible(true);
        synchronizer.tick(0.016f);

        FakeOverlay created = overlay("outline:slot-1-1");
        assertTrue(stage.isAttached(created.node()));
        assertTrue(stage.isAttached(first.node()));
        assertEquals(1, created.shapeCount());
        assertEquals(1, first.shapeCount());
    }

    @Test
    void hoverFollowsThePointer() {
        synchronizer.setMode(PresentationMode.GRID);
        FakeOverlay hover = overlay("grid:hover");

        synchronizer.pointerMove(365f, 265f);
        assertEquals(SlotId.grid(1, 1), synchronizer.hovered());
        assertEquals(1, hover.shapeCount());
        assertEquals(GridMapper.drawRect(synchronizer.metrics(), SlotId.grid(1, 1), 3f), hover.shapes().get(0).rect());

        int clears = hover.clears();
        synchronizer.pointerMove(370f, 270f);
        assertEquals(clears, hover.clears(), "same cell does not redraw");

        synchronizer.pointerMove(5f, 5f);
        assertNull(synchronizer.hovered());
        assertEquals(0, hover.shapeCount());

        synchronizer.pointerMove(365f, 265f);
        synchronizer.pointerLeave();
        assertEquals(0, hover.shapeCount());
    }

    @Test
    void relayoutDropsHover() {
        synchronizer.setMode(PresentationMode.GRID);
        FakeOverlay hover = overlay("grid:hover");
        synchronizer.pointerMove(365f, 265f);

        stage.resize(900f, 700f);
        synchronizer.relayout();

        assertNull(synchronizer.hovered());
        assertEquals(0, hover.shapeCount());
    }

    @Test
    void cellSizeChangeMovesRigs() {
        synchronizer.setMode(PresentationMode.GRID);
        RigInstance rig = load(SlotId.grid(0, 0));
        assertEquals(300f, rig.node().getLocalTranslation().x);

        synchronizer.setCellSize(200f);

        assertEquals(100f, rig.node().getLocalTranslation().x);
        assertEquals(0f, rig.node().getLocalTranslation().y);
    }

    @Test
    void viewportResizeRecentersOnRelayout() {
        RigInstance rig = load(SlotId.SINGLE);

        stage.resize(600f, 400f);
        synchronizer.relayout();

        assertEquals(300f, rig.node().getLocalTranslation().x);
        assertEquals(200f, rig.node().getLocalTranslation().y);
    }

    @Test
    void nothingHappensBeforeTheStageIsReady() {
        stage.setReady(false);

        synchronizer.setMode(PresentationMode.GRID);
        synchronizer.pointerMove(300f, 300f);

        assertTrue(overlays.created().isEmpty());
        assertTrue(stage.children().isEmpty());
        assertEquals(Optional.empty(), synchronizer.pointerDown(300f, 300f));
    }

    @Test
    void shutdownDestroysGuideAndHover() {
        synchronizer.setMode(PresentationMode.GRID);

        synchronizer.shutdown();

        assertTrue(overlay("grid:guide").isDestroyed());
        assertTrue(overlay("grid:hover").isDestroyed());
        assertTrue(stage.children().isEmpty());
    }
}
