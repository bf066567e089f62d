package org.foxesworld.rigview.engine.app;

import org.foxesworld.rigview.engine.asset.BlobUrlRegistry;
import org.foxesworld.rigview.engine.asset.RigBinder;
import org.foxesworld.rigview.engine.asset.RigBlob;
import org.foxesworld.rigview.engine.asset.RigFileSelection;
import org.foxesworld.rigview.engine.slot.SlotId;
import org.foxesworld.rigview.engine.slot.SlotPhase;
import org.foxesworld.rigview.engine.slot.SlotState;
import org.foxesworld.rigview.engine.stage.PresentationMode;
import org.foxesworld.rigview.engine.testsupport.FakeRigRuntime;
import org.foxesworld.rigview.engine.testsupport.InMemoryAssetManager;
import org.foxesworld.rigview.engine.testsupport.ManualExecutor;
import org.foxesworld.rigview.engine.testsupport.RecordingOverlayFactory;
import org.foxesworld.rigview.engine.testsupport.RigFixtures;
import org.foxesworld.rigview.engine.testsupport.TestStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RigViewerTest {

    private ManualExecutor io;
    private InMemoryAssetManager assets;
    private BlobUrlRegistry blobs;
    private FakeRigRuntime runtime;
    private TestStage stage;
    private RigViewer viewer;

    @BeforeEach
    void setUp() {
        io = new ManualExecutor();
        assets = new InMemoryAssetManager();
        blobs = new BlobUrlRegistry();
        runtime = new FakeRigRuntime();
        stage = new TestStage(1280f, 720f);
        RigBinder binder = new RigBinder(assets, blobs, runtime, io);
        viewer = RigViewer.create(ViewerConfig.defaults(), stage, new RecordingOverlayFactory(), binder, Runnable::run);
    }

    @Test
    void startsIdleInSingleMode() {
        assertEquals(PresentationMode.SINGLE, viewer.mode());
        assertEquals(RigViewer.STATUS_IDLE, viewer.status());
        assertEquals(SlotId.grid(0, 0), viewer.activeSlot());
    }

    @Test
    void completeSelectionLoadsOnItsOwn() {
        viewer.selectFiles(RigFixtures.files("page1.png"));
        assertEquals(SlotState.STATUS_LOADING, viewer.status());
        assertTrue(viewer.isBusy());

        io.runAll();

        assertFalse(viewer.isBusy());
        assertEquals(RigViewer.STATUS_READY, viewer.status());
        assertEquals(1, runtime.liveCount());
    }

    @Test
    void sameFilesAreNotLoadedTwice() {
        viewer.selectFiles(RigFixtures.files("page1.png"));
        io.runAll();

        viewer.selectFiles(RigFixtures.files("page1.png"));
        io.runAll();

        assertEquals(1, runtime.created().size());
    }

    @Test
    void incompleteSelectionWaitsSilently() {
        viewer.selectFiles(List.of(RigFixtures.text("hero.json", RigFixtures.SKELETON_JSON)));

        assertEquals(0, io.pending());
        assertNull(viewer.targetState().error());
        assertEquals(RigViewer.STATUS_IDLE, viewer.status());
    }

    @Test
    void explicitLoadOfIncompleteSelectionReportsIt() {
        viewer.selectFiles(List.of(RigFixtures.png("page1.png")));

        viewer.loadSingle();

        assertEquals(RigFileSelection.INCOMPLETE_MESSAGE, viewer.slots().single().error());
    }

    @Test
    void gridLoadsIntoTheActiveSlotAndFollowsSelection() {
        viewer.setMode(PresentationMode.GRID);
        viewer.selectFiles(RigFixtures.files("page1.png"));
        io.runAll();
        assertTrue(viewer.slots().get(SlotId.grid(0, 0)).hasRig());
        assertEquals(SlotState.STATUS_LOADED, viewer.status());

        viewer.selectSlot(SlotId.grid(2, 3));
        io.runAll();

        assertTrue(viewer.slots().get(SlotId.grid(2, 3)).hasRig(), "changing the active slot loads into it");
        assertEquals(2, runtime.liveCount());
    }

    @Test
    void singleAndGridKeepTheirOwnFiles() {
        viewer.selectFiles(RigFixtures.files("page1.png"));
        io.runAll();

        viewer.setMode(PresentationMode.GRID);

        assertTrue(viewer.files().isEmpty());
        assertEquals(0, io.pending(), "grid has no files yet");
        assertFalse(viewer.slots().get(SlotId.grid(0, 0)).hasRig());
    }

    @Test
    void clearGridForgetsFilesSoTheyCanBeLoadedAgain() {
        viewer.setMode(PresentationMode.GRID);
        viewer.selectFiles(RigFixtures.files("page1.png"));
        io.runAll();

        assertEquals(1, viewer.clearGrid());
        assertTrue(viewer.files().isEmpty());
        assertEquals(0, assets.registeredCount());

        viewer.selectFiles(RigFixtures.files("page1.png"));
        io.runAll();
        assertTrue(viewer.slots().get(SlotId.grid(0, 0)).hasRig());
    }

    @Test
    void fillEmptyReportsAttempts() {
        viewer.setMode(PresentationMode.GRID);
        viewer.selectFiles(RigFixtures.files("page1.png"));
        io.runAll();

        var attempts = viewer.fillEmpty();
        io.runAll();

        assertEquals(24, attempts.join());
        assertEquals(25, viewer.slots().bound().size());
    }

    @Test
    void fillEmptyWithoutFilesReportsIncomplete() {
        viewer.setMode(PresentationMode.GRID);

        assertEquals(0, viewer.fillEmpty().join());
        assertEquals(RigFileSelection.INCOMPLETE_MESSAGE, viewer.targetState().error());
    }

    @Test
    void newerSelectionWaitsForTheRunningLoad() {
        viewer.selectFiles(RigFixtures.files("page1.png"));
        List<RigBlob> second = new ArrayList<>(RigFixtures.files("page1.png"));
        second.set(0, RigFixtures.text("other.json", RigFixtures.SKELETON_JSON));

        viewer.selectFiles(second);
        assertEquals(1, io.pending(), "second load is held back");

        io.runAll();

        assertEquals(2, runtime.created().size());
        assertEquals(1, runtime.liveCount());
        assertEquals("other.json", viewer.files().skeleton().name());
    }

    @Test
    void scaleIsClamped() {
        viewer.setScale(99f);
        assertEquals(RigViewer.MAX_SCALE, viewer.scale());

        viewer.setScale(0f);
        assertEquals(RigViewer.MIN_SCALE, viewer.scale());
    }

    @Test
    void gridScaleGoesToAllSlotsOrOnlyTheActiveOne() {
        viewer.setMode(PresentationMode.GRID);

        viewer.setScale(2f);
        assertTrue(viewer.slots().grid().stream().allMatch(s -> s.scale() == 2f));

        viewer.setScaleAll(false);
        viewer.setScale(3f);
        assertEquals(3f, viewer.slots().get(SlotId.grid(0, 0)).scale());
        assertEquals(2f, viewer.slots().get(SlotId.grid(0, 1)).scale());
        assertEquals(1f, viewer.slots().single().scale());
    }

    @Test
    void cellSizeIsClamped() {
        viewer.setCellSize(10);
        assertEquals(RigViewer.MIN_CELL_SIZE, viewer.cellSize());

        viewer.setCellSize(1000);
        assertEquals(RigViewer.MAX_CELL_SIZE, viewer.cellSize());
    }

    @Test
    void clickingACellMakesItActive() {
        viewer.setMode(PresentationMode.GRID);
        var m = viewer.synchronizer().metrics();

        viewer.pointerDown(m.left() + m.cellSize() * 4.5f, m.top() + m.cellSize() * 1.5f);

        assertEquals(SlotId.grid(1, 4), viewer.activeSlot());
        assertFalse(viewer.synchronizer().outlinesVisible());
    }

    @Test
    void playbackControlsCycleNames() {
        viewer.selectFiles(RigFixtures.files("page1.png"));
        io.runAll();

        viewer.cycleAnimation(1);
        assertEquals("walk", viewer.targetState().selectedAnimation());
        viewer.cycleAnimation(-2);
        assertEquals("run", viewer.targetState().selectedAnimation());
        viewer.cycleSkin(1);
        assertEquals("armored", viewer.targetState().selectedSkin());

        viewer.togglePlaying();
        assertFalse(viewer.targetState().playing());
    }

    @Test
    void singleSlotCannotBeActive() {
        assertThrows(IllegalArgumentException.class, () -> viewer.selectSlot(SlotId.SINGLE));
    }

    @Test
    void failedLoadShowsFailureStatus() {
        assets.failLoads(true);

        viewer.selectFiles(RigFixtures.files("page1.png"));
        io.runAll();

        assertEquals(SlotPhase.FAILED, viewer.targetState().phase());
        assertEquals(SlotState.STATUS_FAILED, viewer.status());
    }

    @Test
    void hudTextReflectsState() {
        viewer.setMode(PresentationMode.GRID);

        String text = StatusHud.render(viewer);

        assertTrue(text.startsWith("Grid  active R1C1"));
        assertTrue(text.contains("Outlines: on"));
        assertTrue(text.endsWith(StatusHud.HELP));
    }
}
