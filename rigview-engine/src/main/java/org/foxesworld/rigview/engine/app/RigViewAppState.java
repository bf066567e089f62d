package org.foxesworld.rigview.engine.app;

import com.jme3.app.Application;
import com.jme3.app.SimpleApplication;
import com.jme3.app.state.BaseAppState;
import com.jme3.renderer.Camera;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.rigview.engine.asset.BlobUrlRegistry;
import org.foxesworld.rigview.engine.asset.RigBinder;
import org.foxesworld.rigview.engine.asset.RigBlob;
import org.foxesworld.rigview.engine.asset.jme.JmeRigAssetManager;
import org.foxesworld.rigview.engine.asset.jme.PageTextureCache;
import org.foxesworld.rigview.engine.rig.jme.PreviewRigRuntime;
import org.foxesworld.rigview.engine.stage.jme.JmeOverlayFactory;
import org.foxesworld.rigview.engine.stage.jme.JmeRenderStage;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the viewer into a jME application: io pool, asset pipeline, stage, input and HUD.
 * Drains the render-thread queue and ticks the viewer every frame.
 */
public final class RigViewAppState extends BaseAppState {

    private static final Logger log = LogManager.getLogger(RigViewAppState.class);

    private static final int MAX_JOBS_PER_FRAME = 256;
    private static final long JOB_BUDGET_NANOS = TimeUnit.MILLISECONDS.toNanos(4);

    private final ViewerConfig config;
    private final List<RigBlob> initialFiles;

    private RenderThreadQueue queue;
    private ExecutorService io;
    private BlobUrlRegistry blobs;
    private PageTextureCache textures;
    private JmeRigAssetManager rigAssets;
    private JmeRenderStage stage;
    private RigViewer viewer;
    private RigFilePicker picker;
    private ViewerInput input;
    private StatusHud hud;

    private int lastWidth;
    private int lastHeight;

    public RigViewAppState(ViewerConfig config, List<RigBlob> initialFiles) {
        this.config = Objects.requireNonNull(config, "config");
        this.initialFiles = initialFiles == null ? List.of() : List.copyOf(initialFiles);
    }

    public RigViewer viewer() {
        return viewer;
    }

    @Override
    protected void initialize(Application app) {
        SimpleApplication sa = (SimpleApplication) app;

        queue = new RenderThreadQueue()
                .setOnError(t -> log.error("Render-thread job failed", t));
        io = Executors.newFixedThreadPool(config.ioThreads(), daemonThreads("rigview-io"));

        blobs = new BlobUrlRegistry();
        textures = new PageTextureCache(config.textureCacheSize());
        rigAssets = new JmeRigAssetManager(sa.getAssetManager(), blobs, textures, io);
        RigBinder binder = new RigBinder(rigAssets, blobs,
                new PreviewRigRuntime(rigAssets, sa.getAssetManager()), io);

        stage = new JmeRenderStage(sa.getGuiNode());
        Camera cam = sa.getCamera();
        lastWidth = cam.getWidth();
        lastHeight = cam.getHeight();
        stage.resize(lastWidth, lastHeight);

        viewer = RigViewer.create(config, stage, new JmeOverlayFactory(sa.getAssetManager()), binder, queue);

        picker = new RigFilePicker(queue, viewer::selectFiles);
        input = new ViewerInput(viewer, picker::open);
        hud = new StatusHud(sa.getAssetManager(), sa.getGuiNode());

        log.info("Viewer ready: cell={} scale={} ioThreads={}", config.cellSize(), config.scale(), config.ioThreads());
        if (!initialFiles.isEmpty()) viewer.selectFiles(initialFiles);
    }

    @Override
    protected void onEnable() {
        getApplication().getInputManager().addRawInputListener(input);
    }

    @Override
    protected void onDisable() {
        getApplication().getInputManager().removeRawInputListener(input);
        viewer.pointerLeave();
    }

    @Override
    public void update(float tpf) {
        queue.drainBudgeted(MAX_JOBS_PER_FRAME, JOB_BUDGET_NANOS);

        Camera cam = getApplication().getCamera();
        if (cam.getWidth() != lastWidth || cam.getHeight() != lastHeight) {
            lastWidth = cam.getWidth();
            lastHeight = cam.getHeight();
            stage.resize(lastWidth, lastHeight);
            viewer.viewportResized();
            log.debug("Viewport resized to {}x{}", lastWidth, lastHeight);
        }

        viewer.tick(tpf);
        hud.refresh(viewer, lastHeight);
    }

    @Override
    protected void cleanup(Application app) {
        viewer.shutdown();

        io.shutdown();
        try {
            if (!io.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("io pool did not stop in time, interrupting");
                io.shutdownNow();
            }
        } catch (InterruptedException e) {
            io.shutdownNow();
            Thread.currentThread().interrupt();
        }
        // binds that finished after shutdown are released by the closed coordinator
        queue.drain(Integer.MAX_VALUE);
        queue.clear();

        hud.detach();
        stage.dispose();
        rigAssets.shutdown();
        if (blobs.outstanding() > 0) log.warn("{} blob URI(s) still live at shutdown", blobs.outstanding());
        log.info("Viewer stopped");
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger n = new AtomicInteger(1);
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}
