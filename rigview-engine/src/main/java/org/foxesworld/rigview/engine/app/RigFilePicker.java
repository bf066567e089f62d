package org.foxesworld.rigview.engine.app;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.rigview.engine.asset.RigBlob;

import javax.swing.JFileChooser;
import javax.swing.SwingUtilities;
import javax.swing.filechooser.FileNameExtensionFilter;
import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Swing multi-file chooser for the skeleton JSON, atlas and PNG pages. Runs on the EDT and hands
 * the picked files back through the render-thread queue.
 */
public final class RigFilePicker {

    private static final Logger log = LogManager.getLogger(RigFilePicker.class);

    private final RenderThreadQueue queue;
    private final Consumer<List<RigBlob>> onPicked;
    private final AtomicBoolean open = new AtomicBoolean(false);

    private volatile File lastDir;

    public RigFilePicker(RenderThreadQueue queue, Consumer<List<RigBlob>> onPicked) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.onPicked = Objects.requireNonNull(onPicked, "onPicked");
    }

    /** Opens the chooser unless one is already showing. Safe from any thread. */
    public void open() {
        if (!open.compareAndSet(false, true)) return;
        SwingUtilities.invokeLater(this::show);
    }

    public boolean isOpen() {
        return open.get();
    }

    private void show() {
        try {
            JFileChooser chooser = new JFileChooser(lastDir);
            chooser.setDialogTitle("Select .json, .atlas and .png files");
            chooser.setMultiSelectionEnabled(true);
            chooser.setFileSelectionMode(JFileChooser.FILES_ONLY);
            chooser.setFileFilter(new FileNameExtensionFilter("Spine export (*.json, *.atlas, *.png)",
                    "json", "atlas", "png"));

            if (chooser.showOpenDialog(null) != JFileChooser.APPROVE_OPTION) return;
            File[] files = chooser.getSelectedFiles();
            if (files == null || files.length == 0) return;
            lastDir = files[0].getParentFile();

            List<RigBlob> blobs = new ArrayList<>(files.length);
            for (File f : files) blobs.add(RigBlob.of(f.toPath()));
            log.info("Picked {} file(s) from {}", blobs.size(), lastDir);
            queue.post(() -> onPicked.accept(blobs));
        } catch (RuntimeException e) {
            log.error("File chooser failed", e);
        } finally {
            open.set(false);
        }
    }
}
