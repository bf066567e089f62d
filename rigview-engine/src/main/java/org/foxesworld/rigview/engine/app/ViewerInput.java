package org.foxesworld.rigview.engine.app;

import com.jme3.input.KeyInput;
import com.jme3.input.MouseInput;
import com.jme3.input.RawInputListener;
import com.jme3.input.event.JoyAxisEvent;
import com.jme3.input.event.JoyButtonEvent;
import com.jme3.input.event.KeyInputEvent;
import com.jme3.input.event.MouseButtonEvent;
import com.jme3.input.event.MouseMotionEvent;
import com.jme3.input.event.TouchEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Raw jME input mapped onto {@link RigViewer} operations. Events arrive on the render thread.
 *
 * <pre>
 *   O open files        G single/grid      R load again     F fill empty     C clear grid
 *   B outlines          A scale all        Space play/pause L loop
 *   + / - scale         [ / ] cell size    N / Shift+N animation            K / Shift+K skin
 * </pre>
 */
public final class ViewerInput implements RawInputListener {

    private static final Logger log = LogManager.getLogger(ViewerInput.class);

    static final float SCALE_STEP = 0.1f;
    static final int CELL_STEP = 10;

    private final RigViewer viewer;
    private final Runnable openPicker;

    private boolean shift;

    public ViewerInput(RigViewer viewer, Runnable openPicker) {
        this.viewer = Objects.requireNonNull(viewer, "viewer");
        this.openPicker = Objects.requireNonNull(openPicker, "openPicker");
    }

    @Override public void beginInput() {}
    @Override public void endInput() {}

    @Override public void onJoyAxisEvent(JoyAxisEvent evt) {}
    @Override public void onJoyButtonEvent(JoyButtonEvent evt) {}
    @Override public void onTouchEvent(TouchEvent evt) {}

    @Override
    public void onMouseMotionEvent(MouseMotionEvent evt) {
        viewer.pointerMove(evt.getX(), evt.getY());
    }

    @Override
    public void onMouseButtonEvent(MouseButtonEvent evt) {
        if (evt.isPressed() && evt.getButtonIndex() == MouseInput.BUTTON_LEFT) {
            viewer.pointerDown(evt.getX(), evt.getY());
        }
    }

    @Override
    public void onKeyEvent(KeyInputEvent evt) {
        int code = evt.getKeyCode();
        if (code == KeyInput.KEY_LSHIFT || code == KeyInput.KEY_RSHIFT) {
            shift = evt.isPressed();
            return;
        }
        if (!evt.isPressed() || (evt.isRepeating() && !isRepeatable(code))) return;
        if (handleKey(code)) evt.setConsumed();
    }

    /** @return true when the key is bound */
    boolean handleKey(int code) {
        switch (code) {
            case KeyInput.KEY_O -> openPicker.run();
            case KeyInput.KEY_G -> viewer.toggleMode();
            case KeyInput.KEY_R -> reload();
            case KeyInput.KEY_F -> viewer.fillEmpty();
            case KeyInput.KEY_C -> viewer.clearGrid();
            case KeyInput.KEY_B -> viewer.toggleOutlines();
            case KeyInput.KEY_A -> viewer.setScaleAll(!viewer.isScaleAll());
            case KeyInput.KEY_SPACE -> viewer.togglePlaying();
            case KeyInput.KEY_L -> viewer.setLooping(!viewer.targetState().looping());
            case KeyInput.KEY_EQUALS, KeyInput.KEY_ADD -> viewer.setScale(viewer.scale() + SCALE_STEP);
            case KeyInput.KEY_MINUS, KeyInput.KEY_SUBTRACT -> viewer.setScale(viewer.scale() - SCALE_STEP);
            case KeyInput.KEY_RBRACKET -> viewer.setCellSize(viewer.cellSize() + CELL_STEP);
            case KeyInput.KEY_LBRACKET -> viewer.setCellSize(viewer.cellSize() - CELL_STEP);
            case KeyInput.KEY_N -> viewer.cycleAnimation(shift ? -1 : 1);
            case KeyInput.KEY_K -> viewer.cycleSkin(shift ? -1 : 1);
            default -> {
                return false;
            }
        }
        return true;
    }

    void setShift(boolean shift) {
        this.shift = shift;
    }

    private void reload() {
        log.debug("Explicit load for {}", viewer.target().label());
        if (viewer.target().isSingle()) {
            viewer.loadSingle();
        } else {
            viewer.loadActive();
        }
    }

    private static boolean isRepeatable(int code) {
        return code == KeyInput.KEY_EQUALS || code == KeyInput.KEY_ADD
                || code == KeyInput.KEY_MINUS || code == KeyInput.KEY_SUBTRACT
                || code == KeyInput.KEY_LBRACKET || code == KeyInput.KEY_RBRACKET;
    }
}
