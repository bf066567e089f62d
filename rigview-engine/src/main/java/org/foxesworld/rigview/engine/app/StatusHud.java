package org.foxesworld.rigview.engine.app;

import com.jme3.asset.AssetManager;
import com.jme3.font.BitmapFont;
import com.jme3.font.BitmapText;
import com.jme3.math.ColorRGBA;
import com.jme3.scene.Node;
import org.foxesworld.rigview.engine.slot.SlotState;
import org.foxesworld.rigview.engine.stage.PresentationMode;

import java.util.Locale;
import java.util.Objects;

/** Plain-text status panel in the top-left corner of the gui node. */
public final class StatusHud {

    static final String HELP =
            "O open  G mode  R load  F fill  C clear  B outlines  A scale all\n"
                    + "Space play  L loop  +/- scale  [/] cell  N anim  K skin";

    private static final float MARGIN = 10f;

    private final Node parent;
    private final BitmapText text;
    private String shown = "";

    public StatusHud(AssetManager assets, Node guiNode) {
        Objects.requireNonNull(assets, "assets");
        this.parent = Objects.requireNonNull(guiNode, "guiNode");
        BitmapFont font = assets.loadFont("Interface/Fonts/Default.fnt");
        this.text = new BitmapText(font);
        text.setName("rigview:hud");
        text.setSize(font.getCharSet().getRenderedSize());
        text.setColor(new ColorRGBA(0.93f, 0.9f, 0.95f, 1f));
        parent.attachChild(text);
    }

    /** Rebuilds the text from the viewer state; no-op when nothing changed. */
    public void refresh(RigViewer viewer, float viewportHeight) {
        String next = render(viewer);
        if (!next.equals(shown)) {
            shown = next;
            text.setText(next);
        }
        text.setLocalTranslation(MARGIN, viewportHeight - MARGIN, 0f);
    }

    static String render(RigViewer viewer) {
        SlotState s = viewer.targetState();
        StringBuilder sb = new StringBuilder(256);
        boolean grid = viewer.mode() == PresentationMode.GRID;

        sb.append(grid ? "Grid  active " + viewer.activeSlot().label() : "Single").append('\n');
        sb.append(viewer.status()).append('\n');
        if (s.error() != null) sb.append("Error: ").append(s.error()).append('\n');
        sb.append("Files: ").append(viewer.files().describe()).append('\n');
        if (s.hasRig()) {
            sb.append("Animation: ").append(orNone(s.selectedAnimation()))
                    .append(s.looping() ? " (loop)" : "")
                    .append(s.playing() ? "" : " [paused]").append('\n');
            sb.append("Skin: ").append(orNone(s.selectedSkin())).append('\n');
        }
        sb.append(String.format(Locale.ROOT, "Scale: %.2f", viewer.scale()));
        if (grid) {
            sb.append(viewer.isScaleAll() ? " (all)" : " (active)");
            sb.append("  Cell: ").append(viewer.cellSize());
            sb.append("  Outlines: ").append(viewer.synchronizer().outlinesVisible() ? "on" : "off");
        }
        sb.append('\n').append(HELP);
        return sb.toString();
    }

    private static String orNone(String s) {
        return s.isEmpty() ? "-" : s;
    }

    public void detach() {
        text.removeFromParent();
    }
}
