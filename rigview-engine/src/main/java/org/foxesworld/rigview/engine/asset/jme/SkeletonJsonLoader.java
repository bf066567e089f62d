package org.foxesworld.rigview.engine.asset.jme;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.jme3.asset.AssetInfo;
import com.jme3.asset.AssetLoader;
import org.foxesworld.rigview.engine.util.Bounds2f;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads skeleton JSON files as {@link SkeletonData}.
 *
 * Only metadata is read: {@code skeleton} header, {@code skins} (array or object form) and
 * {@code animations}. An animation's duration is the largest {@code time} key anywhere below it.
 */
public final class SkeletonJsonLoader implements AssetLoader {

    @Override
    public Object load(AssetInfo assetInfo) throws IOException {
        String text = AssetIO.readTextUtf8(assetInfo);
        String name = assetInfo.getKey() != null ? assetInfo.getKey().getName() : "";
        try {
            return parse(text, name);
        } catch (JsonParseException | IllegalStateException e) {
            throw new IOException("Invalid skeleton JSON: " + AssetIO.describe(assetInfo), e);
        }
    }

    public static SkeletonData parse(String json, String name) {
        JsonElement rootEl = JsonParser.parseString(json);
        if (!rootEl.isJsonObject()) throw new IllegalStateException("skeleton root is not an object");
        JsonObject root = rootEl.getAsJsonObject();

        String version = "";
        Bounds2f bounds = Bounds2f.EMPTY;
        if (root.has("skeleton") && root.get("skeleton").isJsonObject()) {
            JsonObject sk = root.getAsJsonObject("skeleton");
            version = str(sk, "spine");
            float x = num(sk, "x");
            float y = num(sk, "y");
            float w = num(sk, "width");
            float h = num(sk, "height");
            // y-up setup pose -> y-down local space
            bounds = new Bounds2f(x, -(y + h), w, h);
        }

        return new SkeletonData(name, version, bounds, animations(root), skins(root));
    }

    private static List<SkeletonData.Animation> animations(JsonObject root) {
        List<SkeletonData.Animation> out = new ArrayList<>();
        JsonElement el = root.get("animations");
        if (el == null || !el.isJsonObject()) return out;
        for (Map.Entry<String, JsonElement> e : el.getAsJsonObject().entrySet()) {
            out.add(new SkeletonData.Animation(e.getKey(), maxTime(e.getValue())));
        }
        return out;
    }

    private static List<String> skins(JsonObject root) {
        List<String> out = new ArrayList<>();
        JsonElement el = root.get("skins");
        if (el == null) return out;
        if (el.isJsonArray()) {
            for (JsonElement s : el.getAsJsonArray()) {
                if (s.isJsonObject()) {
                    String n = str(s.getAsJsonObject(), "name");
                    if (!n.isEmpty()) out.add(n);
                }
            }
        } else if (el.isJsonObject()) {
            out.addAll(el.getAsJsonObject().keySet());
        }
        return out;
    }

    private static float maxTime(JsonElement el) {
        if (el == null) return 0f;
        float max = 0f;
        if (el.isJsonObject()) {
            for (Map.Entry<String, JsonElement> e : el.getAsJsonObject().entrySet()) {
                JsonElement v = e.getValue();
                if ("time".equals(e.getKey()) && v.isJsonPrimitive() && v.getAsJsonPrimitive().isNumber()) {
                    max = Math.max(max, v.getAsFloat());
                } else {
                    max = Math.max(max, maxTime(v));
                }
            }
        } else if (el.isJsonArray()) {
            JsonArray arr = el.getAsJsonArray();
            for (JsonElement v : arr) max = Math.max(max, maxTime(v));
        }
        return max;
    }

    private static String str(JsonObject o, String key) {
        JsonElement v = o.get(key);
        return (v != null && v.isJsonPrimitive()) ? v.getAsString() : "";
    }

    private static float num(JsonObject o, String key) {
        JsonElement v = o.get(key);
        return (v != null && v.isJsonPrimitive() && v.getAsJsonPrimitive().isNumber()) ? v.getAsFloat() : 0f;
    }
}
