package org.foxesworld.rigview.engine.asset.jme;

import com.jme3.asset.AssetInfo;
import com.jme3.asset.AssetNotFoundException;

import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Reads raw bytes/text of a located asset.
 *
 * Always reads through {@link AssetInfo#openStream()}; the source may be a blob, the classpath
 * or a file.
 */
public final class AssetIO {

    private AssetIO() {}

    public static byte[] readBytes(AssetInfo info) {
        if (info == null) throw new IllegalArgumentException("AssetInfo is null");
        try (InputStream in = info.openStream()) {
            if (in == null) throw new AssetNotFoundException("Asset stream is null: " + info.getKey());
            return in.readAllBytes();
        } catch (AssetNotFoundException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to read bytes: " + describe(info), e);
        }
    }

    public static String readTextUtf8(AssetInfo info) {
        return readText(info, StandardCharsets.UTF_8);
    }

    public static String readText(AssetInfo info, Charset cs) {
        byte[] bytes = readBytes(info);
        return new String(bytes, cs == null ? StandardCharsets.UTF_8 : cs);
    }

    public static String describe(AssetInfo info) {
        if (info == null) return "AssetInfo=null";
        String src = info.getClass().getSimpleName();
        String key = (info.getKey() != null) ? info.getKey().getName() : "null";
        return "key='" + key + "' source=" + src;
    }
}
