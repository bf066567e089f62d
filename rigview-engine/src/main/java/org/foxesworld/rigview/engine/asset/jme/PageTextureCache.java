package org.foxesworld.rigview.engine.asset.jme;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jme3.texture.Image;
import com.jme3.texture.Texture;
import com.jme3.texture.Texture2D;
import com.jme3.texture.plugins.AWTLoader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.rigview.engine.asset.RigBlob;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Decoded page textures keyed by blob identity, so a descriptor loaded into many slots decodes
 * each page once. Bounded; entries also go away with their blob.
 */
public final class PageTextureCache {

    private static final Logger log = LogManager.getLogger(PageTextureCache.class);

    private final Cache<RigBlob, Texture2D> cache;

    public PageTextureCache(long maxEntries) {
        this.cache = Caffeine.newBuilder()
                .weakKeys()
                .maximumSize(Math.max(1L, maxEntries))
                .recordStats()
                .build();
    }

    /** Decodes on miss. Blocking; call from the io pool. */
    public Texture2D get(RigBlob blob) {
        if (blob == null) throw new IllegalArgumentException("blob is null");
        return cache.get(blob, PageTextureCache::decode);
    }

    public long size() {
        return cache.estimatedSize();
    }

    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Page texture cache cleared, stats={}", cache.stats());
    }

    static Texture2D decode(RigBlob blob) {
        BufferedImage img;
        try {
            img = ImageIO.read(new ByteArrayInputStream(blob.read()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read image " + blob.name(), e);
        }
        if (img == null) throw new IllegalStateException("Unsupported image format: " + blob.name());

        Image jmeImg = new AWTLoader().load(img, true);
        Texture2D tex = new Texture2D(jmeImg);
        tex.setName(blob.name());
        tex.setWrap(Texture.WrapMode.EdgeClamp);
        tex.setMinFilter(Texture.MinFilter.BilinearNoMipMaps);
        tex.setMagFilter(Texture.MagFilter.Bilinear);
        log.debug("Decoded page {} ({}x{})", blob.name(), img.getWidth(), img.getHeight());
        return tex;
    }
}
