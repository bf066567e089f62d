package org.foxesworld.rigview.engine.rig.jme;

import com.jme3.asset.AssetManager;
import org.foxesworld.rigview.engine.asset.jme.JmeRigAssetManager;
import org.foxesworld.rigview.engine.asset.jme.LoadedAtlas;
import org.foxesworld.rigview.engine.asset.jme.SkeletonData;
import org.foxesworld.rigview.engine.rig.RigInstance;
import org.foxesworld.rigview.engine.rig.RigRuntime;

import java.util.Objects;

/** Builds {@link PreviewRig}s from skeleton and atlas data loaded by {@link JmeRigAssetManager}. */
public final class PreviewRigRuntime implements RigRuntime {

    private final JmeRigAssetManager rigAssets;
    private final AssetManager assets;

    public PreviewRigRuntime(JmeRigAssetManager rigAssets, AssetManager assets) {
        this.rigAssets = Objects.requireNonNull(rigAssets, "rigAssets");
        this.assets = Objects.requireNonNull(assets, "assets");
    }

    @Override
    public RigInstance instantiate(String skeletonKey, String atlasKey) {
        SkeletonData skeleton = rigAssets.skeleton(skeletonKey);
        LoadedAtlas atlas = rigAssets.atlas(atlasKey);
        return new PreviewRig(skeletonKey, skeleton, atlas, assets);
    }
}
