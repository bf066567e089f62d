package org.foxesworld.rigview.core;

public final class RigViewVersion {

    public static final String NAME = "RigView";
    public static final String VERSION = resolveVersion();

    private RigViewVersion() {}

    private static String resolveVersion() {
        Package p = RigViewVersion.class.getPackage();
        String v = (p != null) ? p.getImplementationVersion() : null;
        return (v == null || v.isBlank()) ? "dev" : v;
    }
}
