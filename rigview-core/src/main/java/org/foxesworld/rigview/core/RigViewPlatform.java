package org.foxesworld.rigview.core;

public final class RigViewPlatform {
    public static String java() {
        return System.getProperty("java.version");
    }

    public static String os() {
        return System.getProperty("os.name") + " " + System.getProperty("os.version");
    }

    public static int cpus() {
        return Runtime.getRuntime().availableProcessors();
    }

    private RigViewPlatform() {}
}
