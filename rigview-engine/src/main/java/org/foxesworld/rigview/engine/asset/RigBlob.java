package org.foxesworld.rigview.engine.asset;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Named byte source handed in by the user (picked file or in-memory data).
 * Reads may block; callers keep them off the render thread.
 */
public interface RigBlob {

    String name();

    long size();

    long lastModified();

    byte[] read() throws IOException;

    /** Lower-cased extension without the dot, or an empty string. */
    default String extension() {
        String n = name();
        int dot = n.lastIndexOf('.');
        return (dot < 0 || dot == n.length() - 1) ? "" : n.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /** Name without its last extension ({@code "page1.png" -> "page1"}). */
    default String stem() {
        String n = name();
        int dot = n.lastIndexOf('.');
        return dot <= 0 ? n : n.substring(0, dot);
    }

    static RigBlob of(String name, byte[] data) {
        return new Bytes(name, data, 0L);
    }

    static RigBlob of(String name, byte[] data, long lastModified) {
        return new Bytes(name, data, lastModified);
    }

    static RigBlob of(Path file) {
        return new FileBlob(file);
    }

    final class Bytes implements RigBlob {
        private final String name;
        private final byte[] data;
        private final long lastModified;

        private Bytes(String name, byte[] data, long lastModified) {
            this.name = Objects.requireNonNull(name, "name");
            this.data = Objects.requireNonNull(data, "data").clone();
            this.lastModified = lastModified;
        }

        @Override public String name() { return name; }
        @Override public long size() { return data.length; }
        @Override public long lastModified() { return lastModified; }
        @Override public byte[] read() { return data.clone(); }

        @Override
        public String toString() {
            return "RigBlob[" + name + ", " + data.length + " bytes]";
        }
    }

    final class FileBlob implements RigBlob {
        private final Path file;

        private FileBlob(Path file) {
            this.file = Objects.requireNonNull(file, "file").toAbsolutePath().normalize();
        }

        public Path path() { return file; }

        @Override public String name() { return file.getFileName().toString(); }

        @Override
        public long size() {
            try {
                return Files.size(file);
            } catch (IOException e) {
                return -1L;
            }
        }

        @Override
        public long lastModified() {
            try {
                return Files.getLastModifiedTime(file).toMillis();
            } catch (IOException e) {
                return -1L;
            }
        }

        @Override public byte[] read() throws IOException { return Files.readAllBytes(file); }

        @Override
        public String toString() {
            return "RigBlob[" + file + "]";
        }
    }
}
