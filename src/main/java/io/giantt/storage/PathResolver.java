package io.giantt.storage;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;

public final class PathResolver {
    private static final String RESERVED = "<>:\"/\\|?*";

    private PathResolver() {
    }

    /**
     * Converts either separator to the host one and collapses repeated separators.
     */
    public static String normalize(String path) {
        return normalize(path, File.separatorChar);
    }

    static String normalize(String path, char separator) {
        if (path == null || path.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(path.length());
        boolean leadingUnc = separator == '\\' && (path.startsWith("\\\\") || path.startsWith("//"));
        if (leadingUnc) {
            sb.append(separator).append(separator);
        }
        char previous = 0;
        for (int i = leadingUnc ? 2 : 0; i < path.length(); i++) {
            char ch = path.charAt(i);
            if (ch == '/' || ch == '\\') {
                if (previous == separator) {
                    continue;
                }
                ch = separator;
            }
            sb.append(ch);
            previous = ch;
        }
        return sb.toString();
    }

    public static boolean isAbsolute(String path) {
        return isAbsolute(path, File.separatorChar == '\\');
    }

    static boolean isAbsolute(String path, boolean windows) {
        if (path == null || path.isEmpty()) {
            return false;
        }
        if (windows) {
            boolean drive = path.length() >= 3
                    && Character.isLetter(path.charAt(0))
                    && path.charAt(1) == ':'
                    && (path.charAt(2) == '\\' || path.charAt(2) == '/');
            return drive || path.startsWith("\\\\") || path.startsWith("//");
        }
        return path.startsWith("/");
    }

    /**
     * Resolves an include target against the directory of the file that names it.
     */
    public static Path resolve(Path containingFile, String target) {
        String normalized = normalize(target);
        if (isAbsolute(normalized)) {
            return Paths.get(normalized).normalize();
        }
        Path parent = containingFile.toAbsolutePath().getParent();
        Path base = parent == null ? Paths.get("").toAbsolutePath() : parent;
        return base.resolve(normalized).normalize();
    }

    /**
     * Relative path from one directory to another, '/'-separated, for display.
     */
    public static String relativePath(Path fromDir, Path to) {
        Path from = fromDir.toAbsolutePath().normalize();
        Path target = to.toAbsolutePath().normalize();
        if (from.getRoot() != null && !from.getRoot().equals(target.getRoot())) {
            return target.toString();
        }
        String relative = from.relativize(target).toString();
        if (relative.isEmpty()) {
            return ".";
        }
        return relative.replace(File.separatorChar, '/');
    }

    /**
     * Strips characters reserved on common filesystems and control characters, keeping the rest.
     */
    public static String safeFilename(String name) {
        if (name == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char ch = name.charAt(i);
            if (ch < 0x20 || RESERVED.indexOf(ch) >= 0) {
                continue;
            }
            sb.append(ch);
        }
        return sb.toString();
    }
}
