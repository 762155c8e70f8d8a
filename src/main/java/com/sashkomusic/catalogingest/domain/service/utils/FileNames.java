package com.sashkomusic.catalogingest.domain.service.utils;

public final class FileNames {

    private FileNames() {
    }

    public static String extension(String filename) {
        if (filename == null) {
            return "";
        }
        String name = basename(filename);
        int lastDot = name.lastIndexOf('.');
        if (lastDot > 0 && lastDot < name.length() - 1) {
            return name.substring(lastDot + 1).toLowerCase();
        }
        return "";
    }

    public static String stem(String filename) {
        if (filename == null) {
            return "";
        }
        String name = basename(filename);
        int lastDot = name.lastIndexOf('.');
        return lastDot > 0 ? name.substring(0, lastDot) : name;
    }

    public static String basename(String path) {
        if (path == null) {
            return "";
        }
        String normalized = path.replace('\\', '/');
        int lastSlash = normalized.lastIndexOf('/');
        return lastSlash >= 0 ? normalized.substring(lastSlash + 1) : normalized;
    }

    /**
     * Removes characters that are illegal in file names and object keys: / \ : * ? " < > |
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return value.replaceAll("[/\\\\:*?\"<>|]", "")
                .replaceAll("\\s+", " ")
                .trim();
    }
}
