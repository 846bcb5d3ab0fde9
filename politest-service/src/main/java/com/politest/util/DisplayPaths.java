package com.politest.util;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

public final class DisplayPaths {

    private DisplayPaths() {
    }

    /**
     * Path relative to the working directory when the file lives below it, otherwise unchanged.
     */
    public static String forDisplay(String filePath) {
        if (filePath == null || filePath.isEmpty()) {
            return "";
        }
        try {
            Path file = Paths.get(filePath).toAbsolutePath().normalize();
            Path workingDir = Paths.get("").toAbsolutePath().normalize();
            if (file.startsWith(workingDir) && !file.equals(workingDir)) {
                return workingDir.relativize(file).toString();
            }
            return filePath;
        } catch (InvalidPathException e) {
            return filePath;
        }
    }
}
