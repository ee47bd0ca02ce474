package com.docweaver.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Lists every regular file below a root directory.
     *
     * <p>Results are sorted by their root-relative path so that enumeration order does not
     * depend on the file system.
     *
     * @param rootPath root directory to search from
     * @return list of matching absolute paths
     * @throws IOException if directory traversal fails
     */
    public static List<Path> listFiles(Path rootPath) throws IOException {
        Path root = rootPath.toAbsolutePath().normalize();
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                .filter(Files::isRegularFile)
                .sorted(Comparator.comparing(path -> toUnixPath(root.relativize(path))))
                .toList();
        }
    }

    /**
     * Converts a path to a string using forward slashes regardless of platform.
     *
     * @param path path to convert
     * @return path string with {@code /} separators
     */
    public static String toUnixPath(Path path) {
        return path.toString().replace('\\', '/');
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }

    /**
     * Gets the file name without its extension.
     *
     * @param path file path
     * @return base name of the file
     */
    public static String getBaseName(Path path) {
        return removeExtension(path.getFileName().toString());
    }

    /**
     * Removes the extension from the last segment of a path string.
     *
     * @param path path string
     * @return path without extension
     */
    public static String removeExtension(String path) {
        int lastSlash = path.lastIndexOf('/');
        int lastDot = path.lastIndexOf('.');
        return lastDot > lastSlash + 1 ? path.substring(0, lastDot) : path;
    }

    /**
     * Reads a file as a string.
     *
     * @param path path to file
     * @return file content as string
     * @throws IOException if reading fails
     */
    public static String readString(Path path) throws IOException {
        return Files.readString(path);
    }
}
