package com.docweaver.core.renderer;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Files making up a generated site, in the order they are delivered.
 *
 * @param files generated files
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    /**
     * Finds a file by its output path.
     *
     * @param relativePath relative output path
     * @return the first file with that path
     */
    public Optional<GeneratedFile> find(String relativePath) {
        return files.stream().filter(file -> file.relativePath().equals(relativePath)).findFirst();
    }

    /**
     * Counts the files copied from disk.
     *
     * @return number of copied files
     */
    public long copyCount() {
        return files.stream().filter(GeneratedFile::isCopy).count();
    }
}
