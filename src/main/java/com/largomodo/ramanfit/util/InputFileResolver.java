package com.largomodo.ramanfit.util;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Expands command-line arguments into spectrum files.
 * <p>
 * An argument naming an existing regular file is taken as-is. Anything else is a glob matched
 * against the file names of its parent directory (the base directory if it has none), so
 * {@code *.txt} works even where no shell expanded it. Directories never match.
 * <p>
 * Output is de-duplicated and sorted by path for a deterministic processing order.
 */
public class InputFileResolver {

    private final Path baseDir;

    public InputFileResolver(Path baseDir) {
        if (baseDir == null) {
            throw new IllegalArgumentException("baseDir must not be null");
        }
        this.baseDir = baseDir;
    }

    /**
     * @param arguments file names or glob patterns
     * @return matching regular files, sorted; arguments that match nothing contribute nothing
     * @throws IOException if a directory to be scanned cannot be listed
     */
    public List<Path> resolve(List<String> arguments) throws IOException {
        Set<Path> files = new TreeSet<>();
        for (String argument : arguments) {
            Path literal = baseDir.resolve(argument).normalize();
            if (Files.isRegularFile(literal)) {
                files.add(literal);
                continue;
            }
            Path parent = literal.getParent() != null ? literal.getParent() : baseDir;
            if (!Files.isDirectory(parent) || literal.getFileName() == null) {
                continue;
            }
            String pattern = literal.getFileName().toString();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(parent, pattern)) {
                for (Path candidate : stream) {
                    if (Files.isRegularFile(candidate)) {
                        files.add(candidate.normalize());
                    }
                }
            }
        }
        return new ArrayList<>(files);
    }
}
