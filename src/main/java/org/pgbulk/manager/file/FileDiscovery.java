package org.pgbulk.manager.file;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOCase;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Finds the input files of a load under a directory, matching a wildcard pattern
 * ({@code *} and {@code ?}) against each file's path relative to that directory.
 * <p>
 * Wildcards never cross a {@code /}: {@code *.csv} only matches files directly in the
 * directory, {@code 2024/*.csv} only files in its {@code 2024} subdirectory.
 */
public final class FileDiscovery {

    private static final Logger LOG = LogManager.getLogger(FileDiscovery.class.getName());

    private FileDiscovery() {
    }

    /**
     * @return absolute paths of the matching regular files, sorted; empty when the directory
     * does not exist
     */
    public static List<Path> find(Path directory, String pattern) {
        if (!Files.isDirectory(directory)) {
            LOG.warn("Source directory {} does not exist or is not a directory", directory);
            return List.of();
        }
        Path root = directory.toAbsolutePath().normalize();
        String wildcard = pattern == null || pattern.isEmpty() ? "*" : FilenameUtils.separatorsToUnix(pattern);
        String[] patternSegments = wildcard.split("/");

        List<Path> files = FileUtils.listFiles(root.toFile(), null, patternSegments.length > 1).stream()
                .map(File::toPath)
                .filter(file -> matches(root, file, patternSegments))
                .map(Path::toAbsolutePath)
                .sorted()
                .collect(Collectors.toList());

        LOG.debug("Found {} files in {} matching '{}'", files.size(), root, wildcard);
        return files;
    }

    private static boolean matches(Path root, Path file, String[] patternSegments) {
        String[] segments = FilenameUtils.separatorsToUnix(root.relativize(file).toString()).split("/");
        if (segments.length != patternSegments.length) return false;
        for (int i = 0; i < segments.length; i++) {
            if (!FilenameUtils.wildcardMatch(segments[i], patternSegments[i], IOCase.SENSITIVE)) return false;
        }
        return true;
    }
}
