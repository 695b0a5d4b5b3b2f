package com.fileprovider.provider.registry;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Builds the base name index of a configuration directory.
 *
 * <p>Only regular files directly inside the directory are considered;
 * subdirectories are skipped. A file is eligible when its name ends with one of
 * the recognized extensions, compared case-insensitively, so {@code db.conf}
 * and {@code db.CONF} (or {@code db.json}) collide on base name {@code db}.</p>
 */
public class DirectoryScanner {

    private final List<String> extensions;

    /**
     * @param extensions recognized file extensions including the leading dot
     */
    public DirectoryScanner(List<String> extensions) {
        if (extensions.isEmpty()) {
            throw new IllegalArgumentException("At least one file extension is required");
        }
        this.extensions = extensions.stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .toList();
    }

    /**
     * Index the eligible files of a directory.
     *
     * @param directory the directory to scan
     * @return base name to absolute path, never empty
     * @throws DirectoryScanException if the directory cannot be read, two files share
     *                                a base name, or no eligible file exists
     */
    public SortedMap<String, Path> scan(Path directory) throws DirectoryScanException {
        SortedMap<String, Path> files = new TreeMap<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
            for (Path entry : entries) {
                if (!Files.isRegularFile(entry)) {
                    continue;
                }
                String fileName = entry.getFileName().toString();
                String extension = matchExtension(fileName);
                if (extension == null) {
                    continue;
                }
                String baseName = fileName.substring(0, fileName.length() - extension.length());
                if (files.containsKey(baseName)) {
                    throw new DirectoryScanException(String.format(
                            "duplicate file base name \"%s\" in directory \"%s\"", baseName, directory));
                }
                files.put(baseName, entry.toAbsolutePath());
            }
        } catch (IOException e) {
            throw new DirectoryScanException(String.format(
                    "failed to read directory \"%s\": %s", directory, e.getMessage()), e);
        }

        if (files.isEmpty()) {
            throw new DirectoryScanException(String.format(
                    "no configuration files (%s) found in directory \"%s\"",
                    String.join(", ", extensions), directory));
        }
        return files;
    }

    private String matchExtension(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (String extension : extensions) {
            if (lower.endsWith(extension) && lower.length() > extension.length()) {
                return extension;
            }
        }
        return null;
    }
}
