package org.carball.sascan.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.sascan.model.source.SourceUnit;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resolves an input path to the SAS source units beneath it.
 */
@Slf4j
public class SasSourceScanner {

    private final String extension;

    public SasSourceScanner(String extension) {
        this.extension = extension == null ? "" : extension.toLowerCase(Locale.ROOT);
    }

    /**
     * A regular file is read as-is whatever its extension; a directory is walked recursively and
     * only files carrying the configured extension are read.
     *
     * @throws NoSuchFileException if {@code sourcePath} does not exist
     * @throws IOException if a directory cannot be walked or a matching file cannot be read
     */
    public List<SourceUnit> scan(Path sourcePath) throws IOException {
        if (!Files.exists(sourcePath)) {
            throw new NoSuchFileException(sourcePath.toString());
        }

        if (Files.isRegularFile(sourcePath)) {
            return List.of(read(sourcePath));
        }

        List<Path> files;
        try (Stream<Path> paths = Files.walk(sourcePath)) {
            files = collectSourceFiles(paths);
        }
        log.info("Found {} source files with extension '{}' under {}", files.size(), extension, sourcePath);

        List<SourceUnit> units = new ArrayList<>();
        for (Path file : files) {
            units.add(read(file));
        }
        return units;
    }

    /**
     * Drains a directory walk. Failures the walk reports while descending surface here as their
     * underlying {@link IOException}.
     */
    List<Path> collectSourceFiles(Stream<Path> paths) throws IOException {
        try {
            return paths.filter(Files::isRegularFile)
                    .filter(this::isSourceFile)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    public boolean isSourceFile(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(extension);
    }

    /**
     * Reads one file as UTF-8, retrying as ISO-8859-1 when it holds bytes that are not valid UTF-8.
     */
    public SourceUnit read(Path file) throws IOException {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            log.debug("{} is not valid UTF-8, reading as ISO-8859-1", file);
            text = Files.readString(file, StandardCharsets.ISO_8859_1);
        }
        return new SourceUnit(file.toString(), text);
    }
}
