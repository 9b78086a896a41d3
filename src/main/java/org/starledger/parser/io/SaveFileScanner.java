package org.starledger.parser.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds save files below a save directory and assigns each to a series.
 * <p>
 * The series of a save file is the name of its parent directory. Directories whose name starts with
 * {@code mp} hold multiplayer backups and are ignored.
 */
public final class SaveFileScanner {

    private static final Logger log = LoggerFactory.getLogger(SaveFileScanner.class);

    static final String SAVE_EXTENSION = ".sav";

    /**
     * A save file and the series it belongs to.
     *
     * @param file   The save file.
     * @param series The series name.
     */
    public record SaveFile(Path file, String series) {}

    private final String seriesPrefix;
    private final String nameFilter;
    private final int readEveryNth;

    /**
     * Creates a scanner from the {@code starledger.import} configuration block.
     *
     * @param options Config with {@code series-prefix}, {@code save-name-filter} and {@code read-every-nth}.
     */
    public SaveFileScanner(Config options) {
        this(options.hasPath("series-prefix") ? options.getString("series-prefix") : "",
                options.hasPath("save-name-filter") ? options.getString("save-name-filter") : "",
                options.hasPath("read-every-nth") ? options.getInt("read-every-nth") : 1);
    }

    public SaveFileScanner(String seriesPrefix, String nameFilter, int readEveryNth) {
        if (readEveryNth < 1) {
            throw new IllegalArgumentException("read-every-nth must be at least 1, got " + readEveryNth);
        }
        this.seriesPrefix = seriesPrefix;
        this.nameFilter = nameFilter.toLowerCase(Locale.ROOT);
        this.readEveryNth = readEveryNth;
    }

    /**
     * Scans {@code saveDirectory} recursively.
     *
     * @param saveDirectory The root directory.
     * @return The matching save files, ordered by path.
     * @throws IOException If the directory cannot be walked.
     */
    public List<SaveFile> scan(Path saveDirectory) throws IOException {
        if (!Files.isDirectory(saveDirectory)) {
            throw new IOException("Save directory does not exist: " + saveDirectory.toAbsolutePath());
        }
        List<Path> files;
        try (Stream<Path> walk = Files.walk(saveDirectory)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(SAVE_EXTENSION))
                    .filter(p -> p.getParent() != null && !seriesOf(p).startsWith("mp"))
                    .filter(p -> seriesOf(p).startsWith(seriesPrefix))
                    .sorted()
                    .collect(Collectors.toList());
        }
        int found = files.size();

        if (!nameFilter.isEmpty()) {
            files = files.stream()
                    .filter(p -> stem(p).toLowerCase(Locale.ROOT).contains(nameFilter))
                    .collect(Collectors.toList());
            log.info("Applying file name filter '{}', reduced from {} to {} files", nameFilter, found, files.size());
        }

        List<SaveFile> result = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            if (i % readEveryNth != 0) {
                continue;
            }
            Path file = files.get(i);
            result.add(new SaveFile(file, seriesOf(file)));
        }
        if (readEveryNth > 1) {
            log.info("Reduced to {} files by reading every {}. file", result.size(), readEveryNth);
        }
        log.debug("Found {} save files below {}", result.size(), saveDirectory);
        return result;
    }

    private static String seriesOf(Path file) {
        return file.getParent().getFileName().toString();
    }

    private static String stem(Path file) {
        String name = file.getFileName().toString();
        return name.substring(0, name.length() - SAVE_EXTENSION.length());
    }
}
