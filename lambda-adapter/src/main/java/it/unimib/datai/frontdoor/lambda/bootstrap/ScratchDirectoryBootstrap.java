package it.unimib.datai.frontdoor.lambda.bootstrap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Creates the writable scratch directories the application expects (on Lambda only
 * {@code /tmp} is writable). Must run before the handler is built, since service setup
 * may already write there.
 */
public final class ScratchDirectoryBootstrap {
    private static final Logger log = LoggerFactory.getLogger(ScratchDirectoryBootstrap.class);

    public static final String SCRATCH_DIRECTORIES_ENV = "SCRATCH_DIRECTORIES";

    private final List<Path> directories;

    public ScratchDirectoryBootstrap(List<Path> directories) {
        this.directories = directories == null ? List.of() : List.copyOf(directories);
    }

    /**
     * Directories listed in {@value #SCRATCH_DIRECTORIES_ENV} (comma separated), or
     * {@code defaults} when the variable is unset or blank.
     */
    public static ScratchDirectoryBootstrap fromEnvironment(List<Path> defaults) {
        List<Path> fromEnv = parse(System.getenv(SCRATCH_DIRECTORIES_ENV));
        return new ScratchDirectoryBootstrap(fromEnv.isEmpty() ? defaults : fromEnv);
    }

    static List<Path> parse(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .map(Path::of)
                .toList();
    }

    /**
     * Creates every directory, parents included. Existing directories are left alone.
     *
     * @throws BootstrapException if a directory cannot be created
     */
    public List<Path> run() {
        for (Path dir : directories) {
            try {
                Files.createDirectories(dir);
                log.debug("Scratch directory ready: {}", dir);
            } catch (IOException ex) {
                throw new BootstrapException("Unable to create scratch directory " + dir, ex);
            }
        }
        return directories;
    }

    public List<Path> directories() {
        return directories;
    }
}
