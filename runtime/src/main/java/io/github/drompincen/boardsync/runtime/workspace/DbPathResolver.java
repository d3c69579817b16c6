package io.github.drompincen.boardsync.runtime.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Locates the database bd uses for a workspace, in order of precedence:
 * an explicit path, {@code BEADS_DB}, the nearest {@code .beads/*.db} walking up
 * from the workspace root, then {@code ~/.beads/default.db}.
 */
public final class DbPathResolver {

    private static final Logger log = LoggerFactory.getLogger(DbPathResolver.class);
    private static final int MAX_DEPTH = 100;

    public enum Source { FLAG, ENV, NEAREST, HOME_DEFAULT }

    public record ResolvedDb(Path path, Source source, boolean exists) {}

    private DbPathResolver() {
    }

    public static ResolvedDb resolve(Path cwd, Map<String, String> env, String explicitDb) {
        Path base = cwd.toAbsolutePath().normalize();

        if (explicitDb != null && !explicitDb.isEmpty()) {
            Path p = base.resolve(explicitDb).normalize();
            return new ResolvedDb(p, Source.FLAG, Files.exists(p));
        }

        String fromEnv = env.get("BEADS_DB");
        if (fromEnv != null && !fromEnv.isEmpty()) {
            Path p = base.resolve(fromEnv).normalize();
            return new ResolvedDb(p, Source.ENV, Files.exists(p));
        }

        Optional<Path> nearest = findNearestBeadsDb(base);
        if (nearest.isPresent()) {
            return new ResolvedDb(nearest.get(), Source.NEAREST, true);
        }

        Path homeDefault = Path.of(System.getProperty("user.home"), ".beads", "default.db");
        return new ResolvedDb(homeDefault, Source.HOME_DEFAULT, Files.exists(homeDefault));
    }

    public static ResolvedDb resolve(Path cwd) {
        return resolve(cwd, System.getenv(), null);
    }

    /**
     * First {@code .db} file (alphabetically) inside the closest {@code .beads} directory.
     */
    static Optional<Path> findNearestBeadsDb(Path start) {
        Path dir = start;
        for (int i = 0; i < MAX_DEPTH && dir != null; i++) {
            Path beadsDir = dir.resolve(".beads");
            if (Files.isDirectory(beadsDir)) {
                try (Stream<Path> entries = Files.list(beadsDir)) {
                    Optional<Path> first = entries
                            .filter(Files::isRegularFile)
                            .filter(p -> p.getFileName().toString().endsWith(".db"))
                            .sorted()
                            .findFirst();
                    if (first.isPresent()) {
                        return first;
                    }
                } catch (IOException e) {
                    log.debug("Unable to list {}: {}", beadsDir, e.getMessage());
                }
            }
            dir = dir.getParent();
        }
        return Optional.empty();
    }
}
