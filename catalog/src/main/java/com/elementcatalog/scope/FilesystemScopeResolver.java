package com.elementcatalog.scope;

import com.elementcatalog.model.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Default {@link ScopeRootResolver}: fixed roots decided once at construction.
 *
 * <ul>
 *   <li>global  - {@code ~/.claude} unless configured otherwise</li>
 *   <li>project - the {@code .claude} directory of the nearest ancestor of the
 *       working directory that has one (the home directory itself is skipped,
 *       its {@code .claude} is the global root)</li>
 *   <li>local   - only when configured explicitly</li>
 * </ul>
 */
public class FilesystemScopeResolver implements ScopeRootResolver {

    private static final Logger log = LoggerFactory.getLogger(FilesystemScopeResolver.class);

    public static final String SCOPE_DIR_NAME = ".claude";

    private final Map<Scope, Path> roots = new EnumMap<>(Scope.class);

    public FilesystemScopeResolver(Path globalRoot, Path projectRoot, Path localRoot) {
        put(Scope.GLOBAL,  globalRoot);
        put(Scope.PROJECT, projectRoot);
        put(Scope.LOCAL,   localRoot);
        log.debug("Scope roots: {}", roots);
    }

    /**
     * Resolver for the usual layout. A non-null root argument wins over the
     * default for its scope; the project root is otherwise detected upward
     * from {@code workingDir}.
     */
    public static FilesystemScopeResolver detect(Path home, Path workingDir,
                                                 Path globalRoot, Path projectRoot, Path localRoot) {
        Path global = globalRoot != null ? globalRoot : home.resolve(SCOPE_DIR_NAME);
        Path project = projectRoot != null ? projectRoot : detectProjectRoot(home, workingDir).orElse(null);
        return new FilesystemScopeResolver(global, project, localRoot);
    }

    /**
     * Walks from {@code workingDir} towards the filesystem root and returns
     * the first {@code .claude} directory found, stopping before {@code home}.
     */
    public static Optional<Path> detectProjectRoot(Path home, Path workingDir) {
        Path normalizedHome = home.toAbsolutePath().normalize();
        for (Path dir = workingDir.toAbsolutePath().normalize(); dir != null; dir = dir.getParent()) {
            if (dir.equals(normalizedHome)) {
                break;
            }
            Path candidate = dir.resolve(SCOPE_DIR_NAME);
            if (Files.isDirectory(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<Path> resolve(Scope scope) {
        return Optional.ofNullable(roots.get(scope));
    }

    private void put(Scope scope, Path root) {
        if (root != null) {
            roots.put(scope, root.toAbsolutePath().normalize());
        }
    }
}
