package com.elementcatalog.scope;

import com.elementcatalog.model.Scope;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Maps a scope to the base directory its elements are installed under.
 *
 * Must be side-effect free. An empty result means the scope is not
 * available in the current environment (e.g. no project checked out).
 */
@FunctionalInterface
public interface ScopeRootResolver {

    Optional<Path> resolve(Scope scope);
}
