package com.elementcatalog.config;

import com.elementcatalog.model.Scope;
import com.elementcatalog.scan.MetadataHeaderParser;
import com.elementcatalog.scan.YamlFrontmatterParser;
import com.elementcatalog.scope.FilesystemScopeResolver;
import com.elementcatalog.scope.ScopeRootResolver;
import com.elementcatalog.sync.CatalogCodec;
import com.elementcatalog.sync.CatalogSyncer;
import com.elementcatalog.sync.CatalogValidator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the catalog core from {@code catalog.*} properties.
 *
 * Blank root properties mean "use the default": the global root falls back
 * to {@code ~/.claude}, the project root is detected upward from the working
 * directory, and there is no local root.
 */
@Configuration
public class CatalogConfig {

    private static final Logger log = LoggerFactory.getLogger(CatalogConfig.class);

    static final String MANIFEST_DIR_NAME = ".manifest";

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    ScopeRootResolver scopeRootResolver(@Value("${catalog.scope.global-root:}") String globalRoot,
                                        @Value("${catalog.scope.project-root:}") String projectRoot,
                                        @Value("${catalog.scope.local-root:}") String localRoot) {
        return FilesystemScopeResolver.detect(
                Path.of(System.getProperty("user.home")),
                Path.of("").toAbsolutePath(),
                pathOrNull(globalRoot),
                pathOrNull(projectRoot),
                pathOrNull(localRoot));
    }

    @Bean
    MetadataHeaderParser metadataHeaderParser() {
        return new YamlFrontmatterParser();
    }

    @Bean
    CatalogCodec catalogCodec() {
        return new CatalogCodec();
    }

    @Bean
    CatalogValidator catalogValidator() {
        return new CatalogValidator();
    }

    /** Manifests go to the configured directory, else {@code .manifest} under the project or global root. */
    @Bean
    CatalogSyncer catalogSyncer(ScopeRootResolver scopes,
                                CatalogCodec codec,
                                CatalogValidator validator,
                                Clock clock,
                                @Value("${catalog.manifest-dir:}") String manifestDir) {
        Path dir = pathOrNull(manifestDir);
        if (dir == null) {
            Path base = scopes.resolve(Scope.PROJECT)
                    .or(() -> scopes.resolve(Scope.GLOBAL))
                    .orElseThrow(() -> new IllegalStateException("No scope root to place the manifests under"));
            dir = base.resolve(MANIFEST_DIR_NAME);
        }
        log.info("Manifest directory: {}", dir);
        return new CatalogSyncer(dir, codec, validator, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    private static Path pathOrNull(String value) {
        return value == null || value.isBlank() ? null : Path.of(value.trim());
    }
}
