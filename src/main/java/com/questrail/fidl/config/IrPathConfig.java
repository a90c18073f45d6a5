package com.questrail.fidl.config;

import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Where IR documents are found.
 *
 * <p>The IR producer writes one document per library under a common root:
 * {@code <root>/<library>/<library>.fidl.json}. Individual libraries may be
 * mapped to explicit files, which take precedence over the root.</p>
 */
public record IrPathConfig(
    Path root,
    Map<String, Path> libraryPaths
) {
    /** System property naming the IR root. */
    public static final String IR_PATH_PROPERTY = "fidl.ir.path";

    /** Environment variable naming the IR root, consulted after the property. */
    public static final String IR_PATH_ENV = "FIDL_IR_PATH";

    public static final String IR_FILE_SUFFIX = ".fidl.json";

    public IrPathConfig {
        libraryPaths = Collections.unmodifiableMap(new HashMap<>(
                Objects.requireNonNull(libraryPaths, "libraryPaths")));
    }

    /**
     * Resolves the document path for a library.
     *
     * @return the override or the root-derived path; empty if neither is configured
     */
    public Optional<Path> resolve(String library) {
        Path explicit = libraryPaths.get(library);
        if (explicit != null) {
            return Optional.of(explicit);
        }
        if (root == null) {
            return Optional.empty();
        }
        return Optional.of(root.resolve(library).resolve(library + IR_FILE_SUFFIX));
    }

    /**
     * Configuration from the {@value #IR_PATH_PROPERTY} system property, falling
     * back to the {@value #IR_PATH_ENV} environment variable.
     */
    public static IrPathConfig fromEnvironment() {
        Builder builder = builder();
        String configured = System.getProperty(IR_PATH_PROPERTY);
        if (configured == null || configured.isBlank()) {
            configured = System.getenv(IR_PATH_ENV);
        }
        if (configured != null && !configured.isBlank()) {
            builder.withRoot(Path.of(configured));
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path root;
        private final Map<String, Path> libraryPaths = new HashMap<>();

        public Builder withRoot(Path root) {
            this.root = root;
            return this;
        }

        public Builder withLibraryPath(String library, Path path) {
            libraryPaths.put(Objects.requireNonNull(library, "library"), Objects.requireNonNull(path, "path"));
            return this;
        }

        public IrPathConfig build() {
            return new IrPathConfig(root, libraryPaths);
        }
    }
}
