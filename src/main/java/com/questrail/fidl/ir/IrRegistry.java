package com.questrail.fidl.ir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.fidl.config.IrPathConfig;
import com.questrail.fidl.observability.BindingObservabilitySink;
import com.questrail.fidl.observability.BindingProtocolEvent;
import com.questrail.fidl.observability.NullObservabilitySink;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * IrRegistry
 * =============================================================================
 * Loads and caches IR documents, one per library.
 *
 * <h2>Identity guarantee</h2>
 * Repeated loads of the same library return the <em>same</em>
 * {@link IrLibrary} instance. Compiled declarations hang off these instances,
 * so identity has to be stable for the life of the registry.
 *
 * <h2>Cache key</h2>
 * Documents are cached by their resolved, normalized path. A document must
 * declare the library it was loaded for.
 *
 * <h2>Thread Safety</h2>
 * Safe for concurrent use; each path is parsed at most once.
 */
public final class IrRegistry
{
    private final IrPathConfig config;
    private final ObjectMapper mapper;
    private final BindingObservabilitySink observabilitySink;

    private final Map<Path, IrLibrary> documents = new ConcurrentHashMap<>();

    public IrRegistry(IrPathConfig config, BindingObservabilitySink observabilitySink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.mapper = new ObjectMapper();
    }

    public IrRegistry(IrPathConfig config)
    {
        this(config, null);
    }

    /**
     * Loads the IR document for a library, parsing it on first use.
     *
     * @param library library name, e.g. {@code fuchsia.io}
     * @throws LibraryNotFoundException if no document exists for the library
     * @throws IrFormatException if the document cannot be parsed
     */
    public IrLibrary load(String library)
    {
        Objects.requireNonNull(library, "library");
        Path path = config.resolve(library)
                .orElseThrow(() -> new LibraryNotFoundException(library,
                        "no IR path configured (set the '" + IrPathConfig.IR_PATH_PROPERTY
                                + "' property or the " + IrPathConfig.IR_PATH_ENV
                                + " environment variable)"))
                .toAbsolutePath()
                .normalize();

        IrLibrary cached = documents.get(path);
        if (cached != null) {
            return cached;
        }
        if (!Files.isRegularFile(path)) {
            throw new LibraryNotFoundException(library, path);
        }
        return documents.computeIfAbsent(path, p -> parse(library, p));
    }

    /**
     * @return whether a document for the library has already been parsed
     */
    public boolean isLoaded(String library)
    {
        return config.resolve(library)
                .map(p -> documents.containsKey(p.toAbsolutePath().normalize()))
                .orElse(false);
    }

    private IrLibrary parse(String library, Path path)
    {
        JsonNode root;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            root = mapper.readTree(reader);
        }
        catch (IOException e) {
            throw new IrFormatException("Unable to read IR for library " + library + " at " + path, e);
        }
        if (root == null || !root.isObject()) {
            throw new IrFormatException("IR for library " + library + " at " + path + " is not a JSON object");
        }

        IrLibrary document = new IrLibrary(path, root);
        if (!library.equals(document.libraryName())) {
            throw new IrFormatException("IR at " + path + " declares library "
                    + document.libraryName() + ", expected " + library);
        }
        observabilitySink.onProtocolEvent(
                BindingProtocolEvent.of(Instant.now(), library, BindingProtocolEvent.Kind.LIBRARY_LOADED));
        return document;
    }
}
