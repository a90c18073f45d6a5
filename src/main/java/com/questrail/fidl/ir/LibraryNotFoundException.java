package com.questrail.fidl.ir;

import java.nio.file.Path;

/**
 * Raised when no IR document exists for a requested library.
 *
 * <p>The message always names the library and the path that was searched
 * (or the configuration keys, when no search root was configured at all).</p>
 */
public final class LibraryNotFoundException extends DefinitionException
{
    private final String library;
    private final Path searchedPath;

    public LibraryNotFoundException(String library, Path searchedPath) {
        super("Unable to load FIDL library " + library
                + ": no IR found at '" + searchedPath + "'."
                + " Please ensure that the FIDL IR for this library has been created.");
        this.library = library;
        this.searchedPath = searchedPath;
    }

    public LibraryNotFoundException(String library, String reason) {
        super("Unable to load FIDL library " + library + ": " + reason);
        this.library = library;
        this.searchedPath = null;
    }

    public String library() {
        return library;
    }

    /**
     * @return the path that was probed, or {@code null} if no path could be derived
     */
    public Path searchedPath() {
        return searchedPath;
    }
}
