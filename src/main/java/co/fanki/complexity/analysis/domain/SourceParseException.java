package co.fanki.complexity.analysis.domain;

import java.nio.file.Path;

/**
 * Signals that a single source file could not be turned into a syntax
 * tree. The file is skipped; the run goes on.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SourceParseException extends Exception {

    private static final long serialVersionUID = 1L;

    private final transient Path file;

    /**
     * Creates a new parse exception.
     *
     * @param theFile the file that failed to parse
     * @param message the parser's description of the problem
     */
    public SourceParseException(final Path theFile, final String message) {
        super("Cannot parse " + theFile + ": " + message);
        this.file = theFile;
    }

    /**
     * Returns the file that failed to parse.
     *
     * @return the file path
     */
    public Path getFile() {
        return file;
    }

}
