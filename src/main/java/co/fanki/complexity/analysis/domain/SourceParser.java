package co.fanki.complexity.analysis.domain;

import co.fanki.complexity.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Abstract front end turning source files of one language into
 * {@link SyntaxTree}s.
 *
 * <p>Subclasses decide which files they understand and how to map their
 * parser's tree onto the {@link SyntaxKind} vocabulary. File enumeration
 * is shared: it lists every regular file and leaves filtering to
 * {@link #accepts(Path)}.</p>
 *
 * <p>Implementations must be safe to call from several threads at once;
 * the ranking service parses files in parallel.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public abstract class SourceParser {

    private static final Logger LOG = LoggerFactory.getLogger(
            SourceParser.class);

    /**
     * Returns the language identifier for this parser.
     *
     * @return the language name (e.g., "java")
     */
    public abstract String language();

    /**
     * Checks whether this parser understands the given file.
     *
     * @param file the candidate file
     * @return true if {@link #parse(Path)} should be called for it
     */
    public abstract boolean accepts(Path file);

    /**
     * Parses one source file.
     *
     * @param file the file to parse
     * @return the syntax tree of the file
     * @throws IOException if the file cannot be read
     * @throws SourceParseException if the content is not valid source
     */
    public abstract SyntaxTree parse(Path file)
            throws IOException, SourceParseException;

    /**
     * Lists every regular file under a root directory, sorted by path.
     *
     * <p>Entries below the root that cannot be read are logged and
     * skipped together with their subtree.</p>
     *
     * @param root the root directory, must exist
     * @param recursive whether to descend into subdirectories
     * @return the regular files, accepted or not
     * @throws IOException if the root itself cannot be read
     */
    public List<Path> enumerateFiles(final Path root, final boolean recursive)
            throws IOException {
        Preconditions.requireDirectory(root, "Source root not found");

        final SourceFileCollector collector = new SourceFileCollector(root);
        Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class),
                recursive ? Integer.MAX_VALUE : 1, collector);

        final List<Path> files = collector.files();
        LOG.debug("Enumerated {} files under {}", files.size(), root);
        return files;
    }

    /**
     * Collects regular files during a tree walk. A failure on the root is
     * rethrown; a failure anywhere below it only drops that entry.
     */
    static final class SourceFileCollector extends SimpleFileVisitor<Path> {

        private final Path root;

        private final List<Path> files = new ArrayList<>();

        SourceFileCollector(final Path theRoot) {
            this.root = theRoot;
        }

        @Override
        public FileVisitResult visitFile(final Path file,
                final BasicFileAttributes attributes) {
            if (Files.isRegularFile(file)) {
                files.add(file);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(final Path file,
                final IOException e) throws IOException {
            return skip(file, e);
        }

        @Override
        public FileVisitResult postVisitDirectory(final Path dir,
                final IOException e) throws IOException {
            return e == null ? FileVisitResult.CONTINUE : skip(dir, e);
        }

        List<Path> files() {
            return files.stream().sorted().toList();
        }

        private FileVisitResult skip(final Path path, final IOException e)
                throws IOException {
            if (path.equals(root)) {
                throw e;
            }
            LOG.warn("Skipping unreadable {}: {}", path, e.toString());
            return FileVisitResult.CONTINUE;
        }
    }

}
