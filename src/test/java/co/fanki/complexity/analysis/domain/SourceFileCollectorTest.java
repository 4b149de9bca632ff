package co.fanki.complexity.analysis.domain;

import co.fanki.complexity.analysis.domain.SourceParser.SourceFileCollector;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link SourceFileCollector}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SourceFileCollectorTest {

    @Test
    void whenVisitFails_givenEntryBelowRoot_shouldSkipItAndKeepCollecting(
            @TempDir final Path root) throws IOException {

        final Path first =
                Files.writeString(root.resolve("B.java"), "class B {}");
        final Path second =
                Files.writeString(root.resolve("A.java"), "class A {}");
        final Path locked = root.resolve("locked");
        final SourceFileCollector collector = new SourceFileCollector(root);

        collector.visitFile(first, attributes(first));
        final FileVisitResult result = collector.visitFileFailed(locked,
                new AccessDeniedException(locked.toString()));
        collector.visitFile(second, attributes(second));

        assertEquals(FileVisitResult.CONTINUE, result);
        assertEquals(List.of(second, first), collector.files());
    }

    @Test
    void whenDirectoryListingFails_givenSubdirectory_shouldContinue(
            @TempDir final Path root) throws IOException {

        final SourceFileCollector collector = new SourceFileCollector(root);

        assertEquals(FileVisitResult.CONTINUE, collector.postVisitDirectory(
                root.resolve("pkg"), new NoSuchFileException("pkg/Gone.java")));
        assertEquals(FileVisitResult.CONTINUE,
                collector.postVisitDirectory(root, null));
    }

    @Test
    void whenVisitFails_givenRoot_shouldRethrow(@TempDir final Path root) {
        final SourceFileCollector collector = new SourceFileCollector(root);

        assertThrows(AccessDeniedException.class,
                () -> collector.visitFileFailed(root,
                        new AccessDeniedException(root.toString())));
        assertThrows(NoSuchFileException.class,
                () -> collector.postVisitDirectory(root,
                        new NoSuchFileException(root.toString())));
    }

    @Test
    void whenVisiting_givenDirectoryEntry_shouldNotCollectIt(
            @TempDir final Path root) throws IOException {

        final Path dir = Files.createDirectories(root.resolve("pkg"));
        final SourceFileCollector collector = new SourceFileCollector(root);

        collector.visitFile(dir, attributes(dir));

        assertEquals(List.of(), collector.files());
    }

    private BasicFileAttributes attributes(final Path path)
            throws IOException {
        return Files.readAttributes(path, BasicFileAttributes.class);
    }

}
