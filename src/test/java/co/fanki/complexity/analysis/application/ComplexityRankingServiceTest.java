package co.fanki.complexity.analysis.application;

import co.fanki.complexity.analysis.domain.Metric;
import co.fanki.complexity.analysis.domain.ScoredResult;
import co.fanki.complexity.analysis.domain.SourceParseException;
import co.fanki.complexity.analysis.domain.SourceParser;
import co.fanki.complexity.analysis.domain.java.JavaSourceParser;
import co.fanki.complexity.shared.DomainException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ComplexityRankingService}.
 *
 * <p>Runs the full pipeline against Java sources written to temporary
 * directories.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ComplexityRankingServiceTest {

    private final ComplexityRankingService service =
            new ComplexityRankingService(new JavaSourceParser(), 4, true);

    @Test
    void whenRankingByStatements_givenTwoFiles_shouldOrderByCount(
            @TempDir final Path root) throws IOException {

        write(root, "Small.java", """
                class Small {
                    void one() {
                        step();
                    }
                    void step() {
                        one();
                        one();
                    }
                }
                """);
        write(root, "Large.java", """
                class Large {
                    void many() {
                        int a = 1;
                        a++;
                        a--;
                        System.out.println(a);
                    }
                }
                """);

        final List<ScoredResult> ranked =
                service.rankByStatementCount(root, 100);

        assertEquals(List.of(
                new ScoredResult("Large.java", 2, 4),
                new ScoredResult("Small.java", 5, 2),
                new ScoredResult("Small.java", 2, 1)), ranked);
    }

    @Test
    void whenRankingByNesting_givenDeepMethod_shouldRankItFirst(
            @TempDir final Path root) throws IOException {

        write(root, "Deep.java", """
                class Deep {
                    void flat() {
                        flat();
                    }
                    void deep(boolean a, boolean b, boolean c) {
                        if (a) {
                            if (b) {
                                while (c) {
                                    flat();
                                }
                            }
                        }
                    }
                }
                """);

        final List<ScoredResult> ranked =
                service.rankByNestingDepth(root, 100);

        assertEquals(List.of(
                new ScoredResult("Deep.java", 5, 3),
                new ScoredResult("Deep.java", 2, 0)), ranked);
    }

    @Test
    void whenRanking_givenEqualValues_shouldBreakTieByFileThenLine(
            @TempDir final Path root) throws IOException {

        write(root, "B.java", "\n".repeat(9) + """
                class B {
                    void b() {
                        b();
                    }
                }
                """);
        write(root, "A.java", "\n".repeat(4) + """
                class A {
                    void a() {
                        a();
                    }
                }
                """);

        final List<ScoredResult> ranked =
                service.rankByStatementCount(root, 100);

        assertEquals(List.of(
                new ScoredResult("A.java", 6, 1),
                new ScoredResult("B.java", 11, 1)), ranked);
    }

    @Test
    void whenRanking_givenMoreMembersThanLimit_shouldTruncate(
            @TempDir final Path root) throws IOException {

        final StringBuilder source = new StringBuilder("class Many {\n");
        for (int i = 0; i < 30; i++) {
            source.append("    void m").append(i).append("() { m")
                    .append(i).append("(); }\n");
        }
        source.append("}\n");
        write(root, "Many.java", source.toString());

        assertEquals(5, service.rankByStatementCount(root, 5).size());
        assertEquals(30, service.rankByStatementCount(root, 100).size());
    }

    @Test
    void whenRanking_givenBrokenFile_shouldSkipItAndRankTheRest(
            @TempDir final Path root) throws IOException {

        write(root, "Broken.java", "class Broken { void x( { }");
        write(root, "Fine.java", """
                class Fine {
                    void run() {
                        run();
                    }
                }
                """);

        final RankingReport report = service.rankAll(root, 100);

        assertEquals(2, report.scannedFiles());
        assertEquals(1, report.failedFiles());
        assertEquals(List.of(new ScoredResult("Fine.java", 2, 1)),
                report.statementCount());
        assertEquals(List.of(new ScoredResult("Fine.java", 2, 0)),
                report.nestingDepth());
    }

    @Test
    void whenRanking_givenTypeWithoutMembers_shouldSucceed(
            @TempDir final Path root) throws IOException {

        write(root, "Dto.java", """
                class Dto {
                    private String name;
                    abstract static class Base {
                        abstract void run();
                    }
                }
                """);

        final RankingReport report = service.rankAll(root, 100);

        assertTrue(report.statementCount().isEmpty());
        assertTrue(report.nestingDepth().isEmpty());
        assertEquals(0, report.failedFiles());
    }

    @Test
    void whenRanking_givenEmptyDirectory_shouldReturnEmpty(
            @TempDir final Path root) {

        assertTrue(service.rankByNestingDepth(root, 100).isEmpty());
    }

    @Test
    void whenRanking_givenNonJavaFiles_shouldIgnoreThem(
            @TempDir final Path root) throws IOException {

        write(root, "Program.cs", "class Program { void Main() { Run(); } }");
        write(root, "README.md", "# readme");

        final RankingReport report = service.rankAll(root, 100);

        assertEquals(0, report.scannedFiles());
        assertTrue(report.statementCount().isEmpty());
    }

    @Test
    void whenRanking_givenSubdirectories_shouldHonorRecursiveFlag(
            @TempDir final Path root) throws IOException {

        Files.createDirectories(root.resolve("pkg"));
        write(root, "pkg/Inner.java", """
                class Inner {
                    void run() {
                        run();
                    }
                }
                """);

        final ComplexityRankingService topLevelOnly =
                new ComplexityRankingService(new JavaSourceParser(), 2, false);

        assertEquals(1, service.rankByStatementCount(root, 100).size());
        assertTrue(topLevelOnly.rankByStatementCount(root, 100).isEmpty());
    }

    @Test
    void whenRanking_givenDifferentParallelism_shouldProduceSameOutput(
            @TempDir final Path root) throws IOException {

        for (int f = 0; f < 12; f++) {
            final StringBuilder source = new StringBuilder();
            source.append("class C").append(f).append(" {\n");
            for (int m = 0; m < 6; m++) {
                source.append("    void m").append(m).append("(int x) {\n");
                for (int s = 0; s < (f + m) % 4; s++) {
                    source.append("        if (x > ").append(s)
                            .append(") { x--; }\n");
                }
                source.append("    }\n");
            }
            source.append("}\n");
            write(root, "C" + f + ".java", source.toString());
        }

        final ComplexityRankingService sequential =
                new ComplexityRankingService(new JavaSourceParser(), 1, true);
        final ComplexityRankingService parallel =
                new ComplexityRankingService(new JavaSourceParser(), 8, true);

        final RankingReport expected = sequential.rankAll(root, 20);
        final RankingReport actual = parallel.rankAll(root, 20);

        assertEquals(20, expected.statementCount().size());
        assertEquals(expected.statementCount(), actual.statementCount());
        assertEquals(expected.nestingDepth(), actual.nestingDepth());
    }

    @Test
    void whenRankingOneMetric_givenSingleMember_shouldReturnIt(
            @TempDir final Path root) throws IOException {

        write(root, "One.java", """
                class One {
                    void run() {
                        run();
                    }
                }
                """);

        assertEquals(1, service.rank(root, Metric.NESTING_DEPTH, 10).size());
    }

    @Test
    void whenRanking_givenMissingRoot_shouldThrowDomainException(
            @TempDir final Path root) {

        final DomainException e = assertThrows(DomainException.class,
                () -> service.rankByStatementCount(
                        root.resolve("missing"), 100));

        assertEquals(DomainException.SOURCE_ROOT_NOT_FOUND, e.getErrorCode());
    }

    @Test
    void whenRanking_givenUnreadableRoot_shouldThrowDomainException()
            throws IOException {

        final SourceParser sourceParser = mock(SourceParser.class);
        when(sourceParser.language()).thenReturn("java");
        when(sourceParser.enumerateFiles(any(Path.class), anyBoolean()))
                .thenThrow(new IOException("permission denied"));

        final ComplexityRankingService failing =
                new ComplexityRankingService(sourceParser, 1, true);

        final DomainException e = assertThrows(DomainException.class,
                () -> failing.rankAll(Path.of("/src"), 100));

        assertEquals(DomainException.SOURCE_ROOT_UNREADABLE, e.getErrorCode());
    }

    @Test
    void whenRanking_givenParserCrash_shouldSkipFile() throws Exception {
        final Path file = Path.of("/src/Crash.java");
        final SourceParser sourceParser = mock(SourceParser.class);
        when(sourceParser.language()).thenReturn("java");
        when(sourceParser.enumerateFiles(any(Path.class), anyBoolean()))
                .thenReturn(List.of(file));
        when(sourceParser.accepts(file)).thenReturn(true);
        when(sourceParser.parse(file))
                .thenThrow(new IllegalStateException("boom"));

        final RankingReport report = new ComplexityRankingService(
                sourceParser, 1, true).rankAll(Path.of("/src"), 100);

        assertEquals(1, report.failedFiles());
        assertTrue(report.statementCount().isEmpty());
    }

    @Test
    void whenRanking_givenParseException_shouldCountFailure() throws Exception {
        final Path file = Path.of("/src/Bad.java");
        final SourceParser sourceParser = mock(SourceParser.class);
        when(sourceParser.language()).thenReturn("java");
        when(sourceParser.enumerateFiles(any(Path.class), anyBoolean()))
                .thenReturn(List.of(file));
        when(sourceParser.accepts(file)).thenReturn(true);
        when(sourceParser.parse(file))
                .thenThrow(new SourceParseException(file, "unexpected token"));

        final RankingReport report = new ComplexityRankingService(
                sourceParser, 1, true).rankAll(Path.of("/src"), 100);

        assertEquals(1, report.scannedFiles());
        assertEquals(1, report.failedFiles());
    }

    @Test
    void whenCreating_givenNegativeParallelism_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> new ComplexityRankingService(
                        new JavaSourceParser(), -1, true));
    }

    private void write(final Path root, final String name,
            final String source) throws IOException {
        Files.writeString(root.resolve(name), source);
    }

}
