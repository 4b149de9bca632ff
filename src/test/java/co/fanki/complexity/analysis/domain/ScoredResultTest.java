package co.fanki.complexity.analysis.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ScoredResult} and {@link SourceLocation}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ScoredResultTest {

    @Test
    void whenFormatting_shouldSeparateValueAndLocationWithTab() {
        final ScoredResult result = new ScoredResult("Order.java", 42, 17);

        assertEquals("17\tOrder.java:42", result.toReportLine());
    }

    @Test
    void whenComparing_givenHigherValue_shouldRankFirst() {
        final ScoredResult high = new ScoredResult("z.java", 99, 5);
        final ScoredResult low = new ScoredResult("a.java", 1, 4);

        assertTrue(ScoredResult.RANKING_ORDER.compare(high, low) < 0);
    }

    @Test
    void whenCreating_givenNegativeValue_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> new ScoredResult("a.java", 1, -1));
    }

    @Test
    void whenCreating_givenZeroLine_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> new ScoredResult("a.java", 0, 1));
    }

    @Test
    void whenCreating_givenBlankFile_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> new ScoredResult(" ", 1, 1));
    }

    @Test
    void whenResolvingFileName_givenNestedPath_shouldReturnBaseName() {
        final SourceLocation location = new SourceLocation(
                "/repo/src/main/java/co/fanki/Order.java", 3);

        assertEquals("Order.java", location.fileName());
    }

    @Test
    void whenResolvingFileName_givenBareName_shouldReturnIt() {
        assertEquals("Order.java",
                new SourceLocation("Order.java", 1).fileName());
    }

}
