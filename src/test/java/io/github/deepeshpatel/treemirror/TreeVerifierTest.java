package io.github.deepeshpatel.treemirror;

import io.github.deepeshpatel.treemirror.VerificationReport.Divergence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TreeVerifierTest {

    private static List<Path> paths(String... names) {
        List<Path> result = new ArrayList<>();
        for (String name : names) {
            result.add(Path.of(name));
        }
        return result;
    }

    @Test
    @DisplayName("Arrival order does not matter")
    void testConsistentRegardlessOfOrder() {
        VerificationReport report = TreeVerifier.compare(
                paths("a/b.txt", "a/c.txt", "d.txt"),
                paths("d.txt", "a/c.txt", "a/b.txt"),
                paths("a/c.txt", "d.txt", "a/b.txt"));

        assertTrue(report.consistent());
        assertEquals(3, report.sourceCount());
        assertEquals(-1, report.firstDivergence());
        assertTrue(report.divergences().isEmpty());
    }

    @Test
    @DisplayName("Missing result shows up as a null at the end of its list")
    void testMissingResult() {
        VerificationReport report = TreeVerifier.compare(
                paths("a.txt", "b.txt", "c.txt"),
                paths("a.txt", "b.txt", "c.txt"),
                paths("a.txt", "c.txt"));

        assertFalse(report.consistent());
        assertEquals(2, report.resultCount());
        assertEquals(1, report.firstDivergence());
        assertEquals(List.of(
                new Divergence(1, Path.of("b.txt"), Path.of("b.txt"), Path.of("c.txt")),
                new Divergence(2, Path.of("c.txt"), Path.of("c.txt"), null)), report.divergences());
        assertEquals("2: \"c.txt\", \"c.txt\", \"null\"", report.divergences().get(1).toString());
    }

    @Test
    @DisplayName("Divergence window is capped")
    void testWindowCapped() {
        List<Path> source = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            source.add(Path.of(String.format("f%02d.txt", i)));
        }

        VerificationReport report = TreeVerifier.compare(source, source, List.of());

        assertEquals(0, report.firstDivergence());
        assertEquals(TreeVerifier.DIVERGENCE_WINDOW, report.divergences().size());
        assertNull(report.divergences().get(0).result());
    }

    @Test
    @DisplayName("Verify lists both trees from the file system")
    void testVerifyAgainstFileSystem(@TempDir Path root) throws Exception {
        Path source = Files.createDirectories(root.resolve("src/a"));
        Files.writeString(source.resolve("b.txt"), "b");
        Path destination = Files.createDirectories(root.resolve("dst/a"));
        Files.writeString(destination.resolve("b.txt"), "placeholder");

        VerificationReport ok = TreeVerifier.verify(root.resolve("src"), root.resolve("dst"),
                new ResultCollection(paths("a/b.txt"), true));
        VerificationReport extra = TreeVerifier.verify(root.resolve("src"), root.resolve("dst"),
                new ResultCollection(paths("a/b.txt", "a/b.txt"), true));

        assertTrue(ok.consistent());
        assertFalse(extra.consistent());
        assertEquals(2, extra.resultCount());
    }
}
