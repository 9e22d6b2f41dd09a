package io.github.deepeshpatel.treemirror;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Recursive listing of a directory tree in tree-relative paths.
 * <p>
 * Symbolic links are not followed; a link, whatever it points to, is reported as a file.
 * Entries that cannot be read are skipped with a warning.
 */
public final class SourceTreeWalker {
    private static final Logger logger = LoggerFactory.getLogger(SourceTreeWalker.class);

    /**
     * Callback of {@link #walk}. Directories are always visited before anything beneath them.
     */
    public interface Visitor {
        void directory(Path relativePath) throws IOException;

        void file(Path relativePath) throws IOException;
    }

    private SourceTreeWalker() {
    }

    /**
     * Walks the tree below {@code root}. The root itself is not reported.
     *
     * @param stop polled before each entry; the walk ends early once it returns true
     * @return false if the walk was ended early by {@code stop}
     */
    public static boolean walk(Path root, Visitor visitor, BooleanSupplier stop) throws IOException {
        TreeVisitor treeVisitor = new TreeVisitor(root, visitor, stop);
        Files.walkFileTree(root, treeVisitor);
        return !treeVisitor.stopped;
    }

    /**
     * All files below {@code root}, relative to it and sorted.
     */
    public static List<Path> listFiles(Path root) throws IOException {
        List<Path> files = new ArrayList<>();
        walk(root, new Visitor() {
            @Override
            public void directory(Path relativePath) {
            }

            @Override
            public void file(Path relativePath) {
                files.add(relativePath);
            }
        }, () -> false);
        files.sort(null);
        return files;
    }

    private static class TreeVisitor extends SimpleFileVisitor<Path> {
        private final Path root;
        private final Visitor visitor;
        private final BooleanSupplier stop;
        private boolean stopped;

        TreeVisitor(Path root, Visitor visitor, BooleanSupplier stop) {
            this.root = root;
            this.visitor = visitor;
            this.stop = stop;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
            if (shouldStop()) {
                return FileVisitResult.TERMINATE;
            }
            if (!dir.equals(root)) {
                visitor.directory(root.relativize(dir));
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
            if (shouldStop()) {
                return FileVisitResult.TERMINATE;
            }
            visitor.file(root.relativize(file));
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            logger.warn("Skipping inaccessible entry: {} - {}", file, exc.getMessage());
            return FileVisitResult.CONTINUE;
        }

        private boolean shouldStop() {
            if (stop.getAsBoolean()) {
                stopped = true;
            }
            return stopped;
        }
    }
}
