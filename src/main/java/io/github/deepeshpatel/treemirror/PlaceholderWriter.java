package io.github.deepeshpatel.treemirror;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Writes the fixed-size placeholder artifact of a mirrored leaf: {@value #PLACEHOLDER_SIZE} random
 * ASCII letters. Only size and location are meaningful, never the content.
 */
public class PlaceholderWriter {
    public static final int PLACEHOLDER_SIZE = 1024;
    private static final byte[] LETTERS =
            "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ".getBytes(StandardCharsets.US_ASCII);

    /**
     * Creates the artifact. Fails if the file already exists.
     *
     * @param target absolute path of the artifact; its parent directory must exist
     * @return the number of bytes written
     * @throws IOException if the file cannot be created or written
     */
    public long write(Path target) throws IOException {
        byte[] content = new byte[PLACEHOLDER_SIZE];
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < content.length; i++) {
            content[i] = LETTERS[random.nextInt(LETTERS.length)];
        }
        Files.write(target, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        return content.length;
    }
}
