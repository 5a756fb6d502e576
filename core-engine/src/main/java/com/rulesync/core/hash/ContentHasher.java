package com.rulesync.core.hash;

import com.rulesync.core.model.ContentDigest;
import com.rulesync.core.support.SourcePaths;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Computes an order-independent SHA-256 digest over the files of a subpath.
 *
 * <h3>Digest input</h3>
 * <p>
 * The digest covers, in this order: the caller's seed, the subpath, a
 * presence marker, then for every file in sorted relative-path order its
 * path, its size and its bytes. Every variable-length field is
 * length-prefixed, so no two distinct file sets can produce the same input.
 * </p>
 *
 * <p>
 * A missing subpath hashes as an empty file set. A file that exists but
 * cannot be read raises {@link ContentHashException}.
 * </p>
 *
 * @since 1.0.0
 */
public class ContentHasher {

    private static final String ALGORITHM = "SHA-256";
    private static final int BUFFER_SIZE = 8192;

    /**
     * Digest every non-hidden file under the subpath.
     *
     * @see #digest(Path, String, Predicate, String)
     */
    public ContentDigest digest(Path root, String subpath, String seed) {
        return digest(root, subpath, name -> true, seed);
    }

    /**
     * Digest the files under {@code root/subpath} whose names pass the filter.
     *
     * @param root       mirror root
     * @param subpath    relative subpath; blank means the root
     * @param nameFilter file-name filter selecting the relevant files
     * @param seed       extra identity mixed into the digest (for example the
     *                   source fingerprint), so a configuration change alone
     *                   changes the digest
     * @return digest of the file set
     * @throws ContentHashException if a file cannot be read
     */
    public ContentDigest digest(Path root, String subpath, Predicate<String> nameFilter, String seed) {
        Objects.requireNonNull(nameFilter, "nameFilter must not be null");
        Path dir = SourcePaths.resolve(root, subpath);
        MessageDigest md = newDigest();

        update(md, seed == null ? "" : seed);
        update(md, subpath == null ? "" : subpath);

        boolean present = Files.isDirectory(dir);
        md.update((byte) (present ? 1 : 0));
        if (present) {
            List<String> files = SourcePaths.listFiles(dir, nameFilter);
            md.update(ByteBuffer.allocate(Integer.BYTES).putInt(files.size()).array());
            for (String relative : files) {
                update(md, relative);
                updateFile(md, dir.resolve(relative));
            }
        }
        return ContentDigest.of(md.digest());
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void updateFile(MessageDigest md, Path file) {
        try {
            md.update(ByteBuffer.allocate(Long.BYTES).putLong(Files.size(file)).array());
            try (InputStream in = Files.newInputStream(file)) {
                byte[] buffer = new byte[BUFFER_SIZE];
                int read;
                while ((read = in.read(buffer)) != -1) {
                    md.update(buffer, 0, read);
                }
            }
        } catch (IOException e) {
            throw new ContentHashException("Cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    private static void update(MessageDigest md, String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        md.update(ByteBuffer.allocate(Integer.BYTES).putInt(bytes.length).array());
        md.update(bytes);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }
}
