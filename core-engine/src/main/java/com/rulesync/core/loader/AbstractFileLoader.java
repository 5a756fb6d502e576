package com.rulesync.core.loader;

import com.rulesync.core.model.DownstreamKind;
import com.rulesync.core.model.FileError;
import com.rulesync.core.model.LoadResult;
import com.rulesync.core.model.PublishRecord;
import com.rulesync.core.support.SourcePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Base class for loaders that turn the files of one subpath into records.
 *
 * <h3>Isolation</h3>
 * <p>
 * Every file is read and parsed on its own. A file that cannot be read or
 * fails {@link #parse(String, String, String)} becomes a {@link FileError}
 * and is left out of the result; its siblings are still loaded.
 * </p>
 *
 * <h3>Matching</h3>
 * <p>
 * A file is selected when its name ends with one of {@link #extensions()}
 * (case-insensitive). The longest matching extension is stripped before the
 * record name is derived, so {@code board.json.tmpl} yields {@code board}.
 * </p>
 *
 * @param <R> record type produced by this loader
 * @since 1.0.0
 */
public abstract class AbstractFileLoader<R extends PublishRecord> {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractFileLoader.class);

    private final DownstreamKind kind;

    protected AbstractFileLoader(DownstreamKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public DownstreamKind getKind() {
        return kind;
    }

    /**
     * @return file extensions, each including the leading dot
     */
    protected abstract List<String> extensions();

    /**
     * Parse and validate one file.
     *
     * @param name         record name derived from the path
     * @param relativePath path relative to the subpath, for attribution
     * @param content      file content
     * @return the validated record
     * @throws RuntimeException if the file is malformed or invalid; the
     *                          message becomes the per-file error
     */
    protected abstract R parse(String name, String relativePath, String content);

    /**
     * @param fileName bare file name
     * @return whether this loader handles the file
     */
    public boolean accepts(String fileName) {
        return matchingExtension(fileName) != null;
    }

    /**
     * Load every matching file under {@code root/subpath}.
     *
     * @param root    mirror root
     * @param subpath relative subpath
     * @return valid records and per-file errors; empty when the subpath is
     *         absent or holds no matching files
     * @throws com.rulesync.core.support.ContentReadException if the subpath
     *                                                        exists but
     *                                                        cannot be listed
     */
    public LoadResult<R> load(Path root, String subpath) {
        Path dir = SourcePaths.resolve(root, subpath);
        List<String> files = SourcePaths.listFiles(dir, this::accepts);
        if (files.isEmpty()) {
            LOG.debug("No {} files under {}", kind, dir);
            return LoadResult.empty();
        }

        List<R> records = new ArrayList<>();
        List<FileError> errors = new ArrayList<>();

        for (String relative : files) {
            String content;
            try {
                content = Files.readString(dir.resolve(relative), StandardCharsets.UTF_8);
            } catch (IOException e) {
                errors.add(new FileError(kind, relative, FileError.Type.CONTENT_READ,
                        "Cannot read file: " + e.getMessage()));
                continue;
            }

            String name = RecordNames.fromPath(stripExtension(relative));
            try {
                records.add(parse(name, relative, content));
            } catch (RuntimeException e) {
                errors.add(new FileError(kind, relative, FileError.Type.FILE_VALIDATION, e.getMessage()));
            }
        }

        for (FileError error : errors) {
            LOG.warn("Rejected {} file {}: {}", kind, error.getSourcePath(), error.getMessage());
        }
        LOG.info("Loaded {} {} record(s) from {} ({} rejected)",
                records.size(), kind, dir, errors.size());
        return new LoadResult<>(records, errors);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private String stripExtension(String relative) {
        String extension = matchingExtension(relative);
        return extension == null ? relative : relative.substring(0, relative.length() - extension.length());
    }

    private String matchingExtension(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return extensions().stream()
                .filter(lower::endsWith)
                .max(Comparator.comparingInt(String::length))
                .orElse(null);
    }
}
