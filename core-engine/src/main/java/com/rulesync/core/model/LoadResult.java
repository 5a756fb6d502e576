package com.rulesync.core.model;

import java.util.List;

/**
 * Outcome of loading one subpath: the valid records and the per-file errors.
 *
 * <p>
 * An absent or empty subpath yields an empty result with no errors, which
 * differs from a subpath whose files were all rejected.
 * </p>
 *
 * @param <R> record type
 * @since 1.0.0
 */
public final class LoadResult<R extends PublishRecord> {

    private final List<R> records;
    private final List<FileError> errors;

    public LoadResult(List<R> records, List<FileError> errors) {
        this.records = List.copyOf(records);
        this.errors = List.copyOf(errors);
    }

    public static <R extends PublishRecord> LoadResult<R> empty() {
        return new LoadResult<>(List.of(), List.of());
    }

    /**
     * @return valid records in lexical source-path order
     */
    public List<R> getRecords() {
        return records;
    }

    public List<FileError> getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return "LoadResult{records=" + records.size() + ", errors=" + errors.size() + '}';
    }
}
