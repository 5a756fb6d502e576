package com.rulesync.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Where and how to mirror the source repository.
 *
 * <p>
 * Instances are immutable and only exist for a non-blank location. An absent
 * location is modelled as an absent {@code SourceSpec} (see
 * {@link ReconcileSettings#getSource()}), never as an empty one.
 * </p>
 *
 * @since 1.0.0
 */
public final class SourceSpec {

    private final String location;
    private final String branch;
    private final String revision;
    private final int depth;
    private final String credential;

    private SourceSpec(Builder b) {
        this.location = b.location;
        this.branch = b.branch;
        this.revision = b.revision;
        this.depth = b.depth;
        this.credential = b.credential;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getLocation() {
        return location;
    }

    /**
     * @return branch to check out; may be {@code null}
     */
    public String getBranch() {
        return branch;
    }

    /**
     * @return tag or commit to check out; may be {@code null}
     */
    public String getRevision() {
        return revision;
    }

    /**
     * @return clone depth; {@code 0} means full history
     */
    public int getDepth() {
        return depth;
    }

    /**
     * @return optional private key used to authenticate against the remote
     */
    public Optional<String> getCredential() {
        return Optional.ofNullable(credential);
    }

    /**
     * Identity of the checked-out content: location, branch, revision and
     * depth. The credential is not part of it.
     *
     * @return fingerprint string
     */
    public String fingerprint() {
        return location + '|' + (branch == null ? "" : branch)
                + '|' + (revision == null ? "" : revision) + '|' + depth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SourceSpec that))
            return false;
        return depth == that.depth
                && location.equals(that.location)
                && Objects.equals(branch, that.branch)
                && Objects.equals(revision, that.revision)
                && Objects.equals(credential, that.credential);
    }

    @Override
    public int hashCode() {
        return Objects.hash(location, branch, revision, depth, credential);
    }

    @Override
    public String toString() {
        return "SourceSpec{" +
                "location='" + location + '\'' +
                ", branch='" + branch + '\'' +
                ", revision='" + revision + '\'' +
                ", depth=" + depth +
                ", credential=" + (credential != null ? "<set>" : "<none>") +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link SourceSpec}. Blank optional strings are
     * normalised to {@code null}.
     */
    public static class Builder {
        private String location;
        private String branch;
        private String revision;
        private int depth = 1;
        private String credential;

        public Builder location(String v) {
            this.location = v;
            return this;
        }

        public Builder branch(String v) {
            this.branch = blankToNull(v);
            return this;
        }

        public Builder revision(String v) {
            this.revision = blankToNull(v);
            return this;
        }

        public Builder depth(int v) {
            this.depth = v;
            return this;
        }

        public Builder credential(String v) {
            this.credential = blankToNull(v);
            return this;
        }

        /**
         * @return a validated {@link SourceSpec}
         * @throws IllegalArgumentException if the location is blank or the
         *                                  depth is negative
         */
        public SourceSpec build() {
            if (location == null || location.isBlank()) {
                throw new IllegalArgumentException("location must not be null or blank");
            }
            if (depth < 0) {
                throw new IllegalArgumentException("depth must be >= 0, got: " + depth);
            }
            location = location.trim();
            return new SourceSpec(this);
        }

        private static String blankToNull(String v) {
            return v == null || v.isBlank() ? null : v;
        }
    }
}
