package com.rulesync.core.loader;

import java.util.regex.Pattern;

/**
 * Derives downstream record names from relative file paths.
 *
 * <p>
 * {@code team-a/node/cpu.rules} becomes {@code team-a_node_cpu}. Distinct
 * paths may collapse to the same name ({@code a/b.rule} and
 * {@code a_b.yaml}); the publisher resolves such collisions.
 * </p>
 */
public final class RecordNames {

    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_-]");

    private RecordNames() {
        // utility class, not instantiable
    }

    /**
     * @param relativePathWithoutExtension {@code /}-separated relative path
     *                                     with the kind's extension removed
     * @return record name
     */
    public static String fromPath(String relativePathWithoutExtension) {
        return UNSAFE.matcher(relativePathWithoutExtension).replaceAll("_");
    }
}
