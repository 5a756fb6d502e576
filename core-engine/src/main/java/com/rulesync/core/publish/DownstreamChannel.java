package com.rulesync.core.publish;

import com.rulesync.core.model.DownstreamKind;

import java.util.Map;

/**
 * Connection to one downstream consumer.
 *
 * <p>
 * A channel stores named payloads and can report what it currently holds.
 * {@link #readCurrent()} is the ground truth the publisher rebuilds its view
 * from, so it must reflect every earlier successful {@link #put} and
 * {@link #remove}, including those made by a previous process.
 * </p>
 *
 * <p>
 * Implementations throw {@link PublishException} when the consumer cannot
 * be reached or a write fails.
 * </p>
 *
 * @since 1.0.0
 */
public interface DownstreamChannel {

    /**
     * @return the kind of content this channel accepts
     */
    DownstreamKind getKind();

    /**
     * Read every record the consumer currently holds.
     *
     * @return record name to canonical JSON payload
     * @throws PublishException if the consumer cannot be read
     */
    Map<String, String> readCurrent();

    /**
     * Add or replace one record.
     *
     * @param name    record name
     * @param payload canonical JSON payload
     * @throws PublishException if the write fails
     */
    void put(String name, String payload);

    /**
     * Remove one record; removing an absent name is not an error.
     *
     * @param name record name
     * @throws PublishException if the removal fails
     */
    void remove(String name);
}
