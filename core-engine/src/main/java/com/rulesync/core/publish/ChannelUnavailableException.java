package com.rulesync.core.publish;

import com.rulesync.core.model.DownstreamKind;

/**
 * No channel is attached for a downstream kind.
 *
 * @since 1.0.0
 */
public class ChannelUnavailableException extends PublishException {

    private static final long serialVersionUID = 1L;

    public ChannelUnavailableException(DownstreamKind kind) {
        super("No downstream channel attached for " + kind);
    }
}
