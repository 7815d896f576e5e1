package io.hivebus.transport.connection;

import com.rabbitmq.client.Channel;
import java.util.Objects;

/**
 * Live channel paired with the connection generation it belongs to.
 */
public record ChannelHandle(Channel channel, long generation) {

    public ChannelHandle {
        channel = Objects.requireNonNull(channel, "channel");
        if (generation <= 0) {
            throw new IllegalArgumentException("generation must be positive");
        }
    }

    public boolean isOpen() {
        return channel.isOpen();
    }
}
