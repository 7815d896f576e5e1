package io.hivebus.transport.connection;

import java.io.IOException;

/**
 * Operation executed against the live channel.
 */
@FunctionalInterface
public interface ChannelCallback<T> {

    T doInChannel(ChannelHandle handle) throws IOException;
}
