package io.hivebus.transport.connection;

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import io.hivebus.transport.TransportConnectionException;
import io.hivebus.transport.TransportException;
import io.hivebus.transport.TransportSettings;
import io.hivebus.transport.topology.BindingRegistry;
import io.hivebus.transport.topology.QueueBinding;
import java.io.IOException;
import java.net.URISyntaxException;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the single broker connection and channel shared by the subscriber and the publisher.
 * <p>
 * Every lifecycle transition and every channel operation runs on one serial {@link Executor}, so
 * error and close notifications coming from the client library never race with declarations,
 * publishes or acknowledgments. Callers always receive a future; when no channel is available the
 * future completes with {@code null} instead of failing.
 * <p>
 * No reconnection is attempted: a failed or lost connection leaves the manager {@link ConnectionState#DOWN}
 * until someone calls {@link #connect()} again.
 */
public final class AmqpConnectionManager {

    /**
     * Matches whatever channel is current when the operation runs.
     */
    public static final long ANY_GENERATION = 0L;

    private static final Logger log = LoggerFactory.getLogger(AmqpConnectionManager.class);

    private final TransportSettings settings;
    private final ConnectionFactory connectionFactory;
    private final BindingRegistry bindings;
    private final Executor executor;
    private final AtomicLong generations = new AtomicLong();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile Connection connection;
    private volatile ChannelHandle handle;
    private volatile CompletableFuture<Boolean> pendingConnect;
    private volatile boolean disconnecting;

    public AmqpConnectionManager(TransportSettings settings,
                                 ConnectionFactory connectionFactory,
                                 BindingRegistry bindings,
                                 Executor executor) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.bindings = Objects.requireNonNull(bindings, "bindings");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Connection factory for {@code url} with automatic recovery switched off.
     */
    public static ConnectionFactory connectionFactory(String url) {
        ConnectionFactory factory = new ConnectionFactory();
        try {
            factory.setUri(url);
        } catch (URISyntaxException | NoSuchAlgorithmException | KeyManagementException ex) {
            throw new TransportException("Invalid AMQP url", ex);
        }
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);
        return factory;
    }

    /**
     * Opens the connection and the channel, then applies the prefetch limit.
     * Completes with {@code true} when a new channel was opened and {@code false} when one was already live.
     * The returned future fails with {@link TransportConnectionException} when either cannot be opened,
     * or when the connection drops before the attempt finished.
     */
    public CompletableFuture<Boolean> connect() {
        CompletableFuture<Boolean> attempt = new CompletableFuture<>();
        try {
            executor.execute(() -> open(attempt));
        } catch (RejectedExecutionException ex) {
            attempt.completeExceptionally(new TransportConnectionException("AMQP transport is closed", ex));
        }
        return attempt;
    }

    /**
     * Unbinds every recorded binding, then closes the channel and the connection.
     * Queues and exchanges are left in place. Failures are logged and teardown continues.
     */
    public CompletableFuture<Void> disconnect() {
        CompletableFuture<Void> result = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    teardown();
                } finally {
                    result.complete(null);
                }
            });
        } catch (RejectedExecutionException ex) {
            log.debug("AMQP executor already stopped; nothing to disconnect", ex);
            result.complete(null);
        }
        return result;
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED && channel().isPresent();
    }

    public ConnectionState state() {
        return state;
    }

    public Optional<ChannelHandle> channel() {
        ChannelHandle current = handle;
        if (current == null || !current.isOpen()) {
            return Optional.empty();
        }
        return Optional.of(current);
    }

    public <T> CompletableFuture<T> execute(ChannelCallback<T> callback) {
        return execute(ANY_GENERATION, callback);
    }

    /**
     * Runs {@code callback} against the live channel if its generation matches.
     * An absent, closed or replaced channel completes the future with {@code null}.
     */
    public <T> CompletableFuture<T> execute(long generation, ChannelCallback<T> callback) {
        Objects.requireNonNull(callback, "callback");
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            executor.execute(() -> run(generation, callback, result));
        } catch (RejectedExecutionException ex) {
            log.debug("AMQP executor stopped; skipping channel operation", ex);
            result.complete(null);
        }
        return result;
    }

    private <T> void run(long generation, ChannelCallback<T> callback, CompletableFuture<T> result) {
        ChannelHandle current = handle;
        if (current == null || !current.isOpen()
            || (generation != ANY_GENERATION && current.generation() != generation)) {
            result.complete(null);
            return;
        }
        try {
            result.complete(callback.doInChannel(current));
        } catch (AlreadyClosedException ex) {
            log.debug("AMQP channel closed during operation", ex);
            result.complete(null);
        } catch (IOException ex) {
            result.completeExceptionally(new TransportException("AMQP channel operation failed", ex));
        } catch (RuntimeException ex) {
            result.completeExceptionally(ex);
        }
    }

    private void open(CompletableFuture<Boolean> attempt) {
        if (state == ConnectionState.CONNECTED && channel().isPresent()) {
            attempt.complete(false);
            return;
        }
        state = ConnectionState.CONNECTING;
        pendingConnect = attempt;
        Connection newConnection;
        try {
            newConnection = connectionFactory.newConnection(settings.nodeId());
        } catch (IOException | TimeoutException ex) {
            log.warn("AMQP failed to connect!", ex);
            markDown();
            attempt.completeExceptionally(new TransportConnectionException("Failed to connect to AMQP broker", ex));
            return;
        }
        log.info("AMQP is connected.");
        newConnection.addShutdownListener(cause -> onConnectionShutdown(newConnection, cause));
        newConnection.addBlockedListener(
            reason -> log.warn("AMQP connection is blocked: {}", reason),
            () -> log.info("AMQP connection is unblocked."));

        Channel channel;
        try {
            channel = newConnection.createChannel();
            if (channel == null) {
                throw new IOException("No channel number available");
            }
            channel.basicQos(settings.prefetch());
        } catch (IOException | RuntimeException ex) {
            log.error("AMQP failed to create channel.", ex);
            markDown();
            closeQuietly(newConnection);
            attempt.completeExceptionally(new TransportConnectionException("Failed to create AMQP channel", ex));
            return;
        }
        long generation = generations.incrementAndGet();
        channel.addShutdownListener(cause -> onChannelShutdown(generation, cause));
        channel.addReturnListener(returned -> log.warn(
            "AMQP channel returned a message (exchange='{}', routingKey='{}', replyCode={}, replyText='{}')",
            returned.getExchange(), returned.getRoutingKey(), returned.getReplyCode(), returned.getReplyText()));

        // bindings of a dropped channel were never unbound; the new channel records its own
        List<QueueBinding> stale = bindings.drain();
        if (!stale.isEmpty()) {
            log.debug("Discarded {} binding(s) recorded on a previous channel", stale.size());
        }
        connection = newConnection;
        handle = new ChannelHandle(channel, generation);
        state = ConnectionState.CONNECTED;
        pendingConnect = null;
        log.info("AMQP channel is created (prefetch={}).", settings.prefetch());
        attempt.complete(true);
    }

    private void onConnectionShutdown(Connection source, ShutdownSignalException cause) {
        boolean graceful = disconnecting || cause.isInitiatedByApplication();
        if (graceful) {
            log.info("AMQP connection is closed gracefully.");
        } else {
            log.error("AMQP connection is closed.", cause);
            failPending(cause);
        }
        submitQuietly(() -> {
            if (connection != source) {
                return;
            }
            connection = null;
            handle = null;
            if (!graceful) {
                markDown();
            } else {
                state = ConnectionState.DISCONNECTED;
            }
        });
    }

    private void onChannelShutdown(long generation, ShutdownSignalException cause) {
        boolean graceful = disconnecting || cause.isInitiatedByApplication();
        if (graceful) {
            log.info("AMQP channel is closed gracefully.");
        } else {
            log.warn("AMQP channel is closed.", cause);
            failPending(cause);
        }
        submitQuietly(() -> {
            ChannelHandle current = handle;
            if (current == null || current.generation() != generation) {
                return;
            }
            handle = null;
            if (graceful) {
                return;
            }
            markDown();
            Connection orphan = connection;
            connection = null;
            if (orphan != null && !cause.isHardError()) {
                closeQuietly(orphan);
            }
        });
    }

    private void failPending(ShutdownSignalException cause) {
        CompletableFuture<Boolean> pending = pendingConnect;
        if (pending != null) {
            pending.completeExceptionally(new TransportConnectionException("AMQP connection lost while connecting", cause));
        }
    }

    private void markDown() {
        state = ConnectionState.DOWN;
        pendingConnect = null;
    }

    private void teardown() {
        Connection currentConnection = connection;
        ChannelHandle current = handle;
        if (currentConnection == null || current == null) {
            log.debug("AMQP transport is not connected; disconnect is a no-op");
            return;
        }
        disconnecting = true;
        try {
            List<QueueBinding> recorded = bindings.drain();
            for (QueueBinding binding : recorded) {
                unbind(current.channel(), binding);
            }
            closeChannel(current.channel());
            closeConnection(currentConnection);
            log.info("AMQP transport disconnected ({} binding(s) released)", recorded.size());
        } finally {
            handle = null;
            connection = null;
            state = ConnectionState.DISCONNECTED;
            disconnecting = false;
        }
    }

    private static void unbind(Channel channel, QueueBinding binding) {
        try {
            channel.queueUnbind(binding.queue(), binding.exchange(), binding.routingKey());
        } catch (IOException | ShutdownSignalException ex) {
            log.warn("Failed to unbind queue '{}' from exchange '{}'", binding.queue(), binding.exchange(), ex);
        }
    }

    private static void closeChannel(Channel channel) {
        try {
            if (channel.isOpen()) {
                channel.close();
            }
        } catch (IOException | TimeoutException | ShutdownSignalException ex) {
            log.warn("Failed to close AMQP channel", ex);
        }
    }

    private static void closeConnection(Connection connection) {
        try {
            if (connection.isOpen()) {
                connection.close();
            }
        } catch (IOException | ShutdownSignalException ex) {
            log.warn("Failed to close AMQP connection", ex);
        }
    }

    private static void closeQuietly(Connection connection) {
        try {
            connection.abort();
        } catch (RuntimeException ex) {
            log.debug("Failed to abort AMQP connection", ex);
        }
    }

    private void submitQuietly(Runnable task) {
        try {
            executor.execute(task);
        } catch (RejectedExecutionException ex) {
            log.debug("AMQP executor stopped; dropping lifecycle transition", ex);
        }
    }
}
