package io.hivebus.transport.spring;

import io.hivebus.transport.Transporter;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Connects the transporter when the context starts and disconnects it on shutdown.
 * <p>
 * A failed connect is logged and leaves the transporter disconnected; the transport itself never
 * retries, so reconnect policies belong to the application.
 */
final class TransportLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TransportLifecycle.class);

    private final Transporter transporter;
    private final Duration timeout;
    private volatile boolean running;

    TransportLifecycle(Transporter transporter, Duration timeout) {
        this.transporter = Objects.requireNonNull(transporter, "transporter");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        running = true;
        try {
            transporter.connect().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("AMQP transport started");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while connecting the AMQP transport", ex);
        } catch (ExecutionException ex) {
            log.error("AMQP transport failed to connect", ex.getCause());
        } catch (TimeoutException ex) {
            log.error("AMQP transport did not connect within {}", timeout, ex);
        }
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        try {
            transporter.disconnect().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while disconnecting the AMQP transport", ex);
        } catch (ExecutionException | TimeoutException ex) {
            log.warn("AMQP transport did not disconnect cleanly", ex);
        } finally {
            running = false;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
