package io.hivebus.transport.topology;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Bindings created by this node, kept until a graceful disconnect unwinds them.
 */
public final class BindingRegistry {

    private final List<QueueBinding> bindings = new ArrayList<>();

    public synchronized void record(QueueBinding binding) {
        bindings.add(Objects.requireNonNull(binding, "binding"));
    }

    public synchronized List<QueueBinding> bindings() {
        return List.copyOf(bindings);
    }

    /**
     * Removes and returns every recorded binding in insertion order.
     */
    public synchronized List<QueueBinding> drain() {
        List<QueueBinding> drained = List.copyOf(bindings);
        bindings.clear();
        return drained;
    }

    public synchronized int size() {
        return bindings.size();
    }
}
