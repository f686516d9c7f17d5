package db.median.agg;

import java.util.ArrayList;
import java.util.List;

/**
 * Lifetime scope the engine opens around one aggregation run.
 * States allocated during the run register here and are released together when the
 * context closes; there is no per-state release call. Callbacks refuse to run against
 * a closed context or a state owned by another context.
 */
public final class AggregateContext implements AutoCloseable {

    /** Anything whose memory belongs to a context. */
    public interface Resource {
        void release();
    }

    private final String label;
    private final List<Resource> resources = new ArrayList<>();
    private boolean live = true;

    public AggregateContext(String label) {
        this.label = label;
    }

    public String label() { return label; }

    public boolean isLive() { return live; }

    public int resourceCount() { return resources.size(); }

    public <R extends Resource> R register(R resource) {
        checkLive("register");
        resources.add(resource);
        return resource;
    }

    public void checkLive(String entryPoint) {
        if (!live) {
            throw new InvalidCallContextException(entryPoint + " called after aggregate context '" + label + "' was closed");
        }
    }

    @Override
    public void close() {
        if (!live) return;
        live = false;
        for (Resource r : resources) r.release();
        resources.clear();
    }

    @Override
    public String toString() {
        return "AggregateContext[" + label + (live ? ", live" : ", closed") + ", resources=" + resources.size() + "]";
    }
}
