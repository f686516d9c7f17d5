package db.median.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import db.median.agg.AggregateFunction;
import db.median.agg.MedianAggregate;
import db.median.config.MedianConfig;

/**
 * Aggregate functions callable from SQL, by case-insensitive name.
 * A fresh function instance is created per query.
 */
public class FunctionRegistry {
    private final Map<String, Supplier<? extends AggregateFunction<?>>> functions = new LinkedHashMap<>();

    /** Registry with MEDIAN bound to a MedianAggregate sized from config. */
    public static FunctionRegistry withDefaults(MedianConfig config) {
        FunctionRegistry registry = new FunctionRegistry();
        registry.register(MedianAggregate.NAME, () -> new MedianAggregate(config.initialCapacity, config.maxCapacity));
        return registry;
    }

    public void register(String name, Supplier<? extends AggregateFunction<?>> factory) {
        String key = name.toLowerCase(Locale.ROOT);
        if (functions.containsKey(key)) {
            throw new IllegalArgumentException("Aggregate function already registered: " + name);
        }
        functions.put(key, factory);
    }

    public boolean contains(String name) {
        return name != null && functions.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public AggregateFunction<?> create(String name) {
        Supplier<? extends AggregateFunction<?>> factory = name == null ? null : functions.get(name.toLowerCase(Locale.ROOT));
        if (factory == null) throw new IllegalArgumentException("Unknown aggregate function: " + name);
        return factory.get();
    }

    public Set<String> names() { return Collections.unmodifiableSet(functions.keySet()); }
}
