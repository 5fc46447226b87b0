package com.umitunal.qcron.scheduler;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Resolves function names to the functions scheduled tasks invoke.
 * Names are opaque to the cron layer; a namespaced form such as {@code "reports:daily"} is
 * conventional.
 */
public class FunctionRegistry {
    private final ConcurrentMap<String, Registration> functions = new ConcurrentHashMap<>();

    /**
     * Register a transactional function.
     */
    public FunctionRegistry registerMutation(String name, ScheduledFunction function) {
        return register(name, ScheduledFunction.Kind.MUTATION, function);
    }

    /**
     * Register a function whose duration is unbounded.
     */
    public FunctionRegistry registerAction(String name, ScheduledFunction function) {
        return register(name, ScheduledFunction.Kind.ACTION, function);
    }

    public FunctionRegistry register(String name, ScheduledFunction.Kind kind, ScheduledFunction function) {
        Registration previous = functions.putIfAbsent(name, new Registration(name, kind, function));
        if (previous != null) {
            throw new IllegalStateException("Function already registered: " + name);
        }
        return this;
    }

    public Optional<Registration> resolve(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public boolean isRegistered(String name) {
        return functions.containsKey(name);
    }

    public Set<String> names() {
        return Set.copyOf(functions.keySet());
    }

    /**
     * A named function together with its kind.
     */
    public static class Registration {
        private final String name;
        private final ScheduledFunction.Kind kind;
        private final ScheduledFunction function;

        Registration(String name, ScheduledFunction.Kind kind, ScheduledFunction function) {
            this.name = name;
            this.kind = kind;
            this.function = function;
        }

        public String getName() { return name; }
        public ScheduledFunction.Kind getKind() { return kind; }
        public ScheduledFunction getFunction() { return function; }
    }
}
