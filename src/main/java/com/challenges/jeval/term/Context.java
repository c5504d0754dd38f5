package com.challenges.jeval.term;

import com.challenges.jeval.value.Value;
import com.challenges.jeval.value.Values;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.util.Objects;
import java.util.Optional;

/**
 * Caller-owned functions, variables and options for one or more evaluation
 * calls. Evaluation only reads it; do not modify a context while other threads
 * evaluate with it.
 */
public final class Context {

    private final MutableMap<String, TermFunction> functions = Maps.mutable.empty();
    private final MutableMap<String, Value> variables = Maps.mutable.empty();
    private boolean textualEquality;

    public static Context create() {
        return new Context();
    }

    public Context withFunction(String name, TermFunction function) {
        functions.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(function, "function"));
        return this;
    }

    public Context withVariable(String name, Object value) {
        variables.put(Objects.requireNonNull(name, "name"), Values.of(value));
        return this;
    }

    /**
     * When enabled, {@code is} and {@code is not} also treat two values as equal
     * if their textual forms match, so the string {@code "5"} is the integer 5.
     */
    public Context textualEquality(boolean enabled) {
        this.textualEquality = enabled;
        return this;
    }

    public boolean textualEquality() {
        return textualEquality;
    }

    public Optional<TermFunction> function(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public Optional<Value> variable(String name) {
        return Optional.ofNullable(variables.get(name));
    }
}
