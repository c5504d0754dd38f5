package com.challenges.jeval.record;

import com.challenges.jeval.error.EvaluationException;
import com.challenges.jeval.error.FieldNotFoundException;
import com.challenges.jeval.value.Members;
import com.challenges.jeval.value.Value;
import com.challenges.jeval.value.Values;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The input a query is evaluated against, described by the lookup capability it
 * exposes. Use {@link Records#of(Object)} to adapt host objects.
 *
 * <p>A lookup answers {@link Optional#empty()} when the name is absent; a field
 * that is present but null answers {@link Value#NULL}.
 */
public sealed interface Record {

    /** A null reference: every field is absent. */
    Record ABSENT = new Absent();

    Optional<Value> field(String name);

    /**
     * The whole record as a value.
     *
     * @throws EvaluationException if the record cannot enumerate its fields
     */
    Value snapshot();

    /**
     * Record-like input: members looked up by exact, case-sensitive name.
     */
    final class FieldLookup implements Record {
        private final Object target;
        private final ImmutableMap<String, Members.Accessor> members;

        FieldLookup(Object target) {
            this.target = Objects.requireNonNull(target, "target");
            this.members = Members.of(target.getClass());
        }

        @Override
        public Optional<Value> field(String name) {
            Members.Accessor accessor = members.get(name);
            if (accessor == null) {
                return Optional.empty();
            }
            return Optional.of(Values.of(accessor.read(target)));
        }

        @Override
        public Value snapshot() {
            return Values.of(target);
        }
    }

    /**
     * Map-like input: looked up by the string key equal to the name.
     */
    final class KeyedLookup implements Record {
        private final Map<?, ?> entries;

        KeyedLookup(Map<?, ?> entries) {
            this.entries = Objects.requireNonNull(entries, "entries");
        }

        @Override
        public Optional<Value> field(String name) {
            Object value;
            try {
                if (!entries.containsKey(name)) {
                    return Optional.empty();
                }
                value = entries.get(name);
            } catch (ClassCastException e) {
                // sorted maps with non-string keys reject the lookup; no key can match
                return Optional.empty();
            }
            return Optional.of(Values.of(value));
        }

        @Override
        public Value snapshot() {
            MutableMap<String, Value> fields = Maps.mutable.ofInitialCapacity(entries.size());
            entries.forEach((k, v) -> {
                if (k instanceof String key) {
                    fields.put(key, Values.of(v));
                }
            });
            return new Value.MapValue(fields.toImmutable());
        }
    }

    /**
     * Input that resolves names itself. A getter takes priority over any other
     * capability the object might have.
     */
    non-sealed interface DynamicGetter extends Record {

        /**
         * @throws FieldNotFoundException if there is no value for {@code name}
         */
        Value get(String name) throws FieldNotFoundException;

        @Override
        default Optional<Value> field(String name) {
            try {
                Value value = get(name);
                return Optional.of(value == null ? Value.NULL : value);
            } catch (FieldNotFoundException e) {
                return Optional.empty();
            }
        }

        @Override
        default Value snapshot() {
            throw new EvaluationException("dynamic record " + getClass().getSimpleName() + " cannot be read as a whole");
        }
    }

    final class Absent implements Record {
        private Absent() {
        }

        @Override
        public Optional<Value> field(String name) {
            return Optional.empty();
        }

        @Override
        public Value snapshot() {
            return Value.NULL;
        }

        @Override
        public String toString() {
            return "Record.ABSENT";
        }
    }
}
