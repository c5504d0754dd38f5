package com.challenges.jeval.record;

import com.challenges.jeval.value.Members;
import com.challenges.jeval.value.Value;

import java.util.Map;
import java.util.Optional;

/**
 * Adapts host objects into {@link Record}s. This is the only place that
 * inspects host types; evaluation works on the resulting capabilities.
 */
public final class Records {

    private Records() {
    }

    /**
     * Adapts {@code input}, following at most one {@link Optional} to reach it.
     * A {@code null} reference, an empty optional, or an object that is neither
     * map-like, record-like nor a {@link Record.DynamicGetter} yields
     * {@link Record#ABSENT}.
     */
    public static Record of(Object input) {
        if (input instanceof Optional<?> optional) {
            return optional.isPresent() ? adapt(optional.get()) : Record.ABSENT;
        }
        return adapt(input);
    }

    private static Record adapt(Object input) {
        if (input == null) {
            return Record.ABSENT;
        }
        if (input instanceof Record record) {
            return record;
        }
        if (input instanceof Value.MapValue map) {
            return new Record.KeyedLookup(map.fields().castToMap());
        }
        if (input instanceof Value) {
            return Record.ABSENT;
        }
        if (input instanceof Map<?, ?> map) {
            return new Record.KeyedLookup(map);
        }
        Class<?> type = input.getClass();
        if (type.isRecord() || !Members.of(type).isEmpty()) {
            return new Record.FieldLookup(input);
        }
        return Record.ABSENT;
    }
}
