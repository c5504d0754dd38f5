package com.challenges.jeval.value;

import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;

/**
 * Readable members of host classes by exact name: record components for
 * {@code record} classes, public instance fields otherwise. Tables are built
 * once per class.
 */
public final class Members {

    @FunctionalInterface
    public interface Accessor {
        Object read(Object target);
    }

    private static final ClassValue<ImmutableMap<String, Accessor>> TABLES = new ClassValue<>() {
        @Override
        protected ImmutableMap<String, Accessor> computeValue(Class<?> type) {
            return type.isRecord() ? recordTable(type) : fieldTable(type);
        }
    };

    private Members() {
    }

    public static ImmutableMap<String, Accessor> of(Class<?> type) {
        return TABLES.get(type);
    }

    private static ImmutableMap<String, Accessor> recordTable(Class<?> type) {
        MutableMap<String, Accessor> table = Maps.mutable.empty();
        for (RecordComponent component : type.getRecordComponents()) {
            Method accessor = component.getAccessor();
            accessor.trySetAccessible();
            table.put(component.getName(), target -> invoke(accessor, target));
        }
        return table.toImmutable();
    }

    private static ImmutableMap<String, Accessor> fieldTable(Class<?> type) {
        MutableMap<String, Accessor> table = Maps.mutable.empty();
        for (Field field : type.getFields()) {
            if (Modifier.isStatic(field.getModifiers())) {
                continue;
            }
            field.trySetAccessible();
            table.put(field.getName(), target -> read(field, target));
        }
        return table.toImmutable();
    }

    private static Object invoke(Method accessor, Object target) {
        try {
            return accessor.invoke(target);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Accessor " + accessor.getName() + " failed", e.getCause());
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read " + accessor.getName(), e);
        }
    }

    private static Object read(Field field, Object target) {
        try {
            return field.get(target);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read field " + field.getName(), e);
        }
    }
}
