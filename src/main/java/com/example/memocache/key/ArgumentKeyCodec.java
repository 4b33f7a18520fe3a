package com.example.memocache.key;

import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.Period;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Default {@link KeyCodec}: canonicalizes value-like arguments into immutable copies.
 *
 * <h4>Accepted argument shapes</h4>
 * <ul>
 *   <li>{@code null}</li>
 *   <li>{@link String}, {@link Boolean}, {@link Character}, {@link Byte}, {@link Short},
 *       {@link Integer}, {@link Long}, {@link Float}, {@link Double}, {@link BigInteger},
 *       {@link BigDecimal}, {@link UUID} and enum constants</li>
 *   <li>immutable {@code java.time} values ({@link Instant}, {@link Duration}, {@link Period},
 *       {@link LocalDate}, {@link LocalTime}, {@link LocalDateTime}, {@link OffsetDateTime},
 *       {@link ZonedDateTime})</li>
 *   <li>{@link CacheKey}, kept as is</li>
 *   <li>arrays and {@link List}s, copied into an immutable list (an array and a list holding
 *       equal elements therefore encode to the same key)</li>
 *   <li>{@link Set}s and {@link Map}s, copied element by element</li>
 *   <li>records, encoded as their type followed by their canonicalized components</li>
 * </ul>
 * Any other type, including mutable numbers such as {@code AtomicLong}, I/O handles and
 * threads, is rejected with {@link UnencodableArgumentException}. Values are compared with
 * their own {@code equals}, so {@code 1} and {@code 1L} are different keys.
 */
public class ArgumentKeyCodec implements KeyCodec {

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;
    private static final long NULL_HASH = 0x9e3779b97f4a7c15L;

    private static final Set<Class<?>> SCALAR_TYPES = Set.of(
        String.class, Boolean.class, Character.class,
        Byte.class, Short.class, Integer.class, Long.class, Float.class, Double.class,
        BigInteger.class, BigDecimal.class, UUID.class,
        Instant.class, Duration.class, Period.class,
        LocalDate.class, LocalTime.class, LocalDateTime.class,
        OffsetDateTime.class, ZonedDateTime.class
    );

    @Override
    public CacheKey encode(Object... args) {
        Object[] arguments = args == null ? new Object[] {null} : args;
        List<Object> components = new ArrayList<>(arguments.length);
        for (int i = 0; i < arguments.length; i++) {
            components.add(canonicalize(arguments[i], i));
        }
        List<Object> tuple = Collections.unmodifiableList(components);
        return new CacheKey(fingerprint(tuple), tuple);
    }

    private Object canonicalize(Object value, int position) {
        if (value == null || value instanceof CacheKey || value instanceof Enum) {
            return value;
        }
        Class<?> type = value.getClass();
        if (SCALAR_TYPES.contains(type)) {
            return value;
        }
        if (type.isArray()) {
            int length = Array.getLength(value);
            List<Object> copy = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                copy.add(canonicalize(Array.get(value, i), position));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>(((List<?>) value).size());
            for (Object element : (List<?>) value) {
                copy.add(canonicalize(element, position));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Set) {
            Set<Object> copy = new HashSet<>();
            for (Object element : (Set<?>) value) {
                copy.add(canonicalize(element, position));
            }
            return Collections.unmodifiableSet(copy);
        }
        if (value instanceof Map) {
            Map<Object, Object> copy = new HashMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                copy.put(canonicalize(e.getKey(), position), canonicalize(e.getValue(), position));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (type.isRecord()) {
            return canonicalizeRecord(value, type, position);
        }
        throw new UnencodableArgumentException(position, type);
    }

    private Object canonicalizeRecord(Object record, Class<?> type, int position) {
        RecordComponent[] recordComponents = type.getRecordComponents();
        List<Object> copy = new ArrayList<>(recordComponents.length + 1);
        copy.add(type);
        for (RecordComponent component : recordComponents) {
            Method accessor = component.getAccessor();
            Object componentValue;
            try {
                accessor.setAccessible(true);
                componentValue = accessor.invoke(record);
            } catch (IllegalAccessException | InvocationTargetException | RuntimeException e) {
                UnencodableArgumentException failure = new UnencodableArgumentException(position, type);
                failure.initCause(e);
                throw failure;
            }
            copy.add(canonicalize(componentValue, position));
        }
        return Collections.unmodifiableList(copy);
    }

    // Order-sensitive for lists, order-insensitive for sets and maps.
    private static long fingerprint(Object value) {
        if (value == null) {
            return NULL_HASH;
        }
        if (value instanceof List) {
            long h = FNV_OFFSET;
            for (Object element : (List<?>) value) {
                h = (h ^ fingerprint(element)) * FNV_PRIME;
            }
            return mix(h);
        }
        if (value instanceof Set) {
            long h = 0;
            for (Object element : (Collection<?>) value) {
                h += fingerprint(element);
            }
            return mix(h ^ 0x5bd1e995L);
        }
        if (value instanceof Map) {
            long h = 0;
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                h += mix(fingerprint(e.getKey()) * 31 + fingerprint(e.getValue()));
            }
            return mix(h ^ 0x27d4eb2fL);
        }
        if (value instanceof CacheKey) {
            return ((CacheKey) value).fingerprint();
        }
        if (value instanceof Enum) {
            Enum<?> constant = (Enum<?>) value;
            return mix(constant.getDeclaringClass().getName().hashCode() * 31L + constant.name().hashCode());
        }
        if (value instanceof Class) {
            return mix(((Class<?>) value).getName().hashCode());
        }
        return mix(value.getClass().getName().hashCode() * 31L + value.hashCode());
    }

    // splitmix64 finalizer
    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }
}
