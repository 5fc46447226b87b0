package com.umitunal.qcron.serialization;

import com.fasterxml.jackson.core.type.TypeReference;
import com.umitunal.qcron.config.StorageConfig;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Codecs for the string-keyed argument maps stored with each job.
 */
public final class ArgsCodecs {

    private ArgsCodecs() {
    }

    public static PayloadCodec<Map<String, Object>> forFormat(StorageConfig.ArgsFormat format) {
        switch (format) {
            case KRYO:
                return kryo();
            case JSON:
            default:
                return json();
        }
    }

    public static PayloadCodec<Map<String, Object>> json() {
        return new JsonCodec<>(new TypeReference<Map<String, Object>>() {});
    }

    /**
     * Kryo codec for argument maps. Maps and collections are copied into mutable JDK
     * collections before encoding, at every nesting level, so that immutable ones such as
     * {@code Map.of(...)} or {@code List.of(...)} can be stored.
     */
    @SuppressWarnings("unchecked")
    public static PayloadCodec<Map<String, Object>> kryo() {
        Class<Map<String, Object>> type = (Class<Map<String, Object>>) (Class<?>) HashMap.class;
        KryoCodec<Map<String, Object>> delegate = new KryoCodec<>(type);
        return new PayloadCodec<>() {
            @Override
            public byte[] encode(Map<String, Object> payload) {
                return delegate.encode((Map<String, Object>) mutableCopy(payload, HashMap::new));
            }

            @Override
            public Map<String, Object> decode(byte[] bytes) {
                return new LinkedHashMap<>(delegate.decode(bytes));
            }
        };
    }

    private static Object mutableCopy(Object value) {
        return mutableCopy(value, LinkedHashMap::new);
    }

    private static Object mutableCopy(Object value, Supplier<Map<Object, Object>> mapFactory) {
        if (value instanceof Map) {
            Map<Object, Object> copy = mapFactory.get();
            ((Map<?, ?>) value).forEach((k, v) -> copy.put(k, mutableCopy(v)));
            return copy;
        }
        if (value instanceof Set) {
            Set<Object> copy = new LinkedHashSet<>();
            ((Set<?>) value).forEach(v -> copy.add(mutableCopy(v)));
            return copy;
        }
        if (value instanceof Collection) {
            List<Object> copy = new ArrayList<>();
            ((Collection<?>) value).forEach(v -> copy.add(mutableCopy(v)));
            return copy;
        }
        return value;
    }
}
