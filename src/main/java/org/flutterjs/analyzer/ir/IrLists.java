package org.flutterjs.analyzer.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Defensive-copy helpers for IR records. IR trees are immutable once constructed, and
 * deserialized records may receive {@code null} for absent collections.
 */
public final class IrLists {

    private IrLists() {}

    public static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    public static <T> Set<T> copy(Set<T> set) {
        return set == null ? Set.of() : Set.copyOf(set);
    }

    /**
     * Copies a map preserving its iteration order.
     */
    public static <K, V> Map<K, V> copy(Map<K, V> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
