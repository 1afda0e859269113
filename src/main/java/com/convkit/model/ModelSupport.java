package com.convkit.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Defensive copies that keep model records immutable. */
final class ModelSupport {

    private ModelSupport() {}

    static <E> List<E> list(List<E> list) {
        return list == null ? null : List.copyOf(list);
    }

    static Map<String, JsonNode> json(Map<String, JsonNode> map) {
        return map == null ? null : copy(map);
    }

    /** Extension bags are never null; an absent bag is empty. */
    static Map<String, JsonNode> bag(Map<String, JsonNode> map) {
        return map == null || map.isEmpty() ? Map.of() : copy(map);
    }

    // insertion order is kept so encoded objects list keys as received
    private static Map<String, JsonNode> copy(Map<String, JsonNode> map) {
        var out = new LinkedHashMap<String, JsonNode>();
        map.forEach((k, v) -> out.put(k, v == null ? NullNode.getInstance() : v.deepCopy()));
        return Collections.unmodifiableMap(out);
    }
}
