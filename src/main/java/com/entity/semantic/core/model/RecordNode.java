package com.entity.semantic.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed tree for an arbitrarily nested record.
 * A node is a mapping (field name to node, in declaration order), a sequence, or a scalar.
 *
 * <p>Use {@link #fromObject(Object)} to convert the output of a JSON parser
 * ({@code Map}, {@code List}, strings, numbers, booleans, {@code null}).
 * Cyclic containers are cut: a container already on the conversion path becomes a null scalar.</p>
 */
public sealed interface RecordNode permits RecordNode.MapNode, RecordNode.ListNode, RecordNode.ScalarNode {

    /**
     * Mapping node. Field order is preserved.
     */
    record MapNode(Map<String, RecordNode> fields) implements RecordNode {
        public MapNode {
            fields = fields != null
                    ? Collections.unmodifiableMap(new LinkedHashMap<>(fields))
                    : Map.of();
        }
    }

    /**
     * Sequence node.
     */
    record ListNode(List<RecordNode> items) implements RecordNode {
        public ListNode {
            items = items != null ? List.copyOf(items) : List.of();
        }
    }

    /**
     * Scalar leaf. {@code value} is a String, Number, Boolean, or null.
     */
    record ScalarNode(Object value) implements RecordNode {

        public static final ScalarNode NULL = new ScalarNode(null);

        /**
         * Returns the value when it is a string, otherwise null.
         */
        public String asText() {
            return value instanceof String s ? s : null;
        }
    }

    /**
     * Converts a plain Java object graph into a record tree.
     */
    static RecordNode fromObject(Object value) {
        return convert(value, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    /**
     * Builds a mapping node from a field map, keeping its iteration order.
     */
    static MapNode fromMap(Map<String, ?> fields) {
        return (MapNode) fromObject(fields);
    }

    private static RecordNode convert(Object value, Set<Object> path) {
        if (value instanceof RecordNode node) {
            return node;
        }
        if (value instanceof Map<?, ?> map) {
            if (!path.add(map)) {
                return ScalarNode.NULL;
            }
            Map<String, RecordNode> fields = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                fields.put(String.valueOf(entry.getKey()), convert(entry.getValue(), path));
            }
            path.remove(map);
            return new MapNode(fields);
        }
        if (value instanceof List<?> list) {
            if (!path.add(list)) {
                return ScalarNode.NULL;
            }
            List<RecordNode> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(convert(item, path));
            }
            path.remove(list);
            return new ListNode(items);
        }
        if (value == null) {
            return ScalarNode.NULL;
        }
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return new ScalarNode(value);
        }
        return new ScalarNode(value.toString());
    }
}
