package com.entity.semantic.extract;

import com.entity.semantic.core.model.RecordNode;
import com.entity.semantic.core.model.SourceRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Derives the single canonical name of a record.
 *
 * <p>Rules, first match wins:</p>
 * <ol>
 *   <li>The first string field, in declaration order and depth-first, whose name ends in
 *       {@code NAME_FULL} or {@code NAME_ORG} (case-insensitive). A nested mapping is searched
 *       before the fields declared after it.</li>
 *   <li>Otherwise the first mapping, in the same order, holding any of {@code NAME_FIRST},
 *       {@code NAME_MIDDLE}, {@code NAME_LAST}; the non-empty parts are joined with single spaces.</li>
 *   <li>Otherwise the record has no canonical name.</li>
 * </ol>
 *
 * <p>Non-string name values are treated as absent. Sequences are descended like mappings.
 * The traversal is iterative, skips containers already visited (by identity) and treats
 * anything deeper than {@code maxDepth} as absent, so it always terminates.
 * Instances are stateless and thread-safe.</p>
 */
public class NameExtractor {

    public static final int DEFAULT_MAX_DEPTH = 64;

    private static final String[] FULL_NAME_SUFFIXES = {"NAME_FULL", "NAME_ORG"};
    private static final String[] NAME_PARTS = {"NAME_FIRST", "NAME_MIDDLE", "NAME_LAST"};

    private final int maxDepth;

    public NameExtractor() {
        this(DEFAULT_MAX_DEPTH);
    }

    public NameExtractor(int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be > 0");
        }
        this.maxDepth = maxDepth;
    }

    public Optional<String> extract(SourceRecord record) {
        return extract(record.body());
    }

    public Optional<String> extract(RecordNode record) {
        return extractWithSource(record).map(ExtractedName::value);
    }

    /**
     * Extracts the canonical name and reports which field produced it.
     */
    public Optional<ExtractedName> extractWithSource(RecordNode record) {
        if (record == null) {
            return Optional.empty();
        }
        Optional<ExtractedName> fullName = findFirst(record, this::fullNameAt);
        if (fullName.isPresent()) {
            return fullName;
        }
        return findFirst(record, frame -> frame.node() instanceof RecordNode.MapNode map
                ? namePartsIn(map, frame.path())
                : Optional.empty());
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    private Optional<ExtractedName> fullNameAt(Frame frame) {
        if (frame.field() == null || !(frame.node() instanceof RecordNode.ScalarNode scalar)
                || !isFullNameField(frame.field())) {
            return Optional.empty();
        }
        String value = clean(scalar.asText());
        return value == null ? Optional.empty()
                : Optional.of(new ExtractedName(value, frame.path(), ExtractedName.Rule.FULL_NAME_FIELD));
    }

    private Optional<ExtractedName> namePartsIn(RecordNode.MapNode node, String path) {
        List<String> parts = new ArrayList<>(NAME_PARTS.length);
        for (String part : NAME_PARTS) {
            String value = clean(fieldText(node, part));
            if (value != null) {
                parts.add(value);
            }
        }
        if (parts.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ExtractedName(String.join(" ", parts), path, ExtractedName.Rule.NAME_PARTS));
    }

    /**
     * Depth-first pre-order walk in field order. Every field, scalar or container, is offered
     * to the rule when it is reached, so a nested mapping is fully searched before the
     * fields that follow it.
     */
    private Optional<ExtractedName> findFirst(RecordNode root, FrameRule rule) {
        Set<RecordNode> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, "", null, 0));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            if (frame.depth() > maxDepth) {
                continue;
            }
            if (frame.node() instanceof RecordNode.ScalarNode) {
                Optional<ExtractedName> match = rule.apply(frame);
                if (match.isPresent()) {
                    return match;
                }
                continue;
            }
            // scalars are shared instances, so only containers are tracked
            if (!visited.add(frame.node())) {
                continue;
            }
            Optional<ExtractedName> match = rule.apply(frame);
            if (match.isPresent()) {
                return match;
            }
            List<Frame> children = new ArrayList<>();
            if (frame.node() instanceof RecordNode.MapNode map) {
                for (Map.Entry<String, RecordNode> field : map.fields().entrySet()) {
                    RecordNode value = field.getValue();
                    // a scalar field sits at the depth of its mapping
                    int depth = value instanceof RecordNode.ScalarNode ? frame.depth() : frame.depth() + 1;
                    children.add(new Frame(value, child(frame.path(), field.getKey()), field.getKey(), depth));
                }
            } else if (frame.node() instanceof RecordNode.ListNode list) {
                for (int i = 0; i < list.items().size(); i++) {
                    children.add(new Frame(list.items().get(i), frame.path() + "[" + i + "]",
                            null, frame.depth() + 1));
                }
            }
            pushReversed(stack, children);
        }
        return Optional.empty();
    }

    private static void pushReversed(Deque<Frame> stack, List<Frame> children) {
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }

    private static boolean isFullNameField(String fieldName) {
        String upper = fieldName.toUpperCase(Locale.ROOT);
        for (String suffix : FULL_NAME_SUFFIXES) {
            if (upper.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }

    private static String fieldText(RecordNode.MapNode node, String name) {
        for (Map.Entry<String, RecordNode> field : node.fields().entrySet()) {
            if (field.getKey().equalsIgnoreCase(name) && field.getValue() instanceof RecordNode.ScalarNode scalar) {
                String text = scalar.asText();
                if (text != null && !text.isBlank()) {
                    return text;
                }
            }
        }
        return null;
    }

    private static String clean(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String child(String path, String field) {
        return path.isEmpty() ? field : path + "." + field;
    }

    @FunctionalInterface
    private interface FrameRule {
        Optional<ExtractedName> apply(Frame frame);
    }

    private record Frame(RecordNode node, String path, String field, int depth) {}
}
