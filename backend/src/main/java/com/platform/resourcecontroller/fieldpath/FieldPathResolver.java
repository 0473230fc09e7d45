package com.platform.resourcecontroller.fieldpath;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.resourcecontroller.error.TypeMismatchException;
import com.platform.resourcecontroller.error.UnsupportedPathKindException;

import java.util.Locale;
import java.util.Optional;

/**
 * Reads and writes fields of a Jackson object tree through a {@link FieldPath}.
 * <p>
 * Reads treat a missing, null or non-object intermediate as "not present" and
 * never fail on them. Writes allocate missing intermediates. Both reject
 * lists: list-typed fields are not addressable.
 * <p>
 * Instances are immutable and safe to share across threads.
 */
public final class FieldPathResolver {

    private static final FieldPathResolver UNTYPED = new FieldPathResolver(ResourceSchema.empty());

    private final ResourceSchema schema;

    public FieldPathResolver(ResourceSchema schema) {
        this.schema = schema;
    }

    public static FieldPathResolver untyped() {
        return UNTYPED;
    }

    public ResourceSchema schema() {
        return schema;
    }

    /**
     * Reads the value at {@code path}.
     *
     * @throws UnsupportedPathKindException if the path runs into a list
     */
    public FieldValue get(ObjectNode root, FieldPath path) {
        schema.resolve(path);
        if (root == null) {
            return FieldValue.absent();
        }

        JsonNode node = root;
        for (PathSegment segment : path.segments()) {
            if (!node.isObject()) {
                return FieldValue.absent();
            }
            node = descend(path, node.get(segment.member()));
            if (node == null) {
                return FieldValue.absent();
            }
            if (segment.hasMapKey()) {
                if (!node.isObject()) {
                    return FieldValue.absent();
                }
                node = descend(path, node.get(segment.mapKey()));
                if (node == null) {
                    return FieldValue.absent();
                }
            }
        }
        return FieldValue.of(node);
    }

    /**
     * Writes a deep copy of {@code value} at {@code path}.
     *
     * @throws UnsupportedPathKindException if the path or the value is a list
     * @throws TypeMismatchException if an intermediate is not an object, or
     *     the value does not fit the declared type of the target
     * @throws IllegalArgumentException if the value is absent
     */
    public void set(ObjectNode root, FieldPath path, JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            throw new IllegalArgumentException("Cannot set absent value at " + path);
        }
        if (value.isArray()) {
            throw new UnsupportedPathKindException(path.expression(), "list values are not merged");
        }
        Optional<FieldDefinition> declared = schema.resolve(path);
        if (declared.isPresent() && !declared.get().type().accepts(value)) {
            throw new TypeMismatchException(path.expression(), declared.get().describe(), describe(value));
        }

        ObjectNode container = root;
        int last = path.depth() - 1;
        for (int i = 0; i < last; i++) {
            PathSegment segment = path.segments().get(i);
            container = childObject(path, container, segment.member());
            if (segment.hasMapKey()) {
                container = childObject(path, container, segment.mapKey());
            }
        }

        PathSegment terminal = path.last();
        if (terminal.hasMapKey()) {
            childObject(path, container, terminal.member()).set(terminal.mapKey(), value.deepCopy());
        } else {
            container.set(terminal.member(), value.deepCopy());
        }
    }

    private static JsonNode descend(FieldPath path, JsonNode child) {
        if (child == null || child.isNull() || child.isMissingNode()) {
            return null;
        }
        if (child.isArray()) {
            throw new UnsupportedPathKindException(path.expression(), "list traversal is not supported");
        }
        return child;
    }

    private static ObjectNode childObject(FieldPath path, ObjectNode parent, String name) {
        JsonNode child = parent.get(name);
        if (child == null || child.isNull() || child.isMissingNode()) {
            return parent.putObject(name);
        }
        if (child.isArray()) {
            throw new UnsupportedPathKindException(path.expression(), "list traversal is not supported");
        }
        if (!child.isObject()) {
            throw new TypeMismatchException(path.expression(), "object at '" + name + "'", describe(child));
        }
        return (ObjectNode) child;
    }

    private static String describe(JsonNode value) {
        return value.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
