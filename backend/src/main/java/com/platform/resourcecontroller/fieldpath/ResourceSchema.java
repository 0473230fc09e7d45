package com.platform.resourcecontroller.fieldpath;

import com.platform.resourcecontroller.error.ConfigValidationException;
import com.platform.resourcecontroller.error.TypeMismatchException;
import com.platform.resourcecontroller.error.UnsupportedPathKindException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Typed description of a resource type's spec, declared in configuration as
 * {@code path: type} entries, for example:
 * <pre>
 * timeoutSeconds: integer
 * name: string required
 * network.subnetId: string
 * tags: map&lt;string&gt;
 * </pre>
 * Members named only as intermediates are implicit optional objects.
 * An empty schema leaves every path untyped.
 */
public final class ResourceSchema {
    
    private static final ResourceSchema EMPTY = new ResourceSchema(Map.of());
    
    private final Map<String, FieldDefinition> members;
    
    private ResourceSchema(Map<String, FieldDefinition> members) {
        this.members = members;
    }
    
    public static ResourceSchema empty() {
        return EMPTY;
    }
    
    public boolean isEmpty() {
        return members.isEmpty();
    }
    
    /**
     * Resolves the declaration addressed by a path.
     *
     * @return the terminal definition, or empty if the path is not declared
     * @throws UnsupportedPathKindException if the path runs into a list
     * @throws TypeMismatchException if the path selects into a declared scalar,
     *     or applies a map key to a non-map field
     */
    public Optional<FieldDefinition> resolve(FieldPath path) {
        Map<String, FieldDefinition> scope = members;
        FieldDefinition current = null;
        
        for (PathSegment segment : path.segments()) {
            if (current != null) {
                if (current.type() != FieldType.OBJECT) {
                    throw new TypeMismatchException(path.expression(), "object", current.describe());
                }
                scope = current.members();
            }
            
            current = scope.get(segment.member());
            if (current == null) {
                return Optional.empty();
            }
            rejectList(path, current);
            
            if (segment.hasMapKey()) {
                if (current.type() != FieldType.MAP) {
                    throw new TypeMismatchException(path.expression(), "map", current.describe());
                }
                current = current.entryDefinition();
                rejectList(path, current);
            }
        }
        return Optional.ofNullable(current);
    }
    
    private static void rejectList(FieldPath path, FieldDefinition definition) {
        if (definition.type() == FieldType.LIST) {
            throw new UnsupportedPathKindException(path.expression(), "list-typed fields are not addressable");
        }
    }
    
    /**
     * Builds a schema from {@code path -> declaration} entries.
     *
     * @throws ConfigValidationException for unknown types or conflicting declarations
     */
    public static ResourceSchema fromDeclarations(String resourceType, Map<String, String> declarations) {
        if (declarations == null || declarations.isEmpty()) {
            return EMPTY;
        }
        
        Node root = new Node(FieldType.OBJECT, null, false);
        for (Map.Entry<String, String> entry : declarations.entrySet()) {
            FieldPath path = FieldPath.parse(entry.getKey());
            if (path.hasMapKeys()) {
                throw new ConfigValidationException(resourceType,
                    "Schema path '" + path + "' must not contain map keys");
            }
            root.declare(resourceType, path, 0, parseDeclaration(resourceType, path, entry.getValue()));
        }
        return new ResourceSchema(root.freezeMembers());
    }
    
    private static Node parseDeclaration(String resourceType, FieldPath path, String declaration) {
        if (declaration == null || declaration.isBlank()) {
            throw new ConfigValidationException(resourceType, "Schema path '" + path + "' has no type");
        }
        String[] tokens = declaration.trim().split("\\s+");
        if (tokens.length > 2 || (tokens.length == 2 && !"required".equalsIgnoreCase(tokens[1]))) {
            throw new ConfigValidationException(resourceType,
                "Schema path '" + path + "' has unrecognized declaration '" + declaration + "'");
        }
        boolean required = tokens.length == 2;
        String typeToken = tokens[0];
        
        try {
            if (typeToken.toLowerCase(Locale.ROOT).startsWith("map<") && typeToken.endsWith(">")) {
                FieldType valueType = FieldType.fromConfig(typeToken.substring(4, typeToken.length() - 1));
                return new Node(FieldType.MAP, valueType, required);
            }
            FieldType type = FieldType.fromConfig(typeToken);
            if (type == FieldType.MAP) {
                throw new ConfigValidationException(resourceType,
                    "Schema path '" + path + "' must declare its map value type, e.g. map<string>");
            }
            return new Node(type, null, required);
        } catch (IllegalArgumentException e) {
            throw new ConfigValidationException(resourceType,
                "Schema path '" + path + "' has unknown type '" + typeToken + "'", e);
        }
    }
    
    private static final class Node {
        private final FieldType type;
        private final FieldType valueType;
        private final boolean required;
        private boolean explicit;
        private final Map<String, Node> members = new LinkedHashMap<>();
        
        Node(FieldType type, FieldType valueType, boolean required) {
            this.type = type;
            this.valueType = valueType;
            this.required = required;
        }
        
        void declare(String resourceType, FieldPath path, int index, Node declared) {
            String member = path.segments().get(index).member();
            Node existing = members.get(member);
            
            if (index == path.depth() - 1) {
                if (existing != null && existing.explicit) {
                    throw new ConfigValidationException(resourceType, "Schema path '" + path + "' declared twice");
                }
                if (existing != null && declared.type != FieldType.OBJECT) {
                    throw new ConfigValidationException(resourceType,
                        "Schema path '" + path + "' has nested members but is declared " + declared.type.configName());
                }
                declared.explicit = true;
                if (existing != null) {
                    declared.members.putAll(existing.members);
                }
                members.put(member, declared);
                return;
            }
            
            if (existing == null) {
                existing = new Node(FieldType.OBJECT, null, false);
                members.put(member, existing);
            } else if (existing.type != FieldType.OBJECT) {
                throw new ConfigValidationException(resourceType,
                    "Schema path '" + path + "' descends into " + existing.type.configName() + " field '" + member + "'");
            }
            existing.declare(resourceType, path, index + 1, declared);
        }
        
        Map<String, FieldDefinition> freezeMembers() {
            Map<String, FieldDefinition> frozen = new LinkedHashMap<>();
            members.forEach((name, node) -> frozen.put(name,
                new FieldDefinition(node.type, node.valueType, node.required, node.freezeMembers())));
            return Map.copyOf(frozen);
        }
    }
}
