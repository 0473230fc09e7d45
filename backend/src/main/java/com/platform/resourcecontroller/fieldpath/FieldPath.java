package com.platform.resourcecontroller.fieldpath;

import com.platform.resourcecontroller.error.InvalidFieldPathException;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Address of a field inside a structured record, e.g. {@code timeoutSeconds},
 * {@code network.subnetId} or {@code tags[team]}.
 * <p>
 * Segments are separated by dots. A segment may end with one bracketed map
 * key, which may itself contain dots. List indexing has no syntax of its
 * own; a bracket selector applied to a list fails at resolution time.
 */
public final class FieldPath {
    
    private final String expression;
    private final List<PathSegment> segments;
    
    private FieldPath(String expression, List<PathSegment> segments) {
        this.expression = expression;
        this.segments = List.copyOf(segments);
    }
    
    /**
     * @throws InvalidFieldPathException if the expression is malformed
     */
    public static FieldPath parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidFieldPathException(String.valueOf(expression), "path is empty");
        }
        
        List<PathSegment> segments = new ArrayList<>();
        StringBuilder member = new StringBuilder();
        String mapKey = null;
        int i = 0;
        
        while (i < expression.length()) {
            char c = expression.charAt(i);
            
            if (c == '.') {
                segments.add(segment(expression, member, mapKey));
                member.setLength(0);
                mapKey = null;
                i++;
            } else if (c == '[') {
                if (mapKey != null) {
                    throw new InvalidFieldPathException(expression, "only one map key per segment is supported");
                }
                int close = expression.indexOf(']', i + 1);
                if (close < 0) {
                    throw new InvalidFieldPathException(expression, "unbalanced '['");
                }
                mapKey = expression.substring(i + 1, close);
                if (mapKey.isEmpty()) {
                    throw new InvalidFieldPathException(expression, "empty map key");
                }
                i = close + 1;
                if (i < expression.length() && expression.charAt(i) != '.' && expression.charAt(i) != '[') {
                    throw new InvalidFieldPathException(expression, "unexpected text after ']'");
                }
            } else if (c == ']') {
                throw new InvalidFieldPathException(expression, "unbalanced ']'");
            } else if (mapKey != null) {
                throw new InvalidFieldPathException(expression, "unexpected text after ']'");
            } else {
                member.append(c);
                i++;
            }
        }
        segments.add(segment(expression, member, mapKey));
        
        return new FieldPath(expression, segments);
    }
    
    private static PathSegment segment(String expression, StringBuilder member, String mapKey) {
        String name = member.toString();
        if (name.isBlank()) {
            throw new InvalidFieldPathException(expression, "empty segment");
        }
        if (!name.equals(name.strip())) {
            throw new InvalidFieldPathException(expression, "whitespace around segment '" + name + "'");
        }
        return new PathSegment(name, mapKey);
    }
    
    public List<PathSegment> segments() {
        return segments;
    }
    
    public int depth() {
        return segments.size();
    }
    
    public PathSegment last() {
        return segments.get(segments.size() - 1);
    }
    
    public boolean hasMapKeys() {
        return segments.stream().anyMatch(PathSegment::hasMapKey);
    }
    
    public String expression() {
        return expression;
    }
    
    /**
     * Expression rebuilt from the parsed segments, used to detect duplicates
     * written in different spellings.
     */
    public String canonical() {
        return segments.stream().map(PathSegment::toString).collect(Collectors.joining("."));
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof FieldPath other && segments.equals(other.segments);
    }
    
    @Override
    public int hashCode() {
        return segments.hashCode();
    }
    
    @Override
    public String toString() {
        return expression;
    }
}
