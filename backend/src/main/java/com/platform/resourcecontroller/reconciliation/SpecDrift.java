package com.platform.resourcecontroller.reconciliation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.Map;

/**
 * Drift check that only looks at what the user declared.
 */
public final class SpecDrift {
    
    private SpecDrift() {
    }
    
    /**
     * True if any non-null field of {@code desired} differs from {@code actual}.
     * Objects are compared member by member; other values by equality.
     */
    public static boolean declaredFieldsDiffer(JsonNode desired, JsonNode actual) {
        if (desired == null || desired.isNull()) {
            return false;
        }
        if (actual == null || actual.isNull() || actual.isMissingNode()) {
            return true;
        }
        if (desired.isObject() && actual.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = desired.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (declaredFieldsDiffer(field.getValue(), actual.get(field.getKey()))) {
                    return true;
                }
            }
            return false;
        }
        return !desired.equals(actual);
    }
}
