package com.platform.resourcecontroller.lateinit.ruleset;

import com.platform.resourcecontroller.error.ConfigValidationException;
import com.platform.resourcecontroller.error.ResourceControllerException;
import com.platform.resourcecontroller.fieldpath.FieldDefinition;
import com.platform.resourcecontroller.fieldpath.FieldPath;
import com.platform.resourcecontroller.fieldpath.FieldPathResolver;
import com.platform.resourcecontroller.fieldpath.ResourceSchema;
import com.platform.resourcecontroller.lateinit.hook.FieldMergeHook;
import com.platform.resourcecontroller.lateinit.hook.HookRegistry;
import com.platform.resourcecontroller.lateinit.hook.MergeHooks;
import com.platform.resourcecontroller.lateinit.hook.MergeOverrideHook;
import com.platform.resourcecontroller.lateinit.hook.NamedHook;
import com.platform.resourcecontroller.lateinit.hook.PostMergeHook;
import com.platform.resourcecontroller.lateinit.hook.PreMergeHook;
import com.platform.resourcecontroller.lateinit.ruleset.LateInitProperties.BackoffProperties;
import com.platform.resourcecontroller.lateinit.ruleset.LateInitProperties.FieldRuleProperties;
import com.platform.resourcecontroller.lateinit.ruleset.LateInitProperties.HookProperties;
import com.platform.resourcecontroller.lateinit.ruleset.LateInitProperties.ResourceTypeProperties;
import com.platform.resourcecontroller.resource.SourceMethod;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Validates {@link LateInitProperties} and turns it into immutable rulesets.
 * Every problem is reported as a {@link ConfigValidationException}.
 */
@Slf4j
public class RulesetLoader {

    private final HookRegistry hookRegistry;

    public RulesetLoader(HookRegistry hookRegistry) {
        this.hookRegistry = hookRegistry;
    }

    public RulesetRegistry load(LateInitProperties properties) {
        SourceMethod globalDefault = parseSourceMethod(null, properties.getDefaultSourceMethod(), "default-source-method");
        BackoffSettings globalBackoff = toBackoff(null, properties.getBackoff());

        Map<String, Ruleset> rulesets = new LinkedHashMap<>();
        properties.getResources().forEach((resourceType, typeProperties) -> rulesets.put(resourceType,
            loadResourceType(resourceType, typeProperties, globalDefault, globalBackoff, properties.isStrict())));

        log.info("Loaded late-initialization rulesets for {} resource types (default source method: {})",
            rulesets.size(), globalDefault.configName());
        return new RulesetRegistry(rulesets, globalDefault, globalBackoff);
    }

    Ruleset loadResourceType(
            String resourceType,
            ResourceTypeProperties properties,
            SourceMethod globalDefault,
            BackoffSettings globalBackoff,
            boolean strict) {

        HookProperties hookProperties = properties.getHooks() != null ? properties.getHooks() : new HookProperties();
        List<FieldRuleProperties> fields = properties.getFields() != null ? properties.getFields() : List.of();

        if (fields.isEmpty() && hookProperties.isEmpty()) {
            if (strict) {
                throw new ConfigValidationException(resourceType, "Resource type declares no field rules and no hooks");
            }
            log.warn("[{}] Resource type declares no field rules and no hooks; merge will be a pass-through", resourceType);
        }

        Set<SourceMethod> operations = parseOperations(resourceType, properties.getOperations());
        SourceMethod typeDefault = properties.getDefaultSourceMethod() != null
            ? parseSourceMethod(resourceType, properties.getDefaultSourceMethod(), "default-source-method")
            : globalDefault;
        ResourceSchema schema = buildSchema(resourceType, properties.getSchema());
        FieldPathResolver resolver = new FieldPathResolver(schema);

        Map<FieldPath, FieldRule> rules = new LinkedHashMap<>();
        for (FieldRuleProperties field : fields) {
            FieldRule rule = toRule(resourceType, field, typeDefault, operations, schema);
            FieldRule previous = rules.put(rule.path(), rule);
            if (previous != null) {
                if (strict) {
                    throw new ConfigValidationException(resourceType,
                        "Duplicate field rule for path '" + rule.path().canonical() + "'");
                }
                log.warn("[{}] Duplicate field rule for '{}'; the last declaration wins",
                    resourceType, rule.path().canonical());
            }
        }

        Ruleset ruleset = Ruleset.builder()
            .resourceType(resourceType)
            .rules(List.copyOf(rules.values()))
            .supportedOperations(operations)
            .defaultSourceMethod(typeDefault)
            .hooks(toHooks(resourceType, hookProperties))
            .resolver(resolver)
            .backoff(properties.getBackoff() != null ? toBackoff(resourceType, properties.getBackoff()) : globalBackoff)
            .build();

        log.debug("[{}] Loaded {}", resourceType, ruleset);
        return ruleset;
    }

    private FieldRule toRule(
            String resourceType,
            FieldRuleProperties field,
            SourceMethod typeDefault,
            Set<SourceMethod> operations,
            ResourceSchema schema) {

        FieldPath path = parsePath(resourceType, field.getPath());

        SourceMethod sourceMethod = field.getSourceMethod() != null
            ? parseSourceMethod(resourceType, field.getSourceMethod(), "source-method of '" + path + "'")
            : typeDefault;
        if (!operations.contains(sourceMethod)) {
            throw new ConfigValidationException(resourceType, String.format(
                "Field '%s' takes its value from '%s', which the resource type does not support",
                path, sourceMethod.configName()));
        }

        if (!schema.isEmpty()) {
            validateAgainstSchema(resourceType, path, schema);
        }

        NamedHook<FieldMergeHook> overrideHook = field.getOverrideHook() != null
            ? requireHook(resourceType, field.getOverrideHook(), "field", hookRegistry::fieldHook)
            : null;

        return new FieldRule(path, sourceMethod, overrideHook, field.isAwaitValue());
    }

    private static void validateAgainstSchema(String resourceType, FieldPath path, ResourceSchema schema) {
        Optional<FieldDefinition> definition;
        try {
            definition = schema.resolve(path);
        } catch (ResourceControllerException e) {
            throw new ConfigValidationException(resourceType, e.getMessage(), e);
        }
        if (definition.isEmpty()) {
            throw new ConfigValidationException(resourceType, "Field '" + path + "' is not declared in the schema");
        }
        if (definition.get().required()) {
            throw new ConfigValidationException(resourceType,
                "Field '" + path + "' is required; only optional fields can be late-initialized");
        }
    }

    private MergeHooks toHooks(String resourceType, HookProperties properties) {
        if (properties.getOverrideAll() != null && (properties.getPre() != null || properties.getPost() != null)) {
            throw new ConfigValidationException(resourceType,
                "override-all hook cannot be combined with pre or post hooks");
        }
        if (properties.isEmpty()) {
            return MergeHooks.none();
        }

        NamedHook<MergeOverrideHook> overrideAll = properties.getOverrideAll() != null
            ? requireHook(resourceType, properties.getOverrideAll(), "override-all", hookRegistry::overrideHook)
            : null;
        NamedHook<PreMergeHook> pre = properties.getPre() != null
            ? requireHook(resourceType, properties.getPre(), "pre", hookRegistry::preHook)
            : null;
        NamedHook<PostMergeHook> post = properties.getPost() != null
            ? requireHook(resourceType, properties.getPost(), "post", hookRegistry::postHook)
            : null;
        return new MergeHooks(overrideAll, pre, post);
    }

    private static <T> NamedHook<T> requireHook(
            String resourceType, String name, String kind, Function<String, Optional<NamedHook<T>>> lookup) {
        return lookup.apply(name).orElseThrow(() -> new ConfigValidationException(resourceType,
            String.format("No %s hook bean named '%s'", kind, name)));
    }

    private static FieldPath parsePath(String resourceType, String expression) {
        try {
            return FieldPath.parse(expression);
        } catch (ConfigValidationException e) {
            throw new ConfigValidationException(resourceType, e.getMessage(), e);
        }
    }

    private static ResourceSchema buildSchema(String resourceType, Map<String, String> declarations) {
        try {
            return ResourceSchema.fromDeclarations(resourceType, declarations);
        } catch (ConfigValidationException e) {
            if (e.getResourceType() != null) {
                throw e;
            }
            throw new ConfigValidationException(resourceType, e.getMessage(), e);
        }
    }

    private static Set<SourceMethod> parseOperations(String resourceType, List<String> operations) {
        if (operations == null || operations.isEmpty()) {
            throw new ConfigValidationException(resourceType, "Resource type declares no supported operations");
        }
        Set<SourceMethod> parsed = EnumSet.noneOf(SourceMethod.class);
        for (String operation : operations) {
            parsed.add(parseSourceMethod(resourceType, operation, "operations"));
        }
        return parsed;
    }

    private static SourceMethod parseSourceMethod(String resourceType, String value, String setting) {
        try {
            return SourceMethod.fromConfig(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigValidationException(resourceType,
                String.format("Invalid %s '%s': expected one of read, create, update", setting, value), e);
        }
    }

    private static BackoffSettings toBackoff(String resourceType, BackoffProperties properties) {
        try {
            return new BackoffSettings(
                properties.getMin(), properties.getMax(), properties.getMultiplier(), properties.getJitterFactor());
        } catch (IllegalArgumentException e) {
            throw new ConfigValidationException(resourceType, "Invalid backoff: " + e.getMessage(), e);
        }
    }
}
