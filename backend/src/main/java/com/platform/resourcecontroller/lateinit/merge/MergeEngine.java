package com.platform.resourcecontroller.lateinit.merge;

import com.platform.resourcecontroller.error.HookFailedException;
import com.platform.resourcecontroller.error.MergeFailedException;
import com.platform.resourcecontroller.error.NotYetAvailableException;
import com.platform.resourcecontroller.error.ResourceControllerException;
import com.platform.resourcecontroller.fieldpath.FieldPathResolver;
import com.platform.resourcecontroller.fieldpath.FieldValue;
import com.platform.resourcecontroller.lateinit.hook.MergeHooks;
import com.platform.resourcecontroller.lateinit.ruleset.FieldRule;
import com.platform.resourcecontroller.lateinit.ruleset.Ruleset;
import com.platform.resourcecontroller.resource.DesiredRecord;
import com.platform.resourcecontroller.resource.ObservedRecord;
import com.platform.resourcecontroller.resource.SourceMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Copies late-initialized values from observed records into a desired record.
 * <p>
 * A value is copied only when the desired record lacks it: user-declared
 * values always win, and a value that was late-initialized once is final.
 * Rules run in ruleset order, so the outcome never depends on the iteration
 * order of the observation map.
 * <p>
 * The engine performs no I/O and holds no state. On a fatal result the
 * desired record may be partially mutated; callers discard it.
 */
@Slf4j
@Component
public class MergeEngine {

    public MergeResult merge(DesiredRecord desired, Map<SourceMethod, ObservedRecord> observations, Ruleset ruleset) {
        if (ruleset.isNoOp() || observations == null || observations.isEmpty()) {
            return MergeResult.unchanged();
        }

        Map<SourceMethod, ObservedRecord> byMethod = new EnumMap<>(SourceMethod.class);
        byMethod.putAll(observations);
        Map<SourceMethod, ObservedRecord> view = Collections.unmodifiableMap(byMethod);

        MergeHooks hooks = ruleset.getHooks();
        if (hooks.overrideAll() != null) {
            return invokeHook(hooks.overrideAll().name(),
                () -> hooks.overrideAll().hook().merge(desired, view, ruleset));
        }

        MergeResult result = MergeResult.unchanged();
        if (hooks.pre() != null) {
            MergeResult seed = result;
            result = invokeHook(hooks.pre().name(), () -> hooks.pre().hook().beforeMerge(desired, view, seed));
            if (result.isFatal()) {
                return result;
            }
        }

        for (FieldRule rule : ruleset.getRules()) {
            ObservedRecord observation = byMethod.get(rule.sourceMethod());
            if (observation == null) {
                continue;
            }

            MergeResult fieldResult = rule.hasOverrideHook()
                ? invokeHook(rule.overrideHook().name(),
                    () -> rule.overrideHook().hook().mergeField(desired, observation, rule, ruleset.getResolver()))
                : copyIfAbsent(desired, observation, rule, ruleset);

            if (fieldResult.isFatal()) {
                return fieldResult;
            }
            result = result.combine(fieldResult);
        }

        if (hooks.post() != null) {
            MergeResult computed = result;
            result = invokeHook(hooks.post().name(), () -> hooks.post().hook().afterMerge(desired, view, computed));
        }
        return result;
    }

    private MergeResult copyIfAbsent(DesiredRecord desired, ObservedRecord observation, FieldRule rule, Ruleset ruleset) {
        FieldPathResolver resolver = ruleset.getResolver();
        try {
            if (resolver.get(desired.getSpec(), rule.path()).present()) {
                return MergeResult.unchanged();
            }

            FieldValue observed = resolver.get(observation.spec(), rule.path());
            if (!observed.present()) {
                return rule.awaitValue()
                    ? MergeResult.notYetAvailable(NotYetAvailableException.forField(rule.path().expression()))
                    : MergeResult.unchanged();
            }

            resolver.set(desired.getSpec(), rule.path(), observed.value());
            log.debug("Late-initialized {} of {} from {}",
                rule.path(), desired.getIdentity(), observation.origin().configName());
            return MergeResult.changed();
        } catch (ResourceControllerException | IllegalArgumentException e) {
            return MergeResult.failed(new MergeFailedException(ruleset.getResourceType(), rule.path().expression(), e));
        }
    }

    private MergeResult invokeHook(String name, Supplier<MergeResult> hook) {
        try {
            MergeResult result = hook.get();
            return result != null ? result : MergeResult.unchanged();
        } catch (NotYetAvailableException e) {
            return MergeResult.notYetAvailable(e);
        } catch (MergeFailedException | HookFailedException e) {
            return MergeResult.failed(e);
        } catch (RuntimeException e) {
            log.warn("Late-initialization hook '{}' threw {}", name, e.toString());
            return MergeResult.failed(new HookFailedException(name, e));
        }
    }
}
