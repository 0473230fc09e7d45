package com.platform.resourcecontroller.config;

import com.platform.resourcecontroller.lateinit.hook.FieldMergeHook;
import com.platform.resourcecontroller.lateinit.hook.HookRegistry;
import com.platform.resourcecontroller.lateinit.hook.MergeOverrideHook;
import com.platform.resourcecontroller.lateinit.hook.PostMergeHook;
import com.platform.resourcecontroller.lateinit.hook.PreMergeHook;
import com.platform.resourcecontroller.lateinit.ruleset.LateInitProperties;
import com.platform.resourcecontroller.lateinit.ruleset.RulesetLoader;
import com.platform.resourcecontroller.lateinit.ruleset.RulesetRegistry;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Wires late-initialization rulesets, hook beans and the scheduler used for
 * delayed requeues and resync.
 */
@Configuration
public class LateInitConfig {
    
    /**
     * Hooks are looked up by bean name, so a ruleset refers to a hook by the
     * name of the bean implementing it.
     */
    @Bean
    public HookRegistry hookRegistry(ListableBeanFactory beanFactory) {
        return new HookRegistry(
            beanFactory.getBeansOfType(MergeOverrideHook.class),
            beanFactory.getBeansOfType(PreMergeHook.class),
            beanFactory.getBeansOfType(PostMergeHook.class),
            beanFactory.getBeansOfType(FieldMergeHook.class)
        );
    }
    
    /**
     * Invalid configuration fails application startup.
     */
    @Bean
    public RulesetRegistry rulesetRegistry(HookRegistry hookRegistry, LateInitProperties properties) {
        return new RulesetLoader(hookRegistry).load(properties);
    }
    
    @Bean
    public ThreadPoolTaskScheduler taskScheduler(
            @Value("${resource-controller.reconcile.scheduler-pool-size:2}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("reconcile-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
