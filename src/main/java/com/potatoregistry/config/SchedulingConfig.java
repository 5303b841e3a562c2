package com.potatoregistry.config;

import com.potatoregistry.gc.MaintenanceScheduler;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "registry.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class SchedulingConfig implements SchedulingConfigurer {

    private final MaintenanceScheduler maintenance;
    private final RegistryProperties props;

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        registrar.addFixedDelayTask(maintenance::reconcileTick, props.reconcile().interval());
        registrar.addFixedDelayTask(maintenance::gcTick, props.gc().interval());
    }
}
