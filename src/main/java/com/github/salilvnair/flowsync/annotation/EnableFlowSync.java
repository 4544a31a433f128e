package com.github.salilvnair.flowsync.annotation;

import com.github.salilvnair.flowsync.config.FlowSyncAutoConfiguration;
import org.springframework.context.annotation.Import;
import java.lang.annotation.*;

/**
 * Enables the interactive request broker, the prompt queue and the remote sync hub
 * (WebSocket endpoint plus REST surface) in the host application.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(FlowSyncAutoConfiguration.class)
public @interface EnableFlowSync {
}
