package com.github.salilvnair.flowsync.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.context.annotation.ComponentScan;

@AutoConfiguration
@ComponentScan(basePackages = "com.github.salilvnair.flowsync")
public class FlowSyncAutoConfiguration {
}
