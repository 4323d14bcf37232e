package com.slidepilot.backend.quick.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(QuickGenerationProperties.class)
public class QuickGenerationConfiguration {}
