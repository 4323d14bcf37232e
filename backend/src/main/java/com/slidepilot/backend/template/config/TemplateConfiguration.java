package com.slidepilot.backend.template.config;

import com.slidepilot.backend.template.TemplateCatalog;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TemplateProperties.class)
public class TemplateConfiguration {

  @Bean
  public TemplateCatalog templateCatalog(TemplateProperties properties) {
    return new TemplateCatalog(properties);
  }
}
