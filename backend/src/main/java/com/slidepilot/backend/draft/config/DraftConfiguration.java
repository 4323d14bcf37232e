package com.slidepilot.backend.draft.config;

import com.slidepilot.backend.draft.render.PresentationRenderer;
import com.slidepilot.backend.draft.render.PreviewPresentationRenderer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DraftConfiguration {

  @Bean
  @ConditionalOnMissingBean(PresentationRenderer.class)
  public PresentationRenderer presentationRenderer() {
    return new PreviewPresentationRenderer();
  }
}
