package com.slidepilot.backend.support;

import com.slidepilot.backend.template.TemplateCatalog;
import com.slidepilot.backend.template.config.TemplateProperties;
import java.util.List;

/** Template catalog used by unit tests: one guided template and one without guided mode. */
public final class TestTemplates {

  public static final String GREETING = "Hello! Tell me about your presentation.";
  public static final String SYSTEM_PROMPT = "You are a presentation consultant.";

  private TestTemplates() {}

  public static TemplateCatalog catalog() {
    return new TemplateCatalog(properties());
  }

  public static TemplateProperties properties() {
    TemplateProperties.GuidedMode guided = new TemplateProperties.GuidedMode();
    guided.setEnabled(true);
    guided.setGreeting(GREETING);
    guided.setConversationSystemPrompt(SYSTEM_PROMPT);
    guided.setRequiredInfo(List.of("Topic", "Audience"));

    TemplateProperties.Template general = new TemplateProperties.Template();
    general.setName("General presentation");
    general.setDescription("Any topic");
    general.setGuidedMode(guided);

    TemplateProperties.Template quick = new TemplateProperties.Template();
    quick.setName("Quick summary");

    TemplateProperties properties = new TemplateProperties();
    properties.getCatalog().put("general", general);
    properties.getCatalog().put("quick-summary", quick);
    return properties;
  }
}
