package com.slidepilot.backend.template.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Presentation templates keyed by template id, bound from {@code app.templates}. */
@ConfigurationProperties(prefix = "app.templates")
public class TemplateProperties {

  private String defaultTemplate = "general";

  private Map<String, Template> catalog = new LinkedHashMap<>();

  public String getDefaultTemplate() {
    return defaultTemplate;
  }

  public void setDefaultTemplate(String defaultTemplate) {
    this.defaultTemplate = defaultTemplate;
  }

  public Map<String, Template> getCatalog() {
    return catalog;
  }

  public void setCatalog(Map<String, Template> catalog) {
    this.catalog = catalog;
  }

  public static class Template {

    private String name;
    private String description = "";
    private GuidedMode guidedMode = new GuidedMode();

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public String getDescription() {
      return description;
    }

    public void setDescription(String description) {
      this.description = description;
    }

    public GuidedMode getGuidedMode() {
      return guidedMode;
    }

    public void setGuidedMode(GuidedMode guidedMode) {
      this.guidedMode = guidedMode;
    }
  }

  public static class GuidedMode {

    private boolean enabled;
    private String greeting = "";
    private String conversationSystemPrompt = "";
    private List<String> requiredInfo = new ArrayList<>();

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getGreeting() {
      return greeting;
    }

    public void setGreeting(String greeting) {
      this.greeting = greeting;
    }

    public String getConversationSystemPrompt() {
      return conversationSystemPrompt;
    }

    public void setConversationSystemPrompt(String conversationSystemPrompt) {
      this.conversationSystemPrompt = conversationSystemPrompt;
    }

    public List<String> getRequiredInfo() {
      return requiredInfo;
    }

    public void setRequiredInfo(List<String> requiredInfo) {
      this.requiredInfo = requiredInfo;
    }
  }
}
