package com.slidepilot.backend.template;

import com.slidepilot.backend.common.exception.ErrorCode;
import com.slidepilot.backend.common.exception.InvalidStateException;
import com.slidepilot.backend.common.exception.NotFoundException;
import com.slidepilot.backend.template.TemplateDefinition.GuidedConversation;
import com.slidepilot.backend.template.config.TemplateProperties;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/** Read-only view of the configured presentation templates. */
public class TemplateCatalog {

  private static final Logger log = LoggerFactory.getLogger(TemplateCatalog.class);

  static final String DEFAULT_GREETING =
      "Hello! I'll help you create a presentation. Tell me about your idea.";

  private final Map<String, TemplateDefinition> templates;
  private final String defaultTemplate;

  public TemplateCatalog(TemplateProperties properties) {
    Map<String, TemplateDefinition> definitions = new LinkedHashMap<>();
    properties
        .getCatalog()
        .forEach((key, template) -> definitions.put(key, toDefinition(key, template)));
    this.templates = Collections.unmodifiableMap(definitions);
    this.defaultTemplate = properties.getDefaultTemplate();
    log.info("Loaded {} presentation templates", templates.size());
  }

  public Optional<TemplateDefinition> find(String key) {
    if (key == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(templates.get(key));
  }

  public TemplateDefinition require(String key) {
    return find(key).orElseThrow(() -> NotFoundException.template(key));
  }

  /**
   * Resolves a template that can drive a guided conversation.
   *
   * @throws NotFoundException if the template does not exist
   * @throws InvalidStateException if the template does not enable guided mode
   */
  public TemplateDefinition requireGuided(String key) {
    TemplateDefinition template = require(key);
    if (!template.supportsGuidedMode()) {
      throw new InvalidStateException(
          ErrorCode.GUIDED_MODE_NOT_SUPPORTED,
          "Template '" + key + "' does not support guided mode");
    }
    return template;
  }

  public List<TemplateDefinition> guidedTemplates() {
    return templates.values().stream().filter(TemplateDefinition::supportsGuidedMode).toList();
  }

  public String defaultTemplate() {
    return defaultTemplate;
  }

  private TemplateDefinition toDefinition(String key, TemplateProperties.Template template) {
    String name = StringUtils.hasText(template.getName()) ? template.getName().trim() : key;
    String description = template.getDescription() != null ? template.getDescription().trim() : "";
    TemplateProperties.GuidedMode guidedMode = template.getGuidedMode();
    GuidedConversation guided = null;
    if (guidedMode != null && guidedMode.isEnabled()) {
      String greeting =
          StringUtils.hasText(guidedMode.getGreeting())
              ? guidedMode.getGreeting().trim()
              : DEFAULT_GREETING;
      String systemPrompt =
          guidedMode.getConversationSystemPrompt() != null
              ? guidedMode.getConversationSystemPrompt().trim()
              : "";
      guided = new GuidedConversation(greeting, systemPrompt, guidedMode.getRequiredInfo());
    }
    return new TemplateDefinition(key, name, description, guided);
  }
}
