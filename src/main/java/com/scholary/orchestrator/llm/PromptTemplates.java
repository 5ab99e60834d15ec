package com.scholary.orchestrator.llm;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only table of named prompt templates.
 *
 * <p>Placeholders are written {@code {{name}}}. Text variables are inserted as-is, other JSON
 * values as JSON. Placeholders without a variable are left in place.
 */
public class PromptTemplates {

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.-]+)\\s*}}");

  private final Map<String, String> templates;

  public PromptTemplates(Map<String, String> templates) {
    this.templates = Map.copyOf(templates);
  }

  public Optional<String> find(String name) {
    return Optional.ofNullable(name).map(templates::get);
  }

  public boolean contains(String name) {
    return name != null && templates.containsKey(name);
  }

  public String render(String template, JsonNode variables) {
    Matcher matcher = PLACEHOLDER.matcher(template);
    StringBuilder rendered = new StringBuilder();
    while (matcher.find()) {
      JsonNode value = variables == null ? null : variables.get(matcher.group(1));
      String replacement =
          value == null ? matcher.group() : value.isTextual() ? value.asText() : value.toString();
      matcher.appendReplacement(rendered, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(rendered);
    return rendered.toString();
  }

  public int size() {
    return templates.size();
  }
}
