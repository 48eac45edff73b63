package dev.founderfinder.github;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/** Lenient field access for GitHub payloads: absent or mistyped fields fall back to defaults. */
final class JsonFields {

  private JsonFields() {}

  static @Nullable String text(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (value.isMissingNode() || value.isNull() || value.isContainerNode()) {
      return null;
    }
    return value.asText();
  }

  static int count(JsonNode node, String field) {
    return Math.max(0, node.path(field).asInt(0));
  }
}
