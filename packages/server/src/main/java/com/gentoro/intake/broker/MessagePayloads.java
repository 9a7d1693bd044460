package com.gentoro.intake.broker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Extracts the file path from a delivery body.
 *
 * <p>The body is normally the UTF-8 path itself, taken verbatim apart from one trailing line
 * ending ({@code \n} or {@code \r\n}) that publishers commonly append. Bodies that look like a JSON object are also
 * accepted when they carry the path in one of {@link #PATH_FIELDS}, which is the envelope other
 * services of the pipeline publish.
 */
final class MessagePayloads {
  static final List<String> PATH_FIELDS = List.of("file_path", "path", "source");

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private MessagePayloads() {}

  static Optional<String> filePath(byte[] body) {
    if (body == null || body.length == 0) {
      return Optional.empty();
    }
    String text = stripLineEnding(new String(body, StandardCharsets.UTF_8));
    if (text.isBlank()) {
      return Optional.empty();
    }
    if (!text.stripLeading().startsWith("{")) {
      return Optional.of(text);
    }

    JsonNode node;
    try {
      node = MAPPER.readTree(text);
    } catch (IOException e) {
      return Optional.empty();
    }
    for (String field : PATH_FIELDS) {
      JsonNode value = node.get(field);
      if (value != null && value.isTextual() && !value.asText().isBlank()) {
        return Optional.of(value.asText());
      }
    }
    return Optional.empty();
  }

  private static String stripLineEnding(String text) {
    if (text.endsWith("\r\n")) {
      return text.substring(0, text.length() - 2);
    }
    if (text.endsWith("\n")) {
      return text.substring(0, text.length() - 1);
    }
    return text;
  }
}
