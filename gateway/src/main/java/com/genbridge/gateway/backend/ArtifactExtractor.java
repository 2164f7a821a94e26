package com.genbridge.gateway.backend;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects artifact references from the {@code output} section of a REST reply.
 *
 * Providers spread results over several shapes:
 * <pre>
 *   { "video_url": "..." }                                      flat scalar
 *   { "results": [ {"url": "..."}, ... ] }                      result list
 *   { "audio": { "url": "..." } }                               nested record
 *   { "choices": [ { "message": { "content": ... } } ] }        conversation reply
 * </pre>
 * where {@code content} may be a string, a list of strings and records, or a
 * single record. Every non-empty reference is collected in the order the
 * fields appear in the reply. Shapes that match none of the above contribute
 * nothing; this class never throws on unexpected structure.
 */
@Component
public class ArtifactExtractor {

    private static final Set<String> SCALAR_FIELDS  = Set.of("video_url", "image_url", "audio_url", "url");
    private static final Set<String> CONTENT_FIELDS = Set.of("image", "video", "audio", "url");

    public List<String> fromOutput(JsonNode output) {
        List<String> found = new ArrayList<>();
        if (output == null || !output.isObject()) {
            return found;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = output.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            JsonNode value = field.getValue();
            if (SCALAR_FIELDS.contains(name)) {
                addText(found, value);
            } else if ("results".equals(name)) {
                collectResults(found, value);
            } else if ("choices".equals(name)) {
                collectChoices(found, value);
            } else if ("audio".equals(name) || "video".equals(name)) {
                if (value.isObject()) addText(found, value.get("url"));
            }
        }
        return found;
    }

    private void collectResults(List<String> found, JsonNode results) {
        if (!results.isArray()) return;
        for (JsonNode item : results) {
            if (item.isTextual()) {
                addText(found, item);
            } else if (item.isObject()) {
                addText(found, item.get("url"));
            }
        }
    }

    private void collectChoices(List<String> found, JsonNode choices) {
        if (!choices.isArray()) return;
        for (JsonNode choice : choices) {
            JsonNode message = choice.path("message");
            if (message.isObject()) {
                collectContent(found, message.get("content"));
            }
        }
    }

    private void collectContent(List<String> found, JsonNode content) {
        if (content == null) return;
        if (content.isTextual()) {
            addUrl(found, content);
        } else if (content.isArray()) {
            for (JsonNode item : content) {
                if (item.isTextual()) {
                    addUrl(found, item);
                } else if (item.isObject()) {
                    collectContentItem(found, item);
                }
            }
        } else if (content.isObject()) {
            collectContentItem(found, content);
        }
    }

    // {"text": ...} items are prose, not artifacts
    private void collectContentItem(List<String> found, JsonNode item) {
        Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (CONTENT_FIELDS.contains(field.getKey())) {
                addText(found, field.getValue());
            }
        }
    }

    private static void addText(List<String> found, JsonNode node) {
        if (node != null && node.isTextual() && !node.asText().isBlank()) {
            found.add(node.asText());
        }
    }

    // Bare strings inside a conversation reply are only artifacts when they are links.
    private static void addUrl(List<String> found, JsonNode node) {
        String text = node.asText();
        if (text.startsWith("http://") || text.startsWith("https://")) {
            found.add(text);
        }
    }
}
