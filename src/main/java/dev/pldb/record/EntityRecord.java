package dev.pldb.record;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * One entity: an immutable id plus a sparse JSON field tree.
 *
 * <p>Nested objects model sub-fields, so the path {@code "githubRepo stars"} reads {@code
 * fields.githubRepo.stars}. An object may carry its own scalar under {@value #VALUE_KEY}; e.g.
 * {@code "wikipedia": {"value": "https://...", "dailyPageViews": 120}} answers both {@code
 * "wikipedia"} and {@code "wikipedia dailyPageViews"}.
 *
 * @param id unique entity id
 * @param fields the field tree (copied on construction and on access)
 */
public record EntityRecord(String id, ObjectNode fields) {

  /** Key under which an object node stores its own scalar content. */
  public static final String VALUE_KEY = "value";

  /** Field holding the entity's type, used for language classification. */
  public static final String TYPE_FIELD = "type";

  /** Fields whose values name other entities. */
  public static final List<String> LINK_FIELDS =
      List.of("writtenIn", "influencedBy", "supersetOf", "subsetOf", "related", "compilesTo");

  /** Derived fields that are written back for display and are not counted as facts. */
  static final Set<String> NON_SERIALIZED_FIELDS =
      Set.of("rank", "languageRank", "numberOfUsers", "numberOfJobs", "factCount", "percentile");

  public EntityRecord {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Entity id must not be blank");
    }
    if (fields == null) {
      throw new IllegalArgumentException("Entity '" + id + "' has no field tree");
    }
    fields = fields.deepCopy();
  }

  /** Returns a copy of the field tree; the record itself stays immutable. */
  @Override
  public ObjectNode fields() {
    return fields.deepCopy();
  }

  /**
   * Resolves a space-separated path to a node.
   *
   * @param path the field path
   * @return the node, or null if any segment is missing
   */
  @Nullable JsonNode node(String path) {
    JsonNode current = fields;
    for (String segment : path.trim().split("\\s+")) {
      if (current == null || !current.isObject()) {
        return null;
      }
      current = current.get(segment);
    }
    return current == null || current.isNull() ? null : current;
  }

  /** Scalar text at the path; for an object node, the text of its {@value #VALUE_KEY} child. */
  public Optional<String> text(String path) {
    JsonNode node = node(path);
    if (node == null) {
      return Optional.empty();
    }
    if (node.isObject()) {
      JsonNode value = node.get(VALUE_KEY);
      return value != null && value.isValueNode() && !value.isNull()
          ? Optional.of(value.asText())
          : Optional.empty();
    }
    return node.isValueNode() ? Optional.of(node.asText()) : Optional.empty();
  }

  /** Scalar children of the object at the path, as key to raw text. */
  public Map<String, String> series(String path) {
    JsonNode node = node(path);
    Map<String, String> series = new LinkedHashMap<>();
    if (node == null || !node.isObject()) {
      return series;
    }
    Iterator<Map.Entry<String, JsonNode>> entries = node.fields();
    while (entries.hasNext()) {
      Map.Entry<String, JsonNode> entry = entries.next();
      if (entry.getValue().isValueNode() && !entry.getValue().isNull()) {
        series.put(entry.getKey(), entry.getValue().asText());
      }
    }
    return series;
  }

  public @Nullable String type() {
    return text(TYPE_FIELD).orElse(null);
  }

  /**
   * Ids referenced from the link fields, in declaration order. Duplicates are kept; a link field
   * may be a JSON array of ids or a single space-separated string.
   */
  public List<String> references() {
    List<String> references = new ArrayList<>();
    for (String linkField : LINK_FIELDS) {
      JsonNode node = fields.get(linkField);
      if (node == null || node.isNull()) {
        continue;
      }
      if (node.isArray()) {
        node.forEach(element -> addWords(references, element.asText()));
      } else if (node.isValueNode()) {
        addWords(references, node.asText());
      }
    }
    return references;
  }

  /** Number of field nodes in the tree, skipping derived display fields. */
  public int factCount() {
    return countFacts(fields, true);
  }

  // Derived display fields only exist at the top level; nested keys of the same name are facts.
  private static int countFacts(JsonNode object, boolean root) {
    int count = 0;
    Iterator<Map.Entry<String, JsonNode>> entries = object.fields();
    while (entries.hasNext()) {
      Map.Entry<String, JsonNode> entry = entries.next();
      String key = entry.getKey();
      JsonNode child = entry.getValue();
      if (VALUE_KEY.equals(key) || (root && NON_SERIALIZED_FIELDS.contains(key))) {
        continue;
      }
      count++;
      if (child.isObject()) {
        count += countFacts(child, false);
      } else if (child.isArray()) {
        for (JsonNode element : child) {
          if (element.isObject()) {
            count += 1 + countFacts(element, false);
          }
        }
      }
    }
    return count;
  }

  private static void addWords(List<String> target, String text) {
    for (String word : text.trim().split("\\s+")) {
      if (!word.isEmpty()) {
        target.add(word);
      }
    }
  }
}
