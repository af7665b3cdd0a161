package org.waabox.walship.replication;

import java.util.LinkedHashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.waabox.walship.Position;

/**
 * Serializes {@link StreamRequest} instances to and from JSON.
 *
 * <p>The document has the shape
 * {@code {"node":"a","positions":{"db":{"generation":1,"txid":5}}}}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StreamRequestCodec {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private StreamRequestCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Serializes a request into JSON.
   *
   * @param request the request, never null
   * @return the JSON document, never null
   */
  public static String serialize(final StreamRequest request) {
    Objects.requireNonNull(request, "request must not be null");
    final ObjectNode root = MAPPER.createObjectNode();
    root.put("node", request.node());
    final ObjectNode positions = root.putObject("positions");
    for (final Map.Entry<String, Position> entry
        : request.positions().entrySet()) {
      final ObjectNode position = positions.putObject(entry.getKey());
      position.put("generation", entry.getValue().generation());
      position.put("txid", entry.getValue().txid());
    }
    return root.toString();
  }

  /**
   * Parses a request from JSON.
   *
   * @param json the JSON document, never null
   * @return the request, never null
   * @throws IllegalArgumentException if the document is malformed
   */
  public static StreamRequest deserialize(final String json) {
    Objects.requireNonNull(json, "json must not be null");
    try {
      final JsonNode root = MAPPER.readTree(json);
      final String node = requireField(root, "node").asText();
      final Map<String, Position> positions = new LinkedHashMap<>();
      final JsonNode positionsNode = root.get("positions");
      if (positionsNode != null && !positionsNode.isNull()) {
        final Iterator<Map.Entry<String, JsonNode>> fields =
            positionsNode.fields();
        while (fields.hasNext()) {
          final Map.Entry<String, JsonNode> field = fields.next();
          positions.put(field.getKey(), new Position(
              requireField(field.getValue(), "generation").asLong(),
              requireField(field.getValue(), "txid").asLong()));
        }
      }
      return new StreamRequest(node, positions);
    } catch (final IllegalArgumentException e) {
      throw e;
    } catch (final Exception e) {
      throw new IllegalArgumentException(
          "Failed to parse stream request: " + json, e);
    }
  }

  private static JsonNode requireField(final JsonNode node,
      final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException("Missing field: " + field
          + " in JSON: " + node);
    }
    return value;
  }
}
