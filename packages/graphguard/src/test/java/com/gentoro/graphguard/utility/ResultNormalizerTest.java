package com.gentoro.graphguard.utility;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ResultNormalizerTest {

  /** Attribute-bearing record as an SDK would return it. */
  public static class SdkEdge {
    public final String uuid_;
    private final String sourceNodeUuid;

    SdkEdge(String uuid, String sourceNodeUuid) {
      this.uuid_ = uuid;
      this.sourceNodeUuid = sourceNodeUuid;
    }

    public String getSourceNodeUuid() {
      return sourceNodeUuid;
    }
  }

  @Test
  void readsMapKeys() {
    Map<String, Object> item = Map.of("uuid", "n1", "name", "Alice");
    assertEquals("n1", ResultNormalizer.string(item, "uuid"));
    assertEquals("Alice", ResultNormalizer.string(item, "name", "Unknown"));
  }

  @Test
  void fallsBackToDefaultWhenKeyMissingOrNull() {
    Map<String, Object> item = new HashMap<>();
    item.put("name", null);
    assertEquals("Unknown", ResultNormalizer.string(item, "name", "Unknown"));
    assertEquals("Unknown", ResultNormalizer.string(item, "type", "Unknown"));
    assertNull(ResultNormalizer.field(item, "type"));
  }

  @Test
  void blankStringCountsAsAbsent() {
    assertEquals("x", ResultNormalizer.string(Map.of("name", "  "), "name", "x"));
  }

  @Test
  void readsAttributesThroughGettersAndPublicFields() {
    SdkEdge edge = new SdkEdge("e1", "n1");
    assertEquals("n1", ResultNormalizer.string(edge, "source_node_uuid"));
    // uuid resolves through the uuid_ alias
    assertEquals("e1", ResultNormalizer.string(edge, "uuid"));
    assertEquals("d", ResultNormalizer.string(edge, "missing", "d"));
  }

  @Test
  void uuidFallsBackToId() {
    assertEquals("42", ResultNormalizer.string(Map.of("id", 42), "uuid"));
  }

  @Test
  void readsJsonNodesAndUnwrapsValues() throws Exception {
    JsonNode node =
        JacksonUtility.getJsonMapper()
            .readTree(
                "{\"uuid\":\"n1\",\"labels\":[\"Person\",\"Entity\"],\"score\":3,"
                    + "\"summary\":null,\"metadata\":{\"source\":{\"system\":\"jira\"}}}");
    assertEquals("n1", ResultNormalizer.string(node, "uuid"));
    assertEquals(List.of("Person", "Entity"), ResultNormalizer.stringList(node, "labels"));
    assertEquals(3, ((Number) ResultNormalizer.field(node, "score")).intValue());
    assertNull(ResultNormalizer.field(node, "summary"));
    assertEquals("jira", ResultNormalizer.string(node, "metadata.source.system"));
    assertEquals(Map.of("system", "jira"), ResultNormalizer.map(node, "metadata.source"));
  }

  @Test
  void dotNotationStopsAtMissingSegment() {
    Map<String, Object> item = Map.of("metadata", Map.of("a", 1));
    assertEquals("none", ResultNormalizer.field(item, "metadata.b.c", "none"));
    assertEquals(1, ResultNormalizer.field(item, "metadata.a"));
  }

  @Test
  void neverThrowsOnOddInput() {
    assertNull(ResultNormalizer.field(null, "uuid"));
    assertNull(ResultNormalizer.field("plain string", "uuid"));
    assertEquals("d", ResultNormalizer.string(42, "name", "d"));
    assertTrue(ResultNormalizer.stringList(Map.of(), "labels").isEmpty());
    assertTrue(ResultNormalizer.map(Map.of("attributes", "text"), "attributes").isEmpty());
  }

  @Test
  void nestedMapsAreNotRenderedAsStrings() {
    Map<String, Object> item = Map.of("attributes", Map.of("k", 1));
    assertEquals("d", ResultNormalizer.string(item, "attributes", "d"));
  }

  @Test
  void scalarBecomesSingletonList() {
    assertEquals(
        List.of("Person"), ResultNormalizer.stringList(Map.of("labels", "Person"), "labels"));
  }

  @Test
  void snakeCaseConvertsToCamelCase() {
    assertEquals("sourceNodeUuid", ResultNormalizer.toCamelCase("source_node_uuid"));
    assertEquals("name", ResultNormalizer.toCamelCase("name"));
    assertEquals("uuid", ResultNormalizer.toCamelCase("uuid_"));
  }
}
