package org.waabox.walship.replication;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.waabox.walship.Position;

/**
 * Tests for {@link StreamRequestCodec}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class StreamRequestCodecTest {

  @Test
  void whenParsing_givenSerializedRequest_shouldKeepNegativeGenerations() {
    final StreamRequest request = new StreamRequest("b",
        Map.of("app.db", new Position(-4242L, 17),
            "other.db", Position.ZERO));

    final StreamRequest parsed = StreamRequestCodec.deserialize(
        StreamRequestCodec.serialize(request));

    assertEquals(request, parsed);
  }

  @Test
  void whenParsing_givenNoPositions_shouldReturnEmptyMap() {
    final StreamRequest parsed = StreamRequestCodec.deserialize(
        "{\"node\":\"b\"}");

    assertEquals("b", parsed.node());
    assertTrue(parsed.positions().isEmpty());
  }

  @Test
  void whenParsing_givenMissingNode_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> StreamRequestCodec.deserialize("{\"positions\":{}}"));
  }

  @Test
  void whenParsing_givenMalformedJson_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> StreamRequestCodec.deserialize("{not json"));
  }
}
