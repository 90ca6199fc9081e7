package ca.gc.cra.geosync.logging;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Keeps raw source content short when it ends up in log lines or exception messages.
 *
 * @since 0.1.0
 */
public final class Logs {
  private Logs() {}

  /**
   * Truncates a string to at most {@code maxBytes} UTF-8 bytes without splitting a code point.
   *
   * @param value text to shorten; {@code null} yields {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return the value itself when it fits, otherwise a prefix followed by {@code "... (N of M bytes)"}
   */
  public static String truncate(String value, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (value == null) {
      return "<null>";
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    String prefix;
    try {
      prefix = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes)).toString();
    } catch (CharacterCodingException ex) {
      prefix = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
    }
    return prefix + "... (" + maxBytes + " of " + bytes.length + " bytes)";
  }
}
