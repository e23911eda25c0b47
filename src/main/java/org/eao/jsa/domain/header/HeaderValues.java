package org.eao.jsa.domain.header;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Typed, case-insensitive view of a FITS-style header.
 *
 * <p>Blank strings read as absent. Conversion failures raise {@link IllegalArgumentException}
 * naming the keyword, which the extractor records as a problem of the file.</p>
 *
 * @since 0.1.0
 */
public final class HeaderValues {
  private final Map<String, Object> values;

  public HeaderValues(Map<String, Object> raw) {
    Map<String, Object> normalized = new LinkedHashMap<>();
    raw.forEach((key, value) -> normalized.put(key.trim().toUpperCase(Locale.ROOT), value));
    this.values = normalized;
  }

  public boolean has(String key) {
    Object value = values.get(key);
    return value != null && !(value instanceof String s && s.isBlank());
  }

  /** Trimmed string value, or {@code null}. */
  public String string(String key) {
    Object value = values.get(key);
    if (value == null) {
      return null;
    }
    String text = value.toString().strip();
    return text.isEmpty() ? null : text;
  }

  /** Lower-case string value, or {@code null}. */
  public String lower(String key) {
    String value = string(key);
    return value == null ? null : value.toLowerCase(Locale.ROOT);
  }

  /** Upper-case string value, or {@code null}. */
  public String upper(String key) {
    String value = string(key);
    return value == null ? null : value.toUpperCase(Locale.ROOT);
  }

  public Double number(String key) {
    Object value = values.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof Number n) {
      return n.doubleValue();
    }
    String text = value.toString().strip();
    if (text.isEmpty()) {
      return null;
    }
    try {
      return Double.valueOf(text);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " is not a number: " + text, ex);
    }
  }

  public Long integer(String key) {
    Object value = values.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof Number n) {
      return n.longValue();
    }
    String text = value.toString().strip();
    if (text.isEmpty()) {
      return null;
    }
    try {
      return Long.valueOf(text);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " is not an integer: " + text, ex);
    }
  }

  /** Boolean value; FITS {@code T}/{@code F} and {@code true}/{@code false} are accepted. */
  public Boolean bool(String key) {
    Object value = values.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof Boolean b) {
      return b;
    }
    if (value instanceof Number n) {
      return n.intValue() != 0;
    }
    String text = value.toString().strip().toUpperCase(Locale.ROOT);
    return switch (text) {
      case "" -> null;
      case "T", "TRUE", "1" -> Boolean.TRUE;
      case "F", "FALSE", "0" -> Boolean.FALSE;
      default -> throw new IllegalArgumentException(key + " is not a boolean: " + value);
    };
  }

  /**
   * Timestamp value. ISO-8601 with or without offset (UTC assumed) and plain dates are accepted.
   */
  public Instant instant(String key) {
    String text = string(key);
    if (text == null) {
      return null;
    }
    try {
      return parseInstant(text);
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException(key + " is not a timestamp: " + text, ex);
    }
  }

  /**
   * Parses a FITS or ISO-8601 timestamp.
   *
   * @param text timestamp text
   * @return instant, UTC assumed when no offset is given
   * @throws DateTimeParseException when the text is not a timestamp
   */
  public static Instant parseInstant(String text) {
    String trimmed = text.strip();
    if (trimmed.endsWith("Z") || trimmed.matches(".*[+-]\\d{2}:\\d{2}$")) {
      return OffsetDateTime.parse(trimmed).toInstant();
    }
    if (trimmed.length() == 10) {
      return LocalDate.parse(trimmed).atStartOfDay().toInstant(ZoneOffset.UTC);
    }
    return LocalDateTime.parse(trimmed.replace(' ', 'T')).toInstant(ZoneOffset.UTC);
  }

  /** Values of numbered keywords {@code PREFIX1..PREFIXn}, where {@code n} is read from {@code countKey}. */
  public List<String> series(String countKey, String prefix) {
    Long count = integer(countKey);
    List<String> result = new ArrayList<>();
    if (count == null) {
      return result;
    }
    for (long i = 1; i <= count; i++) {
      String value = string(prefix + i);
      if (value != null) {
        result.add(value);
      }
    }
    return result;
  }
}
