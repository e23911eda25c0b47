package org.eao.jsa.infrastructure.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal JSON reader that parses documents into {@link Map}/{@link List} structures.
 *
 * <p>Numbers keep the type Jackson reports: integers as {@link Integer}, {@link Long} or
 * {@link java.math.BigInteger}, fractions as {@link Double}.
 */
public final class JsonDocuments {
  private final JsonFactory factory;

  public JsonDocuments() {
    this(new JsonFactory());
  }

  JsonDocuments(JsonFactory factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  JsonFactory factory() {
    return factory;
  }

  /**
   * Parses a JSON document whose root must be an object.
   *
   * @param in JSON content; not closed by this method
   * @param source description of the content for error messages
   * @return parsed object
   * @throws IOException when the content cannot be read or is not valid JSON
   */
  public Map<String, Object> parseObject(InputStream in, String source) throws IOException {
    Objects.requireNonNull(in, "in");
    try (JsonParser parser = factory.createParser(in)) {
      JsonToken token = parser.nextToken();
      if (token != JsonToken.START_OBJECT) {
        throw new IOException(source + ": JSON document must be an object");
      }
      Map<String, Object> value = readObject(parser);
      if (parser.nextToken() != null) {
        throw new IOException(source + ": JSON document contains trailing content");
      }
      return value;
    }
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IOException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
      if (token != JsonToken.FIELD_NAME) {
        throw new IOException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      map.put(fieldName, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      list.add(readValue(parser, token));
    }
    return list;
  }
}
