package ca.gc.cra.recstream.infrastructure.json;

import ca.gc.cra.recstream.application.port.RecordCodec;
import ca.gc.cra.recstream.domain.record.Record;
import ca.gc.cra.recstream.logging.Logs;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * JSON adapter for records built on Jackson's streaming API: parses into ordered maps, lists, and scalars and
 * writes records back as single-line objects.
 *
 * @since 0.1.0
 */
public final class JacksonRecordCodec implements RecordCodec {
  private final JsonFactory factory = new JsonFactory();

  @Override
  public Record decode(String line) {
    Objects.requireNonNull(line, "line");
    Object value = parse(line);
    if (value instanceof Map<?, ?> map) {
      return toRecord(map);
    }
    throw new IllegalArgumentException("Expected a JSON object but got: " + Logs.truncate(line));
  }

  @Override
  public String encode(Record record) {
    Objects.requireNonNull(record, "record");
    StringWriter out = new StringWriter();
    try (JsonGenerator generator = factory.createGenerator(out)) {
      writeValue(generator, record);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode record", ex);
    }
    return out.toString();
  }

  /**
   * Parses one JSON document into maps, lists, and scalars.
   *
   * @param json JSON document; never {@code null}
   * @return parsed value; an empty document yields an empty map
   * @throws IllegalArgumentException when parsing fails or trailing content follows the document
   */
  public Object parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        return new LinkedHashMap<String, Object>();
      }
      Object value = readValue(parser, token);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return value;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON: " + Logs.truncate(json), ex);
    }
  }

  /**
   * Reads a stream of concatenated top-level JSON values. Objects become records; arrays contribute each object
   * element. Other values are rejected.
   *
   * @param reader source; left open
   * @param sourceName label used in error messages
   * @param consumer receives each record and returns {@code false} to stop reading
   * @return number of records delivered
   * @throws IOException if reading fails
   * @throws IllegalArgumentException if the content is not JSON objects
   */
  public long readRecords(Reader reader, String sourceName, Predicate<Record> consumer) throws IOException {
    long count = 0;
    try (JsonParser parser = factory.createParser(reader)) {
      parser.disable(JsonParser.Feature.AUTO_CLOSE_SOURCE);
      JsonToken token;
      while ((token = parser.nextToken()) != null) {
        Object value = readValue(parser, token);
        List<?> items = value instanceof List<?> list ? list : Collections.singletonList(value);
        for (Object item : items) {
          if (!(item instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException(
                "Expected JSON objects in " + sourceName + " but got " + Logs.describe(item));
          }
          count++;
          if (!consumer.test(toRecord(map))) {
            return count;
          }
        }
      }
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Invalid JSON in " + sourceName + ": " + ex.getOriginalMessage(), ex);
    }
    return count;
  }

  private static Record toRecord(Map<?, ?> map) {
    Record record = new Record();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      record.put(String.valueOf(entry.getKey()), entry.getValue());
    }
    return record;
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT -> readInteger(parser);
      case VALUE_NUMBER_FLOAT -> parser.getDoubleValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private static Object readInteger(JsonParser parser) throws IOException {
    return switch (parser.getNumberType()) {
      case INT, LONG -> parser.getLongValue();
      default -> parser.getBigIntegerValue();
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      JsonToken valueToken = parser.nextToken();
      map.put(fieldName, readValue(parser, valueToken));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }

  private static void writeValue(JsonGenerator generator, Object value) throws IOException {
    if (value == null) {
      generator.writeNull();
    } else if (value instanceof Record record) {
      writeObject(generator, record.view());
    } else if (value instanceof Map<?, ?> map) {
      writeObject(generator, map);
    } else if (value instanceof Collection<?> items) {
      generator.writeStartArray();
      for (Object item : items) {
        writeValue(generator, item);
      }
      generator.writeEndArray();
    } else if (value instanceof Boolean bool) {
      generator.writeBoolean(bool);
    } else if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte) {
      generator.writeNumber(((Number) value).longValue());
    } else if (value instanceof BigInteger big) {
      generator.writeNumber(big);
    } else if (value instanceof BigDecimal decimal) {
      generator.writeNumber(decimal);
    } else if (value instanceof Number number) {
      generator.writeNumber(number.doubleValue());
    } else {
      generator.writeString(value.toString());
    }
  }

  private static void writeObject(JsonGenerator generator, Map<?, ?> map) throws IOException {
    generator.writeStartObject();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      generator.writeFieldName(String.valueOf(entry.getKey()));
      writeValue(generator, entry.getValue());
    }
    generator.writeEndObject();
  }
}
