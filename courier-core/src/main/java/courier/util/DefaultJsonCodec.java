package courier.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lightweight JSON encoder/decoder for flat objects and arrays of flat objects. Has no
 * external dependencies; objects or arrays nested inside an object are rejected.
 *
 * <p>This is the default {@link JsonCodec} implementation, accessible via
 * {@link JsonCodec#getDefault()} or the singleton {@link #INSTANCE}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, ?> fields) {
    StringBuilder sb = new StringBuilder();
    sb.append('{');
    if (fields != null) {
      boolean first = true;
      for (Map.Entry<String, ?> entry : fields.entrySet()) {
        if (entry.getKey() == null) {
          throw new IllegalArgumentException("fields cannot contain null keys");
        }
        if (!first) {
          sb.append(',');
        }
        first = false;
        sb.append('"').append(escape(entry.getKey())).append('"').append(':');
        appendValue(sb, entry.getValue());
      }
    }
    sb.append('}');
    return sb.toString();
  }

  private static void appendValue(StringBuilder sb, Object value) {
    if (value == null) {
      sb.append("null");
    } else if (value instanceof Boolean b) {
      sb.append(b.booleanValue());
    } else if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new IllegalArgumentException("Non-finite number: " + value);
      }
      sb.append(d);
    } else if (value instanceof Number n) {
      sb.append(n);
    } else {
      sb.append('"').append(escape(value.toString())).append('"');
    }
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (json == null) {
      return Collections.emptyMap();
    }
    String trimmed = json.trim();
    if (trimmed.isEmpty() || "null".equals(trimmed)) {
      return Collections.emptyMap();
    }
    return parseObjectAt(trimmed, skipWhitespace(trimmed, 0)).fields;
  }

  @Override
  public List<Map<String, String>> parseArray(String json) {
    if (json == null) {
      throw new IllegalArgumentException("Expected JSON array");
    }
    String trimmed = json.trim();
    int len = trimmed.length();
    if (len == 0 || trimmed.charAt(0) != '[') {
      throw new IllegalArgumentException("Expected JSON array");
    }
    List<Map<String, String>> result = new ArrayList<>();
    int idx = skipWhitespace(trimmed, 1);
    if (idx < len && trimmed.charAt(idx) == ']') {
      return result;
    }
    while (true) {
      ObjectResult element = parseObjectAt(trimmed, idx);
      result.add(element.fields);
      idx = skipWhitespace(trimmed, element.nextIndex);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON array");
      }
      char next = trimmed.charAt(idx);
      if (next == ']') {
        return result;
      }
      if (next != ',') {
        throw new IllegalArgumentException("Expected ',' or ']'");
      }
      idx = skipWhitespace(trimmed, idx + 1);
    }
  }

  private static ObjectResult parseObjectAt(String trimmed, int start) {
    int len = trimmed.length();
    int idx = start;
    if (idx >= len || trimmed.charAt(idx) != '{') {
      throw new IllegalArgumentException("Expected JSON object");
    }
    idx++;
    Map<String, String> result = new LinkedHashMap<>();
    boolean expectMember = false;
    while (true) {
      idx = skipWhitespace(trimmed, idx);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char ch = trimmed.charAt(idx);
      if (ch == '}' && !expectMember) {
        return new ObjectResult(result, idx + 1);
      }
      if (ch != '"') {
        throw new IllegalArgumentException("Expected string key");
      }
      ParseResult key = parseString(trimmed, idx + 1);
      idx = skipWhitespace(trimmed, key.nextIndex);
      if (idx >= len || trimmed.charAt(idx) != ':') {
        throw new IllegalArgumentException("Expected ':' after key");
      }
      idx = skipWhitespace(trimmed, idx + 1);
      if (idx >= len) {
        throw new IllegalArgumentException("Expected value");
      }
      char valueStart = trimmed.charAt(idx);
      if (valueStart == '"') {
        ParseResult value = parseString(trimmed, idx + 1);
        result.put(key.value, value.value);
        idx = value.nextIndex;
      } else if (valueStart == '{' || valueStart == '[') {
        throw new IllegalArgumentException("Nested values are not supported: " + key.value);
      } else {
        ParseResult literal = parseLiteral(trimmed, idx);
        if (!"null".equals(literal.value)) {
          result.put(key.value, literal.value);
        }
        idx = literal.nextIndex;
      }
      idx = skipWhitespace(trimmed, idx);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char next = trimmed.charAt(idx);
      if (next == ',') {
        idx++;
        expectMember = true;
        continue;
      }
      if (next == '}') {
        return new ObjectResult(result, idx + 1);
      }
      throw new IllegalArgumentException("Expected ',' or '}'");
    }
  }

  private static ParseResult parseLiteral(String input, int startIndex) {
    int i = startIndex;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == ',' || c == '}' || c == ']' || c == ' ' || c == '\t' || c == '\n' || c == '\r') {
        break;
      }
      i++;
    }
    String token = input.substring(startIndex, i);
    if (!"true".equals(token) && !"false".equals(token) && !"null".equals(token)
        && !token.matches("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?")) {
      throw new IllegalArgumentException("Invalid literal: " + token);
    }
    return new ParseResult(token, i);
  }

  private static int skipWhitespace(String input, int index) {
    int i = index;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
        break;
      }
      i++;
    }
    return i;
  }

  private static ParseResult parseString(String input, int startIndex) {
    StringBuilder sb = new StringBuilder();
    int i = startIndex;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == '"') {
        return new ParseResult(sb.toString(), i + 1);
      }
      if (c != '\\') {
        sb.append(c);
        i++;
        continue;
      }
      if (i + 1 >= input.length()) {
        throw new IllegalArgumentException("Invalid escape sequence");
      }
      char next = input.charAt(i + 1);
      switch (next) {
        case '"', '\\', '/' -> sb.append(next);
        case 'b' -> sb.append('\b');
        case 'f' -> sb.append('\f');
        case 'n' -> sb.append('\n');
        case 'r' -> sb.append('\r');
        case 't' -> sb.append('\t');
        case 'u' -> {
          if (i + 5 >= input.length()) {
            throw new IllegalArgumentException("Invalid unicode escape");
          }
          try {
            sb.append((char) Integer.parseInt(input.substring(i + 2, i + 6), 16));
          } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid unicode escape", ex);
          }
          i += 4;
        }
        default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
      }
      i += 2;
    }
    throw new IllegalArgumentException("Unterminated string");
  }

  private static String escape(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 8);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\b' -> sb.append("\\b");
        case '\f' -> sb.append("\\f");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    return sb.toString();
  }

  private record ParseResult(String value, int nextIndex) {
  }

  private record ObjectResult(Map<String, String> fields, int nextIndex) {
  }
}
