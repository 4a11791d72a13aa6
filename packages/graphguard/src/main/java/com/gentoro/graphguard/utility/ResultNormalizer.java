package com.gentoro.graphguard.utility;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Uniform, never-throwing field access over the record shapes the remote graph API returns.
 *
 * <p>An item may be a key-value mapping ({@link Map} or a Jackson object {@link JsonNode}) or an
 * attribute-bearing object (bean getter, record accessor or public field). Lookup order: mapping
 * key, then attribute, then the supplied default. A key whose value is {@code null} (or JSON null)
 * counts as absent.
 *
 * <p>Names may use dot notation ({@code metadata.name}) to reach nested values. The identifier field
 * {@code uuid} also resolves through the aliases {@code uuid_} and {@code id}.
 */
public final class ResultNormalizer {
  private static final org.slf4j.Logger log =
      com.gentoro.graphguard.logging.LoggingService.getLogger(ResultNormalizer.class);

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
  private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {};

  private ResultNormalizer() {}

  public static Object field(Object item, String name, Object defaultValue) {
    if (item == null || name == null || name.isEmpty()) {
      return defaultValue;
    }
    if (name.indexOf('.') > 0) {
      Object current = item;
      for (String part : name.split("\\.")) {
        current = field(current, part, null);
        if (current == null) {
          return defaultValue;
        }
      }
      return current;
    }

    Object value = lookup(item, name);
    if (value == null && "uuid".equals(name)) {
      value = lookup(item, "uuid_");
      if (value == null) value = lookup(item, "id");
    }
    return value == null ? defaultValue : value;
  }

  public static Object field(Object item, String name) {
    return field(item, name, null);
  }

  /** String view of a scalar field; blank strings are treated as absent. */
  public static String string(Object item, String name, String defaultValue) {
    Object value = field(item, name, null);
    if (value == null || value instanceof Map || value instanceof Collection) {
      return defaultValue;
    }
    String text = value.toString();
    return text.isBlank() ? defaultValue : text;
  }

  public static String string(Object item, String name) {
    return string(item, name, null);
  }

  /** List-of-strings view; a single scalar becomes a one-element list, absence an empty list. */
  public static List<String> stringList(Object item, String name) {
    Object value = field(item, name, null);
    if (value == null) {
      return Collections.emptyList();
    }
    List<String> result = new ArrayList<>();
    if (value instanceof Collection<?> collection) {
      for (Object element : collection) {
        if (element != null) result.add(element.toString());
      }
    } else if (value.getClass().isArray() && value instanceof Object[] array) {
      for (Object element : array) {
        if (element != null) result.add(element.toString());
      }
    } else if (!(value instanceof Map)) {
      result.add(value.toString());
    }
    return result;
  }

  /** Mapping view of a nested object; anything that is not a mapping yields an empty map. */
  public static Map<String, Object> map(Object item, String name) {
    Object value = field(item, name, null);
    if (value instanceof Map<?, ?> raw) {
      Map<String, Object> result = new LinkedHashMap<>();
      raw.forEach((k, v) -> result.put(String.valueOf(k), v));
      return result;
    }
    return Collections.emptyMap();
  }

  private static Object lookup(Object item, String name) {
    if (item instanceof JsonNode node) {
      if (!node.isObject()) return null;
      return unwrap(node.get(name));
    }
    if (item instanceof Map<?, ?> map) {
      return map.get(name);
    }
    return attribute(item, name);
  }

  private static Object attribute(Object item, String name) {
    String camel = toCamelCase(name);
    String capitalized = camel.substring(0, 1).toUpperCase(Locale.ROOT) + camel.substring(1);
    Class<?> type = item.getClass();
    try {
      for (String candidate : new String[] {"get" + capitalized, camel, "is" + capitalized}) {
        Method method = findAccessor(type, candidate);
        if (method != null) {
          return unwrap(method.invoke(item));
        }
      }
      for (String candidate : new String[] {name, camel}) {
        Field f = findField(type, candidate);
        if (f != null) {
          return unwrap(f.get(item));
        }
      }
    } catch (ReflectiveOperationException | RuntimeException e) {
      log.debug("Unable to read attribute '{}' from {}: {}", name, type.getName(), e.toString());
    }
    return null;
  }

  private static Method findAccessor(Class<?> type, String name) {
    try {
      Method method = type.getMethod(name);
      if (method.getReturnType() == Void.TYPE || Modifier.isStatic(method.getModifiers())) {
        return null;
      }
      return method;
    } catch (NoSuchMethodException e) {
      return null;
    }
  }

  private static Field findField(Class<?> type, String name) {
    try {
      Field f = type.getField(name);
      return Modifier.isStatic(f.getModifiers()) ? null : f;
    } catch (NoSuchFieldException e) {
      return null;
    }
  }

  private static Object unwrap(Object value) {
    if (!(value instanceof JsonNode node)) {
      return value;
    }
    if (node.isNull() || node.isMissingNode()) return null;
    if (node.isTextual()) return node.textValue();
    if (node.isBoolean()) return node.booleanValue();
    if (node.isNumber()) return node.numberValue();
    if (node.isArray()) return JacksonUtility.getJsonMapper().convertValue(node, LIST_TYPE);
    if (node.isObject()) return JacksonUtility.getJsonMapper().convertValue(node, MAP_TYPE);
    return node.asText();
  }

  static String toCamelCase(String name) {
    if (name.indexOf('_') < 0) return name;
    StringBuilder sb = new StringBuilder(name.length());
    boolean upper = false;
    for (char c : name.toCharArray()) {
      if (c == '_') {
        upper = sb.length() > 0;
        continue;
      }
      sb.append(upper ? Character.toUpperCase(c) : c);
      upper = false;
    }
    return sb.length() == 0 ? name : sb.toString();
  }
}
