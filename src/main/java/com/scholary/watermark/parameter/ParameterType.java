package com.scholary.watermark.parameter;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Declared type of a variant parameter.
 *
 * <p>Each type knows how to cast a raw override (usually a string from a form, or a JSON scalar)
 * into its Java representation.
 */
public enum ParameterType {
  INT("int", "integer"),
  FLOAT("float", "double", "number"),
  BOOL("bool", "boolean"),
  STRING("str", "string"),
  STRING_LIST("list[str]", "list<string>", "list");

  private final List<String> names;

  ParameterType(String... names) {
    this.names = List.of(names);
  }

  /** The canonical name used in configuration. */
  public String typeName() {
    return names.get(0);
  }

  /**
   * Look up a type by its configured name.
   *
   * @throws IllegalArgumentException if the name is unknown
   */
  public static ParameterType fromName(String name) {
    String normalized = name == null ? "str" : name.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(type -> type.names.contains(normalized))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown parameter type: " + name));
  }

  /**
   * Cast a raw value to this type.
   *
   * @param raw non-null raw value
   * @return the cast value ({@link Integer}, {@link Double}, {@link Boolean}, {@link String} or an
   *     immutable {@code List<String>})
   * @throws IllegalArgumentException if the value cannot be represented as this type
   */
  public Object cast(Object raw) {
    return switch (this) {
      case INT -> castInt(raw);
      case FLOAT -> castFloat(raw);
      case BOOL -> castBool(raw);
      case STRING -> String.valueOf(raw);
      case STRING_LIST -> castList(raw);
    };
  }

  private static Integer castInt(Object raw) {
    if (raw instanceof Integer
        || raw instanceof Long
        || raw instanceof Short
        || raw instanceof Byte) {
      return Math.toIntExact(((Number) raw).longValue());
    }
    if (raw instanceof Number number) {
      double value = number.doubleValue();
      if (value != Math.rint(value) || Double.isInfinite(value)) {
        throw new IllegalArgumentException("not an integer: " + raw);
      }
      return Math.toIntExact((long) value);
    }
    if (raw instanceof String text) {
      return Integer.parseInt(text.trim());
    }
    throw new IllegalArgumentException("not an integer: " + raw);
  }

  private static Double castFloat(Object raw) {
    if (raw instanceof Number number) {
      return number.doubleValue();
    }
    if (raw instanceof String text) {
      double value = Double.parseDouble(text.trim());
      if (Double.isNaN(value)) {
        throw new IllegalArgumentException("not a number: " + raw);
      }
      return value;
    }
    throw new IllegalArgumentException("not a number: " + raw);
  }

  private static Boolean castBool(Object raw) {
    if (raw instanceof Boolean bool) {
      return bool;
    }
    String text = String.valueOf(raw).trim().toLowerCase(Locale.ROOT);
    return switch (text) {
      case "true", "1", "yes" -> Boolean.TRUE;
      case "false", "0", "no" -> Boolean.FALSE;
      default -> throw new IllegalArgumentException("not a boolean: " + raw);
    };
  }

  private static List<String> castList(Object raw) {
    if (raw instanceof Collection<?> items) {
      return items.stream().map(item -> String.valueOf(item).trim()).toList();
    }
    return Arrays.stream(String.valueOf(raw).split(","))
        .map(String::trim)
        .filter(item -> !item.isEmpty())
        .toList();
  }
}
