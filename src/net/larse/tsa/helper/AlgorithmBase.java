/*
 * Copyright (c) 2015 Zhiqiang Yang.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.tsa.helper;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Properties;

/**
 * Shared plumbing for the argument holders of the analysis algorithms.
 *
 * <p>An argument holder is a plain class with public fields carrying their defaults. Every field
 * annotated with {@link ArgsBase.Doc} is an argument: it can be overridden by name from a map or a
 * properties stream and it takes part in the fingerprint used as a cache key.
 */
public final class AlgorithmBase {
  private AlgorithmBase() {}

  public abstract static class ArgsBase {
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    public @interface Doc {
      String help();
    }

    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    public @interface Optional {}

    /**
     * Overrides arguments by name. Values may be strings or boxed values of the field type.
     *
     * @throws IllegalArgumentException if a name is unknown or a value cannot be converted
     */
    public void apply(Map<String, ?> values) {
      for (Map.Entry<String, ?> entry : values.entrySet()) {
        Field field = argument(entry.getKey());
        Preconditions.checkArgument(field != null, "Unknown argument: %s", entry.getKey());
        Preconditions.checkArgument(entry.getValue() != null || !field.getType().isPrimitive(),
            "Argument %s may not be null", entry.getKey());
        try {
          field.set(this, convert(field, entry.getValue()));
        } catch (IllegalAccessException e) {
          throw new IllegalStateException("Argument field is not accessible: " + field.getName(), e);
        }
      }
    }

    /** Overrides arguments from a UTF-8 {@link Properties} stream. */
    public void load(InputStream in) throws IOException {
      Properties properties = new Properties();
      properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
      ImmutableSortedMap.Builder<String, String> values = ImmutableSortedMap.naturalOrder();
      for (String name : properties.stringPropertyNames()) {
        values.put(name, properties.getProperty(name).trim());
      }
      apply(values.build());
    }

    /** Returns the current argument values keyed by name, in name order. */
    public ImmutableSortedMap<String, Object> asMap() {
      ImmutableSortedMap.Builder<String, Object> values = ImmutableSortedMap.naturalOrder();
      for (Field field : getClass().getFields()) {
        if (isArgument(field)) {
          try {
            values.put(field.getName(), field.get(this));
          } catch (IllegalAccessException e) {
            throw new IllegalStateException("Argument field is not accessible: " + field.getName(), e);
          }
        }
      }
      return values.build();
    }

    /**
     * A stable hash of all argument values. Two holders with equal values have equal
     * fingerprints.
     */
    public String fingerprint() {
      Hasher hasher = Hashing.sha256().newHasher();
      for (Map.Entry<String, Object> entry : asMap().entrySet()) {
        hasher.putString(entry.getKey(), StandardCharsets.UTF_8);
        hasher.putChar('=');
        hasher.putString(String.valueOf(entry.getValue()), StandardCharsets.UTF_8);
        hasher.putChar(';');
      }
      return hasher.hash().toString();
    }

    private Field argument(String name) {
      for (Field field : getClass().getFields()) {
        if (field.getName().equals(name) && isArgument(field)) {
          return field;
        }
      }
      return null;
    }

    private static boolean isArgument(Field field) {
      return field.isAnnotationPresent(Doc.class)
          && !Modifier.isStatic(field.getModifiers())
          && !Modifier.isFinal(field.getModifiers());
    }

    private static Object convert(Field field, Object value) {
      Class<?> type = field.getType();
      if (value == null || type.isInstance(value)) {
        return value;
      }
      String text = value.toString().trim();
      try {
        if (type == int.class || type == Integer.class) {
          return value instanceof Number ? ((Number) value).intValue() : Integer.parseInt(text);
        }
        if (type == long.class || type == Long.class) {
          return value instanceof Number ? ((Number) value).longValue() : Long.parseLong(text);
        }
        if (type == double.class || type == Double.class) {
          return value instanceof Number ? ((Number) value).doubleValue() : Double.parseDouble(text);
        }
        if (type == boolean.class || type == Boolean.class) {
          Preconditions.checkArgument(text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false"),
              "Not a boolean for %s: %s", field.getName(), text);
          return Boolean.parseBoolean(text);
        }
        if (type == String.class) {
          return text;
        }
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            String.format("Not a valid %s for %s: %s", type.getSimpleName(), field.getName(), text), e);
      }
      throw new IllegalArgumentException(
          String.format("Unsupported argument type %s for %s", type.getSimpleName(), field.getName()));
    }
  }
}
