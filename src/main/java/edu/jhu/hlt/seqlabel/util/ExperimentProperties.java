package edu.jhu.hlt.seqlabel.util;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;

import com.google.common.base.Splitter;

/**
 * Configuration as string key/value pairs. Getters with defaults put the
 * default into this map when the key is missing, so that after setup the map
 * holds the effective configuration and can be logged or saved with a model.
 *
 * Command line arguments are given as "key value" pairs, optionally with a
 * "config" key naming a properties file to load first.
 *
 * @author travis
 */
public class ExperimentProperties extends java.util.Properties {
  private static final long serialVersionUID = 1L;

  /**
   * Loads the file named by the "config" argument (if any), then applies the
   * remaining arguments on top of it.
   */
  public static ExperimentProperties fromArgs(String[] mainArgs) throws IOException {
    ExperimentProperties cmd = new ExperimentProperties();
    cmd.putAll(mainArgs);
    ExperimentProperties config = new ExperimentProperties();
    String f = cmd.getProperty("config");
    if (f != null) {
      try (Reader r = FileUtil.getReader(new File(f))) {
        config.load(r);
      }
    }
    config.putAll(cmd);
    return config;
  }

  public void putAll(String[] mainArgs) {
    if (mainArgs.length % 2 != 0)
      throw new IllegalArgumentException("arguments must be key/value pairs, got " + mainArgs.length + " strings");
    for (int i = 0; i < mainArgs.length; i += 2) {
      String key = mainArgs[i];
      while (key.startsWith("-"))
        key = key.substring(1);
      Object old = put(key, mainArgs[i + 1]);
      if (old != null) {
        throw new IllegalArgumentException(key + " has two values: "
            + mainArgs[i + 1] + " and " + old);
      }
    }
  }

  private String getOrPut(String key, Object defaultValue) {
    String value = getProperty(key);
    if (value == null) {
      value = String.valueOf(defaultValue);
      put(key, value);
    }
    return value.trim();
  }

  private String getRequired(String key) {
    String value = getProperty(key);
    if (value == null)
      throw new IllegalArgumentException("missing required property: " + key);
    return value.trim();
  }

  public int getInt(String key, int defaultValue) {
    return parse(key, getOrPut(key, defaultValue), Integer::parseInt);
  }

  public int getInt(String key) {
    return parse(key, getRequired(key), Integer::parseInt);
  }

  public double getDouble(String key, double defaultValue) {
    return parse(key, getOrPut(key, defaultValue), Double::parseDouble);
  }

  public double getDouble(String key) {
    return parse(key, getRequired(key), Double::parseDouble);
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    String v = getOrPut(key, defaultValue);
    if (!v.equalsIgnoreCase("true") && !v.equalsIgnoreCase("false"))
      throw new IllegalArgumentException(key + " must be true or false: " + v);
    return Boolean.parseBoolean(v);
  }

  public String getString(String key, String defaultValue) {
    return getOrPut(key, defaultValue);
  }

  public String getString(String key) {
    return getRequired(key);
  }

  public <E extends Enum<E>> E getEnum(String key, Class<E> type, E defaultValue) {
    String v = getOrPut(key, defaultValue.name());
    try {
      return Enum.valueOf(type, v.toUpperCase());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(key + " must be one of "
          + Arrays.toString(type.getEnumConstants()) + ": " + v, e);
    }
  }

  /** Comma separated values, empty list if the key is missing */
  public List<String> getStrings(String key) {
    return Splitter.on(',').trimResults().omitEmptyStrings().splitToList(getOrPut(key, ""));
  }

  /** Returns null if the key is missing (no default is recorded) */
  public File getFileOrNull(String key) {
    String value = getProperty(key);
    return value == null || value.trim().isEmpty() ? null : new File(value.trim());
  }

  public File getFile(String key) {
    return new File(getRequired(key));
  }

  public File getExistingFile(String key) {
    File f = getFile(key);
    if (!f.isFile())
      throw new IllegalArgumentException(key + "=" + f.getPath() + " is not a file");
    return f;
  }

  public File getOrMakeDir(String key) {
    File f = getFile(key);
    if (!f.isDirectory() && !f.mkdirs())
      throw new IllegalArgumentException(key + "=" + f.getPath() + " could not be created");
    return f;
  }

  /** One "key = value" per line, sorted by key */
  public String describe() {
    StringBuilder sb = new StringBuilder();
    for (String k : new TreeSet<>(stringPropertyNames()))
      sb.append(k).append(" = ").append(getProperty(k)).append('\n');
    return sb.toString();
  }

  private interface Parser<T> {
    T parse(String s);
  }

  private static <T> T parse(String key, String value, Parser<T> p) {
    try {
      return p.parse(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("bad value for " + key + ": " + value, e);
    }
  }
}
