/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.conf;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Typed access to the properties in {@code sheetsync.properties}.
 * Absent properties fall back to the default declared by their key.
 *
 * <p>Global properties are addressed by {@link Key}, per-job properties by
 * a job name and a {@link JobKey}. Every typed accessor verifies that the
 * key declares the requested type and reports unparseable or missing
 * values as {@link ConfigurationException}.</p>
 */
public class Configuration {

  public static final String FIELDSEP = ",";

  /* Turns the trimmed raw value into the typed value. */
  private interface Parser<T> {
    T parse(String value) throws Exception;
  }

  private final Properties props = new Properties();

  /**
   * Load the configuration from the given path and verify that at least one
   * job is configured.
   */
  public void loadAndCheckConfiguration(Path confPath) throws
      ConfigurationException {
    try (FileInputStream fis = new FileInputStream(confPath.toFile())) {
      this.load(fis);
    } catch (IOException e) {
      throw new ConfigurationException("Cannot load configuration file "
          + confPath + ". Reason: " + e.getMessage(), e);
    }
    if (!isSet(Key.Jobs)) {
      throw new ConfigurationException("No jobs configured!\n"
          + "Please list at least one job in 'Jobs'. Exiting.");
    }
  }

  /** Loads properties from the given UTF-8 encoded stream. */
  public void load(InputStream fis) throws IOException {
    props.load(new InputStreamReader(fis, StandardCharsets.UTF_8));
  }

  public String getProperty(String key) {
    return props.getProperty(key);
  }

  public void setProperty(String key, String value) {
    props.setProperty(key, value);
  }

  public void clear() {
    props.clear();
  }

  public int size() {
    return props.size();
  }

  /**
   * Returns {@code true} if the key has a non-blank configured or default
   * value.
   */
  public boolean isSet(Key key) {
    String value = props.getProperty(key.name(), key.defaultValue());
    return null != value && !value.trim().isEmpty();
  }

  /** Returns a {@code String} property with surrounding whitespace removed. */
  public String getString(Key key) throws ConfigurationException {
    return global(key, String.class, value -> value);
  }

  /**
   * Returns {@code String[]} from a property. Commas separate array
   * elements, e.g. {@code Jobs = leads, partners, webinar}.
   */
  public String[] getStringArray(Key key) throws ConfigurationException {
    return global(key, String[].class, value -> {
      String[] res = value.split(FIELDSEP);
      for (int i = 0; i < res.length; i++) {
        res[i] = res[i].trim();
      }
      return res;
    });
  }

  /** Returns a case-insensitive {@code boolean} property. */
  public boolean getBool(Key key) throws ConfigurationException {
    return global(key, Boolean.class, Boolean::valueOf);
  }

  /**
   * Returns an {@code int} property, reading {@code "inf"} as
   * {@link Integer#MAX_VALUE}.
   */
  public int getInt(Key key) throws ConfigurationException {
    return global(key, Integer.class, Configuration::parseInt);
  }

  public long getLong(Key key) throws ConfigurationException {
    return global(key, Long.class, Long::valueOf);
  }

  public Path getPath(Key key) throws ConfigurationException {
    return global(key, Path.class, Paths::get);
  }

  public URL getUrl(Key key) throws ConfigurationException {
    return global(key, URL.class, URL::new);
  }

  /**
   * Returns a per-job {@code String} property, or {@code null} if it is
   * neither configured nor defaulted.
   */
  public String getJobString(String job, JobKey key) {
    String prop = props.getProperty(key.propertyName(job), key.defaultValue());
    return null == prop ? null : prop.trim();
  }

  public boolean getJobBool(String job, JobKey key)
      throws ConfigurationException {
    return perJob(job, key, Boolean.class, Boolean::valueOf);
  }

  public int getJobInt(String job, JobKey key) throws ConfigurationException {
    return perJob(job, key, Integer.class, Configuration::parseInt);
  }

  private static Integer parseInt(String value) {
    return "inf".equals(value) ? Integer.MAX_VALUE : Integer.valueOf(value);
  }

  private <T> T global(Key key, Class<T> wanted, Parser<T> parser)
      throws ConfigurationException {
    return typed(key.name(), key.keyClass(), wanted,
        props.getProperty(key.name(), key.defaultValue()), parser);
  }

  private <T> T perJob(String job, JobKey key, Class<T> wanted,
      Parser<T> parser) throws ConfigurationException {
    String name = key.propertyName(job);
    return typed(name, key.keyClass(), wanted,
        props.getProperty(name, key.defaultValue()), parser);
  }

  private static <T> T typed(String name, Class<?> declared, Class<T> wanted,
      String value, Parser<T> parser) throws ConfigurationException {
    try {
      if (!declared.equals(wanted)) {
        throw new IllegalArgumentException("Wrong type wanted! My class is "
            + declared.getSimpleName());
      }
      if (null == value) {
        throw new IllegalArgumentException("Property is missing.");
      }
      return parser.parse(value.trim());
    } catch (Exception e) {
      throw new ConfigurationException("Corrupt property: " + name
          + " reason: " + e.getMessage(), e);
    }
  }
}
