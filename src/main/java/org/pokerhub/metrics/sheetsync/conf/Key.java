/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.conf;

import java.net.URL;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Enum containing all global property keys of the configuration.
 * Specifies the key type and, where one exists, the default value.
 */
public enum Key {

  RunOnce(Boolean.class, "false"),
  UpdateIntervalMinutes(Integer.class, "60"),
  ShutdownGraceWaitMinutes(Long.class, "10"),
  TimeZone(String.class, "Europe/Moscow"),
  Jobs(String[].class, null),
  DatabaseHost(String.class, "127.0.0.1"),
  DatabasePort(Integer.class, "5432"),
  DatabaseUser(String.class, "postgres"),
  DatabasePassword(String.class, ""),
  DatabaseQuery(String.class, null),
  DatabaseConnectTimeoutSeconds(Integer.class, "30"),
  SshHost(String.class, null),
  SshPort(Integer.class, "22"),
  SshUser(String.class, null),
  SshPassword(String.class, ""),
  SpreadsheetUrl(String.class, null),
  ServiceAccountFile(Path.class, null),
  PartnerApiUrl(URL.class, null),
  PartnerApiTimeoutSeconds(Integer.class, "30"),
  PartnerBatchSize(Integer.class, "100"),
  PartnerMaxConnections(Integer.class, "4"),
  FetchWarnSeconds(Integer.class, "10"),
  PacingDelayMillis(Integer.class, "100"),
  PacingJitterMillis(Integer.class, "200");

  private final Class<?> clazz;
  private final String defaultValue;
  private static Set<String> keys;

  /**
   * Instantiate a new {@code Key} using the given class for the key value.
   *
   * @param clazz Class of key value.
   * @param defaultValue Value used when the property is absent, or
   *     {@code null} if the property is mandatory.
   */
  Key(Class<?> clazz, String defaultValue) {
    this.clazz = clazz;
    this.defaultValue = defaultValue;
  }

  public Class<?> keyClass() {
    return clazz;
  }

  public String defaultValue() {
    return defaultValue;
  }

  /** Verifies, if the given string corresponds to an enum value. */
  public static synchronized boolean has(String someKey) {
    if (null == keys) {
      keys = new HashSet<>();
      for (Key key : values()) {
        keys.add(key.name());
      }
    }
    return keys.contains(someKey);
  }

}
