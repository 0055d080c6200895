package com.catalai.classifier.service.storage;

import java.util.List;
import java.util.Optional;

/**
 * Key/value store for JSON documents. Keys are slash separated paths such as {@code
 * sessions/abc.json}.
 */
public interface IJsonStorage {

  /**
   * Reads and deserializes the document stored under {@code key}.
   *
   * @return empty when no document exists
   */
  <T> Optional<T> read(String key, Class<T> type);

  /** Serializes {@code value} and replaces the document under {@code key} atomically. */
  void write(String key, Object value);

  boolean exists(String key);

  /** Keys directly or indirectly under {@code prefix}, sorted. */
  List<String> list(String prefix);

  /** Appends one line of text to the document under {@code key}, creating it if needed. */
  void appendLine(String key, String line);

  List<String> readLines(String key);
}
