package com.catalai.classifier.service.storage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import com.catalai.classifier.config.ApplicationProperties;
import com.catalai.classifier.exception.StorageException;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Stores documents as files under {@code catalai.storage.base-dir}. */
@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "catalai.storage.type", havingValue = "file", matchIfMissing = true)
public class FileJsonStorage implements IJsonStorage {

  private final ObjectMapper objectMapper;
  private final ApplicationProperties applicationProperties;
  private Path baseDir;

  @PostConstruct
  public void init() {
    baseDir = Paths.get(applicationProperties.getStorage().getBaseDir()).toAbsolutePath();
    try {
      Files.createDirectories(baseDir);
    } catch (IOException e) {
      throw new StorageException("Cannot create storage directory " + baseDir, e);
    }
    log.info("File storage rooted at {}", baseDir);
  }

  @Override
  public <T> Optional<T> read(String key, Class<T> type) {
    Path file = resolve(key);
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(file.toFile(), type));
    } catch (IOException e) {
      throw new StorageException("Failed to read " + key, e);
    }
  }

  @Override
  public void write(String key, Object value) {
    Path file = resolve(key);
    try {
      Files.createDirectories(file.getParent());
      Path tmp = Files.createTempFile(file.getParent(), ".tmp-", ".json");
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), value);
      try {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new StorageException("Failed to write " + key, e);
    }
  }

  @Override
  public boolean exists(String key) {
    return Files.exists(resolve(key));
  }

  @Override
  public List<String> list(String prefix) {
    Path dir = resolve(prefix);
    if (!Files.isDirectory(dir)) {
      return Collections.emptyList();
    }
    try (Stream<Path> files = Files.walk(dir)) {
      return files
          .filter(Files::isRegularFile)
          .filter(p -> !p.getFileName().toString().startsWith(".tmp-"))
          .map(p -> baseDir.relativize(p).toString().replace('\\', '/'))
          .sorted()
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new StorageException("Failed to list " + prefix, e);
    }
  }

  @Override
  public synchronized void appendLine(String key, String line) {
    Path file = resolve(key);
    try {
      Files.createDirectories(file.getParent());
      Files.writeString(
          file,
          line + System.lineSeparator(),
          StandardCharsets.UTF_8,
          StandardOpenOption.CREATE,
          StandardOpenOption.APPEND);
    } catch (IOException e) {
      throw new StorageException("Failed to append to " + key, e);
    }
  }

  @Override
  public List<String> readLines(String key) {
    Path file = resolve(key);
    if (!Files.exists(file)) {
      return Collections.emptyList();
    }
    try {
      return Files.readAllLines(file, StandardCharsets.UTF_8).stream()
          .filter(l -> !l.isBlank())
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new StorageException("Failed to read " + key, e);
    }
  }

  private Path resolve(String key) {
    Path resolved = baseDir.resolve(key).normalize();
    if (!resolved.startsWith(baseDir)) {
      throw new IllegalArgumentException("Storage key escapes base directory: " + key);
    }
    return resolved;
  }
}
