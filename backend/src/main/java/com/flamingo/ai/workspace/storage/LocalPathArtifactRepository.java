package com.flamingo.ai.workspace.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.workspace.exception.WorkspaceStorageException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.FileSystemUtils;

/**
 * {@link ArtifactRepository} backed by a directory on the local filesystem.
 *
 * <p>Chunk directories are rewritten by writing into a staging sibling and renaming it into place,
 * so a reader sees either the old or the new chunk set, or briefly none.
 */
@Slf4j
public class LocalPathArtifactRepository extends AbstractArtifactRepository {

  private final Path root;

  public LocalPathArtifactRepository(Path root, ObjectMapper objectMapper) {
    super(objectMapper);
    this.root = root.toAbsolutePath().normalize();
    try {
      Files.createDirectories(this.root);
    } catch (IOException e) {
      throw new IllegalStateException("Cannot create workspace storage directory " + root, e);
    }
    log.info("Local artifact repository initialized at {}", this.root);
  }

  public Path getRoot() {
    return root;
  }

  private Path resolve(String key) {
    Path path = root.resolve(key).normalize();
    if (!path.startsWith(root)) {
      throw new IllegalArgumentException("Key escapes workspace root: " + key);
    }
    return path;
  }

  @Override
  protected Optional<byte[]> readBytes(String key) {
    Path path = resolve(key);
    try {
      return Optional.of(Files.readAllBytes(path));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      log.error("Failed to read {}: {}", path, e.getMessage(), e);
      throw new WorkspaceStorageException(key, "Failed to read file", e);
    }
  }

  @Override
  protected void writeBytes(String key, byte[] data, String contentType) {
    Path path = resolve(key);
    try {
      Files.createDirectories(path.getParent());
      Files.write(path, data);
    } catch (IOException e) {
      log.error("Failed to write {}: {}", path, e.getMessage(), e);
      throw new WorkspaceStorageException(key, "Failed to write file", e);
    }
  }

  @Override
  protected boolean exists(String key) {
    return Files.exists(resolve(key));
  }

  @Override
  protected List<String> listFiles(String dirKey) {
    Path dir = resolve(dirKey);
    if (!Files.isDirectory(dir)) {
      return List.of();
    }
    try (Stream<Path> files = Files.walk(dir)) {
      return files
          .filter(Files::isRegularFile)
          .map(path -> root.relativize(path).toString().replace('\\', '/'))
          .sorted()
          .toList();
    } catch (IOException e) {
      log.error("Failed to list {}: {}", dir, e.getMessage(), e);
      throw new WorkspaceStorageException(dirKey, "Failed to list directory", e);
    }
  }

  @Override
  protected void move(String fromKey, String toKey) {
    Path target = resolve(toKey);
    try {
      Files.createDirectories(target.getParent());
      Files.move(resolve(fromKey), target, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      log.error("Failed to move {} to {}: {}", fromKey, toKey, e.getMessage(), e);
      throw new WorkspaceStorageException(fromKey, "Failed to move file to " + toKey, e);
    }
  }

  @Override
  protected void replaceDirectory(String dirKey, Map<String, byte[]> files) {
    Path dir = resolve(dirKey);
    String suffix = UUID.randomUUID().toString().substring(0, 8);
    Path staging = dir.resolveSibling(dir.getFileName() + ".staging-" + suffix);
    Path retired = dir.resolveSibling(dir.getFileName() + ".old-" + suffix);
    try {
      Files.createDirectories(staging);
      for (Map.Entry<String, byte[]> file : files.entrySet()) {
        Files.write(staging.resolve(file.getKey()), file.getValue());
      }
      if (Files.exists(dir)) {
        Files.move(dir, retired, StandardCopyOption.ATOMIC_MOVE);
      }
      Files.move(staging, dir, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      log.error("Failed to replace directory {}: {}", dir, e.getMessage(), e);
      WorkspaceStorageException failure =
          new WorkspaceStorageException(dirKey, "Failed to replace directory", e);
      deleteRecursively(staging, failure);
      if (Files.exists(retired) && !Files.exists(dir)) {
        restore(retired, dir, failure);
      }
      throw failure;
    }
    deleteRecursively(retired, null);
  }

  private static void restore(Path retired, Path dir, WorkspaceStorageException failure) {
    try {
      Files.move(retired, dir, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      failure.addSuppressed(e);
    }
  }

  private static void deleteRecursively(Path path, WorkspaceStorageException failure) {
    try {
      FileSystemUtils.deleteRecursively(path);
    } catch (IOException e) {
      if (failure != null) {
        failure.addSuppressed(e);
      } else {
        log.warn("Failed to remove {}: {}", path, e.getMessage());
      }
    }
  }
}
