package ca.gc.cra.recstream.validation;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem checks for files named on the command line.
 * <p><strong>Thread-safety:</strong> Stateless; the filesystem may change between check and use.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that a path names an existing, readable regular file.
   *
   * @param name argument name used in diagnostics
   * @param raw path text
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is malformed, missing, or unreadable
   */
  public static Path requireReadableFile(String name, String raw) {
    Path path = toPath(name, raw);
    if (!Files.isRegularFile(path)) {
      throw new IllegalArgumentException(name + " does not name a file: " + path);
    }
    if (!Files.isReadable(path)) {
      throw new IllegalArgumentException(name + " is not readable: " + path);
    }
    return path;
  }

  /**
   * Validates that a file can be created or replaced at a path: it is not a directory and its parent directory
   * exists and is writable.
   *
   * @param name argument name used in diagnostics
   * @param raw path text
   * @return absolute normalized path
   * @throws IllegalArgumentException if the target cannot be written
   */
  public static Path requireWritableFile(String name, String raw) {
    Path path = toPath(name, raw);
    if (Files.isDirectory(path)) {
      throw new IllegalArgumentException(name + " is a directory: " + path);
    }
    Path parent = path.getParent();
    if (parent == null || !Files.isDirectory(parent)) {
      throw new IllegalArgumentException(name + " parent directory does not exist: " + path);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException(name + " parent directory is not writable: " + parent);
    }
    return path;
  }

  private static Path toPath(String name, String raw) {
    String trimmed = Strings.requireNonBlank(name, raw);
    if (trimmed.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    return Path.of(trimmed).toAbsolutePath().normalize();
  }
}
