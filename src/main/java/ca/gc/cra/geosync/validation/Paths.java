package ca.gc.cra.geosync.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem checks run before a synchronization touches its directories.
 * <p><strong>Why:</strong> A typo in {@code dataDir} must fail fast instead of reporting an empty run, and
 * table files must only be written to a real, writable directory.</p>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between checks.</p>
 *
 * @implNote Checks use {@link LinkOption#NOFOLLOW_LINKS} where the result could otherwise be redirected.
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Resolves an existing, readable directory.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate directory
   * @return real path of the directory
   * @throws IllegalArgumentException if the directory is missing, not a directory, or unreadable
   */
  public static Path requireReadableDir(String name, Path path) {
    Path normalized = normalize(name, path);
    try {
      Path real = normalized.toRealPath();
      if (!Files.isDirectory(real)) {
        throw new IllegalArgumentException(name + " is not a directory: " + path);
      }
      if (!Files.isReadable(real)) {
        throw new IllegalArgumentException(name + " is not readable: " + path);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException(name + " must exist: " + path, ex);
    }
  }

  /**
   * Validates a writable directory, optionally creating it.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate directory
   * @param createIfMissing whether to create the directory (and parents) when absent
   * @return real path when the directory exists, otherwise the absolute normalized path
   * @throws IllegalArgumentException if the path is not a writable directory or cannot be created
   */
  public static Path validateWritableDir(String name, Path path, boolean createIfMissing) {
    Path normalized = normalize(name, path);
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (!createIfMissing) {
          Path ancestor = nearestExistingAncestor(normalized);
          if (!Files.isWritable(ancestor)) {
            throw new IllegalArgumentException(name + " cannot be created under " + ancestor);
          }
          return normalized;
        }
        Files.createDirectories(normalized);
      }
      Path real = normalized.toRealPath();
      if (!Files.isDirectory(real)) {
        throw new IllegalArgumentException(name + " is not a directory: " + real);
      }
      if (!Files.isWritable(real)) {
        throw new IllegalArgumentException(name + " is not writable: " + real);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate " + name + " " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    if (Strings.containsControl(raw)) {
      throw new IllegalArgumentException(name + " must not contain control characters");
    }
    return path.toAbsolutePath().normalize();
  }

  private static Path nearestExistingAncestor(Path start) throws IOException {
    Path current = start;
    while (current != null && !Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + start);
    }
    return current.toRealPath();
  }
}
