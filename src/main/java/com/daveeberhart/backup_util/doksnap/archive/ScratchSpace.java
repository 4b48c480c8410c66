package com.daveeberhart.backup_util.doksnap.archive;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out per-job temp directories under the scratch directory and makes sure they go away.
 * <p>
 * Directories are released by their job on every exit path.  Anything still registered when the
 * daemon shuts down is deleted by {@link #releaseAll()}, and anything left over from a crashed run
 * is swept at startup.  None of the cleanup methods ever throw.
 *
 * @author deberhar
 */
public class ScratchSpace {
  private static final Logger logger = LoggerFactory.getLogger(ScratchSpace.class);
  static final String PREFIX = "doksnap-";

  private final Path root;
  private final Set<Path> live = ConcurrentHashMap.newKeySet();

  public ScratchSpace(Path p_root) {
    root = p_root;
  }

  public Path getRoot() {
    return root;
  }

  /**
   * @return A fresh directory only the current user can read, write or list.
   */
  public Path createJobDirectory(String p_sourceId) throws IOException {
    Path dir;
    if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
      dir = Files.createTempDirectory(root, PREFIX + p_sourceId + "-", PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rwx------")));
    } else {
      dir = Files.createTempDirectory(root, PREFIX + p_sourceId + "-");
      dir.toFile().setReadable(false, false);
      dir.toFile().setReadable(true, true);
      dir.toFile().setWritable(false, false);
      dir.toFile().setWritable(true, true);
    }
    live.add(dir);
    return dir;
  }

  /**
   * Delete a job directory and everything in it.
   */
  public void release(Path p_dir) {
    try {
      FileUtils.deleteDirectory(p_dir.toFile());
    } catch (IOException | RuntimeException e) {
      logger.warn("Failed to delete scratch directory {}: {}", p_dir, e.getMessage());
    } finally {
      live.remove(p_dir);
    }
  }

  /**
   * Delete every directory still handed out.  Used on shutdown.
   */
  public void releaseAll() {
    for (Path dir : new ArrayList<>(live)) {
      logger.info("Cleaning up leftover scratch directory {}", dir);
      release(dir);
    }
  }

  /**
   * Delete leftovers from an earlier, abnormally terminated run.
   *
   * @return The number of directories removed.
   */
  public int sweepStale() {
    List<Path> stale = new ArrayList<>();
    try (DirectoryStream<Path> dirs = Files.newDirectoryStream(root, PREFIX + "*")) {
      for (Path dir : dirs) {
        if (Files.isDirectory(dir) && !live.contains(dir)) {
          stale.add(dir);
        }
      }
    } catch (IOException | RuntimeException e) {
      logger.warn("Could not scan scratch directory {} for leftovers: {}", root, e.getMessage());
    }

    for (Path dir : stale) {
      logger.info("Removing stale scratch directory {}", dir);
      release(dir);
    }
    return stale.size();
  }

  /**
   * @return Number of directories currently handed out.
   */
  public int liveCount() {
    return live.size();
  }

}
