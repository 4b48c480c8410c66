package com.daveeberhart.backup_util.doksnap.archive;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Path;

import org.apache.commons.io.IOUtils;

import com.daveeberhart.backup_util.doksnap.error.JobFailedException.ArchiveException;

/**
 * Archives with {@code tar -czf}, keeping only the source's own name in the archive paths.
 *
 * @author deberhar
 */
public class TarArchiver implements Archiver {
  private static final int MAX_OUTPUT_CHARS = 2000;

  private final String tarCommand;

  public TarArchiver() {
    this("tar");
  }

  public TarArchiver(String p_tarCommand) {
    tarCommand = p_tarCommand;
  }

  @Override
  public void archive(Path p_source, Path p_output) {
    Path source = p_source.toAbsolutePath().normalize();
    if (source.getParent() == null || source.getFileName() == null) {
      throw new ArchiveException("Refusing to archive the filesystem root");
    }

    ProcessBuilder pb = new ProcessBuilder(
        tarCommand, "-czf", p_output.toString(),
        "-C", source.getParent().toString(),
        source.getFileName().toString());
    pb.redirectErrorStream(true);

    try {
      Process process = pb.start();
      String output = IOUtils.toString(process.getInputStream(), Charset.defaultCharset());
      int exitCode = process.waitFor();
      if (exitCode != 0) {
        throw new ArchiveException("Failed to create tar archive (exit code " + exitCode + "): " + abbreviate(output.trim()));
      }
    } catch (IOException e) {
      throw new ArchiveException("Failed to run " + tarCommand + ": " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ArchiveException("Interrupted while waiting for " + tarCommand, e);
    }
  }

  private static String abbreviate(String p_output) {
    return p_output.length() <= MAX_OUTPUT_CHARS ? p_output : p_output.substring(0, MAX_OUTPUT_CHARS) + "...";
  }

}
