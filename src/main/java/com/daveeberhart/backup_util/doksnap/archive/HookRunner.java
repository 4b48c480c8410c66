package com.daveeberhart.backup_util.doksnap.archive;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.daveeberhart.backup_util.doksnap.error.JobFailedException.HookException;

/**
 * Runs pre/post backup hooks.
 * <p>
 * A hook is one command line.  It has to pass an allow-list of characters and a deny-list of
 * dangerous fragments, its first word has to be an existing executable, and it is started
 * directly as an argument vector, never through a shell.
 * <p>
 * Hooks have no timeout: a hook that never exits blocks its source's job.
 *
 * @author deberhar
 */
public class HookRunner {
  private static final Logger logger = LoggerFactory.getLogger(HookRunner.class);

  private static final Pattern ALLOWED = Pattern.compile("[a-zA-Z0-9_/\\s.\\-:\"'=]+");
  static final List<String> DANGEROUS = Arrays.asList(
      "rm -rf", "mkfs", "dd if=", "> /dev/", "$(", "`", ";", "&&", "||", "|");

  private final String searchPath;

  public HookRunner() {
    this(System.getenv("PATH"));
  }

  /**
   * @param p_searchPath Where to look for executables given without a path (the {@code PATH} format).
   */
  public HookRunner(String p_searchPath) {
    searchPath = p_searchPath == null ? "" : p_searchPath;
  }

  /**
   * Run a hook and wait for it.
   *
   * @param p_label Used to tag the hook's output in the log.
   * @throws HookException if the command is rejected, not found, or exits nonzero.
   */
  public void run(String p_label, String p_command) {
    List<String> argv = prepare(p_command);
    logger.info("[{}] Running hook {}", p_label, argv.get(0));

    ProcessBuilder pb = new ProcessBuilder(argv);
    pb.redirectErrorStream(true);
    try {
      Process process = pb.start();
      try (BufferedReader out = new BufferedReader(new InputStreamReader(process.getInputStream(), Charset.defaultCharset()))) {
        String line;
        while ((line = out.readLine()) != null) {
          logger.info("[{}] {}", p_label, line);
        }
      }

      int exitCode = process.waitFor();
      if (exitCode != 0) {
        throw new HookException("Hook command failed with exit code " + exitCode + ": " + Paths.get(argv.get(0)).getFileName());
      }
    } catch (IOException e) {
      throw new HookException("Hook command could not be started: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new HookException("Interrupted while waiting for hook", e);
    }
  }

  /**
   * Validate, tokenize and resolve a hook command.
   *
   * @return The argument vector, with the executable resolved to a path.
   */
  List<String> prepare(String p_command) {
    if (p_command == null || p_command.trim().isEmpty()) {
      throw new HookException("Hook command is empty");
    }
    if (!ALLOWED.matcher(p_command).matches()) {
      throw new HookException("Invalid hook command format: contains unsafe characters");
    }
    for (String fragment : DANGEROUS) {
      if (p_command.contains(fragment)) {
        throw new HookException("Hook command contains potentially dangerous operations");
      }
    }

    List<String> argv = tokenize(p_command);
    if (argv.isEmpty()) {
      throw new HookException("Hook command is empty");
    }
    argv.set(0, resolveExecutable(argv.get(0)).toString());
    return argv;
  }

  /**
   * Split a command line into words the way a POSIX shell would for plain words and single- or
   * double-quoted strings.  Quotes group; they are not part of the word.
   */
  static List<String> tokenize(String p_command) {
    List<String> tokens = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    boolean inToken = false;
    char quote = 0;

    for (char c : p_command.toCharArray()) {
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        } else {
          current.append(c);
        }
      } else if (c == '\'' || c == '"') {
        quote = c;
        inToken = true;
      } else if (Character.isWhitespace(c)) {
        if (inToken) {
          tokens.add(current.toString());
          current.setLength(0);
          inToken = false;
        }
      } else {
        current.append(c);
        inToken = true;
      }
    }

    if (quote != 0) {
      throw new HookException("Unbalanced quotes in hook command");
    }
    if (inToken) {
      tokens.add(current.toString());
    }
    return tokens;
  }

  private Path resolveExecutable(String p_name) {
    if (p_name.contains("/")) {
      Path exe = Paths.get(p_name);
      if (Files.isRegularFile(exe) && Files.isExecutable(exe)) {
        return exe;
      }
    } else {
      for (String dir : searchPath.split(Pattern.quote(File.pathSeparator))) {
        if (dir.isEmpty()) {
          continue;
        }
        Path exe = Paths.get(dir, p_name);
        if (Files.isRegularFile(exe) && Files.isExecutable(exe)) {
          return exe;
        }
      }
    }
    throw new HookException("Hook executable not found: " + p_name);
  }

}
