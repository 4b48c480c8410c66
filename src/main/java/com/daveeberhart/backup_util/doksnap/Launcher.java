package com.daveeberhart.backup_util.doksnap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.daveeberhart.backup_util.doksnap.config.ConfigLoader;
import com.daveeberhart.backup_util.doksnap.config.DokSnapConfig;
import com.daveeberhart.backup_util.doksnap.error.ConfigException;

/**
 * Main class for the daemon.
 *
 * @author deberhar
 */
public class Launcher {
  private static final Logger logger = LoggerFactory.getLogger(Launcher.class);
  private static final String VERSION = "1.0";

  public static void main(String[] args) {
    new Launcher().run(args);
  }

  public void run(String[] args) {
    System.err.println("DokSnap backup daemon v." + VERSION);
    System.err.println();

    if (args.length > 0) {
      showUsageAndQuit();
      return;
    }

    try {
      DokSnapConfig config = loadConfig();
      logger.info("Loaded {} source(s) for backup, storing to {}", config.getSources().size(), config.getS3());

      Daemon daemon = createDaemon(config);
      registerShutdownHook(daemon);
      daemon.start();
      daemon.awaitStop();
      logger.info("Shutdown complete");
    } catch (ConfigException e) {
      System.err.println("Configuration error:");
      System.err.println(e.getMessage());
      System.err.flush();

      exit(2);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn("Interrupted while waiting for shutdown");
    } catch (Exception e) {
      System.out.flush();
      System.err.println();
      System.err.println("Daemon FAILED with the following exception:");
      e.printStackTrace(System.err);
      System.err.flush();

      exit(99);
    }
  }

  protected DokSnapConfig loadConfig() {
    return ConfigLoader.load();
  }

  protected Daemon createDaemon(DokSnapConfig p_config) {
    return Daemon.create(p_config);
  }

  /**
   * SIGTERM/SIGINT: drain running jobs, then exit.
   */
  protected void registerShutdownHook(Daemon p_daemon) {
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      logger.info("Shutting down DokSnap...");
      p_daemon.stop();
    }, "doksnap-shutdown"));
  }

  private void showUsageAndQuit() {
    System.err.println("Back up directories and volumes on a schedule, encrypted, into Amazon S3 (or any S3-compatible store).");
    System.err.println();
    System.err.println("Usage:");
    System.err.println("  `java [-Dconfig.file.location=/path/to/doksnap.properties] [-Dverbose=true] -jar doksnap.jar`");
    System.err.println("Where:");
    System.err.println("  config.file.location defaults to " + ConfigLoader.DEFAULT_CONFIG_FILE);
    System.err.println("  any setting in the config file may also be passed as -Dsetting=value");
    System.err.println("  secrets come from the environment: AWS_ACCESS_KEY_ID, AWS_SECRET_ACCESS_KEY, and");
    System.err.println("    GPG_PUBLIC_KEY (gpg) or ENCRYPTION_PASSWORD (aes256)");
    System.err.println("");
    exit(1);
  }

  protected void exit(int returnCode) {
    System.exit(returnCode);
  }
}
