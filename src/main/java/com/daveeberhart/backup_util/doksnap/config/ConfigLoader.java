package com.daveeberhart.backup_util.doksnap.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Properties;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.daveeberhart.backup_util.doksnap.crypto.EncryptionMethod;
import com.daveeberhart.backup_util.doksnap.error.ConfigException;

/**
 * Reads and validates the daemon configuration.
 * <p>
 * Settings come from a properties file (default {@value #DEFAULT_CONFIG_FILE}, override with
 * {@code -Dconfig.file.location=...}).  Entries from the file never override a value passed on
 * the command line as {@code -Dkey=value}.  Secrets only come from the environment.
 *
 * @author deberhar
 */
public class ConfigLoader {
  private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

  public static final String DEFAULT_CONFIG_FILE = "/etc/doksnap/doksnap.properties";
  static final long MAX_CONFIG_SIZE = 1024L * 1024L;

  private static final Pattern SOURCE_ID = Pattern.compile("[a-zA-Z0-9_\\-]+");
  private static final Pattern BUCKET = Pattern.compile("[a-z0-9][a-z0-9\\-.]*[a-z0-9]");
  private static final Pattern HOSTNAME = Pattern.compile("[a-zA-Z0-9][a-zA-Z0-9.\\-]*[a-zA-Z0-9]");
  private static final Pattern DIGITS = Pattern.compile("[0-9]+");

  static final List<String> DEFAULT_ALLOWED_BASE_PATHS = Arrays.asList(
      "/var/lib/docker/volumes",
      "/data",
      "/backups",
      "/opt",
      "/srv");

  private static final List<String> DISALLOWED_PATHS = Arrays.asList(
      "/etc",
      "/root",
      "/home",
      "/usr/bin",
      "/usr/sbin",
      "/bin",
      "/sbin",
      "/proc",
      "/sys",
      "/dev");

  private final Properties props;
  private final Map<String, String> env;

  public ConfigLoader(Properties p_props, Map<String, String> p_env) {
    props = p_props;
    env = p_env;
  }

  /**
   * Load the config file into the system properties, then parse them.
   */
  public static DokSnapConfig load() {
    File configFile = new File(System.getProperty("config.file.location", DEFAULT_CONFIG_FILE));
    if (configFile.exists()) {
      for (Entry<Object, Object> entry : readConfigFile(configFile).entrySet()) {
        System.getProperties().putIfAbsent(entry.getKey(), entry.getValue());
      }
    } else {
      logger.warn("Config file not found at {}; using system properties only", configFile.getAbsolutePath());
    }

    return new ConfigLoader(System.getProperties(), System.getenv()).parse();
  }

  static Properties readConfigFile(File p_configFile) {
    if (p_configFile.length() > MAX_CONFIG_SIZE) {
      throw new ConfigException("Configuration file too large: " + p_configFile.length()
          + " bytes. Maximum allowed: " + MAX_CONFIG_SIZE + " bytes (1MB)");
    }

    Properties fileProps = new Properties();
    try (FileInputStream fs = new FileInputStream(p_configFile)) {
      fileProps.load(fs);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return fileProps;
  }

  public DokSnapConfig parse() {
    S3Settings s3 = parseS3();
    EncryptionSettings encryption = parseEncryption();
    List<Source> sources = parseSources();
    Path scratchDir = Paths.get(props.getProperty("scratch.dir", System.getProperty("java.io.tmpdir")));
    if (!Files.isDirectory(scratchDir)) {
      throw new ConfigException("Scratch directory does not exist: " + scratchDir);
    }

    return new DokSnapConfig(s3, encryption, sources, scratchDir);
  }

  private S3Settings parseS3() {
    String bucket = getRequiredProperty("s3.bucket");
    if (!BUCKET.matcher(bucket).matches() || bucket.length() < 3 || bucket.length() > 63) {
      throw new ConfigException("Invalid S3 bucket name: " + bucket + ". Must be 3-63 characters, lowercase alphanumeric.");
    }

    String endpoint = props.getProperty("s3.endpoint", S3Settings.AWS_ENDPOINT).trim();
    if (endpoint.contains("://") || endpoint.contains(":") || endpoint.contains("/")) {
      throw new ConfigException("Invalid S3 endpoint: " + endpoint + ". Endpoint must be a hostname only (no protocol, port, or path).");
    }
    if (!HOSTNAME.matcher(endpoint).matches()) {
      throw new ConfigException("Invalid S3 endpoint format: " + endpoint + ". Must be a valid hostname.");
    }

    return new S3Settings(
        bucket,
        endpoint,
        props.getProperty("s3.region", "us-east-1").trim(),
        getRequiredEnv("AWS_ACCESS_KEY_ID"),
        getRequiredEnv("AWS_SECRET_ACCESS_KEY"));
  }

  private EncryptionSettings parseEncryption() {
    EncryptionMethod method;
    try {
      method = EncryptionMethod.fromId(props.getProperty("encryption.method", EncryptionMethod.GPG.getId()).trim());
    } catch (IllegalArgumentException e) {
      throw new ConfigException(e.getMessage() + ". Use 'gpg' or 'aes256'");
    }

    switch (method) {
    case GPG:
      String keyId = props.getProperty("encryption.keyId", env.get("GPG_KEY_ID"));
      String keyring = props.getProperty("encryption.keyring");
      return EncryptionSettings.gpg(
          getRequiredEnv("GPG_PUBLIC_KEY"),
          keyId == null || keyId.trim().isEmpty() ? null : keyId.trim(),
          keyring == null ? null : Paths.get(keyring.trim()));
    case AES256:
      return EncryptionSettings.aes256(getRequiredEnv("ENCRYPTION_PASSWORD"));
    default:
      throw new ConfigException("Unsupported encryption method: " + method);
    }
  }

  private List<Source> parseSources() {
    List<String> ids = splitList(props.getProperty("sources", ""));
    if (ids.isEmpty()) {
      logger.warn("No sources configured; the daemon will idle");
    }

    Set<String> seen = new HashSet<>();
    Set<String> duplicates = new HashSet<>();
    for (String id : ids) {
      if (!SOURCE_ID.matcher(id).matches()) {
        throw new ConfigException("Invalid source name: " + id + ". Only alphanumeric, underscore, and dash allowed.");
      }
      if (!seen.add(id)) {
        duplicates.add(id);
      }
    }
    if (!duplicates.isEmpty()) {
      throw new ConfigException("Duplicate source names found: " + String.join(", ", duplicates));
    }

    List<Path> allowedBases = splitList(props.getProperty("source.allowedBasePaths", String.join(",", DEFAULT_ALLOWED_BASE_PATHS)))
        .stream()
        .map(Paths::get)
        .collect(Collectors.toList());

    List<Source> sources = new ArrayList<>();
    for (String id : ids) {
      sources.add(parseSource(id, allowedBases));
    }
    return sources;
  }

  private Source parseSource(String p_id, List<Path> p_allowedBases) {
    String prefix = "source." + p_id + ".";

    SourceKind kind = SourceKind.fromId(getRequiredProperty(prefix + "kind").trim());
    Path path = validateSourcePath(p_id, getRequiredProperty(prefix + "path").trim(), p_allowedBases);

    String schedule = getRequiredProperty(prefix + "schedule").trim();
    if (!CronSchedules.isValid(schedule)) {
      throw new ConfigException("Invalid cron schedule for source " + p_id + ": " + schedule);
    }

    RetentionPolicy retention = new RetentionPolicy(
        getBoundedInt(prefix + "retention.keepLast", 1, 1000),
        getBoundedInt(prefix + "retention.daily", 1, 365),
        getBoundedInt(prefix + "retention.weekly", 1, 104),
        getBoundedInt(prefix + "retention.monthly", 1, 120));

    Hooks hooks = new Hooks(
        props.getProperty(prefix + "hooks.preBackup"),
        props.getProperty(prefix + "hooks.postBackup"));

    return new Source(p_id, kind, path, schedule, retention, hooks);
  }

  private Path validateSourcePath(String p_id, String p_path, List<Path> p_allowedBases) {
    if (p_path.contains("..") || p_path.contains("//")) {
      throw new ConfigException("Path traversal detected in source path for " + p_id + ": " + p_path);
    }

    Path normalized = Paths.get(p_path).toAbsolutePath().normalize();
    for (String disallowed : DISALLOWED_PATHS) {
      if (normalized.startsWith(Paths.get(disallowed))) {
        throw new ConfigException("Source path for " + p_id + " is in a disallowed directory: " + p_path);
      }
    }

    if (p_allowedBases.stream().noneMatch(normalized::startsWith)) {
      throw new ConfigException("Source path for " + p_id + " must be under one of: "
          + p_allowedBases.stream().map(Path::toString).collect(Collectors.joining(", ")));
    }

    if (!Files.exists(normalized)) {
      throw new ConfigException("Source path does not exist for " + p_id + ": " + normalized);
    }
    return normalized;
  }

  private Integer getBoundedInt(String p_prop, int p_min, int p_max) {
    String val = props.getProperty(p_prop);
    if (val == null || val.trim().isEmpty()) {
      return null;
    }

    val = val.trim();
    if (!DIGITS.matcher(val).matches()) {
      throw new ConfigException("Invalid retention value for " + p_prop + ": must be an integer");
    }

    int intVal;
    try {
      intVal = Integer.parseInt(val);
    } catch (NumberFormatException e) {
      intVal = Integer.MAX_VALUE;
    }
    if (intVal < p_min || intVal > p_max) {
      throw new ConfigException("Invalid retention value for " + p_prop + ": must be between " + p_min + " and " + p_max + ", got " + val);
    }
    return intVal;
  }

  /**
   * @param p_prop The name of the property to load
   * @return The property's value, preferring properties set via the commandline.
   */
  private String getRequiredProperty(String p_prop) {
    String val = props.getProperty(p_prop);
    if (val == null || val.trim().isEmpty()) {
      throw new ConfigException("A value is required for the setting (property) " + p_prop
          + ". Either add it to the config file, or pass a value on the command line (e.g. -D" + p_prop + "=\"value\")");
    }
    return val;
  }

  private String getRequiredEnv(String p_var) {
    String val = env.get(p_var);
    if (val == null || val.trim().isEmpty()) {
      throw new ConfigException(p_var + " environment variable is required");
    }
    return val;
  }

  private static List<String> splitList(String p_value) {
    return Arrays.stream(p_value.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .collect(Collectors.toList());
  }

}
