package com.daveeberhart.backup_util.doksnap.error;

/**
 * Causes the launcher to print this error and exit before any backup is scheduled.
 *
 * @author deberhar
 */
public class ConfigException extends RuntimeException {

  public ConfigException(String p_mesg) {
    super(p_mesg);
  }

  public ConfigException(String p_mesg, Exception e) {
    super(p_mesg, e);
  }

}
