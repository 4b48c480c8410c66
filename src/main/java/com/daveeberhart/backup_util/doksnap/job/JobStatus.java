package com.daveeberhart.backup_util.doksnap.job;

/**
 * @author deberhar
 */
public enum JobStatus {
  RUNNING,
  SUCCESS,
  FAILED;
}
