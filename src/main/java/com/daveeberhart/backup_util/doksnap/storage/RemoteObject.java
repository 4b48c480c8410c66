package com.daveeberhart.backup_util.doksnap.storage;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A backup as the object store sees it.
 *
 * @author deberhar
 */
public final class RemoteObject {
  private final String key;
  private final long size;
  private final Instant lastModified;
  private final Map<String, String> metadata;

  public RemoteObject(String p_key, long p_size, Instant p_lastModified, Map<String, String> p_metadata) {
    key = p_key;
    size = p_size;
    lastModified = p_lastModified;
    metadata = p_metadata == null ? Collections.<String, String>emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(p_metadata));
  }

  public String getKey() {
    return key;
  }

  public long getSize() {
    return size;
  }

  public Instant getLastModified() {
    return lastModified;
  }

  /**
   * @return User metadata stored with the object (source-id, checksum, ...).
   */
  public Map<String, String> getMetadata() {
    return metadata;
  }

  @Override
  public String toString() {
    return key + " (" + size + " bytes, " + lastModified + ")";
  }
}
