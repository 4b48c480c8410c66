package com.daveeberhart.backup_util.doksnap.archive;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import org.bouncycastle.util.encoders.Hex;

/**
 * @author deberhar
 */
public final class Checksums {
  private static final int BUFFER_SIZE = 64 * 1024;

  private Checksums() {
  }

  /**
   * @return Lower-case hex SHA-256 of the file's bytes.
   */
  public static String sha256Hex(Path p_file) throws IOException {
    MessageDigest md;
    try {
      md = MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("Every JVM has SHA-256?!", e);
    }

    try (InputStream in = Files.newInputStream(p_file)) {
      byte[] buff = new byte[BUFFER_SIZE];
      int len;
      while ((len = in.read(buff, 0, buff.length)) >= 0) {
        md.update(buff, 0, len);
      }
    }
    return Hex.toHexString(md.digest());
  }

}
