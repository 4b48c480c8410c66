package com.daveeberhart.backup_util.doksnap.progress;

/**
 * Logs how far an encryptor has got through a backup archive.
 * <p>
 * Fed by the AES and GPG encryptors with the number of plaintext (or, when decrypting, ciphertext)
 * bytes read per block.  Lines go out roughly every tenth of the archive, but never more often than
 * every {@value #MIN_INTERVAL} bytes, so small archives stay quiet in the daemon log.
 *
 * @author deberhar
 */
public class CryptoProgressListener extends BaseProgressListener {
  /** 64MB */
  static final long MIN_INTERVAL = 64L * 1024L * 1024L;

  private long totalBytesProcessed;

  /**
   * @param p_archiveName Archive file name, shown as the line's caption.
   * @param p_action "Encrypt" or "Decrypt".
   * @param p_archiveSize Size of the input in bytes.
   */
  public CryptoProgressListener(String p_archiveName, String p_action, long p_archiveSize) {
    super(p_archiveName, p_action, p_archiveSize, reportInterval(p_archiveSize));
  }

  static long reportInterval(long p_archiveSize) {
    return Math.max(MIN_INTERVAL, p_archiveSize / 10);
  }

  public void addBytesProcessed(long p_bytes) {
    totalBytesProcessed += p_bytes;
    reportProgress(totalBytesProcessed);
  }

  public long getTotalBytesProcessed() {
    return totalBytesProcessed;
  }

}
