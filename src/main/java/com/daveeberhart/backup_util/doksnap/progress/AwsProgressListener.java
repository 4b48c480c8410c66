package com.daveeberhart.backup_util.doksnap.progress;

import com.amazonaws.event.ProgressEvent;
import com.amazonaws.event.ProgressEventType;
import com.amazonaws.event.ProgressListener;

/**
 * Reports upload progress across every request of one object (a single put, or all parts of a
 * multi-part upload).
 *
 * @author deberhar
 */
public class AwsProgressListener extends BaseProgressListener implements ProgressListener {
  /** 200MB */
  private static final long REPORT_INTERVAL = 200 * 1024 * 1024;

  private long totalBytesProcessed;

  public AwsProgressListener(String caption, long totalBytes) {
    super(caption, "Upload", totalBytes, REPORT_INTERVAL);
  }

  /* (non-Javadoc)
   * @see com.amazonaws.event.ProgressListener#progressChanged(com.amazonaws.event.ProgressEvent)
   */
  @Override
  public void progressChanged(ProgressEvent p_progressEvent) {
    if (p_progressEvent.getEventType() == ProgressEventType.REQUEST_BYTE_TRANSFER_EVENT) {
      totalBytesProcessed += p_progressEvent.getBytesTransferred();
      reportProgress(totalBytesProcessed);
    }
  }

  /**
   * @return Bytes sent so far.
   */
  public long getTotalBytesProcessed() {
    return totalBytesProcessed;
  }

}
