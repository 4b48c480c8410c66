package com.daveeberhart.backup_util.doksnap.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Progress listener that logs a percentage (and, on a console, a bar) every so many bytes.
 * <p>
 * Each job runs on its own scheduler thread, so one listener is only ever fed from one thread.
 *
 * @author deberhar
 */
public class BaseProgressListener {
  private static final Logger logger = LoggerFactory.getLogger(BaseProgressListener.class);
  private static final boolean HAS_CONSOLE = !Boolean.getBoolean("nohup");
  private static final int LINE_WIDTH = 79;

  private final long reportInterval;
  private final String action;
  private final String caption;
  private final long totalBytes;

  private long nextReport;
  private boolean reportedAnything = false;
  private boolean hit100 = false;

  public BaseProgressListener(String caption, String action, long totalBytes, long reportInterval) {
    this.reportInterval = reportInterval;
    this.caption = caption;
    this.action = action;
    this.totalBytes = Math.max(1, totalBytes); // Cheat a bit and avoid div/0 errors.
    nextReport = reportInterval;
  }

  protected void reportProgress(long totalBytesProcessed) {
    if (nextReport <= totalBytesProcessed) {
      reportedAnything = true;
      nextReport = totalBytesProcessed + reportInterval;

      double dPercent = Math.min(100d, (100d * totalBytesProcessed) / totalBytes);
      long lPercent = Math.round(dPercent);
      if (lPercent == 100) {
        hit100 = true;
      }

      logger.info(format(lPercent, dPercent));
    }
  }

  String format(long p_percent, double p_exactPercent) {
    StringBuilder sb = new StringBuilder(LINE_WIDTH);
    sb.append("[").append(caption).append("] ").append(action).append(" ");
    if (p_percent < 100) {
      sb.append(" ");
    }
    if (p_percent < 10) {
      sb.append(" ");
    }
    sb.append(p_percent).append("%");

    if (HAS_CONSOLE) {
      sb.append(" [");
      int barWidth = Math.max(10, LINE_WIDTH - (sb.length() + 1));
      int cutoff = (int)(barWidth * p_exactPercent / 100d);
      for (int i = 0; i < barWidth; i++) {
        sb.append(i <= cutoff ? '=' : ' ');
      }
      sb.append("]");
    }
    return sb.toString();
  }

  public void done() {
    if (reportedAnything && !hit100) {
      // If we made any prior reports, force a report of 100% since we're done...
      nextReport = 0;
      reportProgress(totalBytes);
    }
  }

}
