package com.daveeberhart.backup_util.doksnap.progress;

import org.junit.Assert;
import org.junit.Test;

import com.amazonaws.event.ProgressEvent;
import com.amazonaws.event.ProgressEventType;

/**
 * @author deberhar
 */
public class ProgressListenerTest {

  @Test
  public void testFormatPadsPercent() {
    BaseProgressListener listener = new BaseProgressListener("blog", "Encrypt", 100, 10);

    Assert.assertTrue(listener.format(5, 5d).startsWith("[blog] Encrypt   5%"));
    Assert.assertTrue(listener.format(42, 42d).startsWith("[blog] Encrypt  42%"));
    Assert.assertTrue(listener.format(100, 100d).startsWith("[blog] Encrypt 100%"));
  }

  @Test
  public void testFormatFitsALine() {
    BaseProgressListener listener = new BaseProgressListener("blog", "Encrypt", 100, 10);
    Assert.assertTrue(listener.format(50, 50d).length() <= 79);
  }

  @Test
  public void testAwsListenerCountsOnlyTransferredBytes() {
    AwsProgressListener listener = new AwsProgressListener("backups/blog/x", 1000);

    listener.progressChanged(new ProgressEvent(ProgressEventType.REQUEST_BYTE_TRANSFER_EVENT, 400));
    listener.progressChanged(new ProgressEvent(ProgressEventType.RESPONSE_BYTE_TRANSFER_EVENT, 9999));
    listener.progressChanged(new ProgressEvent(ProgressEventType.REQUEST_BYTE_TRANSFER_EVENT, 600));
    listener.done();

    Assert.assertEquals(1000, listener.getTotalBytesProcessed());
  }

  @Test
  public void testCryptoReportsAboutEveryTenth() {
    Assert.assertEquals(CryptoProgressListener.MIN_INTERVAL, CryptoProgressListener.reportInterval(0));
    Assert.assertEquals(CryptoProgressListener.MIN_INTERVAL, CryptoProgressListener.reportInterval(100L * 1024L * 1024L));
    Assert.assertEquals(1024L * 1024L * 1024L, CryptoProgressListener.reportInterval(10L * 1024L * 1024L * 1024L));
  }

  @Test
  public void testCryptoCountsBytes() {
    CryptoProgressListener listener = new CryptoProgressListener("blog.tar.gz", "Encrypt", 8192);
    listener.addBytesProcessed(4096);
    listener.addBytesProcessed(4096);
    listener.done();
    Assert.assertEquals(8192, listener.getTotalBytesProcessed());
  }

  @Test
  public void testEmptyTotalDoesNotDivideByZero() {
    CryptoProgressListener listener = new CryptoProgressListener("blog", "Encrypt", 0);
    listener.addBytesProcessed(0);
    listener.done();
  }

}
