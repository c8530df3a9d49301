package com.ridwan.tweetharvest.output;

import com.ridwan.tweetharvest.model.TweetRecord;
import java.nio.file.Path;

/**
 * Append-only destination for exported rows. Rows appended since the last {@link #flush()} may be
 * lost on a crash; callers flush at their save points. I/O failures surface as {@link
 * java.io.UncheckedIOException}.
 */
public interface ExportSink extends AutoCloseable {

  void append(TweetRecord record);

  void flush();

  Path getOutputPath();

  /** Rows appended through this instance, not counting rows already in a reopened file. */
  int getRowsWritten();

  /** Flushes and releases the underlying file. */
  @Override
  void close();
}
