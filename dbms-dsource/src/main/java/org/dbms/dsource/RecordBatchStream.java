package org.dbms.dsource;

import java.util.Iterator;
import org.dbms.dtype.RecordBatch;

/**
 * A lazily pulled stream of record batches produced by {@link DataSource#scan}.
 *
 * <p>Each batch returned by {@link #next()} is owned by the caller and must be closed by it; it
 * stays valid after the stream advances or is closed.
 *
 * <p>A failure while decoding is thrown from {@link #next()}. After that the stream reports no
 * further batches and has released its resources.
 *
 * <p>Closing the stream releases any open file and decoder resources. Abandoning a stream before
 * it is exhausted is allowed as long as it is closed.
 */
public interface RecordBatchStream extends Iterator<RecordBatch>, AutoCloseable {

  /**
   * Returns the next batch.
   *
   * @throws java.util.NoSuchElementException if the stream is exhausted
   * @throws DecodeException if the decoder reports malformed data
   * @throws org.dbms.dtype.UnsupportedTypeException if a decoded column has an unsupported type
   * @throws IllegalStateException if the stream has been closed
   */
  @Override
  RecordBatch next();

  /** Returns the number of batches returned so far. */
  long batchCount();

  /** Returns the total number of rows across the batches returned so far. */
  long rowCount();

  /** Releases the stream's resources. Calling this more than once has no effect. */
  @Override
  void close();
}
