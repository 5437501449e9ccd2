package org.dbms.dsource;

import org.dbms.dtype.DbmsException;

/**
 * Exception thrown when a decoder reports malformed data while a scan is in progress.
 *
 * <p>It is thrown from {@link RecordBatchStream#next()}. Batches yielded before the failure remain
 * valid, but the stream produces nothing further.
 */
public class DecodeException extends DbmsException {
  public DecodeException(String message) {
    super(message);
  }

  public DecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
