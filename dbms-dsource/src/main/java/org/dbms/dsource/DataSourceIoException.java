package org.dbms.dsource;

import org.dbms.dtype.DbmsException;

/**
 * Exception thrown when a data source cannot open or read its underlying storage.
 *
 * <p>Failures are reported to the immediate caller and never retried internally.
 */
public class DataSourceIoException extends DbmsException {
  private final String location;

  /**
   * Creates a new DataSourceIoException.
   *
   * @param location the file or URI that could not be read
   * @param cause the underlying failure
   */
  public DataSourceIoException(String location, Throwable cause) {
    super("Failed to read " + location + ": " + describe(cause), cause);
    this.location = location;
  }

  /**
   * Gets the file or URI that could not be read.
   *
   * @return the location
   */
  public String getLocation() {
    return location;
  }

  private static String describe(Throwable cause) {
    String msg = cause.getMessage();
    return msg != null ? msg : cause.getClass().getName();
  }
}
