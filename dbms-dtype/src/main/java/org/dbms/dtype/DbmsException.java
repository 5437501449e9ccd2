package org.dbms.dtype;

/**
 * Root of the errors a scan can report to its caller.
 *
 * <p>Schema resolution and batch reading fail with a subclass of this exception: an unknown
 * projected name, an Arrow type with no {@link DataType}, or storage that cannot be opened or
 * decoded. It is unchecked so that streams can surface decode failures from {@code next()}.
 * Programming errors such as an out-of-range row index use the standard JDK exceptions.
 */
public class DbmsException extends RuntimeException {
  public DbmsException(String message) {
    super(message);
  }

  public DbmsException(String message, Throwable cause) {
    super(message, cause);
  }
}
