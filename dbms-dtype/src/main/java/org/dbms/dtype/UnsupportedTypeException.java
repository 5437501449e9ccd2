package org.dbms.dtype;

import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * Exception thrown when an Arrow type has no corresponding {@link DataType}.
 *
 * <p>Raised at schema resolution time (inferred or embedded schemas) and at batch conversion time.
 * It is never silently dropped: a batch containing one unsupported column fails as a whole.
 */
public class UnsupportedTypeException extends DbmsException {
  private final ArrowType arrowType;

  /**
   * Creates a new UnsupportedTypeException.
   *
   * @param arrowType the Arrow type that could not be mapped
   */
  public UnsupportedTypeException(ArrowType arrowType) {
    super("Unsupported Arrow type: " + arrowType);
    this.arrowType = arrowType;
  }

  /**
   * Gets the Arrow type that could not be mapped.
   *
   * @return the offending Arrow type
   */
  public ArrowType getArrowType() {
    return arrowType;
  }
}
