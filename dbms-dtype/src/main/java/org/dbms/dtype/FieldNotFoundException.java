package org.dbms.dtype;

/** Exception thrown when a column name cannot be resolved against a {@link Schema}. */
public class FieldNotFoundException extends DbmsException {
  private final String fieldName;

  /**
   * Creates a new FieldNotFoundException.
   *
   * @param fieldName the name that was not found
   */
  public FieldNotFoundException(String fieldName) {
    super("Field not found: " + fieldName);
    this.fieldName = fieldName;
  }

  /**
   * Gets the name that was not found.
   *
   * @return the missing field name
   */
  public String getFieldName() {
    return fieldName;
  }
}
