package net.pgtyped.client.core;

/**
 * Identifiers of the diagnostic fields attached to an error result. The code is the field type
 * byte of the ErrorResponse message.
 */
public enum DiagField {
  SEVERITY('S'),
  SEVERITY_NONLOCALIZED('V'),
  SQLSTATE('C'),
  MESSAGE_PRIMARY('M'),
  MESSAGE_DETAIL('D'),
  MESSAGE_HINT('H'),
  STATEMENT_POSITION('P'),
  INTERNAL_POSITION('p'),
  INTERNAL_QUERY('q'),
  CONTEXT('W'),
  SCHEMA_NAME('s'),
  TABLE_NAME('t'),
  COLUMN_NAME('c'),
  DATATYPE_NAME('d'),
  CONSTRAINT_NAME('n'),
  SOURCE_FILE('F'),
  SOURCE_LINE('L'),
  SOURCE_FUNCTION('R');

  private final char code;

  DiagField(char code) {
    this.code = code;
  }

  public char getCode() {
    return code;
  }

  public static DiagField fromCode(char code) {
    for (DiagField field : DiagField.values()) {
      if (field.code == code) {
        return field;
      }
    }
    return null;
  }
}
