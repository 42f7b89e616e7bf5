package com.example.datalake.dsdust.column;

/** A caller-supplied tabular file could not be read; that file is skipped. */
public class SchemaReadException extends RuntimeException {

  private final String source;

  public SchemaReadException(String source, String message, Throwable cause) {
    super(message, cause);
    this.source = source;
  }

  public String getSource() {
    return source;
  }
}
