package com.example.datalake.dsdust.column;

/** A tabular file handed in by the caller, already buffered in memory. */
public record UploadedTable(String filename, byte[] content) {

  public UploadedTable {
    content = content == null ? new byte[0] : content;
  }
}
