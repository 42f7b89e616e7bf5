package com.example.datalake.dsdust.column;

import java.util.List;

/** Header row of one uploaded file. */
public record TabularSchema(String source, List<String> columns) {

  public TabularSchema {
    columns = List.copyOf(columns);
  }
}
