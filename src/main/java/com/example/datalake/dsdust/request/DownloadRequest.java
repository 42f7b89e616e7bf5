package com.example.datalake.dsdust.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DownloadRequest {
  /** Dataset references picked by the user. */
  @Builder.Default private List<String> references = new ArrayList<>();
}
