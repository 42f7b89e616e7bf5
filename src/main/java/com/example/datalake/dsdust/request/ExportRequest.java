package com.example.datalake.dsdust.request;

import com.example.datalake.dsdust.model.DatasetRecord;
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
public class ExportRequest {
  @Builder.Default private List<DatasetRecord> datasets = new ArrayList<>();
}
