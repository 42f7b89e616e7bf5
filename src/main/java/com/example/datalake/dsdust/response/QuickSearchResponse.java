package com.example.datalake.dsdust.response;

import java.util.List;

public record QuickSearchResponse(List<DatasetSummary> datasets) {}
