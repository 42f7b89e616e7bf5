package com.example.datalake.dsdust.model;

/** A concrete query that was abandoned; the rest of the aggregation carried on without it. */
public record QueryFailure(String query, String reason) {}
