package com.example.datalake.dsdust.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.List;

/**
 * A catalog entry as the transport returned it. Numeric fields are boxed because the catalog may
 * omit them; only {@code ref} and {@code title} are required.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class RawDatasetRecord {
  private String ref;
  private String title;
  private String subtitle;
  private String description;
  private Long totalBytes;
  private String lastUpdated;
  private Long downloadCount;
  private Long voteCount;
  private Double usabilityRating;
  @Builder.Default private List<Tag> tags = new ArrayList<>();
  @Builder.Default private List<FileInfo> files = new ArrayList<>();

  /** Copy with its own tag and file lists; the elements themselves are immutable. */
  public RawDatasetRecord copy() {
    return toBuilder()
        .tags(tags == null ? new ArrayList<>() : new ArrayList<>(tags))
        .files(files == null ? new ArrayList<>() : new ArrayList<>(files))
        .build();
  }
}
