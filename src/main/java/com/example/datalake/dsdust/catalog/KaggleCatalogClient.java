package com.example.datalake.dsdust.catalog;

import com.example.datalake.dsdust.config.KaggleProps;
import com.example.datalake.dsdust.model.CatalogPage;
import com.example.datalake.dsdust.model.FileInfo;
import com.example.datalake.dsdust.model.RawDatasetRecord;
import com.example.datalake.dsdust.model.Tag;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;
import reactor.core.Exceptions;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Kaggle REST catalog ({@code /api/v1/datasets/list}). Calls are synchronous; pacing and retries
 * live in {@code RateLimitedFetcher}, this class only classifies failures.
 */
@Slf4j
public class KaggleCatalogClient implements DatasetCatalogClient {

  private static final String SORT_BY = "hottest";

  private final WebClient web;
  private final ObjectMapper om;
  private final Duration timeout;

  public KaggleCatalogClient(WebClient web, ObjectMapper om, KaggleProps props) {
    this.web = web;
    this.om = om;
    this.timeout = props.getTimeout();
  }

  @Override
  public CatalogPage list(String query, int page, String fileType) {
    String json = get(uri -> {
      UriBuilder b = uri.path("/datasets/list")
          .queryParam("page", page)
          .queryParam("sortBy", SORT_BY);
      if (query != null && !query.isBlank()) {
        b.queryParam("search", query);
      }
      if (fileType != null && !fileType.isBlank()) {
        b.queryParam("filetype", fileType);
      }
      return b.build();
    }, "list '" + query + "' page " + page);

    JsonNode root = readTree(json);
    if (root == null || !root.isArray() || root.isEmpty()) {
      return CatalogPage.empty();
    }
    List<RawDatasetRecord> records = new ArrayList<>(root.size());
    for (JsonNode node : root) {
      records.add(toRawRecord(node));
    }
    log.debug("Kaggle list '{}' filetype={} page {} -> {} records", query, fileType, page, records.size());
    return new CatalogPage(records);
  }

  @Override
  public List<FileInfo> listFiles(String reference) {
    String[] parts = reference == null ? new String[0] : reference.split("/", 2);
    if (parts.length != 2) {
      throw new FatalCatalogException("Not an owner/slug reference: " + reference);
    }
    String json = get(uri -> uri.path("/datasets/list/{owner}/{slug}").build(parts[0], parts[1]),
        "files of " + reference);

    JsonNode root = readTree(json);
    JsonNode files = root == null ? null : root.path("datasetFiles");
    if (files == null || !files.isArray()) {
      return List.of();
    }
    List<FileInfo> out = new ArrayList<>(files.size());
    for (JsonNode f : files) {
      out.add(new FileInfo(f.path("name").asText(""), f.path("totalBytes").asLong(0L)));
    }
    return out;
  }

  private String get(Function<UriBuilder, URI> uri, String operation) {
    try {
      String body = web.get()
          .uri(uri)
          .retrieve()
          .bodyToMono(String.class)
          .timeout(timeout)
          .block();
      return body == null ? "" : body;
    } catch (WebClientResponseException e) {
      int status = e.getStatusCode().value();
      if (status == 429) {
        throw new RateLimitedException("Kaggle rate limit hit during " + operation);
      }
      if (status >= 500) {
        throw new TransientCatalogException("Kaggle HTTP " + status + " during " + operation, e);
      }
      throw new FatalCatalogException("Kaggle HTTP " + status + " during " + operation, e);
    } catch (WebClientRequestException e) {
      throw new TransientCatalogException("Kaggle unreachable during " + operation + ": " + e.getMessage(), e);
    } catch (RuntimeException e) {
      if (Exceptions.unwrap(e) instanceof TimeoutException) {
        throw new TransientCatalogException("Kaggle timed out after " + timeout + " during " + operation, e);
      }
      throw e;
    }
  }

  private JsonNode readTree(String json) {
    if (json == null || json.isBlank()) {
      return null;
    }
    try {
      return om.readTree(json);
    } catch (JsonProcessingException e) {
      throw new FatalCatalogException("Unreadable catalog payload: " + e.getOriginalMessage(), e);
    }
  }

  private RawDatasetRecord toRawRecord(JsonNode n) {
    List<Tag> tags = new ArrayList<>();
    for (JsonNode t : n.path("tags")) {
      if (t.isTextual()) {
        tags.add(Tag.of(t.asText()));
      } else if (t.isObject()) {
        tags.add(Tag.named(t.path("name").asText(null), t.path("ref").asText(null)));
      }
    }
    List<FileInfo> files = new ArrayList<>();
    for (JsonNode f : n.path("files")) {
      files.add(new FileInfo(f.path("name").asText(""), f.path("totalBytes").asLong(0L)));
    }
    return RawDatasetRecord.builder()
        .ref(text(n, "ref"))
        .title(text(n, "title"))
        .subtitle(text(n, "subtitle"))
        .description(text(n, "description"))
        .totalBytes(n.hasNonNull("totalBytes") ? n.get("totalBytes").asLong() : null)
        .lastUpdated(text(n, "lastUpdated"))
        .downloadCount(n.hasNonNull("downloadCount") ? n.get("downloadCount").asLong() : null)
        .voteCount(n.hasNonNull("voteCount") ? n.get("voteCount").asLong() : null)
        .usabilityRating(n.hasNonNull("usabilityRating") ? n.get("usabilityRating").asDouble() : null)
        .tags(tags)
        .files(files)
        .build();
  }

  private static String text(JsonNode n, String field) {
    JsonNode v = n.get(field);
    return v == null || v.isNull() ? null : v.asText();
  }
}
