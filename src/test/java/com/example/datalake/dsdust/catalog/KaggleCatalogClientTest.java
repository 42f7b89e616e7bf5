package com.example.datalake.dsdust.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.datalake.dsdust.config.KaggleProps;
import com.example.datalake.dsdust.model.CatalogPage;
import com.example.datalake.dsdust.model.FileInfo;
import com.example.datalake.dsdust.model.RawDatasetRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

class KaggleCatalogClientTest {

  private final List<URI> requests = new ArrayList<>();

  private KaggleCatalogClient clientReturning(HttpStatus status, String body) {
    WebClient web = WebClient.builder()
        .baseUrl("https://www.kaggle.com/api/v1")
        .exchangeFunction(request -> {
          requests.add(request.url());
          return Mono.just(ClientResponse.create(status)
              .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
              .body(body)
              .build());
        })
        .build();
    return new KaggleCatalogClient(web, new ObjectMapper(), new KaggleProps());
  }

  @Test
  void listParsesRecordsWithBothTagShapes() {
    String json = """
        [{"ref": "acme/loans", "title": "Loan book", "subtitle": "Retail loans", "totalBytes": 2048,
          "lastUpdated": "2024-03-01T10:00:00Z", "downloadCount": 120, "voteCount": 7,
          "usabilityRating": 0.88, "tags": ["Finance", {"name": "Banking", "ref": "banking"}],
          "files": [{"name": "loans.csv", "totalBytes": 2048}]}]
        """;
    KaggleCatalogClient client = clientReturning(HttpStatus.OK, json);

    CatalogPage page = client.list("loans", 2, "csv");

    assertThat(page.records()).singleElement().satisfies(r -> {
      assertThat(r.getRef()).isEqualTo("acme/loans");
      assertThat(r.getVoteCount()).isEqualTo(7L);
      assertThat(r.getDescription()).isNull();
      assertThat(r.getTags()).extracting(t -> t.normalized()).containsExactly("finance", "banking");
      assertThat(r.getFiles()).containsExactly(new FileInfo("loans.csv", 2048));
    });
    assertThat(requests.get(0).getPath()).endsWith("/datasets/list");
    assertThat(requests.get(0).getQuery()).contains("page=2", "search=loans", "filetype=csv", "sortBy=hottest");
  }

  @Test
  void emptyArrayIsTheLastPage() {
    assertThat(clientReturning(HttpStatus.OK, "[]").list("x", 5, null).hasMore()).isFalse();
  }

  @Test
  void missingOptionalFieldsStayEmpty() {
    CatalogPage page = clientReturning(HttpStatus.OK, "[{\"ref\": \"o/d\", \"title\": \"T\"}]").list("x", 1, null);

    RawDatasetRecord r = page.records().get(0);
    assertThat(r.getTotalBytes()).isNull();
    assertThat(r.getTags()).isEmpty();
    assertThat(r.getFiles()).isEmpty();
  }

  @Test
  void statusCodesMapToTheErrorTaxonomy() {
    assertThatThrownBy(() -> clientReturning(HttpStatus.TOO_MANY_REQUESTS, "{}").list("x", 1, null))
        .isInstanceOf(RateLimitedException.class);
    assertThatThrownBy(() -> clientReturning(HttpStatus.BAD_GATEWAY, "{}").list("x", 1, null))
        .isInstanceOf(TransientCatalogException.class);
    assertThatThrownBy(() -> clientReturning(HttpStatus.UNAUTHORIZED, "{}").list("x", 1, null))
        .isInstanceOf(FatalCatalogException.class);
  }

  @Test
  void listFilesReadsDatasetFiles() {
    KaggleCatalogClient client = clientReturning(HttpStatus.OK,
        "{\"datasetFiles\": [{\"name\": \"a.json\", \"totalBytes\": 10}, {\"name\": \"b.parquet\", \"totalBytes\": 20}]}");

    assertThat(client.listFiles("acme/loans"))
        .containsExactly(new FileInfo("a.json", 10), new FileInfo("b.parquet", 20));
    assertThat(requests.get(0).getPath()).endsWith("/datasets/list/acme/loans");
  }

  @Test
  void listFilesRejectsReferenceWithoutOwner() {
    assertThatThrownBy(() -> clientReturning(HttpStatus.OK, "{}").listFiles("loans"))
        .isInstanceOf(FatalCatalogException.class);
  }
}
