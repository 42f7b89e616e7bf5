package com.example.datalake.dsdust.controller;

import com.example.datalake.dsdust.column.UploadedTable;
import com.example.datalake.dsdust.export.DatasetCsvExporter;
import com.example.datalake.dsdust.fetch.SearchCancellation;
import com.example.datalake.dsdust.model.SearchReport;
import com.example.datalake.dsdust.request.CollectRequest;
import com.example.datalake.dsdust.request.DownloadRequest;
import com.example.datalake.dsdust.request.ExportRequest;
import com.example.datalake.dsdust.request.SearchRequest;
import com.example.datalake.dsdust.response.DatasetSummary;
import com.example.datalake.dsdust.response.DownloadResponse;
import com.example.datalake.dsdust.response.QuickSearchResponse;
import com.example.datalake.dsdust.response.SearchResponse;
import com.example.datalake.dsdust.service.ColumnSimilarityService;
import com.example.datalake.dsdust.service.DatasetSearchService;
import com.example.datalake.dsdust.validation.ValidationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.function.Function;

@Slf4j
@RestController
@RequestMapping("/v1/datasets")
@Tag(name = "Dataset Search API", description = "Aggregated catalog search, column similarity and export")
@RequiredArgsConstructor
public class DatasetSearchController {

    private final DatasetSearchService searchService;
    private final ColumnSimilarityService columnSimilarityService;
    private final DatasetCsvExporter csvExporter;

    @GetMapping("/search")
    @Operation(summary = "Quick keyword search", description = "Returns the title and reference of each match.")
    public Mono<ResponseEntity<QuickSearchResponse>> quickSearch(@RequestParam(required = false) String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return Mono.just(ResponseEntity.badRequest().body(new QuickSearchResponse(List.of())));
        }
        return runBlocking(token -> searchService.quickSearch(keyword, token))
                .map(report -> ResponseEntity.ok(new QuickSearchResponse(
                        report.getDatasets().stream().map(DatasetSummary::of).toList())))
                .onErrorResume(ex -> {
                    log.error("Quick search for '{}' failed", keyword, ex);
                    return Mono.just(ResponseEntity.internalServerError().body(new QuickSearchResponse(List.of())));
                });
    }

    @PostMapping("/search")
    @Operation(
            summary = "Search datasets across keywords, tags, file types and columns",
            description = "A single filled-in dimension uses that dimension's ordering; several are combined and ranked by boosted score."
    )
    public Mono<ResponseEntity<SearchResponse>> search(@RequestBody SearchRequest req) {
        return respond(runBlocking(token -> searchService.search(req, token)), "search");
    }

    @PostMapping(value = "/search/columns", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(
            summary = "Find datasets similar to uploaded tables",
            description = "Reads the header of each uploaded CSV, drops identifier columns and searches for the rest."
    )
    public Mono<ResponseEntity<SearchResponse>> searchByColumns(@RequestPart("files") Flux<FilePart> files,
                                                                @RequestParam(required = false) Integer maxResults) {
        Mono<SearchReport> report = files
                .flatMapSequential(this::buffer)
                .collectList()
                .flatMap(tables -> runBlocking(token -> columnSimilarityService.findSimilar(tables, maxResults, token)));
        return respond(report, "column search");
    }

    @PostMapping("/collect")
    @Operation(summary = "Collect every dataset related to a domain")
    public Mono<ResponseEntity<SearchResponse>> collect(@Valid @RequestBody CollectRequest req) {
        return respond(runBlocking(token -> searchService.comprehensiveCollection(req.getDomain(), req.getMaxTotal(), token)),
                "collection");
    }

    @PostMapping(value = "/export", produces = "text/csv")
    @Operation(summary = "Export datasets as CSV")
    public Mono<ResponseEntity<String>> export(@RequestBody ExportRequest req) {
        return Mono.fromCallable(() -> csvExporter.toCsv(req.getDatasets()))
                .map(csv -> ResponseEntity.ok()
                        .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"datasets.csv\"")
                        .contentType(MediaType.parseMediaType("text/csv"))
                        .body(csv));
    }

    @PostMapping("/download")
    @Operation(summary = "Acknowledge a download selection", description = "Nothing is transferred yet.")
    public Mono<ResponseEntity<DownloadResponse>> download(@RequestBody DownloadRequest req) {
        List<String> refs = req.getReferences() == null ? List.of() : req.getReferences();
        if (refs.isEmpty()) {
            return Mono.just(ResponseEntity.badRequest().body(new DownloadResponse("No datasets selected for download", 0)));
        }
        return Mono.just(ResponseEntity.ok(
                new DownloadResponse("Download initiated for " + refs.size() + " dataset(s)", refs.size())));
    }

    private Mono<UploadedTable> buffer(FilePart part) {
        return DataBufferUtils.join(part.content())
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return new UploadedTable(part.filename(), bytes);
                })
                .defaultIfEmpty(new UploadedTable(part.filename(), new byte[0]));
    }

    // 阻塞的检索放到 boundedElastic，客户端断开时取消
    private Mono<SearchReport> runBlocking(Function<SearchCancellation, SearchReport> work) {
        SearchCancellation token = SearchCancellation.create();
        return Mono.fromCallable(() -> work.apply(token))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnCancel(token::cancel);
    }

    private Mono<ResponseEntity<SearchResponse>> respond(Mono<SearchReport> report, String operation) {
        return report
                .map(r -> ResponseEntity.ok(SearchResponse.of(r)))
                .onErrorResume(ValidationException.class, ex ->
                        Mono.just(ResponseEntity.badRequest().body(SearchResponse.errors(ex.getReasons()))))
                .onErrorResume(ex -> {
                    log.error("Unexpected failure during {}", operation, ex);
                    return Mono.just(ResponseEntity.internalServerError()
                            .body(SearchResponse.error("Unexpected error: " + ex.getMessage())));
                });
    }
}
