package com.example.datalake.dsdust.config;

import com.example.datalake.dsdust.cache.QueryCache;
import com.example.datalake.dsdust.catalog.DatasetCatalogClient;
import com.example.datalake.dsdust.catalog.KaggleCatalogClient;
import com.example.datalake.dsdust.column.IdentifierColumnFilter;
import com.example.datalake.dsdust.column.SchemaReader;
import com.example.datalake.dsdust.expand.QueryExpander;
import com.example.datalake.dsdust.fetch.PaginatedAccumulator;
import com.example.datalake.dsdust.fetch.RateLimitedFetcher;
import com.example.datalake.dsdust.fetch.RequestGate;
import com.example.datalake.dsdust.fetch.Sleeper;
import com.example.datalake.dsdust.ingest.RecordNormalizer;
import com.example.datalake.dsdust.ranking.DatasetRanker;
import com.example.datalake.dsdust.scoring.RelevanceScorer;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

/** Wires the catalog client and the search engine components from configuration. */
@Slf4j
@Configuration
public class SearchEngineConfig {

    @Bean
    public WebClient kaggleWebClient(WebClient.Builder builder, KaggleProps props) {
        WebClient.Builder b = builder.clone()
                .baseUrl(props.getBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        if (StringUtils.hasText(props.getUsername()) && StringUtils.hasText(props.getKey())) {
            b.defaultHeaders(h -> h.setBasicAuth(props.getUsername(), props.getKey()));
        } else {
            log.warn("dsdust.kaggle.username/key not set; catalog calls will be anonymous and may be rejected");
        }
        return b.build();
    }

    @Bean
    @ConditionalOnMissingBean(DatasetCatalogClient.class)
    public DatasetCatalogClient datasetCatalogClient(WebClient kaggleWebClient, ObjectMapper om, KaggleProps props) {
        return new KaggleCatalogClient(kaggleWebClient, om, props);
    }

    @Bean
    @ConditionalOnMissingBean(Sleeper.class)
    public Sleeper sleeper() {
        return Sleeper.system();
    }

    @Bean
    public RequestGate requestGate(SearchProperties props, Sleeper sleeper) {
        SearchProperties.Retry retry = props.getRetry();
        return new RequestGate(retry.getRequestPermits(), retry.getMinDelay(), sleeper);
    }

    @Bean
    public RateLimitedFetcher rateLimitedFetcher(DatasetCatalogClient client, RequestGate gate, Sleeper sleeper,
                                                 SearchProperties props) {
        SearchProperties.Retry retry = props.getRetry();
        return new RateLimitedFetcher(client, gate, sleeper,
                retry.getBackoffBase(), retry.getMaxDelay(), retry.getMaxRetries());
    }

    @Bean
    public PaginatedAccumulator paginatedAccumulator(RateLimitedFetcher fetcher) {
        return new PaginatedAccumulator(fetcher);
    }

    @Bean
    public QueryCache queryCache(SearchProperties props) {
        return new QueryCache(props.getCache().getCapacity());
    }

    @Bean
    public QueryExpander queryExpander() {
        return new QueryExpander();
    }

    @Bean
    public RelevanceScorer relevanceScorer() {
        return new RelevanceScorer();
    }

    @Bean
    public RecordNormalizer recordNormalizer(RelevanceScorer scorer, SearchProperties props) {
        return new RecordNormalizer(scorer, props.getDescriptionMaxLength());
    }

    @Bean
    public DatasetRanker datasetRanker() {
        return new DatasetRanker();
    }

    @Bean
    public IdentifierColumnFilter identifierColumnFilter() {
        return new IdentifierColumnFilter();
    }

    @Bean
    public SchemaReader schemaReader() {
        return new SchemaReader();
    }
}
