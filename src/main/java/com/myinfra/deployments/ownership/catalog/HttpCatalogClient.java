package com.myinfra.deployments.ownership.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.myinfra.deployments.ownership.config.AppConfig;
import com.myinfra.deployments.ownership.config.AppConfig.CatalogConfig;
import com.myinfra.deployments.ownership.exception.CatalogLookupException;
import com.myinfra.deployments.ownership.model.CatalogEntity;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.client.circuitbreaker.ReactiveCircuitBreaker;
import org.springframework.cloud.client.circuitbreaker.ReactiveCircuitBreakerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Catalog client backed by the catalog REST API
 * ({@code GET /entities/by-name/{kind}/{namespace}/{name}}).
 * Every call runs through the "catalog" circuit breaker.
 */
@Slf4j
@Service
public class HttpCatalogClient implements CatalogClient {

    public static final String CIRCUIT_BREAKER_ID = "catalog";

    private static final String DEFAULT_NAMESPACE = "default";

    private final WebClient webClient;
    private final ReactiveCircuitBreakerFactory<?, ?> circuitBreakerFactory;
    private final CatalogConfig config;

    public HttpCatalogClient(WebClient.Builder webClientBuilder,
                             ReactiveCircuitBreakerFactory<?, ?> circuitBreakerFactory,
                             AppConfig appConfig) {
        Objects.requireNonNull(webClientBuilder, "WebClient.Builder must not be null");
        this.circuitBreakerFactory = Objects.requireNonNull(circuitBreakerFactory, "CircuitBreakerFactory must not be null");
        this.config = Objects.requireNonNull(appConfig, "AppConfig must not be null").getCatalog();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 3000)
                .responseTimeout(Duration.ofSeconds(5));

        this.webClient = webClientBuilder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Override
    public Mono<CatalogEntity> findByRef(String entityRef) {
        String baseUrl = config.getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            return Mono.error(new CatalogLookupException(entityRef,
                    new IllegalStateException("app.catalog.base-url is not configured")));
        }

        EntityRef ref = EntityRef.parse(entityRef);

        Mono<CatalogEntity> lookup = webClient.get()
                .uri(baseUrl + "/entities/by-name/{kind}/{namespace}/{name}", ref.kind(), ref.namespace(), ref.name())
                .accept(MediaType.APPLICATION_JSON)
                .headers(h -> {
                    if (config.getToken() != null && !config.getToken().isBlank()) {
                        h.setBearerAuth(config.getToken());
                    }
                })
                .exchangeToMono(this::readEntity);

        ReactiveCircuitBreaker circuitBreaker = circuitBreakerFactory.create(CIRCUIT_BREAKER_ID);

        return circuitBreaker.run(lookup, throwable -> {
            log.warn("Catalog lookup fallback for {}: {}", entityRef, throwable.getMessage());
            return Mono.error(new CatalogLookupException(entityRef, throwable));
        });
    }

    /**
     * Maps a catalog response: 404 is an empty result, other errors fail the lookup.
     *
     * @param response Catalog response
     * @return the entity, empty when unknown
     */
    private Mono<CatalogEntity> readEntity(ClientResponse response) {
        if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
            return response.releaseBody().then(Mono.empty());
        }
        if (response.statusCode().isError()) {
            return response.createException().flatMap(ex -> Mono.<CatalogEntity>error(ex));
        }
        return response.bodyToMono(JsonNode.class).map(HttpCatalogClient::toEntity);
    }

    private static CatalogEntity toEntity(JsonNode body) {
        JsonNode metadata = body.path("metadata");
        return new CatalogEntity(
                textOrNull(body, "kind"),
                textOrNull(metadata, "namespace"),
                textOrNull(metadata, "name"),
                textOrNull(metadata, "title"));
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return (value == null || value.isNull()) ? null : value.asText();
    }

    /**
     * Parts of a "Kind:namespace/name" reference, kind lower-cased for the URL.
     */
    record EntityRef(String kind, String namespace, String name) {

        static EntityRef parse(String entityRef) {
            int colon = entityRef.indexOf(':');
            String kind = colon < 0 ? "component" : entityRef.substring(0, colon);
            String rest = colon < 0 ? entityRef : entityRef.substring(colon + 1);

            int slash = rest.indexOf('/');
            String namespace = slash < 0 ? DEFAULT_NAMESPACE : rest.substring(0, slash);
            String name = slash < 0 ? rest : rest.substring(slash + 1);

            return new EntityRef(kind.toLowerCase(Locale.ROOT), namespace, name);
        }
    }
}
