package io.backfillkit.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectReader;
import io.backfillkit.config.BackfillSettings;
import io.backfillkit.error.BackfillConfigException;
import io.backfillkit.error.ErrorKind;
import io.backfillkit.error.StoreException;
import io.backfillkit.model.StoreEnvironment;
import io.backfillkit.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Talks to a ClickHouse-compatible HTTP interface: one POST per statement, the SQL in the body.
 */
public final class HttpStoreClient implements StoreClient {
    private static final Logger LOG = LoggerFactory.getLogger(HttpStoreClient.class);
    private static final int MAX_ERROR_BODY_CHARS = 2_000;
    static final String SUMMARY_HEADER = "X-ClickHouse-Summary";

    private final BackfillSettings.Store store;
    private final HttpClient httpClient;
    private final URI endpoint;

    public HttpStoreClient(BackfillSettings.Store store) {
        this(store, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    HttpStoreClient(BackfillSettings.Store store, HttpClient httpClient) {
        if (store == null || store.url() == null || store.url().isBlank()) {
            throw new BackfillConfigException(ErrorKind.STORE_NOT_CONFIGURED,
                    "Store URL is not configured. Set store.url in settings or pass --store-url.");
        }
        this.store = store;
        this.httpClient = httpClient;
        this.endpoint = buildEndpoint(store.url(), store.database());
    }

    @Override
    public WriteSummary execute(String sql) throws StoreException {
        HttpResponse<String> response = send(sql);
        return response.headers().firstValue(SUMMARY_HEADER)
                .map(HttpStoreClient::parseSummary)
                .orElse(WriteSummary.unknown());
    }

    @Override
    public <T> List<T> query(String sql, Class<T> rowType) throws StoreException {
        HttpResponse<String> response = send(sql.strip() + "\nFORMAT JSONEachRow");
        String body = response.body() == null ? "" : response.body();
        ObjectReader reader = Jsons.compactMapper()
                .readerFor(rowType)
                .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        List<T> rows = new ArrayList<>();
        for (String line : body.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                rows.add(reader.readValue(line));
            } catch (IOException e) {
                throw new StoreException("Failed to decode result row: " + e.getMessage(), e);
            }
        }
        return rows;
    }

    @Override
    public StoreEnvironment environment() {
        return new StoreEnvironment(store.url(), store.database());
    }

    URI endpoint() {
        return endpoint;
    }

    /**
     * The summary header carries counters as JSON strings: {@code {"written_rows":"42",...}}.
     * A header that cannot be read leaves the count unknown.
     */
    static WriteSummary parseSummary(String header) {
        try {
            JsonNode written = Jsons.compactMapper().readTree(header).path("written_rows");
            if (written.isMissingNode() || written.isNull()) {
                return WriteSummary.unknown();
            }
            return WriteSummary.rows(Long.parseLong(written.asText().trim()));
        } catch (IOException | NumberFormatException e) {
            LOG.debug("Ignoring unreadable {} header: {}", SUMMARY_HEADER, header, e);
            return WriteSummary.unknown();
        }
    }

    private HttpResponse<String> send(String sql) throws StoreException {
        HttpRequest.Builder request = HttpRequest.newBuilder(endpoint)
                .timeout(Duration.ofMillis(store.requestTimeoutMs()))
                .header("Content-Type", "text/plain; charset=utf-8")
                .POST(HttpRequest.BodyPublishers.ofString(sql, StandardCharsets.UTF_8));
        if (store.user() != null && !store.user().isBlank()) {
            request.header("X-ClickHouse-User", store.user());
        }
        if (store.password() != null && !store.password().isEmpty()) {
            request.header("X-ClickHouse-Key", store.password());
        }
        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new StoreException("Store request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("Store request interrupted", e);
        }
        int status = response.statusCode();
        if (status / 100 != 2) {
            String body = response.body() == null ? "" : response.body().strip();
            if (body.length() > MAX_ERROR_BODY_CHARS) {
                body = body.substring(0, MAX_ERROR_BODY_CHARS) + "...";
            }
            LOG.debug("store returned HTTP {} for statement", status);
            throw new StoreException("Store returned HTTP " + status + ": " + body, status, null);
        }
        return response;
    }

    private static URI buildEndpoint(String url, String database) {
        String base = url.trim();
        if (!base.contains("?") && !base.endsWith("/")) {
            base = base + "/";
        }
        String separator = base.contains("?") ? "&" : "?";
        String db = database == null || database.isBlank() ? "default" : database.trim();
        try {
            return URI.create(base + separator + "database=" + URLEncoder.encode(db, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            throw new BackfillConfigException(ErrorKind.INVALID_OPTION, "Invalid store URL: " + url, e);
        }
    }
}
