package com.sparky.suppress.api;

import com.google.common.net.UrlEscapers;
import com.sparky.suppress.Const;
import com.sparky.suppress.config.ToolConfig;
import com.sparky.suppress.model.SuppressionRecord;
import com.sparky.suppress.web.RateLimitedWebClient;
import com.sparky.suppress.web.UnexpectedStatusCodeException;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.apache.http.client.utils.URIBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * The remote suppression list endpoints: paged listing, bulk upsert and single entry delete.
 * Credentials, host and subaccount are bound at construction.
 */
public class SuppressionListApi {
    private static final Logger LOGGER = LoggerFactory.getLogger(SuppressionListApi.class);

    public static final int LIST_SUCCESS = 200;
    public static final int UPSERT_SUCCESS = 200;
    public static final int DELETE_SUCCESS = 204;

    private final URI listUri;
    private final String authorization;
    private final int subAccount;
    private final Duration requestTimeout;
    private final RateLimitedWebClient webClient;
    private final long listBackoffMs;
    private final long updateBackoffMs;
    private final long deleteBackoffMs;

    public SuppressionListApi(ToolConfig config, RateLimitedWebClient webClient) {
        this(config.baseUri(), config.authorization(), config.subAccount(), Duration.ofSeconds(config.requestTimeoutSeconds()), webClient,
            TimeUnit.SECONDS.toMillis(config.listBackoffSeconds()),
            TimeUnit.SECONDS.toMillis(config.updateBackoffSeconds()),
            TimeUnit.SECONDS.toMillis(config.deleteBackoffSeconds()));
    }

    public SuppressionListApi(URI baseUri, String authorization, int subAccount, Duration requestTimeout, RateLimitedWebClient webClient,
                              long listBackoffMs, long updateBackoffMs, long deleteBackoffMs) {
        this.listUri = URI.create(baseUri.toString() + Const.Api.SuppressionListPath);
        this.authorization = authorization;
        this.subAccount = subAccount;
        this.requestTimeout = requestTimeout;
        this.webClient = webClient;
        this.listBackoffMs = listBackoffMs;
        this.updateBackoffMs = updateBackoffMs;
        this.deleteBackoffMs = deleteBackoffMs;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    /**
     * Fetches one page of the list.
     *
     * @param queryParams cursor, per_page and the optional from / to bounds
     * @throws UnexpectedStatusCodeException on any response other than 200
     */
    public JsonObject listPage(HttpClient session, Map<String, String> queryParams) {
        URI uri = withQuery(listUri, queryParams);
        HttpResponse<String> resp = webClient.send(session, () -> newRequest(uri).GET().build(), listBackoffMs);
        if (resp.statusCode() != LIST_SUCCESS) {
            LOGGER.error("Error: {} : {}", resp.statusCode(), resp.body());
            throw new UnexpectedStatusCodeException(resp.statusCode(), resp.body());
        }
        try {
            return new JsonObject(resp.body());
        } catch (DecodeException e) {
            LOGGER.error("Error: listing response is not a json object: {}", resp.body());
            throw new UnexpectedStatusCodeException(resp.statusCode(), resp.body());
        }
    }

    /**
     * Sends the batch as one request.
     *
     * @return true when the remote accepted the whole batch
     */
    public boolean upsert(HttpClient session, List<SuppressionRecord> batch) {
        JsonArray recipients = new JsonArray();
        for (SuppressionRecord record : batch) {
            recipients.add(record.toJson());
        }
        String body = new JsonObject().put("recipients", recipients).encode();

        HttpResponse<String> resp = webClient.send(session,
            () -> newRequest(listUri)
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(body))
                .build(),
            updateBackoffMs);
        if (resp.statusCode() == UPSERT_SUCCESS) {
            return true;
        }
        LOGGER.error("Error: {} : {}", resp.statusCode(), resp.body());
        return false;
    }

    /**
     * Removes one entry; the list has no bulk delete.
     *
     * @return true when the remote answered 204
     */
    public boolean delete(HttpClient session, SuppressionRecord record) {
        URI uri = URI.create(listUri + "/" + UrlEscapers.urlPathSegmentEscaper().escape(record.recipient()));
        HttpResponse<String> resp = webClient.send(session, () -> {
            HttpRequest.Builder builder = newRequest(uri);
            if (record.type() != null) {
                String body = new JsonObject().put(Const.Field.Type, record.type().wireName()).encode();
                builder.header("Content-Type", "application/json")
                    .method("DELETE", HttpRequest.BodyPublishers.ofString(body));
            } else {
                builder.DELETE();
            }
            return builder.build();
        }, deleteBackoffMs);

        if (resp.statusCode() == DELETE_SUCCESS) {
            return true;
        }
        String message = RateLimitedWebClient.firstErrorMessage(resp.body());
        LOGGER.error("{} : {} : {}", record.recipient(), resp.statusCode(), message != null ? message : resp.body());
        return false;
    }

    private HttpRequest.Builder newRequest(URI uri) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(requestTimeout)
            .header("Authorization", authorization)
            .header("Accept", "application/json");
        if (subAccount != 0) {
            builder.header(Const.Api.SubAccountHeader, String.valueOf(subAccount));
        }
        return builder;
    }

    static URI withQuery(URI uri, Map<String, String> queryParams) {
        URIBuilder uriBuilder = new URIBuilder(uri);
        for (Map.Entry<String, String> param : queryParams.entrySet()) {
            uriBuilder.addParameter(param.getKey(), param.getValue());
        }
        try {
            return uriBuilder.build();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException(e);
        }
    }
}
