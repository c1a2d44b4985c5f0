package com.sparky.suppress.retrieve;

import com.google.common.base.Stopwatch;
import com.sparky.suppress.Const;
import com.sparky.suppress.api.SuppressionListApi;
import com.sparky.suppress.csv.SuppressionCsvWriter;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.apache.http.NameValuePair;
import org.apache.http.client.utils.URIBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Walks the remote list page by page, following the {@code next} link's cursor, and writes each
 * page's entries to the output as soon as it arrives.
 */
public class SuppressionListRetriever {
    private static final Logger LOGGER = LoggerFactory.getLogger(SuppressionListRetriever.class);

    static final String REL_NEXT = "next";
    static final Set<String> REL_IGNORED = Set.of("first", "last", "previous");

    private final SuppressionListApi api;
    private final HttpClient session;
    private final int perPage;

    public SuppressionListRetriever(SuppressionListApi api, HttpClient session, int perPage) {
        this.api = api;
        this.session = session;
        this.perPage = perPage;
    }

    /**
     * @param timeRange optional bounds, null for the whole list
     * @throws UnexpectedLinkException when a page links with an unknown relation
     */
    public RetrieveResult retrieve(TimeRange timeRange, SuppressionCsvWriter sink) throws IOException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("cursor", Const.Api.InitialCursor);
        params.put("per_page", String.valueOf(perPage));
        if (timeRange != null) {
            params.put("from", timeRange.from());
            params.put("to", timeRange.to());
        }

        int page = 0;
        long rows = 0;
        long totalCount = 0;
        String cursor = Const.Api.InitialCursor;
        while (cursor != null) {
            params.put("cursor", cursor);
            page++;

            final Stopwatch sw = Stopwatch.createStarted();
            JsonObject res = api.listPage(session, params);
            JsonArray results = res.getJsonArray("results", new JsonArray());
            for (int i = 0; i < results.size(); ++i) {
                sink.write(results.getJsonObject(i));
            }
            sink.flush();
            sw.stop();

            rows += results.size();
            if (page == 1) {
                totalCount = res.getLong("total_count", 0L);
                LOGGER.info("Total entries to fetch: {}", totalCount);
            }
            LOGGER.info(String.format("Page %8d: got %6d entries in %.3f seconds", page, results.size(), sw.elapsed(TimeUnit.MILLISECONDS) / 1000.0));

            cursor = nextCursor(res.getJsonArray("links", new JsonArray()));
        }
        return new RetrieveResult(page, rows, totalCount);
    }

    /**
     * @return the cursor to continue with, or null when there is no {@code next} link
     */
    static String nextCursor(JsonArray links) {
        String next = null;
        for (int i = 0; i < links.size(); ++i) {
            JsonObject link = links.getJsonObject(i);
            String rel = link.getString("rel");
            if (REL_NEXT.equals(rel)) {
                next = cursorOf(link);
            } else if (!REL_IGNORED.contains(rel)) {
                throw new UnexpectedLinkException(link);
            }
        }
        return next;
    }

    private static String cursorOf(JsonObject link) {
        String href = link.getString("href");
        if (href == null) {
            throw new UnexpectedLinkException(link);
        }
        try {
            for (NameValuePair param : new URIBuilder(href).getQueryParams()) {
                if ("cursor".equals(param.getName())) {
                    return param.getValue();
                }
            }
        } catch (URISyntaxException e) {
            throw new UnexpectedLinkException(link);
        }
        throw new UnexpectedLinkException(link);
    }
}
