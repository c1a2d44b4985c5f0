package com.sparky.suppress.config;

import io.vertx.config.ConfigRetriever;
import io.vertx.config.ConfigRetrieverOptions;
import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Reads the tool configuration through a Vert.x config retriever. Files ending in {@code .json}
 * are read as json, anything else as an ini file (see {@link IniConfigReader}).
 */
public class ConfigLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigLoader.class);
    private static final long LOAD_TIMEOUT_SECONDS = 30;

    private final Vertx vertx;

    public ConfigLoader(Vertx vertx) {
        this.vertx = vertx;
    }

    public ToolConfig load(Path path) throws ConfigException {
        if (!Files.isReadable(path)) {
            throw new ConfigException("cannot read configuration file " + path.toAbsolutePath());
        }
        LOGGER.debug("loading configuration from {}", path.toAbsolutePath());

        ConfigRetriever retriever = ConfigRetriever.create(vertx, new ConfigRetrieverOptions()
            .setScanPeriod(0)
            .setIncludeDefaultStores(false)
            .addStore(storeFor(path)));
        try {
            JsonObject json = retriever.getConfig()
                .toCompletionStage()
                .toCompletableFuture()
                .get(LOAD_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            return ToolConfig.fromJsonObject(json);
        } catch (ExecutionException e) {
            throw new ConfigException("failed reading configuration file " + path + ": " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new ConfigException("timed out reading configuration file " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConfigException("interrupted reading configuration file " + path, e);
        } finally {
            retriever.close();
        }
    }

    static ConfigStoreOptions storeFor(Path path) throws ConfigException {
        if (path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json")) {
            return new ConfigStoreOptions()
                .setType("file")
                .setFormat("json")
                .setConfig(new JsonObject().put("path", path.toAbsolutePath().toString()));
        }

        // ini values may span several lines, which the properties format cannot express
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigException("failed reading configuration file " + path + ": " + e.getMessage(), e);
        }
        return new ConfigStoreOptions()
            .setType("json")
            .setConfig(IniConfigReader.read(lines));
    }
}
