package com.sparky.suppress.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparky.suppress.Const;
import com.sparky.suppress.model.SuppressionType;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Settings for one run. Values arrive as strings from an ini file (or typed from a json file)
 * and are checked once in {@link #fromJsonObject(JsonObject)}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(ToolConfig.class);
    private static final ObjectMapper mapper = new ObjectMapper();
    private static final String VENDOR_DOMAIN = "sparkpost.com";

    @JsonProperty(Const.Config.AuthorizationProp)
    private String authorization;

    @JsonProperty(Const.Config.HostProp)
    private String host = Const.Defaults.Host;

    @JsonProperty(Const.Config.TimezoneProp)
    private String timezone = Const.Defaults.Timezone;

    @JsonProperty(Const.Config.PropertiesProp)
    private String properties = Const.Defaults.Properties;

    @JsonProperty(Const.Config.BatchSizeProp)
    private int batchSize = Const.Defaults.BatchSize;

    @JsonProperty(Const.Config.TypeDefaultProp)
    private String typeDefault = Const.Defaults.TypeDefault;

    @JsonProperty(Const.Config.DescriptionDefaultProp)
    private String descriptionDefault = "";

    @JsonProperty(Const.Config.FileCharacterEncodingsProp)
    private String fileCharacterEncodings = Const.Defaults.FileCharacterEncodings;

    @JsonProperty(Const.Config.DeleteThreadsProp)
    private int deleteThreads = Const.Defaults.DeleteThreads;

    @JsonProperty(Const.Config.SubAccountProp)
    private int subAccount = 0;

    @JsonProperty(Const.Config.RequestTimeoutSecondsProp)
    private int requestTimeoutSeconds = Const.Defaults.RequestTimeoutSeconds;

    @JsonProperty(Const.Config.ListBackoffSecondsProp)
    private int listBackoffSeconds = Const.Defaults.ListBackoffSeconds;

    @JsonProperty(Const.Config.UpdateBackoffSecondsProp)
    private int updateBackoffSeconds = Const.Defaults.UpdateBackoffSeconds;

    @JsonProperty(Const.Config.DeleteBackoffSecondsProp)
    private int deleteBackoffSeconds = Const.Defaults.DeleteBackoffSeconds;

    private URI baseUri;
    private ZoneId zoneId;
    private SuppressionType type;

    public static ToolConfig fromJsonObject(JsonObject obj) throws ConfigException {
        ToolConfig ret;
        try {
            ret = mapper.readValue(obj.encode(), ToolConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException("malformed configuration: " + e.getOriginalMessage(), e);
        }
        ret.validate();
        return ret;
    }

    private void validate() throws ConfigException {
        if (authorization == null || authorization.isBlank()) {
            throw new ConfigException("missing " + Const.Config.AuthorizationProp + " line in configuration");
        }
        authorization = authorization.trim();

        this.baseUri = parseHost(host);

        try {
            this.zoneId = ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new ConfigException("invalid " + Const.Config.TimezoneProp + ": " + timezone, e);
        }

        this.type = SuppressionType.fromWireName(typeDefault.trim().toLowerCase(Locale.ROOT));
        if (this.type == null) {
            throw new ConfigException(Const.Config.TypeDefaultProp + " must be " + SuppressionType.TRANSACTIONAL + " or " + SuppressionType.NON_TRANSACTIONAL + ", got: " + typeDefault);
        }

        requirePositive(Const.Config.BatchSizeProp, batchSize);
        requirePositive(Const.Config.DeleteThreadsProp, deleteThreads);
        requirePositive(Const.Config.RequestTimeoutSecondsProp, requestTimeoutSeconds);
        requireNotNegative(Const.Config.SubAccountProp, subAccount);
        requireNotNegative(Const.Config.ListBackoffSecondsProp, listBackoffSeconds);
        requireNotNegative(Const.Config.UpdateBackoffSecondsProp, updateBackoffSeconds);
        requireNotNegative(Const.Config.DeleteBackoffSecondsProp, deleteBackoffSeconds);

        if (properties().isEmpty()) {
            throw new ConfigException(Const.Config.PropertiesProp + " must name at least one field");
        }
        if (fileCharacterEncodings().isEmpty()) {
            throw new ConfigException(Const.Config.FileCharacterEncodingsProp + " must name at least one encoding");
        }
    }

    // a bare host name gets https, an explicit scheme is kept
    static URI parseHost(String host) throws ConfigException {
        if (host == null || host.isBlank()) {
            throw new ConfigException("missing " + Const.Config.HostProp);
        }
        String trimmed = host.trim();
        String withScheme = trimmed.contains("://") ? trimmed : "https://" + trimmed;
        URI uri;
        try {
            uri = new URI(withScheme);
        } catch (URISyntaxException e) {
            throw new ConfigException("invalid " + Const.Config.HostProp + ": " + host, e);
        }
        if (uri.getHost() == null || !("https".equals(uri.getScheme()) || "http".equals(uri.getScheme()))) {
            throw new ConfigException("invalid " + Const.Config.HostProp + ": " + host);
        }
        if (!uri.getHost().toLowerCase(Locale.ROOT).endsWith(VENDOR_DOMAIN)) {
            LOGGER.warn("{} {} is not a {} address", Const.Config.HostProp, uri.getHost(), VENDOR_DOMAIN);
        }
        String path = uri.getPath() == null ? "" : uri.getPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        try {
            return new URI(uri.getScheme(), null, uri.getHost(), uri.getPort(), path, null, null);
        } catch (URISyntaxException e) {
            throw new ConfigException("invalid " + Const.Config.HostProp + ": " + host, e);
        }
    }

    private static void requirePositive(String name, int value) throws ConfigException {
        if (value <= 0) {
            throw new ConfigException(name + " must be greater than 0, got: " + value);
        }
    }

    private static void requireNotNegative(String name, int value) throws ConfigException {
        if (value < 0) {
            throw new ConfigException(name + " must not be negative, got: " + value);
        }
    }

    private static List<String> splitList(String value) {
        List<String> ret = new ArrayList<>();
        if (value == null) {
            return ret;
        }
        for (String part : value.replace("\r", "").replace("\n", "").split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                ret.add(trimmed);
            }
        }
        return ret;
    }

    public String authorization() {
        return authorization;
    }

    public URI baseUri() {
        return baseUri;
    }

    public ZoneId timezone() {
        return zoneId;
    }

    public List<String> properties() {
        return splitList(properties);
    }

    public int batchSize() {
        return batchSize;
    }

    public SuppressionType typeDefault() {
        return type;
    }

    public String descriptionDefault() {
        return descriptionDefault;
    }

    public List<String> fileCharacterEncodings() {
        return splitList(fileCharacterEncodings);
    }

    public int deleteThreads() {
        return deleteThreads;
    }

    public int subAccount() {
        return subAccount;
    }

    public int requestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public int listBackoffSeconds() {
        return listBackoffSeconds;
    }

    public int updateBackoffSeconds() {
        return updateBackoffSeconds;
    }

    public int deleteBackoffSeconds() {
        return deleteBackoffSeconds;
    }
}
