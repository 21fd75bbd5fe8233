package io.crontask.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.crontask.core.config.model.CrontaskConfig;
import io.crontask.core.config.model.HttpConfig;
import io.crontask.core.config.model.SchedulerConfig;
import io.crontask.core.config.model.ServerConfig;
import io.crontask.core.config.model.StorageConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Loads {@link CrontaskConfig} from a JSON file merged over the defaults, then applies
 * {@code CRONTASK_*} environment overrides.
 */
public final class ConfigService {
    public static final String HOST_ENV = "CRONTASK_HOST";
    public static final String PORT_ENV = "CRONTASK_PORT";
    public static final String DB_PATH_ENV = "CRONTASK_DB_PATH";
    public static final String TIMEZONE_ENV = "CRONTASK_SCHEDULER_TZ";
    public static final String MISFIRE_GRACE_ENV = "CRONTASK_MISFIRE_GRACE_SECONDS";
    public static final String REQUEST_TIMEOUT_ENV = "CRONTASK_REQUEST_TIMEOUT_SECONDS";

    private final ObjectMapper mapper;
    private final Map<String, String> env;

    public ConfigService() {
        this(System.getenv());
    }

    public ConfigService(Map<String, String> env) {
        this.env = Map.copyOf(Objects.requireNonNull(env, "env must not be null"));
        mapper = new ObjectMapper();
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public CrontaskConfig load(Path configPath) throws IOException {
        return applyEnvironment(loadFile(configPath));
    }

    public void save(Path configPath, CrontaskConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    /** Writes the file-level config (defaults when creating or overwriting); env overrides are not persisted. */
    public InitResult init(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        CrontaskConfig config = created || overwrite ? CrontaskConfig.defaults() : loadFile(configPath);
        save(configPath, config);
        return new InitResult(configPath, created, !created && overwrite);
    }

    public String toPrettyJson(CrontaskConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private CrontaskConfig loadFile(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return CrontaskConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(CrontaskConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, CrontaskConfig.class);
    }

    private CrontaskConfig applyEnvironment(CrontaskConfig config) {
        ServerConfig server = new ServerConfig(
            env(HOST_ENV, config.server().host()),
            intEnv(PORT_ENV, config.server().port())
        );
        StorageConfig storage = new StorageConfig(env(DB_PATH_ENV, config.storage().databasePath()));
        SchedulerConfig scheduler = new SchedulerConfig(
            env(TIMEZONE_ENV, config.scheduler().timezone()),
            intEnv(MISFIRE_GRACE_ENV, config.scheduler().misfireGraceSeconds())
        );
        HttpConfig http = new HttpConfig(intEnv(REQUEST_TIMEOUT_ENV, config.http().requestTimeoutSeconds()));
        return new CrontaskConfig(server, storage, scheduler, http);
    }

    private String env(String key, String fallback) {
        String value = env.get(key);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private int intEnv(String key, int fallback) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
