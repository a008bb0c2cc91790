package org.minihttp.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Builds a {@link ServerConfig} from, in increasing precedence: field defaults,
 * the classpath resource {@value #DEFAULT_RESOURCE}, the file named by the
 * {@value #CONFIG_PROPERTY} system property (replaces the resource), the
 * {@code minihttp.*} system properties, and a port given as first argument.
 */
public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final Gson gson = new GsonBuilder().create();

    public static final String DEFAULT_RESOURCE = "minihttp.json";
    public static final String CONFIG_PROPERTY = "minihttp.config";

    private ConfigLoader() {}

    public static ServerConfig load(String[] args) {
        return load(args, System.getProperties());
    }

    public static ServerConfig load(String[] args, Properties props) {
        ServerConfig config;
        String file = props.getProperty(CONFIG_PROPERTY);
        if (file != null && !file.isBlank()) {
            config = loadOrNull(Paths.get(file));
            if (config == null) {
                throw new IllegalArgumentException("config file not found: " + file);
            }
            log.info("Loaded configuration from {}", file);
        } else {
            config = fromResource(DEFAULT_RESOURCE);
        }

        applyOverrides(config, props);
        if (args != null && args.length > 0) {
            config.port(parseInt("port argument", args[0]));
        }
        return config.validate();
    }

    public static ServerConfig fromJson(String json) {
        try {
            ServerConfig config = gson.fromJson(json, ServerConfig.class);
            return config == null ? new ServerConfig() : config;
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("invalid configuration JSON: " + e.getMessage(), e);
        }
    }

    /** Reads {@code file} as JSON configuration, or returns null if it does not exist. */
    public static ServerConfig loadOrNull(Path file) {
        if (!Files.exists(file)) return null;
        try {
            return fromJson(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalArgumentException("cannot read config file " + file + ": " + e.getMessage(), e);
        }
    }

    static ServerConfig fromResource(String name) {
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                log.debug("No {} on classpath, using defaults", name);
                return new ServerConfig();
            }
            return fromJson(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalArgumentException("cannot read resource " + name + ": " + e.getMessage(), e);
        }
    }

    private static void applyOverrides(ServerConfig config, Properties props) {
        String port = props.getProperty("minihttp.port");
        if (port != null) config.port(parseInt("minihttp.port", port));

        String bind = props.getProperty("minihttp.bindAddress");
        if (bind != null) config.bindAddress(bind.trim());

        String concurrent = props.getProperty("minihttp.concurrent");
        if (concurrent != null) config.concurrent(Boolean.parseBoolean(concurrent.trim()));

        String enforce = props.getProperty("minihttp.enforceMethods");
        if (enforce != null) config.enforceMethods(Boolean.parseBoolean(enforce.trim()));

        String serverId = props.getProperty("minihttp.serverId");
        if (serverId != null) config.serverId(serverId.trim());
    }

    private static int parseInt(String what, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(what + " is not a number: " + value, e);
        }
    }
}
