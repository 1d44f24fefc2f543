package io.blockring.config.impl;

import lombok.Getter;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Immutable config holder loaded from gateway.yaml
 */
@Getter
public final class GatewayConfig {
    static final int DEFAULT_REPLICATION_FACTOR = 3;
    static final Duration DEFAULT_HEARTBEAT_TIMEOUT = Duration.ofMinutes(1);

    private String instanceAddress;
    private int replicationFactor;
    private Duration heartbeatTimeout;
    private String ringFile;
    private String blocksFile;

    public static GatewayConfig load(final Path path) throws IOException {
        final Yaml yaml = new Yaml();

        try (final InputStream in = Files.newInputStream(path)) {
            final Map<String, Object> m = yaml.load(in);
            if (m == null) {
                throw new IllegalArgumentException("empty gateway config: " + path);
            }
            final GatewayConfig cfg = new GatewayConfig();

            cfg.instanceAddress   = (String) m.get("instanceAddress");
            cfg.replicationFactor = (Integer) m.getOrDefault("replicationFactor", DEFAULT_REPLICATION_FACTOR);
            cfg.heartbeatTimeout  = parseDuration(m.get("heartbeatTimeout"));
            cfg.ringFile          = (String) m.get("ringFile");
            cfg.blocksFile        = (String) m.get("blocksFile");

            if (cfg.instanceAddress == null || cfg.instanceAddress.isBlank()) {
                throw new IllegalArgumentException("instanceAddress is required");
            }
            if (cfg.ringFile == null || cfg.ringFile.isBlank()) {
                throw new IllegalArgumentException("ringFile is required");
            }
            if (cfg.blocksFile == null || cfg.blocksFile.isBlank()) {
                throw new IllegalArgumentException("blocksFile is required");
            }
            if (cfg.replicationFactor < 1) {
                throw new IllegalArgumentException("replicationFactor must be >= 1, got " + cfg.replicationFactor);
            }
            if (cfg.heartbeatTimeout.isNegative() || cfg.heartbeatTimeout.isZero()) {
                throw new IllegalArgumentException("heartbeatTimeout must be > 0");
            }
            return cfg;
        }
    }

    /* Whole seconds as a number, or an ISO-8601 duration such as PT1M. */
    private static Duration parseDuration(final Object raw) {
        if (raw == null) return DEFAULT_HEARTBEAT_TIMEOUT;
        if (raw instanceof Number) return Duration.ofSeconds(((Number) raw).longValue());
        try {
            return Duration.parse(raw.toString().trim());
        } catch (final DateTimeParseException e) {
            throw new IllegalArgumentException("invalid heartbeatTimeout '" + raw + "'", e);
        }
    }
}
