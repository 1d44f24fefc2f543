package io.blockring.config.type;

import io.blockring.block.BlockId;
import io.blockring.cluster.membership.member.Member;
import io.blockring.cluster.membership.member.MemberState;
import io.blockring.cluster.membership.snapshot.MembershipSnapshot;
import io.blockring.config.impl.GatewayConfig;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public final class ConfigLoader {
    private static final long MAX_TOKEN = 0xFFFF_FFFFL;

    private ConfigLoader() {
    }

    /**
     * Loads gateway configuration from a YAML file by delegating to {@link GatewayConfig#load(Path)}.
     *
     * @param path the path to the gateway YAML configuration file
     * @return a populated {@link GatewayConfig} instance
     * @throws IOException if the file cannot be read
     */
    public static GatewayConfig load(final Path path) throws IOException {
        return GatewayConfig.load(path);
    }

    /**
     * Loads a materialized membership snapshot from a YAML file.
     * <p>
     * The YAML file is expected to have the following structure:
     * <pre>
     * revision: 42
     * valid: true            # optional, defaults to true
     * members:
     *   instance-1:
     *     address: 127.0.0.1
     *     tokens: [283204221, 2931974233]
     *     state: ACTIVE
     *     heartbeat: 1700000000   # unix seconds
     * </pre>
     *
     * @throws IllegalArgumentException if a member entry is malformed or a token is out of the unsigned 32-bit range
     */
    @SuppressWarnings("unchecked")
    public static MembershipSnapshot loadSnapshot(final Path path) throws IOException {
        final Yaml yaml = new Yaml();

        try (final InputStream in = Files.newInputStream(path)) {
            final Map<String, Object> root = yaml.load(in);
            if (root == null) {
                throw new IllegalArgumentException("empty membership snapshot: " + path);
            }
            final long revision = ((Number) root.getOrDefault("revision", 0)).longValue();
            final boolean valid = (Boolean) root.getOrDefault("valid", Boolean.TRUE);
            // "members:" with nothing after it loads as null
            final var raw = (Map<String, Map<String, Object>>) Objects.requireNonNullElse(root.get("members"), Map.of());

            final Map<String, Member> members = new LinkedHashMap<>();
            for (final Map.Entry<String, Map<String, Object>> e : raw.entrySet()) {
                members.put(e.getKey(), toMember(e.getKey(), e.getValue()));
            }
            return new MembershipSnapshot(revision, members, valid);
        }
    }

    /**
     * Reads block ids, one per line. Blank lines and lines starting with {@code #} are skipped.
     */
    public static List<BlockId> loadBlockIds(final Path path) throws IOException {
        try (final Stream<String> lines = Files.lines(path)) {
            return lines.map(String::trim)
                    .filter(l -> !l.isEmpty() && !l.startsWith("#"))
                    .map(BlockId::parse)
                    .collect(Collectors.toList());
        }
    }

    @SuppressWarnings("unchecked")
    private static Member toMember(final String id, final Map<String, Object> m) {
        if (m == null) {
            throw new IllegalArgumentException("member '" + id + "' has no fields");
        }
        final Object heartbeat = m.get("heartbeat");
        if (!(heartbeat instanceof Number)) {
            throw new IllegalArgumentException("member '" + id + "' has no numeric heartbeat");
        }

        final Set<Integer> tokens = new LinkedHashSet<>();
        for (final Object t : (List<Object>) Objects.requireNonNullElse(m.get("tokens"), List.of())) {
            final long v = ((Number) t).longValue();
            if (v < 0 || v > MAX_TOKEN) {
                throw new IllegalArgumentException("member '" + id + "' token out of range: " + v);
            }
            if (!tokens.add((int) v)) {
                throw new IllegalArgumentException("member '" + id + "' lists token " + v + " twice");
            }
        }

        return new Member(
                id,
                (String) m.get("address"),
                tokens,
                MemberState.valueOf(((String) m.getOrDefault("state", "ACTIVE")).toUpperCase()),
                Instant.ofEpochSecond(((Number) heartbeat).longValue()));
    }
}
