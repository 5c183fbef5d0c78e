package com.egress.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns provider records into candidates. Anything without a usable host and port is dropped.
 */
@Slf4j
public class CandidateParser {

    private final ObjectMapper objectMapper;

    public CandidateParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parse a newline-delimited JSON body, one proxy object per line.
     * @param body raw provider response, may be null
     * @return parsed candidates in response order
     */
    public List<Candidate> parseBatch(String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }

        List<Candidate> candidates = new ArrayList<>();
        int skipped = 0;
        for (String line : body.trim().split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                Optional<Candidate> candidate = parseRecord(objectMapper.readTree(line));
                if (candidate.isPresent()) {
                    candidates.add(candidate.get());
                } else {
                    skipped++;
                }
            } catch (Exception e) {
                skipped++;
                log.debug("Skipping unparseable provider line '{}': {}", line, e.getMessage());
            }
        }

        if (skipped > 0) {
            log.debug("Parsed {} candidates, skipped {} malformed records", candidates.size(), skipped);
        }
        return candidates;
    }

    public Optional<Candidate> parseRecord(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        String host = text(node, "ip");
        Integer port = port(text(node, "port"));
        if (host == null || port == null) {
            return Optional.empty();
        }

        String username = text(node, "username");
        String password = text(node, "password");
        // credentials only count as a pair
        if (username == null || password == null) {
            username = null;
            password = null;
        }

        return Optional.of(Candidate.builder()
                .host(host)
                .port(port)
                .username(username)
                .password(password)
                .build());
    }

    /**
     * Parse the textual form "host:port" or "host:port:username:password".
     */
    public Optional<Candidate> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String[] parts = raw.trim().split(":");
        if (parts.length != 2 && parts.length != 4) {
            return Optional.empty();
        }
        String host = parts[0].trim();
        Integer port = port(parts[1].trim());
        if (host.isEmpty() || port == null) {
            return Optional.empty();
        }

        Candidate.CandidateBuilder builder = Candidate.builder().host(host).port(port);
        if (parts.length == 4) {
            builder.username(parts[2]).password(parts[3]);
        }
        return Optional.of(builder.build());
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static Integer port(String value) {
        if (value == null) {
            return null;
        }
        try {
            int port = Integer.parseInt(value);
            return port >= 1 && port <= 65535 ? port : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
