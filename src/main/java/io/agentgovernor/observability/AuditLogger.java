package io.agentgovernor.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentgovernor.security.SensitiveDataMasker;
import io.agentgovernor.util.Hashing;
import io.agentgovernor.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL log of governance decisions. Each row carries the hash of the previous
 * row, so truncation or in-place edits are detected by {@link #verify()}. When a signing
 * secret is configured every row hash is also HMAC-signed.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private final String signingSecret;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, String signingSecret, Clock clock) {
        this.auditFile = auditFile;
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        this.clock = clock == null ? Clock.systemUTC() : clock;
        try {
            if (auditFile.getParent() != null) {
                Files.createDirectories(auditFile.getParent());
            }
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException e) {
                    log.debug("Audit log created concurrently: {}", auditFile);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("correlation_id", event.correlationId());
        row.put("task_id", event.taskId());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write audit log: " + auditFile, e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path auditFile() {
        return auditFile;
    }

    /**
     * Re-reads the whole log and checks every row hash, the {@code prev_hash} links and, when
     * a secret is configured, the signatures. Stops at the first broken row.
     */
    public synchronized VerifyOutcome verify() {
        if (!Files.exists(auditFile)) {
            return new VerifyOutcome(true, 0, 0, "", "");
        }
        int checkedRows = 0;
        int brokenLine = 0;
        String reason = "";
        String expectedPrev = "";
        try {
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                if (line == null || line.isBlank()) {
                    continue;
                }
                JsonNode parsed;
                try {
                    parsed = Jsons.mapper().readTree(line);
                } catch (JsonProcessingException e) {
                    brokenLine = i + 1;
                    reason = "invalid_json";
                    break;
                }
                if (!parsed.isObject()) {
                    brokenLine = i + 1;
                    reason = "invalid_json";
                    break;
                }
                String hash = parsed.path("hash").asText("");
                if (hash.isBlank()) {
                    brokenLine = i + 1;
                    reason = "missing_hash";
                    break;
                }
                if (!parsed.path("prev_hash").asText("").equals(expectedPrev)) {
                    brokenLine = i + 1;
                    reason = "prev_hash_mismatch";
                    break;
                }
                ObjectNode canonical = parsed.deepCopy();
                canonical.remove("hash");
                canonical.remove("signature");
                if (!Hashing.sha256Hex(Jsons.toCompactJson(canonical)).equals(hash)) {
                    brokenLine = i + 1;
                    reason = "hash_mismatch";
                    break;
                }
                String signature = parsed.path("signature").asText("");
                if (!signingSecret.isBlank() && !signature.isBlank()
                        && !Hashing.hmacSha256Hex(signingSecret, hash).equals(signature)) {
                    brokenLine = i + 1;
                    reason = "signature_mismatch";
                    break;
                }
                checkedRows++;
                expectedPrev = hash;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to verify audit log: " + auditFile, e);
        }
        if (brokenLine > 0) {
            log.warn("Audit chain broken at line {} ({})", brokenLine, reason);
        }
        return new VerifyOutcome(brokenLine == 0, checkedRows, brokenLine, reason, expectedPrev);
    }

    /**
     * Reads the signing secret from {@code keyFile}, generating and storing a random one on
     * first use.
     */
    public static String loadOrCreateSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize audit signing secret: " + keyFile, e);
        }
    }

    private String loadLastHash() {
        String last = "";
        try {
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read audit log: " + auditFile, e);
        }
        if (last.isBlank()) {
            return "";
        }
        try {
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (JsonProcessingException e) {
            log.warn("Last audit row is not valid JSON, starting a new chain: {}", auditFile);
            return "";
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        return Jsons.mapper().convertValue(SensitiveDataMasker.masked(node), Map.class);
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String correlationId,
            String taskId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(
                String action,
                String actor,
                String resource,
                String result,
                String correlationId,
                String taskId,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, actor, resource, result, correlationId, taskId, details == null ? Map.of() : details);
        }
    }

    public record VerifyOutcome(
            boolean ok,
            int checkedRows,
            int brokenLine,
            String reason,
            String lastHash
    ) {
    }
}
