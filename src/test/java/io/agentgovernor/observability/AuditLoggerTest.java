package io.agentgovernor.observability;

import io.agentgovernor.testing.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void appendedRowsFormAVerifiableChain() throws Exception {
        Path root = Files.createTempDirectory("governor-audit-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger audit = new AuditLogger(file, "test-secret", MutableClock.startingAt("2026-01-01T00:00:00Z"));
            audit.log(AuditLogger.AuditEvent.of("task.admit", "agent-1", "tsk_1", "accepted", "corr_1", "tsk_1",
                    Map.of("stage", "admitted")));
            audit.log(AuditLogger.AuditEvent.of("task.complete", "agent-1", "tsk_1", "success", "corr_1", "tsk_1",
                    Map.of("cost", 0.25d)));

            AuditLogger.VerifyOutcome outcome = audit.verify();
            Assertions.assertTrue(outcome.ok());
            Assertions.assertEquals(2, outcome.checkedRows());
            Assertions.assertEquals(audit.currentHash(), outcome.lastHash());

            AuditLogger reopened = new AuditLogger(file, "test-secret", null);
            Assertions.assertEquals(audit.currentHash(), reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.of("maintenance.run", "governor", "runtime", "ok", null, null, null));
            Assertions.assertEquals(3, reopened.verify().checkedRows());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void editedRowBreaksTheChain() throws Exception {
        Path root = Files.createTempDirectory("governor-audit-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger audit = new AuditLogger(file, "", null);
            audit.log(AuditLogger.AuditEvent.of("task.admit", "agent-1", "tsk_1", "rejected", "corr_1", "tsk_1", Map.of()));
            audit.log(AuditLogger.AuditEvent.of("task.admit", "agent-1", "tsk_2", "accepted", "corr_2", "tsk_2", Map.of()));

            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            lines.set(0, lines.get(0).replace("\"rejected\"", "\"accepted\""));
            Files.write(file, lines, StandardCharsets.UTF_8);

            AuditLogger.VerifyOutcome outcome = audit.verify();
            Assertions.assertFalse(outcome.ok());
            Assertions.assertEquals(1, outcome.brokenLine());
            Assertions.assertEquals("hash_mismatch", outcome.reason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void removedRowIsDetectedByPrevHashLink() throws Exception {
        Path root = Files.createTempDirectory("governor-audit-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger audit = new AuditLogger(file, "", null);
            for (int i = 0; i < 3; i++) {
                audit.log(AuditLogger.AuditEvent.of("task.start", "agent-1", "tsk_" + i, "ok", null, "tsk_" + i, Map.of()));
            }
            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            lines.remove(1);
            Files.write(file, lines, StandardCharsets.UTF_8);

            AuditLogger.VerifyOutcome outcome = audit.verify();
            Assertions.assertFalse(outcome.ok());
            Assertions.assertEquals(2, outcome.brokenLine());
            Assertions.assertEquals("prev_hash_mismatch", outcome.reason());
            Assertions.assertEquals(1, outcome.checkedRows());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void wrongSecretFailsSignatureCheck() throws Exception {
        Path root = Files.createTempDirectory("governor-audit-");
        try {
            Path file = root.resolve("audit.log");
            new AuditLogger(file, "secret-a", null)
                    .log(AuditLogger.AuditEvent.of("budget.allocate", "agent-1", "budget", "ok", null, null, Map.of()));

            AuditLogger.VerifyOutcome outcome = new AuditLogger(file, "secret-b", null).verify();
            Assertions.assertFalse(outcome.ok());
            Assertions.assertEquals("signature_mismatch", outcome.reason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void sensitiveDetailsAreMaskedOnDisk() throws Exception {
        Path root = Files.createTempDirectory("governor-audit-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger audit = new AuditLogger(file, "", null);
            audit.log(AuditLogger.AuditEvent.of("task.admit", "agent-1", "tsk_1", "accepted", "corr_1", "tsk_1",
                    Map.of("api_key", "sk-live-123", "note", "fine")));

            String content = Files.readString(file, StandardCharsets.UTF_8);
            Assertions.assertFalse(content.contains("sk-live-123"));
            Assertions.assertTrue(content.contains("\"api_key\":\"***\""));
            Assertions.assertTrue(content.contains("\"note\":\"fine\""));
            Assertions.assertTrue(audit.verify().ok());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void signingSecretIsCreatedOnceAndReused() throws Exception {
        Path root = Files.createTempDirectory("governor-audit-");
        try {
            Path keyFile = root.resolve("security").resolve("audit-signing.key");
            String first = AuditLogger.loadOrCreateSigningSecret(keyFile);
            String second = AuditLogger.loadOrCreateSigningSecret(keyFile);
            Assertions.assertFalse(first.isBlank());
            Assertions.assertEquals(first, second);
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
