package me.golemcore.guard.adapter.outbound.approval;

import me.golemcore.guard.domain.model.ApprovalCallbackEvent;
import me.golemcore.guard.domain.model.ApprovalRequest;
import me.golemcore.guard.domain.model.RiskLevel;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PendingApprovalAdapterTest {

    private static final Instant NOW = Instant.parse("2026-02-01T10:00:00Z");
    private static final String TOOL = "delete_file";

    private GuardProperties properties;
    private PendingApprovalAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new GuardProperties();
        adapter = new PendingApprovalAdapter(properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldParkRequestUntilResolved() {
        CompletableFuture<Boolean> future = adapter.requestApproval(request());

        assertFalse(future.isDone());
        List<PendingApprovalAdapter.PendingApproval> pending = adapter.getPendingApprovals();
        assertEquals(1, pending.size());
        assertEquals(TOOL, pending.get(0).request().getToolName());
        assertEquals(NOW, pending.get(0).createdAt());

        assertTrue(adapter.resolve(pending.get(0).id(), true));

        assertTrue(future.join());
        assertTrue(adapter.getPendingApprovals().isEmpty());
    }

    @Test
    void shouldResolveFromCallbackEvent() {
        CompletableFuture<Boolean> future = adapter.requestApproval(request());
        String id = adapter.getPendingApprovals().get(0).id();

        adapter.onApprovalCallback(new ApprovalCallbackEvent(id, false));

        assertFalse(future.join());
    }

    @Test
    void shouldIgnoreUnknownId() {
        assertFalse(adapter.resolve("missing", true));
        assertFalse(adapter.resolve(null, true));
        assertDoesNotThrow(() -> adapter.onApprovalCallback(new ApprovalCallbackEvent("missing", true)));
    }

    @Test
    void shouldDenyOnTimeout() throws Exception {
        properties.getApproval().setTimeoutSeconds(1);
        adapter = new PendingApprovalAdapter(properties, Clock.fixed(NOW, ZoneOffset.UTC));

        CompletableFuture<Boolean> future = adapter.requestApproval(request());

        assertFalse(future.get(5, TimeUnit.SECONDS));
        assertTrue(adapter.getPendingApprovals().isEmpty());
    }

    @Test
    void shouldDenyImmediatelyWhenDisabled() {
        properties.getApproval().setEnabled(false);
        adapter = new PendingApprovalAdapter(properties, Clock.fixed(NOW, ZoneOffset.UTC));

        assertFalse(adapter.isAvailable());
        assertFalse(adapter.requestApproval(request()).join());
        assertTrue(adapter.getPendingApprovals().isEmpty());
    }

    @Test
    void shouldBeAvailableByDefault() {
        assertTrue(adapter.isAvailable());
    }

    private ApprovalRequest request() {
        return ApprovalRequest.builder()
                .toolName(TOOL)
                .args(Map.of("path", "./data/old.txt"))
                .riskLevel(RiskLevel.DANGEROUS)
                .reason("Tool 'delete_file' requires user approval")
                .timestamp(NOW)
                .build();
    }
}
