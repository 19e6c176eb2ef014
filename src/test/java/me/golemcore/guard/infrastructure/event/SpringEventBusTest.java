package me.golemcore.guard.infrastructure.event;

import me.golemcore.guard.domain.model.ApprovalRequest;
import me.golemcore.guard.domain.model.ApprovalRequestedEvent;
import me.golemcore.guard.domain.model.ApprovalResultEvent;
import me.golemcore.guard.domain.model.AuditLogEntry;
import me.golemcore.guard.domain.model.AuditLoggedEvent;
import me.golemcore.guard.domain.model.RiskLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SpringEventBusTest {

    private ApplicationEventPublisher publisher;
    private SpringEventBus eventBus;

    @BeforeEach
    void setUp() {
        publisher = mock(ApplicationEventPublisher.class);
        eventBus = new SpringEventBus(publisher);
    }

    @Test
    void shouldPublishApprovalRequested() {
        ApprovalRequest request = ApprovalRequest.builder().toolName("delete_file").riskLevel(RiskLevel.DANGEROUS)
                .build();

        eventBus.onApprovalRequested(request);

        verify(publisher).publishEvent(new ApprovalRequestedEvent(request));
    }

    @Test
    void shouldPublishApprovalResult() {
        ApprovalRequest request = ApprovalRequest.builder().toolName("delete_file").build();

        eventBus.onApprovalResult(request, false);

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(publisher).publishEvent(captor.capture());
        ApprovalResultEvent event = assertInstanceOf(ApprovalResultEvent.class, captor.getValue());
        assertFalse(event.approved());
        assertSame(request, event.request());
    }

    @Test
    void shouldPublishAuditLogged() {
        AuditLogEntry entry = AuditLogEntry.builder().id("audit_1_abcdef").toolName("read_file").build();

        eventBus.onAuditLogged(entry);

        verify(publisher).publishEvent(new AuditLoggedEvent(entry));
    }
}
