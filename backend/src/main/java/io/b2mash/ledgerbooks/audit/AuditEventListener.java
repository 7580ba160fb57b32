package io.b2mash.ledgerbooks.audit;

import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Appends published {@link AuditEvent}s once the publishing transaction has committed. Events
 * published outside a transaction are appended immediately.
 */
@Component
public class AuditEventListener {

  private final AuditService auditService;

  public AuditEventListener(AuditService auditService) {
    this.auditService = auditService;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onAuditEvent(AuditEvent event) {
    auditService.record(event);
  }
}
