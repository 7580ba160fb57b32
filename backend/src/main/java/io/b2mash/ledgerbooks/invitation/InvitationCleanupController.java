package io.b2mash.ledgerbooks.invitation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Scheduler-facing endpoints. Authentication is by shared secret, see {@link
 * io.b2mash.ledgerbooks.security.CronSecretAuthFilter}.
 */
@RestController
@RequestMapping("/api/invitations/cleanup")
public class InvitationCleanupController {

  private final InvitationService invitationService;

  public InvitationCleanupController(InvitationService invitationService) {
    this.invitationService = invitationService;
  }

  /** A missing body or a non-positive {@code daysOld} falls back to the configured retention. */
  @PostMapping
  public ResponseEntity<CleanupResponse> cleanup(
      @RequestBody(required = false) CleanupRequest request) {
    int deleted =
        request != null && request.daysOld() != null && request.daysOld() > 0
            ? invitationService.cleanup(request.daysOld())
            : invitationService.cleanup();
    return ResponseEntity.ok(new CleanupResponse(true, deleted, invitationService.stats()));
  }

  @GetMapping
  public ResponseEntity<StatsResponse> stats() {
    return ResponseEntity.ok(new StatsResponse(invitationService.stats()));
  }

  // --- DTOs ---

  public record CleanupRequest(Integer daysOld) {}

  public record CleanupResponse(boolean success, int deletedCount, InvitationStats stats) {}

  public record StatsResponse(InvitationStats stats) {}
}
