package io.b2mash.ledgerbooks.invitation;

import io.b2mash.ledgerbooks.identity.RequestScopes;
import io.b2mash.ledgerbooks.member.MembershipController.MembershipResponse;
import io.b2mash.ledgerbooks.security.OrgRole;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/invitations")
public class InvitationController {

  private final InvitationService invitationService;

  public InvitationController(InvitationService invitationService) {
    this.invitationService = invitationService;
  }

  @PostMapping
  public ResponseEntity<InvitationResponse> createInvitation(
      @Valid @RequestBody CreateInvitationRequest request) {
    var invitation =
        invitationService.create(
            request.organizationId(),
            request.email(),
            request.role(),
            RequestScopes.requireActor());
    return ResponseEntity.created(URI.create("/api/invitations/" + invitation.getId()))
        .body(InvitationResponse.from(invitation));
  }

  @GetMapping
  public ResponseEntity<List<InvitationResponse>> listInvitations(
      @RequestParam UUID organizationId) {
    var invitations =
        invitationService.listForOrganization(organizationId, RequestScopes.requireActor());
    return ResponseEntity.ok(invitations.stream().map(InvitationResponse::from).toList());
  }

  @GetMapping("/{id}")
  public ResponseEntity<InvitationResponse> getInvitation(@PathVariable UUID id) {
    var invitation = invitationService.findById(id, RequestScopes.requireActor());
    return ResponseEntity.ok(InvitationResponse.from(invitation));
  }

  @PutMapping("/{id}")
  public ResponseEntity<InvitationResponse> updateInvitation(
      @PathVariable UUID id, @Valid @RequestBody UpdateInvitationRequest request) {
    var invitation =
        invitationService.updateRole(id, request.role(), RequestScopes.requireActor());
    return ResponseEntity.ok(InvitationResponse.from(invitation));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Map<String, Object>> cancelInvitation(@PathVariable UUID id) {
    invitationService.cancel(id, RequestScopes.requireActor());
    return ResponseEntity.ok(Map.of("success", true));
  }

  /** Public: lets the invitee see what they were invited to before signing in. */
  @GetMapping("/details")
  public ResponseEntity<InvitationDetails> getInvitationDetails(@RequestParam String code) {
    return ResponseEntity.ok(invitationService.findDetailsByCode(code));
  }

  @PostMapping("/accept")
  public ResponseEntity<MembershipResponse> acceptInvitation(
      @Valid @RequestBody AcceptInvitationRequest request) {
    var membership = invitationService.accept(request.code(), RequestScopes.requireActor());
    return ResponseEntity.ok(MembershipResponse.from(membership));
  }

  // --- DTOs ---

  public record CreateInvitationRequest(
      @NotNull(message = "organizationId is required") UUID organizationId,
      @NotBlank(message = "email is required")
          @Email(message = "email must be a valid email address")
          @Size(max = 255)
          String email,
      @NotNull(message = "role is required") OrgRole role) {}

  public record UpdateInvitationRequest(@NotNull(message = "role is required") OrgRole role) {}

  public record AcceptInvitationRequest(
      @NotBlank(message = "code is required")
          @Size(min = 6, max = 50, message = "code must be between 6 and 50 characters")
          @Pattern(regexp = "^[A-Z0-9\\-]+$", message = "code has an invalid format")
          String code) {}

  public record InvitationResponse(
      UUID id,
      UUID organizationId,
      String email,
      OrgRole role,
      String code,
      Instant expiresAt,
      Instant usedAt,
      UUID createdBy,
      Instant createdAt,
      InvitationStatus status) {

    public static InvitationResponse from(Invitation invitation) {
      return new InvitationResponse(
          invitation.getId(),
          invitation.getOrganizationId(),
          invitation.getEmail(),
          invitation.getRole(),
          invitation.getCode(),
          invitation.getExpiresAt(),
          invitation.getUsedAt(),
          invitation.getCreatedBy(),
          invitation.getCreatedAt(),
          invitation.statusAt(Instant.now()));
    }
  }
}
