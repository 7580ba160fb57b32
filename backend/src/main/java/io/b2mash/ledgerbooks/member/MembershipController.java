package io.b2mash.ledgerbooks.member;

import io.b2mash.ledgerbooks.identity.RequestScopes;
import io.b2mash.ledgerbooks.organization.Organization;
import io.b2mash.ledgerbooks.security.OrgRole;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/memberships")
public class MembershipController {

  private final MembershipService membershipService;

  public MembershipController(MembershipService membershipService) {
    this.membershipService = membershipService;
  }

  /**
   * Lists the members of an organization when {@code organizationId} is given, otherwise the
   * caller's own memberships.
   */
  @GetMapping
  public ResponseEntity<List<MembershipResponse>> listMemberships(
      @RequestParam(required = false) UUID organizationId) {
    var actor = RequestScopes.requireActor();
    if (organizationId != null) {
      var memberships = membershipService.listForOrganization(organizationId, actor);
      return ResponseEntity.ok(memberships.stream().map(MembershipResponse::from).toList());
    }
    var memberships = membershipService.listForUser(actor);
    return ResponseEntity.ok(
        memberships.stream()
            .map(um -> MembershipResponse.from(um.membership(), um.organization()))
            .toList());
  }

  @PutMapping
  public ResponseEntity<MembershipResponse> updateRole(
      @Valid @RequestBody UpdateRoleRequest request) {
    var membership =
        membershipService.updateRole(
            request.membershipId(), request.role(), RequestScopes.requireActor());
    return ResponseEntity.ok(MembershipResponse.from(membership));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Map<String, Object>> removeMember(@PathVariable UUID id) {
    membershipService.remove(id, RequestScopes.requireActor());
    return ResponseEntity.ok(Map.of("success", true));
  }

  // --- DTOs ---

  public record UpdateRoleRequest(
      @NotNull(message = "membershipId is required") UUID membershipId,
      @NotNull(message = "role is required") OrgRole role) {}

  public record MembershipResponse(
      UUID id,
      UUID organizationId,
      UUID userId,
      String email,
      OrgRole role,
      Instant createdAt,
      String organizationName,
      String currency) {

    public static MembershipResponse from(Membership membership) {
      return from(membership, null);
    }

    public static MembershipResponse from(Membership membership, Organization organization) {
      return new MembershipResponse(
          membership.getId(),
          membership.getOrganizationId(),
          membership.getUserId(),
          membership.getEmail(),
          membership.getRole(),
          membership.getCreatedAt(),
          organization != null ? organization.getName() : null,
          organization != null ? organization.getCurrency() : null);
    }
  }
}
