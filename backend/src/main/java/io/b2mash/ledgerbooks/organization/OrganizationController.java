package io.b2mash.ledgerbooks.organization;

import io.b2mash.ledgerbooks.identity.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/organizations")
public class OrganizationController {

  private final OrganizationService organizationService;

  public OrganizationController(OrganizationService organizationService) {
    this.organizationService = organizationService;
  }

  @PostMapping
  public ResponseEntity<OrganizationResponse> createOrganization(
      @Valid @RequestBody CreateOrganizationRequest request) {
    var organization =
        organizationService.create(
            request.name(), request.currency(), RequestScopes.requireActor());
    return ResponseEntity.created(URI.create("/api/organizations/" + organization.getId()))
        .body(OrganizationResponse.from(organization));
  }

  @GetMapping("/{id}")
  public ResponseEntity<OrganizationResponse> getOrganization(@PathVariable UUID id) {
    var organization = organizationService.get(id, RequestScopes.requireActor());
    return ResponseEntity.ok(OrganizationResponse.from(organization));
  }

  // --- DTOs ---

  public record CreateOrganizationRequest(
      @NotBlank(message = "name is required") @Size(max = 255) String name,
      @NotBlank(message = "currency is required")
          @Pattern(regexp = "^[A-Za-z]{3}$", message = "currency must be a 3-letter code")
          String currency) {}

  public record OrganizationResponse(
      UUID id, String name, String currency, UUID createdBy, Instant createdAt) {

    public static OrganizationResponse from(Organization organization) {
      return new OrganizationResponse(
          organization.getId(),
          organization.getName(),
          organization.getCurrency(),
          organization.getCreatedBy(),
          organization.getCreatedAt());
    }
  }
}
