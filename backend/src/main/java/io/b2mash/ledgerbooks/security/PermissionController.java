package io.b2mash.ledgerbooks.security;

import io.b2mash.ledgerbooks.identity.RequestScopes;
import io.b2mash.ledgerbooks.security.PermissionValidationService.PermissionReport;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/permissions")
public class PermissionController {

  private final PermissionValidationService permissionValidationService;

  public PermissionController(PermissionValidationService permissionValidationService) {
    this.permissionValidationService = permissionValidationService;
  }

  @PostMapping("/validate")
  public ResponseEntity<PermissionReport> validatePermissions(
      @Valid @RequestBody ValidatePermissionsRequest request) {
    var report =
        permissionValidationService.validate(
            request.organizationId(),
            request.actions(),
            request.targetUserId(),
            request.action(),
            RequestScopes.requireActor());
    return ResponseEntity.ok(report);
  }

  public record ValidatePermissionsRequest(
      @NotNull(message = "organizationId is required") UUID organizationId,
      List<String> actions,
      UUID targetUserId,
      ManagementAction action) {}
}
