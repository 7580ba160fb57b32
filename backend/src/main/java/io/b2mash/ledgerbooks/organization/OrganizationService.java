package io.b2mash.ledgerbooks.organization;

import io.b2mash.ledgerbooks.audit.AuditAction;
import io.b2mash.ledgerbooks.audit.AuditEventBuilder;
import io.b2mash.ledgerbooks.exception.ResourceConflictException;
import io.b2mash.ledgerbooks.exception.ResourceNotFoundException;
import io.b2mash.ledgerbooks.identity.Actor;
import io.b2mash.ledgerbooks.member.MembershipService;
import io.b2mash.ledgerbooks.security.OrgPermission;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class OrganizationService {

  private static final Logger log = LoggerFactory.getLogger(OrganizationService.class);

  private final OrganizationRepository organizationRepository;
  private final MembershipService membershipService;
  private final ApplicationEventPublisher eventPublisher;

  public OrganizationService(
      OrganizationRepository organizationRepository,
      MembershipService membershipService,
      ApplicationEventPublisher eventPublisher) {
    this.organizationRepository = organizationRepository;
    this.membershipService = membershipService;
    this.eventPublisher = eventPublisher;
  }

  /** Creates an organization and makes the founder its owner, atomically. */
  @Transactional
  public Organization create(String name, String currency, Actor founder) {
    String trimmedName = name.trim();
    if (organizationRepository.existsByNameIgnoreCase(trimmedName)) {
      throw new ResourceConflictException(
          "Organization exists", "An organization named '" + trimmedName + "' already exists");
    }

    var organization =
        organizationRepository.saveAndFlush(
            new Organization(trimmedName, currency.toUpperCase(Locale.ROOT), founder.userId()));

    eventPublisher.publishEvent(
        AuditEventBuilder.builder()
            .organizationId(organization.getId())
            .userId(founder.userId())
            .action(AuditAction.CREATE)
            .tableName("organizations")
            .recordId(organization.getId())
            .newValues(organization.snapshot())
            .build());

    membershipService.createOwnerMembership(organization.getId(), founder);

    log.info(
        "Created organization {} ({}) by {}",
        organization.getId(),
        trimmedName,
        founder.userId());
    return organization;
  }

  @Transactional(readOnly = true)
  public Organization get(UUID organizationId, Actor actor) {
    var organization =
        organizationRepository
            .findById(organizationId)
            .orElseThrow(() -> new ResourceNotFoundException("Organization", organizationId));
    membershipService.requirePermission(organizationId, actor, OrgPermission.READ_ORGANIZATION);
    return organization;
  }
}
