package io.b2mash.ledgerbooks.organization;

import static io.b2mash.ledgerbooks.testutil.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.ledgerbooks.exception.ForbiddenException;
import io.b2mash.ledgerbooks.exception.ResourceConflictException;
import io.b2mash.ledgerbooks.exception.ResourceNotFoundException;
import io.b2mash.ledgerbooks.identity.Actor;
import io.b2mash.ledgerbooks.member.MembershipService;
import io.b2mash.ledgerbooks.security.OrgPermission;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class OrganizationServiceTest {

  private static final Actor FOUNDER = new Actor(UUID.randomUUID(), "founder@acme.test");

  @Mock private OrganizationRepository organizationRepository;
  @Mock private MembershipService membershipService;
  @Mock private ApplicationEventPublisher eventPublisher;
  @InjectMocks private OrganizationService service;

  @Test
  void create_makesFounderOwner() {
    var orgId = UUID.randomUUID();
    when(organizationRepository.existsByNameIgnoreCase("Acme")).thenReturn(false);
    when(organizationRepository.saveAndFlush(any(Organization.class)))
        .thenAnswer(inv -> withId(inv.getArgument(0), orgId));

    var organization = service.create("  Acme ", "usd", FOUNDER);

    assertThat(organization.getName()).isEqualTo("Acme");
    assertThat(organization.getCurrency()).isEqualTo("USD");
    assertThat(organization.getCreatedBy()).isEqualTo(FOUNDER.userId());
    verify(membershipService).createOwnerMembership(orgId, FOUNDER);
  }

  @Test
  void create_duplicateNameConflicts() {
    when(organizationRepository.existsByNameIgnoreCase("acme")).thenReturn(true);

    assertThatThrownBy(() -> service.create("acme", "USD", FOUNDER))
        .isInstanceOf(ResourceConflictException.class);
    verify(organizationRepository, never()).saveAndFlush(any());
  }

  @Test
  void get_unknownOrganizationIsNotFound() {
    var orgId = UUID.randomUUID();
    when(organizationRepository.findById(orgId)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.get(orgId, FOUNDER))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void get_nonMemberIsForbidden() {
    var orgId = UUID.randomUUID();
    when(organizationRepository.findById(orgId))
        .thenReturn(Optional.of(withId(new Organization("Acme", "USD", UUID.randomUUID()), orgId)));
    when(membershipService.requirePermission(orgId, FOUNDER, OrgPermission.READ_ORGANIZATION))
        .thenThrow(new ForbiddenException("Not a member", "not a member"));

    assertThatThrownBy(() -> service.get(orgId, FOUNDER)).isInstanceOf(ForbiddenException.class);
  }
}
