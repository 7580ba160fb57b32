package io.b2mash.ledgerbooks.member;

import static io.b2mash.ledgerbooks.testutil.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.ledgerbooks.audit.AuditAction;
import io.b2mash.ledgerbooks.audit.AuditEvent;
import io.b2mash.ledgerbooks.exception.ForbiddenException;
import io.b2mash.ledgerbooks.exception.InvalidStateException;
import io.b2mash.ledgerbooks.exception.ResourceConflictException;
import io.b2mash.ledgerbooks.exception.ResourceNotFoundException;
import io.b2mash.ledgerbooks.identity.Actor;
import io.b2mash.ledgerbooks.organization.Organization;
import io.b2mash.ledgerbooks.organization.OrganizationRepository;
import io.b2mash.ledgerbooks.security.OrgRole;
import io.b2mash.ledgerbooks.security.PermissionEvaluator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class MembershipServiceTest {

  private static final UUID ORG_ID = UUID.randomUUID();
  private static final Actor OWNER = new Actor(UUID.randomUUID(), "owner@acme.test");
  private static final Actor ADMIN = new Actor(UUID.randomUUID(), "admin@acme.test");
  private static final Actor MEMBER = new Actor(UUID.randomUUID(), "member@acme.test");

  @Mock private MembershipRepository membershipRepository;
  @Mock private OrganizationRepository organizationRepository;
  @Mock private ApplicationEventPublisher eventPublisher;

  private MembershipService service;

  @BeforeEach
  void setUp() {
    service =
        new MembershipService(
            membershipRepository,
            organizationRepository,
            new PermissionEvaluator(),
            eventPublisher);
  }

  @Test
  void requireRole_nonMemberIsForbidden() {
    when(membershipRepository.findByOrganizationIdAndUserId(ORG_ID, MEMBER.userId()))
        .thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.requireRole(ORG_ID, MEMBER.userId(), OrgRole.MEMBER))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void requireRole_belowRequiredRoleIsForbidden() {
    givenMembership(MEMBER, OrgRole.MEMBER);

    assertThatThrownBy(() -> service.requireRole(ORG_ID, MEMBER.userId(), OrgRole.ADMIN))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void updateRole_unknownMembershipIsNotFound() {
    var id = UUID.randomUUID();
    when(membershipRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.updateRole(id, OrgRole.ADMIN, OWNER))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void updateRole_memberActorIsForbidden() {
    var target = givenTarget(OrgRole.MEMBER);
    givenMembership(MEMBER, OrgRole.MEMBER);

    assertThatThrownBy(() -> service.updateRole(target.getId(), OrgRole.ADMIN, MEMBER))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void updateRole_ownerTargetIsForbidden() {
    var target = givenTarget(OrgRole.OWNER);
    givenMembership(ADMIN, OrgRole.ADMIN);

    assertThatThrownBy(() -> service.updateRole(target.getId(), OrgRole.MEMBER, ADMIN))
        .isInstanceOf(ForbiddenException.class);
    verify(membershipRepository, never()).save(any());
  }

  @Test
  void updateRole_selfTargetConflicts() {
    var self = givenMembership(ADMIN, OrgRole.ADMIN);
    when(membershipRepository.findById(self.getId())).thenReturn(Optional.of(self));

    assertThatThrownBy(() -> service.updateRole(self.getId(), OrgRole.MEMBER, ADMIN))
        .isInstanceOf(ResourceConflictException.class);
  }

  @Test
  void updateRole_adminCannotChangeAnotherAdmin() {
    var target = givenTarget(OrgRole.ADMIN);
    givenMembership(ADMIN, OrgRole.ADMIN);

    assertThatThrownBy(() -> service.updateRole(target.getId(), OrgRole.MEMBER, ADMIN))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void updateRole_adminCannotPromoteToAdmin() {
    var target = givenTarget(OrgRole.MEMBER);
    givenMembership(ADMIN, OrgRole.ADMIN);

    assertThatThrownBy(() -> service.updateRole(target.getId(), OrgRole.ADMIN, ADMIN))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void updateRole_ownerRoleIsNeverAssignable() {
    var target = givenTarget(OrgRole.MEMBER);
    givenMembership(OWNER, OrgRole.OWNER);

    assertThatThrownBy(() -> service.updateRole(target.getId(), OrgRole.OWNER, OWNER))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void updateRole_ownerPromotesMemberAndPublishesRoleChange() {
    var target = givenTarget(OrgRole.MEMBER);
    givenMembership(OWNER, OrgRole.OWNER);
    when(membershipRepository.save(target)).thenReturn(target);

    var updated = service.updateRole(target.getId(), OrgRole.ADMIN, OWNER);

    assertThat(updated.getRole()).isEqualTo(OrgRole.ADMIN);
    var captor = ArgumentCaptor.forClass(Object.class);
    verify(eventPublisher).publishEvent(captor.capture());
    var event = (AuditEvent) captor.getValue();
    assertThat(event.action()).isEqualTo(AuditAction.ROLE_CHANGED);
    assertThat(event.oldValues()).containsEntry("role", "member");
    assertThat(event.newValues()).containsEntry("role", "admin");
    assertThat(event.userId()).isEqualTo(OWNER.userId());
  }

  @Test
  void remove_adminRemovesMember() {
    var target = givenTarget(OrgRole.MEMBER);
    givenMembership(ADMIN, OrgRole.ADMIN);

    service.remove(target.getId(), ADMIN);

    verify(membershipRepository).delete(target);
    var captor = ArgumentCaptor.forClass(Object.class);
    verify(eventPublisher).publishEvent(captor.capture());
    var event = (AuditEvent) captor.getValue();
    assertThat(event.action()).isEqualTo(AuditAction.DELETE);
    assertThat(event.oldValues()).containsEntry("role", "member");
  }

  @Test
  void remove_selfConflicts() {
    var self = givenMembership(OWNER, OrgRole.ADMIN);
    when(membershipRepository.findById(self.getId())).thenReturn(Optional.of(self));

    assertThatThrownBy(() -> service.remove(self.getId(), OWNER))
        .isInstanceOf(ResourceConflictException.class);
    verify(membershipRepository, never()).delete(any());
  }

  @Test
  void remove_ownerCannotBeRemoved() {
    var target = givenTarget(OrgRole.OWNER);
    givenMembership(OWNER, OrgRole.OWNER);

    assertThatThrownBy(() -> service.remove(target.getId(), OWNER))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void listForUser_joinsOrganizationDetails() {
    var organization = withId(new Organization("Acme", "DOP", OWNER.userId()), ORG_ID);
    var membership = new Membership(ORG_ID, MEMBER.userId(), MEMBER.email(), OrgRole.MEMBER);
    when(membershipRepository.findByUserIdOrderByCreatedAtAsc(MEMBER.userId()))
        .thenReturn(List.of(membership));
    when(organizationRepository.findAllById(List.of(ORG_ID))).thenReturn(List.of(organization));

    var result = service.listForUser(MEMBER);

    assertThat(result).hasSize(1);
    assertThat(result.get(0).organization().getName()).isEqualTo("Acme");
    assertThat(result.get(0).membership().getRole()).isEqualTo(OrgRole.MEMBER);
  }

  private Membership givenMembership(Actor actor, OrgRole role) {
    var membership =
        withId(new Membership(ORG_ID, actor.userId(), actor.email(), role), UUID.randomUUID());
    when(membershipRepository.findByOrganizationIdAndUserId(ORG_ID, actor.userId()))
        .thenReturn(Optional.of(membership));
    return membership;
  }

  private Membership givenTarget(OrgRole role) {
    var target =
        withId(
            new Membership(ORG_ID, UUID.randomUUID(), "target@acme.test", role),
            UUID.randomUUID());
    when(membershipRepository.findById(target.getId())).thenReturn(Optional.of(target));
    return target;
  }
}
