package io.b2mash.ledgerbooks.security;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class PermissionEvaluatorTest {

  private final PermissionEvaluator evaluator = new PermissionEvaluator();

  @Test
  void hasRole_followsOrdinalScale() {
    assertThat(evaluator.hasRole(OrgRole.OWNER, OrgRole.ADMIN)).isTrue();
    assertThat(evaluator.hasRole(OrgRole.ADMIN, OrgRole.ADMIN)).isTrue();
    assertThat(evaluator.hasRole(OrgRole.ADMIN, OrgRole.OWNER)).isFalse();
    assertThat(evaluator.hasRole(OrgRole.MEMBER, OrgRole.ADMIN)).isFalse();
    assertThat(evaluator.hasRole(null, OrgRole.MEMBER)).isFalse();
  }

  @ParameterizedTest
  @EnumSource(OrgRole.class)
  void canManage_deniesSelfTargetForChangeRoleAndRemove(OrgRole role) {
    assertThat(evaluator.canManage(role, role, ManagementAction.CHANGE_ROLE, true)).isFalse();
    assertThat(evaluator.canManage(role, role, ManagementAction.REMOVE, true)).isFalse();
  }

  @Test
  void owner_managesAdminsAndMembersButNotOtherOwners() {
    assertThat(
            evaluator.canManage(OrgRole.OWNER, OrgRole.ADMIN, ManagementAction.CHANGE_ROLE, false))
        .isTrue();
    assertThat(evaluator.canManage(OrgRole.OWNER, OrgRole.MEMBER, ManagementAction.REMOVE, false))
        .isTrue();
    assertThat(evaluator.canManage(OrgRole.OWNER, OrgRole.OWNER, ManagementAction.REMOVE, false))
        .isFalse();
    assertThat(evaluator.canManage(OrgRole.OWNER, OrgRole.OWNER, ManagementAction.INVITE, false))
        .isTrue();
  }

  @Test
  void admin_managesOnlyMembers() {
    assertThat(
            evaluator.canManage(OrgRole.ADMIN, OrgRole.MEMBER, ManagementAction.CHANGE_ROLE, false))
        .isTrue();
    assertThat(evaluator.canManage(OrgRole.ADMIN, OrgRole.ADMIN, ManagementAction.REMOVE, false))
        .isFalse();
    assertThat(evaluator.canManage(OrgRole.ADMIN, OrgRole.OWNER, ManagementAction.REMOVE, false))
        .isFalse();
    assertThat(evaluator.canManage(OrgRole.ADMIN, OrgRole.ADMIN, ManagementAction.INVITE, false))
        .isTrue();
  }

  @ParameterizedTest
  @EnumSource(ManagementAction.class)
  void member_cannotManageAnyone(ManagementAction action) {
    for (OrgRole target : OrgRole.values()) {
      assertThat(evaluator.canManage(OrgRole.MEMBER, target, action, false)).isFalse();
    }
  }

  @Test
  void canAssignRole_onlyOwnerProducesAdmin() {
    assertThat(evaluator.canAssignRole(OrgRole.OWNER, OrgRole.ADMIN)).isTrue();
    assertThat(evaluator.canAssignRole(OrgRole.ADMIN, OrgRole.ADMIN)).isFalse();
    assertThat(evaluator.canAssignRole(OrgRole.ADMIN, OrgRole.MEMBER)).isTrue();
    assertThat(evaluator.canAssignRole(OrgRole.MEMBER, OrgRole.MEMBER)).isFalse();
  }

  @ParameterizedTest
  @EnumSource(OrgRole.class)
  void canAssignRole_nobodyProducesOwner(OrgRole actorRole) {
    assertThat(evaluator.canAssignRole(actorRole, OrgRole.OWNER)).isFalse();
  }

  @Test
  void isAllowed_usesPermissionTable() {
    assertThat(evaluator.isAllowed(OrgRole.MEMBER, OrgPermission.VIEW_AUDIT_LOGS)).isTrue();
    assertThat(evaluator.isAllowed(OrgRole.MEMBER, OrgPermission.INVITE_USERS)).isFalse();
    assertThat(evaluator.isAllowed(OrgRole.ADMIN, OrgPermission.CHANGE_ROLES)).isTrue();
    assertThat(evaluator.isAllowed(OrgRole.ADMIN, OrgPermission.MANAGE_ORGANIZATION)).isFalse();
    assertThat(evaluator.isAllowed(OrgRole.OWNER, OrgPermission.MANAGE_ADMINS)).isTrue();
  }
}
