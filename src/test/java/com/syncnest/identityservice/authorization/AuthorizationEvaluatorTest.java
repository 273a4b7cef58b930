package com.syncnest.identityservice.authorization;

import com.syncnest.identityservice.entity.UserRole;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class AuthorizationEvaluatorTest {

    private static AuthenticatedPrincipal principal(UserRole role, boolean active, boolean blocked, boolean verified) {
        return new AuthenticatedPrincipal(UUID.randomUUID(), "p@example.com", role, active, blocked, verified);
    }

    @Test
    void missingPrincipalIsUnauthenticated() {
        assertThat(AuthorizationEvaluator.evaluate(null, List.of(Capability.AUTHENTICATED)))
                .isEqualTo(Decision.UNAUTHENTICATED);
    }

    @Test
    void noRequirementsAllowsAnyone() {
        assertThat(AuthorizationEvaluator.evaluate(null, List.of())).isEqualTo(Decision.ALLOW);
    }

    @Test
    void moderatorIsDeniedAdminButIsStaff() {
        AuthenticatedPrincipal moderator = principal(UserRole.MODERATOR, true, false, true);

        assertThat(AuthorizationEvaluator.evaluate(moderator, List.of(Capability.ADMIN))).isEqualTo(Decision.FORBIDDEN);
        assertThat(AuthorizationEvaluator.evaluate(moderator, List.of(Capability.STAFF))).isEqualTo(Decision.ALLOW);
    }

    @Test
    void adminIsAllowedAdminAndStaff() {
        AuthenticatedPrincipal admin = principal(UserRole.ADMIN, true, false, false);

        assertThat(AuthorizationEvaluator.evaluate(admin, Set.of(Capability.ADMIN, Capability.STAFF)))
                .isEqualTo(Decision.ALLOW);
    }

    @Test
    void plainUserIsNotStaff() {
        assertThat(AuthorizationEvaluator.satisfies(principal(UserRole.USER, true, false, true), Capability.STAFF)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(Capability.class)
    void blockedPrincipalIsDeniedEveryCapability(Capability capability) {
        AuthenticatedPrincipal blockedAdmin = principal(UserRole.ADMIN, true, true, true);

        assertThat(AuthorizationEvaluator.satisfies(blockedAdmin, capability)).isFalse();
        assertThat(AuthorizationEvaluator.evaluate(blockedAdmin, List.of(capability))).isEqualTo(Decision.FORBIDDEN);
    }

    @Test
    void verifiedRequiresActiveAndVerifiedEmail() {
        assertThat(AuthorizationEvaluator.satisfies(principal(UserRole.USER, true, false, true), Capability.VERIFIED)).isTrue();
        assertThat(AuthorizationEvaluator.satisfies(principal(UserRole.USER, false, false, true), Capability.VERIFIED)).isFalse();
        assertThat(AuthorizationEvaluator.satisfies(principal(UserRole.USER, true, false, false), Capability.VERIFIED)).isFalse();
    }

    @Test
    void inactivePrincipalFailsActiveButPassesNotBlocked() {
        AuthenticatedPrincipal inactive = principal(UserRole.USER, false, false, true);

        assertThat(AuthorizationEvaluator.evaluate(inactive, List.of(Capability.NOT_BLOCKED))).isEqualTo(Decision.ALLOW);
        assertThat(AuthorizationEvaluator.evaluate(inactive, List.of(Capability.ACTIVE, Capability.NOT_BLOCKED)))
                .isEqualTo(Decision.FORBIDDEN);
    }

    @Test
    void ownerOrAdmin() {
        AuthenticatedPrincipal user = principal(UserRole.USER, true, false, true);
        AuthenticatedPrincipal admin = principal(UserRole.ADMIN, true, false, true);
        UUID someoneElse = UUID.randomUUID();

        assertThat(AuthorizationEvaluator.isOwnerOrAdmin(user, user.id())).isTrue();
        assertThat(AuthorizationEvaluator.isOwnerOrAdmin(user, someoneElse)).isFalse();
        assertThat(AuthorizationEvaluator.isOwnerOrAdmin(admin, someoneElse)).isTrue();
        assertThat(AuthorizationEvaluator.isOwnerOrAdmin(null, someoneElse)).isFalse();
    }
}
