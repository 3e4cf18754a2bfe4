package com.escrow.jobs.access;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.escrow.jobs.exceptions.UnauthorizedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryRoleRegistryTest {

    InMemoryRoleRegistry registry;
    ListAppender<ILoggingEvent> logged;

    @BeforeEach
    void setUp() {
        logged = new ListAppender<>();
        logged.start();
        registryLogger().addAppender(logged);
        registry = new InMemoryRoleRegistry();
        registry.seedAdministrator("root");
    }

    @AfterEach
    void tearDown() {
        registryLogger().detachAppender(logged);
    }

    @Test
    void grantSelf_logsCallerIdentityVerbatim() throws Exception {
        String callerId = "ann \"the\" client";

        registry.grantSelf(callerId, Role.CLIENT);

        ILoggingEvent granted = logged.list.get(logged.list.size() - 1);
        assertThat(granted.getMessage()).startsWith("RoleGranted");
        assertThat(granted.getArgumentArray()).containsExactly(callerId, "Client");
        assertThat(granted.getFormattedMessage()).contains("callerId=" + callerId + " role=Client");
    }

    @Test
    void seededIdentity_holdsAdministratorOnly() {
        assertThat(registry.hasRole("root", Role.ADMINISTRATOR)).isTrue();
        assertThat(registry.hasRole("root", Role.CLIENT)).isFalse();
    }

    @Test
    void grantSelf_clientAndFreelancer_isIdempotent() throws Exception {
        registry.grantSelf("alice", Role.CLIENT);
        registry.grantSelf("alice", Role.CLIENT);
        registry.grantSelf("alice", Role.FREELANCER);

        assertThat(registry.hasRole("alice", Role.CLIENT)).isTrue();
        assertThat(registry.hasRole("alice", Role.FREELANCER)).isTrue();
        assertThat(registry.hasRole("alice", Role.ADMINISTRATOR)).isFalse();
    }

    @Test
    void grantSelf_administrator_isRejected() {
        assertThatThrownBy(() -> registry.grantSelf("mallory", Role.ADMINISTRATOR))
                .isInstanceOf(UnauthorizedException.class);
        assertThat(registry.hasRole("mallory", Role.ADMINISTRATOR)).isFalse();
    }

    @Test
    void grantSelf_blankIdentity_isRejected() {
        assertThatThrownBy(() -> registry.grantSelf(" ", Role.CLIENT))
                .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void hasRole_unknownOrNullIdentity_isFalse() {
        assertThat(registry.hasRole("nobody", Role.CLIENT)).isFalse();
        assertThat(registry.hasRole(null, Role.ADMINISTRATOR)).isFalse();
    }

    @Test
    void administrator_canGrantAndRevokeOtherAdministrators() throws Exception {
        registry.grantRole("root", "bob", Role.ADMINISTRATOR);
        assertThat(registry.hasRole("bob", Role.ADMINISTRATOR)).isTrue();

        registry.revokeRole("root", "bob", Role.ADMINISTRATOR);
        assertThat(registry.hasRole("bob", Role.ADMINISTRATOR)).isFalse();
    }

    @Test
    void administrator_cannotRevokeOwnAdministratorRole() {
        assertThatThrownBy(() -> registry.revokeRole("root", "root", Role.ADMINISTRATOR))
                .isInstanceOf(UnauthorizedException.class);
        assertThat(registry.hasRole("root", Role.ADMINISTRATOR)).isTrue();
    }

    @Test
    void nonAdministrator_cannotManageRoles() throws Exception {
        registry.grantSelf("alice", Role.CLIENT);

        assertThatThrownBy(() -> registry.grantRole("alice", "alice", Role.ADMINISTRATOR))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> registry.revokeRole("alice", "root", Role.ADMINISTRATOR))
                .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void revoke_leavesOtherRolesInPlace() throws Exception {
        registry.grantSelf("alice", Role.CLIENT);
        registry.grantSelf("alice", Role.FREELANCER);

        registry.revokeRole("root", "alice", Role.CLIENT);

        assertThat(registry.hasRole("alice", Role.CLIENT)).isFalse();
        assertThat(registry.hasRole("alice", Role.FREELANCER)).isTrue();
    }

    @Test
    void roleLookup_isCaseInsensitive() {
        assertThat(Role.fromValue("client")).isEqualTo(Role.CLIENT);
        assertThat(Role.fromValue("Freelancer")).isEqualTo(Role.FREELANCER);
        assertThatThrownBy(() -> Role.fromValue("owner")).isInstanceOf(IllegalArgumentException.class);
    }

    private static Logger registryLogger() {
        return (Logger) LoggerFactory.getLogger(RoleRegistry.class);
    }
}
