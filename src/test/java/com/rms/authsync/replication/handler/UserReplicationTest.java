package com.rms.authsync.replication.handler;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.rms.authsync.core.error.DependencyNotReadyException;
import com.rms.authsync.core.error.InvalidEventException;
import com.rms.authsync.core.model.ReplicatedUser;
import com.rms.authsync.core.subject.EventSubjects;
import com.rms.authsync.support.ReadModelFixture;

class UserReplicationTest {

    private ReadModelFixture fx;

    @BeforeEach
    void setUp() {
        fx = ReadModelFixture.create();
        fx.apply(EventSubjects.PERMISSION_CREATED, "{\"permission\":{\"id\":1,\"name\":\"orders.view\",\"guard_name\":\"web\"}}");
        fx.apply(EventSubjects.PERMISSION_CREATED, "{\"permission\":{\"id\":2,\"name\":\"orders.edit\",\"guard\":\"web\"}}");
        fx.apply(EventSubjects.ROLE_CREATED, "{\"role\":{\"id\":10,\"name\":\"Admin\",\"guard_name\":\"web\"}}");
        fx.apply(EventSubjects.ROLE_CREATED, "{\"role\":{\"id\":11,\"name\":\"Cashier\",\"guard_name\":\"web\"}}");
    }

    private ReplicatedUser user(long id) {
        return fx.users.findById(id).block();
    }

    private List<String> roles(long id) {
        return fx.users.roleNames(id).collectList().block();
    }

    private List<String> permissions(long id) {
        return fx.users.permissionNames(id).collectList().block();
    }

    @Test
    void createdUserWithUnknownRoleIsNotReadyAndRollsBack() {
        DependencyNotReadyException e = assertThrows(DependencyNotReadyException.class,
                () -> fx.apply(EventSubjects.USER_CREATED, """
                        {"user":{"id":5,"name":"Ada","email":"ada@example.com"},"roles":["Cashier","Auditor"]}
                        """));

        assertEquals("Role 'Auditor' not found for guard web", e.getMessage());
        assertNull(user(5));
    }

    @Test
    void createdUserWithKnownRolesIsAdmin() {
        fx.apply(EventSubjects.USER_CREATED, """
                {"user":{"id":5,"email":"ada@example.com","roles":["Admin","Cashier"]},
                 "permissions_direct":["orders.view"]}
                """);

        ReplicatedUser u = user(5);
        assertEquals("ada@example.com", u.name());
        assertEquals(ReplicatedUser.ROLE_ADMIN, u.role());
        assertEquals(List.of("Admin", "Cashier"), roles(5));
        assertEquals(List.of("orders.view"), permissions(5));
    }

    @Test
    void createdUserRequiresEmail() {
        assertThrows(InvalidEventException.class,
                () -> fx.apply(EventSubjects.USER_CREATED, "{\"user\":{\"id\":5,\"name\":\"Ada\"}}"));
    }

    @Test
    void grantFailsClosedUntilPermissionIsReplicated() {
        fx.apply(EventSubjects.USER_CREATED, "{\"user\":{\"id\":5,\"email\":\"ada@example.com\"}}");

        DependencyNotReadyException e = assertThrows(DependencyNotReadyException.class,
                () -> fx.apply(EventSubjects.USER_PERMISSION_GRANTED,
                        "{\"user_id\":5,\"permissions\":[\"orders.view\",\"reports.export\"]}"));
        assertEquals("Permission 'reports.export' not found for guard web", e.getMessage());
        assertEquals(List.of(), permissions(5));

        fx.apply(EventSubjects.PERMISSION_CREATED, "{\"permission\":{\"id\":3,\"name\":\"reports.export\"}}");
        fx.apply(EventSubjects.USER_PERMISSION_GRANTED,
                "{\"user_id\":5,\"permissions\":[\"orders.view\",\"reports.export\"]}");

        assertEquals(List.of("orders.view", "reports.export"), permissions(5));
    }

    @Test
    void grantForUnknownUserIsNotReady() {
        assertThrows(DependencyNotReadyException.class, () -> fx.apply(EventSubjects.USER_PERMISSION_GRANTED,
                "{\"user_id\":99,\"permissions\":[\"orders.view\"]}"));
    }

    @Test
    void permissionSyncReplacesAndRequiresList() {
        fx.apply(EventSubjects.USER_CREATED, """
                {"user":{"id":5,"email":"ada@example.com"},"permissions_direct":["orders.view"]}
                """);

        fx.apply(EventSubjects.USER_PERMISSION_SYNCED,
                "{\"user_id\":5,\"permissions\":{\"from\":[\"orders.view\"],\"to\":[\"orders.edit\"]}}");
        assertEquals(List.of("orders.edit"), permissions(5));

        assertThrows(InvalidEventException.class, () -> fx.apply(EventSubjects.USER_PERMISSION_SYNCED,
                "{\"user_id\":5,\"permissions\":{\"to\":\"orders.edit\"}}"));
    }

    @Test
    void revokeDetachesOnlyNamedPermissions() {
        fx.apply(EventSubjects.USER_CREATED, """
                {"user":{"id":5,"email":"ada@example.com"},"permissions_direct":["orders.view","orders.edit"]}
                """);

        fx.apply(EventSubjects.USER_PERMISSION_REVOKED, "{\"user_id\":5,\"permissions\":[\"orders.edit\"]}");

        assertEquals(List.of("orders.view"), permissions(5));
    }

    @Test
    void roleAssignmentAndRemovalMaintainAdminFlag() {
        fx.apply(EventSubjects.USER_CREATED, "{\"user\":{\"id\":5,\"email\":\"ada@example.com\"}}");

        fx.apply(EventSubjects.USER_ROLE_ASSIGNED, "{\"user_id\":5,\"roles\":[\"Admin\"]}");
        assertEquals(ReplicatedUser.ROLE_ADMIN, user(5).role());
        assertEquals(List.of("Admin"), roles(5));

        fx.apply(EventSubjects.USER_ROLE_ASSIGNED, "{\"user_id\":5,\"roles\":[\"Cashier\"]}");
        assertEquals(List.of("Admin", "Cashier"), roles(5));

        fx.apply(EventSubjects.USER_ROLE_REMOVED, "{\"user_id\":5,\"roles\":[\"Admin\"]}");
        assertEquals(ReplicatedUser.ROLE_USER, user(5).role());
        assertEquals(List.of("Cashier"), roles(5));
    }

    @Test
    void roleSyncAcceptsDeltaAndBareList() {
        fx.apply(EventSubjects.USER_CREATED, "{\"user\":{\"id\":5,\"email\":\"ada@example.com\"}}");

        fx.apply(EventSubjects.USER_ROLE_SYNCED, "{\"user_id\":5,\"roles\":{\"from\":[],\"to\":[\"Admin\",\"Cashier\"]}}");
        assertEquals(List.of("Admin", "Cashier"), roles(5));
        assertEquals(ReplicatedUser.ROLE_ADMIN, user(5).role());

        fx.apply(EventSubjects.USER_ROLE_SYNCED, "{\"user_id\":5,\"roles\":[\"Cashier\"]}");
        assertEquals(List.of("Cashier"), roles(5));
        assertEquals(ReplicatedUser.ROLE_USER, user(5).role());

        fx.apply(EventSubjects.USER_ROLE_SYNCED, "{\"user_id\":5,\"roles\":{\"to\":null}}");
        assertEquals(List.of("Cashier"), roles(5));
    }

    @Test
    void updateAppliesDeltasInEitherShape() {
        fx.apply(EventSubjects.USER_CREATED, "{\"user\":{\"id\":5,\"name\":\"Ada\",\"email\":\"ada@example.com\"}}");

        fx.apply(EventSubjects.USER_UPDATED,
                "{\"user_id\":5,\"changed_fields\":{\"name\":{\"from\":\"Ada\",\"to\":\"Ada L.\"}}}");
        fx.apply(EventSubjects.USER_UPDATED, "{\"user_id\":5,\"changed_fields\":{\"email\":\"ada@lovelace.dev\"}}");

        ReplicatedUser u = user(5);
        assertEquals("Ada L.", u.name());
        assertEquals("ada@lovelace.dev", u.email());
    }

    @Test
    void updateOfUnknownUserIsIgnored() {
        fx.apply(EventSubjects.USER_UPDATED, "{\"user_id\":77,\"changed_fields\":{\"name\":\"Ghost\"}}");

        assertNull(user(77));
    }

    @Test
    void deleteCascadesRelationships() {
        fx.apply(EventSubjects.USER_CREATED, """
                {"user":{"id":5,"email":"ada@example.com"},"roles":["Cashier"],"permissions_direct":["orders.view"]}
                """);

        fx.apply(EventSubjects.USER_DELETED, "{\"user_id\":5}");

        assertNull(user(5));
        assertEquals(0, fx.count("SELECT COUNT(*) FROM user_has_roles"));
        assertEquals(0, fx.count("SELECT COUNT(*) FROM user_has_permissions"));
    }
}
