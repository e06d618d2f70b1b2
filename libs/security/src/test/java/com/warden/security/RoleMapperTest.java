package com.warden.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RoleMapper")
class RoleMapperTest {

    private final RoleMapper mapper = new RoleMapper(RoleMappingTable.defaults());

    @Nested
    @DisplayName("scopes")
    class Scopes {

        @Test
        @DisplayName("maps a known scope ignoring case")
        void knownScope() {
            assertThat(mapper.mapScopesToRoles("uaserver")).containsExactly(RoleId.OBSERVER);
            assertThat(mapper.mapScopesToRoles("UAServer")).containsExactly(RoleId.OBSERVER);
        }

        @Test
        @DisplayName("ignores unknown scopes")
        void unknownScope() {
            assertThat(mapper.mapScopesToRoles("openid profile")).isEmpty();
        }

        @Test
        @DisplayName("splits on any whitespace and deduplicates")
        void splitsAndDeduplicates() {
            assertThat(mapper.mapScopesToRoles("  openid\tUAServer\n uaserver ")).containsExactly(RoleId.OBSERVER);
        }

        @Test
        @DisplayName("null and blank scope strings yield nothing")
        void nullAndBlank() {
            assertThat(mapper.mapScopesToRoles(null)).isEmpty();
            assertThat(mapper.mapScopesToRoles("   ")).isEmpty();
        }

        @Test
        @DisplayName("unions in first-seen order")
        void unionsInOrder() {
            RoleMapper custom = new RoleMapper(RoleMappingTable.builder()
                    .scope("write", RoleId.OPERATOR, RoleId.OBSERVER)
                    .scope("admin", RoleId.SECURITY_ADMIN, RoleId.OPERATOR)
                    .build());

            assertThat(custom.mapScopesToRoles("admin write"))
                    .containsExactly(RoleId.SECURITY_ADMIN, RoleId.OPERATOR, RoleId.OBSERVER);
        }
    }

    @Nested
    @DisplayName("users and role claims")
    class UsersAndRoles {

        @Test
        @DisplayName("maps seeded users")
        void seededUsers() {
            assertThat(mapper.mapUserToRoles("gdsadmin")).containsExactly(RoleId.SECURITY_ADMIN);
            assertThat(mapper.mapUserToRoles("AppAdmin")).containsExactly(RoleId.ENGINEER);
            assertThat(mapper.mapUserToRoles("appuser")).containsExactly(RoleId.OPERATOR);
            assertThat(mapper.mapUserToRoles("nobody")).isEmpty();
        }

        @Test
        @DisplayName("maps role claims to several roles")
        void roleClaims() {
            assertThat(mapper.mapRoleClaimsToRoles(List.of("Admin", "user", "guest")))
                    .containsExactly(RoleId.SECURITY_ADMIN, RoleId.CONFIGURE_ADMIN, RoleId.OPERATOR);
            assertThat(mapper.mapRoleClaimsToRoles(null)).isEmpty();
        }

        @Test
        @DisplayName("tables are independent")
        void independentTables() {
            assertThat(mapper.mapUserToRoles("admin")).isEmpty();
            assertThat(mapper.mapScopesToRoles("gdsadmin")).isEmpty();
        }
    }

    @Nested
    @DisplayName("table")
    class Table {

        @Test
        @DisplayName("is unmodifiable after build")
        void unmodifiable() {
            RoleMappingTable table = RoleMappingTable.defaults();

            assertThatThrownBy(() -> table.scopes().put("x", java.util.Set.of(RoleId.OBSERVER)))
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> table.rolesForRoleClaim("admin").add(RoleId.OBSERVER))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("repeated keys differing in case extend one entry")
        void repeatedKeysMerge() {
            RoleMappingTable table = RoleMappingTable.builder()
                    .user("Alice", RoleId.OPERATOR)
                    .user("alice", RoleId.ENGINEER)
                    .build();

            assertThat(table.users()).hasSize(1);
            assertThat(table.rolesForUser("ALICE")).containsExactly(RoleId.OPERATOR, RoleId.ENGINEER);
        }

        @Test
        @DisplayName("rejects blank keys and empty role sets")
        void rejectsBadEntries() {
            assertThatThrownBy(() -> RoleMappingTable.builder().scope(" ", RoleId.OBSERVER))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> RoleMappingTable.builder().role("admin"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("admin");
        }

        @Test
        @DisplayName("empty table maps nothing")
        void emptyTable() {
            RoleMapper empty = new RoleMapper(RoleMappingTable.empty());
            assertThat(empty.mapScopesToRoles("UAServer")).isEmpty();
        }
    }
}
