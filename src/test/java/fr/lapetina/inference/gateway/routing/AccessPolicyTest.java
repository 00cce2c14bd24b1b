package fr.lapetina.inference.gateway.routing;

import fr.lapetina.inference.gateway.domain.model.Cluster;
import fr.lapetina.inference.gateway.domain.model.Endpoint;
import fr.lapetina.inference.gateway.domain.model.Identity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class AccessPolicyTest {

    private static Cluster cluster(List<String> groups, List<String> domains) {
        return new Cluster("c1", "static", Set.of("vllm"), null, groups, domains, null, null);
    }

    private static Endpoint endpoint(List<String> groups, List<String> domains) {
        return new Endpoint(null, "c1", "vllm", "m", "fake", groups, domains, null);
    }

    @Test
    @DisplayName("should admit anyone allowed when nothing is restricted")
    void shouldAdmitWithoutRestrictions() {
        Identity user = new Identity("user@example.org", Set.of(), true);

        assertThat(AccessPolicy.canAccess(user, cluster(List.of(), List.of()), endpoint(List.of(), List.of())))
                .isTrue();
    }

    @Test
    @DisplayName("should reject identities the provider does not allow")
    void shouldRejectDisallowedIdentity() {
        Identity user = new Identity("user@example.org", Set.of(), false);

        assertThat(AccessPolicy.canAccess(user, cluster(List.of(), List.of()), endpoint(List.of(), List.of())))
                .isFalse();
    }

    @Test
    @DisplayName("should require one shared group")
    void shouldRequireGroup() {
        Cluster restricted = cluster(List.of("research", "staff"), List.of());

        assertThat(AccessPolicy.canAccess(new Identity("a@x.org", Set.of("staff"), true), restricted, null))
                .isTrue();
        assertThat(AccessPolicy.canAccess(new Identity("b@x.org", Set.of("guests"), true), restricted, null))
                .isFalse();
    }

    @Test
    @DisplayName("should match domains ignoring case")
    void shouldMatchDomain() {
        Endpoint restricted = endpoint(List.of(), List.of("Example.org"));

        assertThat(AccessPolicy.canAccess(new Identity("a@EXAMPLE.org", Set.of(), true), null, restricted))
                .isTrue();
        assertThat(AccessPolicy.canAccess(new Identity("a@other.org", Set.of(), true), null, restricted))
                .isFalse();
        assertThat(AccessPolicy.canAccess(new Identity("service-account", Set.of(), true), null, restricted))
                .isFalse();
    }

    @Test
    @DisplayName("should require both cluster and endpoint to admit the user")
    void shouldCheckClusterAndEndpoint() {
        Identity staff = new Identity("a@example.org", Set.of("staff"), true);

        assertThat(AccessPolicy.canAccess(staff, cluster(List.of("staff"), List.of()),
                endpoint(List.of("research"), List.of()))).isFalse();
    }
}
