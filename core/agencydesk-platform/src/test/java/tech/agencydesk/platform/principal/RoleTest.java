package tech.agencydesk.platform.principal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RoleTest {

    @Test
    @DisplayName("fromValue should parse stored role values case-insensitively")
    void fromValue_shouldParseStoredValues() {
        assertThat(Role.fromValue("owner")).isEqualTo(Role.OWNER);
        assertThat(Role.fromValue(" Admin ")).isEqualTo(Role.ADMIN);
        assertThat(Role.fromValue("member")).isEqualTo(Role.MEMBER);
    }

    @Test
    @DisplayName("fromValue should reject unknown roles")
    void fromValue_shouldThrow_whenUnknown() {
        assertThatThrownBy(() -> Role.fromValue("superuser")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Role.fromValue(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Identity should copy the allow-list and default it to empty")
    void identity_shouldCopyAllowedVerticals() {
        List<String> verticals = new ArrayList<>(List.of("knots"));
        Identity identity = new Identity("user-1", "agency-a", Role.MEMBER, verticals, false);
        verticals.add("pluto");

        assertThat(identity.allowedVerticals()).containsExactly("knots");
        assertThat(new Identity("user-1", "agency-a", Role.MEMBER, null, false).allowedVerticals()).isEmpty();
    }
}
