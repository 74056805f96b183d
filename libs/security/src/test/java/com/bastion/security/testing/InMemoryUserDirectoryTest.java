package com.bastion.security.testing;

import com.bastion.security.DuplicateEmailException;
import com.bastion.security.UnknownFieldException;
import com.bastion.security.User;
import com.bastion.security.UserFilter;
import com.bastion.security.UserNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryUserDirectory")
class InMemoryUserDirectoryTest {

    private InMemoryUserDirectory directory;

    @BeforeEach
    void setUp() {
        directory = new InMemoryUserDirectory();
    }

    @Test
    @DisplayName("assigns increasing ids on insert")
    void assignsIds() {
        User first = directory.insert("a@x.com", "d1");
        User second = directory.insert("b@x.com", "d2");

        assertThat(first.id()).isEqualTo(1);
        assertThat(second.id()).isEqualTo(2);
        assertThat(directory.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("rejects duplicate emails")
    void rejectsDuplicate() {
        directory.insert("a@x.com", "d1");

        assertThatThrownBy(() -> directory.insert("a@x.com", "d2"))
                .isInstanceOf(DuplicateEmailException.class)
                .satisfies(e -> assertThat(((DuplicateEmailException) e).email()).isEqualTo("a@x.com"));
    }

    @Test
    @DisplayName("lookup returns an empty list when nothing matches")
    void lookupEmpty() {
        assertThat(directory.lookup(UserFilter.byEmail("nobody@x.com"))).isEmpty();
        assertThat(directory.findOne(UserFilter.byEmail("nobody@x.com"))).isEmpty();
    }

    @Test
    @DisplayName("update changes the named fields only")
    void updatesFields() {
        User user = directory.insert("a@x.com", "d1");

        directory.update(user.id(), Map.of("reset_token", "r-1", "session_token", "s-1"));

        User updated = directory.findOne(UserFilter.byId(user.id())).orElseThrow();
        assertThat(updated.resetToken()).isEqualTo("r-1");
        assertThat(updated.sessionToken()).isEqualTo("s-1");
        assertThat(updated.passwordDigest()).isEqualTo("d1");
    }

    @Test
    @DisplayName("update can clear a token")
    void clearsToken() {
        User user = directory.insert("a@x.com", "d1");
        directory.update(user.id(), Map.of("reset_token", "r-1"));

        Map<String, Object> fields = new HashMap<>();
        fields.put("reset_token", null);
        directory.update(user.id(), fields);

        assertThat(directory.findOne(UserFilter.byId(user.id())).orElseThrow().resetToken()).isNull();
    }

    @Test
    @DisplayName("update rejects unknown fields before touching the user")
    void rejectsUnknownField() {
        User user = directory.insert("a@x.com", "d1");

        assertThatThrownBy(() -> directory.update(user.id(), Map.of("no_such", "x")))
                .isInstanceOf(UnknownFieldException.class)
                .hasMessageContaining("no_such");
        assertThatThrownBy(() -> directory.update(user.id(), Map.of("id", 9)))
                .isInstanceOf(UnknownFieldException.class);
    }

    @Test
    @DisplayName("update fails for an unknown id")
    void rejectsUnknownId() {
        assertThatThrownBy(() -> directory.update(99, Map.of("reset_token", "r")))
                .isInstanceOf(UserNotFoundException.class);
    }

    @Test
    @DisplayName("update rejects an email already used by another user")
    void rejectsEmailCollision() {
        directory.insert("a@x.com", "d1");
        User second = directory.insert("b@x.com", "d2");

        assertThatThrownBy(() -> directory.update(second.id(), Map.of("email", "a@x.com")))
                .isInstanceOf(DuplicateEmailException.class);
    }
}
