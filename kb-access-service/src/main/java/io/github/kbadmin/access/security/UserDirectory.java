package io.github.kbadmin.access.security;

import java.util.Optional;

/** Lookup of application users and their global role. */
public interface UserDirectory {

    Optional<UserAccount> findUser(String userId);
}
