package io.github.kbadmin.access.persistence.repo;

import io.github.kbadmin.access.model.UserRole;
import io.github.kbadmin.access.persistence.entity.UserEntity;
import io.github.kbadmin.access.security.UserAccount;
import io.github.kbadmin.access.security.UserDirectory;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Optional;

@ApplicationScoped
public class UserRepository implements PanacheRepositoryBase<UserEntity, String>, UserDirectory {

    @Override
    public Optional<UserAccount> findUser(String userId) {
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        return findByIdOptional(userId)
                .map(
                        user ->
                                new UserAccount(
                                        user.getId(),
                                        user.getEmail(),
                                        UserRole.fromString(user.getRole())));
    }
}
