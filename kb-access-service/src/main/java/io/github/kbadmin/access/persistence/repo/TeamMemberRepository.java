package io.github.kbadmin.access.persistence.repo;

import io.github.kbadmin.access.model.TeamRole;
import io.github.kbadmin.access.persistence.entity.TeamMemberEntity;
import io.github.kbadmin.access.persistence.entity.TeamMemberEntity.TeamMemberId;
import io.github.kbadmin.access.security.TeamMembershipProvider;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;

@ApplicationScoped
public class TeamMemberRepository
        implements PanacheRepositoryBase<TeamMemberEntity, TeamMemberId>, TeamMembershipProvider {

    public List<TeamMemberEntity> listForUser(String userId) {
        return find("id.userId = ?1", userId).list();
    }

    @Override
    public List<String> leaderTeamIds(String userId) {
        return find("id.userId = ?1 AND role = ?2", userId, TeamRole.LEADER.toValue()).list()
                .stream()
                .map(member -> member.getId().getTeamId())
                .toList();
    }

    @Override
    public List<String> teamIds(String userId) {
        return listForUser(userId).stream()
                .map(member -> member.getId().getTeamId())
                .distinct()
                .toList();
    }
}
