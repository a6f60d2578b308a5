package io.github.kbadmin.access.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import java.io.Serializable;
import java.time.OffsetDateTime;
import java.util.Objects;

@Entity
@Table(name = "user_teams")
public class TeamMemberEntity {

    @EmbeddedId private TeamMemberId id;

    /** Either "member" or "leader". */
    @Column(name = "role", nullable = false)
    private String role;

    @Column(name = "joined_at", nullable = false, insertable = false, updatable = false)
    private OffsetDateTime joinedAt;

    public TeamMemberId getId() {
        return id;
    }

    public void setId(TeamMemberId id) {
        this.id = id;
    }

    public String getRole() {
        return role;
    }

    public void setRole(String role) {
        this.role = role;
    }

    public OffsetDateTime getJoinedAt() {
        return joinedAt;
    }

    @Embeddable
    public static class TeamMemberId implements Serializable {

        @Column(name = "team_id")
        private String teamId;

        @Column(name = "user_id")
        private String userId;

        public TeamMemberId() {}

        public TeamMemberId(String teamId, String userId) {
            this.teamId = teamId;
            this.userId = userId;
        }

        public String getTeamId() {
            return teamId;
        }

        public void setTeamId(String teamId) {
            this.teamId = teamId;
        }

        public String getUserId() {
            return userId;
        }

        public void setUserId(String userId) {
            this.userId = userId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof TeamMemberId that)) {
                return false;
            }
            return Objects.equals(teamId, that.teamId) && Objects.equals(userId, that.userId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(teamId, userId);
        }
    }
}
