package io.github.kbadmin.access.security;

import java.util.List;

/**
 * Team membership as seen by authorization. Only leader memberships confer a team's grants on a
 * user; plain membership only affects which resources a user can see listed.
 */
public interface TeamMembershipProvider {

    /** Ids of the teams in which the user's membership role is exactly "leader". */
    List<String> leaderTeamIds(String userId);

    /** Ids of every team the user belongs to, regardless of role. */
    List<String> teamIds(String userId);
}
