package com.mirrorgroups.insights.engine;

import com.mirrorgroups.insights.model.insight.AlignmentCluster;
import com.mirrorgroups.insights.model.insight.GoalAlignment;
import com.mirrorgroups.insights.model.profile.MemberProfile;
import com.mirrorgroups.insights.model.profile.MotivationDriver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Goal alignment over the members' motivation drivers.
 *
 * <p>A driver counts as a member's goal when its strength exceeds 0.6. Goals held by
 * at least 60% of members are shared, goals held by a single member are divergent,
 * and every goal held by more than one member forms a cluster.
 */
@Component
@Slf4j
public class GoalAlignmentCalculator {

    static final double GOAL_STRENGTH_THRESHOLD = 0.6;

    public GoalAlignment calculate(List<MemberProfile> members) {
        Map<String, Set<String>> holders = new LinkedHashMap<>();
        for (MemberProfile member : members) {
            for (MotivationDriver driver : member.motivationDrivers()) {
                if (driver.getDriver() != null && driver.getStrength() > GOAL_STRENGTH_THRESHOLD) {
                    holders.computeIfAbsent(driver.getDriver().trim().toLowerCase(Locale.ROOT),
                        k -> new LinkedHashSet<>()).add(member.getUserId());
                }
            }
        }

        int total = members.size();
        int required = StrengthDetector.requiredMembers(total);
        List<String> shared = new ArrayList<>();
        List<String> divergent = new ArrayList<>();
        List<AlignmentCluster> clusters = new ArrayList<>();

        holders.forEach((goal, memberIds) -> {
            if (memberIds.size() >= required) {
                shared.add(goal);
            }
            if (memberIds.size() == 1) {
                divergent.add(goal);
            }
            if (memberIds.size() > 1) {
                clusters.add(AlignmentCluster.builder()
                    .goal(goal)
                    .memberIds(List.copyOf(memberIds))
                    .strength((double) memberIds.size() / total)
                    .build());
            }
        });

        double overall = (double) shared.size() / Math.max(holders.size(), 1);
        log.debug("Goal alignment: {} goals, {} shared, {} divergent", holders.size(), shared.size(), divergent.size());

        return GoalAlignment.builder()
            .overallAlignment(overall)
            .sharedGoals(shared)
            .divergentGoals(divergent)
            .clusters(clusters)
            .build();
    }
}
