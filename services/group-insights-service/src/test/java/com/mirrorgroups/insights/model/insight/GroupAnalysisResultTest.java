package com.mirrorgroups.insights.model.insight;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit Tests for GroupAnalysisResult
 *
 * @author MirrorGroups Insights Team
 * @version 1.0.0
 * @since 2026-10-01
 */
@DisplayName("Group Analysis Result Tests")
class GroupAnalysisResultTest {

    private static CollectiveStrength strength(String name, List<String> applications) {
        return CollectiveStrength.builder()
            .name(name)
            .category(StrengthCategory.BEHAVIORAL)
            .prevalence(1.0)
            .strength(0.8)
            .memberCount(3)
            .confidence(0.8)
            .applications(applications)
            .build();
    }

    @Test
    @DisplayName("Should not follow later changes to the lists it was built from")
    void build_CopiesLists() {
        // Given
        List<String> applications = new ArrayList<>(List.of("conflict_resolution"));
        List<CollectiveStrength> strengths = new ArrayList<>(List.of(strength("active_listening", applications)));
        List<ConflictRisk> risks = new ArrayList<>();

        GroupAnalysisResult result = GroupAnalysisResult.builder()
            .groupId("group-1")
            .strengths(strengths)
            .risks(risks)
            .build();

        // When
        strengths.add(strength("injected", List.of()));
        risks.add(ConflictRisk.builder().type("empathy_gap").probability(0.9).impact(0.9).build());
        applications.add("injected");

        // Then
        assertThat(result.getStrengths()).extracting(CollectiveStrength::getName).containsExactly("active_listening");
        assertThat(result.getRisks()).isEmpty();
        assertThat(result.getStrengths().get(0).getApplications()).containsExactly("conflict_resolution");
    }

    @Test
    @DisplayName("Should hand out read-only lists")
    void getters_ReadOnly() {
        GroupAnalysisResult result = GroupAnalysisResult.builder()
            .groupId("group-1")
            .strengths(List.of(strength("active_listening", List.of())))
            .risks(List.of())
            .build();

        assertThatThrownBy(() -> result.getStrengths().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> result.getRisks().add(null)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should keep absent blocks absent")
    void build_NullBlocks() {
        GroupAnalysisResult result = GroupAnalysisResult.builder().groupId("group-1").build();

        assertThat(result.getStrengths()).isNull();
        assertThat(result.getRisks()).isNull();
        assertThat(result.hasAnyInsight()).isFalse();
    }
}
