package dev.buyergroup.service;

import dev.buyergroup.model.PersonProfile;
import dev.buyergroup.model.Role;
import dev.buyergroup.model.RoleAssignment;
import dev.buyergroup.model.SellerProfile;
import dev.buyergroup.model.SeniorityLevel;
import dev.buyergroup.service.BuyerGroupSelector.Selection;
import dev.buyergroup.support.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BuyerGroupSelectorTest {

    private final BuyerGroupSelector selector = new BuyerGroupSelector();
    private SellerProfile profile;

    @BeforeEach
    void setUp() {
        profile = TestData.revenueProfile();
    }

    private ClassifiedCandidate candidate(String id, Role best, double score) {
        return candidate(id, best, score, null, 0);
    }

    private ClassifiedCandidate candidate(String id, Role best, double score, Role other, double otherScore) {
        PersonProfile person = PersonProfile.builder()
                .id(id)
                .fullName("Person " + id)
                .currentTitle("Title " + id)
                .currentDepartment("sales")
                .seniorityLevel(SeniorityLevel.DIRECTOR)
                .build();
        Map<Role, Double> scores = new EnumMap<>(Role.class);
        scores.put(best, score);
        Map<Role, List<String>> rationale = new EnumMap<>(Role.class);
        rationale.put(best, List.of("test"));
        if (other != null) {
            scores.put(other, otherScore);
            rationale.put(other, List.of("test"));
        }
        return new ClassifiedCandidate(person, best, scores, rationale);
    }

    private List<String> ids(Selection selection, Role role) {
        return selection.roles().get(role).stream().map(RoleAssignment::getPersonId).toList();
    }

    @Test
    @DisplayName("Should never exceed a role cap")
    void shouldRespectRoleCaps() {
        List<ClassifiedCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            candidates.add(candidate(String.format("d%02d", i), Role.DECISION, 90 - i));
        }

        Selection selection = selector.select(candidates, profile, 12);

        assertThat(ids(selection, Role.DECISION)).containsExactly("d00", "d01", "d02");
        assertThat(selection.totalMembers()).isEqualTo(3);
        assertThat(selection.warnings()).containsExactly(
                "RoleGapUnfilled: no qualified Champion found (minimum 1)",
                "RoleGapUnfilled: no qualified Stakeholder found (minimum 1)",
                "RoleGapUnfilled: no qualified Blocker found (minimum 1)");
    }

    @Test
    @DisplayName("Minimum targets should be filled before high scorers of other roles")
    void shouldFillMinimumsFirst() {
        List<ClassifiedCandidate> candidates = new ArrayList<>(List.of(
                candidate("d1", Role.DECISION, 90),
                candidate("d2", Role.DECISION, 89),
                candidate("d3", Role.DECISION, 88),
                candidate("c1", Role.CHAMPION, 40),
                candidate("s1", Role.STAKEHOLDER, 30),
                candidate("b1", Role.BLOCKER, 20)));

        Selection selection = selector.select(candidates, profile, 4);

        assertThat(selection.totalMembers()).isEqualTo(4);
        assertThat(ids(selection, Role.DECISION)).containsExactly("d1");
        assertThat(ids(selection, Role.CHAMPION)).containsExactly("c1");
        assertThat(ids(selection, Role.STAKEHOLDER)).containsExactly("s1");
        assertThat(ids(selection, Role.BLOCKER)).containsExactly("b1");
        assertThat(selection.warnings()).isEmpty();
    }

    @Test
    void shouldBreakScoreTiesById() {
        List<ClassifiedCandidate> candidates = List.of(
                candidate("b", Role.DECISION, 80),
                candidate("c", Role.DECISION, 80),
                candidate("a", Role.DECISION, 80));

        Selection selection = selector.select(candidates, profile, 12);

        assertThat(ids(selection, Role.DECISION)).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("Rebalancing should move a surplus adjacent member into an empty role")
    void shouldMoveSurplusMemberIntoGap() {
        List<ClassifiedCandidate> candidates = List.of(
                candidate("d1", Role.DECISION, 90),
                candidate("c1", Role.CHAMPION, 80),
                candidate("s1", Role.STAKEHOLDER, 60, Role.BLOCKER, 50),
                candidate("s2", Role.STAKEHOLDER, 55));

        Selection selection = selector.select(candidates, profile, 12);

        assertThat(ids(selection, Role.BLOCKER)).containsExactly("s1");
        assertThat(ids(selection, Role.STAKEHOLDER)).containsExactly("s2");
        assertThat(selection.roles().get(Role.BLOCKER).get(0).getScore()).isEqualTo(50);
        assertThat(selection.warnings()).isEmpty();
    }

    @Test
    void shouldNotBreakDonorMinimum() {
        List<ClassifiedCandidate> candidates = List.of(
                candidate("d1", Role.DECISION, 90),
                candidate("c1", Role.CHAMPION, 80),
                candidate("s1", Role.STAKEHOLDER, 60, Role.BLOCKER, 50));

        Selection selection = selector.select(candidates, profile, 12);

        assertThat(ids(selection, Role.STAKEHOLDER)).containsExactly("s1");
        assertThat(ids(selection, Role.BLOCKER)).isEmpty();
        assertThat(selection.warnings()).containsExactly("RoleGapUnfilled: no qualified Blocker found (minimum 1)");
    }

    @Test
    @DisplayName("A full group should evict the lowest surplus member to fill a gap")
    void shouldEvictLowestSurplusMemberWhenFull() {
        List<ClassifiedCandidate> candidates = List.of(
                candidate("d1", Role.DECISION, 90),
                candidate("d2", Role.DECISION, 85),
                candidate("c1", Role.CHAMPION, 80),
                candidate("s1", Role.STAKEHOLDER, 60, Role.BLOCKER, 50),
                candidate("s3", Role.STAKEHOLDER, 58, Role.BLOCKER, 45));

        Selection selection = selector.select(candidates, profile, 4);

        assertThat(selection.totalMembers()).isEqualTo(4);
        assertThat(ids(selection, Role.DECISION)).containsExactly("d1");
        assertThat(ids(selection, Role.STAKEHOLDER)).containsExactly("s1");
        assertThat(ids(selection, Role.BLOCKER)).containsExactly("s3");
        assertThat(selection.warnings()).isEmpty();
    }

    @Test
    void shouldWarnWhenBelowTarget() {
        SellerProfile twoChampions = profile.toBuilder().minRoleTarget(Role.CHAMPION, 2).build();
        List<ClassifiedCandidate> candidates = List.of(
                candidate("d1", Role.DECISION, 90),
                candidate("c1", Role.CHAMPION, 80),
                candidate("s1", Role.STAKEHOLDER, 60),
                candidate("b1", Role.BLOCKER, 50));

        Selection selection = selector.select(candidates, twoChampions, 12);

        assertThat(selection.warnings()).containsExactly("RoleBelowTarget: Champion has 1 of 2 required");
    }

    @Test
    void shouldReturnEveryRoleForEmptyInput() {
        Selection selection = selector.select(List.of(), profile, 12);

        assertThat(selection.roles()).containsOnlyKeys(Role.values());
        assertThat(selection.totalMembers()).isZero();
        assertThat(selection.warnings()).hasSize(4);
    }
}
