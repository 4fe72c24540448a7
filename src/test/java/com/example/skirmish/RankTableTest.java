package com.example.skirmish;

import com.example.skirmish.util.RankTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RankTable Tests")
class RankTableTest {

    // ===== Skill ranks =====

    @ParameterizedTest
    @DisplayName("Skill rank boundaries")
    @CsvSource({
        "0, 1, 1.0",
        "19, 1, 1.0",
        "20, 2, 1.3",
        "34, 2, 1.3",
        "35, 3, 1.7",
        "59, 3, 1.7",
        "60, 4, 2.2",
        "99, 4, 2.2",
        "100, 5, 2.8",
        "5000, 5, 2.8"
    })
    void skillRankBoundaries(int uses, int rank, double multiplier) {
        assertEquals(rank, RankTable.SKILL_DEFAULT.rankFor(uses));
        assertEquals(multiplier, RankTable.SKILL_DEFAULT.multiplierFor(uses), 1e-9);
    }

    // ===== Branch ranks =====

    @ParameterizedTest
    @DisplayName("Branch rank boundaries")
    @CsvSource({
        "0, 1, 1.0",
        "74, 1, 1.0",
        "75, 2, 1.05",
        "149, 2, 1.05",
        "150, 3, 1.10",
        "524, 5, 1.20",
        "525, 6, 1.25",
        "1124, 8, 1.35",
        "1125, 9, 1.40",
        "1374, 9, 1.40",
        "1375, 10, 1.50"
    })
    void branchRankBoundaries(int uses, int rank, double multiplier) {
        assertEquals(rank, RankTable.BRANCH_DEFAULT.rankFor(uses));
        assertEquals(multiplier, RankTable.BRANCH_DEFAULT.multiplierFor(uses), 1e-9);
    }

    @Test
    @DisplayName("Default tables have 5 skill tiers and 10 branch tiers")
    void tierCounts() {
        assertEquals(5, RankTable.SKILL_DEFAULT.getTierCount());
        assertEquals(10, RankTable.BRANCH_DEFAULT.getTierCount());
    }

    // ===== Validation =====

    @Test
    @DisplayName("Multiplier count must be one more than threshold count")
    void rejectsMismatchedTable() {
        assertThrows(IllegalArgumentException.class,
                () -> new RankTable(new int[] {10, 20}, new double[] {1.0, 1.5}));
    }

    @Test
    @DisplayName("Thresholds must increase")
    void rejectsUnorderedThresholds() {
        assertThrows(IllegalArgumentException.class,
                () -> new RankTable(new int[] {20, 10}, new double[] {1.0, 1.5, 2.0}));
    }

    @Test
    @DisplayName("Accessors return copies")
    void accessorsReturnCopies() {
        int[] thresholds = RankTable.SKILL_DEFAULT.getThresholds();
        thresholds[0] = 999;
        assertEquals(2, RankTable.SKILL_DEFAULT.rankFor(20));
    }

    // ===== Labels =====

    @ParameterizedTest
    @DisplayName("Rank labels use roman numerals up to X")
    @CsvSource({
        "1, Rank I",
        "2, Rank II",
        "4, Rank IV",
        "9, Rank IX",
        "10, Rank X",
        "11, Rank 11"
    })
    void rankLabels(int rank, String label) {
        assertEquals(label, RankTable.rankLabel(rank));
    }
}
