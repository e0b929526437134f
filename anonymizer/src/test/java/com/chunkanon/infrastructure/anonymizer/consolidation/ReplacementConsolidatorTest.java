package com.chunkanon.infrastructure.anonymizer.consolidation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class ReplacementConsolidatorTest {

    private final ReplacementConsolidator consolidator = new ReplacementConsolidator();

    private static Map<String, String> ordered(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return map;
    }

    @Test
    @DisplayName("first-wins: 먼저 나온 샤드의 값 유지")
    void first_wins() {
        Map<String, String> result = consolidator.consolidate(List.of(
                ordered("A", "X"),
                ordered("A", "Y", "B", "Z")));

        assertThat(result).containsExactly(entry("A", "X"), entry("B", "Z"));
    }

    @Test
    @DisplayName("키 순서는 샤드 순서상 처음 등장한 순서")
    void first_seen_order() {
        Map<String, String> result = consolidator.consolidate(List.of(
                ordered("C", "1", "A", "2"),
                ordered("B", "3", "C", "4"),
                ordered("D", "5")));

        assertThat(result).containsExactly(entry("C", "1"), entry("A", "2"), entry("B", "3"), entry("D", "5"));
    }

    @Test
    @DisplayName("빈 맵과 null 은 무시")
    void empty_and_null_maps() {
        assertThat(consolidator.consolidate(List.of())).isEmpty();
        assertThat(consolidator.consolidate(Arrays.asList(Map.of(), null, ordered("A", "B"))))
                .containsExactly(entry("A", "B"));
    }
}
