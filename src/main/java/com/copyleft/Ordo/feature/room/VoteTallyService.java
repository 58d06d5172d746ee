package com.copyleft.Ordo.feature.room;

import com.copyleft.Ordo.domain.vo.TallyEntry;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 순위 투표 집계.
 *
 * <p>길이 K인 투표에서 i번째(0부터) 항목은 K - i점을 받는다. 점수 내림차순으로 정렬하고,
 * 동점이면 집계 중 먼저 등장한 항목이 앞선다. 투표가 하나도 없으면 모든 항목이 0점이고
 * 정렬 기준 순서(canonical)를 따른다.
 */
@Service
public class VoteTallyService {

    public List<TallyEntry> tally(List<String> canonicalOptions, List<List<String>> ballots) {
        Map<String, Integer> scores = new LinkedHashMap<>();

        for (List<String> ballot : ballots) {
            int k = ballot.size();
            for (int i = 0; i < k; i++) {
                scores.merge(ballot.get(i), k - i, Integer::sum);
            }
        }

        // 한 번도 등장하지 않은 항목 (투표 0건)
        for (String option : canonicalOptions) {
            scores.putIfAbsent(option, 0);
        }

        // 순서 있는 스트림의 sorted는 안정 정렬
        return scores.entrySet().stream()
                .map(entry -> new TallyEntry(entry.getKey(), entry.getValue()))
                .sorted(Comparator.comparingInt(TallyEntry::score).reversed())
                .toList();
    }
}
