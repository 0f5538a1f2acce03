package com.siteharvest.core.lexical;

import java.util.Map;
import java.util.Set;

/**
 * 어휘 분석 결과.
 * nouns/verbs 는 빈도 맵의 키 집합과 같다.
 */
public record LexicalProfile(Set<String> vocabulary,
                             Set<String> nouns,
                             Set<String> verbs,
                             Map<String, Integer> nounFrequencies,
                             Map<String, Integer> verbFrequencies) {

    public static LexicalProfile empty() {
        return new LexicalProfile(Set.of(), Set.of(), Set.of(), Map.of(), Map.of());
    }
}
