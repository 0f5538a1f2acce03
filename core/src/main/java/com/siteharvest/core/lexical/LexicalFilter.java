package com.siteharvest.core.lexical;

import com.siteharvest.core.extract.PatternMatchers;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 내용어가 아닌 토큰 제거. 순서/중복은 유지한다(중복 제거는 호출자 몫).
 * 제거 대상: 불용어, 치수/해시 노이즈, 구두점만으로 된 토큰, 숫자만으로 된 토큰,
 * http 또는 // 로 시작하는 토큰, '=' 가 들어간 토큰, 빈 토큰.
 * 출력에 다시 적용해도 결과가 같다.
 */
public final class LexicalFilter {

    static final String PUNCTUATION = "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~";

    private final Stopwords stopwords;
    private final PatternMatchers patterns;

    public LexicalFilter(Stopwords stopwords, PatternMatchers patterns) {
        this.stopwords = Objects.requireNonNull(stopwords, "stopwords");
        this.patterns = Objects.requireNonNull(patterns, "patterns");
    }

    public List<String> filter(List<String> tokens) {
        List<String> out = new ArrayList<>(tokens.size());
        for (String t : tokens) {
            if (keep(t)) out.add(t);
        }
        return out;
    }

    public boolean keep(String token) {
        if (token == null || token.isEmpty()) return false;
        if (stopwords.contains(token)) return false;
        if (patterns.isDimensionNoise(token) || patterns.isHashNoise(token)) return false;
        if (isPunctuation(token) || isNumeric(token)) return false;

        String lower = token.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http") || lower.startsWith("//")) return false;
        return token.indexOf('=') < 0;
    }

    static boolean isPunctuation(String token) {
        for (int i = 0; i < token.length(); i++) {
            if (PUNCTUATION.indexOf(token.charAt(i)) < 0) return false;
        }
        return true;
    }

    static boolean isNumeric(String token) {
        return token.codePoints().allMatch(cp -> {
            int type = Character.getType(cp);
            return type == Character.DECIMAL_DIGIT_NUMBER
                    || type == Character.LETTER_NUMBER
                    || type == Character.OTHER_NUMBER;
        });
    }
}
