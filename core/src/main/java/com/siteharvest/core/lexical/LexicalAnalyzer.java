package com.siteharvest.core.lexical;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * 누적 텍스트 전체에 대한 어휘 분석(크롤 종료 후 1회).
 *
 * <ul>
 *   <li>어휘: 소문자화 → 토큰화 → 필터 → 집합</li>
 *   <li>명사/동사: 원래 대소문자로 토큰화/태깅 → 소문자 표제어 →
 *       VB* 면 동사 후보, 아니고 NN* 면 명사 후보(불용어 제외) → 필터 → 집계</li>
 * </ul>
 *
 * 후보는 집합이 아니라 등장한 횟수만큼 쌓인 시퀀스로 필터에 넘긴다.
 * 그래서 빈도는 실제 등장 횟수이고, 명사/동사 집합은 빈도 맵의 키와 같다.
 */
public final class LexicalAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(LexicalAnalyzer.class);

    private final Tokenizer tokenizer;
    private final PosTagger tagger;
    private final Lemmatizer lemmatizer;
    private final Stopwords stopwords;
    private final LexicalFilter filter;

    public LexicalAnalyzer(Tokenizer tokenizer, PosTagger tagger, Lemmatizer lemmatizer,
                           Stopwords stopwords, LexicalFilter filter) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.tagger = Objects.requireNonNull(tagger, "tagger");
        this.lemmatizer = Objects.requireNonNull(lemmatizer, "lemmatizer");
        this.stopwords = Objects.requireNonNull(stopwords, "stopwords");
        this.filter = Objects.requireNonNull(filter, "filter");
    }

    public LexicalProfile analyze(String text) {
        if (text == null || text.isBlank()) return LexicalProfile.empty();

        TreeSet<String> vocabulary = vocabulary(text);

        List<String> verbCandidates = new ArrayList<>();
        List<String> nounCandidates = new ArrayList<>();
        List<String> tokens = tokenizer.tokenize(text);
        for (TaggedToken tt : tagger.tag(tokens)) {
            String tag = tt.tag() == null ? "" : tt.tag();
            String lemma = lemmatizer.lemma(tt.word().toLowerCase(Locale.ROOT), tag);
            if (lemma == null || stopwords.contains(lemma)) continue;

            if (tag.startsWith("VB")) verbCandidates.add(lemma);
            else if (tag.startsWith("NN")) nounCandidates.add(lemma);
        }

        Map<String, Integer> verbFreq = count(filter.filter(verbCandidates));
        Map<String, Integer> nounFreq = count(filter.filter(nounCandidates));

        LOG.debug("Lexical analysis: tokens={}, vocabulary={}, nouns={}, verbs={}",
                tokens.size(), vocabulary.size(), nounFreq.size(), verbFreq.size());

        return new LexicalProfile(
                vocabulary,
                new TreeSet<>(nounFreq.keySet()),
                new TreeSet<>(verbFreq.keySet()),
                nounFreq,
                verbFreq);
    }

    /** 대소문자 정보 없는 고유 단어 집합 */
    public TreeSet<String> vocabulary(String text) {
        List<String> tokens = tokenizer.tokenize(text.toLowerCase(Locale.ROOT));
        return new TreeSet<>(filter.filter(tokens));
    }

    private static Map<String, Integer> count(List<String> words) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (String w : words) out.merge(w, 1, Integer::sum);
        return out;
    }
}
