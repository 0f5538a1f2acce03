package com.siteharvest.core.nlp;

import com.siteharvest.core.lexical.PosTagger;
import com.siteharvest.core.lexical.TaggedToken;
import edu.stanford.nlp.ling.HasWord;
import edu.stanford.nlp.ling.TaggedWord;
import edu.stanford.nlp.ling.Word;
import edu.stanford.nlp.tagger.maxent.MaxentTagger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Stanford MaxentTagger 어댑터(Penn Treebank 태그).
 * 문장 끝 토큰(. ! ?)에서 끊어 문장 단위로 태깅한 뒤 원래 순서대로 이어 붙인다.
 */
public final class CoreNlpPosTagger implements PosTagger {

    private static final Logger LOG = LoggerFactory.getLogger(CoreNlpPosTagger.class);
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");

    private final MaxentTagger tagger;

    /** @param model 클래스패스 또는 파일 경로 */
    public CoreNlpPosTagger(String model) {
        Objects.requireNonNull(model, "model");
        long t0 = System.nanoTime();
        this.tagger = new MaxentTagger(model);
        LOG.info("POS model loaded: {} ({} ms)", model, (System.nanoTime() - t0) / 1_000_000);
    }

    @Override
    public List<TaggedToken> tag(List<String> tokens) {
        List<TaggedToken> out = new ArrayList<>(tokens.size());
        List<HasWord> sentence = new ArrayList<>();
        for (String t : tokens) {
            sentence.add(new Word(t));
            if (SENTENCE_END.matcher(t).matches()) {
                flush(sentence, out);
            }
        }
        flush(sentence, out);
        return out;
    }

    private void flush(List<HasWord> sentence, List<TaggedToken> out) {
        if (sentence.isEmpty()) return;
        List<TaggedWord> tagged = tagger.tagSentence(sentence);
        for (TaggedWord tw : tagged) {
            out.add(new TaggedToken(tw.word(), tw.tag()));
        }
        sentence.clear();
    }
}
