package com.siteharvest.core.nlp;

import com.siteharvest.core.config.PipelineContext;
import com.siteharvest.core.lexical.LexicalProfile;
import com.siteharvest.core.lexical.TaggedToken;
import com.siteharvest.core.model.CrawlConfig;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/** 실제 CoreNLP 모델을 올리는 스모크 테스트. 태거 로딩은 한 번만. */
class CoreNlpAdaptersTest {

    private static CoreNlpPosTagger tagger;

    @BeforeAll
    static void loadModel() {
        tagger = new CoreNlpPosTagger(CrawlConfig.defaults().getTaggerModel());
    }

    @Test
    @DisplayName("PTB 토큰화: 구두점 분리, 괄호 치환 없음")
    void tokenize_splits_punctuation() {
        CoreNlpTokenizer tok = new CoreNlpTokenizer();
        assertThat(tok.tokenize("Hello, world!")).containsExactly("Hello", ",", "world", "!");
        assertThat(tok.tokenize("(555) call")).startsWith("(");
        assertThat(tok.tokenize("")).isEmpty();
    }

    @Test
    @DisplayName("Morphology 표제어")
    void lemmatize() {
        CoreNlpLemmatizer lem = new CoreNlpLemmatizer();
        assertThat(lem.lemma("visited", "VBD")).isEqualTo("visit");
        assertThat(lem.lemma("pages", "NNS")).isEqualTo("page");
        assertThat(lem.lemma("", "NN")).isEmpty();
    }

    @Test
    @DisplayName("태깅: 동사는 VB*, 명사는 NN*, 토큰 순서 유지")
    void tag_sentence() {
        List<String> tokens = new CoreNlpTokenizer().tokenize("We visited the museum yesterday. It was big.");
        List<TaggedToken> tagged = tagger.tag(tokens);

        assertThat(tagged).extracting(TaggedToken::word).containsExactlyElementsOf(tokens);
        assertThat(tagOf(tagged, "visited")).startsWith("VB");
        assertThat(tagOf(tagged, "museum")).startsWith("NN");
    }

    @Test
    @DisplayName("운영 구성 전체로 짧은 텍스트 분석")
    void standard_context_analyzes_text() throws Exception {
        CrawlConfig cfg = CrawlConfig.defaults().setSeedUrl("https://example.com/");
        PipelineContext ctx = PipelineContext.standard(cfg);

        LexicalProfile p = ctx.lexicalAnalyzer().analyze("The visitors visited the museum pages.");

        assertThat(p.vocabulary()).contains("visitors", "museum").doesNotContain("the", ".");
        assertThat(p.verbs()).contains("visit");
        assertThat(p.nouns()).contains("visitor", "museum", "page");
    }

    private static String tagOf(List<TaggedToken> tagged, String word) {
        return tagged.stream().filter(t -> t.word().equals(word)).findFirst()
                .map(TaggedToken::tag).orElseThrow();
    }
}
