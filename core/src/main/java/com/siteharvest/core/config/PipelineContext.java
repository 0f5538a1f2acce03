package com.siteharvest.core.config;

import com.siteharvest.core.crawler.DomainScope;
import com.siteharvest.core.extract.ImageExtractor;
import com.siteharvest.core.extract.LinkExtractor;
import com.siteharvest.core.extract.PageExtractor;
import com.siteharvest.core.extract.PatternMatchers;
import com.siteharvest.core.lexical.Lemmatizer;
import com.siteharvest.core.lexical.LexicalAnalyzer;
import com.siteharvest.core.lexical.LexicalFilter;
import com.siteharvest.core.lexical.PosTagger;
import com.siteharvest.core.lexical.Stopwords;
import com.siteharvest.core.lexical.Tokenizer;
import com.siteharvest.core.model.CrawlConfig;
import com.siteharvest.core.nlp.CoreNlpLemmatizer;
import com.siteharvest.core.nlp.CoreNlpPosTagger;
import com.siteharvest.core.nlp.CoreNlpTokenizer;

import java.io.IOException;
import java.util.Objects;

/**
 * 파이프라인 공유 자원(컴파일된 패턴, 불용어, 토크나이저/태거/표제어기).
 * 시작 시 한 번 만들어 각 컴포넌트에 넘긴다.
 */
public final class PipelineContext {

    private final PatternMatchers patterns;
    private final Stopwords stopwords;
    private final LexicalFilter filter;
    private final Tokenizer tokenizer;
    private final PosTagger tagger;
    private final Lemmatizer lemmatizer;

    public PipelineContext(PatternMatchers patterns, Stopwords stopwords,
                           Tokenizer tokenizer, PosTagger tagger, Lemmatizer lemmatizer) {
        this.patterns = Objects.requireNonNull(patterns, "patterns");
        this.stopwords = Objects.requireNonNull(stopwords, "stopwords");
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.tagger = Objects.requireNonNull(tagger, "tagger");
        this.lemmatizer = Objects.requireNonNull(lemmatizer, "lemmatizer");
        this.filter = new LexicalFilter(stopwords, patterns);
    }

    /** 운영 구성: 내장(또는 설정 파일) 불용어 + Stanford CoreNLP */
    public static PipelineContext standard(CrawlConfig cfg) throws IOException {
        Stopwords sw = (cfg.getStopwordsFile() != null)
                ? Stopwords.load(cfg.getStopwordsFile())
                : Stopwords.english();
        return new PipelineContext(
                new PatternMatchers(),
                sw,
                new CoreNlpTokenizer(),
                new CoreNlpPosTagger(cfg.getTaggerModel()),
                new CoreNlpLemmatizer());
    }

    public PageExtractor pageExtractor(CrawlConfig cfg) {
        DomainScope scope = scope(cfg);
        return new PageExtractor(new LinkExtractor(scope), new ImageExtractor(cfg.getBaseUrl()), patterns);
    }

    public DomainScope scope(CrawlConfig cfg) {
        return DomainScope.of(cfg.getDomain(), cfg.getMatchMode());
    }

    public LexicalAnalyzer lexicalAnalyzer() {
        return new LexicalAnalyzer(tokenizer, tagger, lemmatizer, stopwords, filter);
    }

    public PatternMatchers patterns() { return patterns; }
    public Stopwords stopwords() { return stopwords; }
    public LexicalFilter filter() { return filter; }
}
