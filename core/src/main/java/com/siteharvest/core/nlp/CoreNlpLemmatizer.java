package com.siteharvest.core.nlp;

import com.siteharvest.core.lexical.Lemmatizer;
import edu.stanford.nlp.process.Morphology;

/** Stanford Morphology 기반 표제어. Morphology 는 스레드 세이프하지 않으므로 동기화. */
public final class CoreNlpLemmatizer implements Lemmatizer {

    private final Morphology morphology = new Morphology();

    @Override
    public synchronized String lemma(String word, String tag) {
        if (word == null || word.isEmpty()) return word;
        String lemma = morphology.lemma(word, tag == null ? "" : tag);
        return (lemma == null || lemma.isEmpty()) ? word : lemma;
    }
}
