package com.siteharvest.core.lexical;

/** 단어의 기본형. tag 는 힌트이며 모르면 그대로 단어를 돌려줘도 된다. */
@FunctionalInterface
public interface Lemmatizer {
    String lemma(String word, String tag);
}
