package com.siteharvest.core.lexical;

/** 품사 태그가 붙은 토큰. tag 는 Penn Treebank 표기(NN, NNS, VB, VBD ...) */
public record TaggedToken(String word, String tag) {}
