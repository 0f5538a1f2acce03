package com.siteharvest.core.lexical;

import java.util.List;

/** 텍스트 → 토큰 */
@FunctionalInterface
public interface Tokenizer {
    List<String> tokenize(String text);
}
