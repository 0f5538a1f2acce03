package com.siteharvest.core.lexical;

import java.util.List;

/** 토큰열 전체에 품사를 붙인다. 입력과 같은 길이/순서로 돌려준다. */
@FunctionalInterface
public interface PosTagger {
    List<TaggedToken> tag(List<String> tokens);
}
