package com.siteharvest.core.nlp;

import com.siteharvest.core.lexical.Tokenizer;
import edu.stanford.nlp.ling.CoreLabel;
import edu.stanford.nlp.process.CoreLabelTokenFactory;
import edu.stanford.nlp.process.PTBTokenizer;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/** Stanford PTB 토크나이저. 괄호/따옴표 치환(-LRB- 등)은 끈다. */
public final class CoreNlpTokenizer implements Tokenizer {

    static final String OPTIONS = "invertible=false,ptb3Escaping=false,untokenizable=noneKeep";

    @Override
    public List<String> tokenize(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isEmpty()) return out;

        PTBTokenizer<CoreLabel> tok =
                new PTBTokenizer<>(new StringReader(text), new CoreLabelTokenFactory(), OPTIONS);
        while (tok.hasNext()) {
            out.add(tok.next().word());
        }
        return out;
    }
}
