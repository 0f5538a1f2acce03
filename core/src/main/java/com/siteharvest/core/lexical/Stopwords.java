package com.siteharvest.core.lexical;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/** 불용어 집합. 조회는 대소문자를 가리지 않는다. */
public final class Stopwords {

    static final String ENGLISH_RESOURCE = "/com/siteharvest/core/lexical/stopwords-en.txt";

    private final Set<String> words;

    private Stopwords(Set<String> words) {
        this.words = Set.copyOf(words);
    }

    public static Stopwords of(Collection<String> words) {
        Set<String> out = new HashSet<>();
        for (String w : Objects.requireNonNull(words, "words")) {
            if (w != null && !w.isBlank()) out.add(w.trim().toLowerCase(Locale.ROOT));
        }
        return new Stopwords(out);
    }

    /** 내장 영어 목록 */
    public static Stopwords english() throws IOException {
        try (InputStream in = Stopwords.class.getResourceAsStream(ENGLISH_RESOURCE)) {
            if (in == null) throw new IOException("stopword resource missing: " + ENGLISH_RESOURCE);
            return read(in);
        }
    }

    /** 한 줄에 한 단어, '#' 으로 시작하는 줄은 주석 */
    public static Stopwords load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }

    private static Stopwords read(InputStream in) throws IOException {
        Set<String> out = new HashSet<>();
        try (BufferedReader r = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = r.readLine()) != null) {
                String w = line.trim();
                if (w.isEmpty() || w.startsWith("#")) continue;
                out.add(w.toLowerCase(Locale.ROOT));
            }
        }
        return new Stopwords(out);
    }

    public boolean contains(String word) {
        return word != null && words.contains(word.toLowerCase(Locale.ROOT));
    }

    public int size() { return words.size(); }
}
