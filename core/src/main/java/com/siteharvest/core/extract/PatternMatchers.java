package com.siteharvest.core.extract;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 고정 패턴 매처 모음 (상태 없음, 스레드 세이프).
 * - 전화번호: (ddd) ddd-dddd / ddd-ddd-dddd 및 공백/하이픈 변형. 형태만 본다(번호 검증 X)
 * - 우편번호: 5자리, 선택적으로 -4자리 (확장형을 우선 매칭)
 * - 치수 노이즈: 숫자 + px|em|pt|rem 으로 시작하는 토큰
 * - 해시 노이즈: 소문자 16진수 32~64자로 시작하는 토큰
 */
public final class PatternMatchers {

    public static final Pattern PHONE = Pattern.compile("\\(?\\d{3}\\)? ?-?\\d{3}-? *-?\\d{4}");
    public static final Pattern ZIP = Pattern.compile("\\d{5}(?:-\\d{4})?");
    public static final Pattern DIMENSION = Pattern.compile("\\d+(?:px|em|pt|rem)");
    public static final Pattern HASH = Pattern.compile("[a-f0-9]{32,64}");

    /** 중복 없이, 처음 등장한 순서대로 */
    public Set<String> findPhoneNumbers(String text) {
        return findAll(PHONE, text);
    }

    public Set<String> findZipCodes(String text) {
        return findAll(ZIP, text);
    }

    public boolean isDimensionNoise(String token) {
        return token != null && DIMENSION.matcher(token).lookingAt();
    }

    public boolean isHashNoise(String token) {
        return token != null && HASH.matcher(token).lookingAt();
    }

    private static Set<String> findAll(Pattern p, String text) {
        Set<String> out = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) return out;
        Matcher m = p.matcher(text);
        while (m.find()) out.add(m.group());
        return out;
    }
}
