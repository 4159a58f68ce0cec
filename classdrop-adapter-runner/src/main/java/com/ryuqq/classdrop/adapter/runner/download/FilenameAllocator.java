package com.ryuqq.classdrop.adapter.runner.download;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * 배치 내 고유 파일 이름 할당기.
 *
 * <p>같은 이름이 다시 나오면 확장자 앞에 괄호 카운터를 붙입니다.</p>
 * <pre>
 * notes.pdf, notes.pdf, notes.pdf  →  notes.pdf, notes(1).pdf, notes(2).pdf
 * </pre>
 *
 * <p>배치마다 새 인스턴스를 사용합니다. 비교는 대소문자를 구분하지 않습니다.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
final class FilenameAllocator {

    private static final int MAX_NAME_LENGTH = 200;

    private final Set<String> used = new HashSet<>();

    /**
     * 고유 이름 할당.
     *
     * @param name 원하는 파일 이름
     * @return 이 배치에서 아직 쓰이지 않은 이름
     */
    synchronized String allocate(String name) {
        String clean = sanitize(name, "download");
        if (used.add(key(clean))) {
            return clean;
        }

        int dot = clean.lastIndexOf('.');
        String base = dot > 0 ? clean.substring(0, dot) : clean;
        String extension = dot > 0 ? clean.substring(dot) : "";
        for (int counter = 1; ; counter++) {
            String candidate = base + "(" + counter + ")" + extension;
            if (used.add(key(candidate))) {
                return candidate;
            }
        }
    }

    /**
     * 경로 구분자와 예약 문자를 '_'로 치환.
     *
     * @param name 원래 이름
     * @param fallback 결과가 비었을 때 사용할 이름
     * @return 저장 가능한 이름
     */
    static String sanitize(String name, String fallback) {
        if (name == null) {
            return fallback;
        }
        String clean = name.replaceAll("[\\\\/:*?\"<>|\\p{Cntrl}]", "_")
            .replaceAll("\\s+", " ")
            .trim();
        while (clean.startsWith(".")) {
            clean = clean.substring(1);
        }
        if (clean.length() > MAX_NAME_LENGTH) {
            clean = clean.substring(0, MAX_NAME_LENGTH).trim();
        }
        return clean.isEmpty() ? fallback : clean;
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
