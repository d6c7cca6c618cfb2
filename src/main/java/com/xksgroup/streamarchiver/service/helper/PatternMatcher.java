package com.xksgroup.streamarchiver.service.helper;

import com.ibm.icu.text.Transliterator;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Tests text against named rules, looking through the usual tricks used to decorate titles:
 * exotic letter forms, spaced-out letters and stacked combining marks.
 */
public final class PatternMatcher {

    // Merges single letters that are spaced apart ("K A R A O K E")
    private static final Pattern SPACED_LETTERS = Pattern.compile("(?i)(?<=\\b[a-z])\\s+(?=[a-z]\\b)");

    private static final ThreadLocal<Transliterator> TO_ASCII =
            ThreadLocal.withInitial(() -> Transliterator.getInstance("NFKC; Any-Latin; Latin-ASCII"));

    private PatternMatcher() {
    }

    /**
     * Returns the names of every rule whose pattern is found in any normalized form of the text.
     */
    public static Set<String> getPatternMatches(Map<String, Pattern> rules, String text) {
        Set<String> matched = new TreeSet<>();
        if (text == null || text.isEmpty() || rules.isEmpty()) {
            return matched;
        }
        List<String> haystacks = variants(text);
        rules.forEach((name, pattern) -> {
            for (String haystack : haystacks) {
                if (pattern.matcher(haystack).find()) {
                    matched.add(name);
                    return;
                }
            }
        });
        return matched;
    }

    static List<String> variants(String text) {
        String ascii = transliterate(text);
        return List.of(
                text,
                ascii,
                SPACED_LETTERS.matcher(ascii).replaceAll(""),
                stripMarks(text)
        );
    }

    public static String transliterate(String text) {
        return TO_ASCII.get().transliterate(text);
    }

    /**
     * Removes combining and enclosing marks ("zalgo" decoration). Makes no attempt to keep
     * accented letters intact.
     */
    public static String stripMarks(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        text.codePoints()
                .filter(cp -> {
                    int type = Character.getType(cp);
                    return type != Character.NON_SPACING_MARK && type != Character.ENCLOSING_MARK;
                })
                .forEach(sb::appendCodePoint);
        return sb.toString();
    }
}
