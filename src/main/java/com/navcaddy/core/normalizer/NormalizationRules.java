package com.navcaddy.core.normalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered rewrite tables used by {@link InputNormalizer}. Built once when the class loads.
 * <p>
 * Within each multi-word table the longest phrase comes first, so "one hundred fifty" wins over "one fifty".
 */
public final class NormalizationRules {

    /** Fixed-length mask so masking already-masked text is a no-op. */
    public static final String PROFANITY_MASK = "****";

    private static final String[] UNITS =
            {"one", "two", "three", "four", "five", "six", "seven", "eight", "nine"};
    private static final String[] TEENS =
            {"ten", "eleven", "twelve", "thirteen", "fourteen", "fifteen", "sixteen", "seventeen", "eighteen",
             "nineteen"};
    private static final String[] TENS =
            {"twenty", "thirty", "forty", "fifty", "sixty", "seventy", "eighty", "ninety"};

    public static final List<NormalizationRule> PROFANITY = List.of(
            "fuck", "fucking", "shit", "damn", "hell", "ass", "bitch", "crap", "piss", "bastard", "cock", "dick")
            .stream()
            .map(word -> NormalizationRule.phrase(word, PROFANITY_MASK, ModificationType.PROFANITY))
            .toList();

    public static final List<NormalizationRule> COMPOUND_NUMBERS = longestFirst(compoundNumbers(),
            ModificationType.NUMBER);

    public static final List<NormalizationRule> SLANG = buildSlang();

    public static final List<NormalizationRule> NUMBER_WORDS = longestFirst(numberWords(), ModificationType.NUMBER);

    private NormalizationRules() {}

    private static Map<String, String> compoundNumbers() {
        Map<String, String> phrases = new LinkedHashMap<>();
        // "one hundred fifty", "one hundred and fifty", "one fifty", "one fifty five"
        for (int t = 0; t < TENS.length; t++) {
            int tens = (t + 2) * 10;
            phrases.put("one hundred " + TENS[t], String.valueOf(100 + tens));
            phrases.put("one hundred and " + TENS[t], String.valueOf(100 + tens));
            phrases.put("one " + TENS[t], String.valueOf(100 + tens));
            for (int u = 0; u < UNITS.length; u++) {
                String value = String.valueOf(tens + u + 1);
                phrases.put(TENS[t] + " " + UNITS[u], value);
                phrases.put("one hundred " + TENS[t] + " " + UNITS[u], "1" + value);
                phrases.put("one hundred and " + TENS[t] + " " + UNITS[u], "1" + value);
                phrases.put("one " + TENS[t] + " " + UNITS[u], "1" + value);
            }
        }
        for (int i = 0; i < TEENS.length; i++) {
            phrases.put("one hundred " + TEENS[i], String.valueOf(110 + i));
        }
        phrases.put("one ten", "110");
        phrases.put("two hundred", "200");
        phrases.put("one hundred", "100");

        // spoken club names
        for (int n = 3; n <= 9; n++) {
            phrases.put(UNITS[n - 1] + " iron", n + "-iron");
        }
        for (int n : new int[]{3, 5, 7}) {
            phrases.put(UNITS[n - 1] + " wood", n + "-wood");
        }
        for (int n = 2; n <= 5; n++) {
            phrases.put(UNITS[n - 1] + " hybrid", n + "-hybrid");
        }
        return phrases;
    }

    private static List<NormalizationRule> buildSlang() {
        Map<String, String> phrases = new LinkedHashMap<>();
        for (int n = 3; n <= 9; n++) {
            phrases.put(n + "i", n + "-iron");
        }
        phrases.put("pw", "pitching wedge");
        phrases.put("gw", "gap wedge");
        phrases.put("aw", "approach wedge");
        phrases.put("sw", "sand wedge");
        phrases.put("lw", "lob wedge");
        phrases.put("3w", "3-wood");
        phrases.put("5w", "5-wood");
        phrases.put("7w", "7-wood");
        for (int n = 2; n <= 5; n++) {
            phrases.put(n + "h", n + "-hybrid");
        }
        phrases.put("dance floor", "green");
        phrases.put("putting surface", "green");
        phrases.put("tin cup", "hole");
        phrases.put("fairway metal", "fairway wood");
        phrases.put("big stick", "driver");
        phrases.put("big dog", "driver");
        phrases.put("flat stick", "putter");
        phrases.put("sticks", "clubs");
        phrases.put("stick", "club");

        List<NormalizationRule> rules = new ArrayList<>(longestFirst(phrases, ModificationType.SLANG));
        // "7 iron" and "7 wood" written with digits
        rules.add(NormalizationRule.regex("\\b([3-9])\\s+iron\\b", "$1-iron", ModificationType.SLANG));
        rules.add(NormalizationRule.regex("\\b([357])\\s+wood\\b", "$1-wood", ModificationType.SLANG));
        // a lone "d" is the driver, but not "I'd" or "3-d"
        rules.add(NormalizationRule.regex("(?<![\\w'\\-])d(?![\\w'\\-])", "driver", ModificationType.SLANG));
        return List.copyOf(rules);
    }

    private static Map<String, String> numberWords() {
        Map<String, String> words = new LinkedHashMap<>();
        for (int i = 0; i < UNITS.length; i++) {
            words.put(UNITS[i], String.valueOf(i + 1));
        }
        for (int i = 0; i < TEENS.length; i++) {
            words.put(TEENS[i], String.valueOf(10 + i));
        }
        for (int i = 0; i < TENS.length; i++) {
            words.put(TENS[i], String.valueOf((i + 2) * 10));
        }
        words.put("hundred and", "100");
        words.put("hundred", "100");
        return words;
    }

    private static List<NormalizationRule> longestFirst(Map<String, String> phrases, ModificationType type) {
        return phrases.entrySet().stream()
                .sorted(Comparator.comparingInt((Map.Entry<String, String> e) -> e.getKey().length()).reversed())
                .map(e -> NormalizationRule.phrase(e.getKey(), e.getValue(), type))
                .toList();
    }
}
