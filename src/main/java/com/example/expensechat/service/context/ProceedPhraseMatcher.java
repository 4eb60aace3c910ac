package com.example.expensechat.service.context;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Nhận diện câu đồng ý / từ chối ngắn ("yes", "go ahead", "add it now", "nope"...).
 * So khớp mờ: bỏ dấu câu, bỏ từ đệm, chấp nhận lệch 1 ký tự với cụm từ dài.
 */
@Component
public class ProceedPhraseMatcher {

    private static final Set<String> PROCEED_PHRASES = Set.of(
            "yes", "y", "yeah", "yep", "yup", "ok", "okay", "k", "sure", "go ahead", "go for it",
            "create it", "add it", "add it now", "do it", "confirm", "confirmed", "proceed",
            "please do", "sounds good", "of course", "absolutely", "create", "yes create it");

    private static final Set<String> DECLINE_PHRASES = Set.of(
            "no", "n", "nope", "nah", "cancel", "never mind", "nevermind", "dont", "don t", "do not",
            "stop", "forget it", "no thanks", "skip");

    private static final Set<String> FILLERS = Set.of("please", "pls", "thanks", "thank", "you", "now", "then", "just");

    private static final Set<String> PROCEED_WORDS = Set.of(
            "yes", "yeah", "yep", "yup", "ok", "okay", "sure", "go", "ahead", "do", "it", "create", "add",
            "confirm", "proceed", "please", "that", "sounds", "good");
    private static final Set<String> PROCEED_ANCHORS = Set.of(
            "yes", "yeah", "yep", "yup", "ok", "okay", "sure", "ahead", "create", "add", "confirm", "proceed");

    public boolean isProceed(String text) {
        String core = core(text);
        if (core.isEmpty()) return false;
        if (PROCEED_PHRASES.contains(core) || fuzzy(core, PROCEED_PHRASES)) return true;
        List<String> tokens = Arrays.asList(core.split(" "));
        return tokens.stream().allMatch(PROCEED_WORDS::contains)
                && tokens.stream().anyMatch(PROCEED_ANCHORS::contains);
    }

    public boolean isDecline(String text) {
        String core = core(text);
        return !core.isEmpty() && (DECLINE_PHRASES.contains(core) || fuzzy(core, DECLINE_PHRASES));
    }

    static String normalize(String text) {
        if (text == null) return "";
        return text.toLowerCase(Locale.ROOT)
                .replaceAll("[^\\p{L}\\p{Nd}]+", " ")
                .trim()
                .replaceAll("\\s+", " ");
    }

    private static String core(String text) {
        return Arrays.stream(normalize(text).split(" "))
                .filter(t -> !t.isEmpty() && !FILLERS.contains(t))
                .collect(Collectors.joining(" "));
    }

    private static boolean fuzzy(String core, Set<String> phrases) {
        return phrases.stream().anyMatch(p -> p.length() >= 4 && distance(core, p) <= 1);
    }

    /** Levenshtein. */
    static int distance(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] cur = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) prev[j] = j;
        for (int i = 1; i <= a.length(); i++) {
            cur[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                cur[j] = Math.min(Math.min(cur[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] t = prev;
            prev = cur;
            cur = t;
        }
        return prev[b.length()];
    }
}
