package com.example.expensechat.service.format;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Xoá các câu "xác nhận" do model tự viết (successfully added, ✅, has been created...).
 * Chỉ gateway mới được xác nhận một thao tác đã chạy.
 */
@Component
public class ConfirmationScrubber {

    private static final String DONE = "(?:added|created|updated|saved|recorded|inserted|logged|archived|disabled|deleted|removed)";

    private static final List<Pattern> CONFIRMATIONS = List.of(
            Pattern.compile("✅"),
            Pattern.compile("(?i)\\bsuccessfully\\s+" + DONE + "\\b"),
            Pattern.compile("(?i)\\b(?:has|have)\\s+been\\s+(?:successfully\\s+)?" + DONE + "\\b"),
            Pattern.compile("(?i)\\b(?:i've|i\\s+have|i)\\s+(?:just\\s+)?(?:successfully\\s+)?" + DONE + "\\b"),
            Pattern.compile("(?i)\\bis\\s+now\\s+" + DONE + "\\b"),
            Pattern.compile("(?i)\\b" + DONE + "\\s+successfully\\b"));

    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");

    public boolean containsConfirmation(String text) {
        if (text == null) return false;
        return CONFIRMATIONS.stream().anyMatch(p -> p.matcher(text).find());
    }

    /** @return text sau khi bỏ mọi câu mang dạng xác nhận (giữ nguyên cấu trúc dòng) */
    public String scrub(String text) {
        if (text == null || text.isBlank()) return "";
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\\R", -1)) {
            List<String> kept = new ArrayList<>();
            for (String sentence : SENTENCE_END.split(line)) {
                if (!containsConfirmation(sentence)) kept.add(sentence);
            }
            lines.add(String.join(" ", kept).stripTrailing());
        }
        return String.join("\n", lines)
                .replaceAll("\\n{3,}", "\n\n")
                .trim();
    }
}
