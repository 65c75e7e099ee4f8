package com.faqchat.util;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Case-folds, strips punctuation and tokenizes text for fuzzy matching.
 *
 * <p>Tokens are split on whitespace and on script changes (Latin/digits, Han, Hiragana, Katakana,
 * Hangul). Runs of CJK characters carry no word boundaries, so they are indexed as overlapping
 * character bigrams; a single-character run is kept as is.</p>
 */
@Component
public class TextNormalizer {

    private static final Pattern PUNCTUATION = Pattern.compile("[\\p{P}\\p{S}]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final int PROLONGED_SOUND_MARK = 0x30FC;

    enum Script { WORD, HAN, HIRAGANA, KATAKANA, HANGUL }

    public NormalizedText normalize(String text) {
        if (text == null || text.isBlank()) {
            return NormalizedText.EMPTY;
        }

        String folded = Normalizer.normalize(text, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        String stripped = PUNCTUATION.matcher(folded).replaceAll(" ");
        String collapsed = WHITESPACE.matcher(stripped).replaceAll(" ").trim();

        if (collapsed.isEmpty()) {
            return NormalizedText.EMPTY;
        }

        List<String> tokens = new ArrayList<>();
        for (String word : collapsed.split(" ")) {
            splitByScript(word, tokens);
        }
        return new NormalizedText(collapsed, List.copyOf(tokens));
    }

    public List<String> tokenize(String text) {
        return normalize(text).tokens();
    }

    private void splitByScript(String word, List<String> out) {
        int start = 0;
        Script runScript = null;

        for (int i = 0; i < word.length(); ) {
            int cp = word.codePointAt(i);
            Script script = scriptOf(cp);
            if (runScript != null && script != runScript) {
                emitRun(word.substring(start, i), runScript, out);
                start = i;
            }
            runScript = script;
            i += Character.charCount(cp);
        }
        if (runScript != null) {
            emitRun(word.substring(start), runScript, out);
        }
    }

    private void emitRun(String run, Script script, List<String> out) {
        if (script == Script.WORD) {
            out.add(run);
            return;
        }

        int[] cps = run.codePoints().toArray();
        if (cps.length == 1) {
            out.add(run);
            return;
        }
        for (int i = 0; i < cps.length - 1; i++) {
            out.add(new String(cps, i, 2));
        }
    }

    private Script scriptOf(int cp) {
        if (cp == PROLONGED_SOUND_MARK) {
            return Script.KATAKANA;
        }
        Character.UnicodeScript script = Character.UnicodeScript.of(cp);
        switch (script) {
            case HAN:
                return Script.HAN;
            case HIRAGANA:
                return Script.HIRAGANA;
            case KATAKANA:
                return Script.KATAKANA;
            case HANGUL:
                return Script.HANGUL;
            default:
                return Script.WORD;
        }
    }

    /**
     * Normalized form of a text: the collapsed string and its tokens in order of appearance.
     */
    public record NormalizedText(String text, List<String> tokens) {

        static final NormalizedText EMPTY = new NormalizedText("", List.of());

        public boolean isEmpty() {
            return text.isEmpty();
        }

        public Set<String> tokenSet() {
            return new LinkedHashSet<>(tokens);
        }
    }
}
