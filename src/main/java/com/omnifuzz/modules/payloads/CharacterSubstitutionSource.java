package com.omnifuzz.modules.payloads;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Leet-style variants of each base word. A word with {@code k} substitutable
 * characters yields {@code 2^k} variants in binary-counter order: variant 0 is
 * the word itself, bit {@code i} substitutes the {@code i}-th substitutable
 * character (left to right).
 */
public class CharacterSubstitutionSource extends AbstractPayloadSource {

    public static final Map<Character, Character> DEFAULT_SUBSTITUTIONS;

    static {
        Map<Character, Character> m = new LinkedHashMap<>();
        m.put('a', '4');
        m.put('e', '3');
        m.put('i', '1');
        m.put('o', '0');
        m.put('s', '5');
        m.put('t', '7');
        DEFAULT_SUBSTITUTIONS = Collections.unmodifiableMap(m);
    }

    private static final int MAX_SUBSTITUTABLE = 62;

    private final List<String> words;
    private final Map<Character, Character> substitutions;
    // offsets[i] = index of the first variant of words[i]; offsets[n] = total
    private final long[] offsets;

    public CharacterSubstitutionSource(String id, List<String> words, Map<Character, Character> substitutions) {
        super(id, PayloadSourceKind.CHARACTER_SUBSTITUTION);
        this.words = List.copyOf(words);
        this.substitutions = Map.copyOf(substitutions);
        this.offsets = new long[this.words.size() + 1];
        for (int i = 0; i < this.words.size(); i++) {
            int k = substitutableCount(this.words.get(i));
            if (k > MAX_SUBSTITUTABLE) {
                throw new IllegalArgumentException("Word has too many substitutable characters: " + this.words.get(i));
            }
            try {
                offsets[i + 1] = Math.addExact(offsets[i], 1L << k);
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("Character substitution space is too large", e);
            }
        }
    }

    public CharacterSubstitutionSource(String id, List<String> words) {
        this(id, words, DEFAULT_SUBSTITUTIONS);
    }

    private int substitutableCount(String word) {
        int k = 0;
        for (int i = 0; i < word.length(); i++) {
            if (substitutions.containsKey(word.charAt(i))) k++;
        }
        return k;
    }

    @Override
    public long size() {
        return offsets[words.size()];
    }

    @Override
    protected String compute(long index) {
        int found = Arrays.binarySearch(offsets, index);
        // offsets are strictly increasing, every word has at least one variant
        int wordIndex = found >= 0 ? found : -found - 2;
        long mask = index - offsets[wordIndex];
        char[] chars = words.get(wordIndex).toCharArray();
        int bit = 0;
        for (int i = 0; i < chars.length; i++) {
            Character replacement = substitutions.get(chars[i]);
            if (replacement == null) continue;
            if ((mask & (1L << bit)) != 0) {
                chars[i] = replacement;
            }
            bit++;
        }
        return new String(chars);
    }
}
