package com.omnifuzz.modules.payloads;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * For each base word: the distinct variants among as-is, lower case,
 * upper case and capitalised, in that order.
 */
public class CaseModificationSource extends AbstractPayloadSource {

    private final List<String> variants;

    public CaseModificationSource(String id, List<String> words) {
        super(id, PayloadSourceKind.CASE_MODIFICATION);
        List<String> all = new ArrayList<>(words.size() * 4);
        for (String word : words) {
            Set<String> forWord = new LinkedHashSet<>();
            forWord.add(word);
            forWord.add(word.toLowerCase(Locale.ROOT));
            forWord.add(word.toUpperCase(Locale.ROOT));
            forWord.add(capitalise(word));
            all.addAll(forWord);
        }
        this.variants = List.copyOf(all);
    }

    static String capitalise(String word) {
        if (word.isEmpty()) return word;
        return word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT);
    }

    @Override
    public long size() {
        return variants.size();
    }

    @Override
    protected String compute(long index) {
        return variants.get((int) index);
    }
}
