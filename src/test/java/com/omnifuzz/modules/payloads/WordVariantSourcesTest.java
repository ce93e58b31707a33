package com.omnifuzz.modules.payloads;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.omnifuzz.modules.payloads.NumberRangeSourceTest.payloads;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Case modification and character substitution, which derive several payloads
 * from each base word.
 */
class WordVariantSourcesTest {

    @Test
    void case_modification_keeps_distinct_variants_in_order() {
        CaseModificationSource source = new CaseModificationSource("c", List.of("admin", "Root"));

        assertThat(payloads(source)).containsExactly("admin", "ADMIN", "Admin", "Root", "root", "ROOT");
    }

    @Test
    void case_modification_of_empty_word_yields_one_payload() {
        assertThat(payloads(new CaseModificationSource("c", List.of("")))).containsExactly("");
    }

    @Test
    void character_substitution_counts_in_binary_left_to_right() {
        CharacterSubstitutionSource source = new CharacterSubstitutionSource("s", List.of("test"));

        assertThat(source.size()).isEqualTo(16);
        assertThat(source.payloadAt(0)).isEqualTo("test");
        assertThat(source.payloadAt(1)).isEqualTo("7est");
        assertThat(source.payloadAt(2)).isEqualTo("t3st");
        assertThat(source.payloadAt(15)).isEqualTo("7357");
    }

    @Test
    void character_substitution_spans_several_words() {
        CharacterSubstitutionSource source = new CharacterSubstitutionSource("s", List.of("ab", "xy"));

        assertThat(payloads(source)).containsExactly("ab", "4b", "xy");
    }

    @Test
    void character_substitution_uses_custom_table() {
        CharacterSubstitutionSource source =
                new CharacterSubstitutionSource("s", List.of("ll"), Map.of('l', '|'));

        assertThat(payloads(source)).containsExactly("ll", "|l", "l|", "||");
    }
}
