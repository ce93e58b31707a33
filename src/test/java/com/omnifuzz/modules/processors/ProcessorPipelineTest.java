package com.omnifuzz.modules.processors;

import com.omnifuzz.model.ConfigurationException;
import com.omnifuzz.model.EncodingException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessorPipelineTest {

    @Test
    void processors_run_in_list_order() throws EncodingException {
        ProcessorPipeline pipeline = new ProcessorPipeline(List.of(
                PayloadProcessor.prefix("x"),
                PayloadProcessor.of(ProcessorKind.UPPERCASE),
                PayloadProcessor.suffix("y"),
                PayloadProcessor.of(ProcessorKind.REVERSE)));

        assertThat(pipeline.process("ab")).isEqualTo("yBAX");
    }

    @Test
    void disabled_processors_are_skipped() throws EncodingException {
        ProcessorPipeline pipeline = new ProcessorPipeline(List.of(
                PayloadProcessor.of(ProcessorKind.BASE64_ENCODE).withEnabled(false),
                PayloadProcessor.of(ProcessorKind.URL_ENCODE)));

        assertThat(pipeline.process("a b")).isEqualTo("a%20b");
    }

    @Test
    void empty_pipeline_is_identity() throws EncodingException {
        assertThat(ProcessorPipeline.empty().process("' OR 1=1")).isEqualTo("' OR 1=1");
    }

    @Test
    void encode_then_decode_pairs_are_identity() throws EncodingException {
        String payload = "\"><svg/onload=alert(1)> ü";
        ProcessorKind[][] pairs = {
                {ProcessorKind.BASE64_ENCODE, ProcessorKind.BASE64_DECODE},
                {ProcessorKind.URL_ENCODE, ProcessorKind.URL_DECODE},
                {ProcessorKind.HTML_ENCODE, ProcessorKind.HTML_DECODE},
        };
        for (ProcessorKind[] pair : pairs) {
            ProcessorPipeline pipeline = new ProcessorPipeline(List.of(
                    PayloadProcessor.of(pair[0]), PayloadProcessor.of(pair[1])));
            assertThat(pipeline.process(payload)).as(pair[0].getId()).isEqualTo(payload);
        }
    }

    @Test
    void decoder_rejection_surfaces_as_encoding_exception() {
        ProcessorPipeline pipeline = new ProcessorPipeline(List.of(PayloadProcessor.of(ProcessorKind.BASE64_DECODE)));

        assertThatThrownBy(() -> pipeline.process("%%%"))
                .isInstanceOf(EncodingException.class);
    }

    @Test
    void hash_outputs_lowercase_hex() throws EncodingException {
        assertThat(PayloadProcessor.hash(PayloadProcessor.HashAlgorithm.MD5).apply("password"))
                .isEqualTo("5f4dcc3b5aa765d61d8327deb882cf99");
        assertThat(PayloadProcessor.hash(PayloadProcessor.HashAlgorithm.SHA256).apply(""))
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }

    @Test
    void match_replace_supports_group_references() throws EncodingException {
        PayloadProcessor processor = PayloadProcessor.matchReplace("(\\d+)", "[$1]");

        assertThat(processor.apply("id=42&page=7")).isEqualTo("id=[42]&page=[7]");
    }

    @Test
    void invalid_match_replace_regex_fails_validation() {
        ProcessorPipeline pipeline = new ProcessorPipeline(List.of(PayloadProcessor.matchReplace("(unclosed", "x")));

        assertThatThrownBy(pipeline::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("(unclosed");
    }

    @Test
    void kinds_needing_an_argument_cannot_be_created_bare() {
        assertThatThrownBy(() -> PayloadProcessor.of(ProcessorKind.ADD_PREFIX))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
