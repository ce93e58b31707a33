package com.omnifuzz.modules.processors;

import com.omnifuzz.model.ConfigurationException;
import com.omnifuzz.model.EncodingException;

import java.util.List;

/**
 * Ordered processors applied to every raw payload before substitution.
 * Stateless; one instance is shared by all sources of a run.
 */
public class ProcessorPipeline {

    private static final ProcessorPipeline EMPTY = new ProcessorPipeline(List.of());

    private final List<PayloadProcessor> processors;

    public ProcessorPipeline(List<PayloadProcessor> processors) {
        this.processors = List.copyOf(processors);
    }

    public static ProcessorPipeline empty() {
        return EMPTY;
    }

    public List<PayloadProcessor> getProcessors() { return processors; }

    public boolean isEmpty() {
        return processors.stream().noneMatch(PayloadProcessor::isEnabled);
    }

    public void validate() throws ConfigurationException {
        for (PayloadProcessor p : processors) {
            p.validate();
        }
    }

    /**
     * Runs the enabled processors in order.
     *
     * @throws EncodingException from the first processor that rejects its input
     */
    public String process(String rawPayload) throws EncodingException {
        String value = rawPayload;
        for (PayloadProcessor p : processors) {
            if (p.isEnabled()) {
                value = p.apply(value);
            }
        }
        return value;
    }

    @Override
    public String toString() {
        return processors.toString();
    }
}
