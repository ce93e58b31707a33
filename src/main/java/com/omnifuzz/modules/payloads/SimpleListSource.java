package com.omnifuzz.modules.payloads;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Fixed list of payloads, in the order given.
 */
public class SimpleListSource extends AbstractPayloadSource {

    private final List<String> payloads;

    public SimpleListSource(String id, List<String> payloads) {
        super(id, PayloadSourceKind.SIMPLE_LIST);
        this.payloads = List.copyOf(payloads);
    }

    public static SimpleListSource of(String id, String... payloads) {
        return new SimpleListSource(id, List.of(payloads));
    }

    /**
     * Loads a word list, one payload per line. Blank lines are kept as empty or
     * whitespace payloads; a final line terminator does not add an entry.
     */
    public static SimpleListSource fromFile(String id, Path file) throws IOException {
        return new SimpleListSource(id, Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    public List<String> getPayloads() { return payloads; }

    @Override
    public long size() {
        return payloads.size();
    }

    @Override
    protected String compute(long index) {
        return payloads.get((int) index);
    }
}
