package com.omnifuzz.framework;

import com.omnifuzz.model.AttackConfiguration;
import com.omnifuzz.model.AttackResult;
import com.omnifuzz.model.AttackStrategy;
import com.omnifuzz.model.EncodingException;
import com.omnifuzz.model.Position;
import com.omnifuzz.model.RequestPlan;
import com.omnifuzz.modules.payloads.RecursiveGrepSource;
import com.omnifuzz.modules.processors.ProcessorPipeline;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sequential plans for a recursive-grep source. Each block starts from the
 * initial payload; every further payload is the previous result's extraction.
 * A block ends when it reaches maxPayloads or the previous result has nothing
 * extracted. Broadcast runs one block over all positions, rotate one block per
 * position.
 */
public class RecursivePlanSequence implements PlanSequence {

    private final List<Position> positions;
    private final RecursiveGrepSource source;
    private final ProcessorPipeline pipeline;
    private final boolean broadcast;
    private final int blocks;
    private final AtomicLong expectedTotal;

    private int block = 0;
    private long indexInBlock = 0;
    private long requestNumber = 0;

    public RecursivePlanSequence(AttackConfiguration config) {
        if (config.getSources().size() != 1 || !(config.getSources().get(0) instanceof RecursiveGrepSource)) {
            throw new IllegalArgumentException("Recursive plans need a single recursive grep source");
        }
        this.positions = config.getPositions();
        this.source = (RecursiveGrepSource) config.getSources().get(0);
        this.pipeline = config.getPipeline();
        this.broadcast = config.getStrategy() == AttackStrategy.SINGLE_SET_BROADCAST;
        this.blocks = broadcast ? 1 : positions.size();
        this.expectedTotal = new AtomicLong(config.getTotalPlans());
    }

    @Override
    public synchronized RequestPlan next(AttackResult previous) {
        String rawPayload = null;
        while (block < blocks && rawPayload == null) {
            if (indexInBlock >= source.size()) {
                nextBlock();
            } else if (indexInBlock == 0) {
                rawPayload = source.getInitialPayload();
            } else {
                String extracted = previous != null ? previous.getExtractions().get(source.getRuleId()) : null;
                if (extracted == null) {
                    expectedTotal.addAndGet(indexInBlock - source.size());
                    nextBlock();
                } else {
                    rawPayload = extracted;
                }
            }
        }
        if (rawPayload == null) return null;

        indexInBlock++;
        return toPlan(++requestNumber, rawPayload);
    }

    private void nextBlock() {
        block++;
        indexInBlock = 0;
    }

    @Override
    public long expectedTotal() {
        return expectedTotal.get();
    }

    @Override
    public boolean requiresFeedback() {
        return true;
    }

    private RequestPlan toPlan(long number, String rawPayload) {
        List<Position> targets = broadcast ? positions : List.of(positions.get(block));
        Map<String, String> raw = new LinkedHashMap<>();
        for (Position p : targets) {
            raw.put(p.getId(), rawPayload);
        }
        String value;
        try {
            value = pipeline.process(rawPayload);
        } catch (EncodingException e) {
            return RequestPlan.failed(number, raw, e.getProcessor() + ": " + e.getMessage());
        }
        Map<String, String> processed = new LinkedHashMap<>();
        for (Position p : targets) {
            processed.put(p.getId(), value);
        }
        return RequestPlan.of(number, processed, raw);
    }
}
