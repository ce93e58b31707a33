package com.omnifuzz.framework;

import com.omnifuzz.model.AttackConfiguration;
import com.omnifuzz.model.AttackResult;
import com.omnifuzz.model.AttackStrategy;
import com.omnifuzz.model.EncodingException;
import com.omnifuzz.model.Position;
import com.omnifuzz.model.RequestPlan;
import com.omnifuzz.modules.payloads.PayloadSource;
import com.omnifuzz.modules.processors.ProcessorPipeline;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plans for index-addressable sources, in enumerator order. Request numbers
 * are 1-based and follow that order. Creating a new instance from the same
 * configuration replays identical plans.
 */
public class EnumeratedPlanSequence implements PlanSequence {

    private final AttackStrategy strategy;
    private final List<Position> positions;
    private final List<PayloadSource> sources;
    private final ProcessorPipeline pipeline;
    private final CombinationEnumerator enumerator;
    private final Iterator<long[]> assignments;
    private long requestNumber = 0;

    public EnumeratedPlanSequence(AttackConfiguration config) {
        this.strategy = config.getStrategy();
        this.positions = config.getPositions();
        this.sources = config.getSources();
        this.pipeline = config.getPipeline();
        this.enumerator = new CombinationEnumerator(strategy, positions.size(), sources);
        this.assignments = enumerator.iterator();
    }

    @Override
    public synchronized RequestPlan next(AttackResult previous) {
        if (!assignments.hasNext()) return null;
        return toPlan(++requestNumber, assignments.next());
    }

    @Override
    public long expectedTotal() {
        return enumerator.totalPlans();
    }

    private RequestPlan toPlan(long number, long[] assignment) {
        Map<String, String> raw = new LinkedHashMap<>();
        Map<String, String> processed = new LinkedHashMap<>();
        // broadcast processes its single payload once for all positions
        String broadcastRaw = null;
        String broadcastProcessed = null;

        for (int i = 0; i < assignment.length; i++) {
            if (assignment[i] == CombinationEnumerator.KEEP_ORIGINAL) continue;
            PayloadSource source = strategy.isSingleSource() ? sources.get(0) : sources.get(i);
            String id = positions.get(i).getId();
            String rawPayload = source.payloadAt(assignment[i]);
            raw.put(id, rawPayload);
            try {
                if (strategy == AttackStrategy.SINGLE_SET_BROADCAST && rawPayload.equals(broadcastRaw)) {
                    processed.put(id, broadcastProcessed);
                } else {
                    String value = pipeline.process(rawPayload);
                    broadcastRaw = rawPayload;
                    broadcastProcessed = value;
                    processed.put(id, value);
                }
            } catch (EncodingException e) {
                return RequestPlan.failed(number, raw, e.getProcessor() + ": " + e.getMessage());
            }
        }
        return RequestPlan.of(number, processed, raw);
    }
}
