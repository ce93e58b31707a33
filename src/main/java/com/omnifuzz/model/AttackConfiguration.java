package com.omnifuzz.model;

import com.omnifuzz.framework.CombinationEnumerator;
import com.omnifuzz.framework.GrepEvaluator;
import com.omnifuzz.modules.payloads.PayloadSource;
import com.omnifuzz.modules.payloads.RecursiveGrepSource;
import com.omnifuzz.modules.processors.PayloadProcessor;
import com.omnifuzz.modules.processors.ProcessorPipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything one run needs, validated as a whole and immutable afterwards.
 * Built with {@link #builder()}; {@link Builder#build()} is the only place a
 * {@link ConfigurationException} can come from.
 */
public class AttackConfiguration {

    private final AttackStrategy strategy;
    private final RequestTemplate template;
    private final List<Position> positions;
    private final List<PayloadSource> sources;
    private final ProcessorPipeline pipeline;
    private final Throttle throttle;
    private final List<GrepRule> grepRules;
    private final GrepEvaluator grepEvaluator;
    private final long totalPlans;

    private AttackConfiguration(Builder builder, GrepEvaluator grepEvaluator, long totalPlans) {
        this.strategy = builder.strategy;
        this.template = builder.template;
        this.positions = Collections.unmodifiableList(new ArrayList<>(builder.positions));
        this.sources = Collections.unmodifiableList(new ArrayList<>(builder.sources));
        this.pipeline = new ProcessorPipeline(builder.processors);
        this.throttle = builder.throttle;
        this.grepRules = Collections.unmodifiableList(new ArrayList<>(builder.grepRules));
        this.grepEvaluator = grepEvaluator;
        this.totalPlans = totalPlans;
    }

    public static Builder builder() {
        return new Builder();
    }

    public AttackStrategy getStrategy() { return strategy; }
    public RequestTemplate getTemplate() { return template; }
    public List<Position> getPositions() { return positions; }
    public List<PayloadSource> getSources() { return sources; }
    public ProcessorPipeline getPipeline() { return pipeline; }
    public Throttle getThrottle() { return throttle; }
    public List<GrepRule> getGrepRules() { return grepRules; }
    public GrepEvaluator getGrepEvaluator() { return grepEvaluator; }

    /** Plan count; for recursive runs an upper bound. */
    public long getTotalPlans() { return totalPlans; }

    public boolean hasRecursiveSource() {
        return sources.stream().anyMatch(PayloadSource::isRecursive);
    }

    /** The throttle the scheduler actually applies: single in flight for recursive runs. */
    public Throttle effectiveThrottle() {
        return hasRecursiveSource() ? throttle.singleInFlight() : throttle;
    }

    @Override
    public String toString() {
        return strategy.getId() + " positions=" + positions.size() + " sources=" + sources.size()
                + " plans=" + totalPlans + " " + throttle;
    }

    public static class Builder {
        private AttackStrategy strategy = AttackStrategy.SINGLE_SET_ROTATE;
        private RequestTemplate template;
        private final List<Position> positions = new ArrayList<>();
        private final List<PayloadSource> sources = new ArrayList<>();
        private final List<PayloadProcessor> processors = new ArrayList<>();
        private Throttle throttle = Throttle.sequential();
        private boolean throttleSet;
        private final List<GrepRule> grepRules = new ArrayList<>();

        private Builder() {
        }

        public Builder strategy(AttackStrategy s) { this.strategy = s; return this; }
        public Builder template(RequestTemplate t) { this.template = t; return this; }
        public Builder template(String text) { this.template = RequestTemplate.of(text); return this; }
        public Builder position(Position p) { this.positions.add(p); return this; }
        public Builder positions(List<Position> p) { this.positions.addAll(p); return this; }
        public Builder source(PayloadSource s) { this.sources.add(s); return this; }
        public Builder sources(List<? extends PayloadSource> s) { this.sources.addAll(s); return this; }
        public Builder processor(PayloadProcessor p) { this.processors.add(p); return this; }
        public Builder processors(List<PayloadProcessor> p) { this.processors.addAll(p); return this; }
        public Builder throttle(Throttle t) { this.throttle = t; this.throttleSet = true; return this; }
        public Builder grepRule(GrepRule r) { this.grepRules.add(r); return this; }
        public Builder grepRules(List<GrepRule> r) { this.grepRules.addAll(r); return this; }

        /** False while the builder still holds its sequential default. */
        public boolean hasThrottle() { return throttleSet; }

        public AttackConfiguration build() throws ConfigurationException {
            if (strategy == null) {
                throw new ConfigurationException("An attack strategy is required");
            }
            if (template == null) {
                throw new ConfigurationException("A request template is required");
            }
            validatePositions();
            validateSources();
            validateThrottle();
            new ProcessorPipeline(processors).validate();
            GrepEvaluator evaluator = new GrepEvaluator(grepRules);
            validateRecursiveSources();

            long[] sizes = new long[sources.size()];
            for (int i = 0; i < sizes.length; i++) {
                sizes[i] = sources.get(i).size();
            }
            long total;
            try {
                total = CombinationEnumerator.countPlans(strategy, positions.size(), sizes);
            } catch (ArithmeticException e) {
                throw new ConfigurationException("Attack is too large: request count overflows", e);
            }
            return new AttackConfiguration(this, evaluator, total);
        }

        private void validatePositions() throws ConfigurationException {
            if (positions.isEmpty()) {
                throw new ConfigurationException("At least one payload position is required");
            }
            Set<String> ids = new HashSet<>();
            Position previous = null;
            for (Position p : positions) {
                if (!ids.add(p.getId())) {
                    throw new ConfigurationException("Duplicate position id: " + p.getId());
                }
                if (p.getEnd() > template.length()) {
                    throw new ConfigurationException("Position " + p + " extends past the template (length "
                            + template.length() + ")");
                }
                if (previous != null) {
                    if (p.getStart() < previous.getStart()) {
                        throw new ConfigurationException("Positions must be sorted by start: " + previous + " before " + p);
                    }
                    if (p.getStart() < previous.getEnd()) {
                        throw new ConfigurationException("Positions overlap: " + previous + " and " + p);
                    }
                }
                previous = p;
            }
        }

        private void validateSources() throws ConfigurationException {
            if (strategy.isSingleSource()) {
                if (sources.size() != 1) {
                    throw new ConfigurationException(strategy.getId() + " requires exactly one payload source, got "
                            + sources.size());
                }
            } else if (sources.size() != positions.size()) {
                throw new ConfigurationException(strategy.getId() + " requires one payload source per position ("
                        + positions.size() + "), got " + sources.size());
            }
        }

        private void validateThrottle() throws ConfigurationException {
            if (throttle == null) {
                throw new ConfigurationException("A throttle is required");
            }
            if (throttle.getMaxConcurrent() < 1) {
                throw new ConfigurationException("maxConcurrent must be >= 1, got " + throttle.getMaxConcurrent());
            }
            if (throttle.getDelayMs() < 0) {
                throw new ConfigurationException("delayMs must be >= 0, got " + throttle.getDelayMs());
            }
        }

        private void validateRecursiveSources() throws ConfigurationException {
            for (PayloadSource source : sources) {
                if (!(source instanceof RecursiveGrepSource recursive)) continue;
                if (!strategy.isSingleSource()) {
                    throw new ConfigurationException("Recursive grep source " + source.getId()
                            + " is only supported with single-set strategies");
                }
                GrepRule rule = grepRules.stream()
                        .filter(r -> r.getId().equals(recursive.getRuleId()))
                        .findFirst()
                        .orElseThrow(() -> new ConfigurationException("Recursive grep source " + source.getId()
                                + " references unknown grep rule " + recursive.getRuleId()));
                if (rule.getMode() != GrepMode.EXTRACT || !rule.isEnabled()) {
                    throw new ConfigurationException("Recursive grep source " + source.getId()
                            + " needs an enabled extract rule, but " + rule.getId() + " is not one");
                }
            }
        }
    }
}
