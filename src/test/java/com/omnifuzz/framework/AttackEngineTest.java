package com.omnifuzz.framework;

import com.omnifuzz.model.AttackConfiguration;
import com.omnifuzz.model.AttackResult;
import com.omnifuzz.model.AttackStrategy;
import com.omnifuzz.model.ConfigurationException;
import com.omnifuzz.model.GrepRule;
import com.omnifuzz.model.ModuleConfig;
import com.omnifuzz.model.Position;
import com.omnifuzz.model.RunProgress;
import com.omnifuzz.model.RunStatus;
import com.omnifuzz.model.Throttle;
import com.omnifuzz.model.TransportException;
import com.omnifuzz.model.TransportResponse;
import com.omnifuzz.modules.payloads.NullPayloadSource;
import com.omnifuzz.modules.payloads.NumberRangeSource;
import com.omnifuzz.modules.payloads.RecursiveGrepSource;
import com.omnifuzz.modules.payloads.SimpleListSource;
import com.omnifuzz.modules.processors.PayloadProcessor;
import com.omnifuzz.modules.processors.ProcessorKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end runs against {@link FakeTransport}: one result per plan, error
 * recording, pause/resume/stop and the recursive-grep feedback loop.
 */
class AttackEngineTest {

    // body "a=X&b=Y" with both values as positions
    private static final String TEMPLATE = "POST /api HTTP/1.1\r\n"
            + "Host: target.test\r\n"
            + "Content-Length: 7\r\n"
            + "\r\n"
            + "a=X&b=Y";
    private static final Position A = at("a=X", "a");
    private static final Position B = at("b=Y", "b");

    private final FakeTransport transport = new FakeTransport();
    private final List<String> errors = new CopyOnWriteArrayList<>();
    private AttackEngine engine;

    private AttackEngine engine(ModuleConfig settings) {
        engine = new AttackEngine(transport, settings);
        engine.setErrorLogger(errors::add);
        return engine;
    }

    @AfterEach
    void tearDown() {
        transport.open();
        if (engine != null) engine.shutdown();
    }

    @Test
    void every_plan_yields_exactly_one_result_under_concurrency() throws Exception {
        AttackEngine engine = engine(ModuleConfig.defaults());
        transport.latency(2);
        RunHandle run = engine.start(AttackConfiguration.builder()
                .strategy(AttackStrategy.CARTESIAN)
                .template(TEMPLATE).position(A).position(B)
                .source(new NumberRangeSource("n1", 1, 10, 1))
                .source(new NumberRangeSource("n2", 1, 10, 1))
                .throttle(Throttle.concurrent(8)));

        assertThat(run.awaitTermination(20, TimeUnit.SECONDS)).isTrue();

        List<AttackResult> results = engine.results(run);
        assertThat(results).extracting(AttackResult::getRequestNumber)
                .containsExactlyElementsOf(LongStream.rangeClosed(1, 100).boxed().collect(Collectors.toList()));
        assertThat(results).noneMatch(AttackResult::hasError);
        assertThat(transport.sent).hasSize(100);
        assertThat(transport.maxInFlight.get()).isLessThanOrEqualTo(8);
        assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED);
    }

    @Test
    void results_carry_response_fields_and_grep_outcomes() throws Exception {
        AttackEngine engine = engine(ModuleConfig.defaults());
        RunHandle run = engine.start(AttackConfiguration.builder()
                .strategy(AttackStrategy.SINGLE_SET_ROTATE)
                .template(TEMPLATE).position(A)
                .source(SimpleListSource.of("s", "error", "fine"))
                .grepRule(GrepRule.match("err", "error", false))
                .grepRule(GrepRule.extract("echo", "a=(\\w+)", true)));

        assertThat(run.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        AttackResult first = engine.results(run).get(0);
        assertThat(first.getPayloads()).containsEntry("a", "error");
        assertThat(first.getStatusCode()).isEqualTo(200);
        assertThat(first.getLength()).isEqualTo(first.getRawResponse().length());
        assertThat(first.getElapsedMs()).isEqualTo(1L);
        assertThat(first.matched("err")).isTrue();
        assertThat(first.getExtractions()).containsEntry("echo", "error");
        assertThat(first.getRawRequest()).contains("Content-Length: 11").endsWith("a=error&b=Y");

        AttackResult second = engine.results(run).get(1);
        assertThat(second.matched("err")).isFalse();
        assertThat(second.getExtractions()).containsEntry("echo", "fine");
    }

    @Test
    void transport_failures_are_recorded_and_the_run_completes() throws Exception {
        AttackEngine engine = engine(ModuleConfig.defaults());
        transport.respondWith(r -> {
            if (r.getBody().contains("down")) {
                throw new TransportException(TransportException.ErrorType.CONNECTION_FAILED, "refused");
            }
            if (r.getBody().contains("boom")) {
                throw new IllegalStateException("bug in transport");
            }
            return TransportResponse.of(200, List.of(), "ok", 3);
        });
        RunHandle run = engine.start(AttackConfiguration.builder()
                .template(TEMPLATE).position(A)
                .source(SimpleListSource.of("s", "up", "down", "boom"))
                .throttle(Throttle.concurrent(3)));

        assertThat(run.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        List<AttackResult> results = engine.results(run);
        assertThat(results).hasSize(3);
        assertThat(results.get(0).hasError()).isFalse();
        assertThat(results.get(1).getErrorKind()).isEqualTo(AttackResult.ErrorKind.TRANSPORT);
        assertThat(results.get(1).getError()).contains("CONNECTION_FAILED").contains("refused");
        assertThat(results.get(1).hasResponse()).isFalse();
        assertThat(results.get(2).getError()).contains("bug in transport");
        assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED);
    }

    @Test
    void catastrophic_grep_pattern_does_not_hang_the_run() throws Exception {
        AttackEngine engine = engine(ModuleConfig.defaults());
        String huge = "a".repeat(500_000);
        transport.respondWith(r -> TransportResponse.of(200, List.of(), huge, 1));
        RunHandle run = engine.start(AttackConfiguration.builder()
                .template(TEMPLATE).position(A)
                .source(SimpleListSource.of("s", "x", "y"))
                .grepRule(GrepRule.match("m", "(a|b)*c", true))
                .throttle(Throttle.concurrent(2)));

        assertThat(run.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        List<AttackResult> results = engine.results(run);
        assertThat(results).hasSize(2);
        assertThat(results).allSatisfy(r -> {
            assertThat(r.hasError()).isFalse();
            assertThat(r.getMatches()).containsEntry("m", false);
        });
        assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED);
    }

    @Test
    void errors_thrown_by_the_transport_are_recorded_and_release_their_slot() throws Exception {
        AttackEngine engine = engine(ModuleConfig.defaults());
        transport.respondWith(r -> {
            if (r.getBody().contains("bad")) {
                throw new AssertionError("transport blew up");
            }
            return TransportResponse.of(200, List.of(), "ok", 1);
        });
        RunHandle run = engine.start(AttackConfiguration.builder()
                .template(TEMPLATE).position(A)
                .source(SimpleListSource.of("s", "bad", "bad", "good"))
                .throttle(Throttle.concurrent(1)));

        assertThat(run.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        List<AttackResult> results = engine.results(run);
        assertThat(results).hasSize(3);
        assertThat(results.get(0).getErrorKind()).isEqualTo(AttackResult.ErrorKind.TRANSPORT);
        assertThat(results.get(0).getError()).contains("AssertionError").contains("transport blew up");
        assertThat(results.get(1).getErrorKind()).isEqualTo(AttackResult.ErrorKind.TRANSPORT);
        assertThat(results.get(2).hasError()).isFalse();
        assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(errors).anyMatch(e -> e.contains("AssertionError"));
    }

    @Test
    void encoding_failures_are_recorded_without_sending() throws Exception {
        AttackEngine engine = engine(ModuleConfig.defaults());
        RunHandle run = engine.start(AttackConfiguration.builder()
                .template(TEMPLATE).position(A)
                .source(SimpleListSource.of("s", "YWRtaW4=", "!!not-base64!!", "cm9vdA=="))
                .processor(PayloadProcessor.of(ProcessorKind.BASE64_DECODE)));

        assertThat(run.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        List<AttackResult> results = engine.results(run);
        assertThat(results).hasSize(3);
        assertThat(results.get(1).getErrorKind()).isEqualTo(AttackResult.ErrorKind.ENCODING);
        assertThat(results.get(1).getPayloads()).containsEntry("a", "!!not-base64!!");
        assertThat(results.get(0).getPayloads()).containsEntry("a", "YWRtaW4=");
        assertThat(results.get(0).getRawRequest()).endsWith("a=admin&b=Y");
        assertThat(transport.sent).extracting(r -> r.getBody()).containsExactly("a=admin&b=Y", "a=root&b=Y");
        assertThat(engine.summarize(run).getErrorCount()).isEqualTo(1);
    }

    @Test
    void stop_discards_pending_plans_and_keeps_in_flight_results() throws Exception {
        AttackEngine engine = engine(ModuleConfig.defaults());
        transport.closeGate();
        List<RunStatus> finished = new CopyOnWriteArrayList<>();
        RunHandle run = engine.start(AttackConfiguration.builder()
                .template(TEMPLATE).position(A)
                .source(new NumberRangeSource("n", 1, 100, 1))
                .throttle(Throttle.concurrent(2)));
        engine.subscribeResults(run, new ResultListener() {
            @Override
            public void onResult(AttackResult result) {
            }

            @Override
            public void onRunFinished(RunStatus status) {
                finished.add(status);
            }
        });
        assertThat(transport.awaitInFlight(2, 5000)).isTrue();

        assertThat(engine.stop(run)).isTrue();
        assertThat(run.getStatus()).isEqualTo(RunStatus.STOPPED);
        assertThat(run.awaitTermination(200, TimeUnit.MILLISECONDS)).isFalse();

        transport.open();
        assertThat(run.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(engine.results(run)).hasSize(2).noneMatch(AttackResult::hasError);
        assertThat(transport.sent).hasSize(2);
        assertThat(finished).containsExactly(RunStatus.STOPPED);
        assertThat(engine.stop(run)).isFalse();
    }

    @Test
    void pause_holds_admissions_until_resume() throws Exception {
        AttackEngine engine = engine(ModuleConfig.defaults());
        transport.closeGate();
        RunHandle run = engine.start(AttackConfiguration.builder()
                .template(TEMPLATE).position(A)
                .source(SimpleListSource.of("s", "1", "2", "3"))
                .throttle(Throttle.sequential()));
        assertThat(transport.awaitInFlight(1, 5000)).isTrue();

        assertThat(engine.pause(run)).isTrue();
        assertThat(run.getStatus()).isEqualTo(RunStatus.PAUSED);
        transport.open();
        Thread.sleep(300);

        assertThat(engine.results(run)).hasSize(1);
        assertThat(transport.sent).hasSize(1);
        assertThat(engine.progress(run).getStatus()).isEqualTo(RunStatus.PAUSED);

        assertThat(engine.resume(run)).isTrue();
        assertThat(run.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(engine.results(run)).hasSize(3);
        assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(engine.resume(run)).isFalse();
    }

    @Test
    void stop_while_paused_ends_the_run() throws Exception {
        AttackEngine engine = engine(ModuleConfig.defaults());
        RunHandle run = engine.start(AttackConfiguration.builder()
                .template(TEMPLATE).position(A)
                .source(new NumberRangeSource("n", 1, 1000, 1))
                .throttle(Throttle.delayed(20, 1)));
        engine.pause(run);

        engine.stop(run);

        assertThat(run.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(run.getStatus()).isEqualTo(RunStatus.STOPPED);
        assertThat(engine.results(run).size()).isLessThan(1000);
    }

    @Test
    void recursive_grep_runs_sequentially_and_chains_extractions() throws Exception {
        AttackEngine engine = engine(ModuleConfig.defaults());
        transport.latency(5).respondWith(r -> {
            String value = r.getBody().substring(2, r.getBody().indexOf('&'));
            return TransportResponse.of(200, List.of(), "next=" + value + "x", 1);
        });
        RunHandle run = engine.start(AttackConfiguration.builder()
                .strategy(AttackStrategy.SINGLE_SET_BROADCAST)
                .template(TEMPLATE).position(A).position(B)
                .source(new RecursiveGrepSource("r", "s", "next", 4))
                .grepRule(GrepRule.extract("next", "next=(\\w+)", true))
                .throttle(Throttle.concurrent(10)));

        assertThat(run.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(engine.results(run)).extracting(r -> r.getPayloads().get("a"))
                .containsExactly("s", "sx", "sxx", "sxxx");
        assertThat(transport.maxInFlight.get()).isEqualTo(1);
    }

    @Test
    void recursive_chain_ending_early_shrinks_the_total() throws Exception {
        AttackEngine engine = engine(ModuleConfig.defaults());
        transport.respondWith(r -> TransportResponse.of(200, List.of(),
                r.getBody().startsWith("a=seed") ? "next=second" : "nothing here", 1));
        RunHandle run = engine.start(AttackConfiguration.builder()
                .template(TEMPLATE).position(A)
                .source(new RecursiveGrepSource("r", "seed", "next", 50))
                .grepRule(GrepRule.extract("next", "next=(\\w+)", true)));

        assertThat(run.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        RunProgress progress = engine.progress(run);
        assertThat(progress.getCompleted()).isEqualTo(2);
        assertThat(progress.getTotal()).isEqualTo(2);
        assertThat(progress.percent()).isEqualTo(100);
    }

    @Test
    void throttle_delay_spaces_out_admissions() throws Exception {
        AttackEngine engine = engine(ModuleConfig.defaults());
        long start = System.nanoTime();
        RunHandle run = engine.start(AttackConfiguration.builder()
                .template(TEMPLATE).position(A)
                .source(SimpleListSource.of("s", "1", "2", "3"))
                .throttle(Throttle.delayed(60, 3)));

        assertThat(run.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        assertThat(elapsedMs).isGreaterThanOrEqualTo(120);
    }

    @Test
    void builder_without_throttle_gets_the_configured_default_delay() throws Exception {
        ModuleConfig settings = ModuleConfig.defaults();
        settings.setInt(ModuleConfig.DEFAULT_DELAY_MS, 80);
        AttackEngine engine = engine(settings);
        long start = System.nanoTime();
        RunHandle run = engine.start(AttackConfiguration.builder()
                .template(TEMPLATE).position(A)
                .source(SimpleListSource.of("s", "1", "2", "3")));

        assertThat(run.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        assertThat(elapsedMs).isGreaterThanOrEqualTo(160);
        Throttle applied = run.getConfiguration().getThrottle();
        assertThat(applied.isEnabled()).isTrue();
        assertThat(applied.getDelayMs()).isEqualTo(80);
        assertThat(applied.getMaxConcurrent()).isEqualTo(1);
    }

    @Test
    void explicit_throttle_is_not_replaced_by_the_default() throws Exception {
        AttackEngine engine = engine(ModuleConfig.defaults());
        RunHandle run = engine.start(AttackConfiguration.builder()
                .template(TEMPLATE).position(A)
                .source(SimpleListSource.of("s", "1"))
                .throttle(Throttle.concurrent(4)));

        assertThat(run.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(run.getConfiguration().getThrottle().isEnabled()).isFalse();
        assertThat(run.getConfiguration().getThrottle().getMaxConcurrent()).isEqualTo(4);
    }

    @Test
    void concurrency_is_capped_by_engine_settings() throws Exception {
        ModuleConfig settings = ModuleConfig.defaults();
        settings.setInt(ModuleConfig.MAX_CONCURRENT_CAP, 2);
        AttackEngine engine = engine(settings);
        transport.latency(10);
        RunHandle run = engine.start(AttackConfiguration.builder()
                .template(TEMPLATE).position(A)
                .source(new NumberRangeSource("n", 1, 20, 1))
                .throttle(Throttle.concurrent(10)));

        assertThat(run.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(transport.maxInFlight.get()).isLessThanOrEqualTo(2);
        assertThat(engine.results(run)).hasSize(20);
    }

    @Test
    void empty_attack_completes_immediately() throws Exception {
        AttackEngine engine = engine(ModuleConfig.defaults());
        RunHandle run = engine.start(AttackConfiguration.builder()
                .template(TEMPLATE).position(A)
                .source(new NullPayloadSource("n", 0)));

        assertThat(run.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(engine.results(run)).isEmpty();
        assertThat(engine.progress(run).percent()).isEqualTo(100);
    }

    @Test
    void subscriber_sees_every_result_once_and_the_finish() throws Exception {
        AttackEngine engine = engine(ModuleConfig.defaults());
        transport.latency(3);
        List<Long> seen = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch done = new CountDownLatch(1);
        AtomicReference<RunStatus> finalStatus = new AtomicReference<>();
        RunHandle run = engine.start(AttackConfiguration.builder()
                .template(TEMPLATE).position(A)
                .source(new NumberRangeSource("n", 1, 30, 1))
                .throttle(Throttle.concurrent(4)));
        engine.subscribeResults(run, new ResultListener() {
            @Override
            public void onResult(AttackResult result) {
                seen.add(result.getRequestNumber());
            }

            @Override
            public void onRunFinished(RunStatus status) {
                finalStatus.set(status);
                done.countDown();
            }
        });

        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();

        assertThat(seen).hasSize(30).doesNotHaveDuplicates();
        assertThat(finalStatus.get()).isEqualTo(RunStatus.COMPLETED);
    }

    @Test
    void invalid_configuration_fails_start_synchronously() {
        AttackEngine engine = engine(ModuleConfig.defaults());

        assertThatThrownBy(() -> engine.start(AttackConfiguration.builder()
                .strategy(AttackStrategy.LOCKSTEP)
                .template(TEMPLATE).position(A).position(B)
                .source(SimpleListSource.of("only-one", "x"))))
                .isInstanceOf(ConfigurationException.class);
        assertThat(engine.getRuns()).isEmpty();
        assertThat(transport.sent).isEmpty();
    }

    @Test
    void engine_refuses_new_runs_after_shutdown() throws ConfigurationException {
        AttackEngine engine = engine(ModuleConfig.defaults());
        AttackConfiguration config = AttackConfiguration.builder()
                .template(TEMPLATE).position(A)
                .source(SimpleListSource.of("s", "x"))
                .build();

        engine.shutdown();

        assertThatThrownBy(() -> engine.start(config)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void finished_runs_can_be_removed() throws Exception {
        AttackEngine engine = engine(ModuleConfig.defaults());
        RunHandle run = engine.start(AttackConfiguration.builder()
                .template(TEMPLATE).position(A)
                .source(SimpleListSource.of("s", "x")));
        assertThat(run.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(engine.getRun(run.getId())).isSameAs(run);
        assertThat(engine.remove(run)).isTrue();
        assertThat(engine.getRuns()).isEmpty();
    }

    private static Position at(String pair, String id) {
        int start = TEMPLATE.indexOf(pair) + 2;
        return new Position(id, start, start + 1, "body:" + id);
    }
}
