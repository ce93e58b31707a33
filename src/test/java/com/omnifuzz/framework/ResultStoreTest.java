package com.omnifuzz.framework;

import com.omnifuzz.model.AttackResult;
import com.omnifuzz.model.AttackSummary;
import com.omnifuzz.model.RunStatus;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class ResultStoreTest {

    @Test
    void results_are_ordered_by_request_number_not_arrival() {
        ResultStore store = new ResultStore();
        store.record(ok(3, 200));
        store.record(ok(1, 200));
        store.record(ok(2, 404));

        assertThat(store.getResults()).extracting(AttackResult::getRequestNumber).containsExactly(1L, 2L, 3L);
        assertThat(store.getCompletedCount()).isEqualTo(3);
    }

    @Test
    void slot_can_only_be_written_once() {
        ResultStore store = new ResultStore();
        store.record(ok(1, 200));

        assertThatThrownBy(() -> store.record(ok(1, 500))).isInstanceOf(IllegalStateException.class);
        assertThat(store.get(1).getStatusCode()).isEqualTo(200);
    }

    @Test
    void run_finished_is_held_back_until_the_replay_is_done() throws Exception {
        ResultStore store = new ResultStore();
        store.record(ok(1, 200));
        List<String> events = new CopyOnWriteArrayList<>();
        CountDownLatch replaying = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ResultListener listener = new ResultListener() {
            @Override
            public void onResult(AttackResult result) {
                events.add("result " + result.getRequestNumber());
                replaying.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }

            @Override
            public void onRunFinished(RunStatus status) {
                events.add("finished " + status);
            }
        };
        Thread subscriber = new Thread(() -> store.addListener(listener));
        subscriber.start();
        assertThat(replaying.await(5, TimeUnit.SECONDS)).isTrue();

        store.finish(RunStatus.COMPLETED);
        assertThat(events).containsExactly("result 1");

        release.countDown();
        subscriber.join(5000);
        assertThat(events).containsExactly("result 1", "finished COMPLETED");
    }

    @Test
    void late_listener_gets_replay_then_live_results_once_each() {
        ResultStore store = new ResultStore();
        store.record(ok(2, 200));
        store.record(ok(1, 200));
        List<Long> seen = new ArrayList<>();
        List<RunStatus> finished = new ArrayList<>();
        ResultListener listener = new ResultListener() {
            @Override
            public void onResult(AttackResult result) {
                seen.add(result.getRequestNumber());
            }

            @Override
            public void onRunFinished(RunStatus status) {
                finished.add(status);
            }
        };

        store.addListener(listener);
        store.record(ok(3, 200));
        store.finish(RunStatus.COMPLETED);
        store.finish(RunStatus.STOPPED);

        assertThat(seen).containsExactly(1L, 2L, 3L);
        assertThat(finished).containsExactly(RunStatus.COMPLETED);
    }

    @Test
    void listener_added_after_finish_still_hears_terminal_status() {
        ResultStore store = new ResultStore();
        store.record(ok(1, 200));
        store.finish(RunStatus.STOPPED);
        ResultListener listener = mock(ResultListener.class);

        store.addListener(listener);

        verify(listener).onResult(store.get(1));
        verify(listener).onRunFinished(RunStatus.STOPPED);
    }

    @Test
    void failing_listener_is_reported_and_does_not_block_others() {
        ResultStore store = new ResultStore();
        List<String> errors = new ArrayList<>();
        store.setErrorLogger(errors::add);
        ResultListener broken = mock(ResultListener.class);
        doThrow(new IllegalStateException("boom")).when(broken).onResult(any());
        List<AttackResult> received = new ArrayList<>();
        store.addListener(broken);
        store.addListener(received::add);

        store.record(ok(1, 200));

        assertThat(received).hasSize(1);
        assertThat(errors).singleElement().asString().contains("[ResultStore]").contains("boom");
    }

    @Test
    void summary_counts_statuses_errors_matches_and_extractions() {
        ResultStore store = new ResultStore();
        store.record(AttackResult.builder(1).statusCode(200)
                .matches(Map.of("err", false)).extractions(Map.of("tok", "a")).build());
        store.record(AttackResult.builder(2).statusCode(500)
                .matches(Map.of("err", true)).extractions(Map.of("tok", "b")).build());
        store.record(AttackResult.builder(3).statusCode(200)
                .matches(Map.of("err", true)).extractions(Map.of("tok", "a")).build());
        store.record(AttackResult.builder(4).error(AttackResult.ErrorKind.TRANSPORT, "TIMEOUT").build());

        AttackSummary summary = store.summarize();

        assertThat(summary.getTotalResults()).isEqualTo(4);
        assertThat(summary.getErrorCount()).isEqualTo(1);
        assertThat(summary.getStatusCounts()).containsExactly(Map.entry(200, 2L), Map.entry(500, 1L));
        assertThat(summary.getMatchCounts()).containsEntry("err", 2L);
        assertThat(summary.getDistinctExtractions().get("tok")).containsExactly("a", "b");
    }

    private static AttackResult ok(long number, int status) {
        return AttackResult.builder(number).statusCode(status).rawResponse("HTTP/1.1 " + status).build();
    }
}
