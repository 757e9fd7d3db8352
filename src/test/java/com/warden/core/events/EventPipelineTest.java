package com.warden.core.events;

import com.warden.core.jobs.JobProperties;
import com.warden.core.metrics.WardenMetrics;
import com.warden.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

class EventPipelineTest {

    private EventPipeline pipeline;

    @BeforeEach
    void setUp() {
        var properties = new JobProperties();
        properties.setEventBufferCapacity(8);
        pipeline = new EventPipeline(new InMemoryEventStore(), properties, Runnable::run,
                MutableClock.at("2026-03-01T10:00:00Z"), null);
    }

    private JobEvent message(String jobId, String text) {
        return pipeline.ingest(jobId, JobEventType.MESSAGE, Map.of("role", "assistant", "content", text));
    }

    private static class Collector implements JobEventListener {
        final List<JobEvent> events = new CopyOnWriteArrayList<>();
        final AtomicInteger completions = new AtomicInteger();

        @Override
        public void onEvent(JobEvent event) {
            events.add(event);
        }

        @Override
        public void onComplete() {
            completions.incrementAndGet();
        }

        List<Long> sequences() {
            return events.stream().map(JobEvent::sequence).toList();
        }
    }

    @Nested
    @DisplayName("ingest")
    class Ingest {

        @Test
        @DisplayName("sequences start at 1 and are gap-free per job")
        void gapFreeSequences() {
            message("a", "one");
            message("b", "other job");
            message("a", "two");
            JobEvent third = message("a", "three");

            assertEquals(3, third.sequence());
            assertEquals(List.of(1L, 2L, 3L),
                    pipeline.read("a", 0, 100).stream().map(JobEvent::sequence).toList());
            assertEquals(1, pipeline.read("b", 0, 100).size());
        }

        @Test
        @DisplayName("concurrent producers never share or skip a sequence")
        void concurrentProducers() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                for (int i = 0; i < 200; i++) {
                    int n = i;
                    pool.submit(() -> message("a", "msg " + n));
                }
            } finally {
                pool.shutdown();
                assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
            }
            List<Long> sequences = pipeline.read("a", 0, 1000).stream().map(JobEvent::sequence).toList();
            assertEquals(LongStream.rangeClosed(1, 200).boxed().toList(), sequences);
        }

        @Test
        @DisplayName("durable read honours since and limit")
        void readPages() {
            for (int i = 0; i < 5; i++) {
                message("a", "m" + i);
            }
            assertEquals(List.of(3L, 4L),
                    pipeline.read("a", 2, 2).stream().map(JobEvent::sequence).toList());
        }
    }

    @Nested
    @DisplayName("subscribe")
    class Subscribe {

        @Test
        @DisplayName("backfill then live delivery without duplicates or gaps")
        void backfillThenLive() {
            message("a", "one");
            message("a", "two");

            Collector collector = new Collector();
            pipeline.subscribe("a", collector);
            message("a", "three");

            assertEquals(List.of(1L, 2L, 3L), collector.sequences());
        }

        @Test
        @DisplayName("backfill reads durable history beyond the live buffer")
        void backfillBeyondBuffer() {
            for (int i = 0; i < 20; i++) {
                message("a", "m" + i);
            }
            Collector collector = new Collector();
            pipeline.subscribe("a", collector);

            assertEquals(20, collector.events.size());
            assertEquals(8, pipeline.bufferedCount("a"));
        }

        @Test
        @DisplayName("finish completes subscribers once and detaches them")
        void finishCompletes() {
            Collector collector = new Collector();
            pipeline.subscribe("a", collector);
            pipeline.ingest("a", JobEventType.RESULT, Map.of("success", true));

            pipeline.finish("a");
            pipeline.finish("a");

            assertEquals(1, collector.completions.get());
            assertEquals(JobEventType.RESULT, collector.events.get(collector.events.size() - 1).eventType());
            assertEquals(0, pipeline.subscriberCount("a"));
        }

        @Test
        @DisplayName("unsubscribed listener receives nothing further")
        void unsubscribe() {
            Collector collector = new Collector();
            EventSubscription subscription = pipeline.subscribe("a", collector);
            message("a", "one");
            subscription.unsubscribe();
            message("a", "two");

            assertEquals(List.of(1L), collector.sequences());
            assertTrue(subscription.isClosed());
        }

        @Test
        @DisplayName("a failing listener does not affect other subscribers")
        void failingListener() {
            List<Long> seen = new ArrayList<>();
            pipeline.subscribe("a", event -> {
                throw new IllegalStateException("boom");
            });
            pipeline.subscribe("a", event -> seen.add(event.sequence()));

            message("a", "one");
            message("a", "two");

            assertEquals(List.of(1L, 2L), seen);
        }
    }

    @Nested
    @DisplayName("slow subscribers")
    class SlowSubscribers {

        private final Queue<Runnable> deferred = new ArrayDeque<>();
        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private EventPipeline slowPipeline;

        @BeforeEach
        void setUp() {
            var properties = new JobProperties();
            properties.setEventBufferCapacity(8);
            slowPipeline = new EventPipeline(new InMemoryEventStore(), properties, deferred::add,
                    MutableClock.at("2026-03-01T10:00:00Z"), new WardenMetrics(registry));
        }

        private void ingest(int count) {
            for (int i = 0; i < count; i++) {
                slowPipeline.ingest("a", JobEventType.MESSAGE, Map.of("content", "step " + i));
            }
        }

        private void runDeferred() {
            Runnable task;
            while ((task = deferred.poll()) != null) {
                task.run();
            }
        }

        @Test
        @DisplayName("a subscriber held back past the buffer receives only the tail and reports the skip")
        void skipsOverwrittenEvents() {
            Collector collector = new Collector();
            slowPipeline.subscribe("a", collector);

            ingest(20);
            assertEquals(1, deferred.size());
            assertEquals(8, slowPipeline.bufferedCount("a"));

            runDeferred();

            assertEquals(LongStream.rangeClosed(13, 20).boxed().toList(), collector.sequences());
            assertEquals(12.0, registry.find("warden.events.subscriber_lag").counter().count());
            assertEquals(20, slowPipeline.read("a", 0, 100).size());
        }

        @Test
        @DisplayName("after catching up the cursor keeps increasing without further skips")
        void cursorKeepsIncreasing() {
            Collector collector = new Collector();
            EventSubscription subscription = slowPipeline.subscribe("a", collector);

            ingest(11);
            runDeferred();
            ingest(3);
            runDeferred();

            List<Long> seen = collector.sequences();
            for (int i = 1; i < seen.size(); i++) {
                assertTrue(seen.get(i) > seen.get(i - 1), "sequence went backwards at " + i);
            }
            assertEquals(List.of(4L, 5L, 6L, 7L, 8L, 9L, 10L, 11L, 12L, 13L, 14L), seen);
            assertEquals(14, subscription.cursor());
            assertEquals(3.0, registry.find("warden.events.subscriber_lag").counter().count());
            assertEquals(8, slowPipeline.bufferedCount("a"));
        }
    }
}
