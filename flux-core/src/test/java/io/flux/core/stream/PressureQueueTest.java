package io.flux.core.stream;

import io.flux.core.channel.Channel;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class PressureQueueTest {

    @Test
    void shouldDeliverInOrderAndDrainBuffer() throws Exception {
        Channel<Integer> out = new Channel<>();
        PressureQueue<Integer> queue = new PressureQueue<>(out);

        for (int i = 0; i < 5000; i++) {
            queue.enqueue(i);
        }
        assertThat(queue.length()).isLessThanOrEqualTo(5000);

        for (int i = 0; i < 1000; i++) {
            assertThat(out.receive()).contains(i);
        }
        await().atMost(2, TimeUnit.SECONDS).untilAsserted(() -> assertThat(queue.length()).isEqualTo(4000));

        for (int i = 1000; i < 5000; i++) {
            assertThat(out.receive()).contains(i);
        }
        await().atMost(2, TimeUnit.SECONDS).untilAsserted(() -> assertThat(queue.length()).isZero());

        queue.close();

        assertThat(out.receive()).isEmpty();
        assertThat(out.isClosed()).isTrue();
    }

    @Test
    void shouldBufferWithoutConsumer() {
        Channel<Integer> out = new Channel<>();
        PressureQueue<Integer> queue = new PressureQueue<>(out);

        // no consumer: every enqueue still returns
        for (int i = 0; i < 5000; i++) {
            queue.enqueue(i);
        }

        assertThat(queue.length()).isEqualTo(5000);
        assertThat(queue.peek()).isZero();
        queue.close();
    }

    @Test
    void shouldCloseWithUndeliveredItemsPromptly() throws Exception {
        Channel<Integer> out = new Channel<>();
        PressureQueue<Integer> queue = new PressureQueue<>(out);

        for (int i = 0; i < 5000; i++) {
            queue.enqueue(i);
        }
        for (int i = 0; i < 1000; i++) {
            assertThat(out.receive()).contains(i);
        }

        long start = System.nanoTime();
        queue.close();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(elapsedMs).isLessThan(2000);
        assertThat(out.receive()).isEmpty();
    }

    @Test
    void shouldDeliverEveryItemOnceFromConcurrentProducers() throws Exception {
        Channel<String> out = new Channel<>();
        PressureQueue<String> queue = new PressureQueue<>(out);
        int producers = 4;
        int perProducer = 500;

        List<Thread> threads = new ArrayList<>();
        for (int p = 0; p < producers; p++) {
            int producer = p;
            Thread t = new Thread(() -> {
                for (int i = 0; i < perProducer; i++) {
                    queue.enqueue(producer + ":" + i);
                }
            });
            threads.add(t);
            t.start();
        }

        List<String> received = new ArrayList<>();
        for (int i = 0; i < producers * perProducer; i++) {
            Optional<String> item = out.poll(Duration.ofSeconds(5));
            assertThat(item).isPresent();
            received.add(item.get());
        }
        for (Thread t : threads) {
            t.join(2000);
        }

        assertThat(received).doesNotHaveDuplicates().hasSize(producers * perProducer);
        // each producer's own items keep their order
        for (int p = 0; p < producers; p++) {
            String prefix = p + ":";
            List<Integer> sequence = received.stream()
                    .filter(s -> s.startsWith(prefix))
                    .map(s -> Integer.parseInt(s.substring(prefix.length())))
                    .toList();
            assertThat(sequence).isSorted();
        }

        queue.close();
    }

    @Test
    void shouldRejectEnqueueAfterClose() {
        PressureQueue<String> queue = new PressureQueue<>(new Channel<>());
        queue.close();
        queue.close(); // idempotent

        assertThatThrownBy(() -> queue.enqueue("late")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldRejectNullItem() {
        PressureQueue<String> queue = new PressureQueue<>(new Channel<>());

        assertThatThrownBy(() -> queue.enqueue(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("item");
        assertThat(queue.length()).isZero();
        queue.close();
    }

    @Test
    void shouldSignalEmptyOnPeek() {
        PressureQueue<String> queue = new PressureQueue<>(new Channel<>());

        assertThatThrownBy(queue::peek).isInstanceOf(QueueEmptyException.class);
        queue.close();
    }
}
