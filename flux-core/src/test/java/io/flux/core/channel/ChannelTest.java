package io.flux.core.channel;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ChannelTest {

    @Test
    void shouldHandOffToReceiver() throws Exception {
        Channel<String> channel = new Channel<>();
        CompletableFuture<Optional<String>> received = CompletableFuture.supplyAsync(() -> {
            try {
                return channel.receive();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        channel.send("hello");

        assertThat(received.get(5, TimeUnit.SECONDS)).contains("hello");
    }

    @Test
    void shouldBlockSenderUntilTaken() throws Exception {
        Channel<Integer> channel = new Channel<>();
        AtomicBoolean sent = new AtomicBoolean(false);
        Thread sender = new Thread(() -> {
            try {
                channel.send(1);
                sent.set(true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        sender.start();

        Thread.sleep(100);
        assertThat(sent).isFalse();

        assertThat(channel.receive()).contains(1);
        await().atMost(2, TimeUnit.SECONDS).untilTrue(sent);
        sender.join(2000);
    }

    @Test
    void shouldTimeOutOfferWithoutReceiver() throws Exception {
        Channel<String> channel = new Channel<>();

        long start = System.nanoTime();
        boolean accepted = channel.offer("lost", Duration.ofMillis(20));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(accepted).isFalse();
        assertThat(elapsedMs).isLessThan(1000);
        // the withdrawn item must not be delivered later
        assertThat(channel.poll(Duration.ofMillis(20))).isEmpty();
    }

    @Test
    void shouldAcceptOfferWhenReceiverWaiting() throws Exception {
        Channel<String> channel = new Channel<>();
        CompletableFuture<Optional<String>> received = CompletableFuture.supplyAsync(() -> {
            try {
                return channel.poll(Duration.ofSeconds(5));
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        assertThat(channel.offer("taken", Duration.ofSeconds(5))).isTrue();
        assertThat(received.get(5, TimeUnit.SECONDS)).contains("taken");
    }

    @Test
    void shouldReturnEmptyOnPollTimeout() throws Exception {
        Channel<String> channel = new Channel<>();

        assertThat(channel.poll(Duration.ofMillis(10))).isEmpty();
    }

    @Test
    void shouldFailBlockedSenderOnClose() throws Exception {
        Channel<String> channel = new Channel<>();
        CompletableFuture<Throwable> failure = new CompletableFuture<>();
        CountDownLatch started = new CountDownLatch(1);

        Thread sender = new Thread(() -> {
            started.countDown();
            try {
                channel.send("never");
                failure.complete(null);
            } catch (Throwable t) {
                failure.complete(t);
            }
        });
        sender.start();
        started.await(2, TimeUnit.SECONDS);
        Thread.sleep(50);

        channel.close();

        assertThat(failure.get(2, TimeUnit.SECONDS)).isInstanceOf(ChannelClosedException.class);
        assertThat(channel.receive()).isEmpty();
    }

    @Test
    void shouldWakeBlockedReceiverOnClose() throws Exception {
        Channel<String> channel = new Channel<>();
        CompletableFuture<Optional<String>> received = CompletableFuture.supplyAsync(() -> {
            try {
                return channel.receive();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(50);
        channel.close();

        assertThat(received.get(2, TimeUnit.SECONDS)).isEmpty();
        assertThat(channel.isClosed()).isTrue();
    }

    @Test
    void shouldRejectSendAfterClose() {
        Channel<String> channel = new Channel<>();
        channel.close();
        channel.close(); // idempotent

        assertThatThrownBy(() -> channel.send("late")).isInstanceOf(ChannelClosedException.class);
    }

    @Test
    void shouldWithdrawItemWhenSenderInterrupted() throws Exception {
        Channel<String> channel = new Channel<>();
        CompletableFuture<Throwable> failure = new CompletableFuture<>();

        Thread sender = new Thread(() -> {
            try {
                channel.send("withdrawn");
                failure.complete(null);
            } catch (Throwable t) {
                failure.complete(t);
            }
        });
        sender.start();
        Thread.sleep(50);
        sender.interrupt();

        assertThat(failure.get(2, TimeUnit.SECONDS)).isInstanceOf(InterruptedException.class);
        assertThat(channel.poll(Duration.ofMillis(20))).isEmpty();
    }

    @Test
    void shouldRejectNullItems() {
        Channel<String> channel = new Channel<>();

        assertThatThrownBy(() -> channel.send(null)).isInstanceOf(NullPointerException.class);
    }
}
