package org.codenode.fbp.runtime;

import org.codenode.fbp.api.channels.ChannelClosedException;
import org.codenode.fbp.api.channels.IReceiveChannel;
import org.codenode.fbp.channels.InMemoryChannel;
import org.codenode.fbp.junit.extensions.logging.ExpectLog;
import org.codenode.fbp.junit.extensions.logging.LogLevel;
import org.codenode.fbp.junit.extensions.logging.LogWatchExtension;
import org.codenode.fbp.model.ControlConfig;
import org.codenode.fbp.model.ExecutionState;
import org.codenode.fbp.model.FlowConfigurationException;
import org.codenode.fbp.runtime.shapes.GeneratorRuntime;
import org.codenode.fbp.runtime.shapes.In1Out2Runtime;
import org.codenode.fbp.runtime.shapes.In2Out1Runtime;
import org.codenode.fbp.runtime.shapes.SinkRuntime;
import org.codenode.fbp.runtime.shapes.TransformerRuntime;
import org.codenode.fbp.testutils.ManualTimeSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Processing-loop behavior of channel runtimes: joins, selective emission, pause, stop and end of stream.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ChannelRuntimeTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(3);

    private ExecutorService scheduler;
    private RuntimeRegistry registry;
    private ManualTimeSource clock;
    private RuntimeFactory factory;
    private final List<ChannelRuntime> started = new ArrayList<>();

    @BeforeEach
    void setUp() {
        scheduler = Executors.newCachedThreadPool();
        registry = new RuntimeRegistry();
        clock = new ManualTimeSource();
        factory = new RuntimeFactory(RuntimeSettings.defaults(), registry, clock);
    }

    @AfterEach
    void tearDown() {
        started.forEach(NodeRuntime::stop);
        scheduler.shutdownNow();
    }

    private <T extends ChannelRuntime> T start(T runtime) {
        runtime.start(scheduler);
        started.add(runtime);
        return runtime;
    }

    private static <T> T receive(IReceiveChannel<T> channel) throws InterruptedException {
        return channel.poll(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)
            .orElseThrow(() -> new AssertionError("Nothing received within " + TIMEOUT));
    }

    @Test
    @Timeout(10)
    void generatorEmitsOneValuePerPeriodOfVirtualTime() throws Exception {
        AtomicInteger counter = new AtomicInteger();
        GeneratorRuntime<Integer> generator = start(factory.createGenerator(NodeOptions.named("counter"), context -> {
            context.sleep(Duration.ofMillis(100));
            return counter.incrementAndGet();
        }));
        await().atMost(TIMEOUT).until(() -> clock.getSleepers() == 1);

        clock.advanceBy(Duration.ofMillis(350));

        IReceiveChannel<Integer> output = generator.getOutputChannel();
        List<Integer> values = List.of(receive(output), receive(output), receive(output));
        assertEquals(List.of(1, 2, 3), values);
        await().atMost(TIMEOUT).until(() -> clock.getSleepers() == 1);
        assertThat(output.poll(50, TimeUnit.MILLISECONDS)).isEmpty();
    }

    @Test
    void twoInputProcessorJoinsOneValuePerInput() throws Exception {
        InMemoryChannel<Integer> left = new InMemoryChannel<>("left", 4);
        InMemoryChannel<Integer> right = new InMemoryChannel<>("right", 4);
        In2Out1Runtime<Integer, Integer, Integer> adder =
            factory.createIn2Out1Processor(NodeOptions.named("adder"), Integer::sum);
        adder.setInputChannel1(left);
        adder.setInputChannel2(right);
        start(adder);

        left.send(2);
        left.send(5);
        right.send(3);
        right.send(5);

        assertEquals(5, receive(adder.getOutputChannel()));
        assertEquals(10, receive(adder.getOutputChannel()));
        await().atMost(TIMEOUT).until(() -> adder.getMetrics().get("cycles").longValue() == 2L);
        assertEquals(4L, adder.getMetrics().get("items_received"));
        assertEquals(2L, adder.getMetrics().get("items_sent"));
    }

    @Test
    void nullResultSlotsAreNotSent() throws Exception {
        InMemoryChannel<Integer> input = new InMemoryChannel<>("input", 4);
        In1Out2Runtime<Integer, Integer, Integer> splitter = factory.createIn1Out2Processor(NodeOptions.named("splitter"),
            value -> value == 1 ? ProcessResult2.of(7, null) : ProcessResult2.second(8));
        splitter.setInputChannel(input);
        start(splitter);

        input.send(1);
        input.send(2);

        assertEquals(7, receive(splitter.getOutputChannel1()));
        assertEquals(8, receive(splitter.getOutputChannel2()));
        assertThat(splitter.getOutputChannel1().poll(50, TimeUnit.MILLISECONDS)).isEmpty();
        assertEquals(0, splitter.getOutputChannel2().size());
    }

    @Test
    @Timeout(10)
    void pausedSinkConsumesNothingUntilResumed() throws Exception {
        InMemoryChannel<Integer> input = new InMemoryChannel<>("input", 10);
        List<Integer> consumed = new CopyOnWriteArrayList<>();
        SinkRuntime<Integer> sink = factory.createSink(NodeOptions.named("sink"), consumed::add);
        sink.setInputChannel(input);
        start(sink);

        input.send(1);
        input.send(2);
        await().atMost(TIMEOUT).until(() -> consumed.size() == 2);

        sink.pause();
        // A poll already in flight when pause() is called may still take one item; wait until it has timed out.
        Thread.sleep(100);
        input.send(3);
        input.send(4);
        input.send(5);

        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1))
            .until(() -> consumed.size() == 2 && input.size() == 3);

        sink.resume();

        await().atMost(TIMEOUT).until(() -> consumed.size() == 5);
        assertEquals(List.of(1, 2, 3, 4, 5), consumed);
        assertEquals(0, input.size());
    }

    @Test
    void stopWhilePausedClosesOutputsAndGoesIdle() throws Exception {
        InMemoryChannel<String> input = new InMemoryChannel<>("input", 4);
        TransformerRuntime<String, String> upper = factory.createTransformer(NodeOptions.named("upper"), String::toUpperCase);
        upper.setInputChannel(input);
        start(upper);
        upper.pause();

        upper.stop();

        assertEquals(ExecutionState.IDLE, upper.getExecutionState());
        assertFalse(registry.isRegistered(upper.getNodeId()));
        assertTrue(upper.getOutputChannel().isClosedForReceive());
        assertThatThrownBy(() -> upper.getOutputChannel().receive()).isInstanceOf(ChannelClosedException.class);
    }

    @Test
    void closedInputEndsLoopGracefully() throws Exception {
        InMemoryChannel<String> input = new InMemoryChannel<>("input", 4);
        TransformerRuntime<String, Integer> length = factory.createTransformer(NodeOptions.named("length"), String::length);
        length.setInputChannel(input);
        start(length);

        input.send("abc");
        input.close();

        assertEquals(3, receive(length.getOutputChannel()));
        await().atMost(TIMEOUT).until(length::isIdle);
        assertFalse(registry.isRegistered(length.getNodeId()));
        assertTrue(length.isHealthy());
        await().atMost(TIMEOUT).until(() -> length.getOutputChannel().isClosedForReceive());
    }

    @Test
    void restartedProducerServesExistingConsumers() throws Exception {
        InMemoryChannel<Integer> input = new InMemoryChannel<>("input", 4);
        TransformerRuntime<Integer, Integer> doubler = factory.createTransformer(NodeOptions.named("doubler"), v -> v * 2);
        doubler.setInputChannel(input);
        IReceiveChannel<Integer> consumerView = doubler.getOutputChannel();
        start(doubler);
        input.send(1);
        assertEquals(2, receive(consumerView));

        doubler.stop();
        assertTrue(consumerView.isClosedForReceive());
        doubler.start(scheduler);

        input.send(2);
        assertEquals(4, receive(consumerView));
    }

    @Test
    @Timeout(10)
    void restartRetiresTaskThatIgnoredCancellation() throws Exception {
        InMemoryChannel<Integer> input = new InMemoryChannel<>("input", 16);
        CountDownLatch slowCallStarted = new CountDownLatch(1);
        AtomicBoolean restarted = new AtomicBoolean();
        Set<String> threadsAfterRestart = ConcurrentHashMap.newKeySet();
        TransformerRuntime<Integer, Integer> stubborn = factory.createTransformer(NodeOptions.named("stubborn"), (Integer v) -> {
            if (v == 0) {
                slowCallStarted.countDown();
                try {
                    Thread.sleep(500);
                } catch (InterruptedException e) {
                    // cancellation deliberately ignored
                }
            } else if (restarted.get()) {
                threadsAfterRestart.add(Thread.currentThread().getName());
            }
            return v;
        });
        stubborn.setInputChannel(input);
        start(stubborn);
        input.send(0);
        assertTrue(slowCallStarted.await(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS));

        stubborn.start(scheduler);
        restarted.set(true);
        for (int i = 1; i <= 10; i++) {
            input.send(i);
        }

        List<Integer> received = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            received.add(receive(stubborn.getOutputChannel()));
        }
        assertEquals(List.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10), received);
        assertThat(threadsAfterRestart).hasSize(1);
        assertTrue(stubborn.isRunning());
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "divider stopped with ERROR due to ArithmeticException.*")
    void failingFunctionMovesToErrorAndClosesOutputs() throws Exception {
        InMemoryChannel<Integer> input = new InMemoryChannel<>("input", 4);
        TransformerRuntime<Integer, Integer> divider = factory.createTransformer(NodeOptions.named("divider"), v -> 10 / v);
        divider.setInputChannel(input);
        start(divider);

        input.send(0);

        await().atMost(TIMEOUT).until(() -> divider.getExecutionState() == ExecutionState.ERROR);
        await().atMost(TIMEOUT).until(() -> divider.getOutputChannel().isClosedForReceive());
        assertFalse(registry.isRegistered(divider.getNodeId()));
        assertThat(divider.getErrors()).hasSize(1);
        assertThat(divider.getErrors().get(0).details()).contains("ArithmeticException");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "pair stopped with ERROR due to IllegalStateException.*ProcessResult2.*")
    void multiOutputFunctionMustReturnProcessResult() throws Exception {
        InMemoryChannel<Integer> input = new InMemoryChannel<>("input", 4);
        @SuppressWarnings({"unchecked", "rawtypes"})
        ProcessFunction1<Integer, ProcessResult2<Integer, Integer>> wrong = (ProcessFunction1) v -> v;
        In1Out2Runtime<Integer, Integer, Integer> pair = factory.createIn1Out2Processor(NodeOptions.named("pair"), wrong);
        pair.setInputChannel(input);
        start(pair);

        input.send(1);

        await().atMost(TIMEOUT).until(() -> pair.getExecutionState() == ExecutionState.ERROR);
    }

    @Test
    void startWithUnboundInputIsRejected() {
        SinkRuntime<Object> sink = factory.createSink(NodeOptions.named("dangling"), value -> { });

        assertThatThrownBy(() -> sink.start(scheduler))
            .isInstanceOf(FlowConfigurationException.class)
            .hasMessageContaining("input 1 is not connected");
        assertTrue(sink.isIdle());
        assertFalse(registry.isRegistered(sink.getNodeId()));
    }

    @Test
    @Timeout(10)
    void speedAttenuationDelaysEachCycle() throws Exception {
        InMemoryChannel<Integer> input = new InMemoryChannel<>("input", 4);
        List<Integer> consumed = new CopyOnWriteArrayList<>();
        SinkRuntime<Integer> slow = factory.createSink(NodeOptions.named("slow")
            .controlConfig(ControlConfig.defaults().withSpeedAttenuation(Duration.ofSeconds(1))), consumed::add);
        slow.setInputChannel(input);
        start(slow);

        input.send(1);
        input.send(2);

        await().atMost(TIMEOUT).until(() -> consumed.size() == 1 && clock.getSleepers() == 1);
        await().during(Duration.ofMillis(100)).atMost(Duration.ofSeconds(1)).until(() -> consumed.size() == 1);

        clock.advanceBy(Duration.ofSeconds(1));

        await().atMost(TIMEOUT).until(() -> consumed.size() == 2);
    }
}
