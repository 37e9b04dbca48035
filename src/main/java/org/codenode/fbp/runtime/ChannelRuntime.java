package org.codenode.fbp.runtime;

import org.codenode.fbp.api.channels.IReceiveChannel;
import org.codenode.fbp.model.CodeNode;
import org.codenode.fbp.model.FlowConfigurationException;
import org.codenode.fbp.model.Port;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * A node runtime with K input and L output channels ({@code 0 <= K, L <= 3}, {@code K + L >= 1}) and a
 * processing function invoked once per cycle.
 * <p>
 * One cycle of the loop:
 * <ol>
 *   <li>Wait while paused; leave the loop once the runtime is no longer running.</li>
 *   <li>Receive one value from every input, in input order (a join). A closed and drained input ends the
 *       loop gracefully.</li>
 *   <li>Invoke the function with the values, or with the {@link NodeContext} for generators.</li>
 *   <li>Send each non-null result on its output. For one output the result is the value itself, for more
 *       it is a {@link ProcessResult}. Sends block while an output is full.</li>
 *   <li>Wait for the node's speed attenuation, if any.</li>
 * </ol>
 * Outputs are owned by the runtime: they are closed when a run ends and renewed at the next start.
 * Inputs are the outputs of other runtimes and must be bound before {@link #start(ExecutorService)}.
 * <p>
 * Typed subclasses expose the channels under their conventional names.
 */
public abstract class ChannelRuntime extends NodeRuntime {

    public static final int MAX_ARITY = 3;

    /**
     * Adapts a typed processing function to the untyped loop.
     */
    @FunctionalInterface
    protected interface Invocation {
        Object invoke(Object[] inputs, NodeContext context) throws Exception;
    }

    private final int inputCount;
    private final AtomicReferenceArray<IReceiveChannel<?>> inputs;
    private final List<OutputSlot<?>> outputs;
    private final Invocation invocation;
    private final TimeSource timeSource;
    private volatile NodeContext context;

    private final AtomicLong cycles = new AtomicLong();
    private final AtomicLong itemsReceived = new AtomicLong();
    private final AtomicLong itemsSent = new AtomicLong();

    /**
     * @throws FlowConfigurationException if the arity is out of range, or a supplied node's ports do not
     *                                    match it.
     */
    protected ChannelRuntime(NodeOptions options, int inputCount, int outputCount,
                             Invocation invocation, RuntimeEnvironment environment) {
        super(resolveNode(options, inputCount, outputCount), environment.registry(), environment.settings());
        this.inputCount = inputCount;
        this.inputs = new AtomicReferenceArray<>(inputCount);
        this.invocation = invocation;
        this.timeSource = environment.timeSource();
        List<OutputSlot<?>> slots = new ArrayList<>(outputCount);
        List<Port> ports = getCodeNode().outputPorts();
        for (int i = 0; i < outputCount; i++) {
            int capacity = options.outputCapacity(i, environment.settings().defaultChannelCapacity());
            slots.add(new OutputSlot<>(getCodeNode().name() + "." + ports.get(i).name(), capacity));
        }
        this.outputs = List.copyOf(slots);
    }

    private static CodeNode resolveNode(NodeOptions options, int inputCount, int outputCount) {
        if (inputCount < 0 || outputCount < 0 || inputCount > MAX_ARITY || outputCount > MAX_ARITY) {
            throw new FlowConfigurationException(String.format(
                "Unsupported arity %dx%d for node '%s': inputs and outputs must be between 0 and %d",
                inputCount, outputCount, options.getName(), MAX_ARITY), List.of("arity out of range"));
        }
        if (inputCount == 0 && outputCount == 0) {
            throw new FlowConfigurationException(
                "Node '" + options.getName() + "' has neither inputs nor outputs", List.of("arity 0x0"));
        }
        return options.resolveNode(inputCount, outputCount);
    }

    /**
     * Starts the processing loop.
     *
     * @throws FlowConfigurationException if an input channel is not bound.
     */
    public void start(ExecutorService scheduler) {
        List<String> unbound = new ArrayList<>();
        for (int i = 0; i < inputCount; i++) {
            if (inputs.get(i) == null) {
                unbound.add("input " + (i + 1) + " is not connected");
            }
        }
        if (!unbound.isEmpty()) {
            throw new FlowConfigurationException("Cannot start node '" + getNodeId() + "': " + String.join(", ", unbound), unbound);
        }
        start(scheduler, this::processLoop);
    }

    public int getInputCount() {
        return inputCount;
    }

    public int getOutputCount() {
        return outputs.size();
    }

    @SuppressWarnings("unchecked")
    protected <T> IReceiveChannel<T> inputAt(int index) {
        return (IReceiveChannel<T>) inputs.get(index);
    }

    protected void bindInput(int index, IReceiveChannel<?> channel) {
        inputs.set(index, channel);
    }

    @SuppressWarnings("unchecked")
    protected <T> OutputSlot<T> outputAt(int index) {
        return (OutputSlot<T>) outputs.get(index);
    }

    @Override
    protected void onStarting() {
        for (OutputSlot<?> output : outputs) {
            output.renew();
        }
        context = new NodeContext(getNodeId(), timeSource, () -> isRunning() || isPaused());
    }

    @Override
    protected void onTerminated() {
        for (OutputSlot<?> output : outputs) {
            output.close();
        }
    }

    @Override
    protected void onResumedFromPause() {
        NodeContext current = context;
        if (current != null) {
            current.resync();
        }
    }

    private void processLoop() throws Exception {
        NodeContext ctx = context;
        Duration attenuation = getCodeNode().controlConfig().speedAttenuation();
        while (awaitRunnable()) {
            Object[] values = new Object[inputCount];
            if (!receiveAll(values)) {
                break;
            }
            if (inputCount > 0 && !awaitRunnable()) {
                log.debug("{} stopped with a received input tuple pending", getDisplayName());
                break;
            }
            Object result = invocation.invoke(values, ctx);
            cycles.incrementAndGet();
            emit(result);
            if (!attenuation.isZero()) {
                ctx.delay(attenuation);
            }
        }
    }

    private boolean receiveAll(Object[] values) throws InterruptedException {
        long pollMillis = settings.pausePollMillis();
        for (int i = 0; i < inputCount; i++) {
            IReceiveChannel<?> channel = inputs.get(i);
            Optional<?> value = Optional.empty();
            while (value.isEmpty()) {
                if (!awaitRunnable()) {
                    return false;
                }
                value = channel.poll(pollMillis, TimeUnit.MILLISECONDS);
            }
            values[i] = value.get();
            itemsReceived.incrementAndGet();
        }
        return true;
    }

    private void emit(Object result) throws InterruptedException {
        if (result == null || outputs.isEmpty()) {
            return;
        }
        if (outputs.size() == 1) {
            send(0, result);
            return;
        }
        if (!(result instanceof ProcessResult processResult) || processResult.arity() != outputs.size()) {
            throw new IllegalStateException(String.format("Node '%s' has %d outputs and must return a ProcessResult%d, got %s",
                getNodeId(), outputs.size(), outputs.size(), result.getClass().getSimpleName()));
        }
        for (int i = 0; i < outputs.size(); i++) {
            Object value = processResult.valueAt(i);
            if (value != null) {
                send(i, value);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void send(int index, Object value) throws InterruptedException {
        if (Thread.currentThread().isInterrupted() || !isCurrentRun()) {
            throw new InterruptedException("Cancelled before sending");
        }
        ((OutputSlot<Object>) outputs.get(index)).send(value);
        itemsSent.incrementAndGet();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("cycles", cycles.get());
        metrics.put("items_received", itemsReceived.get());
        metrics.put("items_sent", itemsSent.get());
        for (int i = 0; i < outputs.size(); i++) {
            metrics.put("output_" + (i + 1) + "_buffered", outputs.get(i).size());
        }
    }
}
