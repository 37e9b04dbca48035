package org.codenode.fbp.cli.demo;

import org.codenode.fbp.control.RootControlNode;
import org.codenode.fbp.model.CodeNode;
import org.codenode.fbp.model.Connection;
import org.codenode.fbp.model.FlowGraph;
import org.codenode.fbp.runtime.NodeOptions;
import org.codenode.fbp.runtime.ProcessResult2;
import org.codenode.fbp.runtime.RuntimeFactory;
import org.codenode.fbp.runtime.RuntimeRegistry;
import org.codenode.fbp.runtime.RuntimeSettings;
import org.codenode.fbp.runtime.TimeSource;
import org.codenode.fbp.runtime.shapes.In2SinkRuntime;
import org.codenode.fbp.runtime.shapes.Out2GeneratorRuntime;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

/**
 * A stopwatch built from two nodes: a timer emitting elapsed seconds and minutes on two outputs every
 * tick, and a display joining both values into a {@code mm:ss} reading.
 */
public class StopWatchFlow {

    public static final String TIMER_ID = "timerEmitter";
    public static final String DISPLAY_ID = "displayReceiver";

    private final FlowGraph graph;
    private final RuntimeRegistry registry = new RuntimeRegistry();
    private final Out2GeneratorRuntime<Integer, Integer> timer;
    private final In2SinkRuntime<Integer, Integer> display;
    private final List<String> readings = new CopyOnWriteArrayList<>();
    private RootControlNode controller;

    private int elapsedSeconds;
    private int elapsedMinutes;

    /**
     * @param tick     Wall time of one stopwatch second.
     * @param listener Receives every reading shown by the display.
     */
    public StopWatchFlow(RuntimeSettings settings, TimeSource timeSource, Duration tick, Consumer<String> listener) {
        this.graph = createGraph();
        this.controller = RootControlNode.createFor(graph, "StopWatchController", registry);
        RuntimeFactory factory = new RuntimeFactory(settings, registry, timeSource);

        this.timer = factory.createOut2Generator(NodeOptions.fromGraph(graph, TIMER_ID), context -> {
            context.sleep(tick);
            return nextTick();
        });
        this.display = factory.createIn2Sink(NodeOptions.fromGraph(graph, DISPLAY_ID), (seconds, minutes) -> {
            String reading = String.format("%02d:%02d", minutes, seconds);
            readings.add(reading);
            listener.accept(reading);
        });
        display.setInputChannel1(timer.getOutputChannel1());
        display.setInputChannel2(timer.getOutputChannel2());
    }

    /**
     * The model of the stopwatch: two code nodes joined by two connections with a capacity of one.
     */
    public static FlowGraph createGraph() {
        CodeNode timerNode = CodeNode.builder(TIMER_ID, "TimerEmitter")
            .output("elapsedSeconds", Integer.class)
            .output("elapsedMinutes", Integer.class)
            .build();
        CodeNode displayNode = CodeNode.builder(DISPLAY_ID, "DisplayReceiver")
            .input("seconds", Integer.class)
            .input("minutes", Integer.class)
            .build();
        List<Connection> connections = List.of(
            Connection.between("seconds", timerNode.outputPorts().get(0), displayNode.inputPorts().get(0), 1).withTypeTag("ip_int"),
            Connection.between("minutes", timerNode.outputPorts().get(1), displayNode.inputPorts().get(1), 1).withTypeTag("ip_int"));
        FlowGraph graph = FlowGraph.of("stopwatch", "StopWatch", "1.0.0", List.of(timerNode, displayNode), connections);
        graph.validate().orThrow("Flow graph 'StopWatch'");
        return graph;
    }

    private ProcessResult2<Integer, Integer> nextTick() {
        elapsedSeconds++;
        if (elapsedSeconds >= 60) {
            elapsedSeconds = 0;
            elapsedMinutes++;
        }
        return ProcessResult2.both(elapsedSeconds, elapsedMinutes);
    }

    public void start(ExecutorService scheduler) {
        controller = controller.withFlowGraph(controller.startAll());
        display.start(scheduler);
        timer.start(scheduler);
    }

    public void pause() {
        controller = controller.withFlowGraph(controller.pauseAll());
    }

    public void resume() {
        controller = controller.withFlowGraph(controller.resumeAll());
    }

    public void stop() {
        controller = controller.withFlowGraph(controller.stopAll());
    }

    public List<String> getReadings() {
        return List.copyOf(readings);
    }

    public RootControlNode getController() {
        return controller;
    }

    public RuntimeRegistry getRegistry() {
        return registry;
    }

    public FlowGraph getGraph() {
        return graph;
    }

    public Out2GeneratorRuntime<Integer, Integer> getTimer() {
        return timer;
    }

    public In2SinkRuntime<Integer, Integer> getDisplay() {
        return display;
    }
}
