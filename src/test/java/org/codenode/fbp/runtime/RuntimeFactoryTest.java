package org.codenode.fbp.runtime;

import org.codenode.fbp.channels.InMemoryChannel;
import org.codenode.fbp.junit.extensions.logging.LogWatchExtension;
import org.codenode.fbp.model.CodeNode;
import org.codenode.fbp.model.Connection;
import org.codenode.fbp.model.FlowConfigurationException;
import org.codenode.fbp.model.FlowGraph;
import org.codenode.fbp.model.GraphNode;
import org.codenode.fbp.model.Port;
import org.codenode.fbp.runtime.shapes.In2Out3Runtime;
import org.codenode.fbp.runtime.shapes.In3Out1Runtime;
import org.codenode.fbp.runtime.shapes.In3SinkRuntime;
import org.codenode.fbp.runtime.shapes.Out2GeneratorRuntime;
import org.codenode.fbp.runtime.shapes.Out3GeneratorRuntime;
import org.codenode.fbp.runtime.shapes.TransformerRuntime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class RuntimeFactoryTest {

    private ExecutorService scheduler;
    private RuntimeFactory factory;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newCachedThreadPool();
        factory = new RuntimeFactory(RuntimeSettings.defaults().withDefaultChannelCapacity(8), new RuntimeRegistry());
    }

    @AfterEach
    void tearDown() {
        factory.getRegistry().stopAll();
        scheduler.shutdownNow();
    }

    @Test
    void everyShapeHasMatchingPortsAndChannels() {
        List<ChannelRuntime> runtimes = List.of(
            factory.createGenerator(NodeOptions.named("g1"), ctx -> 1),
            factory.createOut2Generator(NodeOptions.named("g2"), ctx -> ProcessResult2.both(1, 2)),
            factory.createOut3Generator(NodeOptions.named("g3"), ctx -> ProcessResult3.all(1, 2, 3)),
            factory.createSink(NodeOptions.named("s1"), (Object a) -> { }),
            factory.createIn2Sink(NodeOptions.named("s2"), (Object a, Object b) -> { }),
            factory.createIn3Sink(NodeOptions.named("s3"), (Object a, Object b, Object c) -> { }),
            factory.createTransformer(NodeOptions.named("t"), (Object a) -> a),
            factory.createIn1Out2Processor(NodeOptions.named("p12"), (Object a) -> ProcessResult2.first(a)),
            factory.createIn1Out3Processor(NodeOptions.named("p13"), (Object a) -> ProcessResult3.third(a)),
            factory.createIn2Out1Processor(NodeOptions.named("p21"), (Object a, Object b) -> a),
            factory.createIn2Out2Processor(NodeOptions.named("p22"), (Object a, Object b) -> ProcessResult2.of(a, b)),
            factory.createIn2Out3Processor(NodeOptions.named("p23"), (Object a, Object b) -> ProcessResult3.of(a, b, null)),
            factory.createIn3Out1Processor(NodeOptions.named("p31"), (Object a, Object b, Object c) -> c),
            factory.createIn3Out2Processor(NodeOptions.named("p32"), (Object a, Object b, Object c) -> ProcessResult2.none()),
            factory.createIn3Out3Processor(NodeOptions.named("p33"), (Object a, Object b, Object c) -> ProcessResult3.of(a, b, c)));

        assertEquals(15, runtimes.size());
        for (ChannelRuntime runtime : runtimes) {
            CodeNode node = runtime.getCodeNode();
            assertEquals(runtime.getInputCount(), node.inputPorts().size(), node.name());
            assertEquals(runtime.getOutputCount(), node.outputPorts().size(), node.name());
            assertTrue(runtime.getInputCount() + runtime.getOutputCount() >= 1);
            assertTrue(runtime.isIdle());
            for (int i = 0; i < runtime.getOutputCount(); i++) {
                assertEquals(8, runtime.<Object>outputAt(i).getCapacity());
            }
        }
    }

    @Test
    void genericPortsFollowTheNamingConvention() {
        TransformerRuntime<Object, Object> single = factory.createTransformer(NodeOptions.named("single"), a -> a);
        In3Out1Runtime<Object, Object, Object, Object> triple =
            factory.createIn3Out1Processor(NodeOptions.named("triple"), (a, b, c) -> a);

        assertThat(single.getCodeNode().inputPorts()).extracting(Port::name).containsExactly("input");
        assertThat(single.getCodeNode().outputPorts()).extracting(Port::name).containsExactly("output");
        assertThat(triple.getCodeNode().inputPorts()).extracting(Port::name).containsExactly("input1", "input2", "input3");
    }

    @Test
    void zeroByZeroAndOversizedAritiesAreRejected() {
        RuntimeEnvironment environment = factory.getEnvironment();
        assertThatThrownBy(() -> new ChannelRuntime(NodeOptions.named("nothing"), 0, 0, (v, c) -> null, environment) { })
            .isInstanceOf(FlowConfigurationException.class)
            .hasMessageContaining("neither inputs nor outputs");
        assertThatThrownBy(() -> new ChannelRuntime(NodeOptions.named("wide"), 4, 1, (v, c) -> null, environment) { })
            .isInstanceOf(FlowConfigurationException.class)
            .hasMessageContaining("Unsupported arity 4x1");
    }

    @Test
    void suppliedNodeMustMatchShape() {
        CodeNode twoInputs = CodeNode.builder("join", "Join")
            .input("a", Integer.class)
            .input("b", Integer.class)
            .output("sum", Integer.class)
            .build();

        assertThatThrownBy(() -> factory.createTransformer(NodeOptions.forNode(twoInputs), a -> a))
            .isInstanceOf(FlowConfigurationException.class)
            .hasMessageContaining("has 2 inputs and 1 outputs");

        assertEquals("join", factory.createIn2Out1Processor(NodeOptions.forNode(twoInputs), (Integer x, Integer y) -> x + y).getNodeId());
    }

    @Test
    void explicitCapacitiesAndIndependentControl() {
        Out3GeneratorRuntime<Integer, Integer, Integer> generator = factory.createOut3Generator(
            NodeOptions.named("caps").description("capacity test").outputCapacities(0, -1).independent(),
            ctx -> ProcessResult3.none());

        assertEquals(0, generator.<Integer>outputAt(0).getCapacity());
        assertEquals(-1, generator.<Integer>outputAt(1).getCapacity());
        assertEquals(8, generator.<Integer>outputAt(2).getCapacity());
        assertTrue(generator.isIndependentlyControlled());
        assertEquals("capacity test", generator.getCodeNode().description());
        assertThatThrownBy(() -> NodeOptions.named("bad").outputCapacities(-5)).isInstanceOf(FlowConfigurationException.class);
    }

    @Test
    void fromGraphTakesCapacitiesFromOutgoingConnections() {
        CodeNode source = CodeNode.builder("source", "Source")
            .output("first", Integer.class)
            .output("second", Integer.class)
            .build();
        CodeNode target = CodeNode.builder("target", "Target").input("in", Integer.class).build();
        FlowGraph graph = FlowGraph.of("g", "Graph", "1.0.0", List.of(source, target), List.of(
            Connection.between("c1", source.outputPorts().get(0), target.inputPorts().get(0), 3)));

        Out2Capacities capacities = capacitiesOf(NodeOptions.fromGraph(graph, "source"));

        assertEquals(3, capacities.first());
        assertEquals(8, capacities.second());
        assertThatThrownBy(() -> NodeOptions.fromGraph(graph, "missing")).isInstanceOf(FlowConfigurationException.class);
    }

    @Test
    void fromGraphRejectsInvalidConnectionCapacity() {
        CodeNode source = CodeNode.builder("source", "Source").output("out", Integer.class).build();
        CodeNode target = CodeNode.builder("target", "Target").input("in", Integer.class).build();
        FlowGraph graph = FlowGraph.of("g", "Graph", "1.0.0", List.of(source, target), List.of(
            Connection.between("c1", source.outputPorts().get(0), target.inputPorts().get(0), -5)));

        assertThatThrownBy(() -> NodeOptions.fromGraph(graph, "source"))
            .isInstanceOf(FlowConfigurationException.class)
            .hasMessageContaining("Invalid channel capacity -5 on output 'out' of node 'source'");
    }

    @Test
    void fromGraphRejectsGraphNodes() {
        CodeNode child = CodeNode.builder("child", "Child").input("in", String.class).build();
        GraphNode group = GraphNode.builder("group", "Group")
            .child(child)
            .exposeInput("in", String.class, "child", "in")
            .build();
        FlowGraph graph = FlowGraph.of("g", "Graph", "1.0.0", List.of(group), List.of());

        assertThatThrownBy(() -> NodeOptions.fromGraph(graph, "group"))
            .isInstanceOf(FlowConfigurationException.class)
            .hasMessageContaining("graph node");
        assertEquals("child", factory.createSink(NodeOptions.fromGraph(graph, "child"), (String s) -> { }).getNodeId());
    }

    private record Out2Capacities(int first, int second) {
    }

    private Out2Capacities capacitiesOf(NodeOptions options) {
        Out2GeneratorRuntime<Integer, Integer> runtime = factory.createOut2Generator(options, ctx -> ProcessResult2.<Integer, Integer>none());
        return new Out2Capacities(runtime.<Integer>outputAt(0).getCapacity(), runtime.<Integer>outputAt(1).getCapacity());
    }

    @Test
    void filterForwardsOnlyAcceptedValues() throws Exception {
        InMemoryChannel<Integer> input = new InMemoryChannel<>("numbers", 8);
        TransformerRuntime<Integer, Integer> evens = factory.createFilter(NodeOptions.named("evens"), v -> v % 2 == 0);
        evens.setInputChannel(input);
        evens.start(scheduler);

        for (int i = 1; i <= 6; i++) {
            input.send(i);
        }
        input.close();

        List<Integer> received = new CopyOnWriteArrayList<>();
        for (int i = 0; i < 3; i++) {
            received.add(evens.getOutputChannel().poll(2, TimeUnit.SECONDS).orElseThrow());
        }
        assertEquals(List.of(2, 4, 6), received);
        await().atMost(Duration.ofSeconds(2)).until(evens::isIdle);
    }

    @Test
    void threeInputSinkAndTwoInputThreeOutputProcessorWorkTogether() throws Exception {
        InMemoryChannel<Integer> a = new InMemoryChannel<>("a", 2);
        InMemoryChannel<Integer> b = new InMemoryChannel<>("b", 2);
        In2Out3Runtime<Integer, Integer, Integer, Integer, Integer> math = factory.createIn2Out3Processor(
            NodeOptions.named("math"), (x, y) -> ProcessResult3.all(x + y, x - y, x * y));
        math.setInputChannel1(a);
        math.setInputChannel2(b);

        List<String> lines = new CopyOnWriteArrayList<>();
        In3SinkRuntime<Integer, Integer, Integer> printer = factory.createIn3Sink(NodeOptions.named("printer"),
            (sum, diff, product) -> lines.add(sum + "," + diff + "," + product));
        printer.setInputChannel1(math.getOutputChannel1());
        printer.setInputChannel2(math.getOutputChannel2());
        printer.setInputChannel3(math.getOutputChannel3());

        printer.start(scheduler);
        math.start(scheduler);
        a.send(6);
        b.send(2);

        await().atMost(Duration.ofSeconds(2)).until(() -> lines.size() == 1);
        assertEquals("8,4,12", lines.get(0));
        assertEquals(2, factory.getRegistry().count());
    }
}
