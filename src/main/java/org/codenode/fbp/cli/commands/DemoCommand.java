package org.codenode.fbp.cli.commands;

import com.typesafe.config.Config;
import org.codenode.fbp.cli.CommandLineInterface;
import org.codenode.fbp.cli.demo.StopWatchFlow;
import org.codenode.fbp.model.FlowExecutionStatus;
import org.codenode.fbp.runtime.RuntimeSettings;
import org.codenode.fbp.runtime.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs the stopwatch flow for a number of ticks, pausing and resuming the whole flow halfway.
 */
@Command(
    name = "demo",
    description = "Runs a stopwatch flow (timer generator -> display sink) and prints every reading."
)
public class DemoCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(DemoCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-n", "--ticks"}, description = "Number of stopwatch ticks to show (default: fbp.demo.ticks).")
    private Integer ticks;

    @Option(names = {"-t", "--tick-millis"}, description = "Milliseconds per tick (default: fbp.demo.tickMillis).")
    private Long tickMillis;

    @Override
    public Integer call() throws Exception {
        final Config config = parent.getConfig(spec.commandLine());
        final int tickCount = ticks != null ? ticks : config.getInt("fbp.demo.ticks");
        final long millis = tickMillis != null ? tickMillis : config.getLong("fbp.demo.tickMillis");
        if (tickCount < 1 || millis < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--ticks and --tick-millis must be positive");
        }

        final PrintWriter out = spec.commandLine().getOut();
        final StopWatchFlow flow = new StopWatchFlow(RuntimeSettings.fromConfig(config), TimeSource.system(),
            Duration.ofMillis(millis), reading -> {
                out.println(reading);
                out.flush();
            });
        final long timeoutMillis = millis * (tickCount + 5L) + 1000L;
        final ExecutorService scheduler = Executors.newCachedThreadPool();
        try {
            flow.start(scheduler);
            final int half = Math.max(1, tickCount / 2);
            awaitReadings(flow, half, timeoutMillis);
            flow.pause();
            out.println("-- paused --");
            Thread.sleep(2 * millis);
            flow.resume();
            out.println("-- resumed --");
            awaitReadings(flow, tickCount, timeoutMillis);
        } finally {
            flow.stop();
            scheduler.shutdownNow();
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.warn("Demo runtimes did not terminate within 5 seconds");
            }
        }

        final FlowExecutionStatus status = flow.getController().getStatus();
        out.printf("Flow '%s' finished: %d readings, %d nodes %s%n",
            flow.getGraph().name(), flow.getReadings().size(), status.totalNodes(), status.overallState());
        return 0;
    }

    private static void awaitReadings(StopWatchFlow flow, int count, long timeoutMillis) throws InterruptedException {
        final long deadline = System.currentTimeMillis() + timeoutMillis;
        while (flow.getReadings().size() < count) {
            if (System.currentTimeMillis() > deadline) {
                throw new IllegalStateException("Stopwatch produced only " + flow.getReadings().size() + " of " + count + " readings");
            }
            Thread.sleep(10);
        }
    }
}
