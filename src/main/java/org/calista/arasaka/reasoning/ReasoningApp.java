package org.calista.arasaka.reasoning;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.reasoning.core.ReasoningComposer;
import org.calista.arasaka.reasoning.core.ReasoningKernel;
import org.calista.arasaka.reasoning.events.ReasoningEvent;
import org.calista.arasaka.reasoning.format.ChainFormatter;
import org.calista.arasaka.reasoning.format.ChainFormatters;
import org.calista.arasaka.reasoning.reason.ChainStatistics;
import org.calista.arasaka.reasoning.reason.ReasoningChain;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * ReasoningApp: interactive console runner.
 *
 * Lifecycle:
 *  1) build kernel (no bootstrap inside build)
 *  2) kernel.bootstrap()
 *  3) compose the pipeline
 *  4) run loop: every line becomes a chain, printed in the configured format
 *  5) snapshot, close pipeline (owns pools) + kernel
 *
 * Commands: {@code exit}, {@code stats}, {@code format <text|json|markdown|html>}, {@code causal <query>}.
 */
public final class ReasoningApp {

    private static final Logger log = LogManager.getLogger(ReasoningApp.class);

    private final Path configRoot;
    private final Path cfgPath;
    private ReasoningKernel kernel;
    private ReasoningComposer.Pipeline pipeline;
    private ChainFormatter formatter;
    private final List<ReasoningChain> history = new ArrayList<>();

    public static void main(String[] args) throws Exception {
        Path cfg = args.length > 0 ? Path.of(args[0]) : Path.of("config/reasoning.json");
        new ReasoningApp(cfg).run();
    }

    public ReasoningApp(Path cfgPath) {
        this(Path.of("."), cfgPath);
    }

    /** @param configRoot directory relative config paths (and a relative baseDir) resolve against */
    public ReasoningApp(Path configRoot, Path cfgPath) {
        this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
        this.cfgPath = Objects.requireNonNull(cfgPath, "cfgPath");
    }

    public void run() throws IOException {
        try {
            start();
            try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
                runLoop(in, System.out);
            }
        } finally {
            shutdown();
        }
    }

    /** Kernel + bootstrap + pipeline. */
    public void start() throws IOException {
        kernel = ReasoningKernel.builder()
                .configRoot(configRoot)
                .build(cfgPath);
        kernel.bootstrap();
        pipeline = new ReasoningComposer().compose(kernel);
        formatter = ChainFormatters.forName(kernel.config().reasoning.outputFormat, kernel.mapper());
    }

    /**
     * Reads queries until EOF or {@code exit}; saves a snapshot at the end.
     *
     * @return number of chains produced
     */
    public int runLoop(BufferedReader in, PrintStream out) throws IOException {
        String sessionId = "sess-" + Long.toHexString(System.nanoTime());
        int produced = 0;

        log.info("Reasoning started. knowledge.size={}", kernel.knowledge().size());
        out.println("Type 'exit' to quit.");

        while (true) {
            out.print("> ");
            out.flush();
            String line = in.readLine();
            if (line == null) break;

            line = line.trim();
            if (line.equalsIgnoreCase("exit")) break;
            if (line.isEmpty()) continue;

            String lower = line.toLowerCase(Locale.ROOT);
            if (lower.equals("stats")) {
                out.println(ChainStatistics.of(history).format());
                continue;
            }
            if (lower.startsWith("format ")) {
                formatter = ChainFormatters.forName(line.substring(7), kernel.mapper());
                out.println("format: " + formatter.name());
                continue;
            }

            boolean causal = lower.startsWith("causal ");
            String query = causal ? line.substring(7).trim() : line;
            if (query.isEmpty()) continue;

            appendEvent(ReasoningEvent.of(ReasoningEvent.QUERY, sessionId, query, System.currentTimeMillis()));

            ReasoningChain chain = causal
                    ? pipeline.causal.reason(query)
                    : pipeline.engine.generateReasoningChain(query);
            history.add(chain);
            produced++;

            if (kernel.config().events.enabled) kernel.eventStore().appendChain(sessionId, chain, System.currentTimeMillis());
            out.println();
            out.println(formatter.format(chain));
            out.println();
        }

        int saved = kernel.saveSnapshot();
        appendEvent(ReasoningEvent.of(ReasoningEvent.SNAPSHOT, sessionId, "saved " + saved, System.currentTimeMillis()));
        out.println("Bye. Snapshot saved.");
        return produced;
    }

    private void appendEvent(ReasoningEvent e) throws IOException {
        if (kernel.config().events.enabled) kernel.eventStore().append(e);
    }

    private void shutdown() {
        try {
            if (pipeline != null) pipeline.close();
        } catch (RuntimeException e) {
            log.warn("pipeline close failed: {}", e.toString());
        }
        if (kernel != null) kernel.close();
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public ReasoningKernel getKernel() { return kernel; }

    public ReasoningComposer.Pipeline getPipeline() { return pipeline; }

    public Path getCfgPath() { return cfgPath; }

    public List<ReasoningChain> history() { return List.copyOf(history); }
}
