package com.myla.channels;

import com.myla.shared.model.InboundMessage;
import com.myla.shared.model.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.time.Instant;

/**
 * Interactive console channel. Each line is one query; {@code /quit} or end of input stops it.
 */
public class CliAdapter implements ChannelAdapter {

    private static final Logger log = LoggerFactory.getLogger(CliAdapter.class);

    private final BufferedReader reader;
    private final PrintStream out;
    private volatile boolean running;
    private Thread readThread;
    private Runnable onStop;

    public CliAdapter(BufferedReader reader, PrintStream out) {
        this.reader = reader;
        this.out = out;
    }

    public void onStop(Runnable callback) {
        this.onStop = callback;
    }

    @Override
    public String id() {
        return "cli";
    }

    @Override
    public void start(MessageSink sink) {
        readThread = new Thread(() -> runLoop(sink), "myla-cli");
        readThread.setDaemon(true);
        readThread.start();
    }

    void runLoop(MessageSink sink) {
        running = true;
        out.println("Myla CLI (type /agents to list agents, /quit to stop)");
        while (running) {
            out.print("> ");
            out.flush();
            String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                if (!running) break;
                log.warn("Input read error: {}", e.getMessage());
                continue;
            }

            if (line == null) {
                finish();
                break;
            }
            var input = line.trim();
            if (input.isEmpty()) continue;
            if ("/quit".equals(input) || "/exit".equals(input)) {
                finish();
                break;
            }

            try {
                sink.accept(new InboundMessage("cli-user", "cli", input, Instant.now()));
            } catch (RuntimeException e) {
                log.error("Message handling error: {}", e.getMessage(), e);
                out.println("Message handling error: " + e.getMessage());
            }
        }
    }

    private void finish() {
        stop();
        if (onStop != null) onStop.run();
    }

    @Override
    public void send(OutboundMessage msg) {
        out.println(msg.content());
    }

    @Override
    public void stop() {
        running = false;
        if (readThread != null && readThread != Thread.currentThread()) readThread.interrupt();
    }
}
