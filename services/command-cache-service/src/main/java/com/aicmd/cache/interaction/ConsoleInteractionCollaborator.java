package com.aicmd.cache.interaction;

import jakarta.annotation.PreDestroy;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Prompts on standard error and reads a y/n answer from standard input. Anything other
 * than a yes counts as a rejection; no line within the timeout (or end of input) counts
 * as no answer.
 *
 * <p>One reader thread owns the input for the lifetime of the bean. A blocked console read
 * cannot be interrupted, so a prompt that times out leaves the read running and its line
 * goes to the next prompt.
 */
@Component
public class ConsoleInteractionCollaborator implements InteractionCollaborator {
    private static final Logger log = LoggerFactory.getLogger(ConsoleInteractionCollaborator.class);
    private static final Set<String> YES = Set.of("y", "yes", "是");
    private static final Optional<String> END_OF_INPUT = Optional.empty();

    private final InteractionProperties properties;
    private final BufferedReader reader;
    private final PrintStream prompt;
    private final BlockingQueue<Optional<String>> lines = new LinkedBlockingQueue<>();
    private final AtomicBoolean readerStarted = new AtomicBoolean();
    private final ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "aicmd-confirm-input");
        thread.setDaemon(true);
        return thread;
    });

    @Autowired
    public ConsoleInteractionCollaborator(InteractionProperties properties) {
        this(properties, System.in, System.err);
    }

    ConsoleInteractionCollaborator(InteractionProperties properties, InputStream input, PrintStream prompt) {
        properties.validate();
        this.properties = properties;
        this.reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        this.prompt = prompt;
    }

    @Override
    public ConfirmationResult confirm(String command, CommandSource source, double confidence, Double similarity) {
        if (!properties.isEnabled()) {
            return ConfirmationResult.TIMED_OUT;
        }
        prompt.println();
        prompt.println(describe(source, confidence, similarity));
        prompt.println("  " + command);
        prompt.print("Use this command? [y/N] ");
        prompt.flush();

        startReader();
        Optional<String> line;
        try {
            line = lines.poll(properties.getTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return ConfirmationResult.TIMED_OUT;
        }
        if (line == null) {
            prompt.println();
            log.debug("confirmation timed out after {}s", properties.getTimeoutSeconds());
            return ConfirmationResult.TIMED_OUT;
        }
        if (line.isEmpty()) {
            lines.add(END_OF_INPUT);
            return ConfirmationResult.TIMED_OUT;
        }
        return YES.contains(line.get().trim().toLowerCase(Locale.ROOT))
            ? ConfirmationResult.CONFIRMED
            : ConfirmationResult.REJECTED;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private void startReader() {
        if (readerStarted.compareAndSet(false, true)) {
            executor.execute(this::readLines);
        }
    }

    private void readLines() {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(Optional.of(line));
            }
        } catch (IOException ex) {
            log.warn("could not read confirmation input error={}", ex.getMessage());
        }
        lines.add(END_OF_INPUT);
    }

    private static String describe(CommandSource source, double confidence, Double similarity) {
        return switch (source) {
            case EXACT_CACHE -> String.format(Locale.ROOT, "Cached command (confidence %.0f%%):", confidence * 100);
            case SIMILAR_CACHE -> String.format(
                Locale.ROOT,
                "Command from a similar request (similarity %.0f%%, confidence %.0f%%):",
                similarity == null ? 0.0 : similarity * 100,
                confidence * 100
            );
            case TRANSLATION -> "Suggested command:";
        };
    }
}
