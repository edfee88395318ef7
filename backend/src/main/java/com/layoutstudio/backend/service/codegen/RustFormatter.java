package com.layoutstudio.backend.service.codegen;

import com.layoutstudio.backend.config.LayoutStudioProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * Pipes generated code through {@code rustfmt}. Formatting is cosmetic, so
 * any failure falls back to the unformatted text.
 */
@Component
public class RustFormatter {
    private static final Logger log = LoggerFactory.getLogger(RustFormatter.class);

    private final LayoutStudioProperties.Rustfmt settings;

    public RustFormatter(LayoutStudioProperties props) {
        this.settings = props.rustfmt();
    }

    public String formatOrKeep(String code) {
        try {
            return format(code);
        } catch (FormatException e) {
            log.warn("Could not format generated code, keeping it unformatted: {}", e.getMessage());
            return code;
        }
    }

    public String format(String code) throws FormatException {
        Process process;
        try {
            process = new ProcessBuilder(List.of(settings.command(), "--emit=stdout", "--edition=2021")).start();
        } catch (IOException e) {
            throw new FormatException(settings.command() + " not available: " + e.getMessage(), e);
        }

        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());
        try (OutputStream in = process.getOutputStream()) {
            in.write(code.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            process.destroyForcibly();
            throw new FormatException("failed to write to " + settings.command() + ": " + e.getMessage(), e);
        }

        try {
            if (!process.waitFor(settings.timeout().toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new FormatException(settings.command() + " timed out after " + settings.timeout(), null);
            }
            if (process.exitValue() != 0) {
                throw new FormatException(settings.command() + " exited with " + process.exitValue()
                        + ": " + stderr.join().trim(), null);
            }
            return stdout.join();
        } catch (CompletionException e) {
            throw new FormatException("failed to read " + settings.command() + " output: " + e.getCause(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new FormatException("interrupted while waiting for " + settings.command(), e);
        }
    }

    private static CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream s = stream) {
                return new String(s.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    public static class FormatException extends Exception {
        public FormatException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
