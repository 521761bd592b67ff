package com.example.mediacache.cache;

import com.example.mediacache.ExternalToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs ffmpeg to grab the frame five seconds into a video.
 */
public final class FfmpegFrameExtractor implements VideoFrameExtractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegFrameExtractor.class);
    private static final String SEEK_POSITION = "00:00:05";

    private final String command;
    private final Duration timeout;

    public FfmpegFrameExtractor(String command, Duration timeout) {
        this.command = command;
        this.timeout = timeout;
    }

    @Override
    public boolean isAvailable() {
        if (command.contains(File.separator)) {
            return Files.isExecutable(Path.of(command));
        }
        String path = System.getenv("PATH");
        if (path == null) {
            return false;
        }
        for (String directory : path.split(File.pathSeparator)) {
            if (directory.isEmpty()) {
                continue;
            }
            Path candidate = Path.of(directory, command);
            if (Files.isExecutable(candidate) || Files.isExecutable(Path.of(directory, command + ".exe"))) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void extractFrame(Path video, Path output) throws ExternalToolException {
        if (!isAvailable()) {
            throw new ExternalToolException("Video thumbnails not supported, " + command + " not installed");
        }
        List<String> arguments = List.of(
                command,
                "-y",
                "-i", video.toString(),
                "-ss", SEEK_POSITION,
                "-vframes", "1",
                output.toString());
        try {
            Files.createDirectories(output.toAbsolutePath().getParent());
        } catch (IOException ex) {
            throw new ExternalToolException("Unable to create directories for " + output, ex);
        }

        Process process;
        try {
            process = new ProcessBuilder(arguments).redirectErrorStream(true).start();
        } catch (IOException ex) {
            throw new ExternalToolException(String.join(" ", arguments) + "\n" + ex.getMessage(), ex);
        }
        CompletableFuture<String> consoleOutput = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ExternalToolException(String.join(" ", arguments)
                        + "\nTimed out after " + timeout.toSeconds() + " seconds");
            }
            String console = consoleOutput.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (process.exitValue() != 0 || !Files.exists(output)) {
                throw new ExternalToolException(String.join(" ", arguments) + "\nOutput: " + console);
            }
            LOGGER.debug("Extracted frame of {} to {}", video, output);
        } catch (InterruptedException ex) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ExternalToolException("Interrupted while extracting frame from " + video, ex);
        } catch (ExecutionException | TimeoutException ex) {
            throw new ExternalToolException("Unable to read output of " + command + " for " + video, ex);
        }
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
