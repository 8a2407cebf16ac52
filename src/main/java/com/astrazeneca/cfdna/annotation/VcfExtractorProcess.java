package com.astrazeneca.cfdna.annotation;

import htsjdk.samtools.util.Log;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Running vcfExtractor process. Output of the process is read line by line on the current thread, stderr is
 * drained by another, internal thread so the process never blocks on a full pipe. Stderr is reported only
 * if the process fails.
 */
public class VcfExtractorProcess implements AutoCloseable {
    private static final Log LOG = Log.getInstance(VcfExtractorProcess.class);
    private static final ExecutorService STDERR_READERS = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "VcfExtractorProcess stderr");
        thread.setDaemon(true);
        return thread;
    });

    private final Process proc;
    private final BufferedReader reader;
    private final Future<List<String>> stderr;
    private final List<String> list;

    public VcfExtractorProcess(String executable, String... args) throws IOException {
        list = new ArrayList<>(1 + args.length);
        list.add(executable);
        list.addAll(Arrays.asList(args));

        ProcessBuilder builder = new ProcessBuilder(list);
        builder.redirectErrorStream(false);
        proc = builder.start();
        reader = new BufferedReader(new InputStreamReader(proc.getInputStream(), StandardCharsets.UTF_8));
        stderr = STDERR_READERS.submit(() -> readLines(proc.getErrorStream()));
    }

    public String read() throws IOException {
        return reader.readLine();
    }

    public List<String> readAll() throws IOException {
        List<String> lines = new ArrayList<>();
        String line;
        while ((line = read()) != null) {
            lines.add(line);
        }
        return lines;
    }

    @Override
    public void close() throws IOException {
        String command = String.join(" ", list);
        try {
            // stdout is read to the end so the process can exit
            while (reader.readLine() != null) {
                LOG.debug("Skipped output of '", command, "'");
            }
            List<String> errors = stderr.get();
            int exitValue = proc.waitFor();
            if (exitValue != 0) {
                for (String line : errors) {
                    LOG.error(line);
                }
                throw new IOException("Process: '" + command + "' exit with error code(" + exitValue + ").");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            proc.destroy();
            throw new IOException("Interrupted while waiting for process: '" + command + "'.", e);
        } catch (ExecutionException e) {
            throw new IOException("Can't read stderr of process: '" + command + "'.", e.getCause());
        } finally {
            reader.close();
            proc.getOutputStream().close();
        }
    }

    private static List<String> readLines(InputStream stream) throws IOException {
        List<String> lines = new ArrayList<>();
        try (BufferedReader ers = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = ers.readLine()) != null) {
                lines.add(line);
            }
        }
        return lines;
    }
}
