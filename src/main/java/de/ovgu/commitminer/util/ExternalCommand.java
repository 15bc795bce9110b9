package de.ovgu.commitminer.util;

import org.apache.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Scanner;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external program (git, pmd, ...) and pipes its output into the log.
 */
public class ExternalCommand {
    private static final Logger LOG = Logger.getLogger(ExternalCommand.class);

    private final String prog;
    private final List<String> args;
    private File workingDir = null;
    private long timeoutMillis = 0;

    private ExternalCommand(String prog, List<String> args) {
        this.prog = prog;
        this.args = args;
    }

    public static ExternalCommand of(String prog, String... args) {
        return new ExternalCommand(prog, new ArrayList<>(Arrays.asList(args)));
    }

    public static ExternalCommand of(String prog, List<String> args) {
        return new ExternalCommand(prog, new ArrayList<>(args));
    }

    public ExternalCommand in(File workingDir) {
        this.workingDir = workingDir;
        return this;
    }

    /**
     * @param timeoutMillis Maximum time to wait for the program to exit.  A value &lt;= 0 means no limit.
     */
    public ExternalCommand withTimeout(long timeoutMillis) {
        this.timeoutMillis = timeoutMillis;
        return this;
    }

    /**
     * Run the program and throw an {@link ExternalCommandException} if it times out or exits with a non-zero code.
     */
    public Result runOrFail() {
        Result result = run();
        if (result.isTimedOut()) {
            throw new ExternalCommandException("Command " + result.getCommand() + " timed out after " + timeoutMillis + " ms", result);
        }
        if (result.getExitCode() != 0) {
            throw new ExternalCommandException("Command " + result.getCommand() + " exited with non-zero exit code " + result.getExitCode(), result);
        }
        return result;
    }

    /**
     * Run the program and report its exit status, whatever it is.
     *
     * @throws ExternalCommandException if the program could not be started at all
     */
    public Result run() {
        final long startTime = System.currentTimeMillis();
        final String command = describe();
        LOG.debug("Executing " + command + " ...");

        List<String> processBuilderArgs = new ArrayList<>(args.size() + 1);
        processBuilderArgs.add(prog);
        processBuilderArgs.addAll(args);
        ProcessBuilder pb = new ProcessBuilder(processBuilderArgs);
        if (workingDir != null) {
            pb.directory(workingDir);
        }

        final String progBasename = new File(prog).getName();
        Process p;
        try {
            p = pb.start();
        } catch (IOException e) {
            throw new ExternalCommandException("Error executing " + command, e);
        }

        Thread readOut = new Thread(new StreamReader(p.getInputStream(), progBasename, " out"),
                "Stream reader for stdout of " + progBasename);
        Thread readErr = new Thread(new StreamReader(p.getErrorStream(), progBasename, " err"),
                "Stream reader for stderr of " + progBasename);
        readOut.start();
        readErr.start();

        int exitCode = -1;
        boolean timedOut = false;
        try {
            if (timeoutMillis > 0) {
                if (p.waitFor(timeoutMillis, TimeUnit.MILLISECONDS)) {
                    exitCode = p.exitValue();
                } else {
                    timedOut = true;
                    LOG.warn("Command " + command + " did not finish within " + timeoutMillis + " ms. Killing it.");
                }
            } else {
                exitCode = p.waitFor();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalCommandException("Got interrupted while executing " + command, e);
        } finally {
            if (p.isAlive()) {
                // Launcher scripts may fork the actual program instead of exec'ing it
                p.descendants().forEach(ProcessHandle::destroyForcibly);
                p.destroyForcibly();
            }
            joinReader(readOut);
            joinReader(readErr);
        }

        long timeForProg = System.currentTimeMillis() - startTime;
        LOG.debug("Executing " + command + " took " + timeForProg + " ms");
        return new Result(command, exitCode, timedOut);
    }

    private static void joinReader(Thread reader) {
        try {
            reader.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Interrupted while waiting for " + reader.getName(), e);
        }
    }

    private String describe() {
        StringBuilder commandSb = new StringBuilder();
        commandSb.append("`").append(prog);
        for (String arg : args) {
            commandSb.append(' ').append(arg);
        }
        commandSb.append("'");
        if (workingDir != null) {
            commandSb.append(" in directory ").append(workingDir.getAbsolutePath());
        }
        return commandSb.toString();
    }

    public static class Result {
        private final String command;
        private final int exitCode;
        private final boolean timedOut;

        Result(String command, int exitCode, boolean timedOut) {
            this.command = command;
            this.exitCode = exitCode;
            this.timedOut = timedOut;
        }

        public String getCommand() {
            return command;
        }

        /**
         * @return The exit code of the program, or -1 if it timed out
         */
        public int getExitCode() {
            return exitCode;
        }

        public boolean isTimedOut() {
            return timedOut;
        }
    }

    static class StreamReader implements Runnable {
        private final String progBasename;
        private final InputStream stream;
        private final String suffix;

        StreamReader(InputStream stream, String progBasename, String suffix) {
            this.stream = stream;
            this.progBasename = progBasename;
            this.suffix = suffix;
        }

        @Override
        public void run() {
            final String logLinePrefix = "[" + progBasename + suffix + "] ";
            try (Scanner scanner = new Scanner(stream, StandardCharsets.UTF_8)) {
                while (scanner.hasNextLine()) {
                    String line = scanner.nextLine();
                    if (line.contains("ERROR ")) {
                        LOG.error(logLinePrefix + line.replaceFirst("^.*ERROR ", ""));
                    } else if (line.contains("WARN ")) {
                        LOG.warn(logLinePrefix + line.replaceFirst("^.*WARN ", ""));
                    } else if (line.contains("INFO ")) {
                        LOG.info(logLinePrefix + line.replaceFirst("^.*INFO ", ""));
                    } else if (LOG.isDebugEnabled()) {
                        LOG.debug(logLinePrefix + line.replaceFirst("^.*DEBUG ", "").replaceFirst("^.*TRACE ", ""));
                    }
                }
            } catch (RuntimeException e) {
                LOG.debug("Stopped reading output of " + progBasename + suffix, e);
            }
        }
    }
}
