package com.fixforge.core.editor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * {@link CodeEditor} that replays scripted results. Transcript lines are
 * streamed to the caller before each result is returned.
 */
public class FakeCodeEditor implements CodeEditor {

    private final Deque<EditorResult> results = new ArrayDeque<>();
    private final List<String> instructions = new ArrayList<>();
    private final List<Boolean> autoCommitFlags = new ArrayList<>();
    private final List<List<String>> fileLists = new ArrayList<>();
    private volatile CountDownLatch blockUntilStopped;
    private volatile int blockFromCall = 1;
    private int calls;
    private final CountDownLatch started = new CountDownLatch(1);
    private final CountDownLatch blocked = new CountDownLatch(1);
    private volatile boolean stopped;

    public FakeCodeEditor thenReturn(int exitCode, String transcript) {
        results.add(new EditorResult(exitCode, transcript));
        return this;
    }

    /** Makes the next call block until {@link #stop} is invoked. */
    public FakeCodeEditor blockUntilStopped() {
        return blockUntilStopped(1);
    }

    /** Answers earlier calls from the script; the given call and later ones block until stopped. */
    public FakeCodeEditor blockUntilStopped(int fromCall) {
        blockFromCall = fromCall;
        blockUntilStopped = new CountDownLatch(1);
        return this;
    }

    @Override
    public synchronized EditorResult run(String instruction, List<String> files, Consumer<String> onLine,
                                         boolean autoCommit) {
        instructions.add(instruction);
        autoCommitFlags.add(autoCommit);
        fileLists.add(files);
        calls++;
        started.countDown();
        CountDownLatch latch = blockUntilStopped;
        if (latch != null && calls >= blockFromCall) {
            blocked.countDown();
            try {
                latch.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new EditorResult(143, "terminated");
        }
        EditorResult result = results.isEmpty() ? new EditorResult(0, "") : results.poll();
        if (onLine != null && !result.transcript().isEmpty()) {
            result.transcript().lines().forEach(onLine);
        }
        return result;
    }

    @Override
    public void stop() {
        stopped = true;
        CountDownLatch latch = blockUntilStopped;
        if (latch != null) {
            latch.countDown();
        }
    }

    public boolean awaitStarted(long seconds) throws InterruptedException {
        return started.await(seconds, TimeUnit.SECONDS);
    }

    public boolean awaitBlocked(long seconds) throws InterruptedException {
        return blocked.await(seconds, TimeUnit.SECONDS);
    }

    public List<String> getInstructions() {
        return instructions;
    }

    public List<Boolean> getAutoCommitFlags() {
        return autoCommitFlags;
    }

    public List<List<String>> getFileLists() {
        return fileLists;
    }

    public boolean isStopped() {
        return stopped;
    }
}
