package com.fixforge.core.editor;

import java.util.List;
import java.util.function.Consumer;

/**
 * An external engine that reads and modifies the files of one local checkout.
 * <p>
 * Every call blocks until the engine exits; each transcript line is passed to
 * {@code onLine} as it is produced. Implementations are bound to a single
 * working directory and run at most one process at a time.
 */
public interface CodeEditor {

    /**
     * Runs the engine with a free-form instruction.
     *
     * @param instruction what to do
     * @param files       files to hand to the engine, empty to let it choose
     * @param onLine      receives each transcript line, may be null
     * @param autoCommit  whether the engine may commit its own changes
     */
    EditorResult run(String instruction, List<String> files, Consumer<String> onLine, boolean autoCommit);

    /**
     * Terminates the running process, if any. Safe to call from any thread.
     */
    void stop();

    default EditorResult reviewRepository(Consumer<String> onLine) {
        return run(EditorInstructions.reviewRepository(), List.of(), onLine, false);
    }

    /**
     * Asks the engine to fix an issue. Changes are left uncommitted so the
     * caller can capture the diff and decide whether to commit.
     */
    default EditorResult fixIssue(String title, String body, List<String> files, Consumer<String> onLine) {
        return run(EditorInstructions.fixIssue(title, body), files, onLine, false);
    }

    default EditorResult reviewDiff(String diff, Consumer<String> onLine) {
        return run(EditorInstructions.reviewDiff(diff), List.of(), onLine, false);
    }
}
