package com.fixforge.core.editor;

/**
 * Exit code and full transcript of one code-editor run.
 * An exit code of {@code -1} means the editor could not be started.
 */
public record EditorResult(int exitCode, String transcript) {

    public EditorResult {
        transcript = transcript != null ? transcript : "";
    }

    public boolean succeeded() {
        return exitCode == 0;
    }
}
