package com.fixforge.core.editor;

import java.nio.file.Path;

/**
 * Creates a {@link CodeEditor} bound to one working directory.
 */
@FunctionalInterface
public interface CodeEditorFactory {

    /**
     * @throws IllegalArgumentException if {@code workDir} does not exist
     */
    CodeEditor create(Path workDir);
}
