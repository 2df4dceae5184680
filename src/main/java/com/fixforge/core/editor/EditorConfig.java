package com.fixforge.core.editor;

import com.fixforge.core.config.FixforgeProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the aider-backed editor factory.
 */
@Configuration
public class EditorConfig {

    @Bean
    public CodeEditorFactory codeEditorFactory(FixforgeProperties properties) {
        return workDir -> new AiderCodeEditor(workDir, properties.getEditor());
    }
}
