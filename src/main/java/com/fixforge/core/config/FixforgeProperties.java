package com.fixforge.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "fixforge")
public class FixforgeProperties {

    private String dataDir = "data";
    private String workDir = "data/repos";
    private int workers = 4;
    private Store store = new Store();
    private Editor editor = new Editor();
    private Github github = new Github();
    private Events events = new Events();
    private Triage triage = new Triage();

    public String getDataDir() { return dataDir; }
    public void setDataDir(String dataDir) { this.dataDir = dataDir; }
    public String getWorkDir() { return workDir; }
    public void setWorkDir(String workDir) { this.workDir = workDir; }
    public int getWorkers() { return workers; }
    public void setWorkers(int workers) { this.workers = workers; }
    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }
    public Editor getEditor() { return editor; }
    public void setEditor(Editor editor) { this.editor = editor; }
    public Github getGithub() { return github; }
    public void setGithub(Github github) { this.github = github; }
    public Events getEvents() { return events; }
    public void setEvents(Events events) { this.events = events; }
    public Triage getTriage() { return triage; }
    public void setTriage(Triage triage) { this.triage = triage; }

    public boolean isGithubConfigured() {
        return github.token != null && !github.token.isBlank();
    }

    public static class Store {
        private int maxOutputChars = 10_000;

        public int getMaxOutputChars() { return maxOutputChars; }
        public void setMaxOutputChars(int maxOutputChars) { this.maxOutputChars = maxOutputChars; }
    }

    public static class Editor {
        private String command = "aider";
        private String model = "";
        private int stopGraceSeconds = 5;

        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public int getStopGraceSeconds() { return stopGraceSeconds; }
        public void setStopGraceSeconds(int stopGraceSeconds) { this.stopGraceSeconds = stopGraceSeconds; }
    }

    public static class Github {
        private String token = "";
        private String apiUrl = "";

        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }
    }

    public static class Events {
        private int bufferSize = 256;

        public int getBufferSize() { return bufferSize; }
        public void setBufferSize(int bufferSize) { this.bufferSize = bufferSize; }
    }

    /**
     * Label and keyword sets driving issue triage. Matching is case-insensitive.
     */
    public static class Triage {
        private List<String> friendlyLabels = new ArrayList<>(List.of(
                "good first issue", "good-first-issue", "help wanted", "help-wanted",
                "beginner", "beginner-friendly", "easy", "low-hanging-fruit", "starter",
                "first-timers-only", "documentation", "docs", "typo"));
        private List<String> skipLabels = new ArrayList<>(List.of(
                "wontfix", "won't fix", "invalid", "duplicate", "question", "discussion",
                "needs-discussion", "breaking-change", "breaking", "security"));
        private List<String> easyKeywords = new ArrayList<>(List.of(
                "typo", "typos", "spelling", "grammar", "documentation", "readme", "comment",
                "rename", "format", "formatting", "indent", "whitespace", "missing", "add",
                "update", "fix link", "broken link"));

        public List<String> getFriendlyLabels() { return friendlyLabels; }
        public void setFriendlyLabels(List<String> friendlyLabels) { this.friendlyLabels = friendlyLabels; }
        public List<String> getSkipLabels() { return skipLabels; }
        public void setSkipLabels(List<String> skipLabels) { this.skipLabels = skipLabels; }
        public List<String> getEasyKeywords() { return easyKeywords; }
        public void setEasyKeywords(List<String> easyKeywords) { this.easyKeywords = easyKeywords; }
    }
}
