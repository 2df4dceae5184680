package com.fixforge.core.persistence;

import com.fixforge.core.model.Task;
import com.fixforge.core.model.TaskState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskStoreTest {

    @TempDir
    Path dir;

    private DocumentStore documents;
    private TaskStore store;

    @BeforeEach
    void setUp() {
        documents = new DocumentStore(dir);
        store = new TaskStore(documents, 10);
    }

    private Task cloned(String id) {
        var task = new Task(id, "https://github.com/acme/demo.git", "demo");
        task.transitionTo(TaskState.CLONING, "Cloning");
        task.setLocalPath("/work/demo");
        task.transitionTo(TaskState.CLONED, "Clone completed");
        return task;
    }

    @Nested
    @DisplayName("saveTasks")
    class SaveTests {

        @Test
        @DisplayName("writes snake_case fields and the document header")
        void snakeCase() throws Exception {
            store.saveTasks(List.of(cloned("1")), 1);

            String json = Files.readString(dir.resolve("tasks.json"));
            assertTrue(json.contains("\"repo_url\""));
            assertTrue(json.contains("\"local_path\""));
            assertTrue(json.contains("\"status\" : \"cloned\""));
            assertTrue(json.contains("\"last_id\" : 1"));
            assertTrue(json.contains("\"version\" : 1"));
        }

        @Test
        @DisplayName("keeps only the first characters of long output")
        void truncatesOutput() {
            var task = cloned("1");
            task.appendOutput("0123456789abcdef");

            store.saveTasks(List.of(task), 1);

            assertEquals("0123456789", store.load().tasks().get("1").output());
            assertEquals("0123456789abcdef\n", task.getOutput());
        }
    }

    @Nested
    @DisplayName("load")
    class LoadTests {

        @Test
        @DisplayName("missing document loads empty")
        void missing() {
            var document = store.load();

            assertTrue(document.tasks().isEmpty());
            assertEquals(0L, document.lastId());
        }

        @Test
        @DisplayName("document without a version reads as version 1")
        void unversioned() throws Exception {
            Files.writeString(dir.resolve("tasks.json"), """
                    {"tasks": {"4": {"id": "4", "repo_url": "https://github.com/acme/demo",
                      "repo_name": "demo", "status": "completed"}}}
                    """);

            var document = store.load();

            assertEquals(1, document.version());
            assertEquals("completed", document.tasks().get("4").status());
            assertEquals("", document.tasks().get("4").error());
        }

        @Test
        @DisplayName("unknown fields are ignored")
        void unknownFields() throws Exception {
            Files.writeString(dir.resolve("tasks.json"), """
                    {"version": 2, "extra": true, "tasks": {"1": {"id": "1", "colour": "red"}}}
                    """);

            assertEquals("1", store.load().tasks().get("1").id());
        }

        @Test
        @DisplayName("wrongly typed document loads empty")
        void wrongShape() throws Exception {
            Files.writeString(dir.resolve("tasks.json"), "{\"tasks\": [1, 2, 3]}");

            assertTrue(store.load().tasks().isEmpty());
        }
    }

    @Nested
    @DisplayName("records")
    class RecordTests {

        @Test
        @DisplayName("in-flight status recovers by checkout presence")
        void recovery() {
            var withPath = new TaskRecord("1", "u", "demo", "fixing", "/work/demo", "", "", "");
            var withoutPath = new TaskRecord("2", "u", "demo", "cloning", null, "", "", "");

            assertEquals(TaskState.CLONED, withPath.toTask("1").getState());
            assertEquals(TaskState.PENDING, withoutPath.toTask("2").getState());
        }

        @Test
        @DisplayName("unknown status loads as pending")
        void unknownStatus() {
            var record = new TaskRecord("1", "u", "demo", "paused", null, "", "", "");

            assertEquals(TaskState.PENDING, record.toTask("1").getState());
        }

        @Test
        @DisplayName("missing id and name are filled from the key and URL")
        void fallbacks() {
            var record = new TaskRecord(null, "https://github.com/acme/tool.git", null, "completed",
                    null, null, null, null);

            var task = record.toTask("9");

            assertEquals("9", task.getId());
            assertEquals("tool", task.getRepoName());
        }

        @Test
        @DisplayName("counter recovers from ids and the stored high-water mark")
        void lastTaskId() {
            var records = new java.util.LinkedHashMap<String, TaskRecord>();
            records.put("3", new TaskRecord("3", "u", "a", "pending", null, "", "", ""));
            records.put("legacy", new TaskRecord("legacy", "u", "b", "pending", null, "", "", ""));

            assertEquals(3L, TaskStore.lastTaskId(new TasksDocument(1, "", 0L, records)));
            assertEquals(7L, TaskStore.lastTaskId(new TasksDocument(1, "", 7L, records)));
        }
    }
}
