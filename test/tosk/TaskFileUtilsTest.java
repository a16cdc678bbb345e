package tosk;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TaskFileUtilsTest {

    @TempDir
    Path dir;

    @Test
    void missingTaskFileIsAnEmptyList() throws Exception {
        assertThat(TaskFileUtils.loadTasks(dir.resolve("tasks.json"))).isEmpty();
    }

    @Test
    void taskFileUsesSnakeCaseDueDateAndFillsDefaults() throws Exception {
        Path file = dir.resolve("tasks.json");
        Files.writeString(file, "[{\"id\":3,\"title\":\"Call bank\",\"due_date\":\"2025-02-01\",\"extra\":1}]",
                StandardCharsets.UTF_8);

        List<Task> tasks = TaskFileUtils.loadTasks(file);

        assertThat(tasks).hasSize(1);
        Task t = tasks.get(0);
        assertThat(t.id).isEqualTo(3);
        assertThat(t.dueDate).isEqualTo("2025-02-01");
        assertThat(t.duration).isEqualTo(60);
        assertThat(t.category).isEqualTo("General");
        assertThat(t.priority).isEqualTo(1);
        assertThat(t.completed).isFalse();

        TaskFileUtils.saveTasks(file, tasks);
        assertThat(Files.readString(file, StandardCharsets.UTF_8)).contains("\"due_date\"");
    }

    @Test
    void exportWritesHeaderAndCapitalizedBooleans() throws Exception {
        Path csv = dir.resolve("tasks_export.csv");
        List<Task> tasks = List.of(
                new Task(1, "Write report", 90, "Work", 2, true, "2025-01-01"),
                new Task(2, "Buy milk, eggs", 15, "Home", 1, false, ""));

        int written = TaskFileUtils.exportCsv(tasks, csv);

        assertThat(written).isEqualTo(2);
        List<String> lines = Files.readAllLines(csv, StandardCharsets.UTF_8);
        assertThat(lines.get(0)).isEqualTo("ID,Title,Duration,Category,Priority,Due Date,Completed");
        assertThat(lines.get(1)).isEqualTo("1,Write report,90,Work,2,2025-01-01,True");
        assertThat(lines.get(2)).isEqualTo("2,\"Buy milk, eggs\",15,Home,1,,False");
    }

    @Test
    void emptyListWritesNothing() throws Exception {
        Path csv = dir.resolve("tasks_export.csv");

        assertThat(TaskFileUtils.exportCsv(List.of(), csv)).isZero();
        assertThat(csv).doesNotExist();
    }

    @Test
    void importReadsExportBack() throws Exception {
        Path csv = dir.resolve("tasks_export.csv");
        TaskFileUtils.exportCsv(List.of(new Task(7, "Plan, then act", 30, "Work", 3, true, "2025-03-03")), csv);

        List<Task> tasks = TaskFileUtils.importCsv(csv);

        assertThat(tasks).singleElement().satisfies(t -> {
            assertThat(t.id).isEqualTo(7);
            assertThat(t.title).isEqualTo("Plan, then act");
            assertThat(t.priority).isEqualTo(3);
            assertThat(t.completed).isTrue();
        });
    }

    @Test
    void importHandlesBomMissingColumnsAndBadRows() throws Exception {
        Path csv = dir.resolve("edited.csv");
        Files.writeString(csv, "\uFEFFID,Title,Duration\n1,First,45\nx,Broken,10\n2,Second,20\n",
                StandardCharsets.UTF_8);

        List<Task> tasks = TaskFileUtils.importCsv(csv);

        assertThat(tasks).extracting(t -> t.id).containsExactly(1, 2);
        assertThat(tasks.get(0).category).isEqualTo("General");
        assertThat(tasks.get(0).duration).isEqualTo(45);
        assertThat(tasks.get(1).completed).isFalse();
    }
}
