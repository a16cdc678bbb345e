package tosk;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * TaskFileUtils: file I/O around the task list (tasks.json) and its CSV export (tasks_export.csv).
 * These are the files the backup table moves; editing tasks is not done here.
 *
 * CSV layout (header row first):
 *   ID,Title,Duration,Category,Priority,Due Date,Completed
 *   1,Write report,60,General,2,2025-01-01,False
 */
public final class TaskFileUtils {

    private static final Logger log = LoggerFactory.getLogger(TaskFileUtils.class);

    static final String[] CSV_HEADER = { "ID", "Title", "Duration", "Category", "Priority", "Due Date", "Completed" };

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private TaskFileUtils() {}

    /** Load all tasks; a missing file is an empty list. */
    public static List<Task> loadTasks(Path file) throws IOException {
        if (!Files.isRegularFile(file)) return new ArrayList<>();
        return MAPPER.readValue(file.toFile(), new TypeReference<List<Task>>() {});
    }

    public static void saveTasks(Path file, List<Task> tasks) throws IOException {
        MAPPER.writeValue(file.toFile(), tasks);
    }

    /**
     * Write the tasks as CSV (UTF-8). Nothing is written when there are no tasks.
     *
     * @return number of task rows written
     */
    public static int exportCsv(List<Task> tasks, Path dest) throws IOException {
        if (tasks.isEmpty()) return 0;
        try (CSVWriter writer = new CSVWriter(
                new OutputStreamWriter(Files.newOutputStream(dest), StandardCharsets.UTF_8))) {
            writer.writeNext(CSV_HEADER, false);
            for (Task t : tasks) {
                writer.writeNext(new String[] {
                        Integer.toString(t.id),
                        t.title,
                        Integer.toString(t.duration),
                        t.category,
                        Integer.toString(t.priority),
                        t.dueDate,
                        t.completed ? "True" : "False"
                }, false);
            }
        }
        log.info("Exported {} tasks to {}", tasks.size(), dest);
        return tasks.size();
    }

    /**
     * Read tasks back from a CSV export. Missing optional columns get their defaults;
     * rows whose ID or Duration is not a number are skipped.
     */
    public static List<Task> importCsv(Path src) throws IOException {
        List<Task> tasks = new ArrayList<>();
        try (CSVReader reader = new CSVReader(new InputStreamReader(Files.newInputStream(src), StandardCharsets.UTF_8))) {
            String[] header = reader.readNext();
            if (header == null) return tasks;

            // Some tools save CSV with a BOM; drop it so the first column name matches.
            if (header.length > 0 && header[0] != null && !header[0].isEmpty() && header[0].charAt(0) == '\uFEFF') {
                header[0] = header[0].substring(1);
            }
            Map<String, Integer> col = new HashMap<>();
            for (int i = 0; i < header.length; i++) col.put(header[i].trim(), i);

            String[] row;
            int skipped = 0;
            while ((row = reader.readNext()) != null) {
                try {
                    Task t = new Task();
                    t.id = Integer.parseInt(cell(row, col, "ID", "").trim());
                    t.title = cell(row, col, "Title", "");
                    t.duration = Integer.parseInt(cell(row, col, "Duration", "").trim());
                    t.category = cell(row, col, "Category", "General");
                    t.priority = Integer.parseInt(cell(row, col, "Priority", "1").trim());
                    t.dueDate = cell(row, col, "Due Date", "");
                    t.completed = "True".equals(cell(row, col, "Completed", "False"));
                    tasks.add(t);
                } catch (NumberFormatException e) {
                    skipped++;
                }
            }
            if (skipped > 0) log.warn("Skipped {} CSV rows with invalid numbers in {}", skipped, src);
        } catch (CsvValidationException e) {
            throw new IOException("Malformed CSV in " + src + ": " + e.getMessage(), e);
        }
        return tasks;
    }

    private static String cell(String[] row, Map<String, Integer> col, String name, String def) {
        Integer i = col.get(name);
        if (i == null || i >= row.length || row[i] == null) return def;
        return row[i];
    }
}
