package tosk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Task
 * ----
 * One entry of the task list file (tasks.json). Plain data holder; fields are public for Jackson
 * and the CSV helpers. Defaults match what a task gets when a field is missing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Task {
    public int id;
    public String title = "Untitled";
    public int duration = 60;          // minutes
    public String category = "General";
    public int priority = 1;
    public boolean completed;
    @JsonProperty("due_date")
    public String dueDate = "";        // yyyy-MM-dd or ""

    public Task() {}

    public Task(int id, String title, int duration, String category, int priority, boolean completed, String dueDate) {
        this.id = id;
        this.title = title;
        this.duration = duration;
        this.category = category;
        this.priority = priority;
        this.completed = completed;
        this.dueDate = dueDate;
    }
}
