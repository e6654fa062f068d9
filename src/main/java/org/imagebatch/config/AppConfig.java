package org.imagebatch.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AppConfig(@JsonProperty("tasks") List<TaskConfig> tasks) {

    public AppConfig {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public List<TaskConfig> enabledTasks() {
        return tasks.stream().filter(TaskConfig::enabled).toList();
    }
}
