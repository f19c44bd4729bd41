package io.datapillar.openlineage.extractor.task;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;

/**
 * 不可变的任务描述，供编排器集成层直接构造
 */
@Builder
public record DefaultTask(
        String taskId,
        String taskType,
        Map<String, Object> config
) implements Task {

    public DefaultTask {
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("taskType 不能为空");
        }
        taskId = taskId == null ? "" : taskId;
        config = config == null || config.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    @Override
    public String getTaskId() {
        return taskId;
    }

    @Override
    public String getTaskType() {
        return taskType;
    }

    @Override
    public Map<String, Object> getConfig() {
        return config;
    }
}
