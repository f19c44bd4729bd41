package io.datapillar.openlineage.extractor.task;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.Builder;

/**
 * 任务完成后的运行视图，提供 extract() 阶段拿不到的运行结果
 *
 * @param task    对应的任务实例
 * @param runId   运行 ID
 * @param state   结束状态
 * @param results 运行结果（影响行数、外部作业 ID 等），不为 null
 */
@Builder
public record TaskRun(
        Task task,
        String runId,
        TaskRunState state,
        Map<String, Object> results
) {

    public TaskRun {
        Objects.requireNonNull(task, "TaskRun task 不能为空");
        state = state == null ? TaskRunState.SUCCESS : state;
        results = results == null || results.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    /**
     * 读取字符串类型的运行结果，不存在或为空白时返回 null
     */
    public String resultAsString(String key) {
        Object value = results.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }
}
