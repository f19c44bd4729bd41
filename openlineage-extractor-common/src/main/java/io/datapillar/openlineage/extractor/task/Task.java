package io.datapillar.openlineage.extractor.task;

import java.util.Map;

/**
 * 编排器中的任务实例（算子）
 * <p>
 * 提取框架只依赖两点：
 * 1. 稳定的运行时类型名称，用于按类型分发 Extractor
 * 2. 具体 Extractor 读取的任务配置，内容由各实现自行约定
 */
public interface Task {

    /**
     * 任务 ID，在所属工作流内唯一
     */
    String getTaskId();

    /**
     * 运行时类型名称（如实现类名 {@code BigQueryOperator}），分发时作为查找键
     */
    String getTaskType();

    /**
     * 任务静态配置，不为 null
     */
    Map<String, Object> getConfig();
}
