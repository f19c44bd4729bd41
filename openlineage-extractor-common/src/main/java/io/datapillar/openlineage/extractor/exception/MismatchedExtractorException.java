package io.datapillar.openlineage.extractor.exception;

import java.util.Set;

/**
 * 绑定的任务类型不在 Extractor 支持的类型集合内
 */
public class MismatchedExtractorException extends ExtractorException {

    private final String taskType;
    private final Set<String> supportedTaskTypes;

    public MismatchedExtractorException(Class<?> extractorClass, String taskType, Set<String> supportedTaskTypes) {
        super("Extractor 与任务类型不匹配: extractor=%s, taskType=%s, supported=%s",
                extractorClass.getSimpleName(), taskType, supportedTaskTypes);
        this.taskType = taskType;
        this.supportedTaskTypes = Set.copyOf(supportedTaskTypes);
    }

    public String getTaskType() {
        return taskType;
    }

    public Set<String> getSupportedTaskTypes() {
        return supportedTaskTypes;
    }
}
