package io.datapillar.openlineage.extractor;

import com.google.common.collect.ImmutableSet;
import io.datapillar.openlineage.extractor.exception.ExtractorException;
import io.datapillar.openlineage.extractor.exception.ExtractorNotImplementedException;
import java.util.Set;

/**
 * Extractor 工具方法
 */
public final class Extractors {

    private Extractors() {
    }

    /**
     * 读取 Extractor 类声明的支持任务类型，无需实例
     *
     * @param extractorClass Extractor 类
     * @return 按声明顺序排列的不可变集合
     * @throws ExtractorNotImplementedException 类上没有 {@link SupportedTaskTypes} 声明
     */
    public static Set<String> supportedTaskTypes(Class<? extends Extractor> extractorClass) {
        SupportedTaskTypes declaration = extractorClass.getAnnotation(SupportedTaskTypes.class);
        if (declaration == null) {
            throw new ExtractorNotImplementedException(extractorClass);
        }
        ImmutableSet.Builder<String> taskTypes = ImmutableSet.builder();
        for (String taskType : declaration.value()) {
            if (taskType == null || taskType.isBlank()) {
                throw new ExtractorException("Extractor %s 声明了空白的任务类型", extractorClass.getName());
            }
            taskTypes.add(taskType);
        }
        return taskTypes.build();
    }
}
