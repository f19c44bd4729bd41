package io.datapillar.openlineage.extractor.exception;

/**
 * Extractor 未声明支持的任务类型
 * <p>
 * 属于编程错误，首次使用时立即失败，避免该 Extractor 被分发器静默跳过
 */
public class ExtractorNotImplementedException extends ExtractorException {

    private final Class<?> extractorClass;

    public ExtractorNotImplementedException(Class<?> extractorClass) {
        super("Extractor %s 未声明支持的任务类型，请添加 @SupportedTaskTypes", extractorClass.getName());
        this.extractorClass = extractorClass;
    }

    public Class<?> getExtractorClass() {
        return extractorClass;
    }
}
