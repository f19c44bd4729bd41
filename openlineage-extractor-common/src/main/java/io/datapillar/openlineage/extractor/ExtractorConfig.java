package io.datapillar.openlineage.extractor;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Builder;

/**
 * 提取配置
 *
 * <p>示例配置：
 *
 * <pre>
 * extractors = com.example.lineage.HiveExtractor;com.example.lineage.SparkSqlExtractor
 * disabledTaskTypes = BashOperator,PythonOperator
 * extractTimeoutMillis = 10000
 * fallbackEnabled = true
 * </pre>
 *
 * @param extractorClasses     额外注册的自定义 Extractor 类名
 * @param disabledTaskTypes    不做提取的任务类型
 * @param extractTimeoutMillis 单次提取超时（毫秒），0 表示不限制
 * @param fallbackEnabled      找不到专用 Extractor 时是否使用 {@link DefaultExtractor}
 */
@Builder
public record ExtractorConfig(
        List<String> extractorClasses,
        Set<String> disabledTaskTypes,
        long extractTimeoutMillis,
        boolean fallbackEnabled
) {

    /** 生成的 facet 与事件使用的 producer。 */
    public static final URI PRODUCER_URI = URI.create("https://datapillar.io/openlineage-extractor");

    /** 自定义 Extractor 类名，分号或逗号分隔。 */
    public static final String EXTRACTORS = "extractors";

    /** 禁用的任务类型，逗号分隔。 */
    public static final String DISABLED_TASK_TYPES = "disabledTaskTypes";

    /** 单次提取超时（毫秒）。 */
    public static final String EXTRACT_TIMEOUT_MILLIS = "extractTimeoutMillis";

    /** 默认不限制超时。 */
    public static final long DEFAULT_EXTRACT_TIMEOUT_MILLIS = 0L;

    /** 是否启用兜底 Extractor。 */
    public static final String FALLBACK_ENABLED = "fallbackEnabled";

    public static final boolean DEFAULT_FALLBACK_ENABLED = true;

    public ExtractorConfig {
        extractorClasses = extractorClasses == null ? List.of() : List.copyOf(extractorClasses);
        disabledTaskTypes = Collections.unmodifiableSet(
                disabledTaskTypes == null ? new LinkedHashSet<>() : new LinkedHashSet<>(disabledTaskTypes));
        if (extractTimeoutMillis < 0) {
            throw new IllegalArgumentException("extractTimeoutMillis 不能为负数: " + extractTimeoutMillis);
        }
    }

    /**
     * 构建器，未设置的项与 {@link #defaults()} 一致
     */
    public static ExtractorConfigBuilder builder() {
        return new ExtractorConfigBuilder()
                .extractTimeoutMillis(DEFAULT_EXTRACT_TIMEOUT_MILLIS)
                .fallbackEnabled(DEFAULT_FALLBACK_ENABLED);
    }

    public static ExtractorConfig defaults() {
        return new ExtractorConfig(List.of(), Set.of(), DEFAULT_EXTRACT_TIMEOUT_MILLIS, DEFAULT_FALLBACK_ENABLED);
    }

    /**
     * 从配置项解析，未配置的项取默认值
     */
    public static ExtractorConfig from(Map<String, String> properties) {
        if (properties == null || properties.isEmpty()) {
            return defaults();
        }
        String timeout = properties.get(EXTRACT_TIMEOUT_MILLIS);
        long timeoutMillis;
        try {
            timeoutMillis = timeout == null || timeout.isBlank()
                    ? DEFAULT_EXTRACT_TIMEOUT_MILLIS
                    : Long.parseLong(timeout.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("extractTimeoutMillis 不是合法数字: " + timeout, e);
        }
        String fallback = properties.get(FALLBACK_ENABLED);
        return new ExtractorConfig(
                split(properties.get(EXTRACTORS), "[;,]"),
                new LinkedHashSet<>(split(properties.get(DISABLED_TASK_TYPES), ",")),
                timeoutMillis,
                fallback == null || fallback.isBlank() ? DEFAULT_FALLBACK_ENABLED : Boolean.parseBoolean(fallback.trim()));
    }

    public boolean isDisabled(String taskType) {
        return taskType != null && disabledTaskTypes.contains(taskType);
    }

    public boolean hasTimeout() {
        return extractTimeoutMillis > 0;
    }

    private static List<String> split(String value, String separator) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        List<String> items = new ArrayList<>();
        for (String item : value.split(separator)) {
            if (!item.isBlank()) {
                items.add(item.trim());
            }
        }
        return items;
    }
}
