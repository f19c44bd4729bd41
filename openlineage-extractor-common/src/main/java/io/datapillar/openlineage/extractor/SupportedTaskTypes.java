package io.datapillar.openlineage.extractor;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 声明 Extractor 支持的任务类型
 * <p>
 * 声明在类上，是静态能力而非实例状态，注册表无需创建实例即可读取。
 * 每个具体 Extractor 必须自行声明，不会从父类继承。
 * <p>
 * 使用示例：
 * <pre>
 * &#64;SupportedTaskTypes({"BigQueryOperator", "BigQueryExecuteQueryOperator"})
 * public class BigQueryExtractor extends BaseExtractor {
 *     ...
 * }
 * </pre>
 * <p>
 * 部分算子已废弃，只是简单继承了新实现（例如旧版 BigQueryOperator），
 * 这些历史名称也应列在这里，保证新旧任务都能分发到同一个 Extractor。
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface SupportedTaskTypes {

    /**
     * 任务类型名称（运行时类型名，如实现类名）
     */
    String[] value();
}
