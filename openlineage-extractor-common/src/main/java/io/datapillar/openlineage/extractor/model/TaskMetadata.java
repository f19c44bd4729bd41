package io.datapillar.openlineage.extractor.model;

import io.openlineage.client.OpenLineage;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.Builder;

/**
 * 单次任务执行的血缘元数据。
 * <p>
 * 构造后不可变：集合字段缺省时为空集合，不会为 null；分发器不会修改已产出的记录，原样交给发送层。
 *
 * @param name      任务标识（历史字段，仅为兼容保留，调用方应从任务实例获取身份）
 * @param inputs    输入数据集，有序
 * @param outputs   输出数据集，有序
 * @param runFacets 描述本次运行的 facet，按名称索引
 * @param jobFacets 描述任务定义的 facet，与具体运行无关
 */
@Builder(toBuilder = true)
public record TaskMetadata(
        String name,
        List<Dataset> inputs,
        List<Dataset> outputs,
        Map<String, OpenLineage.RunFacet> runFacets,
        Map<String, OpenLineage.JobFacet> jobFacets
) {

    public TaskMetadata {
        Objects.requireNonNull(name, "TaskMetadata name 不能为空");
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        runFacets = copyOf(runFacets);
        jobFacets = copyOf(jobFacets);
    }

    public static TaskMetadata of(String name, List<Dataset> inputs, List<Dataset> outputs) {
        return new TaskMetadata(name, inputs, outputs, null, null);
    }

    private static <F> Map<String, F> copyOf(Map<String, F> facets) {
        if (facets == null || facets.isEmpty()) {
            return Map.of();
        }
        // 保留插入顺序
        Map<String, F> copy = new LinkedHashMap<>();
        facets.forEach((key, value) -> copy.put(
                Objects.requireNonNull(key, "facet 名称不能为空"),
                Objects.requireNonNull(value, "facet 不能为空: " + key)));
        return Collections.unmodifiableMap(copy);
    }
}
