package io.datapillar.openlineage.extractor.model;

import io.openlineage.client.OpenLineage;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;

/**
 * 数据集引用，由 namespace + name 唯一标识一个数据源或数据汇。
 *
 * <p>示例：namespace = {@code postgres://db.example.com:5432}，name = {@code analytics.public.orders}
 */
@Builder
public record Dataset(
        String namespace,
        String name,
        Map<String, OpenLineage.DatasetFacet> facets
) {

    public Dataset {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("Dataset namespace 不能为空");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Dataset name 不能为空");
        }
        facets = facets == null || facets.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(facets));
    }

    public static Dataset of(String namespace, String name) {
        return new Dataset(namespace, name, null);
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
