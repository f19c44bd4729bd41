package io.datapillar.openlineage.extractor;

/**
 * Extractor 工厂，每次调用返回一个未绑定的新实例
 */
@FunctionalInterface
public interface ExtractorFactory {

    Extractor create();
}
