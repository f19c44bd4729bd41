package io.datapillar.openlineage.extractor;

import io.datapillar.openlineage.extractor.exception.ExtractorException;
import io.datapillar.openlineage.extractor.exception.ExtractorNotImplementedException;
import io.datapillar.openlineage.extractor.model.TaskMetadata;
import io.datapillar.openlineage.extractor.task.DefaultTask;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ExtractorsTest {

    @Test
    void shouldReadDeclaredTaskTypesWithoutInstance() {
        Set<String> taskTypes = Extractors.supportedTaskTypes(AliasedExtractor.class);

        Assertions.assertEquals(List.of("BigQueryExecuteQueryOperator", "BigQueryOperator"), List.copyOf(taskTypes));
    }

    @Test
    void shouldSeeSameTaskTypesAsRegistry() throws Exception {
        ExtractorRegistry registry = new ExtractorRegistry();
        registry.register(AliasedExtractor.class, AliasedExtractor::new);

        Assertions.assertEquals(registry.getTaskTypes(), new AliasedExtractor().getSupportedTaskTypes());
        Assertions.assertTrue(Modifier.isFinal(
                BaseExtractor.class.getMethod("getSupportedTaskTypes").getModifiers()));
    }

    @Test
    void shouldFailEveryTimeWhenTaskTypesUndeclared() {
        for (int i = 0; i < 3; i++) {
            ExtractorNotImplementedException exception = Assertions.assertThrows(
                    ExtractorNotImplementedException.class,
                    () -> Extractors.supportedTaskTypes(UndeclaredExtractor.class));
            Assertions.assertEquals(UndeclaredExtractor.class, exception.getExtractorClass());
        }
    }

    @Test
    void shouldFailRegardlessOfBindState() {
        UndeclaredExtractor extractor = new UndeclaredExtractor();
        Assertions.assertThrows(ExtractorNotImplementedException.class, extractor::getSupportedTaskTypes);

        extractor.bind(DefaultTask.builder().taskId("t1").taskType("BigQueryOperator").build());
        Assertions.assertThrows(ExtractorNotImplementedException.class, extractor::getSupportedTaskTypes);
        Assertions.assertThrows(ExtractorNotImplementedException.class, extractor::validate);
    }

    @Test
    void shouldNotInheritDeclarationFromParent() {
        Assertions.assertThrows(ExtractorNotImplementedException.class,
                () -> Extractors.supportedTaskTypes(UndeclaredSubclassExtractor.class));
    }

    @Test
    void shouldRejectBlankTaskTypeDeclaration() {
        ExtractorException exception = Assertions.assertThrows(ExtractorException.class,
                () -> Extractors.supportedTaskTypes(BlankTypeExtractor.class));
        Assertions.assertTrue(exception.getMessage().contains("空白"));
    }

    @SupportedTaskTypes({"BigQueryExecuteQueryOperator", "BigQueryOperator"})
    static class AliasedExtractor extends BaseExtractor {
        @Override
        public Optional<TaskMetadata> extract() {
            return Optional.empty();
        }
    }

    static class UndeclaredExtractor extends BaseExtractor {
        @Override
        public Optional<TaskMetadata> extract() {
            return Optional.empty();
        }
    }

    static class UndeclaredSubclassExtractor extends AliasedExtractor {
    }

    @SupportedTaskTypes({"PostgresOperator", " "})
    static class BlankTypeExtractor extends BaseExtractor {
        @Override
        public Optional<TaskMetadata> extract() {
            return Optional.empty();
        }
    }
}
