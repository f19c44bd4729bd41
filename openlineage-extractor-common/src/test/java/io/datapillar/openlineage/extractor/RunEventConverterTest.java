package io.datapillar.openlineage.extractor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.datapillar.openlineage.extractor.model.Dataset;
import io.datapillar.openlineage.extractor.model.TaskMetadata;
import io.openlineage.client.OpenLineage;
import io.openlineage.client.OpenLineage.RunEvent;
import io.openlineage.client.OpenLineageClientUtils;
import java.net.URI;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class RunEventConverterTest {

    private final OpenLineage openLineage = new OpenLineage(URI.create("https://datapillar.io/test"));

    private final ObjectMapper mapper = OpenLineageClientUtils.newObjectMapper();

    @Test
    void shouldConvertMetadataToRunEvent() throws Exception {
        OpenLineage.SchemaDatasetFacet schema = openLineage.newSchemaDatasetFacetBuilder()
                .fields(List.of(openLineage.newSchemaDatasetFacetFieldsBuilder().name("id").type("INT64").build()))
                .build();
        TaskMetadata metadata = TaskMetadata.builder()
                .name("copy_orders")
                .inputs(List.of(Dataset.builder()
                        .namespace("bigquery")
                        .name("project.ds.in")
                        .facets(Map.of("schema", schema))
                        .build()))
                .outputs(List.of(Dataset.of("bigquery", "project.ds.out")))
                .jobFacets(Map.of("sql", openLineage.newSQLJobFacetBuilder().query("select * from t").build()))
                .runFacets(Map.of("externalQuery", openLineage.newExternalQueryRunFacetBuilder()
                        .externalQueryId("job_123")
                        .source("bigquery")
                        .build()))
                .build();
        UUID runId = UUID.fromString("11111111-1111-1111-1111-111111111111");
        ZonedDateTime eventTime = ZonedDateTime.of(2026, 10, 19, 8, 0, 0, 0, ZoneOffset.UTC);

        RunEvent event = new RunEventConverter().toRunEvent(
                metadata, RunEvent.EventType.COMPLETE, runId, "datapillar://workflow", "daily.copy_orders", eventTime);

        Assertions.assertEquals(RunEvent.EventType.COMPLETE, event.getEventType());
        Assertions.assertEquals(runId, event.getRun().getRunId());
        Assertions.assertEquals("datapillar://workflow", event.getJob().getNamespace());
        Assertions.assertEquals("daily.copy_orders", event.getJob().getName());
        Assertions.assertEquals(1, event.getInputs().size());
        Assertions.assertEquals("project.ds.in", event.getInputs().get(0).getName());
        Assertions.assertEquals("bigquery", event.getOutputs().get(0).getNamespace());

        JsonNode node = mapper.readTree(OpenLineageClientUtils.toJson(event));
        Assertions.assertEquals("select * from t", node.at("/job/facets/sql/query").asText());
        Assertions.assertEquals("job_123", node.at("/run/facets/externalQuery/externalQueryId").asText());
        Assertions.assertEquals("id", node.at("/inputs/0/facets/schema/fields/0/name").asText());
        Assertions.assertEquals(ExtractorConfig.PRODUCER_URI.toString(), node.at("/producer").asText());
    }

    @Test
    void shouldConvertEmptyMetadata() {
        RunEvent event = new RunEventConverter().toRunEvent(
                TaskMetadata.builder().name("noop").build(),
                RunEvent.EventType.START,
                UUID.randomUUID(),
                "datapillar://workflow",
                "daily.noop",
                ZonedDateTime.now(ZoneOffset.UTC));

        Assertions.assertTrue(event.getInputs().isEmpty());
        Assertions.assertTrue(event.getOutputs().isEmpty());
    }

    @Test
    void shouldRejectNullMetadata() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new RunEventConverter().toRunEvent(
                null, RunEvent.EventType.START, UUID.randomUUID(), "ns", "job", ZonedDateTime.now(ZoneOffset.UTC)));
    }
}
