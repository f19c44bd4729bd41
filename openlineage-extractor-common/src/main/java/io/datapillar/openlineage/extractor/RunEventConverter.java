package io.datapillar.openlineage.extractor;

import io.datapillar.openlineage.extractor.model.Dataset;
import io.datapillar.openlineage.extractor.model.TaskMetadata;
import io.openlineage.client.OpenLineage;
import io.openlineage.client.OpenLineage.InputDataset;
import io.openlineage.client.OpenLineage.Job;
import io.openlineage.client.OpenLineage.OutputDataset;
import io.openlineage.client.OpenLineage.Run;
import io.openlineage.client.OpenLineage.RunEvent;
import java.net.URI;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.UUID;

/**
 * 将 {@link TaskMetadata} 转换为 OpenLineage RunEvent
 * <p>
 * 只负责结构转换，发送由调用方的 transport 完成。
 */
public class RunEventConverter {

    private final OpenLineage openLineage;

    public RunEventConverter() {
        this(ExtractorConfig.PRODUCER_URI);
    }

    public RunEventConverter(URI producerUri) {
        this.openLineage = new OpenLineage(producerUri);
    }

    /**
     * 创建 OpenLineage RunEvent。
     *
     * @param metadata     任务元数据
     * @param eventType    事件类型
     * @param runId        运行 ID
     * @param jobNamespace job namespace
     * @param jobName      job 名称，通常由工作流 ID 与任务 ID 拼接
     * @param eventTime    事件时间
     */
    public RunEvent toRunEvent(
            TaskMetadata metadata,
            RunEvent.EventType eventType,
            UUID runId,
            String jobNamespace,
            String jobName,
            ZonedDateTime eventTime) {
        if (metadata == null) {
            throw new IllegalArgumentException("TaskMetadata 不能为空");
        }

        OpenLineage.RunFacetsBuilder runFacets = openLineage.newRunFacetsBuilder();
        metadata.runFacets().forEach(runFacets::put);
        Run run = openLineage.newRunBuilder().runId(runId).facets(runFacets.build()).build();

        OpenLineage.JobFacetsBuilder jobFacets = openLineage.newJobFacetsBuilder();
        metadata.jobFacets().forEach(jobFacets::put);
        Job job = openLineage.newJobBuilder()
                .namespace(jobNamespace)
                .name(jobName)
                .facets(jobFacets.build())
                .build();

        return openLineage
                .newRunEventBuilder()
                .eventType(eventType)
                .eventTime(eventTime)
                .run(run)
                .job(job)
                .inputs(toInputs(metadata.inputs()))
                .outputs(toOutputs(metadata.outputs()))
                .build();
    }

    private List<InputDataset> toInputs(List<Dataset> datasets) {
        return datasets.stream()
                .map(dataset -> openLineage.newInputDatasetBuilder()
                        .namespace(dataset.namespace())
                        .name(dataset.name())
                        .facets(toDatasetFacets(dataset))
                        .build())
                .toList();
    }

    private List<OutputDataset> toOutputs(List<Dataset> datasets) {
        return datasets.stream()
                .map(dataset -> openLineage.newOutputDatasetBuilder()
                        .namespace(dataset.namespace())
                        .name(dataset.name())
                        .facets(toDatasetFacets(dataset))
                        .build())
                .toList();
    }

    private OpenLineage.DatasetFacets toDatasetFacets(Dataset dataset) {
        OpenLineage.DatasetFacetsBuilder facets = openLineage.newDatasetFacetsBuilder();
        dataset.facets().forEach(facets::put);
        return facets.build();
    }
}
