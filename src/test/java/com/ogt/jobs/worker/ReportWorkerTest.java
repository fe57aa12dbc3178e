package com.ogt.jobs.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ogt.jobs.dto.ReportConfig;
import com.ogt.jobs.entity.Job;
import com.ogt.jobs.entity.JobPayload;
import com.ogt.jobs.entity.JobStatus;
import com.ogt.jobs.entity.JobType;
import com.ogt.jobs.repository.JobPayloadRepository;
import com.ogt.jobs.service.ArtifactStore;
import com.ogt.jobs.service.JobLease;
import com.ogt.jobs.service.JobStore;
import com.ogt.jobs.service.report.*;
import com.ogt.jobs.validation.ImportSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReportWorkerTest {

    @Mock private JobStore jobStore;
    @Mock private JobPayloadRepository payloadRepository;
    @Mock private ReportDataSource dataSource;
    @Mock private ReportAssembler assembler;
    @Mock private ArtifactStore artifactStore;
    @Mock private ReportExporter exporter;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ReportWorker reportWorker;
    private Job job;
    private JobLease lease;
    private ReportTable table;

    @BeforeEach
    void setUp() throws Exception {
        when(exporter.getFormat()).thenReturn(ReportFormat.CSV);
        reportWorker = new ReportWorker(jobStore, payloadRepository, dataSource, assembler, artifactStore,
                objectMapper, List.of(exporter));

        UUID payloadId = UUID.randomUUID();
        job = Job.builder()
                .id(UUID.randomUUID())
                .type(JobType.GENERATE_REPORT)
                .scopeId("inst-1")
                .status(JobStatus.PROCESSING)
                .payloadRef(payloadId.toString())
                .build();
        lease = new JobLease(job.getId(), "worker-a:9f3c21ab");

        ReportConfig config = ReportConfig.builder()
                .reportType(ImportSchema.STUDENTS)
                .exportFormat(ReportFormat.CSV)
                .build();
        when(payloadRepository.findById(payloadId)).thenReturn(Optional.of(JobPayload.builder()
                .jobType(JobType.GENERATE_REPORT)
                .content(objectMapper.writeValueAsString(config))
                .build()));

        List<Map<String, String>> rows = List.of(Map.of("name", "Asha"));
        table = ReportTable.builder()
                .columns(List.of("name"))
                .groups(List.of(new ReportTable.Group(null, rows)))
                .build();
        when(dataSource.fetch("inst-1", ImportSchema.STUDENTS)).thenReturn(rows);
        when(assembler.assemble(eq(rows), any())).thenReturn(table);
        when(jobStore.recordProgress(eq(lease), anyInt(), anyInt(), eq(0), isNull())).thenReturn(true);
        when(exporter.export(table)).thenReturn("name\nAsha\n".getBytes());
    }

    @Test
    void leaseLostDuringExportNeverPublishesTheFile() throws Exception {
        when(jobStore.renewLease(lease)).thenReturn(false);

        assertThatThrownBy(() -> reportWorker.process(job, lease)).isInstanceOf(LeaseLostException.class);

        verify(artifactStore, never()).store(any(), any(), any());
        verify(jobStore, never()).complete(any(), anyInt(), anyInt(), anyInt(), any(), any(), any());
    }

    @Test
    void storesTheArtifactUnderTheLeaseAttemptTag() throws Exception {
        when(jobStore.renewLease(lease)).thenReturn(true);
        when(artifactStore.store(any(), any(), any())).thenReturn("ref-1");
        when(jobStore.complete(lease, ReportWorker.PHASES, ReportWorker.PHASES, 0, null, "ref-1", "text/csv"))
                .thenReturn(true);

        reportWorker.process(job, lease);

        verify(artifactStore).store(eq(job.getId()), eq("report-" + job.getId() + "-9f3c21ab.csv"), any());
        verify(artifactStore, never()).delete(any());
    }
}
