package com.mirrorgroups.insights.queue;

import com.mirrorgroups.insights.config.GroupInsightsProperties;
import com.mirrorgroups.insights.entity.AnalysisJob;
import com.mirrorgroups.insights.entity.AnalysisJob.JobStatus;
import com.mirrorgroups.insights.exception.AnalysisJobNotFoundException;
import com.mirrorgroups.insights.repository.AnalysisJobRepository;
import com.mirrorgroups.insights.service.InsightCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit Tests for AnalysisJobService
 *
 * @author MirrorGroups Insights Team
 * @version 1.0.0
 * @since 2026-10-01
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("Analysis Job Service Tests")
class AnalysisJobServiceTest {

    @Mock
    private AnalysisJobRepository jobRepository;

    @Mock
    private InsightCache insightCache;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Captor
    private ArgumentCaptor<AnalysisJob> jobCaptor;

    private AnalysisJobService jobService;

    private final UUID jobId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        jobService = new AnalysisJobService(jobRepository, insightCache, kafkaTemplate, new GroupInsightsProperties());
    }

    private void saveAssignsId() {
        when(jobRepository.save(any(AnalysisJob.class))).thenAnswer(invocation -> {
            AnalysisJob job = invocation.getArgument(0);
            job.setId(jobId);
            return job;
        });
    }

    @Test
    @DisplayName("Should store the job before notifying processors")
    void enqueue_PersistsThenNotifies() {
        // Given
        saveAssignsId();
        when(kafkaTemplate.send("group-analysis-jobs", "group-1", jobId.toString()))
            .thenReturn(new CompletableFuture<>());

        // When
        UUID queued = jobService.enqueue("group-1", "member_joined");

        // Then
        assertThat(queued).isEqualTo(jobId);
        InOrder order = inOrder(jobRepository, insightCache, kafkaTemplate);
        order.verify(jobRepository).save(jobCaptor.capture());
        order.verify(insightCache).evict("group-1");
        order.verify(kafkaTemplate).send("group-analysis-jobs", "group-1", jobId.toString());

        AnalysisJob job = jobCaptor.getValue();
        assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(job.getPriority()).isEqualTo(5);
        assertThat(job.getTriggerEvent()).isEqualTo("member_joined");
        assertThat(job.getRetryCount()).isZero();
    }

    @Test
    @DisplayName("Should honour an explicit priority")
    void enqueue_WithPriority() {
        saveAssignsId();
        when(kafkaTemplate.send(anyString(), anyString(), anyString())).thenReturn(new CompletableFuture<>());

        jobService.enqueue("group-1", "manual", 9);

        verify(jobRepository).save(jobCaptor.capture());
        assertThat(jobCaptor.getValue().getPriority()).isEqualTo(9);
    }

    @Test
    @DisplayName("Should keep the job when the broker is unreachable")
    void enqueue_BrokerDown() {
        // Given
        saveAssignsId();
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
            .thenThrow(new IllegalStateException("broker unavailable"));

        // When
        UUID queued = jobService.enqueue("group-1", "member_joined");

        // Then
        assertThat(queued).isEqualTo(jobId);
    }

    @Test
    @DisplayName("Should keep the job when delivery fails asynchronously")
    void enqueue_DeliveryFails() {
        // Given
        saveAssignsId();
        CompletableFuture<SendResult<String, String>> future = new CompletableFuture<>();
        when(kafkaTemplate.send(anyString(), anyString(), anyString())).thenReturn(future);

        // When
        UUID queued = jobService.enqueue("group-1", "member_joined");
        future.completeExceptionally(new IllegalStateException("timeout"));

        // Then
        assertThat(queued).isEqualTo(jobId);
    }

    @Test
    @DisplayName("Should report a missing job")
    void getJob_NotFound() {
        when(jobRepository.findById(jobId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> jobService.getJob(jobId))
            .isInstanceOf(AnalysisJobNotFoundException.class)
            .hasMessageContaining(jobId.toString());
    }
}
