package com.ogt.jobs.worker;

import com.ogt.jobs.config.JobProperties;
import com.ogt.jobs.config.WorkerIdentity;
import com.ogt.jobs.service.JobLease;
import com.ogt.jobs.service.JobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobDispatcherTest {

    @Mock
    private JobStore jobStore;

    @Mock
    private JobWorker jobWorker;

    private final WorkerIdentity identity = new WorkerIdentity("test-worker");
    private final JobProperties properties = new JobProperties();

    @BeforeEach
    void setUp() {
        properties.getWorker().setThreads(2);
    }

    @Test
    void drainsPendingJobsWhileThreadsFreeUp() {
        when(jobStore.claimNext(anyString()))
                .thenReturn(Optional.of(lease()), Optional.of(lease()), Optional.of(lease()), Optional.empty());
        JobDispatcher dispatcher = new JobDispatcher(jobStore, jobWorker, identity, new SyncTaskExecutor(), properties);

        int started = dispatcher.dispatch();

        assertThat(started).isEqualTo(3);
        verify(jobWorker, times(3)).execute(any(JobLease.class));
    }

    @Test
    void neverClaimsMoreJobsThanThreads() {
        HeldExecutor executor = new HeldExecutor();
        when(jobStore.claimNext(anyString())).thenAnswer(invocation -> Optional.of(lease()));
        JobDispatcher dispatcher = new JobDispatcher(jobStore, jobWorker, identity, executor, properties);

        assertThat(dispatcher.dispatch()).isEqualTo(2);
        assertThat(dispatcher.dispatch()).isZero();
        verify(jobStore, times(2)).claimNext(anyString());

        // Un hilo termina y libera su permiso
        executor.runNext();
        assertThat(dispatcher.dispatch()).isEqualTo(1);
        verify(jobStore, times(3)).claimNext(anyString());
    }

    @Test
    void leaseOwnersAreUniquePerClaim() {
        List<String> owners = new ArrayList<>();
        when(jobStore.claimNext(anyString())).thenAnswer(invocation -> {
            owners.add(invocation.getArgument(0));
            return owners.size() < 3 ? Optional.of(lease()) : Optional.empty();
        });
        JobDispatcher dispatcher = new JobDispatcher(jobStore, jobWorker, identity, new SyncTaskExecutor(), properties);

        dispatcher.dispatch();

        assertThat(owners).hasSize(3).doesNotHaveDuplicates();
        assertThat(owners).allMatch(owner -> owner.startsWith("test-worker:"));
    }

    @Test
    void rejectedHandOffReturnsThePermit() {
        TaskExecutor rejecting = task -> {
            throw new TaskRejectedException("pool full");
        };
        when(jobStore.claimNext(anyString())).thenAnswer(invocation -> Optional.of(lease()));
        JobDispatcher dispatcher = new JobDispatcher(jobStore, jobWorker, identity, rejecting, properties);

        assertThat(dispatcher.dispatch()).isZero();
        assertThat(dispatcher.dispatch()).isZero();

        // Cada pasada intenta de nuevo: el permiso no quedó tomado
        verify(jobStore, times(2)).claimNext(anyString());
        verify(jobWorker, never()).execute(any(JobLease.class));
    }

    private JobLease lease() {
        return new JobLease(UUID.randomUUID(), identity.newLeaseOwner());
    }

    private static class HeldExecutor implements TaskExecutor {

        private final List<Runnable> held = new ArrayList<>();

        @Override
        public void execute(Runnable task) {
            held.add(task);
        }

        void runNext() {
            held.remove(0).run();
        }
    }
}
