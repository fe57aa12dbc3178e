package com.ogt.jobs.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.util.UUID;

@Slf4j
@Configuration
@EnableConfigurationProperties(JobProperties.class)
public class WorkerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Identidad con la que este proceso firma sus leases.
     */
    @Bean
    public WorkerIdentity workerIdentity(JobProperties properties) {
        String id = properties.getWorker().getId();
        if (id == null || id.isBlank()) {
            id = hostName() + "-" + UUID.randomUUID().toString().substring(0, 8);
        }
        log.info("🆔 Worker id: {}", id);
        return new WorkerIdentity(id);
    }

    @Bean(name = "jobWorkerExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor jobWorkerExecutor(JobProperties properties) {
        int threads = Math.max(1, properties.getWorker().getThreads());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        // Sin cola: el dispatcher sólo reclama jobs cuando hay un hilo libre
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("job-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "worker";
        }
    }
}
