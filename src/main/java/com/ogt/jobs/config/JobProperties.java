package com.ogt.jobs.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "jobs")
public class JobProperties {

    private Batch batch = new Batch();
    private Sync sync = new Sync();
    private Lease lease = new Lease();
    private Dispatch dispatch = new Dispatch();
    private Worker worker = new Worker();
    private Artifacts artifacts = new Artifacts();
    private Retention retention = new Retention();

    @Data
    public static class Batch {
        private int maxRows = 500;
    }

    @Data
    public static class Sync {
        // Por encima de este tamaño el alta siempre es asíncrona
        private int maxRows = 100;
    }

    @Data
    public static class Lease {
        private Duration duration = Duration.ofSeconds(60);
        private Duration checkInterval = Duration.ofSeconds(15);
    }

    @Data
    public static class Dispatch {
        private Duration pollInterval = Duration.ofSeconds(5);
        private int candidateBatch = 10;
    }

    @Data
    public static class Worker {
        private String id;
        private int threads = 2;
        private int progressFlushEvery = 10;
    }

    @Data
    public static class Artifacts {
        private String dir = System.getProperty("java.io.tmpdir") + "/ogt-job-artifacts";
    }

    @Data
    public static class Retention {
        private int days = 30;
        private String cron = "0 0 3 * * *";
    }
}
