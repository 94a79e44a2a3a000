package mail.taxonomy.app.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Thread pools for provisioning branches, individual provider calls and scheduled reconciliation.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    /**
     * One top-level category branch per task. Bounded so a single tenant cannot flood the provider.
     */
    @Bean(name = "folderProvisioningExecutor")
    public Executor folderProvisioningExecutor(TaxonomyProperties properties) {
        int workers = Math.max(1, properties.getProvisioning().getMaxConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("folder-provisioner-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    // Runs each remote call so it can be abandoned on timeout
    @Bean(name = "providerCallTaskExecutor")
    public ThreadPoolTaskExecutor providerCallTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(16);
        executor.setMaxPoolSize(64);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("provider-call-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "reconciliationExecutor")
    public Executor reconciliationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("folder-reconciler-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
