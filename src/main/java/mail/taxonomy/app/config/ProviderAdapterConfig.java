package mail.taxonomy.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import mail.taxonomy.app.provider.*;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;

/**
 * Wires one folder adapter per supported provider.
 * Retry settings come from taxonomy.provider.gmail.* and taxonomy.provider.outlook.retry.*
 */
@Configuration
public class ProviderAdapterConfig {

    @Bean
    public ProviderCallExecutor providerCallExecutor(
            @Qualifier("providerCallTaskExecutor") ThreadPoolTaskExecutor providerCallTaskExecutor) {
        return new ProviderCallExecutor(providerCallTaskExecutor);
    }

    @Bean
    public GmailLabelAdapter gmailLabelAdapter(GmailLabelClient gmailLabelClient,
                                               ProviderCallExecutor providerCallExecutor,
                                               TaxonomyProperties properties) {
        return new GmailLabelAdapter(gmailLabelClient, providerCallExecutor,
                properties.getProvider().getGmail().toPolicy());
    }

    @Bean
    public RestTemplate graphRestTemplate(RestTemplateBuilder builder, TaxonomyProperties properties) {
        Duration timeout = properties.getProvider().getCallTimeout();
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }

    @Bean
    public GraphMailFolderClient graphMailFolderClient(@Qualifier("graphRestTemplate") RestTemplate graphRestTemplate,
                                                       ObjectMapper objectMapper,
                                                       TaxonomyProperties properties) {
        return new RestGraphMailFolderClient(graphRestTemplate, objectMapper,
                properties.getProvider().getOutlook().getGraphBaseUrl());
    }

    @Bean
    public OutlookFolderAdapter outlookFolderAdapter(GraphMailFolderClient graphMailFolderClient,
                                                     ProviderCallExecutor providerCallExecutor,
                                                     TaxonomyProperties properties) {
        TaxonomyProperties.Outlook outlook = properties.getProvider().getOutlook();
        return new OutlookFolderAdapter(graphMailFolderClient, providerCallExecutor,
                outlook.getRetry().toPolicy(), outlook.getSystemFolders());
    }

    @Bean
    public FolderProviderRegistry folderProviderRegistry(List<FolderProviderAdapter> adapters) {
        return new FolderProviderRegistry(adapters);
    }
}
