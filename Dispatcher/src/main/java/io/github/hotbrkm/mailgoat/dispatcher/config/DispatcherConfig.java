package io.github.hotbrkm.mailgoat.dispatcher.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hotbrkm.mailgoat.dispatcher.profile.JsonFileProfileStore;
import io.github.hotbrkm.mailgoat.dispatcher.profile.ProfileStore;
import io.github.hotbrkm.mailgoat.dispatcher.send.engine.BatchDispatcher;
import io.github.hotbrkm.mailgoat.dispatcher.send.engine.BatchSendService;
import io.github.hotbrkm.mailgoat.dispatcher.send.engine.BatchSummaryAggregator;
import io.github.hotbrkm.mailgoat.dispatcher.send.engine.metrics.BatchSendMetrics;
import io.github.hotbrkm.mailgoat.dispatcher.send.entry.RecipientSourceReader;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.BatchStore;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.JsonFileBatchStore;
import io.github.hotbrkm.mailgoat.dispatcher.send.template.TemplateLoader;
import io.github.hotbrkm.mailgoat.dispatcher.send.template.TemplateRenderer;
import io.github.hotbrkm.mailgoat.dispatcher.send.transport.MailApiClientFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(MailgoatConfig.class)
public class DispatcherConfig {

    @Bean
    public ProfileStore profileStore(MailgoatConfig config, ObjectMapper objectMapper) {
        log.debug("event=profile_store_configured, path={}", config.resolveProfilesFile());
        return new JsonFileProfileStore(config.resolveProfilesFile(), objectMapper);
    }

    @Bean
    public BatchStore batchStore(MailgoatConfig config, ObjectMapper objectMapper) {
        log.debug("event=batch_store_configured, directory={}", config.resolveBatchStoreDir());
        return new JsonFileBatchStore(config.resolveBatchStoreDir(), objectMapper);
    }

    @Bean
    public MailApiClientFactory mailApiClientFactory(MailgoatConfig config, ObjectMapper objectMapper) {
        return new MailApiClientFactory(config.getHttp(), objectMapper);
    }

    @Bean
    public BatchSendMetrics batchSendMetrics(MeterRegistry meterRegistry) {
        return new BatchSendMetrics(meterRegistry);
    }

    @Bean
    public BatchSummaryAggregator batchSummaryAggregator() {
        return new BatchSummaryAggregator();
    }

    @Bean
    public BatchSendService batchSendService(ObjectMapper objectMapper, MailApiClientFactory clientFactory,
                                             BatchStore batchStore, BatchSendMetrics metrics,
                                             BatchSummaryAggregator aggregator) {
        return new BatchSendService(
                new RecipientSourceReader(objectMapper),
                new TemplateLoader(objectMapper),
                new BatchDispatcher(new TemplateRenderer(), metrics),
                clientFactory,
                batchStore,
                aggregator);
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
