package com.seshlog.ingest.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
public class TransactionConfig {

    @Bean
    public TransactionTemplate ingestTransactionTemplate(PlatformTransactionManager transactionManager,
            IngestProperties properties) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        template.setTimeout(timeoutSeconds(properties));
        template.setName("session-ingest");
        log.info("Session ingest transactions: isolation=READ_COMMITTED, timeout={}s", template.getTimeout());
        return template;
    }

    private static int timeoutSeconds(IngestProperties properties) {
        if (properties.getTransactionTimeout() == null) {
            return TransactionDefinition.TIMEOUT_DEFAULT;
        }
        // transaction managers work in whole seconds
        return (int) Math.max(1, properties.getTransactionTimeout().toSeconds());
    }
}
