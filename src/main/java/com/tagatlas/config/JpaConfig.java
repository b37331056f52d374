package com.tagatlas.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.EnableTransactionManagement;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * JPA Configuration
 * Enables the graph repositories and provides the transaction template used by
 * the single graph writer
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.tagatlas.repository")
@EnableTransactionManagement
public class JpaConfig {

    /**
     * Template for graph mutations. READ_COMMITTED keeps readers unblocked on H2's MVStore;
     * writers are serialized above this layer.
     */
    @Bean(name = "graphWriteTransactionTemplate")
    public TransactionTemplate graphWriteTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        return template;
    }
}
