package com.baykanat.insider.warehouse.config;

import com.baykanat.insider.warehouse.infrastructure.persistence.WarehouseConnections;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;
import java.util.Objects;

/** Primary (spring.datasource) ve opsiyonel read-replica (app.warehouse.replica) bağlantı havuzları. */
@Slf4j
@Configuration
public class DataSourceConfig {

    @Bean
    @Primary
    @ConfigurationProperties("spring.datasource")
    public DataSourceProperties primaryDataSourceProperties() {
        return new DataSourceProperties();
    }

    /** CRUD tarafıyla ortak transactional store; refresh ve state yazımları her zaman buraya. */
    @Bean
    @Primary
    @ConfigurationProperties("spring.datasource.hikari")
    public HikariDataSource primaryDataSource(DataSourceProperties primaryDataSourceProperties) {
        return primaryDataSourceProperties.initializeDataSourceBuilder()
                .type(HikariDataSource.class)
                .build();
    }

    /** Replica havuzu; replica kapalıyken açılışı engellemesin diye initialization fail timeout -1. */
    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "app.warehouse", name = "replica-enabled", havingValue = "true")
    public HikariDataSource replicaDataSource(AppProperties appProperties) {
        AppProperties.ReplicaProperties replica = appProperties.getWarehouse().getReplica();
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName("warehouse-replica");
        dataSource.setJdbcUrl(Objects.requireNonNull(replica.getUrl(), "app.warehouse.replica.url"));
        dataSource.setUsername(replica.getUsername());
        dataSource.setPassword(replica.getPassword());
        dataSource.setMaximumPoolSize(replica.getMaximumPoolSize());
        dataSource.setConnectionTimeout(replica.getConnectionTimeoutMs());
        dataSource.setReadOnly(true);
        dataSource.setInitializationFailTimeout(-1);
        log.info("Read replica configured: {}", replica.getUrl());
        return dataSource;
    }

    @Bean
    public WarehouseConnections warehouseConnections(DataSource primaryDataSource,
                                                     @Qualifier("replicaDataSource") ObjectProvider<DataSource> replicaDataSource) {
        return new WarehouseConnections(primaryDataSource, replicaDataSource.getIfAvailable());
    }
}
