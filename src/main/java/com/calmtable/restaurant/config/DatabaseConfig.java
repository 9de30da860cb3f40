package com.calmtable.restaurant.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.orm.jpa.EntityManagerFactoryBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.orm.jpa.JpaTransactionManager;
import org.springframework.orm.jpa.LocalContainerEntityManagerFactoryBean;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.EnableTransactionManagement;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import jakarta.persistence.EntityManagerFactory;
import javax.sql.DataSource;
import java.io.File;
import java.util.HashMap;
import java.util.Map;

/**
 * SQLite persistence. Every connection starts its transactions with {@code BEGIN IMMEDIATE},
 * so write transactions are serialized at the database level and waiters block up to the busy
 * timeout instead of failing on lock upgrade.
 */
@Configuration
@EnableTransactionManagement
@EnableJpaRepositories(
    basePackages = "com.calmtable.restaurant.repository",
    entityManagerFactoryRef = "entityManagerFactory",
    transactionManagerRef = "transactionManager"
)
public class DatabaseConfig {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseConfig.class);
    private static final String JDBC_PREFIX = "jdbc:sqlite:";

    private final String url;
    private final String ddlAuto;
    private final int busyTimeoutMillis;
    private final boolean showSql;

    public DatabaseConfig(@Value("${calmtable.datasource.url:jdbc:sqlite:data/calmtable.db}") String url,
                          @Value("${calmtable.datasource.ddl-auto:update}") String ddlAuto,
                          @Value("${calmtable.datasource.busy-timeout-ms:30000}") int busyTimeoutMillis,
                          @Value("${calmtable.datasource.show-sql:false}") boolean showSql) {
        this.url = url;
        this.ddlAuto = ddlAuto;
        this.busyTimeoutMillis = busyTimeoutMillis;
        this.showSql = showSql;
    }

    @Bean(name = "dataSource")
    @Primary
    public DataSource dataSource() {
        ensureDataDirectory();

        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setBusyTimeout(busyTimeoutMillis);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        config.enforceForeignKeys(true);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl(url);
        logger.info("[DatabaseConfig] Using SQLite database {}", url);
        return dataSource;
    }

    private void ensureDataDirectory() {
        if (!url.startsWith(JDBC_PREFIX)) {
            return;
        }
        String path = url.substring(JDBC_PREFIX.length());
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        if (path.isEmpty() || path.startsWith(":memory:") || path.startsWith("file::memory:")) {
            return;
        }
        File dataDir = new File(path).getAbsoluteFile().getParentFile();
        if (dataDir != null && !dataDir.exists()) {
            if (dataDir.mkdirs()) {
                logger.info("[DatabaseConfig] Created data directory {}", dataDir);
            } else {
                logger.error("[DatabaseConfig] Failed to create data directory {}", dataDir);
            }
        }
    }

    @Bean(name = "entityManagerFactory")
    @Primary
    public LocalContainerEntityManagerFactoryBean entityManagerFactory(
            EntityManagerFactoryBuilder builder,
            @Qualifier("dataSource") DataSource dataSource) {
        Map<String, String> properties = new HashMap<>();
        properties.put("hibernate.dialect", "org.hibernate.community.dialect.SQLiteDialect");
        properties.put("hibernate.hbm2ddl.auto", ddlAuto);
        properties.put("hibernate.show_sql", String.valueOf(showSql));
        properties.put("hibernate.format_sql", "true");
        properties.put("hibernate.jdbc.use_get_generated_keys", "false");

        return builder
            .dataSource(dataSource)
            .packages("com.calmtable.restaurant.model", "com.calmtable.restaurant.util")
            .persistenceUnit("default")
            .properties(properties)
            .build();
    }

    @Bean(name = "transactionManager")
    @Primary
    public PlatformTransactionManager transactionManager(
            @Qualifier("entityManagerFactory") EntityManagerFactory entityManagerFactory) {
        return new JpaTransactionManager(entityManagerFactory);
    }
}
