package io.github.yok.sqlinsert.config;

import io.github.yok.sqlinsert.core.SqlInserter;
import io.github.yok.sqlinsert.db.DataSourceInsertExecutor;
import io.github.yok.sqlinsert.db.InsertExecutor;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnSingleCandidate;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration for SQLInsert.
 *
 * <p>
 * Binds {@link SqlInsertProperties} and registers:
 * </p>
 * <ul>
 * <li>{@link InsertConfig} built from the {@code sqlinsert} properties</li>
 * <li>{@link SqlInserter} using that config</li>
 * <li>{@link DataSourceInsertExecutor} when the context has a single {@link DataSource}</li>
 * </ul>
 *
 * <p>
 * Each bean backs off when the application defines its own.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@AutoConfiguration(
        afterName = "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration")
@EnableConfigurationProperties(SqlInsertProperties.class)
public class SqlInsertAutoConfiguration {

    /**
     * Creates the application-wide insert config.
     *
     * @param properties bound {@code sqlinsert} properties
     * @return insert config
     */
    @Bean
    @ConditionalOnMissingBean
    public InsertConfig insertConfig(SqlInsertProperties properties) {
        InsertConfig config = properties.toInsertConfig();
        log.info("SQLInsert configured. tokenType={}, annotationKey={}, format={}",
                config.getTokenType(), config.getAnnotationKey(), config.getFormat());
        return config;
    }

    /**
     * Creates the inserter.
     *
     * @param insertConfig insert config
     * @return inserter
     */
    @Bean
    @ConditionalOnMissingBean
    public SqlInserter sqlInserter(InsertConfig insertConfig) {
        return new SqlInserter(insertConfig);
    }

    /**
     * Creates an executor over the application data source.
     *
     * @param dataSource data source
     * @return executor joining Spring-managed transactions
     */
    @Bean
    @ConditionalOnMissingBean(InsertExecutor.class)
    @ConditionalOnSingleCandidate(DataSource.class)
    public DataSourceInsertExecutor dataSourceInsertExecutor(DataSource dataSource) {
        return new DataSourceInsertExecutor(dataSource);
    }
}
