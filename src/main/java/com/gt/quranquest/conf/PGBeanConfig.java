package com.gt.quranquest.conf;

import com.gt.quranquest.progress.VerseLearningStateDao;
import com.gt.quranquest.progress.impl.VerseLearningStateDaoPG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;

@Configuration
@ConditionalOnProperty(name = "quranquest.store", havingValue = "pg")
public class PGBeanConfig {

    @Bean
    public DataSource getDataSource(@Value("${quranquest.datasource.postgres.url}") String url,
                                    @Value("${quranquest.datasource.postgres.username}") String username,
                                    @Value("${quranquest.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {
        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public VerseLearningStateDao getVerseLearningStateDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new VerseLearningStateDaoPG(namedParameterJdbcTemplate);
    }
}
