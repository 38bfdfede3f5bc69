package com.gt.recall.conf;

import com.gt.recall.reviewItem.ReviewItemDao;
import com.gt.recall.reviewItem.impl.ReviewItemDaoPG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.time.Clock;

@Configuration
public class PGBeanConfig {

    @Bean
    public DataSource getDataSource(@Value("${recall.datasource.postgres.url}") String url,
                                    @Value("${recall.datasource.postgres.username}") String username,
                                    @Value("${recall.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {

        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public ReviewItemDao getReviewItemDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new ReviewItemDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public Clock getClock() {
        return Clock.systemUTC();
    }
}
