package com.gt.chamlang.conf;

import com.gt.chamlang.progress.UserPracticeProgressDao;
import com.gt.chamlang.progress.WordProgressDao;
import com.gt.chamlang.progress.impl.UserPracticeProgressDaoPG;
import com.gt.chamlang.progress.impl.WordProgressDaoPG;
import com.gt.chamlang.session.PracticeSessionDao;
import com.gt.chamlang.session.impl.PracticeSessionDaoPG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;

@Configuration
public class PGBeanConfig {

    @Bean
    public DataSource getDataSource(@Value("${chamlang.datasource.postgres.url}") String url,
                                    @Value("${chamlang.datasource.postgres.username}") String username,
                                    @Value("${chamlang.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {

        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public WordProgressDao getWordProgressDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new WordProgressDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public UserPracticeProgressDao getUserPracticeProgressDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new UserPracticeProgressDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public PracticeSessionDao getPracticeSessionDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new PracticeSessionDaoPG(namedParameterJdbcTemplate);
    }
}
