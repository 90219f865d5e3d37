package io.clubone.donation.config;

import javax.sql.DataSource;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
public class DBConfiguration {

	@Primary
	@Bean(name = "donationDb")
	@ConfigurationProperties(prefix = "spring.datasource.donation")
	public DataSource donationDataSource() {
		return DataSourceBuilder.create().build();
	}

	@Bean(name = "donationJdbcTemplate")
	public JdbcTemplate donationJdbcTemplate(@Qualifier("donationDb") DataSource donationDb) {
		return new JdbcTemplate(donationDb, false);
	}
}
