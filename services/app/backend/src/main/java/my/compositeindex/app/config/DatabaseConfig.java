package my.compositeindex.app.config;

import liquibase.integration.spring.SpringLiquibase;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.support.DatabaseStartupValidator;

import javax.sql.DataSource;

@Configuration
@EnableConfigurationProperties(DatabaseConfig.LiquibaseSettings.class)
public class DatabaseConfig {
	static final String DEFAULT_CHANGE_LOG = "classpath:db/changelog/db.changelog-master.yaml";

	@Bean
	public DatabaseStartupValidator databaseStartupValidator(DataSource dataSource, LiquibaseSettings settings) {
		DatabaseStartupValidator validator = new DatabaseStartupValidator();
		validator.setDataSource(dataSource);
		validator.setTimeout(settings.getStartupTimeoutSeconds());
		validator.setInterval(settings.getStartupIntervalSeconds());
		return validator;
	}

	@Bean
	@DependsOn("databaseStartupValidator")
	public SpringLiquibase liquibase(DataSource dataSource, LiquibaseSettings settings) {
		SpringLiquibase liquibase = new SpringLiquibase();
		liquibase.setDataSource(dataSource);
		liquibase.setChangeLog(resolveChangeLog(settings.getChangeLog()));
		liquibase.setShouldRun(settings.isEnabled());
		return liquibase;
	}

	static String resolveChangeLog(String configured) {
		return configured == null || configured.isBlank() ? DEFAULT_CHANGE_LOG : configured;
	}

	@ConfigurationProperties(prefix = "spring.liquibase")
	public static class LiquibaseSettings {
		private String changeLog;
		private boolean enabled = true;
		private int startupTimeoutSeconds = 60;
		private int startupIntervalSeconds = 5;

		public String getChangeLog() {
			return changeLog;
		}

		public void setChangeLog(String changeLog) {
			this.changeLog = changeLog;
		}

		public boolean isEnabled() {
			return enabled;
		}

		public void setEnabled(boolean enabled) {
			this.enabled = enabled;
		}

		public int getStartupTimeoutSeconds() {
			return startupTimeoutSeconds;
		}

		public void setStartupTimeoutSeconds(int startupTimeoutSeconds) {
			this.startupTimeoutSeconds = startupTimeoutSeconds;
		}

		public int getStartupIntervalSeconds() {
			return startupIntervalSeconds;
		}

		public void setStartupIntervalSeconds(int startupIntervalSeconds) {
			this.startupIntervalSeconds = startupIntervalSeconds;
		}
	}
}
