package my.compositeindex.app.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
public class SecurityConfig {
	private static final Logger logger = LoggerFactory.getLogger(SecurityConfig.class);
	private final AppProperties properties;

	public SecurityConfig(AppProperties properties) {
		this.properties = properties;
	}

	/**
	 * No form or basic login exists; an empty user store keeps Boot from generating a default password.
	 */
	@Bean
	public UserDetailsService userDetailsService() {
		return new InMemoryUserDetailsManager();
	}

	@Bean
	public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
		http
			.csrf(csrf -> csrf.disable())
			.httpBasic(basic -> basic.disable())
			.formLogin(form -> form.disable())
			.sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
			.exceptionHandling(ex -> ex.authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)));

		if (properties.security().tokenEnabled()) {
			logger.info("API token protection enabled for /api/**");
			http
				.addFilterBefore(new StaticTokenAuthenticationFilter(properties.security().token()),
						UsernamePasswordAuthenticationFilter.class)
				.authorizeHttpRequests(auth -> auth
					.requestMatchers("/api/health").permitAll()
					.requestMatchers("/api/**").authenticated()
					.anyRequest().permitAll());
		} else {
			logger.warn("No API token configured (app.security.token); /api/** is open");
			http.authorizeHttpRequests(auth -> auth.anyRequest().permitAll());
		}
		return http.build();
	}
}
