package my.compositeindex.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		Security security,
		@Valid @NotNull Engine engine,
		Sample sample
) {
	public AppProperties {
		security = security == null ? new Security(null) : security;
		sample = sample == null ? new Sample(true) : sample;
	}

	public record Security(
			String token
	) {
		public boolean tokenEnabled() {
			return token != null && !token.isBlank();
		}
	}

	public record Engine(
			@DecimalMin(value = "0.0", inclusive = false) @DecimalMax("1.0") double pcaCumVarThreshold,
			@DecimalMin("0.0") double ahpConsistencyThreshold,
			@Min(1) int eigenMaxSweeps,
			@Min(1) int previewRows
	) {
	}

	public record Sample(
			boolean enabled
	) {
	}
}
