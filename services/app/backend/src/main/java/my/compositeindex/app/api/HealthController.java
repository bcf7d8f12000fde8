package my.compositeindex.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import my.compositeindex.app.dto.OnboardingDto;
import my.compositeindex.app.dto.StatusDto;
import my.compositeindex.app.service.OnboardingService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Tag(name = "Health")
public class HealthController {
	private final OnboardingService onboardingService;

	public HealthController(OnboardingService onboardingService) {
		this.onboardingService = onboardingService;
	}

	@GetMapping("/health")
	@Operation(summary = "Liveness probe")
	public StatusDto health() {
		return StatusDto.OK;
	}

	@GetMapping("/onboarding")
	@Operation(summary = "Ids of the seeded sample dataset, models and results")
	public OnboardingDto onboarding() {
		return onboardingService.getOnboarding();
	}
}
