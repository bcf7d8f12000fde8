package my.compositeindex.app.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import static org.assertj.core.api.Assertions.assertThat;

class StaticTokenAuthenticationFilterTest {
	private final StaticTokenAuthenticationFilter filter = new StaticTokenAuthenticationFilter("s3cret");

	@AfterEach
	void clearContext() {
		SecurityContextHolder.clearContext();
	}

	@Test
	void matchingBearerTokenAuthenticates() throws Exception {
		MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/datasets");
		request.addHeader("Authorization", "Bearer s3cret");
		MockFilterChain chain = new MockFilterChain();

		filter.doFilter(request, new MockHttpServletResponse(), chain);

		Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
		assertThat(authentication).isNotNull();
		assertThat(authentication.getName()).isEqualTo(StaticTokenAuthenticationFilter.PRINCIPAL);
		assertThat(authentication.getAuthorities()).extracting(Object::toString).containsExactly("ROLE_API");
		assertThat(chain.getRequest()).isSameAs(request);
	}

	@Test
	void wrongTokenPassesThroughUnauthenticated() throws Exception {
		MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/datasets");
		request.addHeader("Authorization", "Bearer guess");
		MockFilterChain chain = new MockFilterChain();

		filter.doFilter(request, new MockHttpServletResponse(), chain);

		assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
		assertThat(chain.getRequest()).isSameAs(request);
	}

	@Test
	void missingHeaderPassesThroughUnauthenticated() throws Exception {
		MockFilterChain chain = new MockFilterChain();

		filter.doFilter(new MockHttpServletRequest("GET", "/api/health"), new MockHttpServletResponse(), chain);

		assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
		assertThat(chain.getRequest()).isNotNull();
	}
}
