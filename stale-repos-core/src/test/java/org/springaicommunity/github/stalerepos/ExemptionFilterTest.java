package org.springaicommunity.github.stalerepos;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ExemptionFilter and the glob patterns it matches names with.
 */
@DisplayName("ExemptionFilter Tests")
class ExemptionFilterTest {

	@Nested
	@DisplayName("Glob Pattern Tests")
	class GlobPatternTest {

		@ParameterizedTest(name = "{0} matches {1}: {2}")
		@CsvSource({ "data-*, data-temp, true", "data-*, data-, true", "data-*, old-data-temp, false",
				"*-archive, docs-archive, true", "repo?, repo1, true", "repo?, repo12, false",
				"'repo[0-9]', repo7, true", "'repo[0-9]', repoX, false", "'repo[!0-9]', repoX, true",
				"'repo[!0-9]', repo7, false", "exact, exact, true", "exact, Exact, false",
				"a.b, a.b, true", "a.b, axb, false", "'a[b', 'a[b', true", "*, anything, true",
				"'[z-a]', z, false", "'[z-a]*', svc, false", "'[!z-a]', q, true", "'[a-cz-a]', b, true",
				"'[a-cz-a]', z, false", "'x[a-]', x-, true" })
		void shouldMatchLikeShellGlobs(String glob, String name, boolean expected) {
			assertThat(GlobPattern.compile(glob).matches(name)).isEqualTo(expected);
		}

		@Test
		@DisplayName("Should quote regex metacharacters")
		void shouldQuoteRegexMetacharacters() {
			GlobPattern pattern = GlobPattern.compile("lib(core)+");

			assertThat(pattern.matches("lib(core)+")).isTrue();
			assertThat(pattern.matches("libcore")).isFalse();
		}

		@Test
		@DisplayName("Should treat a reversed range as matching nothing")
		void shouldNotExemptWithReversedRange() {
			ExemptionFilter filter = new ExemptionFilter(List.of("[z-a]*"), List.of());
			FakeRepositorySummary repo = FakeRepositorySummary.named("svc");

			assertThat(filter.isExempt(repo)).isFalse();
		}

	}

	@Nested
	@DisplayName("Rule Evaluation Tests")
	class RuleEvaluationTest {

		@Test
		@DisplayName("Should not exempt when nothing is configured")
		void shouldNotExemptWithoutConfiguration() {
			ExemptionFilter filter = new ExemptionFilter(List.of(), List.of());
			FakeRepositorySummary repo = FakeRepositorySummary.named("service").topics("anything");

			assertThat(filter.isExempt(repo)).isFalse();
			assertThat(repo.topicLookups).isZero();
		}

		@Test
		@DisplayName("Should exempt by name before looking at topics")
		void shouldShortCircuitOnNameMatch() {
			ExemptionFilter filter = new ExemptionFilter(List.of("sandbox-*"), List.of("keep"));
			FakeRepositorySummary repo = FakeRepositorySummary.named("sandbox-ui").topics("keep");

			assertThat(filter.isExempt(repo)).isTrue();
			assertThat(repo.topicLookups).isZero();
		}

		@Test
		@DisplayName("Should exempt when any topic matches")
		void shouldExemptOnTopicMatch() {
			ExemptionFilter filter = new ExemptionFilter(List.of("sandbox-*"), List.of("keep", "legacy"));
			FakeRepositorySummary repo = FakeRepositorySummary.named("service").topics("java", "legacy");

			assertThat(filter.isExempt(repo)).isTrue();
			assertThat(repo.topicLookups).isEqualTo(1);
		}

		@Test
		@DisplayName("Should compare topics exactly")
		void shouldCompareTopicsExactly() {
			ExemptionFilter filter = new ExemptionFilter(List.of(), List.of("keep"));
			FakeRepositorySummary repo = FakeRepositorySummary.named("service").topics("Keep", "keeper");

			assertThat(filter.isExempt(repo)).isFalse();
		}

		@Test
		@DisplayName("Should rethrow topic lookup failures other than not found")
		void shouldRethrowServerErrors() {
			ExemptionFilter filter = new ExemptionFilter(List.of(), List.of("keep"));
			FakeRepositorySummary repo = FakeRepositorySummary.named("service").topics(() -> {
				throw new GitHubHttpClient.GitHubApiException("Server error", 502, null);
			});

			assertThatThrownBy(() -> filter.isExempt(repo)).isInstanceOf(GitHubHttpClient.GitHubApiException.class);
		}

		@Test
		@DisplayName("Should build from policy")
		void shouldBuildFromPolicy() {
			Policy policy = new Policy(10, List.of("docs"), Set.of(), ActivityMethod.PUSHED,
					Set.of());

			ExemptionFilter filter = ExemptionFilter.from(policy);

			assertThat(filter.isExempt(FakeRepositorySummary.named("docs"))).isTrue();
			assertThat(filter.isExempt(FakeRepositorySummary.named("docs2"))).isFalse();
		}

	}

}
