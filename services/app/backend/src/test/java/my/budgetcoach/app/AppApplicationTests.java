package my.budgetcoach.app;

import my.budgetcoach.app.llm.LlmClient;
import my.budgetcoach.app.llm.NoopLlmClient;
import my.budgetcoach.app.model.FinanceThresholds;
import my.budgetcoach.app.service.LlmNarrativeService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class AppApplicationTests {
	@Autowired
	private LlmClient llmClient;

	@Autowired
	private LlmNarrativeService llmNarrativeService;

	@Autowired
	private FinanceThresholds thresholds;

	@Test
	void contextLoadsWithNoopLlmAndDefaultThresholds() {
		assertThat(llmClient).isInstanceOf(NoopLlmClient.class);
		assertThat(llmNarrativeService.isEnabled()).isFalse();
		assertThat(thresholds).isEqualTo(FinanceThresholds.defaults());
	}
}
