package my.budgetcoach.app.api;

import my.budgetcoach.app.BudgetCoachApplication;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.hamcrest.Matchers.closeTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = BudgetCoachApplication.class)
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(GoalApiIntegrationTest.TestConfig.class)
class GoalApiIntegrationTest {
	@Autowired
	private MockMvc mockMvc;

	@Test
	void planReportsShortfallForUnderfundedGoal() throws Exception {
		mockMvc.perform(post("/api/goals/plan").contentType(MediaType.APPLICATION_JSON)
						.content("{\"targetAmount\": 25000, \"monthsFromNow\": 6, \"currentMonthlySurplus\": 3000}"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.plan.monthsRemaining").value(6))
				.andExpect(jsonPath("$.plan.targetDate").value("2026-09-15"))
				.andExpect(jsonPath("$.plan.requiredMonthlySaving").value(closeTo(4166.67, 0.01)))
				.andExpect(jsonPath("$.plan.feasible").value(false))
				.andExpect(jsonPath("$.plan.shortfall").value(closeTo(1166.67, 0.01)))
				.andExpect(jsonPath("$.narrativeSource").value("template"));
	}

	@Test
	void planWithCalendarDeadlineIsFeasible() throws Exception {
		mockMvc.perform(post("/api/goals/plan").contentType(MediaType.APPLICATION_JSON)
						.content("{\"targetAmount\": 25000, \"deadline\": \"2026-09-15\", \"currentMonthlySurplus\": 5000}"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.plan.monthsRemaining").value(6))
				.andExpect(jsonPath("$.plan.feasible").value(true))
				.andExpect(jsonPath("$.plan.shortfall").value(0.0));
	}

	@Test
	void pastDeadlineIsRejected() throws Exception {
		mockMvc.perform(post("/api/goals/plan").contentType(MediaType.APPLICATION_JSON)
						.content("{\"targetAmount\": 1000, \"deadline\": \"2026-03-14\", \"currentMonthlySurplus\": 100}"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.code").value("invalid_deadline"));
	}

	@Test
	void missingDeadlineIsRejected() throws Exception {
		mockMvc.perform(post("/api/goals/plan").contentType(MediaType.APPLICATION_JSON)
						.content("{\"targetAmount\": 1000, \"currentMonthlySurplus\": 100}"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.code").value("invalid_deadline"));
	}

	@Test
	void nonPositiveTargetIsRejected() throws Exception {
		mockMvc.perform(post("/api/goals/plan").contentType(MediaType.APPLICATION_JSON)
						.content("{\"targetAmount\": 0, \"monthsFromNow\": 3, \"currentMonthlySurplus\": 100}"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.code").value("invalid_input"));
	}

	@Configuration
	static class TestConfig {
		@Bean
		@Primary
		Clock fixedClock() {
			return Clock.fixed(Instant.parse("2026-03-15T10:00:00Z"), ZoneOffset.UTC);
		}
	}
}
