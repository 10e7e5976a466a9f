package my.budgetcoach.app.api;

import my.budgetcoach.app.dto.FinanceSettingsDto;
import my.budgetcoach.app.model.BudgetBenchmarks;
import my.budgetcoach.app.model.FinanceThresholds;
import my.budgetcoach.app.service.LlmNarrativeService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/finance")
public class FinanceSettingsController {
	private final FinanceThresholds thresholds;
	private final BudgetBenchmarks benchmarks;
	private final LlmNarrativeService llmNarrativeService;

	public FinanceSettingsController(FinanceThresholds thresholds,
									 BudgetBenchmarks benchmarks,
									 LlmNarrativeService llmNarrativeService) {
		this.thresholds = thresholds;
		this.benchmarks = benchmarks;
		this.llmNarrativeService = llmNarrativeService;
	}

	@GetMapping("/thresholds")
	public FinanceSettingsDto thresholds() {
		return new FinanceSettingsDto(thresholds, benchmarks, llmNarrativeService.isEnabled());
	}
}
