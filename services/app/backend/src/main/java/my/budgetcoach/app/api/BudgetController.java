package my.budgetcoach.app.api;

import jakarta.validation.Valid;
import my.budgetcoach.app.dto.BudgetAnalysisDto;
import my.budgetcoach.app.dto.BudgetAnalysisRequest;
import my.budgetcoach.app.service.BudgetAdvisorService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/budget")
public class BudgetController {
	private final BudgetAdvisorService budgetAdvisorService;

	public BudgetController(BudgetAdvisorService budgetAdvisorService) {
		this.budgetAdvisorService = budgetAdvisorService;
	}

	@PostMapping("/analyze")
	public BudgetAnalysisDto analyze(@Valid @RequestBody BudgetAnalysisRequest request) {
		return budgetAdvisorService.analyze(request);
	}
}
