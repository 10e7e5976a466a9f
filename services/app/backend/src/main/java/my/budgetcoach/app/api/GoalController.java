package my.budgetcoach.app.api;

import jakarta.validation.Valid;
import my.budgetcoach.app.dto.GoalPlanDto;
import my.budgetcoach.app.dto.GoalPlanRequest;
import my.budgetcoach.app.service.GoalAdvisorService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/goals")
public class GoalController {
	private final GoalAdvisorService goalAdvisorService;

	public GoalController(GoalAdvisorService goalAdvisorService) {
		this.goalAdvisorService = goalAdvisorService;
	}

	@PostMapping("/plan")
	public GoalPlanDto plan(@Valid @RequestBody GoalPlanRequest request) {
		return goalAdvisorService.plan(request);
	}
}
