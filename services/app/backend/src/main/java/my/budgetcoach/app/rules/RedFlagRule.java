package my.budgetcoach.app.rules;

import my.budgetcoach.app.model.FinanceThresholds;

import java.util.Optional;

public interface RedFlagRule {
	String id();

	Optional<String> evaluate(BudgetFigures figures, FinanceThresholds thresholds);
}
