package my.budgetcoach.app.service;

import my.budgetcoach.app.model.BudgetReport;
import my.budgetcoach.app.model.CategoryShare;
import my.budgetcoach.app.model.GoalPlan;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Explains computed reports and plans in prose. Uses the LLM when available and
 * otherwise, or when the LLM returns nothing, a fixed template.
 */
@Service
public class FinanceNarrativeService {
	private static final int MAX_CONTEXT_CHARS = 1000;

	private final LlmNarrativeService llmNarrativeService;

	public FinanceNarrativeService(LlmNarrativeService llmNarrativeService) {
		this.llmNarrativeService = llmNarrativeService;
	}

	public Narrative describeBudget(BudgetReport report, List<String> recommendations, String userContext) {
		if (llmNarrativeService != null && llmNarrativeService.isEnabled()) {
			String narrative = llmNarrativeService.suggestBudgetNarrative(buildBudgetPrompt(report, recommendations, userContext));
			if (narrative != null && !narrative.isBlank()) {
				return new Narrative(narrative, Narrative.SOURCE_LLM);
			}
		}
		return new Narrative(buildBudgetTemplate(report), Narrative.SOURCE_TEMPLATE);
	}

	public Narrative describeGoal(GoalPlan plan, double targetAmount, double currentMonthlySurplus, String userContext) {
		if (llmNarrativeService != null && llmNarrativeService.isEnabled()) {
			String narrative = llmNarrativeService.suggestGoalNarrative(
					buildGoalPrompt(plan, targetAmount, currentMonthlySurplus, userContext));
			if (narrative != null && !narrative.isBlank()) {
				return new Narrative(narrative, Narrative.SOURCE_LLM);
			}
		}
		return new Narrative(buildGoalTemplate(plan), Narrative.SOURCE_TEMPLATE);
	}

	String buildBudgetPrompt(BudgetReport report, List<String> recommendations, String userContext) {
		StringBuilder builder = new StringBuilder();
		builder.append("Monthly budget figures:\n");
		builder.append("- income: ").append(money(report.income())).append('\n');
		builder.append("- total expenses: ").append(money(report.totalExpenses())).append('\n');
		builder.append("- surplus: ").append(money(report.surplus())).append('\n');
		builder.append("- savings rate: ").append(report.savingsRate().defined()
				? percent(report.savingsRate().value()) : "undefined (no income)").append('\n');
		builder.append("- emergency fund: ").append(report.emergencyFundMonths().defined()
				? months(report.emergencyFundMonths().value()) + " months" : "undefined (no expenses)").append('\n');
		builder.append("Expenses by category:\n");
		for (CategoryShare share : report.categoryShares()) {
			builder.append("- ").append(share.category()).append(": ").append(money(share.amount()));
			if (share.shareOfExpenses().defined()) {
				builder.append(" (").append(percent(share.shareOfExpenses().value())).append(" of expenses)");
			}
			builder.append('\n');
		}
		appendList(builder, "Red flags", report.redFlags());
		appendList(builder, "Suggestions", recommendations);
		appendContext(builder, userContext);
		return builder.toString();
	}

	String buildGoalPrompt(GoalPlan plan, double targetAmount, double currentMonthlySurplus, String userContext) {
		StringBuilder builder = new StringBuilder();
		builder.append("Savings goal plan:\n");
		builder.append("- target amount: ").append(money(targetAmount)).append('\n');
		builder.append("- still to save: ").append(money(plan.remainingAmount())).append('\n');
		builder.append("- deadline: ").append(plan.targetDate()).append(" (").append(plan.monthsRemaining()).append(" months)\n");
		builder.append("- required monthly saving: ").append(money(plan.requiredMonthlySaving())).append('\n');
		builder.append("- current monthly surplus: ").append(money(currentMonthlySurplus)).append('\n');
		builder.append("- feasible: ").append(plan.feasible() ? "yes" : "no").append('\n');
		if (!plan.feasible()) {
			builder.append("- monthly shortfall: ").append(money(plan.shortfall())).append('\n');
		}
		appendContext(builder, userContext);
		return builder.toString();
	}

	String buildBudgetTemplate(BudgetReport report) {
		StringBuilder builder = new StringBuilder();
		builder.append(String.format(Locale.ROOT, "You spend %s of %s income, leaving %s %s.",
				money(report.totalExpenses()), money(report.income()), money(Math.abs(report.surplus())),
				report.surplus() < 0.0d ? "uncovered" : "each month"));
		if (report.savingsRate().defined()) {
			builder.append(" Savings rate is ").append(percent(report.savingsRate().value())).append('.');
		} else {
			builder.append(" Savings rate cannot be computed without income.");
		}
		if (report.emergencyFundMonths().defined()) {
			builder.append(" That covers ").append(months(report.emergencyFundMonths().value()))
					.append(" months of expenses.");
		}
		if (report.hasRedFlags()) {
			builder.append(" Watch out: ").append(String.join(" ", report.redFlags()));
		} else {
			builder.append(" No red flags.");
		}
		return builder.toString();
	}

	String buildGoalTemplate(GoalPlan plan) {
		String base = String.format(Locale.ROOT, "Saving %s over %d month%s needs %s per month.",
				money(plan.remainingAmount()), plan.monthsRemaining(), plan.monthsRemaining() == 1 ? "" : "s",
				money(plan.requiredMonthlySaving()));
		if (plan.feasible()) {
			return base + " Your current surplus covers it.";
		}
		return base + " Your current surplus falls short by " + money(plan.shortfall()) + " per month.";
	}

	private void appendList(StringBuilder builder, String title, List<String> items) {
		if (items == null || items.isEmpty()) {
			return;
		}
		builder.append(title).append(":\n");
		for (String item : items) {
			builder.append("- ").append(item).append('\n');
		}
	}

	private void appendContext(StringBuilder builder, String userContext) {
		if (userContext == null || userContext.isBlank()) {
			return;
		}
		String trimmed = userContext.trim();
		if (trimmed.length() > MAX_CONTEXT_CHARS) {
			trimmed = trimmed.substring(0, MAX_CONTEXT_CHARS);
		}
		builder.append("User question: ").append(trimmed).append('\n');
	}

	private static String money(double amount) {
		return String.format(Locale.ROOT, "%.2f", amount);
	}

	private static String percent(double fraction) {
		return String.format(Locale.ROOT, "%.1f%%", fraction * 100.0d);
	}

	private static String months(double value) {
		return String.format(Locale.ROOT, "%.1f", value);
	}
}
