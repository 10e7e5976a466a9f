package my.budgetcoach.app.service;

import my.budgetcoach.app.dto.BudgetAnalysisDto;
import my.budgetcoach.app.dto.BudgetAnalysisRequest;
import my.budgetcoach.app.model.BudgetBenchmarks;
import my.budgetcoach.app.model.BudgetReport;
import my.budgetcoach.app.rules.BenchmarkTipRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class BudgetAdvisorService {
	private static final Logger logger = LoggerFactory.getLogger(BudgetAdvisorService.class);

	private final BudgetAnalyzer budgetAnalyzer;
	private final BudgetBenchmarks benchmarks;
	private final FinanceNarrativeService narrativeService;

	public BudgetAdvisorService(BudgetAnalyzer budgetAnalyzer,
								BudgetBenchmarks benchmarks,
								FinanceNarrativeService narrativeService) {
		this.budgetAnalyzer = budgetAnalyzer;
		this.benchmarks = benchmarks;
		this.narrativeService = narrativeService;
	}

	public BudgetAnalysisDto analyze(BudgetAnalysisRequest request) {
		if (request == null || request.income() == null) {
			throw new InvalidInputException("income is required");
		}
		BudgetReport report = budgetAnalyzer.analyze(request.income(), request.expenses(), request.liquidSavings());
		List<String> recommendations = BenchmarkTipRules.evaluate(report, benchmarks);
		logger.debug("Budget analyzed (categories={}, redFlags={}, recommendations={}).",
				report.categoryShares().size(), report.redFlags().size(), recommendations.size());
		Narrative narrative = narrativeService.describeBudget(report, recommendations, request.context());
		return new BudgetAnalysisDto(report, recommendations, narrative.text(), narrative.source());
	}
}
