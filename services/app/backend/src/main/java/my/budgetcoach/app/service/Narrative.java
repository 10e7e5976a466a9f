package my.budgetcoach.app.service;

public record Narrative(String text, String source) {
	public static final String SOURCE_LLM = "llm";
	public static final String SOURCE_TEMPLATE = "template";
}
