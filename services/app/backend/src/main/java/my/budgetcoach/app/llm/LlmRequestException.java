package my.budgetcoach.app.llm;

/**
 * A failed call to the narrative provider.
 * <p>
 * {@code statusCode} is {@code null} when no HTTP response arrived (timeouts, refused connections).
 * Retryable failures are worth one more attempt; the rest (bad key, bad request) are not.
 */
public class LlmRequestException extends RuntimeException {
	private final Integer statusCode;
	private final boolean retryable;

	public LlmRequestException(String message, Integer statusCode, boolean retryable, Throwable cause) {
		super(message, cause);
		this.statusCode = statusCode;
		this.retryable = retryable;
	}

	public Integer getStatusCode() {
		return statusCode;
	}

	public boolean isRetryable() {
		return retryable;
	}

	public String statusLabel() {
		return statusCode == null ? "no response" : "HTTP " + statusCode;
	}
}
