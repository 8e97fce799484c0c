package io.evitadb.polyglot.llm;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.LangChain4jException;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Wraps a ChatModel with permanent failure detection and token accounting.
 *
 * LangChain4j already retries transient errors internally. Once a {@link NonRetriableException} is seen (bad key,
 * unknown model, ...) every following call fails immediately without contacting the backend, so a page of many
 * batches does not hammer an endpoint that will never answer.
 */
public final class LlmClient {

	@Nonnull
	private final ChatModel model;
	@Nonnull
	private final AtomicBoolean permanentFailure = new AtomicBoolean(false);
	@Nonnull
	private final AtomicReference<NonRetriableException> failureCause = new AtomicReference<>();
	private final AtomicLong inputTokens = new AtomicLong();
	private final AtomicLong outputTokens = new AtomicLong();

	/**
	 * Creates an LLM client wrapping the given ChatModel.
	 *
	 * @param model the underlying chat model
	 */
	public LlmClient(@Nonnull ChatModel model) {
		this.model = Objects.requireNonNull(model, "model must not be null");
	}

	/**
	 * Sends a system and a user message and returns the text of the answer.
	 *
	 * @param systemPrompt instructions for the model
	 * @param userPrompt   the request
	 * @return the answer text, empty if the model returned no text
	 * @throws NonRetriableException if a permanent failure occurs
	 * @throws LangChain4jException  for other LLM errors or after a previous permanent failure
	 */
	@Nonnull
	public String chat(@Nonnull String systemPrompt, @Nonnull String userPrompt) {
		Objects.requireNonNull(systemPrompt, "systemPrompt must not be null");
		Objects.requireNonNull(userPrompt, "userPrompt must not be null");

		if (this.permanentFailure.get()) {
			final NonRetriableException cause = this.failureCause.get();
			throw new LangChain4jException(
				"LLM client shutdown due to previous permanent failure" +
					(cause != null ? ": " + cause.getMessage() : ""),
				cause
			);
		}

		final List<ChatMessage> messages = List.of(
			SystemMessage.from(systemPrompt),
			UserMessage.from(userPrompt)
		);
		final ChatResponse response;
		try {
			response = this.model.chat(messages);
		} catch (NonRetriableException e) {
			this.failureCause.set(e);
			this.permanentFailure.set(true);
			throw e;
		}

		final TokenUsage tokenUsage = response.tokenUsage();
		if (tokenUsage != null) {
			this.inputTokens.addAndGet(tokenUsage.inputTokenCount() != null ? tokenUsage.inputTokenCount() : 0);
			this.outputTokens.addAndGet(tokenUsage.outputTokenCount() != null ? tokenUsage.outputTokenCount() : 0);
		}
		final String text = response.aiMessage() != null ? response.aiMessage().text() : null;
		return text != null ? text : "";
	}

	/**
	 * Checks if a permanent failure has occurred.
	 *
	 * @return true if every further call will fail immediately
	 */
	public boolean hasPermanentFailure() {
		return this.permanentFailure.get();
	}

	@Nullable
	public NonRetriableException getFailureCause() {
		return this.failureCause.get();
	}

	public long getInputTokens() {
		return this.inputTokens.get();
	}

	public long getOutputTokens() {
		return this.outputTokens.get();
	}
}
