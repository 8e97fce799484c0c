package io.evitadb.polyglot.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.LangChain4jException;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@DisplayName("LlmClient should send prompts and stop after permanent failures")
class LlmClientTest {

	private ChatModel mockModel;

	@BeforeEach
	void setUp() {
		mockModel = mock(ChatModel.class);
	}

	@Test
	@DisplayName("sends system and user message and returns answer text")
	@SuppressWarnings("unchecked")
	void shouldSendSystemAndUserMessage() {
		when(mockModel.chat(anyList())).thenReturn(
			ChatResponse.builder().aiMessage(AiMessage.from("<response/>")).build()
		);

		final LlmClient client = new LlmClient(mockModel);
		final String answer = client.chat("be precise", "translate this");

		assertEquals("<response/>", answer);
		final ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
		verify(mockModel, times(1)).chat(captor.capture());
		final List<ChatMessage> messages = captor.getValue();
		assertEquals(2, messages.size());
		assertEquals("be precise", ((SystemMessage) messages.get(0)).text());
		assertEquals("translate this", ((UserMessage) messages.get(1)).singleText());
	}

	@Test
	@DisplayName("accumulates token usage across calls")
	void shouldAccumulateTokenUsage() {
		when(mockModel.chat(anyList())).thenReturn(
			ChatResponse.builder()
				.aiMessage(AiMessage.from("ok"))
				.tokenUsage(new TokenUsage(100, 40))
				.build()
		);

		final LlmClient client = new LlmClient(mockModel);
		client.chat("s", "u");
		client.chat("s", "u");

		assertEquals(200, client.getInputTokens());
		assertEquals(80, client.getOutputTokens());
	}

	@Test
	@DisplayName("fast-fails after a permanent failure without calling the model")
	void shouldFastFailAfterPermanentFailure() {
		when(mockModel.chat(anyList())).thenThrow(new AuthenticationException("Invalid API key"));

		final LlmClient client = new LlmClient(mockModel);

		assertFalse(client.hasPermanentFailure());
		assertThrows(NonRetriableException.class, () -> client.chat("s", "u"));
		assertTrue(client.hasPermanentFailure());
		assertNotNull(client.getFailureCause());

		final LangChain4jException thrown = assertThrows(LangChain4jException.class, () -> client.chat("s", "u"));
		assertTrue(thrown.getMessage().contains("previous permanent failure"));
		assertTrue(thrown.getMessage().contains("Invalid API key"));
		verify(mockModel, times(1)).chat(anyList());
	}

	@Test
	@DisplayName("propagates retriable exceptions without shutting down")
	void shouldPropagateRetriableException() {
		when(mockModel.chat(anyList()))
			.thenThrow(new RateLimitException("Rate limit exceeded"))
			.thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("recovered")).build());

		final LlmClient client = new LlmClient(mockModel);

		assertThrows(RateLimitException.class, () -> client.chat("s", "u"));
		assertFalse(client.hasPermanentFailure());
		assertEquals("recovered", client.chat("s", "u"));
	}
}
