package io.evitadb.polyglot.job;

import io.evitadb.polyglot.model.BatchState;
import io.evitadb.polyglot.model.JobState;
import io.evitadb.polyglot.model.JobSummary;
import io.evitadb.polyglot.model.TranslationSettings;
import io.evitadb.polyglot.provider.TranslationProviderException;
import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PageTranslationJob should translate documents batch by batch")
class PageTranslationJobTest {

	private ScriptedProvider provider;
	private RecordingListener listener;
	private TestLog log;

	@BeforeEach
	void setUp() {
		provider = new ScriptedProvider();
		listener = new RecordingListener();
		log = new TestLog();
	}

	@Test
	@DisplayName("translates every block and reports progress")
	void shouldTranslateAllBlocks() {
		final InMemoryDocument document = new InMemoryDocument(
			List.of("Introduction"),
			List.of("Read the ", "manual", " first."),
			List.of("Done here")
		);

		final JobSummary summary = run(document, settings(1000, 20));

		assertEquals(JobState.COMPLETED, summary.state());
		assertEquals(1, summary.batchCount());
		assertEquals(3, summary.translatedGroups());
		assertTrue(summary.isAllSuccessful());
		assertEquals(
			List.of("[de] Introduction", "[de] Read the ", "[de] manual", "[de]  first.", "[de] Done here"),
			document.texts()
		);
		assertEquals(
			List.of("Scanning document...", "Found 3 blocks", "Translating batch 1/1", "Translation completed (1 batches)"),
			listener.statuses
		);
		assertEquals(List.of(0, 1, 2), listener.loading);
		assertEquals(List.of(0, 1, 2), listener.settled);
	}

	@Test
	@DisplayName("keeps going after a failed batch and reports its blocks")
	void shouldIsolateFailedBatch() {
		final InMemoryDocument document = new InMemoryDocument(List.of("first block"), List.of("second block"), List.of("third block"));
		provider
			.thenEcho()
			.thenFail(new TranslationProviderException(TranslationProviderException.Kind.RATE_LIMIT, "scripted", "Rate limit exceeded for scripted"))
			.thenEcho();

		final PageTranslationJob job = job(document, settings(1000, 1));
		final JobSummary summary = job.start().toCompletableFuture().join();

		assertEquals(JobState.COMPLETED_WITH_ERRORS, summary.state());
		assertEquals(JobState.COMPLETED_WITH_ERRORS, job.getState());
		assertEquals(3, summary.batchCount());
		assertEquals(1, summary.errorCount());
		assertEquals(List.of("Block 2: Rate limit exceeded for scripted"), summary.errors());
		assertEquals(2, summary.translatedGroups());
		assertEquals(List.of("[de] first block", "second block", "[de] third block"), document.texts());
		assertEquals(BatchState.APPLIED, job.getBatchState(0));
		assertEquals(BatchState.FAILED, job.getBatchState(1));
		assertEquals(BatchState.APPLIED, job.getBatchState(2));
		assertEquals("Translation completed with errors (3 batches, 1 errors)", listener.statuses.get(listener.statuses.size() - 1));
		assertEquals(List.of(0, 1, 2), listener.settled);
		assertTrue(log.errors.contains("Block error: Block 2: Rate limit exceeded for scripted"));
	}

	@Test
	@DisplayName("labels a failed multi-block batch with every block number")
	void shouldLabelMultiBlockFailure() {
		final InMemoryDocument document = new InMemoryDocument(List.of("alpha text"), List.of("beta text"));
		provider.then(payload -> {
			throw new IllegalStateException("boom");
		});

		final JobSummary summary = run(document, settings(1000, 20));

		assertEquals(JobState.COMPLETED_WITH_ERRORS, summary.state());
		assertEquals(List.of("Blocks 1, 2: boom"), summary.errors());
		assertEquals(List.of("alpha text", "beta text"), document.texts());
		assertEquals(BatchState.FAILED, summary.batchOutcomes().get(0).state());
	}

	@Test
	@DisplayName("discards late results and reverts the document on cancel")
	void shouldDiscardLateResultsOnCancel() {
		final InMemoryDocument document = new InMemoryDocument(List.of("first block"), List.of("second block"), List.of("third block"));
		provider.thenEcho();
		final CompletableFuture<String> pending = provider.thenPending();

		final PageTranslationJob job = job(document, settings(1000, 1));
		final CompletableFuture<JobSummary> result = job.start().toCompletableFuture();

		assertEquals("[de] first block", document.texts().get(0));
		assertEquals(BatchState.IN_FLIGHT, job.getBatchState(1));
		assertFalse(result.isDone());

		job.cancel();
		assertEquals(List.of("first block", "second block", "third block"), document.texts());

		pending.complete(ScriptedProvider.echo(provider.payloads.get(1)));
		final JobSummary summary = result.join();

		assertEquals(JobState.CANCELLED, summary.state());
		assertTrue(job.isCancelled());
		assertEquals(List.of("first block", "second block", "third block"), document.texts());
		assertEquals(2, provider.payloads.size());
		assertEquals(BatchState.APPLIED, summary.batchOutcomes().get(0).state());
		assertEquals(BatchState.DISCARDED, summary.batchOutcomes().get(1).state());
		assertEquals(BatchState.DISCARDED, summary.batchOutcomes().get(2).state());
		assertEquals("Translation cancelled", listener.statuses.get(listener.statuses.size() - 1));
	}

	@Test
	@DisplayName("reverts the whole document when cancelled while a batch is being applied")
	void shouldRevertBatchCancelledDuringApply() throws InterruptedException {
		final AtomicReference<PageTranslationJob> jobRef = new AtomicReference<>();
		final AtomicReference<Thread> canceller = new AtomicReference<>();
		final InMemoryDocument document = new InMemoryDocument(List.of("first block"), List.of("second block")) {
			@Override
			public void apply(int handle, String text) {
				super.apply(handle, text);
				if (handle == 0) {
					final Thread thread = new Thread(() -> jobRef.get().cancel());
					canceller.set(thread);
					thread.start();
					try {
						Thread.sleep(100);
					} catch (InterruptedException e) {
						Thread.currentThread().interrupt();
					}
				}
			}
		};
		provider.thenEcho();

		final PageTranslationJob job = job(document, settings(1000, 20));
		jobRef.set(job);
		job.start().toCompletableFuture().join();
		canceller.get().join(5000);

		assertTrue(job.isCancelled());
		assertEquals(List.of("first block", "second block"), document.texts());
	}

	@Test
	@DisplayName("falls back to sentence split when the reply is not structured")
	void shouldUseSentenceFallback() {
		final InMemoryDocument document = new InMemoryDocument(List.of("Hello world.", "How are you?"));
		provider.thenReply("Hallo Welt. Wie geht es dir?");

		final JobSummary summary = run(document, settings(1000, 20));

		assertEquals(JobState.COMPLETED, summary.state());
		assertEquals(List.of("Hallo Welt.", "Wie geht es dir?"), document.texts());
		assertTrue(summary.batchOutcomes().get(0).fallbackUsed());
		assertEquals(1, summary.fallbackCount());
		assertTrue(log.warnings.stream().anyMatch(message -> message.contains("approximate sentence split")));
	}

	@Test
	@DisplayName("keeps the original text of items the backend left empty or skipped")
	void shouldKeepOriginalForEmptyTranslation() {
		final InMemoryDocument document = new InMemoryDocument(List.of("keep this", "translate this", "missing one"));
		provider.thenReply(
			"<response><item><original>keep this</original><translated> </translated></item>" +
				"<item><original>translate this</original><translated>übersetze das</translated></item></response>"
		);

		final JobSummary summary = run(document, settings(1000, 20));

		assertEquals(JobState.COMPLETED, summary.state());
		assertEquals(List.of("keep this", "übersetze das", "missing one"), document.texts());
		assertEquals(2, summary.emptyTranslations());
		assertEquals(1, summary.batchOutcomes().get(0).appliedCount());
	}

	@Test
	@DisplayName("fails when the document has nothing to translate")
	void shouldFailWithoutFragments() {
		final InMemoryDocument document = new InMemoryDocument(List.of());
		final PageTranslationJob job = job(document, settings(1000, 20));

		final CompletionException exception = assertThrows(CompletionException.class, () -> job.start().toCompletableFuture().join());

		assertInstanceOf(NothingToTranslateException.class, exception.getCause());
		assertEquals(JobState.FAILED, job.getState());
		assertEquals(JobState.FAILED, listener.states.get(listener.states.size() - 1));
		assertTrue(provider.payloads.isEmpty());
	}

	@Test
	@DisplayName("cannot be started twice")
	void shouldRejectSecondStart() {
		final PageTranslationJob job = job(new InMemoryDocument(List.of("some text")), settings(1000, 20));
		job.start().toCompletableFuture().join();

		assertThrows(IllegalStateException.class, job::start);
	}

	@Test
	@DisplayName("waits between batches when throttling is configured")
	void shouldThrottleBetweenBatches() {
		final InMemoryDocument document = new InMemoryDocument(List.of("first block"), List.of("second block"));
		final TranslationSettings throttled = settings(1000, 1).withThrottleMillis(50);

		final long startedAt = System.nanoTime();
		final JobSummary summary = run(document, throttled);
		final long elapsedMillis = (System.nanoTime() - startedAt) / 1_000_000;

		assertEquals(JobState.COMPLETED, summary.state());
		assertTrue(elapsedMillis >= 50, "elapsed " + elapsedMillis + " ms");
	}

	private JobSummary run(InMemoryDocument document, TranslationSettings settings) {
		return job(document, settings).start().toCompletableFuture().join();
	}

	private PageTranslationJob job(InMemoryDocument document, TranslationSettings settings) {
		return new PageTranslationJob(document, provider, "de", "auto", settings, listener, log);
	}

	private static TranslationSettings settings(int maxChars, int maxItems) {
		return TranslationSettings.defaults()
			.withBatchLimits(maxChars, maxItems)
			.withThrottleMillis(0);
	}

	private static class TestLog implements Log {
		private final List<String> warnings = new ArrayList<>();
		private final List<String> errors = new ArrayList<>();

		@Override public boolean isDebugEnabled() { return true; }
		@Override public void debug(CharSequence content) {}
		@Override public void debug(CharSequence content, Throwable error) {}
		@Override public void debug(Throwable error) {}
		@Override public boolean isInfoEnabled() { return true; }
		@Override public void info(CharSequence content) {}
		@Override public void info(CharSequence content, Throwable error) {}
		@Override public void info(Throwable error) {}
		@Override public boolean isWarnEnabled() { return true; }
		@Override public synchronized void warn(CharSequence content) { warnings.add(content.toString()); }
		@Override public synchronized void warn(CharSequence content, Throwable error) { warnings.add(content.toString()); }
		@Override public void warn(Throwable error) {}
		@Override public boolean isErrorEnabled() { return true; }
		@Override public synchronized void error(CharSequence content) { errors.add(content.toString()); }
		@Override public synchronized void error(CharSequence content, Throwable error) { errors.add(content.toString()); }
		@Override public void error(Throwable error) {}
	}
}
