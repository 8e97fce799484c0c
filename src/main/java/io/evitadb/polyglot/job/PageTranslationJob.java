package io.evitadb.polyglot.job;

import io.evitadb.polyglot.batch.BatchBuilder;
import io.evitadb.polyglot.codec.ProtocolCodec;
import io.evitadb.polyglot.document.DocumentAdapter;
import io.evitadb.polyglot.model.Batch;
import io.evitadb.polyglot.model.BatchOutcome;
import io.evitadb.polyglot.model.BatchState;
import io.evitadb.polyglot.model.Fragment;
import io.evitadb.polyglot.model.FragmentGroup;
import io.evitadb.polyglot.model.JobState;
import io.evitadb.polyglot.model.JobSummary;
import io.evitadb.polyglot.model.TranslationSettings;
import io.evitadb.polyglot.provider.TranslationProvider;
import io.evitadb.polyglot.provider.TranslationProviderException;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Translates one document: scans it through the {@link DocumentAdapter}, packs the fragment groups into batches and
 * sends them to the {@link TranslationProvider} one after another, applying each batch's results as soon as they
 * arrive.
 *
 * Lifecycle: `IDLE -> SCANNING -> RUNNING -> COMPLETED | COMPLETED_WITH_ERRORS | CANCELLED`. A scan that yields
 * nothing ends in `FAILED` and the returned stage completes with {@link NothingToTranslateException}.
 *
 * Failures of single batches never abort the job. They are collected and reported in the {@link JobSummary}; the
 * fragments of a failed batch keep their original text. Cancellation reverts the document immediately and results
 * arriving afterwards are dropped.
 *
 * A job instance runs once.
 */
public final class PageTranslationJob {

	@Nonnull
	private final DocumentAdapter adapter;
	@Nonnull
	private final TranslationProvider provider;
	@Nonnull
	private final String targetLanguage;
	@Nonnull
	private final String sourceLanguage;
	@Nonnull
	private final TranslationSettings settings;
	@Nonnull
	private final ProgressListener listener;
	@Nonnull
	private final Log log;

	private final CancellationToken cancellationToken = new CancellationToken();
	private final Object applyLock = new Object();
	private final AtomicReference<JobState> state = new AtomicReference<>(JobState.IDLE);
	private final AtomicInteger translatedGroups = new AtomicInteger();
	private final AtomicInteger emptyTranslations = new AtomicInteger();
	private final List<String> errors = new CopyOnWriteArrayList<>();
	private final Map<Integer, BatchOutcome> outcomes = new ConcurrentHashMap<>();
	private final Map<Integer, BatchState> batchStates = new ConcurrentHashMap<>();
	private final Map<Integer, Integer> groupNumbers = new HashMap<>();
	private final CompletableFuture<JobSummary> result = new CompletableFuture<>();
	private volatile List<Batch> batches = List.of();

	/**
	 * Creates a job.
	 *
	 * @param adapter        document to translate
	 * @param provider       backend to translate with
	 * @param targetLanguage target language code
	 * @param sourceLanguage source language code, or "auto"
	 * @param settings       batch limits and throttle
	 * @param listener       progress sink
	 * @param log            log for diagnostics and the final error report
	 */
	public PageTranslationJob(
		@Nonnull DocumentAdapter adapter,
		@Nonnull TranslationProvider provider,
		@Nonnull String targetLanguage,
		@Nonnull String sourceLanguage,
		@Nonnull TranslationSettings settings,
		@Nonnull ProgressListener listener,
		@Nonnull Log log
	) {
		this.adapter = Objects.requireNonNull(adapter, "adapter must not be null");
		this.provider = Objects.requireNonNull(provider, "provider must not be null");
		this.targetLanguage = Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");
		this.sourceLanguage = Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
		this.listener = Objects.requireNonNull(listener, "listener must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Scans the document and starts translating. The scan runs on the calling thread; batches run asynchronously.
	 *
	 * @return stage completing with the job summary, or exceptionally when the scan fails
	 * @throws IllegalStateException if the job was already started
	 */
	@Nonnull
	public CompletionStage<JobSummary> start() {
		if (!this.state.compareAndSet(JobState.IDLE, JobState.SCANNING)) {
			throw new IllegalStateException("Job has already been started (state " + this.state.get() + ")");
		}
		this.listener.onStatus(JobState.SCANNING, "Scanning document...");

		final List<FragmentGroup> groups;
		try {
			groups = this.adapter.scan()
				.stream()
				.filter(group -> !group.isEmpty())
				.collect(Collectors.toList());
		} catch (RuntimeException e) {
			return fail(e);
		}
		if (groups.isEmpty()) {
			return fail(new NothingToTranslateException("No translatable text found"));
		}

		for (final FragmentGroup group : groups) {
			this.groupNumbers.put(group.groupId(), this.groupNumbers.size() + 1);
		}
		this.batches = BatchBuilder.build(groups, this.settings.batchMaxChars(), this.settings.batchMaxItems());
		for (final Batch batch : this.batches) {
			this.batchStates.put(batch.index(), BatchState.PENDING);
		}
		this.state.set(JobState.RUNNING);
		this.listener.onStatus(JobState.RUNNING, "Found " + groups.size() + " blocks");

		CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
		for (final Batch batch : this.batches) {
			final boolean last = batch.index() == this.batches.size() - 1;
			chain = chain
				.thenCompose(ignored -> processBatch(batch))
				.thenCompose(ignored -> throttle(last));
		}
		chain.whenComplete((ignored, failure) -> finish(failure));
		return this.result;
	}

	/**
	 * Cancels the job and restores the original text of the whole document right away. In-flight work is not
	 * awaited; its results are discarded when they arrive. A batch being applied at the moment of the call is
	 * finished first and then reverted with the rest of the document.
	 */
	public void cancel() {
		synchronized (this.applyLock) {
			if (this.cancellationToken.cancel()) {
				this.log.info("Translation cancelled, restoring original text");
			}
			this.adapter.revertAll();
		}
	}

	public boolean isCancelled() {
		return this.cancellationToken.isCancelled();
	}

	@Nonnull
	public JobState getState() {
		return this.state.get();
	}

	/**
	 * Returns the batches built by the scan, empty before {@link #start()}.
	 *
	 * @return batches in processing order
	 */
	@Nonnull
	public List<Batch> getBatches() {
		return this.batches;
	}

	/**
	 * Returns the current state of a batch.
	 *
	 * @param batchIndex zero-based batch index
	 * @return the batch state, or null for an unknown index
	 */
	@Nullable
	public BatchState getBatchState(int batchIndex) {
		return this.batchStates.get(batchIndex);
	}

	@Nonnull
	public CompletionStage<JobSummary> getResult() {
		return this.result;
	}

	@Nonnull
	private CompletionStage<Void> processBatch(@Nonnull Batch batch) {
		if (this.cancellationToken.isCancelled()) {
			return CompletableFuture.completedFuture(null);
		}
		this.batchStates.put(batch.index(), BatchState.IN_FLIGHT);
		for (final FragmentGroup group : batch.groups()) {
			this.listener.onGroupLoading(group.groupId());
		}
		this.listener.onStatus(
			JobState.RUNNING,
			"Translating batch " + (batch.index() + 1) + "/" + this.batches.size()
		);

		final List<String> texts = batch.texts();
		CompletionStage<String> call;
		try {
			call = this.provider.translate(ProtocolCodec.encode(texts), this.targetLanguage, this.sourceLanguage);
		} catch (RuntimeException e) {
			call = CompletableFuture.failedFuture(e);
		}

		return call.handle((reply, failure) -> {
			if (failure != null) {
				recordFailure(batch, failure);
				return null;
			}
			try {
				applyReply(batch, texts, reply);
			} catch (RuntimeException e) {
				recordFailure(batch, e);
			}
			return null;
		});
	}

	private void applyReply(@Nonnull Batch batch, @Nonnull List<String> texts, @Nullable String reply) {
		final Optional<List<String>> decoded = ProtocolCodec.decode(reply, texts);
		final boolean fallbackUsed = decoded.isEmpty();
		if (fallbackUsed) {
			this.log.warn(
				"Failed to parse structured response of batch " + (batch.index() + 1) + ", using approximate sentence split"
			);
		}
		final List<String> translations = decoded.orElseGet(
			() -> FallbackSplitter.split(reply != null ? reply : "", texts.size())
		);

		synchronized (this.applyLock) {
			applyTranslations(batch, translations, fallbackUsed);
		}
	}

	private void applyTranslations(@Nonnull Batch batch, @Nonnull List<String> translations, boolean fallbackUsed) {
		if (this.cancellationToken.isCancelled()) {
			this.batchStates.put(batch.index(), BatchState.DISCARDED);
			this.outcomes.put(batch.index(), BatchOutcome.discarded(batch.index(), groupIds(batch)));
			settleGroups(batch);
			return;
		}

		final List<Fragment> fragments = batch.fragments();
		int applied = 0;
		int empty = 0;
		for (int i = 0; i < fragments.size(); i++) {
			final Fragment fragment = fragments.get(i);
			final String translation = i < translations.size() ? translations.get(i) : null;
			if (translation == null || translation.isBlank()) {
				empty++;
			} else if (!translation.equals(fragment.originalText())) {
				this.adapter.apply(fragment.id(), translation);
				applied++;
			}
		}
		if (empty > 0) {
			this.emptyTranslations.addAndGet(empty);
			this.log.debug(
				empty + " items returned empty translation in batch " + (batch.index() + 1) + ", keeping original text"
			);
		}

		this.translatedGroups.addAndGet(batch.groups().size());
		this.batchStates.put(batch.index(), BatchState.APPLIED);
		this.outcomes.put(batch.index(), BatchOutcome.applied(batch.index(), groupIds(batch), applied, fallbackUsed));
		settleGroups(batch);
	}

	private void recordFailure(@Nonnull Batch batch, @Nonnull Throwable failure) {
		final Throwable cause = TranslationProviderException.unwrap(failure);
		final List<Integer> numbers = new ArrayList<>();
		for (final FragmentGroup group : batch.groups()) {
			numbers.add(this.groupNumbers.get(group.groupId()));
		}
		final String label = numbers.size() == 1
			? "Block " + numbers.get(0)
			: "Blocks " + numbers.stream().map(String::valueOf).collect(Collectors.joining(", "));
		final String message = label + ": " + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());

		this.errors.add(message);
		this.batchStates.put(batch.index(), BatchState.FAILED);
		this.outcomes.put(batch.index(), BatchOutcome.failed(batch.index(), groupIds(batch), message));
		settleGroups(batch);
	}

	@Nonnull
	private CompletionStage<Void> throttle(boolean lastBatch) {
		if (lastBatch || this.cancellationToken.isCancelled() || this.settings.throttleMillis() == 0) {
			return CompletableFuture.completedFuture(null);
		}
		return CompletableFuture.runAsync(
			() -> {
			},
			CompletableFuture.delayedExecutor(this.settings.throttleMillis(), TimeUnit.MILLISECONDS)
		);
	}

	private void finish(@Nullable Throwable unexpected) {
		if (unexpected != null) {
			this.log.error("Translation job stopped unexpectedly", unexpected);
			this.errors.add("Job: " + TranslationProviderException.unwrap(unexpected).getMessage());
		}
		final List<BatchOutcome> batchOutcomes = new ArrayList<>(this.batches.size());
		for (final Batch batch : this.batches) {
			final BatchOutcome outcome = this.outcomes.computeIfAbsent(
				batch.index(), index -> BatchOutcome.discarded(index, groupIds(batch))
			);
			this.batchStates.put(batch.index(), outcome.state());
			batchOutcomes.add(outcome);
		}

		final JobState terminal;
		final String message;
		if (this.cancellationToken.isCancelled()) {
			terminal = JobState.CANCELLED;
			message = "Translation cancelled";
		} else if (!this.errors.isEmpty()) {
			terminal = JobState.COMPLETED_WITH_ERRORS;
			message = "Translation completed with errors (" + this.batches.size() + " batches, " +
				this.errors.size() + " errors)";
		} else {
			terminal = JobState.COMPLETED;
			message = "Translation completed (" + this.batches.size() + " batches)";
		}
		this.state.set(terminal);

		final JobSummary summary = new JobSummary(
			terminal,
			this.batches.size(),
			this.translatedGroups.get(),
			this.errors.size(),
			this.errors,
			this.emptyTranslations.get(),
			batchOutcomes
		);
		this.listener.onStatus(terminal, message);
		if (terminal == JobState.COMPLETED_WITH_ERRORS) {
			for (final String error : this.errors) {
				this.log.error("Block error: " + error);
			}
		}
		this.result.complete(summary);
	}

	@Nonnull
	private CompletionStage<JobSummary> fail(@Nonnull RuntimeException e) {
		this.state.set(JobState.FAILED);
		this.listener.onStatus(JobState.FAILED, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
		this.result.completeExceptionally(e);
		return this.result;
	}

	private void settleGroups(@Nonnull Batch batch) {
		for (final FragmentGroup group : batch.groups()) {
			this.listener.onGroupSettled(group.groupId());
		}
	}

	@Nonnull
	private static List<Integer> groupIds(@Nonnull Batch batch) {
		final List<Integer> ids = new ArrayList<>(batch.groups().size());
		for (final FragmentGroup group : batch.groups()) {
			ids.add(group.groupId());
		}
		return ids;
	}
}
