package io.evitadb.polyglot.job;

import io.evitadb.polyglot.codec.ProtocolCodec;
import io.evitadb.polyglot.document.DocumentAdapter;
import io.evitadb.polyglot.model.JobSummary;
import io.evitadb.polyglot.model.TranslationSettings;
import io.evitadb.polyglot.provider.ProviderRegistry;
import io.evitadb.polyglot.provider.TranslationProvider;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point of the translation engine. Resolves request defaults and providers, and keeps the single-flight rules:
 * at most one page translation and at most one selection translation at a time. The two kinds may run side by side.
 */
public final class TranslationService {

	@Nonnull
	private final ProviderRegistry providers;
	@Nonnull
	private final TranslationSettings settings;
	@Nonnull
	private final Log log;
	private final AtomicReference<PageTranslationJob> activePageJob = new AtomicReference<>();
	private final AtomicBoolean selectionInProgress = new AtomicBoolean(false);

	public TranslationService(@Nonnull ProviderRegistry providers, @Nonnull TranslationSettings settings, @Nonnull Log log) {
		this.providers = Objects.requireNonNull(providers, "providers must not be null");
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Starts translating a document.
	 *
	 * @param adapter  document to translate
	 * @param request  languages and provider
	 * @param listener progress sink
	 * @return stage completing with the job summary, or exceptionally when the scan finds nothing to translate
	 * @throws TranslationInProgressException if another page translation is running
	 * @throws IllegalArgumentException       if the provider name is unknown
	 */
	@Nonnull
	public CompletionStage<JobSummary> translatePage(
		@Nonnull DocumentAdapter adapter,
		@Nonnull TranslationRequest request,
		@Nonnull ProgressListener listener
	) {
		Objects.requireNonNull(adapter, "adapter must not be null");
		Objects.requireNonNull(request, "request must not be null");
		Objects.requireNonNull(listener, "listener must not be null");

		final TranslationProvider provider = this.providers.get(request.resolveProviderName(this.settings));
		final PageTranslationJob job = new PageTranslationJob(
			adapter,
			provider,
			request.resolveTargetLanguage(this.settings),
			request.resolveSourceLanguage(this.settings),
			this.settings,
			listener,
			this.log
		);
		if (!this.activePageJob.compareAndSet(null, job)) {
			throw new TranslationInProgressException("A page translation is already in progress");
		}

		final CompletionStage<JobSummary> stage;
		try {
			stage = job.start();
		} catch (RuntimeException e) {
			this.activePageJob.compareAndSet(job, null);
			throw e;
		}
		return stage.whenComplete((summary, failure) -> this.activePageJob.compareAndSet(job, null));
	}

	/**
	 * Cancels the running page translation, reverting its document.
	 *
	 * @return true if a page translation was running
	 */
	public boolean cancelPageTranslation() {
		final PageTranslationJob job = this.activePageJob.get();
		if (job == null) {
			return false;
		}
		job.cancel();
		return true;
	}

	public boolean isPageTranslationInProgress() {
		return this.activePageJob.get() != null;
	}

	/**
	 * Translates a standalone text without touching any document. Long texts are split into pieces that are
	 * translated one after another and concatenated in order.
	 *
	 * @param text    text to translate
	 * @param request languages and provider
	 * @return stage completing with the translated text
	 * @throws TranslationInProgressException if another selection translation is running
	 * @throws IllegalArgumentException       if the provider name is unknown
	 */
	@Nonnull
	public CompletionStage<String> translateSelection(@Nonnull String text, @Nonnull TranslationRequest request) {
		Objects.requireNonNull(text, "text must not be null");
		Objects.requireNonNull(request, "request must not be null");

		if (!this.selectionInProgress.compareAndSet(false, true)) {
			throw new TranslationInProgressException("A selection translation is already in progress");
		}
		try {
			final TranslationProvider provider = this.providers.get(request.resolveProviderName(this.settings));
			final String targetLanguage = request.resolveTargetLanguage(this.settings);
			final String sourceLanguage = request.resolveSourceLanguage(this.settings);
			final String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
			final List<String> pieces = SelectionSplitter.split(normalized, this.settings.selectionChunkMaxLength());
			if (pieces.size() > 1) {
				this.log.debug("Selection split into " + pieces.size() + " pieces");
			}

			CompletableFuture<StringBuilder> chain = CompletableFuture.completedFuture(new StringBuilder());
			for (final String piece : pieces) {
				chain = chain.thenCompose(
					translated -> translatePiece(provider, piece, targetLanguage, sourceLanguage)
						.thenApply(translated::append)
				);
			}
			return chain
				.thenApply(StringBuilder::toString)
				.whenComplete((result, failure) -> this.selectionInProgress.set(false));
		} catch (RuntimeException e) {
			this.selectionInProgress.set(false);
			throw e;
		}
	}

	public boolean isSelectionTranslationInProgress() {
		return this.selectionInProgress.get();
	}

	/**
	 * Lists the models of a provider, best effort.
	 *
	 * @param providerName provider configuration name
	 * @return model names, empty if the provider could not be asked
	 */
	@Nonnull
	public List<String> getModels(@Nonnull String providerName) {
		return this.providers.get(providerName).getModels();
	}

	/**
	 * Translates one piece of a selection. Leading and trailing whitespace is kept outside the request and restored
	 * around the result so pieces still join cleanly.
	 */
	@Nonnull
	private static CompletionStage<String> translatePiece(
		@Nonnull TranslationProvider provider,
		@Nonnull String piece,
		@Nonnull String targetLanguage,
		@Nonnull String sourceLanguage
	) {
		if (piece.isBlank()) {
			return CompletableFuture.completedFuture(piece);
		}
		final String core = piece.strip();
		final int start = piece.indexOf(core);
		final String leading = piece.substring(0, start);
		final String trailing = piece.substring(start + core.length());
		final List<String> originals = List.of(core);

		return provider.translate(ProtocolCodec.encode(originals), targetLanguage, sourceLanguage)
			.thenApply(reply -> {
				final Optional<List<String>> decoded = ProtocolCodec.decode(reply, originals);
				final String translation;
				if (decoded.isEmpty()) {
					translation = reply != null && !reply.isBlank() ? reply.strip() : core;
				} else {
					final String value = decoded.get().get(0);
					translation = value != null ? value : core;
				}
				return leading + translation + trailing;
			});
	}
}
