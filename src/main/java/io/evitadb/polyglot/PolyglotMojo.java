package io.evitadb.polyglot;

import io.evitadb.polyglot.batch.BatchBuilder;
import io.evitadb.polyglot.document.MarkdownDocument;
import io.evitadb.polyglot.document.MarkdownDocumentAdapter;
import io.evitadb.polyglot.job.LoggingProgressListener;
import io.evitadb.polyglot.job.NothingToTranslateException;
import io.evitadb.polyglot.job.TranslationRequest;
import io.evitadb.polyglot.job.TranslationService;
import io.evitadb.polyglot.model.Batch;
import io.evitadb.polyglot.model.FragmentGroup;
import io.evitadb.polyglot.model.JobState;
import io.evitadb.polyglot.model.JobSummary;
import io.evitadb.polyglot.model.TranslationSettings;
import io.evitadb.polyglot.provider.ChatModelProvider;
import io.evitadb.polyglot.provider.ModelCatalog;
import io.evitadb.polyglot.provider.ProviderKind;
import io.evitadb.polyglot.provider.ProviderRegistry;
import io.evitadb.polyglot.provider.ProviderSettings;
import io.evitadb.polyglot.provider.TranslationProvider;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Main Mojo of the Polyglot plugin providing actions:
 * - show-config: prints the current configuration
 * - translate: translates every matching Markdown file into each target directory
 * - translate-text: translates the configured text and prints the result
 * - list-models: prints the models offered by the configured provider
 */
@Mojo(name = "run", defaultPhase = LifecyclePhase.NONE, threadSafe = true)
public class PolyglotMojo extends AbstractMojo {

	/** Which action to perform: "show-config", "translate", "translate-text" or "list-models". */
	@Parameter(property = "polyglot.action", defaultValue = "show-config")
	private String action;

	/** Translation provider: openai, openai-compatible, anthropic, anthropic-compatible, gemini or ollama. */
	@Parameter(property = "polyglot.provider", defaultValue = TranslationSettings.DEFAULT_PROVIDER)
	private String provider = TranslationSettings.DEFAULT_PROVIDER;

	/** Provider endpoint; the provider's public endpoint when not set. */
	@Parameter(property = "polyglot.providerUrl")
	private String providerUrl;

	/** Provider API key. */
	@Parameter(property = "polyglot.providerToken")
	private String providerToken;

	/** Model name. */
	@Parameter(property = "polyglot.providerModel")
	private String providerModel;

	/** Sampling temperature (default 0.3). */
	@Parameter(property = "polyglot.providerTemperature")
	private Double providerTemperature;

	/** Output token cap per backend call (default 2000). */
	@Parameter(property = "polyglot.providerMaxTokens")
	private Integer providerMaxTokens;

	/** Source language code, "auto" lets the backend detect it. */
	@Parameter(property = "polyglot.sourceLanguage", defaultValue = TranslationSettings.AUTO_LANGUAGE)
	private String sourceLanguage = TranslationSettings.AUTO_LANGUAGE;

	/** Target language for translate-text. */
	@Parameter(property = "polyglot.targetLanguage", defaultValue = TranslationSettings.DEFAULT_TARGET_LANGUAGE)
	private String targetLanguage = TranslationSettings.DEFAULT_TARGET_LANGUAGE;

	/** Source directory path (no default). */
	@Parameter(property = "polyglot.sourceDir")
	private String sourceDir;

	/** Regex to match all files to translate - default (?i).*\.md (ignore case). */
	@Parameter(property = "polyglot.fileRegex", defaultValue = "(?i).*\\.md")
	private String fileRegex = "(?i).*\\.md";

	/** Target languages with their output directories. */
	@Parameter(property = "polyglot.targets")
	private List<Target> targets;

	/** Maximum number of files to be translated per target. */
	@Parameter(property = "polyglot.limit", defaultValue = "2147483647")
	private int limit = Integer.MAX_VALUE;

	/** When true, nothing is sent to the provider and nothing is written; the batch plan is reported instead. */
	@Parameter(property = "polyglot.dryRun", defaultValue = "true")
	private boolean dryRun = true;

	/** Soft ceiling on characters per backend call. */
	@Parameter(property = "polyglot.batchMaxChars", defaultValue = "64000")
	private int batchMaxChars = TranslationSettings.DEFAULT_BATCH_MAX_CHARS;

	/** Soft ceiling on text fragments per backend call. */
	@Parameter(property = "polyglot.batchMaxItems", defaultValue = "20")
	private int batchMaxItems = TranslationSettings.DEFAULT_BATCH_MAX_ITEMS;

	/** Pause between two backend calls of one document, in milliseconds. */
	@Parameter(property = "polyglot.throttleMillis", defaultValue = "100")
	private long throttleMillis = TranslationSettings.DEFAULT_THROTTLE_MILLIS;

	/** Maximum length of one piece when translate-text splits a long text. */
	@Parameter(property = "polyglot.selectionChunkMaxLength", defaultValue = "2000")
	private int selectionChunkMaxLength = TranslationSettings.DEFAULT_SELECTION_CHUNK_MAX_LENGTH;

	/** Text to translate with translate-text. */
	@Parameter(property = "polyglot.text")
	private String text;

	@Override
	public void execute() throws MojoExecutionException {
		if (this.action == null || this.action.isBlank()) {
			this.action = "show-config";
		}
		switch (this.action) {
			case "show-config" -> showConfig(getLog());
			case "translate" -> translate(getLog());
			case "translate-text" -> translateText(getLog());
			case "list-models" -> listModels(getLog());
			default -> throw new MojoExecutionException(
				"Unknown action: " + this.action + ". Supported actions: show-config, translate, translate-text, list-models"
			);
		}
	}

	private void showConfig(@Nonnull final Log log) {
		log.info("Polyglot Plugin Configuration:");
		log.info(" - provider: " + this.provider);
		ProviderKind kind = null;
		try {
			kind = ProviderKind.fromName(this.provider);
		} catch (IllegalArgumentException e) {
			log.warn(e.getMessage());
		}
		log.info(" - providerUrl: " + (isBlank(this.providerUrl)
			? "<default" + (kind != null && kind.getDefaultBaseUrl() != null ? ": " + kind.getDefaultBaseUrl() : "") + ">"
			: this.providerUrl));
		if (kind != null && isBlank(this.providerUrl) && kind.getDefaultBaseUrl() == null) {
			log.warn("Provider URL is not set but " + kind.getConfigName() + " requires one");
		}
		log.info(" - providerToken: " + (isBlank(this.providerToken) ? "<not set>" : mask(this.providerToken)));
		if (kind != null && kind.isApiKeyRequired() && isBlank(this.providerToken)) {
			log.warn("Provider token is not set");
		}
		log.info(" - providerModel: " + (isBlank(this.providerModel) ? "<not set>" : this.providerModel));
		if (isBlank(this.providerModel)) {
			log.warn("Provider model is not set");
		}
		log.info(" - providerTemperature: " + (this.providerTemperature == null
			? ProviderSettings.DEFAULT_TEMPERATURE : this.providerTemperature));
		log.info(" - providerMaxTokens: " + (this.providerMaxTokens == null
			? ProviderSettings.DEFAULT_MAX_TOKENS : this.providerMaxTokens));
		log.info(" - sourceLanguage: " + this.sourceLanguage);
		log.info(" - targetLanguage: " + this.targetLanguage);
		log.info(" - sourceDir: " + (isBlank(this.sourceDir) ? "<not set>" : this.sourceDir));
		log.info(" - fileRegex: " + this.fileRegex);
		if (this.targets == null || this.targets.isEmpty()) {
			log.info(" - targets: <none>");
		} else {
			log.info(" - targets:");
			for (final Target t : this.targets) {
				final String locale = t == null ? null : t.getLocale();
				final String tDir = t == null ? null : t.getTargetDir();
				log.info("   - locale: " + (isBlank(locale) ? "<not set>" : locale) +
					", targetDir: " + (isBlank(tDir) ? "<not set>" : tDir));
				if (isBlank(locale) || isBlank(tDir)) {
					log.warn("Target configuration is incomplete");
				}
			}
		}
		log.info(" - limit: " + this.limit);
		log.info(" - dryRun: " + this.dryRun);
		log.info(" - batchMaxChars: " + this.batchMaxChars);
		log.info(" - batchMaxItems: " + this.batchMaxItems);
		log.info(" - throttleMillis: " + this.throttleMillis);
		log.info(" - selectionChunkMaxLength: " + this.selectionChunkMaxLength);
	}

	private void translate(@Nonnull final Log log) throws MojoExecutionException {
		if (isBlank(this.sourceDir)) {
			throw new MojoExecutionException("Source directory must be specified for translate action");
		}
		if (this.targets == null || this.targets.isEmpty()) {
			throw new MojoExecutionException("At least one target must be specified for translate action");
		}
		final Path root = Path.of(this.sourceDir).toAbsolutePath().normalize();
		if (!Files.isDirectory(root)) {
			throw new MojoExecutionException("Source directory does not exist or is not a directory: " + root);
		}
		final Pattern pattern = Pattern.compile(this.fileRegex);
		final TranslationSettings settings = createSettings();

		final ExecutorService executor = Executors.newSingleThreadExecutor();
		try {
			final ProviderRegistry registry = createRegistry(log, executor);
			final TranslationService service = new TranslationService(registry, settings, log);
			final Writer writer = new Writer();

			for (final Target target : this.targets) {
				if (target == null || isBlank(target.getLocale()) || isBlank(target.getTargetDir())) {
					log.warn("Skipping incomplete target configuration");
					continue;
				}
				final Path targetDir = Path.of(target.getTargetDir()).toAbsolutePath().normalize();
				log.info("=== Processing target: " + target.getLocale() + " -> " + targetDir + " ===");

				final TargetStatistics statistics = new TargetStatistics();
				final TranslationRequest request = new TranslationRequest(target.getLocale(), this.sourceLanguage, this.provider);
				final Visitor visitor = (file, content) -> {
					final Path relativePath = root.relativize(file.toAbsolutePath().normalize());
					final MarkdownDocumentAdapter adapter = new MarkdownDocumentAdapter(new MarkdownDocument(content));
					if (this.dryRun) {
						reportPlan(log, relativePath, adapter, settings, statistics);
					} else {
						translateFile(log, service, request, relativePath, adapter, targetDir.resolve(relativePath), writer, statistics);
					}
				};
				new Traverser(root, pattern, this.limit, visitor).traverse();
				statistics.report(log, this.dryRun);
			}

			if (!this.dryRun) {
				final TranslationProvider translationProvider = registry.get(this.provider);
				if (translationProvider instanceof ChatModelProvider chatModelProvider) {
					log.info("Input tokens: " + chatModelProvider.getInputTokens());
					log.info("Output tokens: " + chatModelProvider.getOutputTokens());
				}
			}
		} catch (IOException e) {
			throw new MojoExecutionException("Failed to execute translate action: " + e.getMessage(), e);
		} catch (RuntimeException e) {
			throw new MojoExecutionException("Translation failed: " + e.getMessage(), e);
		} finally {
			executor.shutdown();
		}
	}

	private static void reportPlan(
		@Nonnull final Log log,
		@Nonnull final Path relativePath,
		@Nonnull final MarkdownDocumentAdapter adapter,
		@Nonnull final TranslationSettings settings,
		@Nonnull final TargetStatistics statistics
	) {
		final List<FragmentGroup> groups = adapter.scan();
		if (groups.isEmpty()) {
			log.info("[SKIP] " + relativePath + " (nothing to translate)");
			statistics.skipped.incrementAndGet();
			return;
		}
		final List<Batch> batches = BatchBuilder.build(groups, settings.batchMaxChars(), settings.batchMaxItems());
		final int fragments = batches.stream().mapToInt(Batch::size).sum();
		log.info("[PLAN] " + relativePath + ": " + groups.size() + " blocks, " + fragments + " fragments, " +
			batches.size() + " batches");
		statistics.files.incrementAndGet();
		statistics.batches.addAndGet(batches.size());
	}

	private static void translateFile(
		@Nonnull final Log log,
		@Nonnull final TranslationService service,
		@Nonnull final TranslationRequest request,
		@Nonnull final Path relativePath,
		@Nonnull final MarkdownDocumentAdapter adapter,
		@Nonnull final Path targetFile,
		@Nonnull final Writer writer,
		@Nonnull final TargetStatistics statistics
	) {
		try {
			final JobSummary summary = service.translatePage(
				adapter, request, new LoggingProgressListener(log, relativePath.toString())
			).toCompletableFuture().join();
			statistics.batches.addAndGet(summary.batchCount());
			statistics.batchErrors.addAndGet(summary.errorCount());
			if (summary.state() == JobState.CANCELLED) {
				statistics.failed.incrementAndGet();
				return;
			}
			writer.write(adapter.render(), targetFile);
			statistics.files.incrementAndGet();
		} catch (CompletionException e) {
			if (e.getCause() instanceof NothingToTranslateException) {
				log.info("[SKIP] " + relativePath + " (nothing to translate)");
				statistics.skipped.incrementAndGet();
			} else {
				log.error("Error translating " + relativePath + ": " + e.getMessage(), e);
				statistics.failed.incrementAndGet();
			}
		} catch (IOException e) {
			log.error("Error writing " + targetFile + ": " + e.getMessage(), e);
			statistics.failed.incrementAndGet();
		}
	}

	private void translateText(@Nonnull final Log log) throws MojoExecutionException {
		if (this.text == null || this.text.isEmpty()) {
			throw new MojoExecutionException("Text must be specified for translate-text action");
		}
		final ExecutorService executor = Executors.newSingleThreadExecutor();
		try {
			final TranslationService service = new TranslationService(createRegistry(log, executor), createSettings(), log);
			final String translated = service.translateSelection(
				this.text, new TranslationRequest(this.targetLanguage, this.sourceLanguage, this.provider)
			).toCompletableFuture().join();
			log.info("Translation (" + this.targetLanguage + "):");
			for (final String line : translated.split("\n", -1)) {
				log.info(line);
			}
		} catch (CompletionException e) {
			final Throwable cause = e.getCause() != null ? e.getCause() : e;
			throw new MojoExecutionException("Translation failed: " + cause.getMessage(), cause);
		} catch (RuntimeException e) {
			throw new MojoExecutionException("Translation failed: " + e.getMessage(), e);
		} finally {
			executor.shutdown();
		}
	}

	private void listModels(@Nonnull final Log log) throws MojoExecutionException {
		try {
			final List<String> models = createRegistry(log, Runnable::run).get(this.provider).getModels();
			if (models.isEmpty()) {
				log.warn("No models reported by " + this.provider);
				return;
			}
			log.info("Models offered by " + this.provider + ":");
			for (final String model : models) {
				log.info(" - " + model);
			}
		} catch (RuntimeException e) {
			throw new MojoExecutionException("Cannot list models: " + e.getMessage(), e);
		}
	}

	@Nonnull
	private TranslationSettings createSettings() {
		return new TranslationSettings(
			this.batchMaxChars,
			this.batchMaxItems,
			this.provider,
			this.sourceLanguage,
			this.targetLanguage,
			this.throttleMillis,
			this.selectionChunkMaxLength
		);
	}

	@Nonnull
	private ProviderRegistry createRegistry(@Nonnull final Log log, @Nonnull final Executor executor) {
		final ProviderKind kind = ProviderKind.fromName(this.provider);
		final ProviderSettings settings = new ProviderSettings(
			true,
			this.providerToken,
			this.providerUrl,
			this.providerModel,
			this.providerTemperature,
			this.providerMaxTokens
		);
		return new ProviderRegistry(Map.of(kind, settings), executor, new ModelCatalog(log));
	}

	private static boolean isBlank(@Nullable final String value) {
		return value == null || value.isBlank();
	}

	@Nonnull
	private static String mask(@Nullable final String value) {
		if (value == null || value.length() <= 4) {
			return "****";
		}
		return "****" + value.substring(value.length() - 4);
	}

	// Setters to aid testing without Maven parameter injection
	void setAction(@Nullable final String action) { this.action = action; }
	void setProvider(@Nonnull final String provider) { this.provider = provider; }
	void setProviderUrl(@Nullable final String providerUrl) { this.providerUrl = providerUrl; }
	void setProviderToken(@Nullable final String providerToken) { this.providerToken = providerToken; }
	void setProviderModel(@Nullable final String providerModel) { this.providerModel = providerModel; }
	void setSourceLanguage(@Nonnull final String sourceLanguage) { this.sourceLanguage = sourceLanguage; }
	void setTargetLanguage(@Nonnull final String targetLanguage) { this.targetLanguage = targetLanguage; }
	void setSourceDir(@Nullable final String sourceDir) { this.sourceDir = sourceDir; }
	void setFileRegex(@Nonnull final String fileRegex) { this.fileRegex = fileRegex; }
	void setTargets(@Nullable final List<Target> targets) { this.targets = targets; }
	void setLimit(final int limit) { this.limit = limit; }
	void setDryRun(final boolean dryRun) { this.dryRun = dryRun; }
	void setBatchMaxChars(final int batchMaxChars) { this.batchMaxChars = batchMaxChars; }
	void setBatchMaxItems(final int batchMaxItems) { this.batchMaxItems = batchMaxItems; }
	void setText(@Nullable final String text) { this.text = text; }

	/** Counters of one target run. */
	private static final class TargetStatistics {
		private final AtomicInteger files = new AtomicInteger();
		private final AtomicInteger skipped = new AtomicInteger();
		private final AtomicInteger failed = new AtomicInteger();
		private final AtomicInteger batches = new AtomicInteger();
		private final AtomicInteger batchErrors = new AtomicInteger();

		void report(@Nonnull final Log log, final boolean dryRun) {
			log.info(dryRun ? "--- Dry-run Summary ---" : "--- Translation Summary ---");
			log.info((dryRun ? "Files to translate: " : "Translated files: ") + this.files.get());
			log.info("Skipped (nothing to translate): " + this.skipped.get());
			log.info("Batches: " + this.batches.get());
			if (!dryRun) {
				log.info("Failed files: " + this.failed.get());
				if (this.batchErrors.get() > 0) {
					log.warn("Failed batches: " + this.batchErrors.get() + " (their text was kept untranslated)");
				}
			}
		}
	}

	/** Target language configuration. */
	public static class Target {
		@Parameter
		private String locale;
		@Parameter
		private String targetDir;

		public Target() {}

		public Target(@Nullable final String locale, @Nullable final String targetDir) {
			this.locale = locale;
			this.targetDir = targetDir;
		}

		@Nullable
		public String getLocale() { return this.locale; }

		@Nullable
		public String getTargetDir() { return this.targetDir; }

		public void setLocale(@Nullable final String locale) { this.locale = locale; }

		public void setTargetDir(@Nullable final String targetDir) { this.targetDir = targetDir; }
	}
}
