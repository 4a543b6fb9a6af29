package my.charbuilder.app.service;

import jakarta.annotation.PreDestroy;
import my.charbuilder.app.config.AppProperties;
import my.charbuilder.app.content.ContentPackage;
import my.charbuilder.app.content.DocumentCatalog;
import my.charbuilder.app.content.DocumentCollection;
import my.charbuilder.app.content.DocumentProvider;
import my.charbuilder.app.content.DocumentSubtype;
import my.charbuilder.app.content.PackageIndexEntry;
import my.charbuilder.app.content.SourceDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.text.Collator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Process-wide cache of the documents characters may reference, one name-sorted collection per subtype.
 * <p>
 * Each subtype is loaded at most once per empty cache: the first caller installs a future, later and
 * concurrent callers share it. A failed subtype load is evicted so the next caller retries.
 */
@Service
public class ForeignDocumentCatalogService {
	private static final Logger logger = LoggerFactory.getLogger(ForeignDocumentCatalogService.class);

	private final DocumentProvider documentProvider;
	private final Locale sortLocale;
	private final Map<DocumentSubtype, CompletableFuture<DocumentCollection>> collections = new ConcurrentHashMap<>();
	private final ExecutorService executor;

	public ForeignDocumentCatalogService(DocumentProvider documentProvider, AppProperties properties) {
		this.documentProvider = documentProvider;
		this.sortLocale = Locale.forLanguageTag(properties.derivation().sortLocale());
		this.executor = Executors.newFixedThreadPool(properties.catalog().loadThreads());
	}

	/**
	 * Completes with every tracked subtype loaded, starting the loads that are not cached or in flight.
	 */
	public CompletableFuture<DocumentCatalog> ensureLoaded() {
		Map<DocumentSubtype, CompletableFuture<DocumentCollection>> pending = new EnumMap<>(DocumentSubtype.class);
		for (DocumentSubtype subtype : DocumentSubtype.values()) {
			pending.put(subtype, collectionFuture(subtype));
		}
		return CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0]))
				.thenApply(ignored -> {
					Map<DocumentSubtype, DocumentCollection> loaded = new EnumMap<>(DocumentSubtype.class);
					pending.forEach((subtype, future) -> loaded.put(subtype, future.join()));
					return new DocumentCatalog(loaded);
				});
	}

	/**
	 * The cached collection of a subtype, empty while it is not loaded yet.
	 */
	public Optional<DocumentCollection> collection(DocumentSubtype subtype) {
		CompletableFuture<DocumentCollection> future = collections.get(subtype);
		if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
			return Optional.empty();
		}
		return Optional.of(future.join());
	}

	public boolean isWarm() {
		for (DocumentSubtype subtype : DocumentSubtype.values()) {
			if (collection(subtype).isEmpty()) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Drops the cache; the next {@link #ensureLoaded()} reloads everything. Loads already in flight still
	 * complete for their current callers.
	 */
	public void invalidate() {
		collections.clear();
		logger.info("Foreign document catalog invalidated.");
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}

	private CompletableFuture<DocumentCollection> collectionFuture(DocumentSubtype subtype) {
		CompletableFuture<DocumentCollection> existing = collections.get(subtype);
		if (existing != null) {
			return existing;
		}
		CompletableFuture<DocumentCollection> future = new CompletableFuture<>();
		existing = collections.putIfAbsent(subtype, future);
		if (existing != null) {
			return existing;
		}
		try {
			executor.execute(() -> runLoad(subtype, future));
		} catch (RejectedExecutionException ex) {
			fail(subtype, future, ex);
		}
		return future;
	}

	private void runLoad(DocumentSubtype subtype, CompletableFuture<DocumentCollection> future) {
		try {
			future.complete(loadCollection(subtype));
		} catch (RuntimeException ex) {
			fail(subtype, future, ex);
		}
	}

	private void fail(DocumentSubtype subtype, CompletableFuture<DocumentCollection> future, RuntimeException ex) {
		logger.error("Failed to load {} documents: {}", subtype.key(), ex.getMessage(), ex);
		collections.remove(subtype, future);
		future.completeExceptionally(ex);
	}

	DocumentCollection loadCollection(DocumentSubtype subtype) {
		List<SourceDocument> found = new ArrayList<>();
		for (SourceDocument document : documentProvider.getLocalCollection(DocumentProvider.ITEM_TYPE)) {
			if (subtype.matches(document.type())) {
				found.add(document);
			}
		}
		int fetched = 0;
		int skipped = 0;
		int skippedPackages = 0;
		for (ContentPackage contentPackage : documentProvider.listPackages()) {
			List<PackageIndexEntry> entries;
			try {
				if (!DocumentProvider.ITEM_TYPE.equals(contentPackage.documentType())) {
					continue;
				}
				entries = contentPackage.indexEntries(subtype);
			} catch (RuntimeException ex) {
				skippedPackages++;
				logger.warn("Skipping package {} for {} documents: {}",
						contentPackage.id(), subtype.key(), ex.getMessage());
				continue;
			}
			for (PackageIndexEntry entry : entries) {
				try {
					Optional<SourceDocument> document = contentPackage.fetchById(entry.id());
					if (document.isPresent()) {
						found.add(document.get());
						fetched++;
					}
				} catch (RuntimeException ex) {
					skipped++;
					logger.warn("Skipping {} document {} from package {}: {}",
							subtype.key(), entry.id(), contentPackage.id(), ex.getMessage());
				}
			}
		}

		Map<String, SourceDocument> unique = new LinkedHashMap<>();
		for (SourceDocument document : found) {
			if (document.id() != null) {
				unique.putIfAbsent(document.id(), document);
			}
		}
		Collator collator = Collator.getInstance(sortLocale);
		List<SourceDocument> sorted = new ArrayList<>(unique.values());
		sorted.sort(Comparator.comparing((SourceDocument d) -> d.name() == null ? "" : d.name(), collator));

		logger.info("Loaded {} {} document(s) ({} fetched from packages, {} skipped, {} package(s) skipped).",
				sorted.size(), subtype.key(), fetched, skipped, skippedPackages);
		return new DocumentCollection(sorted);
	}
}
