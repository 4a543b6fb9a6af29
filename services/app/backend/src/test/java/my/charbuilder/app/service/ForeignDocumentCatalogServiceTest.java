package my.charbuilder.app.service;

import my.charbuilder.app.content.ContentPackage;
import my.charbuilder.app.content.DocumentCatalog;
import my.charbuilder.app.content.DocumentCollection;
import my.charbuilder.app.content.DocumentProvider;
import my.charbuilder.app.content.DocumentSubtype;
import my.charbuilder.app.content.SourceDocument;
import my.charbuilder.app.support.InMemoryDocumentProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static my.charbuilder.app.support.TestFixtures.document;
import static my.charbuilder.app.support.TestFixtures.properties;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ForeignDocumentCatalogServiceTest {
	private ForeignDocumentCatalogService service;

	@AfterEach
	void tearDown() {
		if (service != null) {
			service.shutdown();
		}
	}

	@Test
	void collectionIsDedupedAndSortedByName() throws Exception {
		SourceDocument sailor = document("bg-sailor", "Sailor", "background", null);
		SourceDocument acolyte = document("bg-acolyte", "acolyte", "background", null);
		SourceDocument noble = document("bg-noble", "Noble", "background", null);
		InMemoryDocumentProvider provider = new InMemoryDocumentProvider()
				.local(sailor, document("ln-elf", "Elf", "lineage", null))
				.pack(new InMemoryDocumentProvider.Pack("core").with(noble, sailor, acolyte));
		service = new ForeignDocumentCatalogService(provider, properties());

		DocumentCatalog catalog = service.ensureLoaded().get(5, TimeUnit.SECONDS);

		DocumentCollection backgrounds = catalog.collection(DocumentSubtype.BACKGROUND);
		assertThat(backgrounds.documents())
				.extracting(SourceDocument::name)
				.containsExactly("acolyte", "Noble", "Sailor");
		assertThat(catalog.collection(DocumentSubtype.LINEAGE).documents())
				.extracting(SourceDocument::id)
				.containsExactly("ln-elf");
		assertThat(catalog.collection(DocumentSubtype.CLASS).isEmpty()).isTrue();
	}

	@Test
	void warmCacheTriggersNoFurtherFetches() throws Exception {
		InMemoryDocumentProvider.Pack pack = new InMemoryDocumentProvider.Pack("core")
				.with(document("bg-noble", "Noble", "background", null),
						document("cl-fighter", "Fighter", "class", null));
		InMemoryDocumentProvider provider = new InMemoryDocumentProvider().pack(pack);
		service = new ForeignDocumentCatalogService(provider, properties());

		DocumentCatalog first = service.ensureLoaded().get(5, TimeUnit.SECONDS);
		int fetchesAfterFirstLoad = pack.fetches();
		int listCallsAfterFirstLoad = provider.listCalls();
		DocumentCatalog second = service.ensureLoaded().get(5, TimeUnit.SECONDS);

		assertThat(fetchesAfterFirstLoad).isEqualTo(2);
		assertThat(pack.fetches()).isEqualTo(fetchesAfterFirstLoad);
		assertThat(provider.listCalls()).isEqualTo(listCallsAfterFirstLoad);
		assertThat(second.collection(DocumentSubtype.BACKGROUND).documents())
				.isEqualTo(first.collection(DocumentSubtype.BACKGROUND).documents());
		assertThat(service.isWarm()).isTrue();
	}

	@Test
	void concurrentCallersShareOneLoad() throws Exception {
		CountDownLatch release = new CountDownLatch(1);
		AtomicInteger listCalls = new AtomicInteger();
		DocumentProvider blockingProvider = new DocumentProvider() {
			@Override
			public List<SourceDocument> getLocalCollection(String documentType) {
				try {
					release.await(5, TimeUnit.SECONDS);
				} catch (InterruptedException ex) {
					Thread.currentThread().interrupt();
				}
				return List.of(document("bg-noble", "Noble", "background", null));
			}

			@Override
			public List<ContentPackage> listPackages() {
				listCalls.incrementAndGet();
				return List.of();
			}
		};
		service = new ForeignDocumentCatalogService(blockingProvider, properties());

		List<CompletableFuture<DocumentCatalog>> callers = new ArrayList<>();
		for (int i = 0; i < 8; i++) {
			callers.add(service.ensureLoaded());
		}
		release.countDown();
		for (CompletableFuture<DocumentCatalog> caller : callers) {
			assertThat(caller.get(5, TimeUnit.SECONDS).collection(DocumentSubtype.BACKGROUND).size()).isEqualTo(1);
		}

		assertThat(listCalls.get()).isEqualTo(DocumentSubtype.values().length);
	}

	@Test
	void failingEntryIsSkippedWithoutAbortingTheLoad() throws Exception {
		InMemoryDocumentProvider.Pack pack = new InMemoryDocumentProvider.Pack("core")
				.with(document("bg-noble", "Noble", "background", null),
						document("bg-broken", "Broken", "background", null),
						document("bg-sage", "Sage", "background", null))
				.failingOn("bg-broken");
		service = new ForeignDocumentCatalogService(new InMemoryDocumentProvider().pack(pack), properties());

		DocumentCatalog catalog = service.ensureLoaded().get(5, TimeUnit.SECONDS);

		assertThat(catalog.collection(DocumentSubtype.BACKGROUND).documents())
				.extracting(SourceDocument::id)
				.containsExactly("bg-noble", "bg-sage");
	}

	@Test
	void unreadablePackageIndexIsSkippedWithoutAbortingTheLoad() throws Exception {
		InMemoryDocumentProvider.Pack unreadable = new InMemoryDocumentProvider.Pack("damaged")
				.with(document("bg-noble", "Noble", "background", null))
				.failingIndex("index unreadable");
		InMemoryDocumentProvider.Pack healthy = new InMemoryDocumentProvider.Pack("core")
				.with(document("cl-fighter", "Fighter", "class", null));
		InMemoryDocumentProvider provider = new InMemoryDocumentProvider()
				.local(document("bg-sage", "Sage", "background", null))
				.pack(unreadable)
				.pack(healthy);
		service = new ForeignDocumentCatalogService(provider, properties());

		DocumentCatalog catalog = service.ensureLoaded().get(5, TimeUnit.SECONDS);

		assertThat(catalog.collection(DocumentSubtype.BACKGROUND).documents())
				.extracting(SourceDocument::id)
				.containsExactly("bg-sage");
		assertThat(catalog.collection(DocumentSubtype.CLASS).documents())
				.extracting(SourceDocument::id)
				.containsExactly("cl-fighter");
		assertThat(unreadable.fetches()).isZero();
		assertThat(service.isWarm()).isTrue();
	}

	@Test
	void packagesOfOtherDocumentTypesAreIgnored() throws Exception {
		InMemoryDocumentProvider.Pack actors = new InMemoryDocumentProvider.Pack("monsters", "Actor")
				.with(document("bg-fake", "Fake", "background", null));
		service = new ForeignDocumentCatalogService(new InMemoryDocumentProvider().pack(actors), properties());

		DocumentCatalog catalog = service.ensureLoaded().get(5, TimeUnit.SECONDS);

		assertThat(catalog.collection(DocumentSubtype.BACKGROUND).isEmpty()).isTrue();
		assertThat(actors.fetches()).isZero();
	}

	@Test
	void invalidateForcesReload() throws Exception {
		InMemoryDocumentProvider.Pack pack = new InMemoryDocumentProvider.Pack("core")
				.with(document("bg-noble", "Noble", "background", null));
		service = new ForeignDocumentCatalogService(new InMemoryDocumentProvider().pack(pack), properties());

		service.ensureLoaded().get(5, TimeUnit.SECONDS);
		service.invalidate();
		assertThat(service.collection(DocumentSubtype.BACKGROUND)).isEmpty();
		service.ensureLoaded().get(5, TimeUnit.SECONDS);

		assertThat(pack.fetches()).isEqualTo(2);
		assertThat(service.collection(DocumentSubtype.BACKGROUND)).isPresent();
	}

	@Test
	void failedSubtypeLoadIsEvictedAndRetried() throws Exception {
		AtomicInteger attempts = new AtomicInteger();
		DocumentProvider flakyProvider = new DocumentProvider() {
			@Override
			public List<SourceDocument> getLocalCollection(String documentType) {
				return List.of(document("bg-noble", "Noble", "background", null));
			}

			@Override
			public List<ContentPackage> listPackages() {
				if (attempts.incrementAndGet() <= DocumentSubtype.values().length) {
					throw new IllegalStateException("package index offline");
				}
				return List.of();
			}
		};
		service = new ForeignDocumentCatalogService(flakyProvider, properties());

		assertThatThrownBy(() -> service.ensureLoaded().get(5, TimeUnit.SECONDS))
				.hasRootCauseMessage("package index offline");
		assertThat(service.isWarm()).isFalse();

		DocumentCatalog catalog = service.ensureLoaded().get(5, TimeUnit.SECONDS);
		assertThat(catalog.collection(DocumentSubtype.BACKGROUND).size()).isEqualTo(1);
	}
}
