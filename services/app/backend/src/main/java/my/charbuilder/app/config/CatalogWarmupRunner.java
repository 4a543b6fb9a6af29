package my.charbuilder.app.config;

import my.charbuilder.app.service.ForeignDocumentCatalogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
public class CatalogWarmupRunner implements ApplicationRunner {
	private static final Logger logger = LoggerFactory.getLogger(CatalogWarmupRunner.class);

	private final AppProperties properties;
	private final ForeignDocumentCatalogService catalogService;

	public CatalogWarmupRunner(AppProperties properties, ForeignDocumentCatalogService catalogService) {
		this.properties = properties;
		this.catalogService = catalogService;
	}

	@Override
	public void run(ApplicationArguments args) {
		if (!properties.catalog().warmOnStartup()) {
			return;
		}
		catalogService.ensureLoaded().whenComplete((catalog, ex) -> {
			if (ex != null) {
				logger.error("Foreign document catalog warm-up failed: {}", ex.getMessage());
				return;
			}
			logger.info("Foreign document catalog warmed ({} document(s)).", catalog.totalDocuments());
		});
	}
}
