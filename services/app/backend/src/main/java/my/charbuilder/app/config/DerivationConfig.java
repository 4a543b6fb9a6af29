package my.charbuilder.app.config;

import my.charbuilder.app.content.ClasspathDocumentProvider;
import my.charbuilder.app.content.ContentParser;
import my.charbuilder.app.content.DocumentProvider;
import my.charbuilder.app.rules.JsonRuleCatalog;
import my.charbuilder.app.rules.RuleCatalog;
import my.charbuilder.app.rules.RuleCatalogDefinition;
import my.charbuilder.app.rules.RuleCatalogParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

@Configuration
public class DerivationConfig {
	private static final Logger logger = LoggerFactory.getLogger(DerivationConfig.class);

	@Bean
	@ConditionalOnMissingBean(DocumentProvider.class)
	public DocumentProvider documentProvider(AppProperties properties, ResourcePatternResolver resourceResolver) {
		AppProperties.Content content = properties.content();
		logger.info("Document provider enabled (local={}, packages={}).", content.localDocuments(), content.packages());
		return new ClasspathDocumentProvider(resourceResolver, new ContentParser(),
				content.localDocuments(), content.packages());
	}

	@Bean
	@ConditionalOnMissingBean(RuleCatalog.class)
	public RuleCatalog ruleCatalog(AppProperties properties, ResourcePatternResolver resourceResolver) {
		String location = properties.catalog().ruleCatalog();
		Resource resource = resourceResolver.getResource(location);
		if (!resource.exists()) {
			throw new IllegalStateException("Rule catalog resource not found: " + location);
		}
		try (InputStream inputStream = resource.getInputStream()) {
			String json = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
			RuleCatalogDefinition definition = new RuleCatalogParser().parse(json);
			JsonRuleCatalog catalog = new JsonRuleCatalog(definition);
			logger.info("Rule catalog loaded (name={}, location={}).", definition.getName(), location);
			return catalog;
		} catch (IOException ex) {
			throw new IllegalStateException("Failed to read rule catalog " + location, ex);
		}
	}
}
