package my.charbuilder.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import my.charbuilder.app.rules.UnknownModePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid @NotNull Content content,
		@Valid @NotNull Catalog catalog,
		@Valid @NotNull Derivation derivation
) {
	public record Content(
			String localDocuments,
			String packages
	) {
	}

	public record Catalog(
			@NotBlank String ruleCatalog,
			@Min(1) int loadThreads,
			boolean warmOnStartup,
			@Min(1) int loadTimeoutSeconds
	) {
	}

	public record Derivation(
			@NotBlank String sortLocale,
			@NotNull UnknownModePolicy unknownModePolicy
	) {
	}
}
