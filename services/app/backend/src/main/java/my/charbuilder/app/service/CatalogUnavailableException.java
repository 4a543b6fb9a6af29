package my.charbuilder.app.service;

public class CatalogUnavailableException extends RuntimeException {
	public CatalogUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}
}
