package my.charbuilder.app.content;

public class ContentFetchException extends RuntimeException {
	private final String packageId;

	public ContentFetchException(String message, String packageId, Throwable cause) {
		super(message, cause);
		this.packageId = packageId;
	}

	public String getPackageId() {
		return packageId;
	}
}
