package my.charbuilder.app.content;

public record PackageIndexEntry(String id, String name, String type) {
}
