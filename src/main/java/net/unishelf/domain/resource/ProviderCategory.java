package net.unishelf.domain.resource;

/**
 * Broad category of an external provider. Imported candidates inherit their
 * resource type and format label from the category of the provider that found them.
 */
public enum ProviderCategory {
    BOOK_CATALOG("textbook"),
    OPEN_ACCESS_REPOSITORY("journal"),
    PREPRINT_ARCHIVE("preprint");

    private final String formatLabel;

    ProviderCategory(String formatLabel) {
        this.formatLabel = formatLabel;
    }

    public ResourceType resourceType() {
        return ResourceType.DOCUMENT;
    }

    public String formatLabel() {
        return formatLabel;
    }
}
