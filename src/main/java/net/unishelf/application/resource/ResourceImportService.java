package net.unishelf.application.resource;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import net.unishelf.adapters.persistence.ResourceRepository;
import net.unishelf.domain.resource.CandidateRecord;
import net.unishelf.domain.resource.ProviderCategory;
import net.unishelf.domain.resource.Resource;
import net.unishelf.domain.resource.ResourceDraft;
import net.unishelf.exception.InvalidCandidateException;
import net.unishelf.service.provider.ExternalProviderAdapter;
import net.unishelf.service.provider.ExternalProviderRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Promotes an external candidate into a persisted local resource.
 *
 * <p>The resource type and format come from the category of the provider that
 * produced the candidate. The file reference stays empty; the candidate's preview
 * or info link becomes the external link. Staff imports are approved immediately.
 * Re-imports of the same (source, external id) pair follow {@link ImportDuplicatePolicy}.
 * A candidate from an unregistered or unnamed source is imported as a book catalog record.</p>
 */
@Slf4j
@Service
public class ResourceImportService {

    /** Category for candidates whose source is missing or not a registered provider. */
    static final ProviderCategory DEFAULT_CATEGORY = ProviderCategory.BOOK_CATALOG;

    private static final Pattern YEAR = Pattern.compile("(\\d{4})");

    private final ResourceRepository resourceRepository;
    private final ExternalProviderRegistry providerRegistry;
    private final ImportDuplicatePolicy duplicatePolicy;

    public ResourceImportService(ResourceRepository resourceRepository,
                                 ExternalProviderRegistry providerRegistry,
                                 @Value("${app.import.duplicate-policy:REUSE_EXISTING}") String duplicatePolicy) {
        this.resourceRepository = resourceRepository;
        this.providerRegistry = providerRegistry;
        this.duplicatePolicy = ImportDuplicatePolicy.fromProperty(duplicatePolicy).orElseGet(() -> {
            if (duplicatePolicy != null && !duplicatePolicy.isBlank()) {
                log.warn("Unknown app.import.duplicate-policy '{}'; using REUSE_EXISTING", duplicatePolicy);
            }
            return ImportDuplicatePolicy.REUSE_EXISTING;
        });
    }

    public ResourceImportResult importCandidate(ResourceImportCommand command) {
        CandidateRecord candidate = command.candidate();
        if (candidate == null) {
            throw new InvalidCandidateException("Resource data is required");
        }
        if (candidate.title().isBlank()) {
            throw new InvalidCandidateException("Candidate has no title");
        }
        String link = candidate.usableLink();
        if (link == null) {
            throw new InvalidCandidateException("Candidate has neither a preview link nor an info link");
        }
        Optional<ExternalProviderAdapter> provider = providerRegistry.findBySourceName(candidate.sourceName());
        ProviderCategory category = provider.map(ExternalProviderAdapter::category).orElse(DEFAULT_CATEGORY);
        String sourceName = provider.map(ExternalProviderAdapter::displayName).orElse(emptyToNull(candidate.sourceName()));
        if (provider.isEmpty()) {
            log.debug("Candidate source '{}' is not a registered provider; importing as {}", sourceName, DEFAULT_CATEGORY);
        }

        if (duplicatePolicy == ImportDuplicatePolicy.REUSE_EXISTING && !candidate.sourceExternalId().isBlank()) {
            Optional<Resource> existing = resourceRepository.findBySource(sourceName, candidate.sourceExternalId());
            if (existing.isPresent()) {
                log.info("Reusing resource {} for already imported {} record {}",
                    existing.get().id(), sourceName, candidate.sourceExternalId());
                return new ResourceImportResult(existing.get(), false);
            }
        }

        Resource created = resourceRepository.insert(
            toDraft(command, category, sourceName, emptyToNull(candidate.sourceExternalId()), link));
        log.info("Imported {} record {} as resource {} (approved={})",
            sourceName, candidate.sourceExternalId(), created.id(), created.approved());
        return new ResourceImportResult(created, true);
    }

    public ImportDuplicatePolicy duplicatePolicy() {
        return duplicatePolicy;
    }

    private static ResourceDraft toDraft(ResourceImportCommand command,
                                         ProviderCategory category,
                                         String sourceName,
                                         String sourceExternalId,
                                         String link) {
        CandidateRecord candidate = command.candidate();
        return new ResourceDraft(
            candidate.title().trim(),
            candidate.description(),
            category.resourceType(),
            category.formatLabel(),
            String.join(", ", candidate.authors()),
            null,
            parseYear(candidate.publishedDate()),
            null,
            null,
            command.departmentIds(),
            command.courseIds(),
            null,
            null,
            link,
            candidate.thumbnail(),
            command.importer().userId(),
            command.accessLevel(),
            command.importer().isStaff(),
            sourceName,
            sourceExternalId
        );
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    static Integer parseYear(String publishedDate) {
        if (publishedDate == null) {
            return null;
        }
        Matcher matcher = YEAR.matcher(publishedDate);
        return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
    }
}
