package net.unishelf.application.resource;

import lombok.extern.slf4j.Slf4j;
import net.unishelf.adapters.persistence.ResourceRepository;
import net.unishelf.domain.resource.AccessLevel;
import net.unishelf.domain.resource.Resource;
import net.unishelf.domain.resource.ResourceDraft;
import net.unishelf.domain.resource.ResourceType;
import net.unishelf.exception.InvalidResourceException;
import net.unishelf.util.SearchQueryUtils;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Creates resources from uploaded metadata. Lecturer and admin uploads are
 * approved on creation; student uploads wait for review.
 */
@Slf4j
@Service
public class ResourceUploadService {

    private final ResourceRepository resourceRepository;

    public ResourceUploadService(ResourceRepository resourceRepository) {
        this.resourceRepository = resourceRepository;
    }

    public Resource upload(ResourceUploadCommand command) {
        if (!StringUtils.hasText(command.title()) || !StringUtils.hasText(command.resourceType())) {
            throw new InvalidResourceException("Title and resource type are required");
        }
        ResourceType type = ResourceType.fromWire(command.resourceType());
        if (type == null) {
            throw new InvalidResourceException("Unknown resource type: " + command.resourceType());
        }
        boolean hasFile = StringUtils.hasText(command.fileUrl());
        boolean hasLink = StringUtils.hasText(command.externalLink());
        if (type == ResourceType.LINK && !hasLink) {
            throw new InvalidResourceException("External link is required for link resources");
        }
        if (type != ResourceType.LINK && !hasFile && !hasLink) {
            throw new InvalidResourceException("Either a file or an external link is required");
        }
        if (command.level() != null && command.level() < 0) {
            throw new InvalidResourceException("Level must not be negative");
        }

        ResourceDraft draft = new ResourceDraft(
            command.title().trim(),
            command.description(),
            type,
            ResourceFormats.derive(command.fileUrl(), command.fileName(), command.mimeType()),
            trimToNull(command.author()),
            trimToNull(command.publisher()),
            command.publicationYear(),
            trimToNull(command.isbn()),
            SearchQueryUtils.flattenCsv(command.tags()),
            SearchQueryUtils.flattenCsv(command.departmentIds()),
            SearchQueryUtils.flattenCsv(command.courseIds()),
            command.level(),
            hasFile ? command.fileUrl().trim() : null,
            hasLink ? command.externalLink().trim() : null,
            trimToNull(command.thumbnail()),
            command.uploader().userId(),
            AccessLevel.fromWireOrPublic(command.accessLevel()),
            command.uploader().isStaff(),
            null,
            null
        );
        Resource created = resourceRepository.insert(draft);
        log.info("Resource {} uploaded by {} (type={}, format={}, approved={})",
            created.id(), created.uploaderId(), created.resourceType().wireValue(), created.format(), created.approved());
        return created;
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
