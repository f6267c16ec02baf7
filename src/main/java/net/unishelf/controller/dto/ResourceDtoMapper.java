package net.unishelf.controller.dto;

import java.util.List;
import net.unishelf.adapters.persistence.ResourceRepository.RatingUpdate;
import net.unishelf.application.resource.ResourceImportCommand;
import net.unishelf.application.resource.ResourceUploadCommand;
import net.unishelf.domain.caller.CallerIdentity;
import net.unishelf.domain.resource.AccessLevel;
import net.unishelf.domain.resource.CandidateRecord;
import net.unishelf.util.SearchQueryUtils;

/**
 * Converts request bodies into application commands and results into response bodies.
 */
public final class ResourceDtoMapper {

    private ResourceDtoMapper() {
    }

    public static ResourceImportCommand toImportCommand(ResourceImportRequest request, CallerIdentity importer) {
        return new ResourceImportCommand(
            toCandidate(request.resourceData()),
            importer,
            AccessLevel.fromWireOrPublic(request.accessLevel()),
            SearchQueryUtils.flattenCsv(request.departmentIds()),
            SearchQueryUtils.flattenCsv(request.courseIds())
        );
    }

    public static CandidateRecord toCandidate(CandidatePayload payload) {
        if (payload == null) {
            return null;
        }
        return new CandidateRecord(
            payload.id(),
            payload.title(),
            payload.description(),
            payload.authors() == null ? List.of() : payload.authors().stream().filter(a -> a != null && !a.isBlank()).toList(),
            payload.publishedDate(),
            payload.thumbnail(),
            payload.previewLink(),
            payload.infoLink(),
            payload.sourceName(),
            payload.sourceExternalId()
        );
    }

    public static ResourceUploadCommand toUploadCommand(ResourceUploadRequest request, CallerIdentity uploader) {
        return new ResourceUploadCommand(
            uploader,
            request.title(),
            request.description(),
            request.resourceType(),
            request.author(),
            request.publisher(),
            request.publicationYear(),
            request.isbn(),
            request.tags(),
            request.departmentIds(),
            request.courseIds(),
            request.level(),
            request.fileUrl(),
            request.fileName(),
            request.mimeType(),
            request.externalLink(),
            request.thumbnail(),
            request.accessLevel()
        );
    }

    public static RatingResponse toRatingResponse(RatingUpdate update) {
        return new RatingResponse(update.rating().score(), update.averageRating(), update.ratingsCount());
    }
}
