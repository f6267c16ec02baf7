package net.unishelf.application.resource;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import net.unishelf.adapters.persistence.ResourceRepository;
import net.unishelf.adapters.persistence.ResourceRepository.Counter;
import net.unishelf.adapters.persistence.ResourceRepository.RatingUpdate;
import net.unishelf.domain.caller.CallerIdentity;
import net.unishelf.domain.resource.Resource;
import net.unishelf.domain.resource.ResourceRating;
import net.unishelf.exception.InvalidResourceException;
import net.unishelf.exception.ResourceAccessDeniedException;
import net.unishelf.exception.ResourceNotFoundException;
import net.unishelf.util.SearchQueryUtils;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Rating, download and share operations on a single resource. Counter bumps
 * and rating upserts are atomic in the store.
 */
@Slf4j
@Service
public class ResourceEngagementService {

    /** Where a download sends the caller, plus the resource with its bumped counter. */
    public record DownloadTarget(String url, Resource resource) {
    }

    private final ResourceRepository resourceRepository;
    private final ResourceAccessPolicy accessPolicy;
    private final ResourceShareNotifier shareNotifier;

    public ResourceEngagementService(ResourceRepository resourceRepository,
                                     ResourceAccessPolicy accessPolicy,
                                     ResourceShareNotifier shareNotifier) {
        this.resourceRepository = resourceRepository;
        this.accessPolicy = accessPolicy;
        this.shareNotifier = shareNotifier;
    }

    public RatingUpdate rate(UUID resourceId, CallerIdentity rater, Integer score, String review) {
        if (score == null || score < ResourceRating.MIN_SCORE || score > ResourceRating.MAX_SCORE) {
            throw new InvalidResourceException("Rating must be between 1 and 5");
        }
        requireAccessible(resourceId, rater);
        ResourceRating rating = new ResourceRating(
            rater.userId(),
            score,
            StringUtils.hasText(review) ? review.trim() : null,
            Instant.now()
        );
        RatingUpdate update = resourceRepository.upsertRating(resourceId, rating);
        log.debug("Resource {} rated {} by {}; average now {} over {} rating(s)",
            resourceId, score, rater.userId(), update.averageRating(), update.ratingsCount());
        return update;
    }

    public DownloadTarget download(UUID resourceId, CallerIdentity caller) {
        Resource resource = requireAccessible(resourceId, caller);
        if (resource.downloadTarget() == null) {
            throw new InvalidResourceException("Resource has no file or external link to download");
        }
        Resource updated = resourceRepository.incrementCounter(resourceId, Counter.DOWNLOADS)
            .orElseThrow(() -> new ResourceNotFoundException(resourceId));
        return new DownloadTarget(updated.downloadTarget(), updated);
    }

    public Resource share(UUID resourceId, CallerIdentity sharer, String groupId, List<String> userIds, String message) {
        List<String> recipients = SearchQueryUtils.flattenCsv(userIds);
        boolean hasGroup = StringUtils.hasText(groupId);
        if (!hasGroup && recipients.isEmpty()) {
            throw new InvalidResourceException("Either a group or at least one user is required to share");
        }
        requireAccessible(resourceId, sharer);
        Resource updated = resourceRepository.incrementCounter(resourceId, Counter.SHARES)
            .orElseThrow(() -> new ResourceNotFoundException(resourceId));
        shareNotifier.notifyShared(new ResourceSharedEvent(
            updated.id(),
            updated.title(),
            sharer.userId(),
            hasGroup ? groupId.trim() : null,
            recipients,
            StringUtils.hasText(message) ? message.trim() : null,
            Instant.now()
        ));
        return updated;
    }

    private Resource requireAccessible(UUID resourceId, CallerIdentity caller) {
        Resource resource = resourceRepository.findById(resourceId)
            .orElseThrow(() -> new ResourceNotFoundException(resourceId));
        if (!accessPolicy.canAccess(caller, resource)) {
            throw new ResourceAccessDeniedException(resourceId);
        }
        return resource;
    }
}
