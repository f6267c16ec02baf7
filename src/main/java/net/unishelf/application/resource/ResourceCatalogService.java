package net.unishelf.application.resource;

import jakarta.annotation.Nullable;
import java.util.List;
import java.util.UUID;
import net.unishelf.adapters.persistence.ResourceRepository;
import net.unishelf.adapters.persistence.ResourceRepository.Counter;
import net.unishelf.domain.caller.CallerIdentity;
import net.unishelf.domain.resource.Resource;
import net.unishelf.domain.resource.ResourceRating;
import net.unishelf.domain.resource.ResourceType;
import net.unishelf.exception.InvalidResourceException;
import net.unishelf.exception.ResourceAccessDeniedException;
import net.unishelf.exception.ResourceNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Read paths over single resources: detail view and the featured lists.
 */
@Service
public class ResourceCatalogService {

    static final int RELATED_LIMIT = 5;
    static final int MAX_FEATURED_LIMIT = 50;

    public record ResourceDetail(Resource resource, @Nullable ResourceRating userRating, List<Resource> related) {
    }

    public record FeaturedResources(List<Resource> featured,
                                    List<Resource> trending,
                                    List<Resource> recent,
                                    List<Resource> topRated) {
    }

    private final ResourceRepository resourceRepository;
    private final ResourceAccessPolicy accessPolicy;

    public ResourceCatalogService(ResourceRepository resourceRepository, ResourceAccessPolicy accessPolicy) {
        this.resourceRepository = resourceRepository;
        this.accessPolicy = accessPolicy;
    }

    /**
     * Loads a resource for display, counting the view once access is granted.
     */
    public ResourceDetail detail(UUID resourceId, @Nullable CallerIdentity caller) {
        Resource resource = resourceRepository.findById(resourceId)
            .orElseThrow(() -> new ResourceNotFoundException(resourceId));
        if (!accessPolicy.canAccess(caller, resource)) {
            throw new ResourceAccessDeniedException(resourceId);
        }
        Resource viewed = resourceRepository.incrementCounter(resourceId, Counter.VIEWS)
            .orElseThrow(() -> new ResourceNotFoundException(resourceId));
        ResourceRating userRating = caller == null
            ? null
            : resourceRepository.loadRatings(resourceId).findByRater(caller.userId()).orElse(null);
        List<Resource> related = resourceRepository.findRelated(viewed, RELATED_LIMIT);
        return new ResourceDetail(viewed, userRating, related);
    }

    public FeaturedResources featured(@Nullable Integer limit, @Nullable String rawType) {
        int size = limit == null || limit < 1 ? 10 : Math.min(limit, MAX_FEATURED_LIMIT);
        ResourceType type = null;
        if (StringUtils.hasText(rawType)) {
            type = ResourceType.fromWire(rawType);
            if (type == null) {
                throw new InvalidResourceException("Unknown resource type: " + rawType);
            }
        }
        return new FeaturedResources(
            resourceRepository.findFeatured(type, size),
            resourceRepository.findTrending(type, size),
            resourceRepository.findRecent(type, size),
            resourceRepository.findTopRated(type, size)
        );
    }
}
