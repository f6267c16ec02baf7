package net.unishelf.controller;

import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import net.unishelf.application.resource.ResourceCatalogService;
import net.unishelf.application.resource.ResourceCatalogService.FeaturedResources;
import net.unishelf.application.resource.ResourceCatalogService.ResourceDetail;
import net.unishelf.application.resource.ResourceEngagementService;
import net.unishelf.application.resource.ResourceEngagementService.DownloadTarget;
import net.unishelf.application.resource.ResourceImportResult;
import net.unishelf.application.resource.ResourceImportService;
import net.unishelf.application.resource.ResourceUploadService;
import net.unishelf.application.search.ResourceSearchRequest;
import net.unishelf.application.search.ResourceSearchResponse;
import net.unishelf.application.search.ResourceSearchUseCase;
import net.unishelf.controller.dto.ApiResponse;
import net.unishelf.controller.dto.DownloadResponse;
import net.unishelf.controller.dto.RateResourceRequest;
import net.unishelf.controller.dto.RatingResponse;
import net.unishelf.controller.dto.ResourceDtoMapper;
import net.unishelf.controller.dto.ResourceImportRequest;
import net.unishelf.controller.dto.ResourceUploadRequest;
import net.unishelf.controller.dto.ShareResourceRequest;
import net.unishelf.controller.support.CurrentCaller;
import net.unishelf.domain.caller.CallerIdentity;
import net.unishelf.domain.resource.Resource;
import net.unishelf.exception.InvalidCandidateException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Resource library API: combined local and external search, import of external
 * candidates, upload, and per-resource engagement.
 */
@Slf4j
@RestController
@RequestMapping("/api/resources")
public class ResourceController {

    private final ResourceSearchUseCase searchUseCase;
    private final ResourceImportService importService;
    private final ResourceUploadService uploadService;
    private final ResourceCatalogService catalogService;
    private final ResourceEngagementService engagementService;

    public ResourceController(ResourceSearchUseCase searchUseCase,
                              ResourceImportService importService,
                              ResourceUploadService uploadService,
                              ResourceCatalogService catalogService,
                              ResourceEngagementService engagementService) {
        this.searchUseCase = searchUseCase;
        this.importService = importService;
        this.uploadService = uploadService;
        this.catalogService = catalogService;
        this.engagementService = engagementService;
    }

    /**
     * Searches the local library and the selected external providers at once.
     * {@code sources} is a comma separated list; external providers only run with a query.
     */
    @GetMapping("/search")
    public Mono<ResponseEntity<ResourceSearchResponse>> search(@RequestParam(required = false) String query,
                                                               @RequestParam(required = false) String type,
                                                               @RequestParam(required = false) Integer level,
                                                               @RequestParam(required = false) String department,
                                                               @RequestParam(required = false) String course,
                                                               @RequestParam(required = false) List<String> sources,
                                                               @RequestParam(required = false) Integer page,
                                                               @RequestParam(required = false) Integer limit) {
        ResourceSearchRequest request = new ResourceSearchRequest(query, type, level, department, course, sources, page, limit);
        return searchUseCase.search(request).map(ResponseEntity::ok);
    }

    @PostMapping("/import")
    public ResponseEntity<ApiResponse<Resource>> importResource(@CurrentCaller CallerIdentity caller,
                                                                @RequestBody ResourceImportRequest request) {
        if (request == null || request.resourceData() == null) {
            throw new InvalidCandidateException("Resource data is required");
        }
        ResourceImportResult result = importService.importCandidate(ResourceDtoMapper.toImportCommand(request, caller));
        if (result.created()) {
            return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok("Resource imported successfully", result.resource()));
        }
        return ResponseEntity.ok(ApiResponse.ok("Resource was already imported", result.resource()));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<Resource>> upload(@CurrentCaller CallerIdentity caller,
                                                        @RequestBody ResourceUploadRequest request) {
        Resource created = uploadService.upload(ResourceDtoMapper.toUploadCommand(request, caller));
        String message = created.approved()
            ? "Resource uploaded successfully"
            : "Resource uploaded and pending approval";
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(message, created));
    }

    @GetMapping("/featured")
    public ApiResponse<FeaturedResources> featured(@RequestParam(required = false) Integer limit,
                                                   @RequestParam(required = false) String type) {
        return ApiResponse.ok(catalogService.featured(limit, type));
    }

    @GetMapping("/{id}")
    public ApiResponse<ResourceDetail> detail(@PathVariable UUID id,
                                              @CurrentCaller(required = false) CallerIdentity caller) {
        return ApiResponse.ok(catalogService.detail(id, caller));
    }

    @RequestMapping(value = "/{id}/download", method = {RequestMethod.GET, RequestMethod.POST})
    public ApiResponse<DownloadResponse> download(@PathVariable UUID id, @CurrentCaller CallerIdentity caller) {
        DownloadTarget target = engagementService.download(id, caller);
        return ApiResponse.ok(new DownloadResponse(target.url()));
    }

    @PostMapping("/{id}/rate")
    public ApiResponse<RatingResponse> rate(@PathVariable UUID id,
                                            @CurrentCaller CallerIdentity caller,
                                            @RequestBody RateResourceRequest request) {
        RatingResponse rating = ResourceDtoMapper.toRatingResponse(
            engagementService.rate(id, caller, request.rating(), request.review()));
        return ApiResponse.ok("Resource rated successfully", rating);
    }

    @PostMapping("/{id}/share")
    public ApiResponse<Resource> share(@PathVariable UUID id,
                                       @CurrentCaller CallerIdentity caller,
                                       @RequestBody ShareResourceRequest request) {
        Resource shared = engagementService.share(id, caller, request.groupId(), request.userIds(), request.message());
        return ApiResponse.ok("Resource shared successfully", shared);
    }
}
