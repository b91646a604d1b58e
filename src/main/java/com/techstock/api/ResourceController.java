package com.techstock.api;

import com.techstock.domain.model.CreateResourceRequest;
import com.techstock.domain.model.LinkApplicationRequest;
import com.techstock.domain.model.PaginationParams;
import com.techstock.domain.model.ResourceFilters;
import com.techstock.domain.model.ResourceStatistics;
import com.techstock.domain.model.ResourceView;
import com.techstock.domain.model.SortDirection;
import com.techstock.domain.model.SortParams;
import com.techstock.domain.model.UpdateResourceRequest;
import com.techstock.domain.service.DashboardService;
import com.techstock.domain.service.ResourceService;
import com.techstock.infrastructure.persistence.entity.ApplicationEntity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for catalog resources.
 *
 * Endpoints:
 * - GET /api/v1/resources - Filtered, sorted, paginated listing
 * - GET /api/v1/resources/types - Distinct resource types
 * - GET /api/v1/resources/stats - Counts by type, location and environment
 * - GET|PUT|DELETE /api/v1/resources/{id}
 * - GET|POST /api/v1/resources/{id}/applications
 * - DELETE /api/v1/resources/{id}/applications/{applicationId}
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/resources")
@RequiredArgsConstructor
public class ResourceController {

    private final ResourceService resourceService;
    private final DashboardService dashboardService;

    /**
     * GET /api/v1/resources?page=1&size=20&resourceType=vm&tags=Env:prod,Env:dev&search=web&sortField=name&sortDirection=desc
     *
     * Every filter is optional. {@code tags} pairs are OR-combined, all
     * other filters AND-combined. Unknown sort fields are rejected with 400.
     */
    @GetMapping
    public ResponseEntity<PaginatedResponse<ResourceView>> listResources(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size,
            @RequestParam(required = false) String resourceType,
            @RequestParam(required = false) String location,
            @RequestParam(required = false) String environment,
            @RequestParam(required = false) String vendor,
            @RequestParam(required = false) Long subscriptionId,
            @RequestParam(required = false) Long resourceGroupId,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String tags,
            @RequestParam(required = false) String sortField,
            @RequestParam(required = false) String sortDirection) {

        log.info("List resources: page={}, size={}, search={}, tags={}", page, size, search, tags);

        ResourceFilters filters = ResourceFilters.builder()
                .resourceType(resourceType)
                .location(location)
                .environment(environment)
                .vendor(vendor)
                .subscriptionId(subscriptionId)
                .resourceGroupId(resourceGroupId)
                .search(search)
                .tags(tags)
                .build();
        SortParams sort = new SortParams(sortField, SortDirection.fromParameter(sortDirection));

        return ResponseEntity.ok(PaginatedResponse.of(
                resourceService.listResources(filters, sort, PaginationParams.of(page, size))));
    }

    @GetMapping("/types")
    public ResponseEntity<ApiResponse<List<String>>> getResourceTypes() {
        return ResponseEntity.ok(ApiResponse.success(resourceService.getResourceTypes()));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<ResourceStatistics>> getStatistics() {
        return ResponseEntity.ok(ApiResponse.success(dashboardService.getStatistics()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ResourceView>> getResource(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(resourceService.getResource(id)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ResourceView>> createResource(
            @Valid @RequestBody CreateResourceRequest request) {
        log.info("Create resource: name={}, type={}", request.getName(), request.getResourceType());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(resourceService.createResource(request), "Resource created"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<ResourceView>> updateResource(
            @PathVariable Long id,
            @Valid @RequestBody UpdateResourceRequest request) {
        return ResponseEntity.ok(ApiResponse.success(resourceService.updateResource(id, request), "Resource updated"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteResource(@PathVariable Long id) {
        resourceService.deleteResource(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Resource deleted"));
    }

    @GetMapping("/{id}/applications")
    public ResponseEntity<ApiResponse<List<ApplicationEntity>>> getApplications(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(resourceService.getApplications(id)));
    }

    @PostMapping("/{id}/applications")
    public ResponseEntity<ApiResponse<Void>> linkApplication(
            @PathVariable Long id,
            @Valid @RequestBody LinkApplicationRequest request) {
        resourceService.linkApplication(id, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(null, "Application linked"));
    }

    @DeleteMapping("/{id}/applications/{applicationId}")
    public ResponseEntity<ApiResponse<Void>> unlinkApplication(
            @PathVariable Long id,
            @PathVariable Long applicationId,
            @RequestParam(required = false) String relationType) {
        resourceService.unlinkApplication(id, applicationId, relationType);
        return ResponseEntity.ok(ApiResponse.success(null, "Application unlinked"));
    }
}
