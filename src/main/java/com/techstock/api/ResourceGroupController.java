package com.techstock.api;

import com.techstock.domain.model.CreateResourceGroupRequest;
import com.techstock.domain.model.PaginationParams;
import com.techstock.domain.model.ResourceView;
import com.techstock.domain.model.UpdateResourceGroupRequest;
import com.techstock.domain.service.ResourceGroupService;
import com.techstock.domain.service.ResourceService;
import com.techstock.infrastructure.persistence.entity.ResourceGroupEntity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/resource-groups")
@RequiredArgsConstructor
public class ResourceGroupController {

    private final ResourceGroupService resourceGroupService;
    private final ResourceService resourceService;

    @GetMapping
    public ResponseEntity<PaginatedResponse<ResourceGroupEntity>> listResourceGroups(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size) {
        return ResponseEntity.ok(PaginatedResponse.of(
                resourceGroupService.listResourceGroups(PaginationParams.of(page, size))));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ResourceGroupEntity>> getResourceGroup(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(resourceGroupService.getResourceGroup(id)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ResourceGroupEntity>> createResourceGroup(
            @Valid @RequestBody CreateResourceGroupRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(resourceGroupService.createResourceGroup(request), "Resource group created"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<ResourceGroupEntity>> updateResourceGroup(
            @PathVariable Long id,
            @Valid @RequestBody UpdateResourceGroupRequest request) {
        return ResponseEntity.ok(ApiResponse.success(
                resourceGroupService.updateResourceGroup(id, request), "Resource group updated"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteResourceGroup(@PathVariable Long id) {
        resourceGroupService.deleteResourceGroup(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Resource group deleted"));
    }

    @GetMapping("/{id}/resources")
    public ResponseEntity<ApiResponse<List<ResourceView>>> getResources(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(resourceService.getResourcesByResourceGroup(id)));
    }
}
