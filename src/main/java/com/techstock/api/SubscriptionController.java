package com.techstock.api;

import com.techstock.domain.model.CreateSubscriptionRequest;
import com.techstock.domain.model.PaginationParams;
import com.techstock.domain.model.ResourceView;
import com.techstock.domain.model.UpdateSubscriptionRequest;
import com.techstock.domain.service.ResourceGroupService;
import com.techstock.domain.service.ResourceService;
import com.techstock.domain.service.SubscriptionService;
import com.techstock.infrastructure.persistence.entity.ResourceGroupEntity;
import com.techstock.infrastructure.persistence.entity.SubscriptionEntity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/subscriptions")
@RequiredArgsConstructor
public class SubscriptionController {

    private final SubscriptionService subscriptionService;
    private final ResourceGroupService resourceGroupService;
    private final ResourceService resourceService;

    @GetMapping
    public ResponseEntity<PaginatedResponse<SubscriptionEntity>> listSubscriptions(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size) {
        return ResponseEntity.ok(PaginatedResponse.of(
                subscriptionService.listSubscriptions(PaginationParams.of(page, size))));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<SubscriptionEntity>> getSubscription(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(subscriptionService.getSubscription(id)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<SubscriptionEntity>> createSubscription(
            @Valid @RequestBody CreateSubscriptionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(subscriptionService.createSubscription(request), "Subscription created"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<SubscriptionEntity>> updateSubscription(
            @PathVariable Long id,
            @Valid @RequestBody UpdateSubscriptionRequest request) {
        return ResponseEntity.ok(ApiResponse.success(
                subscriptionService.updateSubscription(id, request), "Subscription updated"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteSubscription(@PathVariable Long id) {
        subscriptionService.deleteSubscription(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Subscription deleted"));
    }

    @GetMapping("/{id}/resource-groups")
    public ResponseEntity<ApiResponse<List<ResourceGroupEntity>>> getResourceGroups(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(resourceGroupService.getResourceGroupsBySubscription(id)));
    }

    @GetMapping("/{id}/resources")
    public ResponseEntity<ApiResponse<List<ResourceView>>> getResources(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(resourceService.getResourcesBySubscription(id)));
    }
}
