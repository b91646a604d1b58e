package com.techstock.api;

import com.techstock.domain.exception.NotFoundException;
import com.techstock.domain.model.CreateApplicationRequest;
import com.techstock.domain.model.PaginationParams;
import com.techstock.domain.model.ResourceView;
import com.techstock.domain.model.UpdateApplicationRequest;
import com.techstock.domain.service.ApplicationService;
import com.techstock.domain.service.ResourceService;
import com.techstock.infrastructure.persistence.entity.ApplicationEntity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/applications")
@RequiredArgsConstructor
public class ApplicationController {

    private final ApplicationService applicationService;
    private final ResourceService resourceService;

    @GetMapping
    public ResponseEntity<PaginatedResponse<ApplicationEntity>> listApplications(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size) {
        return ResponseEntity.ok(PaginatedResponse.of(
                applicationService.listApplications(PaginationParams.of(page, size))));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ApplicationEntity>> getApplication(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(applicationService.getApplication(id)));
    }

    @GetMapping("/by-code/{code}")
    public ResponseEntity<ApiResponse<ApplicationEntity>> getApplicationByCode(@PathVariable String code) {
        ApplicationEntity application = applicationService.findByCode(code)
                .orElseThrow(() -> new NotFoundException("Application", code));
        return ResponseEntity.ok(ApiResponse.success(application));
    }

    @GetMapping("/by-owner")
    public ResponseEntity<ApiResponse<List<ApplicationEntity>>> getApplicationsByOwner(
            @RequestParam String email) {
        return ResponseEntity.ok(ApiResponse.success(applicationService.findByOwnerEmail(email)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ApplicationEntity>> createApplication(
            @Valid @RequestBody CreateApplicationRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(applicationService.createApplication(request), "Application created"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<ApplicationEntity>> updateApplication(
            @PathVariable Long id,
            @Valid @RequestBody UpdateApplicationRequest request) {
        return ResponseEntity.ok(ApiResponse.success(
                applicationService.updateApplication(id, request), "Application updated"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteApplication(@PathVariable Long id) {
        applicationService.deleteApplication(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Application deleted"));
    }

    @GetMapping("/{id}/resources")
    public ResponseEntity<ApiResponse<List<ResourceView>>> getResources(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(resourceService.getResourcesByApplication(id)));
    }
}
