package com.techstock.api;

import com.techstock.domain.exception.InvalidInputException;
import com.techstock.domain.model.ImportReport;
import com.techstock.domain.service.ResourceImportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;

/**
 * POST /api/v1/import with a multipart {@code file} part holding the CSV export.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/import")
@RequiredArgsConstructor
public class ImportController {

    private final ResourceImportService importService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<ImportReport>> importCsv(@RequestParam("file") MultipartFile file) {
        if (file.isEmpty()) {
            throw new InvalidInputException("CSV file is empty");
        }
        log.info("Import requested: {} ({} bytes)", file.getOriginalFilename(), file.getSize());

        try (InputStream input = file.getInputStream()) {
            return ResponseEntity.ok(ApiResponse.success(importService.importCsv(input), "Import finished"));
        } catch (IOException e) {
            throw new InvalidInputException("Cannot read uploaded file: " + e.getMessage());
        }
    }
}
