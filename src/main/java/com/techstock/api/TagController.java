package com.techstock.api;

import com.techstock.domain.model.TagIndex;
import com.techstock.domain.model.TagSuggestion;
import com.techstock.domain.service.TagIndexService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/tags")
@RequiredArgsConstructor
public class TagController {

    private final TagIndexService tagIndexService;

    @GetMapping
    public ResponseEntity<ApiResponse<TagIndex>> getAvailableTags() {
        return ResponseEntity.ok(ApiResponse.success(tagIndexService.getAvailableTags()));
    }

    @GetMapping("/suggestions")
    public ResponseEntity<ApiResponse<List<TagSuggestion>>> suggest(
            @RequestParam(name = "q", required = false, defaultValue = "") String query) {
        return ResponseEntity.ok(ApiResponse.success(tagIndexService.suggest(query)));
    }
}
