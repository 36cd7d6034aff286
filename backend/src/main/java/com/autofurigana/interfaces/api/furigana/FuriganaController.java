package com.autofurigana.interfaces.api.furigana;

import com.autofurigana.application.furigana.FuriganaAppService;
import com.autofurigana.application.furigana.FuriganaSettings;
import com.autofurigana.domain.furigana.model.AlignedSegment;
import com.autofurigana.domain.furigana.model.FuriganaResult;
import com.autofurigana.interfaces.api.dto.AnnotateRequest;
import com.autofurigana.interfaces.api.dto.AnnotateResponse;
import com.autofurigana.interfaces.api.dto.SegmentsRequest;
import com.autofurigana.interfaces.api.dto.SegmentsResponse;
import com.autofurigana.interfaces.api.dto.SelectionDto;
import com.autofurigana.interfaces.api.dto.SettingsRequest;
import com.autofurigana.interfaces.api.dto.SettingsResponse;
import com.autofurigana.interfaces.api.dto.TokenizerStatusResponse;
import com.autofurigana.interfaces.api.dto.ViewportRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/furigana")
@RequiredArgsConstructor
public class FuriganaController {

    private final FuriganaAppService furiganaAppService;
    private final FuriganaSettings furiganaSettings;

    @PostMapping
    public ResponseEntity<AnnotateResponse> annotate(@Valid @RequestBody AnnotateRequest request) {
        FuriganaResult result = furiganaAppService.annotate(
                request.text(),
                request.notationStyle(),
                SelectionDto.toSelections(request.selections()),
                !Boolean.FALSE.equals(request.skipCodeRegions()),
                Boolean.TRUE.equals(request.waitForTokenizer()));

        String html = Boolean.TRUE.equals(request.includeHtml())
                ? furiganaAppService.renderHtml(result)
                : null;
        return ResponseEntity.ok(AnnotateResponse.from(result, html));
    }

    @PostMapping("/viewport")
    public ResponseEntity<AnnotateResponse> viewport(@Valid @RequestBody ViewportRequest request) {
        FuriganaResult result = furiganaAppService.viewport(
                request.text(),
                request.toVisibleRanges(),
                SelectionDto.toSelections(request.selections()),
                request.notationStyle());
        return ResponseEntity.ok(AnnotateResponse.from(result, null));
    }

    @PostMapping("/segments")
    public ResponseEntity<SegmentsResponse> segments(@Valid @RequestBody SegmentsRequest request) {
        AlignedSegment segment = furiganaAppService.segments(
                request.text(), Boolean.TRUE.equals(request.waitForTokenizer()));
        return ResponseEntity.ok(new SegmentsResponse(segment.baseChunks(), segment.readingChunks()));
    }

    @GetMapping("/settings")
    public ResponseEntity<SettingsResponse> getSettings() {
        return ResponseEntity.ok(SettingsResponse.from(furiganaSettings.get()));
    }

    @PutMapping("/settings")
    public ResponseEntity<SettingsResponse> updateSettings(@Valid @RequestBody SettingsRequest request) {
        FuriganaSettings.Snapshot next = furiganaSettings.update(
                request.editingMode(), request.readingMode(), request.notationStyle());
        return ResponseEntity.ok(SettingsResponse.from(next));
    }

    @GetMapping("/tokenizer")
    public ResponseEntity<TokenizerStatusResponse> tokenizerStatus() {
        return ResponseEntity.ok(new TokenizerStatusResponse(furiganaAppService.isTokenizerReady()));
    }

    @PostMapping("/tokenizer")
    public ResponseEntity<TokenizerStatusResponse> startTokenizer() {
        furiganaAppService.startTokenizer();
        return ResponseEntity.accepted().body(new TokenizerStatusResponse(furiganaAppService.isTokenizerReady()));
    }
}
