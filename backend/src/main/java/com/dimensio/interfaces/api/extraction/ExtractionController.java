package com.dimensio.interfaces.api.extraction;

import com.dimensio.application.extraction.ExtractionAppService;
import com.dimensio.domain.extraction.model.ParseResult;
import com.dimensio.interfaces.api.dto.LocalesResponse;
import com.dimensio.interfaces.api.dto.ParseRequest;
import com.dimensio.interfaces.api.dto.ParseResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/parse")
@RequiredArgsConstructor
public class ExtractionController {

    private final ExtractionAppService extractionAppService;

    @PostMapping
    public ResponseEntity<ParseResponse> parse(@Valid @RequestBody ParseRequest request) {
        ParseResult result = extractionAppService.parse(
                request.text(),
                request.locale(),
                request.referenceTime(),
                request.zone(),
                request.dims());

        return ResponseEntity.ok(ParseResponse.from(result));
    }

    @GetMapping("/locales")
    public ResponseEntity<LocalesResponse> getLocales() {
        return ResponseEntity.ok(new LocalesResponse(
                extractionAppService.supportedLocales(), extractionAppService.getMaxTextLength()));
    }
}
