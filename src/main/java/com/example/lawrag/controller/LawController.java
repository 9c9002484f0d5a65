package com.example.lawrag.controller;

import com.example.lawrag.application.service.CollectionService;
import com.example.lawrag.application.service.LawRagService;
import com.example.lawrag.application.service.LawRagService.LawDescriptor;
import com.example.lawrag.controller.exception.BusinessException;
import com.example.lawrag.domain.dto.CollectionStats;
import com.example.lawrag.domain.dto.IngestResponse;
import com.example.lawrag.domain.dto.ResponseData;
import com.example.lawrag.domain.model.SupportedCountry;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/v1")
public class LawController {

    private static final Logger log = LoggerFactory.getLogger(LawController.class);

    static final int MIN_UPLOAD_BYTES = 1000;

    private final LawRagService lawRagService;
    private final CollectionService collectionService;

    public LawController(LawRagService lawRagService, CollectionService collectionService) {
        this.lawRagService = lawRagService;
        this.collectionService = collectionService;
    }

    @PostMapping(
            path = "/ingest",
            consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public ResponseEntity<ResponseData<IngestResponse>> ingest(
            @RequestPart("file") MultipartFile file,
            @RequestParam("country") String country,
            @RequestParam("law_type") String lawType,
            @RequestParam("law_name") String lawName,
            @RequestParam(value = "law_name_en", required = false) String lawNameEn,
            @RequestParam(value = "law_number", required = false) String lawNumber,
            @RequestParam(value = "law_year", required = false) Integer lawYear
    ) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("file is required");
        }
        String filename = file.getOriginalFilename() == null ? "upload.pdf" : file.getOriginalFilename();
        if (!filename.toLowerCase().endsWith(".pdf")) {
            throw new IllegalArgumentException("Only PDF uploads are supported");
        }
        if (file.getSize() < MIN_UPLOAD_BYTES) {
            throw new IllegalArgumentException("File is too small to be a valid PDF");
        }
        if (!StringUtils.hasText(lawName)) {
            throw new IllegalArgumentException("law_name is required");
        }

        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read PDF upload", e);
        }

        log.info("event=api_ingest file={} bytes={} country={} lawType={}", filename, bytes.length, country, lawType);
        IngestResponse result = lawRagService.ingest(bytes, filename,
                new LawDescriptor(country, lawType, lawName, lawNameEn, lawNumber, lawYear));

        ResponseData<IngestResponse> response = ResponseData.<IngestResponse>builder()
                .status(HttpStatus.CREATED.value())
                .message("Law ingested successfully")
                .data(result)
                .build();
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/laws")
    public ResponseData<List<CollectionStats>> listLaws() {
        return ResponseData.<List<CollectionStats>>builder()
                .status(HttpStatus.OK.value())
                .message("OK")
                .data(collectionService.listCountryCollections())
                .build();
    }

    @GetMapping("/laws/{country}")
    public ResponseData<CollectionStats> countryStats(@PathVariable("country") String country) {
        SupportedCountry c = CollectionService.requireCountry(country);
        CollectionStats stats = collectionService.stats(c)
                .orElseThrow(() -> new BusinessException(HttpStatus.NOT_FOUND,
                        "No collection exists for country: " + c.code()));
        return ResponseData.<CollectionStats>builder()
                .status(HttpStatus.OK.value())
                .message("OK")
                .data(stats)
                .build();
    }

    @DeleteMapping("/laws/{country}")
    public ResponseData<Map<String, Object>> deleteCountry(@PathVariable("country") String country) {
        SupportedCountry c = CollectionService.requireCountry(country);
        if (!collectionService.deleteCountryCollection(c)) {
            throw new BusinessException(HttpStatus.NOT_FOUND, "No collection exists for country: " + c.code());
        }
        return ResponseData.<Map<String, Object>>builder()
                .status(HttpStatus.OK.value())
                .message("Collection deleted")
                .data(Map.of("country", c.code(), "collection_name", CollectionService.collectionName(c.code())))
                .build();
    }

    @PostMapping("/laws/{country}/reset")
    public ResponseData<Map<String, Object>> resetCountry(@PathVariable("country") String country) {
        SupportedCountry c = CollectionService.requireCountry(country);
        String name = collectionService.resetCountryCollection(c);
        return ResponseData.<Map<String, Object>>builder()
                .status(HttpStatus.OK.value())
                .message("Collection reset")
                .data(Map.of("country", c.code(), "collection_name", name))
                .build();
    }
}
