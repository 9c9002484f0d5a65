package com.example.lawrag.controller;

import com.example.lawrag.application.service.LawRagService;
import com.example.lawrag.domain.dto.QueryRequest;
import com.example.lawrag.domain.dto.QueryResponse;
import com.example.lawrag.domain.dto.ResponseData;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
public class QueryController {

    private final LawRagService lawRagService;

    public QueryController(LawRagService lawRagService) {
        this.lawRagService = lawRagService;
    }

    @PostMapping(
            path = "/query",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public ResponseData<QueryResponse> query(@Valid @RequestBody QueryRequest request) {
        return ResponseData.<QueryResponse>builder()
                .status(HttpStatus.OK.value())
                .message("OK")
                .data(lawRagService.ask(request))
                .build();
    }
}
