package com.nftgateway.nftdata.controller;

import com.nftgateway.nftdata.model.OperationRequest;
import com.nftgateway.nftdata.model.OperationResponse;
import com.nftgateway.nftdata.operation.ShapeNftOperation;
import com.nftgateway.nftdata.service.RequestOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * HTTP entry points. Every orchestrator answer, including error payloads, is a 200; only
 * malformed input is rejected here.
 */
@RestController
@RequestMapping("/api/v1")
public class OperationController {

    static final int MIN_PAGE_SIZE = 1;
    static final int MAX_PAGE_SIZE = 100;

    private final RequestOrchestrator orchestrator;

    public OperationController(RequestOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/operations/{operationName}")
    public Mono<ResponseEntity<OperationResponse>> invoke(
            @PathVariable String operationName,
            @RequestBody OperationRequest request) {
        if (request.identityParam() == null || request.identityParam().isBlank()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "identityParam is required"));
        }
        if (!validPageSize(request.pageSize())) {
            return Mono.error(pageSizeError());
        }
        return orchestrator.handle(operationName, request.identityParam(),
                                   request.paginationCursor(), request.pageSize())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/nft/{address}")
    public Mono<ResponseEntity<OperationResponse>> shapeNft(
            @PathVariable String address,
            @RequestParam(required = false) String pageKey,
            @RequestParam(required = false) Integer pageSize) {
        if (!validPageSize(pageSize)) {
            return Mono.error(pageSizeError());
        }
        return orchestrator.handle(ShapeNftOperation.NAME, address, pageKey, pageSize)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private static boolean validPageSize(Integer pageSize) {
        return pageSize == null || (pageSize >= MIN_PAGE_SIZE && pageSize <= MAX_PAGE_SIZE);
    }

    private static ResponseStatusException pageSizeError() {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST,
            "pageSize must be between " + MIN_PAGE_SIZE + " and " + MAX_PAGE_SIZE);
    }
}
