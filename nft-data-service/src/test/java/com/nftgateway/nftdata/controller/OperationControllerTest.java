package com.nftgateway.nftdata.controller;

import com.nftgateway.nftdata.model.ErrorPayload;
import com.nftgateway.nftdata.model.PagedResult;
import com.nftgateway.nftdata.model.Pagination;
import com.nftgateway.nftdata.service.RequestOrchestrator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class OperationControllerTest {

    private static final String OWNER = "0x00000000000000000000000000000000000000aa";

    private final RequestOrchestrator orchestrator = mock(RequestOrchestrator.class);
    private final WebTestClient client = WebTestClient.bindToController(new OperationController(orchestrator)).build();

    @Test
    @DisplayName("POST operation → orchestrator payload with 200")
    void invokeOperation() {
        when(orchestrator.handle("getShapeNft", OWNER, "cur", 20))
            .thenReturn(Mono.just(new PagedResult(List.of(), new Pagination(20, true, "n", 0), 7, null)));

        client.post().uri("/api/v1/operations/getShapeNft")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"identityParam\":\"" + OWNER + "\",\"paginationCursor\":\"cur\",\"pageSize\":20}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.totalCount").isEqualTo(7)
            .jsonPath("$.pagination.hasNextPage").isEqualTo(true)
            .jsonPath("$.pagination.nextPageKey").isEqualTo("n")
            .jsonPath("$.summary").doesNotExist();
    }

    @Test
    @DisplayName("error payloads are still 200")
    void errorPayloadIsOk() {
        when(orchestrator.handle(anyString(), anyString(), any(), any()))
            .thenReturn(Mono.just(ErrorPayload.of("Error fetching data: boom", OWNER, Instant.parse("2025-01-01T00:00:00Z"))));

        client.get().uri("/api/v1/nft/{address}", OWNER)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.error").isEqualTo(true)
            .jsonPath("$.message").isEqualTo("Error fetching data: boom")
            .jsonPath("$.identityParam").isEqualTo(OWNER);
    }

    @Test
    @DisplayName("absent pageSize is passed as null so the default applies downstream")
    void defaultPageSize() {
        when(orchestrator.handle(anyString(), anyString(), any(), any()))
            .thenReturn(Mono.just(new PagedResult(List.of(), new Pagination(100, false, null, 0), 0, null)));

        client.get().uri("/api/v1/nft/{address}", OWNER).exchange().expectStatus().isOk();

        verify(orchestrator).handle(eq("getShapeNft"), eq(OWNER), isNull(), isNull());
    }

    @Test
    @DisplayName("pageSize outside 1..100 → 400, orchestrator not called")
    void pageSizeOutOfRange() {
        client.get().uri("/api/v1/nft/{address}?pageSize=0", OWNER).exchange().expectStatus().isBadRequest();
        client.get().uri("/api/v1/nft/{address}?pageSize=101", OWNER).exchange().expectStatus().isBadRequest();

        verifyNoInteractions(orchestrator);
    }

    @Test
    @DisplayName("missing identityParam → 400")
    void missingIdentity() {
        client.post().uri("/api/v1/operations/getShapeNft")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"pageSize\":10}")
            .exchange()
            .expectStatus().isBadRequest();

        verifyNoInteractions(orchestrator);
    }
}
