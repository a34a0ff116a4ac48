package com.nftgateway.nftdata.operation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nftgateway.nftdata.client.AlchemyNftWebClient;
import com.nftgateway.nftdata.model.AlchemyOwnedNftsResponse;
import com.nftgateway.nftdata.model.AlchemyOwnedNftsResponse.Contract;
import com.nftgateway.nftdata.model.AlchemyOwnedNftsResponse.Image;
import com.nftgateway.nftdata.model.AlchemyOwnedNftsResponse.OwnedNft;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ShapeNftOperationTest {

    private static final String OWNER = "0x00000000000000000000000000000000000000aa";

    private final AlchemyNftWebClient client = mock(AlchemyNftWebClient.class);
    private final ShapeNftOperation operation = new ShapeNftOperation(client, new ObjectMapper());

    private static OwnedNft nft(String contract, String collection, String tokenId, String name, Image image) {
        return new OwnedNft(new Contract(contract, collection), tokenId, name, image);
    }

    @Test
    @DisplayName("declares its name and a 10 minute TTL")
    void nameAndTtl() {
        assertEquals("getShapeNft", operation.name());
        assertEquals(Duration.ofMinutes(10), operation.cacheTtl().orElseThrow());
    }

    @Test
    @DisplayName("items are reduced to tokenId, contract, name and best image URL")
    void itemMapping() {
        AlchemyOwnedNftsResponse response = new AlchemyOwnedNftsResponse(List.of(
            nft("0xc1", "Shapes", "1", "Shape #1", new Image("https://img/orig.png", "https://img/thumb.png")),
            nft("0xc1", "Shapes", "2", null, new Image(null, "https://img/thumb2.png")),
            nft("0xc2", null, "7", "Other", null)
        ), 12, "page-2");
        when(client.getNftsForOwner(OWNER, null, 3)).thenReturn(Mono.just(response));

        StepVerifier.create(operation.fetchPage(OWNER, null, 3))
            .assertNext(page -> {
                assertEquals(3, page.items().size());
                assertEquals("page-2", page.nextCursor());
                assertEquals(12, page.totalCount());

                JsonNode first = page.items().get(0);
                assertEquals("1", first.get("tokenId").asText());
                assertEquals("0xc1", first.get("contractAddress").asText());
                assertEquals("Shape #1", first.get("name").asText());
                assertEquals("https://img/orig.png", first.get("imageUrl").asText());

                assertTrue(page.items().get(1).get("name").isNull());
                assertEquals("https://img/thumb2.png", page.items().get(1).get("imageUrl").asText());
                assertTrue(page.items().get(2).get("imageUrl").isNull());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("summary counts NFTs per collection in first-seen order")
    void collectionSummary() {
        AlchemyOwnedNftsResponse response = new AlchemyOwnedNftsResponse(List.of(
            nft("0xc1", "Shapes", "1", null, null),
            nft("0xc2", "Others", "5", null, null),
            nft("0xc1", "Shapes", "2", null, null)
        ), null, null);

        UpstreamPage page = operation.toPage(response);

        JsonNode summary = page.summary();
        assertEquals(2, summary.size());
        assertEquals("0xc1", summary.get(0).get("contractAddress").asText());
        assertEquals("Shapes", summary.get(0).get("name").asText());
        assertEquals(2, summary.get(0).get("ownedCount").asInt());
        assertEquals(1, summary.get(1).get("ownedCount").asInt());
        assertNull(page.nextCursor());
    }

    @Test
    @DisplayName("empty page → no items and no summary")
    void emptyPage() {
        UpstreamPage page = operation.toPage(new AlchemyOwnedNftsResponse(null, 0, null));

        assertTrue(page.items().isEmpty());
        assertNull(page.summary());
    }

    @Test
    @DisplayName("empty upstream body → error signal for the retrier to classify")
    void emptyBody() {
        when(client.getNftsForOwner(OWNER, "k", 100)).thenReturn(Mono.empty());

        StepVerifier.create(operation.fetchPage(OWNER, "k", 100))
            .expectError(IllegalStateException.class)
            .verify();
    }
}
