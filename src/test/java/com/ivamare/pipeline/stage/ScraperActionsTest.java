package com.ivamare.pipeline.stage;

import com.ivamare.pipeline.handler.ActionContext;
import com.ivamare.pipeline.model.ActionMessage;
import com.ivamare.pipeline.model.OutboundMessage;
import com.ivamare.pipeline.model.QueueMessage;
import com.ivamare.pipeline.queue.QueueNames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ScraperActions")
class ScraperActionsTest {

    @Mock
    private IngestionService ingestionService;

    @Mock
    private DocumentSource documentSource;

    private ScraperActions actions;
    private ActionContext context;

    @BeforeEach
    void setUp() {
        actions = new ScraperActions(ingestionService, documentSource);
        QueueMessage delivery = new QueueMessage("1", "1:1", Map.of(), 1, Instant.now(), Instant.now().plusSeconds(1800));
        context = new ActionContext(QueueNames.SCRAPER_QUEUE, delivery, 5, null);
    }

    @Nested
    @DisplayName("e_ingest")
    class IngestTests {

        @Test
        @DisplayName("should forward new and updated documents as separate work items")
        void shouldForwardNewAndUpdated() throws Exception {
            Map<String, Object> trigger = Map.of("offset", 0, "date_since_days", 2);
            when(ingestionService.ingest(trigger))
                .thenReturn(new IngestionResult(List.of("b1", "b2"), List.of("b3")));

            actions.ingest(new ActionMessage(PipelineActions.INGEST, trigger), context);

            List<OutboundMessage> outbound = context.outbound();
            assertEquals(2, outbound.size());
            assertThat(outbound).extracting(OutboundMessage::queueName).containsOnly(QueueNames.NLP_QUEUE);
            assertEquals(PipelineActions.EVENT_EXTRACTOR, outbound.get(0).message().action());
            assertEquals(Map.of("ids", List.of("b1", "b2"), "type", PipelineActions.TYPE_NEW),
                outbound.get(0).message().payload());
            assertEquals(Map.of("ids", List.of("b3"), "type", PipelineActions.TYPE_UPDATED),
                outbound.get(1).message().payload());
        }

        @Test
        @DisplayName("should forward nothing when nothing changed")
        void shouldForwardNothingWhenEmpty() throws Exception {
            when(ingestionService.ingest(any())).thenReturn(IngestionResult.empty());

            actions.ingest(ActionMessage.of(PipelineActions.INGEST), context);

            assertTrue(context.outbound().isEmpty());
        }

        @Test
        @DisplayName("should propagate ingestion failures so the trigger is redelivered")
        void shouldPropagateFailure() throws Exception {
            when(ingestionService.ingest(any())).thenThrow(new IOException("source unreachable"));

            assertThrows(IOException.class, () -> actions.ingest(ActionMessage.of(PipelineActions.INGEST), context));
            assertTrue(context.outbound().isEmpty());
        }
    }

    @Nested
    @DisplayName("e_chunk_urls")
    class ChunkUrlsTests {

        @Test
        @DisplayName("should split the listing into chunks on the scraper queue")
        void shouldChunkUrls() throws Exception {
            List<String> urls = IntStream.range(0, 1201).mapToObj(i -> "https://example.org/bill/" + i)
                .collect(Collectors.toList());
            when(documentSource.listUrls(any())).thenReturn(urls);

            actions.chunkUrls(new ActionMessage(PipelineActions.CHUNK_URLS, Map.of("session", "2024")), context);

            List<OutboundMessage> outbound = context.outbound();
            assertEquals(3, outbound.size());
            assertThat(outbound).extracting(OutboundMessage::queueName).containsOnly(QueueNames.SCRAPER_QUEUE);
            assertThat(outbound).extracting(o -> o.message().action()).containsOnly(PipelineActions.INGEST_BILLS);
            assertThat((List<?>) outbound.get(0).message().payload().get("urls")).hasSize(ScraperActions.URL_CHUNK_SIZE);
            assertThat((List<?>) outbound.get(2).message().payload().get("urls")).hasSize(201);
            assertEquals("2024", outbound.get(2).message().payload().get("session"));
        }

        @Test
        @DisplayName("should fail without a document source")
        void shouldFailWithoutSource() {
            ScraperActions withoutSource = new ScraperActions(ingestionService, null);

            assertThrows(IllegalStateException.class, () ->
                withoutSource.chunkUrls(ActionMessage.of(PipelineActions.CHUNK_URLS), context));
        }
    }

    @Nested
    @DisplayName("e_ingest_bills")
    class IngestBillsTests {

        @Test
        @DisplayName("should ingest the chunk and forward the results")
        void shouldIngestChunk() throws Exception {
            when(ingestionService.ingestUrls(List.of("u1", "u2")))
                .thenReturn(new IngestionResult(List.of("b1"), List.of()));

            actions.ingestBills(new ActionMessage(PipelineActions.INGEST_BILLS, Map.of("urls", List.of("u1", "u2"))),
                context);

            assertEquals(1, context.outbound().size());
            assertEquals(QueueNames.NLP_QUEUE, context.outbound().get(0).queueName());
        }

        @Test
        @DisplayName("should skip chunks without URLs")
        void shouldSkipEmptyChunk() throws Exception {
            actions.ingestBills(ActionMessage.of(PipelineActions.INGEST_BILLS), context);

            verifyNoInteractions(ingestionService);
            assertTrue(context.outbound().isEmpty());
        }
    }
}
