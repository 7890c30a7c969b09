package com.seibun.backend.runner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import com.seibun.backend.services.IngestionReport;
import com.seibun.backend.services.IngestionRequest;
import com.seibun.backend.services.IngestionService;
import com.seibun.backend.services.extraction.SourceKind;
import com.seibun.backend.services.sheets.AppendResult;
import com.seibun.backend.services.tables.ExtractionEmptyException;
import com.seibun.backend.services.tables.PipelineResult;

class IngestionRunnerTest {

    @Test
    void readsUrlAndOptions() {
        IngestionRequest request = IngestionRunner.toRequest(new DefaultApplicationArguments(
                "https://example.test/a.pdf", "--pages=2-12", "--source=pdf"));

        assertEquals("https://example.test/a.pdf", request.url());
        assertEquals("2-12", request.pages());
        assertEquals("pdf", request.source());
    }

    @Test
    void missingArgumentsFallBackToNull() {
        IngestionRequest request = IngestionRunner.toRequest(new DefaultApplicationArguments());

        assertNull(request.url());
        assertNull(request.pages());
        assertNull(request.source());
    }

    @Test
    void lastRepeatedOptionWins() {
        IngestionRequest request = IngestionRunner.toRequest(new DefaultApplicationArguments(
                "--pages=1", "--pages=3-4"));

        assertEquals("3-4", request.pages());
    }

    @Test
    void runDelegatesToService() {
        IngestionService service = mock(IngestionService.class);
        when(service.run(any())).thenReturn(new IngestionReport("u", SourceKind.PDF, 1,
                new PipelineResult(List.of(), 1, 0), null, AppendResult.nothing("")));

        new IngestionRunner(service).run(new DefaultApplicationArguments("u"));

        verify(service).run(new IngestionRequest("u", null, null));
    }

    @Test
    void emptyExtractionPropagates() {
        IngestionService service = mock(IngestionService.class);
        when(service.run(any())).thenThrow(new ExtractionEmptyException("No tables were detected."));

        assertThrows(ExtractionEmptyException.class,
                () -> new IngestionRunner(service).run(new DefaultApplicationArguments()));
    }
}
