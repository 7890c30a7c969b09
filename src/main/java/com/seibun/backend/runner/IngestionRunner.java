package com.seibun.backend.runner;

import java.util.List;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.seibun.backend.services.IngestionReport;
import com.seibun.backend.services.IngestionRequest;
import com.seibun.backend.services.IngestionService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Command line entry: {@code [url] [--pages=2-12] [--source=pdf|html|auto]}.
 *
 * An empty extraction propagates as an exception so the process exits non-zero.
 */
@Component
@ConditionalOnProperty(name = "seibun.runner.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class IngestionRunner implements ApplicationRunner {

    private final IngestionService ingestionService;

    @Override
    public void run(ApplicationArguments args) {
        IngestionRequest request = toRequest(args);
        IngestionReport report = ingestionService.run(request);
        log.info("[Ingestion] {} tables -> {} records -> {} rows written",
                report.tablesExtracted(),
                report.pipelineResult().records().size(),
                report.appendResult().rowsWritten());
    }

    static IngestionRequest toRequest(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        String url = positional.isEmpty() ? null : positional.get(0);
        return new IngestionRequest(url, lastValue(args, "pages"), lastValue(args, "source"));
    }

    private static String lastValue(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) return null;
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }
}
