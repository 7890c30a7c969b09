package com.seibun.backend.services.export;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.seibun.backend.config.ExportProperties;
import com.seibun.backend.services.tables.records.LimitRecord;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Optional JSON dump of every record of a run, for checking a run before trusting the sheet.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JsonRecordExporter {

    private final ObjectMapper objectMapper;
    private final ExportProperties exportProperties;

    public boolean isEnabled() {
        return exportProperties.isSaveJson();
    }

    public Path export(List<LimitRecord> records) {
        Path target = Path.of(exportProperties.getJsonDir(), exportProperties.getJsonFilename());
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(records);
            Files.write(target, json);
            log.info("[Export] Saved {} record(s) to {}", records.size(), target.toAbsolutePath());
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write JSON records to " + target, e);
        }
    }
}
