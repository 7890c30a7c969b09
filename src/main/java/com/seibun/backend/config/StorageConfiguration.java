package com.seibun.backend.config;

import java.time.Clock;
import java.time.ZoneId;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.seibun.backend.services.sheets.DisabledSheetStorage;
import com.seibun.backend.services.sheets.GoogleSheetsStorage;
import com.seibun.backend.services.sheets.SheetRowMapper;
import com.seibun.backend.services.sheets.SheetStorage;

import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
public class StorageConfiguration {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock(SheetsProperties sheetsProperties) {
        String zone = sheetsProperties.getTimeZone();
        return Clock.system(zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone));
    }

    @Bean
    public SheetRowMapper sheetRowMapper(Clock clock) {
        return new SheetRowMapper(clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "seibun.sheets", name = "enabled", havingValue = "true")
    public SheetStorage googleSheetsStorage(SheetsProperties sheetsProperties, SheetRowMapper sheetRowMapper) {
        log.info("[Sheets] Enabled: spreadsheetId='{}' sheet='{}' key='{}'",
                safe(sheetsProperties.getSpreadsheetId()),
                safe(sheetsProperties.getSheetTitle()),
                safe(sheetsProperties.getServiceAccountJson()));
        return new GoogleSheetsStorage(sheetsProperties, sheetRowMapper);
    }

    @Bean
    @ConditionalOnMissingBean(SheetStorage.class)
    public SheetStorage disabledSheetStorage() {
        log.info("[Sheets] Disabled (seibun.sheets.enabled=false)");
        return new DisabledSheetStorage();
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
