package com.seibun.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Destination spreadsheet. Prefix "seibun.sheets".
 */
@Data
@ConfigurationProperties(prefix = "seibun.sheets")
public class SheetsProperties {

    /**
     * When false records are only logged (dry run) and nothing is written.
     */
    private boolean enabled = false;

    private String spreadsheetId = "";

    /**
     * Worksheet the rows are appended to; created when missing.
     */
    private String sheetTitle = "更新情報一覧";

    /**
     * Optional service account key. If empty or missing, Application Default Credentials are used.
     */
    private String serviceAccountJson = "./service_account.json";

    private String applicationName = "seibun-sync";

    /**
     * Zone used for the date column.
     */
    private String timeZone = "Asia/Tokyo";
}
