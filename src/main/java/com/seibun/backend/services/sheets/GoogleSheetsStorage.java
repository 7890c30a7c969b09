package com.seibun.backend.services.sheets;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.List;

import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.sheets.v4.Sheets;
import com.google.api.services.sheets.v4.model.AddSheetRequest;
import com.google.api.services.sheets.v4.model.BatchUpdateSpreadsheetRequest;
import com.google.api.services.sheets.v4.model.GridProperties;
import com.google.api.services.sheets.v4.model.Request;
import com.google.api.services.sheets.v4.model.Sheet;
import com.google.api.services.sheets.v4.model.SheetProperties;
import com.google.api.services.sheets.v4.model.Spreadsheet;
import com.google.api.services.sheets.v4.model.UpdateValuesResponse;
import com.google.api.services.sheets.v4.model.ValueRange;
import com.google.auth.http.HttpCredentialsAdapter;
import com.google.auth.oauth2.GoogleCredentials;
import com.seibun.backend.config.SheetsProperties;
import com.seibun.backend.services.tables.records.LimitRecord;

import lombok.extern.slf4j.Slf4j;

/**
 * Appends records to a Google Sheets worksheet, creating the worksheet when it does not exist yet.
 */
@Slf4j
public class GoogleSheetsStorage implements SheetStorage {

    static final List<String> SCOPES = List.of(
            "https://www.googleapis.com/auth/spreadsheets",
            "https://www.googleapis.com/auth/drive.readonly",
            "https://www.googleapis.com/auth/drive.file"
    );

    private static final int NEW_SHEET_ROWS = 2000;
    private static final int NEW_SHEET_COLUMNS = 30;

    private final SheetsProperties sheetsProperties;
    private final SheetRowMapper rowMapper;
    private Sheets sheets;

    public GoogleSheetsStorage(SheetsProperties sheetsProperties, SheetRowMapper rowMapper) {
        this(sheetsProperties, rowMapper, null);
    }

    GoogleSheetsStorage(SheetsProperties sheetsProperties, SheetRowMapper rowMapper, Sheets sheets) {
        this.sheetsProperties = sheetsProperties;
        this.rowMapper = rowMapper;
        this.sheets = sheets;
    }

    @Override
    public AppendResult append(List<LimitRecord> records) {
        String spreadsheetId = sheetsProperties.getSpreadsheetId();
        String title = sheetsProperties.getSheetTitle();

        if (records == null || records.isEmpty()) {
            log.info("[Sheets] Nothing to append.");
            return AppendResult.nothing(title);
        }
        if (spreadsheetId == null || spreadsheetId.isBlank()) {
            throw new IllegalStateException("seibun.sheets.spreadsheet-id is not configured");
        }

        try {
            Sheets client = client();
            ensureWorksheet(client, spreadsheetId, title);

            int startRow = firstEmptyRow(client, spreadsheetId, title);
            List<List<Object>> rows = rowMapper.toRows(records);
            String range = SheetRowMapper.range(title, startRow, rows.size());

            UpdateValuesResponse response = client.spreadsheets().values()
                    .update(spreadsheetId, range, new ValueRange().setValues(rows))
                    .setValueInputOption("USER_ENTERED")
                    .execute();

            String written = response != null && response.getUpdatedRange() != null ? response.getUpdatedRange() : range;
            log.info("[Sheets] Appended {} row(s) to {}", rows.size(), written);
            return new AppendResult(title, rows.size(), written);
        } catch (IOException e) {
            throw new SheetStorageException("Failed to append to spreadsheet " + spreadsheetId + " / " + title, e);
        }
    }

    private void ensureWorksheet(Sheets client, String spreadsheetId, String title) throws IOException {
        Spreadsheet spreadsheet = client.spreadsheets().get(spreadsheetId)
                .setFields("sheets.properties.title")
                .execute();
        if (spreadsheet.getSheets() != null) {
            for (Sheet sheet : spreadsheet.getSheets()) {
                if (sheet.getProperties() != null && title.equals(sheet.getProperties().getTitle())) {
                    return;
                }
            }
        }

        log.info("[Sheets] Worksheet '{}' not found, creating it", title);
        Request addSheet = new Request().setAddSheet(new AddSheetRequest().setProperties(
                new SheetProperties()
                        .setTitle(title)
                        .setGridProperties(new GridProperties()
                                .setRowCount(NEW_SHEET_ROWS)
                                .setColumnCount(NEW_SHEET_COLUMNS))));
        client.spreadsheets()
                .batchUpdate(spreadsheetId, new BatchUpdateSpreadsheetRequest().setRequests(List.of(addSheet)))
                .execute();
    }

    /**
     * Row below the last row holding any value (1-based). Assumes the sheet has no gaps.
     */
    private int firstEmptyRow(Sheets client, String spreadsheetId, String title) throws IOException {
        ValueRange existing = client.spreadsheets().values()
                .get(spreadsheetId, SheetRowMapper.quoteTitle(title))
                .execute();
        List<List<Object>> values = existing == null ? null : existing.getValues();
        return (values == null ? 0 : values.size()) + 1;
    }

    private synchronized Sheets client() throws IOException {
        if (sheets != null) return sheets;
        try {
            sheets = new Sheets.Builder(
                    GoogleNetHttpTransport.newTrustedTransport(),
                    GsonFactory.getDefaultInstance(),
                    new HttpCredentialsAdapter(credentials()))
                    .setApplicationName(sheetsProperties.getApplicationName())
                    .build();
            return sheets;
        } catch (GeneralSecurityException e) {
            throw new SheetStorageException("Failed to create the HTTP transport for Google Sheets", e);
        }
    }

    private GoogleCredentials credentials() throws IOException {
        // Prefer an explicit service account key; otherwise ADC (GOOGLE_APPLICATION_CREDENTIALS / workload identity)
        String path = sheetsProperties.getServiceAccountJson() == null ? "" : sheetsProperties.getServiceAccountJson().trim();
        if (!path.isEmpty()) {
            Path p = Path.of(path);
            if (Files.exists(p)) {
                log.info("[Sheets] Using service account key '{}'", path);
                try (InputStream in = Files.newInputStream(p)) {
                    return GoogleCredentials.fromStream(in).createScoped(SCOPES);
                }
            }
            log.warn("[Sheets] Service account key not found: '{}' (using Application Default Credentials)", path);
        }
        return GoogleCredentials.getApplicationDefault().createScoped(SCOPES);
    }
}
