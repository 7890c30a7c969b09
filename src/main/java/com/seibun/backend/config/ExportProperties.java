package com.seibun.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

@Data
@ConfigurationProperties(prefix = "seibun.export")
public class ExportProperties {

    /**
     * Writes every synthesized record to {jsonDir}/{jsonFilename} before the sheet append.
     */
    private boolean saveJson = false;

    private String jsonDir = "./json_out";

    private String jsonFilename = "ccc_ALL.json";
}
