package com.seibun.backend.services.extraction;

import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Downloads source documents. HTTP failures surface as Spring's RestClientException.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentFetcher {

    private final RestTemplate restTemplate;

    public byte[] fetchBytes(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url is empty");
        }

        long startMs = System.currentTimeMillis();
        ResponseEntity<byte[]> response = restTemplate.getForEntity(url.trim(), byte[].class);
        byte[] body = response.getBody();
        if (body == null || body.length == 0) {
            throw new DocumentFetchException("Empty response body from " + url + " status=" + response.getStatusCode());
        }

        log.info("[Fetch] {} bytes from {} in {}ms", body.length, url, System.currentTimeMillis() - startMs);
        return body;
    }
}
