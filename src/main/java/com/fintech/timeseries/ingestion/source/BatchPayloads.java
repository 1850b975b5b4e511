package com.fintech.timeseries.ingestion.source;

import com.fintech.timeseries.ingestion.BatchValidationException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Turns a downloaded batch payload into CSV text. Upstream publishes either
 * plain CSV or a ZIP archive holding a single CSV file.
 */
final class BatchPayloads {

    private static final byte[] ZIP_MAGIC = {0x50, 0x4B, 0x03, 0x04};

    private BatchPayloads() {
    }

    static String decode(String batchName, byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new BatchValidationException("Empty payload for batch " + batchName);
        }
        if (!isZip(payload)) {
            return new String(payload, StandardCharsets.UTF_8);
        }
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(payload))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (!entry.isDirectory() && entry.getName().toLowerCase(Locale.ROOT).endsWith(".csv")) {
                    return new String(zip.readAllBytes(), StandardCharsets.UTF_8);
                }
            }
        } catch (IOException e) {
            throw new BatchValidationException("Corrupt archive " + batchName + ": " + e.getMessage(), e);
        }
        throw new BatchValidationException("No CSV entry in archive " + batchName);
    }

    private static boolean isZip(byte[] payload) {
        if (payload.length < ZIP_MAGIC.length) {
            return false;
        }
        for (int i = 0; i < ZIP_MAGIC.length; i++) {
            if (payload[i] != ZIP_MAGIC[i]) {
                return false;
            }
        }
        return true;
    }
}
