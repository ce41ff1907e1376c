package com.zerodayguardian.passwordrisk.wordlist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.function.Consumer;

/**
 * Streams line-delimited text resources (breach corpora, word lists).
 *
 * <p>
 * Lines are trimmed and lowercased; blank lines and lines starting with
 * {@code #} are skipped. Malformed UTF-8 is replaced rather than rejected.
 * </p>
 *
 * @author Naveed Gung
 */
public final class LineResources {

    private static final Logger log = LoggerFactory.getLogger(LineResources.class);

    private LineResources() {
    }

    /**
     * Feed every entry of the resource to the sink.
     *
     * <p>
     * A missing resource yields nothing. A read error stops the stream but
     * keeps the entries already delivered.
     * </p>
     *
     * @param resource the resource to read
     * @param sink     receives each normalized entry
     * @return number of entries delivered
     */
    public static int stream(Resource resource, Consumer<String> sink) {
        if (!resource.exists()) {
            log.warn("Resource {} not found, skipping", resource.getDescription());
            return 0;
        }

        int count = 0;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String entry = line.strip();
                if (entry.isEmpty() || entry.startsWith("#")) {
                    continue;
                }
                sink.accept(entry.toLowerCase(Locale.ROOT));
                count++;
            }
        } catch (IOException e) {
            log.warn("Read of {} stopped after {} entries: {}", resource.getDescription(), count, e.getMessage());
        }
        return count;
    }
}
