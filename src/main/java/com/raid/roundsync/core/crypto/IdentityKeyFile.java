package com.raid.roundsync.core.crypto;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the device identity from disk, generating and saving a new one on first use.
 *
 * <p>File format (java.util.Properties):</p>
 * <pre>
 * seed=&lt;64 hex&gt;
 * pubkey=&lt;64 hex&gt;
 * </pre>
 */
public final class IdentityKeyFile {

    private static final Logger log = LoggerFactory.getLogger(IdentityKeyFile.class);

    private IdentityKeyFile() {
    }

    public static IdentityKeys loadOrCreate(Path path) {
        try {
            if (Files.exists(path)) {
                Properties p = new Properties();
                try (Reader r = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                    p.load(r);
                }
                IdentityKeys keys = IdentityKeys.restore(p.getProperty("seed", ""), p.getProperty("pubkey", ""));
                log.info("Loaded identity {} from {}", keys.publicKeyHex(), path);
                return keys;
            }

            IdentityKeys keys = IdentityKeys.generate();
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Properties p = new Properties();
            p.setProperty("seed", keys.seedHex());
            p.setProperty("pubkey", keys.publicKeyHex());
            try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                p.store(w, "raid-round-sync device identity");
            }
            log.info("Generated new identity {} at {}", keys.publicKeyHex(), path);
            return keys;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read or write identity file " + path, e);
        }
    }
}
