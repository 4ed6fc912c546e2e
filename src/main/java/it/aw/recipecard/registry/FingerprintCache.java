package it.aw.recipecard.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Cache delle impronte delle ricette indicizzate: titolo → SHA-256 del contenuto.
 * <p>
 * Formato su disco: una sequenza di record {@code titolo UTF-8, '\n', 32 byte di digest},
 * senza prefissi di lunghezza. Il file viene riscritto per intero a ogni salvataggio;
 * una scrittura interrotta lascia un file troncato, che al caricamento successivo
 * viene trattato come cache vuota (re-indicizzazione completa).
 */
@Component
public class FingerprintCache {

    private static final Logger log = LoggerFactory.getLogger(FingerprintCache.class);

    public static final int DIGEST_LENGTH = 32;

    private final Path path;

    public FingerprintCache(@Value("${store.fingerprint.file}") String path) {
        this.path = Paths.get(path).toAbsolutePath();
    }

    public Path getPath() {
        return path;
    }

    /**
     * Carica la cache. Non fallisce mai: file assente, illeggibile o troncato
     * restituiscono una mappa vuota.
     */
    public Map<String, byte[]> load() {
        try (InputStream is = new BufferedInputStream(Files.newInputStream(path))) {
            Map<String, byte[]> fingerprints = read(is);
            log.debug("FingerprintCache: {} impronte caricate da {}", fingerprints.size(), path);
            return fingerprints;
        } catch (NoSuchFileException e) {
            log.info("FingerprintCache: file {} non trovato, indicizzazione completa.", path);
            return new HashMap<>();
        } catch (IOException e) {
            log.warn("FingerprintCache: impossibile leggere {} ({}), indicizzazione completa.",
                    path, e.getMessage());
            return new HashMap<>();
        }
    }

    /**
     * Sovrascrive il file con le impronte date, in ordine di titolo.
     * I titoli che contengono '\n' vengono saltati con un warning.
     *
     * @throws IOException se il file o la cartella non possono essere scritti
     */
    public void save(Map<String, byte[]> fingerprints) throws IOException {
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        int skipped = 0;
        try (OutputStream os = new BufferedOutputStream(Files.newOutputStream(path))) {
            for (Map.Entry<String, byte[]> entry : new TreeMap<>(fingerprints).entrySet()) {
                if (entry.getKey().indexOf('\n') >= 0) {
                    // il separatore del record non può comparire nel titolo
                    log.warn("FingerprintCache: titolo con a capo non salvabile, verrà re-indicizzato: '{}'",
                            entry.getKey());
                    skipped++;
                    continue;
                }
                byte[] digest = entry.getValue();
                if (digest.length != DIGEST_LENGTH) {
                    throw new IOException("Impronta di lunghezza " + digest.length
                            + " per '" + entry.getKey() + "'");
                }
                os.write(entry.getKey().getBytes(StandardCharsets.UTF_8));
                os.write('\n');
                os.write(digest);
            }
        }
        log.debug("FingerprintCache: {} impronte salvate su {}", fingerprints.size() - skipped, path);
    }

    private static Map<String, byte[]> read(InputStream is) throws IOException {
        DataInputStream in = new DataInputStream(is);
        Map<String, byte[]> fingerprints = new HashMap<>();
        ByteArrayOutputStream key = new ByteArrayOutputStream();
        int b;
        while ((b = in.read()) != -1) {
            if (b != '\n') {
                key.write(b);
                continue;
            }
            byte[] digest = new byte[DIGEST_LENGTH];
            try {
                in.readFully(digest);
            } catch (EOFException e) {
                throw new IOException("record troncato per '" + key.toString(StandardCharsets.UTF_8) + "'", e);
            }
            fingerprints.put(key.toString(StandardCharsets.UTF_8), digest);
            key.reset();
        }
        if (key.size() > 0) {
            throw new IOException("titolo senza impronta in coda al file");
        }
        return fingerprints;
    }
}
