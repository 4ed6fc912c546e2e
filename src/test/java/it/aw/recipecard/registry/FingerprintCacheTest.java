package it.aw.recipecard.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("FingerprintCache")
class FingerprintCacheTest {

    @TempDir Path tempDir;

    private static byte[] digest(int fill) {
        byte[] digest = new byte[FingerprintCache.DIGEST_LENGTH];
        Arrays.fill(digest, (byte) fill);
        return digest;
    }

    @Test
    @DisplayName("file assente: mappa vuota, nessun errore")
    void shouldReturnEmptyMapWhenFileIsMissing() {
        FingerprintCache cache = new FingerprintCache(tempDir.resolve("item.idx").toString());

        assertThat(cache.load()).isEmpty();
    }

    @Test
    @DisplayName("salva e ricarica le impronte, creando le cartelle mancanti")
    void shouldPersistFingerprints() throws Exception {
        Path file = tempDir.resolve("search_idx/item.idx");
        FingerprintCache cache = new FingerprintCache(file.toString());
        Map<String, byte[]> fingerprints = new HashMap<>();
        // il digest contiene '\n' (0x0A): il formato a larghezza fissa non deve confondersi
        fingerprints.put("Apple Pie", digest('\n'));
        fingerprints.put("Crème brûlée", digest(0x7F));

        cache.save(fingerprints);
        Map<String, byte[]> loaded = cache.load();

        assertThat(Files.size(file)).isEqualTo(
                "Apple Pie\n".getBytes(StandardCharsets.UTF_8).length
                        + "Crème brûlée\n".getBytes(StandardCharsets.UTF_8).length
                        + 2L * FingerprintCache.DIGEST_LENGTH);
        assertThat(loaded).containsOnlyKeys("Apple Pie", "Crème brûlée");
        assertThat(loaded.get("Apple Pie")).isEqualTo(digest('\n'));
        assertThat(loaded.get("Crème brûlée")).isEqualTo(digest(0x7F));
    }

    @Test
    @DisplayName("record troncato: cache trattata come vuota")
    void shouldTreatTruncatedFileAsEmpty() throws Exception {
        Path file = tempDir.resolve("item.idx");
        byte[] data = "Apple Pie\n".getBytes(StandardCharsets.UTF_8);
        byte[] truncated = Arrays.copyOf(data, data.length + 10);
        Files.write(file, truncated);

        assertThat(new FingerprintCache(file.toString()).load()).isEmpty();
    }

    @Test
    @DisplayName("titolo senza impronta in coda: cache trattata come vuota")
    void shouldTreatDanglingTitleAsEmpty() throws Exception {
        Path file = tempDir.resolve("item.idx");
        Files.writeString(file, "Dangling");

        assertThat(new FingerprintCache(file.toString()).load()).isEmpty();
    }

    @Test
    @DisplayName("un file vuoto è una cache vuota valida")
    void shouldLoadEmptyFile() throws Exception {
        Path file = Files.createFile(tempDir.resolve("item.idx"));

        assertThat(new FingerprintCache(file.toString()).load()).isEmpty();
    }

    @Test
    @DisplayName("un titolo con a capo non viene salvato e non sposta i record successivi")
    void shouldSkipTitleContainingNewline() throws Exception {
        FingerprintCache cache = new FingerprintCache(tempDir.resolve("item.idx").toString());
        Map<String, byte[]> fingerprints = new HashMap<>();
        fingerprints.put("Apple\nPie", digest(1));
        fingerprints.put("Bread", digest(2));
        fingerprints.put("Apple", digest(3));

        cache.save(fingerprints);
        Map<String, byte[]> loaded = cache.load();

        assertThat(loaded).containsOnlyKeys("Apple", "Bread");
        assertThat(loaded.get("Apple")).isEqualTo(digest(3));
        assertThat(loaded.get("Bread")).isEqualTo(digest(2));
    }

    @Test
    @DisplayName("rifiuta impronte di lunghezza sbagliata")
    void shouldRejectDigestOfWrongLength() {
        FingerprintCache cache = new FingerprintCache(tempDir.resolve("item.idx").toString());

        assertThatThrownBy(() -> cache.save(Map.of("Pie", new byte[] {1, 2, 3})))
                .isInstanceOf(IOException.class);
    }
}
