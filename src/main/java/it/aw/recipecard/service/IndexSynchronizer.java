package it.aw.recipecard.service;

import it.aw.recipecard.exception.IndexOperationException;
import it.aw.recipecard.index.RecipeIndex;
import it.aw.recipecard.model.Recipe;
import it.aw.recipecard.model.SyncReport;
import it.aw.recipecard.model.SyncReport.Skipped;
import it.aw.recipecard.registry.FingerprintCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Allinea l'indice di ricerca al corpus delle ricette.
 * <p>
 * Pipeline:
 * <ol>
 *   <li>Scarta le ricette senza titolo e i titoli duplicati (vince la prima trovata)</li>
 *   <li>Calcola l'impronta SHA-256 di ogni ricetta accettata</li>
 *   <li>Titolo nuovo o impronta diversa: cancella la voce obsoleta e re-indicizza</li>
 *   <li>Titoli in cache ma non più nel corpus: rimossi da indice e cache</li>
 *   <li>Commit dell'indice, poi salvataggio della cache</li>
 * </ol>
 * Due passaggi consecutivi sullo stesso corpus: il secondo non modifica l'indice.
 * Un errore dell'indice su una ricetta non ferma le altre; la sua impronta non viene
 * aggiornata, così il passaggio successivo ritenta.
 */
@Service
public class IndexSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(IndexSynchronizer.class);

    private final FingerprintCache fingerprintCache;

    public IndexSynchronizer(FingerprintCache fingerprintCache) {
        this.fingerprintCache = fingerprintCache;
    }

    /**
     * Ricette accettate (titolo → ricetta, nell'ordine del corpus) e riepilogo del passaggio.
     */
    public record Result(Map<String, Recipe> accepted, SyncReport report) {}

    public Result synchronize(List<Recipe> recipes, RecipeIndex index) {
        Map<String, byte[]> fingerprints = index.isFresh() ? new HashMap<>() : fingerprintCache.load();
        if (index.isFresh()) {
            log.info("Indice nuovo: cache delle impronte ignorata, re-indicizzazione completa");
        }

        Map<String, Recipe> accepted = new LinkedHashMap<>();
        List<String> added = new ArrayList<>();
        List<String> updated = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        List<Skipped> skipped = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        int unchanged = 0;

        // [1-3] ricette presenti nel corpus
        for (Recipe recipe : recipes) {
            String docx = recipe.docxPath().toString();
            if (!recipe.hasTitle()) {
                log.error("Titolo mancante: {}", docx);
                skipped.add(new Skipped(docx, "", "titolo mancante"));
                continue;
            }
            Recipe existing = accepted.get(recipe.title());
            if (existing != null) {
                log.error("Titolo duplicato '{}': {} ignorato, già presente in {}",
                        recipe.title(), docx, existing.docxPath());
                skipped.add(new Skipped(docx, recipe.title(), "titolo duplicato di " + existing.docxPath()));
                continue;
            }
            accepted.put(recipe.title(), recipe);

            byte[] digest = fingerprint(recipe);
            log.debug("Impronta '{}': {}", recipe.title(), HexFormat.of().formatHex(digest));

            byte[] cached = fingerprints.get(recipe.title());
            if (cached != null && MessageDigest.isEqual(cached, digest)) {
                unchanged++;
                continue;
            }

            log.info("Indicizzazione '{}' ({})", recipe.title(), docx);
            try {
                index.delete(recipe.title());
                index.index(recipe.title(), recipe);
            } catch (IndexOperationException e) {
                log.error("Indicizzazione fallita per '{}': {}", recipe.title(), e.getMessage(), e);
                failed.add(recipe.title());
                continue;
            }
            fingerprints.put(recipe.title(), digest);
            (cached == null ? added : updated).add(recipe.title());
        }

        // [4] ricette sparite dal corpus (cancellate o rinominate)
        Iterator<String> cachedTitles = fingerprints.keySet().iterator();
        while (cachedTitles.hasNext()) {
            String title = cachedTitles.next();
            if (accepted.containsKey(title)) {
                continue;
            }
            log.info("Rimozione ricetta non più presente: '{}'", title);
            try {
                index.delete(title);
            } catch (IndexOperationException e) {
                log.error("Rimozione fallita per '{}': {}", title, e.getMessage(), e);
                failed.add(title);
                continue;
            }
            cachedTitles.remove();
            removed.add(title);
        }

        // [5] persistenza: prima l'indice, poi le impronte che lo descrivono
        boolean persisted = persist(index, fingerprints);

        SyncReport report = new SyncReport(added, updated, removed, skipped, failed, unchanged, persisted);
        log.info("Sincronizzazione completata: {} nuove, {} aggiornate, {} rimosse, {} invariate, {} scartate, {} errori",
                added.size(), updated.size(), removed.size(), unchanged, skipped.size(), failed.size());
        return new Result(accepted, report);
    }

    /**
     * SHA-256 del titolo seguito da tutte le righe di tutte le sezioni, in ordine di
     * categoria, senza separatori. Sensibile all'ordine delle righe e delle categorie.
     */
    public static byte[] fingerprint(Recipe recipe) {
        MessageDigest digest = sha256();
        digest.update(recipe.title().getBytes(StandardCharsets.UTF_8));
        recipe.sections().values().forEach(lines ->
                lines.forEach(line -> digest.update(line.getBytes(StandardCharsets.UTF_8))));
        return digest.digest();
    }

    private boolean persist(RecipeIndex index, Map<String, byte[]> fingerprints) {
        try {
            index.commit();
        } catch (IOException e) {
            log.error("Impossibile salvare l'indice, cache delle impronte non aggiornata: {}", e.getMessage(), e);
            return false;
        }
        try {
            fingerprintCache.save(fingerprints);
            log.info("Cache delle impronte aggiornata: {}", fingerprintCache.getPath());
            return true;
        } catch (IOException e) {
            log.warn("Impossibile aggiornare la cache delle impronte {}: {}",
                    fingerprintCache.getPath(), e.getMessage());
            return false;
        }
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 non disponibile", e);
        }
    }
}
