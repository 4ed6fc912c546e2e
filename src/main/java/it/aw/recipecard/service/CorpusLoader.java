package it.aw.recipecard.service;

import it.aw.recipecard.model.CorpusLoad;
import it.aw.recipecard.model.LoadOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Carica il corpus delle ricette da una cartella.
 * <p>
 * La visita del filesystem è sequenziale e in ordine lessicografico per cartella;
 * l'estrazione dei documenti gira invece in parallelo sull'executor dedicato, un task
 * per documento, con una join esplicita prima di restituire il risultato.
 * Ogni task scrive solo il proprio esito: non c'è stato condiviso tra i task.
 * <p>
 * Un documento che fallisce non interrompe il caricamento: compare tra gli esiti
 * con il motivo del fallimento e viene escluso dalle ricette.
 */
@Service
public class CorpusLoader {

    private static final Logger log = LoggerFactory.getLogger(CorpusLoader.class);

    static final String DOCX_SUFFIX = ".docx";

    private final Executor executor;

    public CorpusLoader(@Qualifier("recipeLoaderExecutor") Executor executor) {
        this.executor = executor;
    }

    /**
     * @param root cartella radice del corpus
     * @return un esito per documento, nell'ordine di scoperta
     * @throws IOException se la radice non esiste, non è una cartella o non è leggibile
     */
    public CorpusLoad load(Path root) throws IOException {
        Path absoluteRoot = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(absoluteRoot)) {
            throw new IOException("Non è una cartella: " + absoluteRoot);
        }

        List<Path> documents = new ArrayList<>();
        walk(absoluteRoot, documents);
        log.info("Trovati {} documenti docx in {}", documents.size(), absoluteRoot);

        List<CompletableFuture<LoadOutcome>> tasks = documents.stream()
                .map(path -> CompletableFuture.supplyAsync(() -> extract(path), executor))
                .collect(Collectors.toList());
        CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();

        List<LoadOutcome> outcomes = tasks.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());
        CorpusLoad load = new CorpusLoad(absoluteRoot, outcomes);
        log.info("Caricamento completato: {} ricette, {} documenti non leggibili",
                load.recipes().size(), load.failures().size());
        return load;
    }

    private LoadOutcome extract(Path docxPath) {
        try {
            return LoadOutcome.success(RecipeExtractor.extract(docxPath));
        } catch (IOException | RuntimeException e) {
            log.error("Documento scartato {}: {}", docxPath, e.getMessage());
            return LoadOutcome.failure(docxPath, e);
        }
    }

    /**
     * Visita ricorsiva in ordine lessicografico dei nomi, cartella per cartella.
     * I link simbolici a cartelle non vengono seguiti.
     */
    private void walk(Path dir, List<Path> documents) throws IOException {
        List<Path> children;
        try (Stream<Path> listing = Files.list(dir)) {
            children = listing.sorted().collect(Collectors.toList());
        }
        for (Path child : children) {
            if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                walk(child, documents);
            } else if (child.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(DOCX_SUFFIX)) {
                documents.add(child);
            }
        }
    }
}
