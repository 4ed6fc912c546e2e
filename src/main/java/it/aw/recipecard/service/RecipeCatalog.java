package it.aw.recipecard.service;

import it.aw.recipecard.index.RecipeIndex;
import it.aw.recipecard.model.CorpusLoad;
import it.aw.recipecard.model.Recipe;
import it.aw.recipecard.model.SyncReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalogo delle ricette servite dall'applicazione: le ricette accettate
 * dall'ultima sincronizzazione, indicizzate per titolo.
 * <p>
 * La sincronizzazione parte all'avvio (se {@code recipes.sync-on-startup=true})
 * e su richiesta; le esecuzioni sono serializzate, le letture vedono sempre
 * l'ultima mappa completa.
 */
@Component
public class RecipeCatalog {

    private static final Logger log = LoggerFactory.getLogger(RecipeCatalog.class);

    private final CorpusLoader corpusLoader;
    private final IndexSynchronizer synchronizer;
    private final RecipeIndex index;
    private final Path recipesPath;
    private final boolean syncOnStartup;

    private volatile Map<String, Recipe> recipes = Map.of();

    public RecipeCatalog(CorpusLoader corpusLoader,
                         IndexSynchronizer synchronizer,
                         RecipeIndex index,
                         @Value("${recipes.path}") String recipesPath,
                         @Value("${recipes.sync-on-startup:true}") boolean syncOnStartup) {
        this.corpusLoader = corpusLoader;
        this.synchronizer = synchronizer;
        this.index = index;
        this.recipesPath = Paths.get(recipesPath).toAbsolutePath();
        this.syncOnStartup = syncOnStartup;
    }

    @EventListener(ApplicationReadyEvent.class)
    void syncAtStartup() throws IOException {
        if (syncOnStartup) {
            synchronize();
        }
    }

    /**
     * Ricarica il corpus e allinea l'indice.
     *
     * @throws IOException se la cartella delle ricette non è leggibile
     */
    public synchronized SyncReport synchronize() throws IOException {
        log.info("Caricamento ricette da {}", recipesPath);
        CorpusLoad load = corpusLoader.load(recipesPath);
        IndexSynchronizer.Result result = synchronizer.synchronize(load.recipes(), index);
        recipes = result.accepted();
        log.info("Catalogo aggiornato: {} ricette", recipes.size());
        return result.report();
    }

    public Optional<Recipe> find(String title) {
        return Optional.ofNullable(recipes.get(title));
    }

    /** Tutte le ricette, nell'ordine del corpus. */
    public List<Recipe> all() {
        return new ArrayList<>(recipes.values());
    }

    public Path getRecipesPath() {
        return recipesPath;
    }
}
