package it.aw.recipecard.index;

import it.aw.recipecard.exception.IndexOperationException;
import it.aw.recipecard.model.Recipe;
import it.aw.recipecard.model.SearchHit;

import java.io.IOException;
import java.util.List;

/**
 * Indice di ricerca delle ricette, con il titolo come chiave.
 * Scritto solo da IndexSynchronizer; letto da SearchService.
 */
public interface RecipeIndex {

    /** Indicizza la ricetta sotto la chiave data. */
    void index(String title, Recipe recipe) throws IndexOperationException;

    /** Rimuove la chiave dall'indice; nessun effetto se la chiave non esiste. */
    void delete(String title) throws IndexOperationException;

    /** Titoli ordinati per pertinenza decrescente, al più {@code limit}. */
    List<SearchHit> search(String query, int limit);

    /** Rende durevoli le modifiche applicate finora. */
    void commit() throws IOException;

    /**
     * True se l'indice è stato creato vuoto (mai salvato, oppure file illeggibile):
     * in questo caso le impronte in cache non descrivono il suo contenuto.
     */
    boolean isFresh();
}
