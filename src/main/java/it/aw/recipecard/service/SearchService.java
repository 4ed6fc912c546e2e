package it.aw.recipecard.service;

import it.aw.recipecard.index.RecipeIndex;
import it.aw.recipecard.model.Recipe;
import it.aw.recipecard.model.RecipeView;
import it.aw.recipecard.model.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Esegue ricerche sulle ricette del catalogo.
 * <p>
 * Prima la ricerca semantica sull'indice, tenendo solo i risultati sopra
 * {@code search.min-score} e ancora presenti nel catalogo. Se non resta nulla,
 * ripiega su una ricerca testuale (case-insensitive) su titolo e sezioni.
 */
@Service
public class SearchService {

    private static final Logger log = LoggerFactory.getLogger(SearchService.class);

    private final RecipeIndex index;
    private final RecipeCatalog catalog;
    private final double minScore;

    public SearchService(RecipeIndex index,
                         RecipeCatalog catalog,
                         @Value("${search.min-score:0.5}") double minScore) {
        this.index = index;
        this.catalog = catalog;
        this.minScore = minScore;
    }

    /**
     * @param query testo della query
     * @param limit numero massimo di risultati
     * @return risultati per pertinenza decrescente
     */
    public List<SearchResult> search(String query, int limit) {
        List<SearchResult> results = index.search(query, limit).stream()
                .filter(hit -> hit.score() >= minScore)
                .map(hit -> catalog.find(hit.title())
                        .map(recipe -> new SearchResult(hit.score(), RecipeView.of(recipe))))
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
        if (!results.isEmpty()) {
            return results;
        }

        log.debug("Nessun risultato semantico per '{}', ricerca testuale", query);
        String needle = query.toLowerCase(Locale.ROOT);
        return catalog.all().stream()
                .filter(recipe -> matches(recipe, needle))
                .limit(limit)
                .map(recipe -> new SearchResult(null, RecipeView.of(recipe)))
                .collect(Collectors.toList());
    }

    private boolean matches(Recipe recipe, String needle) {
        return recipe.title().toLowerCase(Locale.ROOT).contains(needle)
                || recipe.summary().toLowerCase(Locale.ROOT).contains(needle);
    }
}
