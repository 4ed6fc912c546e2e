package it.aw.recipecard.model;

/**
 * Risultato di una ricerca sul catalogo.
 * {@code score} è null per i risultati del fallback sul titolo.
 */
public record SearchResult(
        Double     score,
        RecipeView recipe
) {}
