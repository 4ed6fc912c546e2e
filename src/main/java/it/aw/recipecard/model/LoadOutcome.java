package it.aw.recipecard.model;

import java.nio.file.Path;

/**
 * Esito dell'estrazione di un singolo documento durante il caricamento del corpus.
 * Esattamente uno tra {@code recipe} e {@code failure} è valorizzato.
 */
public record LoadOutcome(Path docxPath, Recipe recipe, String failure) {

    public static LoadOutcome success(Recipe recipe) {
        return new LoadOutcome(recipe.docxPath(), recipe, null);
    }

    public static LoadOutcome failure(Path docxPath, Throwable cause) {
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new LoadOutcome(docxPath, null, reason);
    }

    public boolean succeeded() {
        return recipe != null;
    }
}
