package it.aw.recipecard.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Categorie riconosciute all'interno di una ricetta.
 * <p>
 * L'ordine di dichiarazione è l'ordine di visualizzazione: viene usato sia per
 * il rendering delle sezioni sia per il calcolo dell'impronta (fingerprint).
 * Non riordinare le costanti senza forzare una re-indicizzazione completa.
 */
public enum Category {

    SERVES("serves"),
    OVEN_TEMPERATURE("oven temperature"),
    INGREDIENTS("ingredients"),
    PREPARATION("preparation"),
    TIPS("tips");

    private final String label;

    Category(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Riconosce una riga come intestazione di categoria.
     * Match esatto dopo aver rimosso i due punti finali e convertito in minuscolo:
     * "Ingredients:" corrisponde, "Ingredients :" e "Main ingredients" no.
     */
    public static Optional<Category> fromHeading(String line) {
        String normalized = stripTrailingColons(line).toLowerCase(Locale.ROOT);
        for (Category category : values()) {
            if (category.label.equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    private static String stripTrailingColons(String line) {
        int end = line.length();
        while (end > 0 && line.charAt(end - 1) == ':') {
            end--;
        }
        return line.substring(0, end);
    }
}
