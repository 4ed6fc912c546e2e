package it.aw.recipecard.model;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Risultato di un passaggio del CorpusLoader: un esito per documento, nell'ordine
 * di scoperta della visita del filesystem (non nell'ordine di completamento).
 */
public record CorpusLoad(Path root, List<LoadOutcome> outcomes) {

    public CorpusLoad {
        outcomes = List.copyOf(outcomes);
    }

    /** Ricette estratte con successo; i documenti falliti sono esclusi. */
    public List<Recipe> recipes() {
        return outcomes.stream()
                .filter(LoadOutcome::succeeded)
                .map(LoadOutcome::recipe)
                .collect(Collectors.toList());
    }

    public List<LoadOutcome> failures() {
        return outcomes.stream()
                .filter(o -> !o.succeeded())
                .collect(Collectors.toList());
    }
}
