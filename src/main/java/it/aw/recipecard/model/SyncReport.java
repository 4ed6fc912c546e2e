package it.aw.recipecard.model;

import java.util.List;

/**
 * Riepilogo di un passaggio di sincronizzazione indice/corpus.
 * <p>
 * {@code persisted} è false se l'indice o la cache delle impronte non sono stati
 * salvati: le modifiche all'indice già applicate non vengono annullate e il
 * passaggio successivo riallinea lo stato.
 */
public record SyncReport(
        List<String>  added,       // titoli nuovi, indicizzati
        List<String>  updated,     // titoli con contenuto cambiato, re-indicizzati
        List<String>  removed,     // titoli non più presenti nel corpus
        List<Skipped> skipped,     // documenti scartati (titolo mancante o duplicato)
        List<String>  failed,      // titoli per cui l'indice ha rifiutato l'operazione
        int           unchanged,
        boolean       persisted
) {

    public SyncReport {
        added = List.copyOf(added);
        updated = List.copyOf(updated);
        removed = List.copyOf(removed);
        skipped = List.copyOf(skipped);
        failed = List.copyOf(failed);
    }

    /** Numero di operazioni di scrittura eseguite con successo sull'indice. */
    public int mutations() {
        return added.size() + updated.size() + removed.size();
    }

    /** Documento scartato dalla sincronizzazione. */
    public record Skipped(String docxPath, String title, String reason) {}
}
