package it.aw.recipecard.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Ricetta estratta da un documento .docx.
 * <p>
 * Il titolo è la chiave di identità nel corpus e nell'indice; è vuoto se il
 * documento non contiene la riga "recipe" che lo precede. Le sezioni sono
 * ordinate secondo {@link Category} indipendentemente dall'ordine nel documento.
 */
public record Recipe(
        String                      title,
        Map<Category, List<String>> sections,
        Path                        docxPath,    // path assoluto del documento sorgente
        List<Path>                  scanPaths,   // scansioni .jpg/.jpeg nella stessa cartella, ordinate
        byte[]                      coverImage   // immagine incorporata nel docx, null se assente
) {

    public Recipe {
        title = title == null ? "" : title;
        EnumMap<Category, List<String>> copy = new EnumMap<>(Category.class);
        sections.forEach((category, lines) -> copy.put(category, List.copyOf(lines)));
        sections = Collections.unmodifiableMap(copy);
        scanPaths = List.copyOf(scanPaths);
    }

    public boolean hasTitle() {
        return !title.isEmpty();
    }

    public boolean hasCoverImage() {
        return coverImage != null && coverImage.length > 0;
    }

    /** Testo delle sezioni presenti, una intestazione per categoria seguita dalle righe. */
    public String summary() {
        StringJoiner output = new StringJoiner("\n\n");
        sections.forEach((category, lines) ->
                output.add(category.label() + "\n" + String.join("\n", lines)));
        return output.toString();
    }
}
