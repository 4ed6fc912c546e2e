package it.aw.recipecard.exception;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Errore di lettura di un singolo documento ricetta.
 * Fatale per il documento, mai per il caricamento dell'intero corpus.
 */
public class RecipeDocumentException extends IOException {

    private final Path docxPath;

    public RecipeDocumentException(Path docxPath, String message) {
        super(message);
        this.docxPath = docxPath;
    }

    public RecipeDocumentException(Path docxPath, String message, Throwable cause) {
        super(message, cause);
        this.docxPath = docxPath;
    }

    public Path getDocxPath() {
        return docxPath;
    }
}
