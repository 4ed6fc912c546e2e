package it.aw.recipecard.exception;

import java.nio.file.Path;

/** Il contenitore non è un archivio leggibile oppure il suo XML non è ben formato. */
public class MalformedContainerException extends RecipeDocumentException {

    public MalformedContainerException(Path docxPath, String message, Throwable cause) {
        super(docxPath, message, cause);
    }
}
