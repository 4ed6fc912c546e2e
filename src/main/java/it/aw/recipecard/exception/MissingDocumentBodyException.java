package it.aw.recipecard.exception;

import java.nio.file.Path;

/** Il contenitore non ha la voce con il testo del documento. */
public class MissingDocumentBodyException extends RecipeDocumentException {

    public MissingDocumentBodyException(Path docxPath, String entryName) {
        super(docxPath, "Impossibile trovare " + entryName + " nel docx " + docxPath);
    }
}
