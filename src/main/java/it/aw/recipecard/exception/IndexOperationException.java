package it.aw.recipecard.exception;

/** L'indice di ricerca ha rifiutato un inserimento o una cancellazione. */
public class IndexOperationException extends RuntimeException {

    private final String title;

    public IndexOperationException(String title, String message, Throwable cause) {
        super(message, cause);
        this.title = title;
    }

    public String getTitle() {
        return title;
    }
}
