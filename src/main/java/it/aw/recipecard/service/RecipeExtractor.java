package it.aw.recipecard.service;

import it.aw.recipecard.model.Category;
import it.aw.recipecard.model.Recipe;
import it.aw.recipecard.service.DocxContainerReader.DocxContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Estrae una {@link Recipe} dalle righe di un docx con una piccola macchina a stati.
 * <p>
 * Fasi:
 * <ol>
 *   <li>Ricerca del titolo: la riga che segue la prima riga contenente "recipe"
 *       (case-insensitive) è il titolo. Tutto ciò che precede viene scartato.</li>
 *   <li>Contenuto: le righe che corrispondono esattamente a una {@link Category}
 *       aprono la sezione corrente; le altre righe vengono accodate alla sezione
 *       corrente, oppure scartate se nessuna sezione è ancora aperta.</li>
 * </ol>
 * Un documento senza titolo o senza categorie è un risultato valido ma vuoto:
 * sarà la sincronizzazione dell'indice a scartarlo.
 */
public class RecipeExtractor {

    private static final Logger log = LoggerFactory.getLogger(RecipeExtractor.class);

    private static final String TITLE_MARKER = "recipe";

    private RecipeExtractor() {}

    /** Titolo e sezioni ricavati dalle righe del documento. */
    public record ParsedLines(String title, Map<Category, List<String>> sections) {}

    /**
     * Legge il docx, ne linearizza il testo e costruisce la ricetta,
     * includendo le scansioni presenti nella stessa cartella.
     *
     * @throws IOException errori del contenitore o dell'XML (propagati invariati)
     *                     oppure lettura della cartella non riuscita
     */
    public static Recipe extract(Path docxPath) throws IOException {
        Path absolute = docxPath.toAbsolutePath().normalize();
        List<Path> scans = scanPaths(absolute);

        DocxContent content = DocxContainerReader.read(absolute);
        List<String> lines = DocxTextLinearizer.lines(content.bodyXml(), absolute);
        ParsedLines parsed = parseLines(lines);

        log.debug("Estratto {}: titolo='{}', {} sezioni, {} scansioni",
                absolute, parsed.title(), parsed.sections().size(), scans.size());
        return new Recipe(parsed.title(), parsed.sections(), absolute, scans, content.coverImage());
    }

    /**
     * Applica la macchina a stati alle righe del documento.
     *
     * @param lines righe non vuote nell'ordine del documento
     * @return titolo (vuoto se non trovato) e sezioni in ordine di categoria
     */
    public static ParsedLines parseLines(List<String> lines) {
        Map<Category, List<String>> sections = new EnumMap<>(Category.class);
        String title = "";
        boolean titleIsNext = false;
        Category current = null;

        for (String line : lines) {
            if (title.isEmpty()) {
                if (titleIsNext) {
                    title = line;
                } else if (line.toLowerCase(Locale.ROOT).contains(TITLE_MARKER)) {
                    titleIsNext = true;
                }
                continue;
            }

            Optional<Category> heading = Category.fromHeading(line);
            if (heading.isPresent()) {
                current = heading.get();
                continue;
            }
            if (current == null) {
                continue;
            }
            sections.computeIfAbsent(current, c -> new ArrayList<>()).add(line);
        }

        return new ParsedLines(title, sections);
    }

    /**
     * Scansioni della ricetta: file .jpg/.jpeg nella cartella del documento,
     * in ordine lessicografico di path.
     */
    static List<Path> scanPaths(Path docxPath) throws IOException {
        Path dir = docxPath.getParent();
        if (dir == null) {
            return List.of();
        }
        try (Stream<Path> siblings = Files.list(dir)) {
            return siblings
                    .filter(p -> !Files.isDirectory(p))
                    .filter(p -> DocxContainerReader.isImageName(
                            p.getFileName().toString().toLowerCase(Locale.ROOT)))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
