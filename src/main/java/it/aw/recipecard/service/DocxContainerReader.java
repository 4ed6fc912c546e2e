package it.aw.recipecard.service;

import it.aw.recipecard.exception.MalformedContainerException;
import it.aw.recipecard.exception.MissingDocumentBodyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Lettore del contenitore .docx.
 * <p>
 * Un docx è un archivio zip di documenti XML: l'unico che contiene il testo è
 * {@value #BODY_ENTRY}. Oltre al testo viene estratta la prima immagine
 * .jpg/.jpeg trovata nell'archivio, usata come copertina della ricetta.
 * Le voci vengono scandite una sola volta, nell'ordine dell'archivio, fermandosi
 * appena entrambe sono state trovate.
 */
public class DocxContainerReader {

    private static final Logger log = LoggerFactory.getLogger(DocxContainerReader.class);

    static final String BODY_ENTRY = "word/document.xml";
    static final List<String> IMAGE_SUFFIXES = List.of(".jpg", ".jpeg");

    private DocxContainerReader() {}

    /**
     * Contenuto grezzo di un docx.
     *
     * @param bodyXml    byte di {@value #BODY_ENTRY}, mai null
     * @param coverImage byte della prima immagine jpeg, null se il docx non ne ha
     */
    public record DocxContent(byte[] bodyXml, byte[] coverImage) {}

    /**
     * Apre il docx ed estrae testo XML e immagine.
     *
     * @throws MalformedContainerException  se il file non è un archivio zip leggibile
     * @throws MissingDocumentBodyException se manca {@value #BODY_ENTRY}, anche in presenza dell'immagine
     */
    public static DocxContent read(Path docxPath) throws MalformedContainerException, MissingDocumentBodyException {
        byte[] bodyXml = null;
        byte[] coverImage = null;

        try (ZipFile zip = new ZipFile(docxPath.toFile())) {
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements() && (bodyXml == null || coverImage == null)) {
                ZipEntry entry = entries.nextElement();
                String lowerName = entry.getName().toLowerCase(Locale.ROOT);

                if (coverImage == null && isImageName(lowerName)) {
                    coverImage = readEntry(zip, entry);
                    log.debug("Immagine di copertina trovata in {}: {} ({} byte)",
                            docxPath, entry.getName(), coverImage.length);
                } else if (bodyXml == null && lowerName.equals(BODY_ENTRY)) {
                    bodyXml = readEntry(zip, entry);
                }
            }
        } catch (IOException e) {
            throw new MalformedContainerException(docxPath,
                    "Impossibile leggere il docx " + docxPath + ": " + e.getMessage(), e);
        }

        if (bodyXml == null) {
            throw new MissingDocumentBodyException(docxPath, BODY_ENTRY);
        }
        return new DocxContent(bodyXml, coverImage);
    }

    /** True se il nome (già in minuscolo) termina con un suffisso immagine riconosciuto. */
    static boolean isImageName(String lowerName) {
        return IMAGE_SUFFIXES.stream().anyMatch(lowerName::endsWith);
    }

    private static byte[] readEntry(ZipFile zip, ZipEntry entry) throws IOException {
        try (InputStream is = zip.getInputStream(entry)) {
            return is.readAllBytes();
        }
    }
}
