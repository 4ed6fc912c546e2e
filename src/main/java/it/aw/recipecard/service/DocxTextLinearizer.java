package it.aw.recipecard.service;

import it.aw.recipecard.exception.MalformedContainerException;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.ByteArrayInputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Linearizza il testo di {@code word/document.xml} in righe.
 * <p>
 * Il tokenizer StAX scorre il documento una sola volta: tutto ciò che precede
 * l'elemento {@code body} (namespace, impostazioni, ecc.) viene ignorato; da lì in
 * poi ogni blocco di caratteri, ripulito dagli spazi, diventa una riga se non è vuoto.
 * Non si torna mai fuori dal body, anche dopo il tag di chiusura.
 */
public class DocxTextLinearizer {

    private DocxTextLinearizer() {}

    /**
     * @param bodyXml   contenuto XML del documento
     * @param docxPath  documento di origine, usato solo nei messaggi di errore
     * @return righe non vuote nell'ordine del documento
     * @throws MalformedContainerException se l'XML non è ben formato
     */
    public static List<String> lines(byte[] bodyXml, Path docxPath) throws MalformedContainerException {
        List<String> lines = new ArrayList<>();
        try {
            XMLStreamReader reader = createFactory().createXMLStreamReader(new ByteArrayInputStream(bodyXml));
            boolean insideBody = false;
            while (reader.hasNext()) {
                int event = reader.next();
                if (event == XMLStreamConstants.START_ELEMENT) {
                    if (!insideBody && "body".equals(reader.getLocalName().toLowerCase(Locale.ROOT))) {
                        insideBody = true;
                    }
                } else if (insideBody && isCharacterData(event)) {
                    String text = reader.getText().strip();
                    if (!text.isEmpty()) {
                        lines.add(text);
                    }
                }
            }
            reader.close();
        } catch (XMLStreamException e) {
            throw new MalformedContainerException(docxPath,
                    "XML non valido in " + docxPath + ": " + e.getMessage(), e);
        }
        return lines;
    }

    private static boolean isCharacterData(int event) {
        return event == XMLStreamConstants.CHARACTERS || event == XMLStreamConstants.CDATA;
    }

    /** Una factory per chiamata: i documenti vengono letti in parallelo dal CorpusLoader. */
    private static XMLInputFactory createFactory() {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        // blocchi di testo adiacenti (entità, CDATA) arrivano come un solo evento
        factory.setProperty(XMLInputFactory.IS_COALESCING, true);
        return factory;
    }
}
