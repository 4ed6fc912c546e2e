package it.aw.recipecard;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/** Costruisce file .docx minimali per i test. */
public final class DocxFixtures {

    public static final String BODY_ENTRY = "word/document.xml";
    public static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0, 1, 2, 3};

    private DocxFixtures() {}

    /** document.xml con i paragrafi dati dentro {@code w:body}. */
    public static String documentXml(String... paragraphs) {
        StringBuilder sb = new StringBuilder()
                .append("<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>")
                .append("<w:document xmlns:w=\"http://schemas.openxmlformats.org/wordprocessingml/2006/main\">")
                .append("<w:body>");
        for (String p : paragraphs) {
            sb.append("<w:p><w:r><w:t>").append(escape(p)).append("</w:t></w:r></w:p>");
        }
        return sb.append("</w:body></w:document>").toString();
    }

    /** Docx con il testo dato e, se {@code withImage}, una copertina jpeg. */
    public static Path recipeDocx(Path file, boolean withImage, String... paragraphs) throws IOException {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("[Content_Types].xml", "<Types/>".getBytes(StandardCharsets.UTF_8));
        if (withImage) {
            entries.put("word/media/image1.jpeg", JPEG);
        }
        entries.put(BODY_ENTRY, documentXml(paragraphs).getBytes(StandardCharsets.UTF_8));
        return zip(file, entries);
    }

    public static Path zip(Path file, Map<String, byte[]> entries) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        try (OutputStream os = Files.newOutputStream(file);
             ZipOutputStream zos = new ZipOutputStream(os)) {
            for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
                zos.putNextEntry(new ZipEntry(entry.getKey()));
                zos.write(entry.getValue());
                zos.closeEntry();
            }
        }
        return file;
    }

    private static String escape(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
