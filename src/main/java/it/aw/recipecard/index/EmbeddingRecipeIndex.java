package it.aw.recipecard.index;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import it.aw.recipecard.exception.IndexOperationException;
import it.aw.recipecard.model.Recipe;
import it.aw.recipecard.model.SearchHit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

/**
 * {@link RecipeIndex} su embedding store LangChain4j.
 * <p>
 * Ogni ricetta diventa un segmento per categoria presente (titolo, categoria e righe),
 * più un segmento con il solo titolo se non ha sezioni. Tutti i segmenti portano
 * il metadato {@value #TITLE_KEY}, usato per la cancellazione e per raggruppare i
 * risultati: una ricerca restituisce ogni titolo una sola volta, con il punteggio
 * del suo segmento migliore.
 */
public class EmbeddingRecipeIndex implements RecipeIndex {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingRecipeIndex.class);

    static final String TITLE_KEY = "title";
    static final String CATEGORY_KEY = "category";
    private static final int SEARCH_MULTIPLIER = 5;

    private final EmbeddingModel embeddingModel;
    private final InMemoryEmbeddingStore<TextSegment> embeddingStore;
    private final Path storeFile;
    private volatile boolean fresh;

    /**
     * @param storeFile file JSON su cui {@link #commit()} serializza lo store;
     *                  null per un indice solo in memoria
     * @param fresh     true se lo store non è stato caricato da file
     */
    public EmbeddingRecipeIndex(EmbeddingModel embeddingModel,
                                InMemoryEmbeddingStore<TextSegment> embeddingStore,
                                Path storeFile,
                                boolean fresh) {
        this.embeddingModel = embeddingModel;
        this.embeddingStore = embeddingStore;
        this.storeFile = storeFile;
        this.fresh = fresh;
    }

    @Override
    public void index(String title, Recipe recipe) {
        List<TextSegment> segments = toSegments(title, recipe);
        try {
            List<Embedding> embeddings = embeddingModel.embedAll(segments).content();
            embeddingStore.addAll(embeddings, segments);
        } catch (RuntimeException e) {
            throw new IndexOperationException(title, "Indicizzazione fallita per '" + title + "'", e);
        }
        log.debug("Indicizzati {} segmenti per '{}'", segments.size(), title);
    }

    @Override
    public void delete(String title) {
        try {
            embeddingStore.removeAll(metadataKey(TITLE_KEY).isEqualTo(title));
        } catch (RuntimeException e) {
            throw new IndexOperationException(title, "Cancellazione fallita per '" + title + "'", e);
        }
    }

    @Override
    public List<SearchHit> search(String query, int limit) {
        Embedding queryEmbedding = embeddingModel.embed(query).content();
        List<EmbeddingMatch<TextSegment>> candidates = embeddingStore.search(
                EmbeddingSearchRequest.builder()
                        .queryEmbedding(queryEmbedding)
                        .maxResults((int) Math.min((long) limit * SEARCH_MULTIPLIER, Integer.MAX_VALUE))
                        .build()
        ).matches();

        // i candidati arrivano per score decrescente: il primo segmento di ogni titolo è il migliore
        Map<String, Double> best = new LinkedHashMap<>();
        for (EmbeddingMatch<TextSegment> match : candidates) {
            String title = match.embedded().metadata().getString(TITLE_KEY);
            if (title != null) {
                best.putIfAbsent(title, match.score());
            }
        }
        return best.entrySet().stream()
                .limit(limit)
                .map(e -> new SearchHit(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
    }

    @Override
    public void commit() throws IOException {
        if (storeFile == null) {
            return;
        }
        Path parent = storeFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try {
            embeddingStore.serializeToFile(storeFile);
        } catch (RuntimeException e) {
            throw new IOException("Impossibile salvare l'indice su " + storeFile, e);
        }
        fresh = false;
        log.info("Indice salvato: {}", storeFile.toAbsolutePath());
    }

    @Override
    public boolean isFresh() {
        return fresh;
    }

    private List<TextSegment> toSegments(String title, Recipe recipe) {
        List<TextSegment> segments = new ArrayList<>();
        recipe.sections().forEach((category, lines) -> {
            Metadata metadata = new Metadata();
            metadata.put(TITLE_KEY, title);
            metadata.put(CATEGORY_KEY, category.label());
            String text = title + "\n" + category.label() + "\n" + String.join("\n", lines);
            segments.add(TextSegment.from(text, metadata));
        });
        if (segments.isEmpty()) {
            Metadata metadata = new Metadata();
            metadata.put(TITLE_KEY, title);
            segments.add(TextSegment.from(title, metadata));
        }
        return segments;
    }
}
