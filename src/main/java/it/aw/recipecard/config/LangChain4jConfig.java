package it.aw.recipecard.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2q.AllMiniLmL6V2QuantizedEmbeddingModel;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import it.aw.recipecard.index.EmbeddingRecipeIndex;
import it.aw.recipecard.index.RecipeIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configura l'indice di ricerca delle ricette.
 *
 * EmbeddingModel: AllMiniLM-L6-v2 quantizzato, gira in locale senza API key.
 * EmbeddingStore:  InMemoryEmbeddingStore persistito su file JSON.
 *                  All'avvio carica il file se esiste; se manca o è illeggibile
 *                  parte da zero e l'indice viene segnato come nuovo, così la prima
 *                  sincronizzazione ignora la cache delle impronte e re-indicizza tutto.
 *                  Il salvataggio avviene a fine sincronizzazione (RecipeIndex.commit).
 */
@Configuration
public class LangChain4jConfig {

    private static final Logger log = LoggerFactory.getLogger(LangChain4jConfig.class);

    @Value("${store.index.file}")
    private String indexFilePath;

    @Bean
    public EmbeddingModel embeddingModel() {
        log.info("Inizializzazione EmbeddingModel: AllMiniLmL6V2Quantized (locale)");
        return new AllMiniLmL6V2QuantizedEmbeddingModel();
    }

    @Bean
    public RecipeIndex recipeIndex(EmbeddingModel embeddingModel) {
        Path path = Paths.get(indexFilePath).toAbsolutePath();
        if (Files.exists(path)) {
            try {
                log.info("Indice: caricamento da file {}", path);
                return new EmbeddingRecipeIndex(embeddingModel, InMemoryEmbeddingStore.fromFile(path), path, false);
            } catch (RuntimeException e) {
                log.warn("Indice: file {} illeggibile ({}), ricostruzione completa.", path, e.getMessage());
            }
        } else {
            log.info("Indice: file {} non trovato, partenza da zero.", path);
        }
        return new EmbeddingRecipeIndex(embeddingModel, new InMemoryEmbeddingStore<>(), path, true);
    }
}
