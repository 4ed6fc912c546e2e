package it.aw.recipecard.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Pool di worker per l'estrazione parallela dei documenti.
 * Dimensione fissa, coda illimitata: un caricamento accoda un task per documento.
 */
@Configuration
public class LoaderConfig {

    @Value("${recipes.loader.threads:4}")
    private int threads;

    @Bean(name = "recipeLoaderExecutor")
    public Executor recipeLoaderExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("recipe-load-");
        executor.initialize();
        return executor;
    }
}
