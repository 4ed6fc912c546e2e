package it.aw.recipecard.controller;

import it.aw.recipecard.model.Recipe;
import it.aw.recipecard.model.RecipeView;
import it.aw.recipecard.model.SearchResult;
import it.aw.recipecard.model.SyncReport;
import it.aw.recipecard.service.RecipeCatalog;
import it.aw.recipecard.service.SearchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Espone il catalogo delle ricette.
 *
 * Endpoint disponibili:
 *   GET  /api/recipes                      lista di tutte le ricette
 *   GET  /api/recipes/search?q=&limit=     ricerca
 *   GET  /api/recipes/recipe?title=               dettaglio di una ricetta
 *   GET  /api/recipes/recipe/cover?title=         immagine incorporata nel docx
 *   GET  /api/recipes/recipe/scans/{n}?title=     n-esima scansione (0-based)
 *   GET  /api/recipes/recipe/docx?title=          documento sorgente
 *   POST /api/recipes/sync                        ricarica il corpus e allinea l'indice
 *
 * Il titolo viaggia come parametro di query: può contenere qualsiasi carattere, '/' compreso.
 */
@RestController
@RequestMapping("/api/recipes")
public class RecipeController {

    private static final Logger log = LoggerFactory.getLogger(RecipeController.class);

    static final int MAX_SEARCH_LIMIT = 100;

    static final MediaType DOCX = MediaType.parseMediaType(
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document");

    private final RecipeCatalog catalog;
    private final SearchService searchService;

    public RecipeController(RecipeCatalog catalog, SearchService searchService) {
        this.catalog = catalog;
        this.searchService = searchService;
    }

    @GetMapping
    public ResponseEntity<List<RecipeView>> listRecipes() {
        return ResponseEntity.ok(catalog.all().stream()
                .map(RecipeView::of)
                .collect(Collectors.toList()));
    }

    /**
     * Esempio:
     *   curl "http://localhost:8889/api/recipes/search?q=apple+pie&limit=3"
     */
    @GetMapping("/search")
    public ResponseEntity<List<SearchResult>> search(
            @RequestParam("q") String query,
            @RequestParam(value = "limit", defaultValue = "10") int limit) {
        if (query.isBlank() || limit < 1) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(searchService.search(query.strip(), Math.min(limit, MAX_SEARCH_LIMIT)));
    }

    /**
     * Esempio:
     *   curl "http://localhost:8889/api/recipes/recipe?title=Pie%201/2"
     */
    @GetMapping("/recipe")
    public ResponseEntity<RecipeView> getRecipe(@RequestParam("title") String title) {
        return catalog.find(title)
                .map(RecipeView::of)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/recipe/cover")
    public ResponseEntity<byte[]> cover(@RequestParam("title") String title) {
        return catalog.find(title)
                .filter(Recipe::hasCoverImage)
                .map(recipe -> ResponseEntity.ok()
                        .contentType(MediaType.IMAGE_JPEG)
                        .body(recipe.coverImage()))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/recipe/scans/{n}")
    public ResponseEntity<Resource> scan(@RequestParam("title") String title, @PathVariable int n) {
        return catalog.find(title)
                .filter(recipe -> n >= 0 && n < recipe.scanPaths().size())
                .map(recipe -> file(recipe.scanPaths().get(n), MediaType.IMAGE_JPEG))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/recipe/docx")
    public ResponseEntity<Resource> docx(@RequestParam("title") String title) {
        return catalog.find(title)
                .map(recipe -> file(recipe.docxPath(), DOCX))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Esempio:
     *   curl -X POST http://localhost:8889/api/recipes/sync
     */
    @PostMapping("/sync")
    public ResponseEntity<SyncReport> sync() {
        try {
            return ResponseEntity.ok(catalog.synchronize());
        } catch (IOException e) {
            log.error("Errore durante la sincronizzazione di {}", catalog.getRecipesPath(), e);
            return ResponseEntity.internalServerError().build();
        }
    }

    private ResponseEntity<Resource> file(Path path, MediaType mediaType) {
        if (!Files.isRegularFile(path)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok()
                .contentType(mediaType)
                .header(HttpHeaders.CONTENT_DISPOSITION, "inline; filename=\"" + path.getFileName() + "\"")
                .body(new FileSystemResource(path));
    }
}
