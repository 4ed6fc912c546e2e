package it.aw.recipecard.controller;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import it.aw.recipecard.model.Category;
import it.aw.recipecard.model.Recipe;
import it.aw.recipecard.model.RecipeView;
import it.aw.recipecard.model.SearchResult;
import it.aw.recipecard.model.SyncReport;
import it.aw.recipecard.service.RecipeCatalog;
import it.aw.recipecard.service.SearchService;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("RecipeController")
class RecipeControllerTest {

    @Mock private RecipeCatalog catalog;
    @Mock private SearchService searchService;

    private MockMvc mockMvc;

    private final Recipe applePie = new Recipe("Apple Pie",
            Map.of(Category.INGREDIENTS, List.of("2 cups flour")),
            Path.of("/recipes/pie/pie.docx"), List.of(), new byte[] {1, 2, 3});

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new RecipeController(catalog, searchService)).build();
    }

    @Test
    @DisplayName("GET /api/recipes/recipe restituisce sezioni con le etichette di categoria")
    void shouldReturnRecipeDetail() throws Exception {
        when(catalog.find("Apple Pie")).thenReturn(Optional.of(applePie));

        mockMvc.perform(get("/api/recipes/recipe").param("title", "Apple Pie"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("Apple Pie"))
                .andExpect(jsonPath("$.sections.ingredients[0]").value("2 cups flour"))
                .andExpect(jsonPath("$.hasCoverImage").value(true));
    }

    @Test
    @DisplayName("titolo sconosciuto: 404")
    void shouldReturnNotFoundForUnknownTitle() throws Exception {
        when(catalog.find("Nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/recipes/recipe").param("title", "Nope")).andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET cover restituisce l'immagine incorporata")
    void shouldServeCoverImage() throws Exception {
        when(catalog.find("Apple Pie")).thenReturn(Optional.of(applePie));

        mockMvc.perform(get("/api/recipes/recipe/cover").param("title", "Apple Pie"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.IMAGE_JPEG))
                .andExpect(content().bytes(new byte[] {1, 2, 3}));
    }

    @Test
    @DisplayName("scansione fuori intervallo: 404")
    void shouldReturnNotFoundForMissingScan() throws Exception {
        when(catalog.find("Apple Pie")).thenReturn(Optional.of(applePie));

        mockMvc.perform(get("/api/recipes/recipe/scans/{n}", 0).param("title", "Apple Pie"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("query vuota: 400")
    void shouldRejectBlankQuery() throws Exception {
        mockMvc.perform(get("/api/recipes/search").param("q", "  ")).andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET search restituisce i risultati del SearchService")
    void shouldReturnSearchResults() throws Exception {
        when(searchService.search("pie", 10))
                .thenReturn(List.of(new SearchResult(0.87, RecipeView.of(applePie))));

        mockMvc.perform(get("/api/recipes/search").param("q", " pie "))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].score").value(0.87))
                .andExpect(jsonPath("$[0].recipe.title").value("Apple Pie"));
    }

    @Test
    @DisplayName("un titolo con '/' è raggiungibile da dettaglio e documento")
    void shouldResolveTitleContainingSlash() throws Exception {
        Recipe halfPie = new Recipe("Pie 1/2", Map.of(), Path.of("/recipes/half/missing.docx"), List.of(), null);
        when(catalog.find("Pie 1/2")).thenReturn(Optional.of(halfPie));

        mockMvc.perform(get("/api/recipes/recipe").param("title", "Pie 1/2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("Pie 1/2"));
        mockMvc.perform(get("/api/recipes/recipe/docx").param("title", "Pie 1/2"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("limit molto grande viene ridotto al massimo consentito")
    void shouldCapSearchLimit() throws Exception {
        when(searchService.search("pie", RecipeController.MAX_SEARCH_LIMIT)).thenReturn(List.of());

        mockMvc.perform(get("/api/recipes/search").param("q", "pie").param("limit", "500000000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
        verify(searchService).search("pie", RecipeController.MAX_SEARCH_LIMIT);
    }

    @Test
    @DisplayName("POST sync restituisce il riepilogo, 500 se il corpus non è leggibile")
    void shouldTriggerSync() throws Exception {
        when(catalog.synchronize())
                .thenReturn(new SyncReport(List.of("Apple Pie"), List.of(), List.of(), List.of(), List.of(), 0, true))
                .thenThrow(new IOException("Non è una cartella"));
        when(catalog.getRecipesPath()).thenReturn(Path.of("/recipes"));

        mockMvc.perform(post("/api/recipes/sync"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.added[0]").value("Apple Pie"))
                .andExpect(jsonPath("$.persisted").value(true));
        mockMvc.perform(post("/api/recipes/sync")).andExpect(status().isInternalServerError());
    }
}
