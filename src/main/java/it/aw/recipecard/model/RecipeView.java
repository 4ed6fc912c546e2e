package it.aw.recipecard.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Vista JSON di una ricetta: sezioni con le etichette delle categorie,
 * path come stringhe, immagine incorporata indicata solo dal flag.
 */
public record RecipeView(
        String                    title,
        Map<String, List<String>> sections,
        String                    docxPath,
        List<String>              scanPaths,
        boolean                   hasCoverImage
) {
    public static RecipeView of(Recipe recipe) {
        Map<String, List<String>> sections = new LinkedHashMap<>();
        recipe.sections().forEach((category, lines) -> sections.put(category.label(), lines));
        return new RecipeView(
                recipe.title(),
                sections,
                recipe.docxPath().toString(),
                recipe.scanPaths().stream().map(Object::toString).collect(Collectors.toList()),
                recipe.hasCoverImage());
    }
}
