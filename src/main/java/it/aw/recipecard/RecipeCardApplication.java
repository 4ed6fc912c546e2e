package it.aw.recipecard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RecipeCardApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecipeCardApplication.class, args);
    }
}
