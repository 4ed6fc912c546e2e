package it.aw.recipecard.model;

/** Risultato grezzo dell'indice: titolo della ricetta e punteggio di similarità. */
public record SearchHit(String title, double score) {}
