package uk.ac.ebi.biostudies.content_index.model;

/**
 * An entry of the entity store. Content items and taxonomy nodes live in a single keyspace indexed
 * by slug; cross references between them (parents, previous/next) are slugs resolved by lookup,
 * never object references.
 *
 * <p>Implementations are immutable. Code that needs to treat both kinds switches on {@link
 * #kind()}.
 */
public sealed interface Entity permits ContentItem, TaxonomyNode {

  String getSlug();

  String getTitle();

  EntityKind kind();
}
