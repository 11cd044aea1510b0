package uk.ac.ebi.biostudies.content_index.cache;

/** The derived trees held by {@link DerivedCache}, one cache slot each. */
public enum TreeKind {
  TAXONOMY_TREE,
  CONTENT_TREE
}
