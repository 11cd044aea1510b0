package uk.ac.ebi.biostudies.content_index.model;

/**
 * One level of the category chain derived from a file path.
 *
 * @param title readable category name, e.g. "3D Models"
 * @param slug cumulative slug up to this level, e.g. "/blog/art/3d-models"
 */
public record CategoryDescriptor(String title, String slug) {}
