package uk.ac.ebi.biostudies.content_index.rest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.ac.ebi.biostudies.content_index.Constants;
import uk.ac.ebi.biostudies.content_index.index.ContentIndexService;
import uk.ac.ebi.biostudies.content_index.model.Entity;
import uk.ac.ebi.biostudies.content_index.model.EntityKind;
import uk.ac.ebi.biostudies.content_index.model.TaxonomyNode;

/**
 * Read-only REST access to the content index.
 *
 * <p>Serves single entities by slug and the two derived trees. Writes happen through {@link
 * ContentIndexService}; the only mutating endpoint forces a rebuild of the trees. Returns {@link
 * RestResponse} envelopes for all responses.
 */
@Slf4j
@RestController
@Tag(
    name = "Content Index",
    description =
        """
        Look up content items and taxonomies by slug and read the taxonomy and content trees.
        Returns RestResponse<T> envelopes with consistent success/error structure.
        """)
public class ContentController {

  private final ContentIndexService contentIndexService;

  public ContentController(ContentIndexService contentIndexService) {
    this.contentIndexService = contentIndexService;
  }

  @GetMapping("/content")
  @Operation(
      summary = "Get entity by slug",
      description = "Returns the content item or taxonomy stored under the slug.")
  @ApiResponses({
    @ApiResponse(
        responseCode = "200",
        description = "Entity found",
        content =
            @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = RestResponse.class))),
    @ApiResponse(
        responseCode = "404",
        description = "No entity with that slug",
        content =
            @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = RestResponse.class)))
  })
  public ResponseEntity<RestResponse<Entity>> getBySlug(
      @Parameter(description = "Entity slug", example = "/blog/my-new-project") @RequestParam
          String slug) {
    log.debug("Entity requested for slug {}", slug);
    return contentIndexService
        .getBySlug(slug)
        .map(entity -> ResponseEntity.ok(RestResponse.success("Entity found", entity)))
        .orElseGet(
            () ->
                ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(RestResponse.notFound("slug", "No entity with slug " + slug)));
  }

  @GetMapping("/content/all")
  @Operation(
      summary = "List entities",
      description = "Lists every stored entity ordered by slug, optionally of a single kind.")
  public ResponseEntity<RestResponse<List<Entity>>> listAll(
      @Parameter(description = "Entity kind: content_item or taxonomy", example = "taxonomy")
          @RequestParam(required = false)
          String kind) {
    EntityKind entityKind = StringUtils.isBlank(kind) ? null : EntityKind.fromValue(kind);
    List<Entity> entities = contentIndexService.listAll(entityKind);
    return ResponseEntity.ok(
        RestResponse.success(String.format("%d entities", entities.size()), entities));
  }

  @GetMapping("/trees/taxonomy")
  @Operation(
      summary = "Get taxonomy tree",
      description = "Returns the taxonomy hierarchy from the root, without content items.")
  public ResponseEntity<RestResponse<TaxonomyNode>> getTaxonomyTree() {
    return ResponseEntity.ok(
        RestResponse.success("Taxonomy tree", contentIndexService.getTaxonomyTree()));
  }

  @GetMapping("/trees/content")
  @Operation(
      summary = "Get content tree",
      description =
          """
          Returns the content hierarchy below a taxonomy, content items included, with
          previous/next navigation resolved.""")
  @ApiResponses({
    @ApiResponse(
        responseCode = "200",
        description = "Subtree found",
        content =
            @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = RestResponse.class))),
    @ApiResponse(
        responseCode = "404",
        description = "No taxonomy with that slug",
        content =
            @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = RestResponse.class)))
  })
  public ResponseEntity<RestResponse<TaxonomyNode>> getContentTree(
      @Parameter(description = "Slug of the subtree root", example = "/blog")
          @RequestParam(defaultValue = Constants.ROOT_SLUG)
          String root) {
    return contentIndexService
        .getContentTree(root)
        .map(tree -> ResponseEntity.ok(RestResponse.success("Content tree", tree)))
        .orElseGet(
            () ->
                ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(RestResponse.notFound("root", "No taxonomy with slug " + root)));
  }

  @PostMapping("/trees/rebuild")
  @Operation(
      summary = "Rebuild trees",
      description = "Drops both derived trees and builds them again from the current content.")
  public ResponseEntity<RestResponse<Void>> rebuildTrees() {
    log.info("Tree rebuild requested");
    contentIndexService.rebuildTrees();
    return ResponseEntity.ok(RestResponse.success("Trees rebuilt", null));
  }
}
