package uk.ac.ebi.biostudies.content_index.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Resolved position of a content item in the content tree, written back to the item after each
 * content tree build so slug lookups do not have to walk the tree.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContentLink {
  String slug;
  String title;
  int level;
  List<String> parents;

  /** Neighbour before this item in tree order, null for the first item. */
  LinkRef previous;

  /** Neighbour after this item in tree order, null for the last item. */
  LinkRef next;
}
