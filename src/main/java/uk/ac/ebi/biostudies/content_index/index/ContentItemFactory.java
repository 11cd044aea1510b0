package uk.ac.ebi.biostudies.content_index.index;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import uk.ac.ebi.biostudies.content_index.Constants;
import uk.ac.ebi.biostudies.content_index.exceptions.InvalidContentException;
import uk.ac.ebi.biostudies.content_index.fileaccess.ContentPathService;
import uk.ac.ebi.biostudies.content_index.model.ContentItem;
import uk.ac.ebi.biostudies.content_index.model.ContentType;
import uk.ac.ebi.biostudies.content_index.model.TaxonomyNode;
import uk.ac.ebi.biostudies.content_index.util.PathResolver;

/**
 * Builds validated {@link ContentItem} records from the fields a markdown parser extracted from a
 * file (front matter plus rendered body).
 *
 * <p>The slug and the taxonomy chain always come from the file path. The title falls back to a
 * path-derived one when the parser provides none. Accepted field names are the {@code *_FIELD}
 * constants of {@link Constants}.
 */
@Slf4j
@Component
public class ContentItemFactory {

  private static final Pattern OFFSET_SUFFIX = Pattern.compile("(Z|[+-]\\d{2}:?\\d{2})$");

  private final ContentPathService contentPathService;

  public ContentItemFactory(ContentPathService contentPathService) {
    this.contentPathService = contentPathService;
  }

  /**
   * Creates an item for an absolute file path reported by a watcher.
   *
   * @param absolutePath absolute path of the source file, under the content root
   * @param fields parsed fields
   * @return the validated item
   * @throws InvalidContentException if the file is a static asset, lies outside the content root,
   *     or its fields are invalid
   */
  public ContentItem fromFile(String absolutePath, Map<String, Object> fields) {
    if (contentPathService.isPathFromStaticAssets(absolutePath)) {
      throw new InvalidContentException(
          "filePath", "Static asset " + absolutePath + " cannot become a content item");
    }
    try {
      return fromFields(contentPathService.toContentPath(absolutePath), fields);
    } catch (IllegalArgumentException e) {
      throw new InvalidContentException("filePath", e.getMessage(), e);
    }
  }

  /**
   * Creates an item for a path relative to the content root.
   *
   * @param path slash-rooted path relative to the content root, e.g. {@code /blog/post.md}
   * @param fields parsed fields
   * @return the validated item
   * @throws InvalidContentException if a required field is missing or malformed
   */
  public ContentItem fromFields(String path, Map<String, Object> fields) {
    Objects.requireNonNull(fields, "fields cannot be null");
    if (StringUtils.isBlank(path)) {
      throw new InvalidContentException("filePath", "File path is required");
    }
    String filePath = path.startsWith(Constants.PATH_SEPARATOR) ? path : "/" + path;

    ContentType type = resolveType(filePath, fields.get(Constants.TYPE_FIELD));
    List<TaxonomyNode> taxonomies = PathResolver.taxonomyChain(filePath);

    String title = StringUtils.trimToNull(asString(fields.get(Constants.TITLE_FIELD)));
    if (title == null) {
      title = type == ContentType.INDEX
          ? taxonomies.get(taxonomies.size() - 1).getTitle()
          : PathResolver.deriveTitle(filePath);
    }
    if (StringUtils.isBlank(title)) {
      throw new InvalidContentException(
          Constants.TITLE_FIELD, "Title is required and cannot be derived from " + filePath);
    }

    Object date = fields.get(Constants.DATE_FIELD);
    if (date == null) {
      throw new InvalidContentException(Constants.DATE_FIELD, "Date is required for " + filePath);
    }

    ContentItem item =
        ContentItem.builder()
            .slug(PathResolver.deriveSlug(filePath))
            .type(type)
            .title(title)
            .summary(asString(fields.get(Constants.SUMMARY_FIELD)))
            .body(asString(fields.get(Constants.CONTENT_FIELD)))
            .filePath(filePath)
            .date(parseDate(date))
            .published(parsePublished(fields.get(Constants.PUBLISHED_FIELD)))
            .position(parsePosition(fields.get(Constants.POSITION_FIELD)))
            .metadata(copyMetadata(fields.get(Constants.METADATA_FIELD)))
            .taxonomies(taxonomies)
            .build();
    log.debug("Created {} item {} from {}", type.getValue(), item.getSlug(), filePath);
    return item;
  }

  private ContentType resolveType(String filePath, Object value) {
    if (PathResolver.isIndexFile(filePath)) {
      return ContentType.INDEX;
    }
    if (value == null) {
      return ContentType.POST;
    }
    try {
      return ContentType.fromValue(value.toString().trim());
    } catch (IllegalArgumentException e) {
      throw new InvalidContentException(Constants.TYPE_FIELD, e.getMessage(), e);
    }
  }

  private OffsetDateTime parseDate(Object value) {
    if (value instanceof OffsetDateTime offsetDateTime) {
      return offsetDateTime;
    }
    if (value instanceof ZonedDateTime zonedDateTime) {
      return zonedDateTime.toOffsetDateTime();
    }
    if (value instanceof Instant instant) {
      return instant.atOffset(ZoneOffset.UTC);
    }
    if (value instanceof LocalDateTime localDateTime) {
      return localDateTime.atOffset(ZoneOffset.UTC);
    }
    if (value instanceof LocalDate localDate) {
      return localDate.atStartOfDay().atOffset(ZoneOffset.UTC);
    }
    if (value instanceof Date date) {
      return date.toInstant().atOffset(ZoneOffset.UTC);
    }
    String text = value.toString().trim();
    try {
      if (!text.contains("T")) {
        return LocalDate.parse(text).atStartOfDay().atOffset(ZoneOffset.UTC);
      }
      if (OFFSET_SUFFIX.matcher(text).find()) {
        return OffsetDateTime.parse(text);
      }
      return LocalDateTime.parse(text).atOffset(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      throw new InvalidContentException(Constants.DATE_FIELD, "Invalid date: " + text, e);
    }
  }

  private boolean parsePublished(Object value) {
    if (value == null) {
      return false;
    }
    if (value instanceof Boolean published) {
      return published;
    }
    String text = value.toString().trim();
    if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
      return Boolean.parseBoolean(text);
    }
    throw new InvalidContentException(Constants.PUBLISHED_FIELD, "Invalid published flag: " + text);
  }

  private Integer parsePosition(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number number) {
      return number.intValue();
    }
    try {
      return Integer.valueOf(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new InvalidContentException(Constants.POSITION_FIELD, "Invalid position: " + value, e);
    }
  }

  private Map<String, Object> copyMetadata(Object value) {
    if (value == null) {
      return Map.of();
    }
    if (!(value instanceof Map<?, ?> map)) {
      throw new InvalidContentException(
          Constants.METADATA_FIELD, "Metadata must be a map, got " + value.getClass().getName());
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    map.forEach((key, entry) -> copy.put(String.valueOf(key), entry));
    return Collections.unmodifiableMap(copy);
  }

  private static String asString(Object value) {
    return value == null ? null : value.toString();
  }
}
