package uk.ac.ebi.biostudies.content_index.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;
import uk.ac.ebi.biostudies.content_index.Constants;
import uk.ac.ebi.biostudies.content_index.model.CategoryDescriptor;
import uk.ac.ebi.biostudies.content_index.model.TaxonomyNode;

/**
 * Utility class deriving slugs, titles and category chains from content file paths. Paths are
 * expected relative to the content root and slash-rooted, e.g. {@code /blog/art/post.md}.
 *
 * <p>All methods are pure.
 */
public class PathResolver {

  private static final Pattern APOSTROPHES = Pattern.compile("['’]");
  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");
  private static final Pattern DIGIT_START = Pattern.compile("^[0-9]");

  // Private constructor to prevent instantiation
  private PathResolver() {
    throw new UnsupportedOperationException("Utility class should not be instantiated");
  }

  /**
   * Derives the slug of a file: the extension is removed and every path segment is slugified.
   *
   * <pre>{@code
   * deriveSlug("/blog/art/3d/post.md")       // "/blog/art/3d/post"
   * deriveSlug("/blog/My new Project.md")    // "/blog/my-new-project"
   * }</pre>
   *
   * @param path the file path
   * @return an absolute, slash-rooted slug; "/" when nothing is left
   */
  public static String deriveSlug(String path) {
    String joined =
        splitSegments(removeExtension(path)).stream()
            .map(PathResolver::slugifySegment)
            .filter(StringUtils::isNotEmpty)
            .collect(Collectors.joining(Constants.PATH_SEPARATOR));
    return Constants.PATH_SEPARATOR + joined;
  }

  /**
   * Transforms the file name of a path into a readable title: separators become spaces and only
   * the first word is capitalized, so capitalization elsewhere is preserved.
   *
   * <pre>{@code
   * deriveTitle("/blog/art/3d/post-about-art.md")   // "Post about art"
   * deriveTitle("/blog/My new Project.md")          // "My new Project"
   * }</pre>
   */
  public static String deriveTitle(String path) {
    return toTitle(baseName(path));
  }

  /**
   * Transforms a source string into a title, capitalizing the first word only.
   *
   * @param source e.g. "post-about-art"
   * @return e.g. "Post about art"
   */
  public static String toTitle(String source) {
    List<String> words = tokenize(source);
    List<String> result = new ArrayList<>(words.size());
    for (int i = 0; i < words.size(); i++) {
      result.add(i == 0 ? capitalize(words.get(i)) : words.get(i));
    }
    return String.join(" ", result);
  }

  /**
   * Transforms a folder name into a taxonomy name. Every word is capitalized and words starting
   * with a digit are upper-cased, so "3d" becomes "3D". Hyphens are consumed as separators before
   * that check, which is why "4d-art" yields "4D Art".
   *
   * @param segment a single path segment, e.g. "3d-models"
   * @return e.g. "3D Models"
   */
  public static String deriveTaxonomyName(String segment) {
    return tokenize(segment).stream()
        .map(PathResolver::capitalize)
        .map(word -> DIGIT_START.matcher(word).find() ? word.toUpperCase(Locale.ROOT) : word)
        .collect(Collectors.joining(" "));
  }

  /**
   * Splits the directory portion of a path into its category hierarchy, pairing each readable
   * category name with the cumulative slug up to that level.
   *
   * <pre>{@code
   * categoryChain("/blog/art/3d-models/post.md")
   * // [("Blog", "/blog"), ("Art", "/blog/art"), ("3D Models", "/blog/art/3d-models")]
   *
   * categoryChain("/post.md")
   * // [("", "/")]
   * }</pre>
   *
   * @param path the file path
   * @return one descriptor per directory level; the synthetic root descriptor for root files
   */
  public static List<CategoryDescriptor> categoryChain(String path) {
    List<String> directories = splitSegments(directoryOf(path));
    List<CategoryDescriptor> chain = new ArrayList<>(directories.size());
    StringBuilder slug = new StringBuilder();
    for (String directory : directories) {
      String slugSegment = slugifySegment(directory);
      if (slugSegment.isEmpty()) {
        continue;
      }
      slug.append(Constants.PATH_SEPARATOR).append(slugSegment);
      chain.add(new CategoryDescriptor(deriveTaxonomyName(directory), slug.toString()));
    }
    if (chain.isEmpty()) {
      return List.of(new CategoryDescriptor("", Constants.ROOT_SLUG));
    }
    return List.copyOf(chain);
  }

  /**
   * Turns the category chain of a path into taxonomy stubs, root-first. Files at the content root
   * belong to the root taxonomy.
   *
   * @param path the file path
   * @return taxonomy nodes with slug, title, level and parents set, and no children
   */
  public static List<TaxonomyNode> taxonomyChain(String path) {
    List<CategoryDescriptor> chain = categoryChain(path);
    if (chain.size() == 1 && Constants.ROOT_SLUG.equals(chain.get(0).slug())) {
      return List.of(TaxonomyNode.root());
    }
    List<TaxonomyNode> taxonomies = new ArrayList<>(chain.size());
    List<String> parents = new ArrayList<>();
    parents.add(Constants.ROOT_SLUG);
    for (CategoryDescriptor category : chain) {
      taxonomies.add(
          TaxonomyNode.builder()
              .slug(category.slug())
              .title(category.title())
              .level(parents.size() + 1)
              .parents(List.copyOf(parents))
              .build());
      parents.add(category.slug());
    }
    return List.copyOf(taxonomies);
  }

  /** True if the file is a taxonomy's own descriptive file, e.g. {@code /blog/_index.md}. */
  public static boolean isIndexFile(String path) {
    return Constants.INDEX_FILE_NAME.equals(baseName(path));
  }

  /** Final path segment without its extension. */
  public static String baseName(String path) {
    return removeExtension(StringUtils.substringAfterLast(Constants.PATH_SEPARATOR + path, "/"));
  }

  /**
   * Removes the extension of the final path segment. A leading dot (hidden file) is not treated as
   * an extension.
   */
  static String removeExtension(String path) {
    int lastSeparator = path.lastIndexOf('/');
    int lastDot = path.lastIndexOf('.');
    return lastDot > lastSeparator + 1 ? path.substring(0, lastDot) : path;
  }

  /**
   * Lower-cases, strips accents, drops apostrophes and collapses everything but letters and digits
   * into "-". Letters of any script are kept, so "日本" stays "日本".
   */
  static String slugifySegment(String segment) {
    String slug = StringUtils.stripAccents(segment).toLowerCase(Locale.ROOT);
    slug = APOSTROPHES.matcher(slug).replaceAll("");
    slug = NON_ALPHANUMERIC.matcher(slug).replaceAll("-");
    return StringUtils.strip(slug, "-");
  }

  private static String directoryOf(String path) {
    int lastSeparator = path.lastIndexOf('/');
    return lastSeparator < 0 ? "" : path.substring(0, lastSeparator);
  }

  private static List<String> splitSegments(String path) {
    return Arrays.stream(StringUtils.split(path, '/')).filter(StringUtils::isNotBlank).toList();
  }

  private static List<String> tokenize(String source) {
    String prepared = StringUtils.trimToEmpty(source).replace('-', ' ').replace('_', ' ');
    return Arrays.asList(prepared.split(" ", -1));
  }

  // First letter upper case, the rest lower case
  private static String capitalize(String word) {
    return StringUtils.capitalize(word.toLowerCase(Locale.ROOT));
  }
}
