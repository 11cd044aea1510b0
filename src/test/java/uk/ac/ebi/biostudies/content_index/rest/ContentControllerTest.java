package uk.ac.ebi.biostudies.content_index.rest;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static uk.ac.ebi.biostudies.content_index.ContentFixtures.date;
import static uk.ac.ebi.biostudies.content_index.ContentFixtures.index;
import static uk.ac.ebi.biostudies.content_index.ContentFixtures.post;

import io.restassured.RestAssured;
import io.restassured.http.ContentType;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.ActiveProfiles;
import uk.ac.ebi.biostudies.content_index.index.ContentIndexService;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@DisplayName("ContentController Tests")
class ContentControllerTest {

  @Autowired private ContentIndexService contentIndexService;
  @LocalServerPort private Integer port;

  @BeforeEach
  void setUp() {
    RestAssured.port = port;
    contentIndexService.deleteAll();
    contentIndexService.ingest(
        List.of(
            post("/blog/first.md", date(2022, 1, 1)),
            post("/blog/second.md", date(2023, 1, 1)),
            post("/blog/art/painting.md", date(2021, 1, 1)),
            post("/docs/install.md", date(2020, 1, 1)),
            index("/blog/_index.md", "The Blog", 1)));
    contentIndexService.rebuildTrees();
  }

  @Test
  @DisplayName("Should return a content item with its resolved link")
  void shouldReturnContentItem() {
    given()
        .queryParam("slug", "/blog/second")
        .when()
        .get("/content")
        .then()
        .statusCode(200)
        .contentType(ContentType.JSON)
        .body("success", is(true))
        .body("data.slug", is("/blog/second"))
        .body("data.kind", is("content_item"))
        .body("data.type", is("post"))
        .body("data.title", is("Second"))
        .body("data.link.previous", nullValue())
        .body("data.link.next.slug", is("/blog/first"))
        .body("errors", is(List.of()));
  }

  @Test
  @DisplayName("Should return a taxonomy")
  void shouldReturnTaxonomy() {
    given()
        .queryParam("slug", "/blog")
        .when()
        .get("/content")
        .then()
        .statusCode(200)
        .body("data.kind", is("taxonomy"))
        .body("data.title", is("The Blog"))
        .body("data.position", is(1))
        .body("data.level", is(2));
  }

  @Test
  @DisplayName("Should answer 404 for unknown slugs")
  void shouldAnswerNotFound() {
    given()
        .queryParam("slug", "/blog/missing")
        .when()
        .get("/content")
        .then()
        .statusCode(404)
        .body("success", is(false))
        .body("errors[0].code", is("NOT_FOUND"))
        .body("errors[0].field", is("slug"));
  }

  @Test
  @DisplayName("Should answer 400 when the slug is missing")
  void shouldAnswerBadRequestWithoutSlug() {
    given().when().get("/content").then().statusCode(400).body("success", is(false));
  }

  @Test
  @DisplayName("Should list entities of one kind")
  void shouldListEntitiesOfOneKind() {
    given()
        .queryParam("kind", "taxonomy")
        .when()
        .get("/content/all")
        .then()
        .statusCode(200)
        .body("data.slug", contains("/blog", "/blog/art", "/docs"));
  }

  @Test
  @DisplayName("Should reject unknown kinds")
  void shouldRejectUnknownKinds() {
    given()
        .queryParam("kind", "widget")
        .when()
        .get("/content/all")
        .then()
        .statusCode(400)
        .body("errors[0].code", is("BAD_REQUEST"));
  }

  @Test
  @DisplayName("Should serve the taxonomy tree")
  void shouldServeTaxonomyTree() {
    given()
        .when()
        .get("/trees/taxonomy")
        .then()
        .statusCode(200)
        .body("data.slug", is("/"))
        .body("data.children.slug", contains("/blog", "/docs"))
        .body("data.children[0].children.slug", contains("/blog/art"));
  }

  @Test
  @DisplayName("Should serve a content subtree")
  void shouldServeContentSubtree() {
    given()
        .queryParam("root", "/blog")
        .when()
        .get("/trees/content")
        .then()
        .statusCode(200)
        .body("data.slug", is("/blog"))
        .body("data.children.slug", contains("/blog/second", "/blog/first", "/blog/art"))
        .body("data.children[0].body", is("<p>Second</p>"));
  }

  @Test
  @DisplayName("Should answer 404 for unknown subtree roots")
  void shouldAnswerNotFoundForUnknownRoot() {
    given()
        .queryParam("root", "/nowhere")
        .when()
        .get("/trees/content")
        .then()
        .statusCode(404)
        .body("errors[0].field", is("root"));
  }

  @Test
  @DisplayName("Should rebuild trees on demand")
  void shouldRebuildTrees() {
    contentIndexService.saveContentItem(post("/news/launch.md", date(2024, 1, 1)));

    given().when().post("/trees/rebuild").then().statusCode(200).body("success", is(true));

    given()
        .when()
        .get("/trees/taxonomy")
        .then()
        .statusCode(200)
        .body("data.children.slug", contains("/blog", "/docs", "/news"));
  }
}
