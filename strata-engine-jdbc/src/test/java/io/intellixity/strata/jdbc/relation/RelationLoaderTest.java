package io.intellixity.strata.jdbc.relation;

import io.intellixity.strata.jdbc.FakeDialect;
import io.intellixity.strata.jdbc.RecordingQueryFn;
import io.intellixity.strata.query.IncludeSpec;
import io.intellixity.strata.schema.ColumnDef;
import io.intellixity.strata.schema.RelationDef;
import io.intellixity.strata.schema.TableDef;
import io.intellixity.strata.schema.TableRegistry;
import io.intellixity.strata.spi.exec.Executor;
import io.intellixity.strata.spi.exec.QueryResult;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

final class RelationLoaderTest {
  private static final TableDef USERS = TableDef.builder("users")
      .column("id", ColumnDef.integer().asPrimary())
      .column("name", ColumnDef.text())
      .build();
  private static final TableDef POSTS = TableDef.builder("posts")
      .column("id", ColumnDef.integer().asPrimary())
      .column("authorId", ColumnDef.integer().asNullable())
      .column("title", ColumnDef.text())
      .build();
  private static final TableDef COMMENTS = TableDef.builder("comments")
      .column("id", ColumnDef.integer().asPrimary())
      .column("postId", ColumnDef.integer())
      .column("body", ColumnDef.text())
      .build();
  private static final TableDef TAGS = TableDef.builder("tags")
      .column("id", ColumnDef.integer().asPrimary())
      .column("label", ColumnDef.text())
      .build();
  private static final TableDef POST_TAGS = TableDef.builder("post_tags")
      .column("postId", ColumnDef.integer())
      .column("tagId", ColumnDef.integer())
      .build();

  private static final Map<String, RelationDef> USER_RELATIONS = Map.of(
      "posts", RelationDef.many(() -> POSTS, "authorId"));
  private static final Map<String, RelationDef> POST_RELATIONS = Map.of(
      "author", RelationDef.one(() -> USERS, "authorId"),
      "comments", RelationDef.many(() -> COMMENTS, "postId"),
      "tags", RelationDef.manyThrough(() -> TAGS, () -> POST_TAGS, "postId", "tagId"));
  private static final Map<String, RelationDef> COMMENT_RELATIONS = Map.of(
      "post", RelationDef.one(() -> POSTS, "postId"));

  private static final TableRegistry REGISTRY = TableRegistry.builder()
      .table("users", USERS, USER_RELATIONS)
      .table("posts", POSTS, POST_RELATIONS)
      .table("comments", COMMENTS, COMMENT_RELATIONS)
      .table("tags", TAGS)
      .table("postTags", POST_TAGS)
      .build();

  private static final Pattern KEYED_SELECT = Pattern.compile("FROM \"(\\w+)\" WHERE \"(\\w+)\" IN");

  /** In-memory tables keyed by storage name; answers {@code col IN (...)} selects. */
  private static RecordingQueryFn database(Map<String, List<Map<String, Object>>> tables) {
    return new RecordingQueryFn((sql, params) -> {
      Matcher m = KEYED_SELECT.matcher(sql);
      if (!m.find()) throw new IllegalStateException("unexpected statement: " + sql);
      Set<Object> keys = new HashSet<>(params);
      List<Map<String, Object>> out = new ArrayList<>();
      for (Map<String, Object> r : tables.getOrDefault(m.group(1), List.of())) {
        if (keys.contains(r.get(m.group(2)))) out.add(new LinkedHashMap<>(r));
      }
      return QueryResult.of(out);
    });
  }

  private static Map<String, Object> row(Object... kv) {
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
    return m;
  }

  @SafeVarargs
  private static List<Map<String, Object>> rows(Map<String, Object>... rs) {
    List<Map<String, Object>> out = new ArrayList<>();
    for (Map<String, Object> r : rs) out.add(new LinkedHashMap<>(r));
    return out;
  }

  private static RelationLoader loader(RecordingQueryFn fn) {
    return new RelationLoader(new Executor(fn), FakeDialect.INSTANCE, null, REGISTRY);
  }

  private static final Map<String, List<Map<String, Object>>> DATA = Map.of(
      "users", List.of(row("id", 1, "name", "Ada"), row("id", 2, "name", "Grace")),
      "posts", List.of(
          row("id", 10, "author_id", 1, "title", "a"),
          row("id", 11, "author_id", 1, "title", "b"),
          row("id", 12, "author_id", 2, "title", "c")),
      "comments", List.of(row("id", 100, "post_id", 10, "body", "hi")),
      "tags", List.of(row("id", 7, "label", "java"), row("id", 8, "label", "sql")),
      "post_tags", List.of(row("post_id", 10, "tag_id", 7), row("post_id", 10, "tag_id", 8)));

  @Test
  @SuppressWarnings("unchecked")
  void oneToOneAttachesTargetOrNull() {
    RecordingQueryFn fn = database(DATA);
    List<Map<String, Object>> posts = rows(
        row("id", 10, "authorId", 1), row("id", 12, "authorId", 2), row("id", 13, "authorId", null));

    loader(fn).load(posts, POSTS, POST_RELATIONS, IncludeSpec.of("author"));

    assertEquals(1, fn.calls().size());
    assertEquals("SELECT \"id\", \"name\" FROM \"users\" WHERE \"id\" IN ($1, $2)", fn.last().sql());
    assertEquals("Ada", ((Map<String, Object>) posts.get(0).get("author")).get("name"));
    assertEquals("Grace", ((Map<String, Object>) posts.get(1).get("author")).get("name"));
    assertTrue(posts.get(2).containsKey("author"));
    assertNull(posts.get(2).get("author"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void oneToManyGroupsChildrenByParent() {
    RecordingQueryFn fn = database(DATA);
    List<Map<String, Object>> users = rows(row("id", 1), row("id", 2), row("id", 3));

    loader(fn).load(users, USERS, USER_RELATIONS, IncludeSpec.of("posts"));

    assertEquals(1, fn.calls().size());
    assertEquals(2, ((List<Map<String, Object>>) users.get(0).get("posts")).size());
    assertEquals("c", ((List<Map<String, Object>>) users.get(1).get("posts")).get(0).get("title"));
    assertEquals(List.of(), users.get(2).get("posts"));
  }

  @Test
  void queryCountDoesNotGrowWithParentRows() {
    List<Map<String, Object>> users = new ArrayList<>();
    for (int i = 0; i < 1000; i++) users.add(row("id", i));
    RecordingQueryFn fn = database(DATA);

    loader(fn).load(users, USERS, USER_RELATIONS, IncludeSpec.of("posts"));

    assertEquals(1, fn.calls().size());
    assertEquals(1000, fn.last().params().size());
  }

  @Test
  @SuppressWarnings("unchecked")
  void joinTableRelationsTakeTwoQueries() {
    RecordingQueryFn fn = database(DATA);
    List<Map<String, Object>> posts = rows(row("id", 10), row("id", 11));

    loader(fn).load(posts, POSTS, POST_RELATIONS, IncludeSpec.of("tags"));

    assertEquals(2, fn.calls().size());
    assertTrue(fn.calls().get(0).sql().startsWith("SELECT \"post_id\" AS \"postId\", \"tag_id\" AS \"tagId\" FROM \"post_tags\""));
    List<Map<String, Object>> tags = (List<Map<String, Object>>) posts.get(0).get("tags");
    assertEquals(List.of("java", "sql"), List.of(tags.get(0).get("label"), tags.get(1).get("label")));
    assertEquals(List.of(), posts.get(1).get("tags"));
  }

  @Test
  void eachNestedLevelAddsOneQuery() {
    RecordingQueryFn fn = database(DATA);
    List<Map<String, Object>> users = rows(row("id", 1));

    loader(fn).load(users, USERS, USER_RELATIONS,
        IncludeSpec.none().with("posts", List.of(), IncludeSpec.of("comments")));

    assertEquals(2, fn.calls().size());
  }

  @Test
  @SuppressWarnings("unchecked")
  void narrowedManySelectStillProjectsTargetKey() {
    RecordingQueryFn fn = database(DATA);
    List<Map<String, Object>> users = rows(row("id", 1));

    loader(fn).load(users, USERS, USER_RELATIONS,
        IncludeSpec.none().with("posts", List.of("title"), IncludeSpec.of("comments")));

    assertEquals(2, fn.calls().size());
    assertEquals("SELECT \"title\", \"author_id\" AS \"authorId\", \"id\" FROM \"posts\" WHERE \"author_id\" IN ($1)",
        fn.calls().get(0).sql());
    assertEquals(List.of(10, 11), fn.calls().get(1).params());
    Map<String, Object> post = ((List<Map<String, Object>>) users.get(0).get("posts")).get(0);
    assertEquals("hi", ((List<Map<String, Object>>) post.get("comments")).get(0).get("body"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void nestingStopsBelowTheDepthCap() {
    RecordingQueryFn fn = database(DATA);
    List<Map<String, Object>> users = rows(row("id", 1));
    IncludeSpec deepest = IncludeSpec.of("author");
    IncludeSpec commentPost = IncludeSpec.none().with("post", List.of(), deepest);
    IncludeSpec postComments = IncludeSpec.none().with("comments", List.of(), commentPost);
    IncludeSpec include = IncludeSpec.none().with("posts", List.of(), postComments);

    loader(fn).load(users, USERS, USER_RELATIONS, include);

    assertEquals(3, fn.calls().size());
    Map<String, Object> post = (Map<String, Object>) ((List<Map<String, Object>>) users.get(0).get("posts")).get(0);
    Map<String, Object> comment = ((List<Map<String, Object>>) post.get("comments")).get(0);
    Map<String, Object> commentedPost = (Map<String, Object>) comment.get("post");
    assertEquals(10, commentedPost.get("id"));
    assertFalse(commentedPost.containsKey("author"));
  }

  @Test
  void nothingToLoadIssuesNoQueries() {
    RecordingQueryFn fn = database(DATA);
    RelationLoader loader = loader(fn);

    loader.load(new ArrayList<>(), USERS, USER_RELATIONS, IncludeSpec.of("posts"));
    loader.load(rows(row("id", 1)), USERS, USER_RELATIONS, null);
    loader.load(rows(row("id", 1)), USERS, USER_RELATIONS, IncludeSpec.none());

    assertTrue(fn.calls().isEmpty());
  }

  @Test
  void unknownRelationsAreSkipped() {
    RecordingQueryFn fn = database(DATA);
    List<Map<String, Object>> users = rows(row("id", 1));

    loader(fn).load(users, USERS, USER_RELATIONS, IncludeSpec.of("followers"));

    assertTrue(fn.calls().isEmpty());
    assertFalse(users.get(0).containsKey("followers"));
  }
}
