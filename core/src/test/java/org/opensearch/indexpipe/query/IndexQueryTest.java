/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class IndexQueryTest {

  @Test
  void should_match_equal_value_only() {
    IndexQuery query = IndexQuery.eq("color", "red");

    assertTrue(query.matches("red"));
    assertFalse(query.matches("blue"));
    assertFalse(query.matches(null));
    assertEquals("color", query.indexName());
  }

  @Test
  void should_match_range_inclusive_at_both_ends() {
    IndexQuery query = IndexQuery.range("age", 18, 30);

    assertTrue(query.matches(18));
    assertTrue(query.matches(24));
    assertTrue(query.matches(30));
    assertFalse(query.matches(17));
    assertFalse(query.matches(31));
  }

  @Test
  void should_not_match_value_of_unrelated_type_in_range() {
    IndexQuery query = IndexQuery.range("age", 18, 30);

    assertFalse(query.matches("twenty"));
    assertFalse(query.matches(null));
  }

  @Test
  void should_match_string_range_lexicographically() {
    IndexQuery query = IndexQuery.range("name", "b", "d");

    assertTrue(query.matches("bob"));
    assertTrue(query.matches("d"));
    assertFalse(query.matches("dan"));
  }

  @Test
  void should_reject_invalid_construction() {
    assertThrows(IllegalArgumentException.class, () -> IndexQuery.eq("", "red"));
    assertThrows(NullPointerException.class, () -> IndexQuery.eq("color", null));
    assertThrows(NullPointerException.class, () -> IndexQuery.range("age", null, 30));
    assertThrows(IllegalArgumentException.class, () -> IndexQuery.range("age", List.of(), 30));
  }

  @Test
  void should_keep_bucket_without_filters() {
    BucketOrFilter target = BucketOrFilter.bucket("users");

    assertFalse(target.hasKeyFilters());
    assertEquals("users", target.toString());
  }

  @Test
  void should_copy_key_filters() {
    List<String> filters = new ArrayList<>(List.of("user_"));
    BucketOrFilter target = BucketOrFilter.filtered("users", filters);
    filters.clear();

    assertTrue(target.hasKeyFilters());
    assertEquals(List.of("user_"), target.keyFilters());
    assertThrows(IllegalArgumentException.class, () -> BucketOrFilter.bucket(""));
  }
}
