package com.example.datalake.dsdust.ranking;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.datalake.dsdust.model.DatasetRecord;
import com.example.datalake.dsdust.model.SortKey;
import java.util.List;
import org.junit.jupiter.api.Test;

class DatasetRankerTest {

  private final DatasetRanker ranker = new DatasetRanker();

  private static DatasetRecord record(String ref, double score) {
    return DatasetRecord.builder().reference(ref).title(ref).searchScore(score).build();
  }

  @Test
  void keepsTheFirstOccurrenceOfEachReference() {
    DatasetRecord first = record("o/a", 1.0).toBuilder().searchMethod("keyword:a").build();
    DatasetRecord later = record("o/a", 9.0).toBuilder().searchMethod("tag:a").build();

    List<DatasetRecord> unique = ranker.dedupe(List.of(first, record("o/b", 2.0), later));

    assertThat(unique).extracting(DatasetRecord::getReference).containsExactly("o/a", "o/b");
    assertThat(unique.get(0).getSearchMethod()).isEqualTo("keyword:a");
  }

  @Test
  void dedupeIsIdempotent() {
    List<DatasetRecord> input = List.of(record("o/a", 1), record("o/b", 2), record("o/a", 3));

    List<DatasetRecord> once = ranker.dedupe(input);

    assertThat(ranker.dedupe(once)).isEqualTo(once);
  }

  @Test
  void tiesAreBrokenByReference() {
    List<DatasetRecord> ranked = ranker.dedupeAndRank(
        List.of(record("o/c", 5), record("o/a", 5), record("o/b", 7)), SortKey.SCORE, -1);

    assertThat(ranked).extracting(DatasetRecord::getReference).containsExactly("o/b", "o/a", "o/c");
  }

  @Test
  void truncatesOnlyAfterSorting() {
    List<DatasetRecord> ranked = ranker.dedupeAndRank(
        List.of(record("o/low", 1), record("o/mid", 5), record("o/high", 9)), SortKey.SCORE, 2);

    assertThat(ranked).extracting(DatasetRecord::getReference).containsExactly("o/high", "o/mid");
  }

  @Test
  void sortsByVotesAndSizeWhenAsked() {
    DatasetRecord popular = DatasetRecord.builder().reference("o/p").voteCount(500).sizeBytes(1).build();
    DatasetRecord big = DatasetRecord.builder().reference("o/b").voteCount(5).sizeBytes(1_000_000).build();

    assertThat(ranker.dedupeAndRank(List.of(big, popular), SortKey.VOTES, 10).get(0)).isEqualTo(popular);
    assertThat(ranker.dedupeAndRank(List.of(popular, big), SortKey.SIZE, 10).get(0)).isEqualTo(big);
  }

  @Test
  void titleAndReferenceDedupeKeepsSameReferenceWithDifferentTitles() {
    DatasetRecord a = DatasetRecord.builder().reference("o/a").title("Sales").build();
    DatasetRecord renamed = DatasetRecord.builder().reference("o/a").title("Sales v2").build();

    assertThat(ranker.dedupeByTitleAndReference(List.of(a, a, renamed))).containsExactly(a, renamed);
  }
}
